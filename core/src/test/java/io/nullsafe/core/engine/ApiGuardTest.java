package io.nullsafe.core.engine;

import static io.nullsafe.core.testkit.Trees.binary;
import static io.nullsafe.core.testkit.Trees.call;
import static io.nullsafe.core.testkit.Trees.expr;
import static io.nullsafe.core.testkit.Trees.function;
import static io.nullsafe.core.testkit.Trees.literal;
import static io.nullsafe.core.testkit.Trees.name;
import static io.nullsafe.core.testkit.Trees.param;
import static io.nullsafe.core.testkit.Trees.params;
import static io.nullsafe.core.testkit.Trees.ret;
import static io.nullsafe.core.testkit.Trees.type;
import static io.nullsafe.core.testkit.Trees.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.MalformedTreeException;
import io.nullsafe.core.model.Feature;
import io.nullsafe.core.scope.ActivationSet;
import io.nullsafe.core.scope.ScopeResolver;
import io.nullsafe.core.testkit.TreeInterpreter;
import io.nullsafe.runtime.GuardFailure;
import io.nullsafe.runtime.Guards;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for boundary guard injection, driven through {@link RewriteDriver}. */
@DisplayName("API boundary guards")
class ApiGuardTest {

    private static final RewriteDriver GUARDS_IN_APP = new RewriteDriver(new ScopeResolver(
            ActivationSet.builder().activate("app", true, Feature.API_GUARD).build()));

    private static ObjectNode job() {
        return function("job", "public", params(param("s", "String", false)),
                expr(call("sideEffect")),
                ret(binary("+", literal("job:"), name("s"))));
    }

    private static JsonNode statements(ObjectNode function) {
        return function.at("/body/statements");
    }

    @Nested
    @DisplayName("Runtime behaviour")
    class Runtime {

        @Test
        @DisplayName("job(null) fails naming parameter s and function job; job(\"x\") returns normally")
        void scenario() {
            ObjectNode unit = unit("app.util", job());
            GUARDS_IN_APP.rewrite(unit);
            var interpreter = new TreeInterpreter(unit).host("sideEffect", args -> null);

            assertThatThrownBy(() -> interpreter.call("job", (Object) null))
                    .isInstanceOf(GuardFailure.class)
                    .satisfies(e -> {
                        var failure = (GuardFailure) e;
                        assertThat(failure.parameter()).isEqualTo("s");
                        assertThat(failure.function()).isEqualTo("app.util.job");
                    })
                    .hasMessageContaining("'s'")
                    .hasMessageContaining("job");
            assertThat(interpreter.call("job", "x")).isEqualTo("job:x");
        }

        @Test
        @DisplayName("guard fires before any original statement runs")
        void failsBeforeBody() {
            ObjectNode unit = unit("app.util", job());
            GUARDS_IN_APP.rewrite(unit);
            AtomicInteger sideEffects = new AtomicInteger();
            var interpreter = new TreeInterpreter(unit).host("sideEffect", args -> sideEffects.incrementAndGet());

            assertThatThrownBy(() -> interpreter.call("job", (Object) null)).isInstanceOf(GuardFailure.class);
            assertThat(sideEffects).hasValue(0);

            interpreter.call("job", "x");
            assertThat(sideEffects).hasValue(1);
        }

        @Test
        @DisplayName("without the rewrite the same call silently runs the body")
        void unguardedBaseline() {
            ObjectNode unit = unit("app.util", job());
            AtomicInteger sideEffects = new AtomicInteger();
            var interpreter = new TreeInterpreter(unit).host("sideEffect", args -> sideEffects.incrementAndGet());

            assertThat(interpreter.call("job", (Object) null)).isEqualTo("job:null");
            assertThat(sideEffects).hasValue(1);
        }

        @Test
        @DisplayName("with several null arguments the first non-nullable parameter is reported")
        void declarationOrder() {
            ObjectNode unit = unit("app", function("pair", "public",
                    params(param("a", "String", false), param("b", "String", false)),
                    ret(name("b"))));
            GUARDS_IN_APP.rewrite(unit);
            var interpreter = new TreeInterpreter(unit);

            assertThatThrownBy(() -> interpreter.call("pair", null, null))
                    .isInstanceOfSatisfying(GuardFailure.class, e -> assertThat(e.parameter()).isEqualTo("a"));
            assertThatThrownBy(() -> interpreter.call("pair", "x", null))
                    .isInstanceOfSatisfying(GuardFailure.class, e -> assertThat(e.parameter()).isEqualTo("b"));
        }

        @Test
        @DisplayName("nullable parameters accept null")
        void nullableParameterAcceptsNull() {
            ObjectNode unit = unit("app", function("maybe", "public",
                    params(param("a", "String", true), param("b", "String", false)),
                    ret(name("a"))));
            GUARDS_IN_APP.rewrite(unit);

            assertThat(new TreeInterpreter(unit).call("maybe", null, "y")).isNull();
        }
    }

    @Nested
    @DisplayName("Tree shape")
    class Shape {

        @Test
        @DisplayName("one guard per non-nullable parameter, prepended in declaration order")
        void guardsPrepended() {
            ObjectNode function = function("f", "public",
                    params(param("a", "String", false), param("n", "String", true), param("c", "Int", false)),
                    ret(name("a")));
            function.put("line", 12);
            ObjectNode originalFirst = (ObjectNode) statements(function).get(0);

            int guards = GUARDS_IN_APP.rewrite(unit("app", function)).guards();

            JsonNode statements = statements(function);
            assertThat(guards).isEqualTo(2);
            assertThat(statements.size()).isEqualTo(3);
            assertThat(statements.at("/0/expr/name").asText()).isEqualTo(Guards.CHECK_ARGUMENT);
            assertThat(statements.at("/0/expr/args/0/name").asText()).isEqualTo("a");
            assertThat(statements.at("/0/expr/args/2/value").asText()).isEqualTo("app.f");
            assertThat(statements.at("/0/expr/args/3/value").asText()).isEqualTo("app.src:12");
            assertThat(statements.at("/1/expr/args/1/value").asText()).isEqualTo("c");
            assertThat(statements.at("/0/synthetic").asBoolean()).isTrue();
            assertThat(statements.get(2)).isSameAs(originalFirst);
        }

        @Test
        @DisplayName("function without non-nullable parameters is left untouched")
        void noOp() {
            ObjectNode function = function("f", "public", params(param("n", "String", true)), ret(name("n")));
            ObjectNode before = function.deepCopy();

            assertThat(GUARDS_IN_APP.rewrite(unit("app", function)).guards()).isZero();
            assertThat(function).isEqualTo(before);
        }

        @Test
        @DisplayName("parameters without a declared type are not guarded")
        void untypedParameter() {
            ObjectNode untyped = param("u", "String", false);
            untyped.remove("type");
            ObjectNode function = function("f", "public", params(untyped), ret(name("u")));

            assertThat(GUARDS_IN_APP.rewrite(unit("app", function)).guards()).isZero();
        }

        @Test
        @DisplayName("function without a body is skipped")
        void noBody() {
            ObjectNode function = function("f", "public", params(param("a", "String", false)));
            function.remove("body");

            assertThat(GUARDS_IN_APP.rewrite(unit("app", function)).guards()).isZero();
        }

        @Test
        @DisplayName("body without statements is fine when nothing needs a guard")
        void bodyWithoutStatementsAndNothingToGuard() {
            ObjectNode function = function("f", "public", params(param("n", "String", true)));
            ((ObjectNode) function.get("body")).remove("statements");
            ObjectNode before = function.deepCopy();

            assertThat(GUARDS_IN_APP.rewrite(unit("app", function)).guards()).isZero();
            assertThat(function).isEqualTo(before);
        }

        @Test
        @DisplayName("body without statements is malformed when a guard is needed")
        void bodyWithoutStatementsNeedingGuard() {
            ObjectNode function = function("f", "public", params(param("a", "String", false)));
            ((ObjectNode) function.get("body")).remove("statements");

            assertThatThrownBy(() -> GUARDS_IN_APP.rewrite(unit("app", function)))
                    .isInstanceOf(MalformedTreeException.class)
                    .hasMessageContaining("statements");
        }

        @Test
        @DisplayName("rewriting twice does not duplicate guards")
        void idempotent() {
            ObjectNode unit = unit("app.util", job());
            GUARDS_IN_APP.rewrite(unit);
            ObjectNode afterFirst = unit.deepCopy();

            assertThat(GUARDS_IN_APP.rewrite(unit).guards()).isZero();
            assertThat(unit).isEqualTo(afterFirst);
        }
    }

    @Nested
    @DisplayName("Visibility and scope")
    class Visibility {

        @Test
        @DisplayName("private functions are not guarded")
        void privateFunction() {
            ObjectNode unit = unit("app", function("f", "private", params(param("a", "String", false)), ret(name("a"))));

            assertThat(GUARDS_IN_APP.rewrite(unit).guards()).isZero();
        }

        @Test
        @DisplayName("public method of a public type is guarded under the type's path")
        void publicMethodOfPublicType() {
            ObjectNode method = function("put", "public", params(param("v", "String", false)), ret(name("v")));
            ObjectNode unit = unit("app.util", type("Box", "public", method));

            assertThat(GUARDS_IN_APP.rewrite(unit).guards()).isEqualTo(1);
            assertThat(method.at("/body/statements/0/expr/args/2/value").asText()).isEqualTo("app.util.Box.put");
            assertThatThrownBy(() -> new TreeInterpreter(unit).call("Box.put", (Object) null))
                    .isInstanceOf(GuardFailure.class);
        }

        @Test
        @DisplayName("public method of a private type is not exposed")
        void publicMethodOfPrivateType() {
            ObjectNode unit = unit("app.util", type("Hidden", "private",
                    function("put", "public", params(param("v", "String", false)), ret(name("v")))));

            assertThat(GUARDS_IN_APP.rewrite(unit).guards()).isZero();
        }

        @Test
        @DisplayName("local functions inside a body are never exposed")
        void localFunction() {
            ObjectNode local = function("inner", "public", params(param("v", "String", false)), ret(name("v")));
            ObjectNode outer = function("outer", "public", params(), expr(local));

            assertThat(GUARDS_IN_APP.rewrite(unit("app", outer)).guards()).isZero();
        }

        @Test
        @DisplayName("activation on a single type covers its methods only")
        void typeActivation() {
            var driver = new RewriteDriver(new ScopeResolver(
                    ActivationSet.builder().activate("app.util.Box", false, Feature.API_GUARD).build()));
            ObjectNode unit = unit("app.util",
                    type("Box", "public", function("put", "public", params(param("v", "String", false)))),
                    type("Bag", "public", function("put", "public", params(param("v", "String", false)))));

            assertThat(driver.rewrite(unit).guards()).isEqualTo(1);
            assertThat(unit.at("/declarations/1/members/0/body/statements").size()).isZero();
        }

        @Test
        @DisplayName("non-recursive package activation does not reach sub-packages")
        void packageActivationNotRecursive() {
            var driver = new RewriteDriver(new ScopeResolver(
                    ActivationSet.builder().activate("app", false, Feature.API_GUARD).build()));

            assertThat(driver.rewrite(unit("app", job())).guards()).isEqualTo(1);
            assertThat(driver.rewrite(unit("app.util", job())).guards()).isZero();
        }
    }
}
