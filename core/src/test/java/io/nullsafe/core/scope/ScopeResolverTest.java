package io.nullsafe.core.scope;

import static org.assertj.core.api.Assertions.assertThat;

import io.nullsafe.core.model.Feature;
import io.nullsafe.core.model.ScopeActivation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeResolver}. */
@DisplayName("ScopeResolver")
class ScopeResolverTest {

    private static ScopeResolver resolver(ActivationSet.Builder builder) {
        return new ScopeResolver(builder.build());
    }

    @Nested
    @DisplayName("Exact activations")
    class Exact {

        @Test
        @DisplayName("exact path → enabled")
        void exactMatch() {
            var resolver = resolver(ActivationSet.builder().activate("app.util", false, Feature.API_GUARD));

            assertThat(resolver.isEnabled("app.util", Feature.API_GUARD)).isTrue();
        }

        @Test
        @DisplayName("non-recursive activation does not reach descendants")
        void nonRecursiveStopsAtPath() {
            var resolver = resolver(ActivationSet.builder().activate("app", false, Feature.API_GUARD));

            assertThat(resolver.isEnabled("app.util", Feature.API_GUARD)).isFalse();
            assertThat(resolver.isEnabled("app.util.job", Feature.API_GUARD)).isFalse();
        }

        @Test
        @DisplayName("other features stay disabled")
        void featureIsolation() {
            var resolver = resolver(ActivationSet.builder().activate("app", true, Feature.API_GUARD));

            assertThat(resolver.isEnabled("app.util", Feature.NAVIGATION)).isFalse();
            assertThat(resolver.isEnabled("app.util", Feature.SEQUENCE_WRAP)).isFalse();
        }
    }

    @Nested
    @DisplayName("Recursive activations")
    class Recursive {

        @Test
        @DisplayName("recursive ancestor covers every descendant")
        void recursivePrefix() {
            var resolver = resolver(ActivationSet.builder().activate("app", true, Feature.NAVIGATION));

            assertThat(resolver.isEnabled("app", Feature.NAVIGATION)).isTrue();
            assertThat(resolver.isEnabled("app.util", Feature.NAVIGATION)).isTrue();
            assertThat(resolver.isEnabled("app.util.Box.get", Feature.NAVIGATION)).isTrue();
        }

        @Test
        @DisplayName("prefix is segment-wise: app does not cover application")
        void segmentBoundary() {
            var resolver = resolver(ActivationSet.builder().activate("app", true, Feature.NAVIGATION));

            assertThat(resolver.isEnabled("application", Feature.NAVIGATION)).isFalse();
            assertThat(resolver.isEnabled("application.util", Feature.NAVIGATION)).isFalse();
            assertThat(resolver.isEnabled("ap", Feature.NAVIGATION)).isFalse();
        }

        @Test
        @DisplayName("recursive root covers everything")
        void recursiveRoot() {
            var resolver = resolver(ActivationSet.builder().activate("", true, Feature.SEQUENCE_WRAP));

            assertThat(resolver.isEnabled("", Feature.SEQUENCE_WRAP)).isTrue();
            assertThat(resolver.isEnabled("anything.at.all", Feature.SEQUENCE_WRAP)).isTrue();
        }

        @Test
        @DisplayName("non-recursive root covers only the root package")
        void nonRecursiveRoot() {
            var resolver = resolver(ActivationSet.builder().activate("", false, Feature.SEQUENCE_WRAP));

            assertThat(resolver.isEnabled("", Feature.SEQUENCE_WRAP)).isTrue();
            assertThat(resolver.isEnabled("app", Feature.SEQUENCE_WRAP)).isFalse();
        }
    }

    @Nested
    @DisplayName("Union semantics")
    class Union {

        @Test
        @DisplayName("exact and broader recursive match both enable; all are reported")
        void unionOfMatches() {
            var resolver = resolver(ActivationSet.builder()
                    .activate("app", true, Feature.API_GUARD)
                    .activate("app.util", false, Feature.API_GUARD)
                    .activate("other", true, Feature.API_GUARD));

            assertThat(resolver.isEnabled("app.util", Feature.API_GUARD)).isTrue();
            assertThat(resolver.matching("app.util", Feature.API_GUARD))
                    .containsExactly(
                            new ScopeActivation("app", true, Feature.API_GUARD),
                            new ScopeActivation("app.util", false, Feature.API_GUARD));
        }

        @Test
        @DisplayName("empty activation set → nothing enabled")
        void emptySet() {
            var resolver = new ScopeResolver(ActivationSet.empty());

            for (Feature feature : Feature.values()) {
                assertThat(resolver.isEnabled("app", feature)).isFalse();
                assertThat(resolver.matching("app", feature)).isEmpty();
            }
        }
    }
}
