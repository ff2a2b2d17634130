package io.nullsafe.core.error;

/** Thrown when a node is missing a field its kind requires (e.g. a {@code Member} without target). */
public final class MalformedTreeException extends TreeRewriteException {

    private static final long serialVersionUID = 1L;

    public MalformedTreeException(String message, String unit, String declaration) {
        super(message, unit, declaration);
    }
}
