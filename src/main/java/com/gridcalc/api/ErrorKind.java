package com.gridcalc.api;

/**
 * Closed set of value-level formula errors.
 *
 * A formula failure never escapes as an exception; it becomes a
 * {@link Value} of kind ERROR carrying one of these tags. Each tag knows the
 * text shown in place of a value.
 */
public enum ErrorKind {
    DIV_ZERO("#DIV/0!"),
    CIRCULAR("#CIRC!"),
    NAME("#NAME?"),
    REF("#REF!"),
    NUM("#NUM!"),
    GENERIC("#ERR!");

    private final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    /** The display tag, e.g. {@code #DIV/0!}. */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a display tag back to its kind.
     *
     * @return the kind, or null if the text is not an error tag.
     */
    public static ErrorKind fromTag(String text) {
        for (ErrorKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(text))
                return kind;
        }
        return null;
    }
}
