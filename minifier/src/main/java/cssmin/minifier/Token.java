package cssmin.minifier;

import lombok.NonNull;

public record Token(
    @NonNull Kind kind,
    @NonNull String text) {

    /**
     * Whitespace and comments never reach the output as tokens.
     */
    public boolean hidden() {
        return kind == Kind.WHITESPACE || kind == Kind.COMMENT;
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return "(Token " + kind + " \"" + text + "\")";
    }

    public enum Kind {
        WHITESPACE,
        COMMENT,
        STRING,

        // structural
        BRACE_OPEN,
        BRACE_CLOSE,
        COLON,
        SEMICOLON,
        PAREN_OPEN,
        PAREN_CLOSE,

        // , > + ~
        OPERATOR,

        // selectors, properties, values
        WORD;
    }
}
