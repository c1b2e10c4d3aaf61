package cssmin.minifier;

import lombok.Getter;

/**
 * Holds back a semicolon until the next significant token shows whether it is
 * needed. A semicolon right before <code>}</code> is dropped, any other follower
 * keeps it, and so does the end of input.
 */
final class PendingSemicolon {

    enum State {
        NORMAL,
        AWAITING_DECISION;
    }

    @Getter
    private State state = State.NORMAL;

    void defer() {
        state = State.AWAITING_DECISION;
    }

    /**
     * Settles a deferred semicolon against the token that follows it.
     *
     * @return whether a {@code ;} has to be written before {@code next}
     */
    boolean resolve(Token next) {
        if (state == State.NORMAL) {
            return false;
        }
        state = State.NORMAL;
        return !next.is(Token.Kind.BRACE_CLOSE);
    }

    /**
     * @return whether a {@code ;} is still owed at the end of input
     */
    boolean finish() {
        var owed = state == State.AWAITING_DECISION;
        state = State.NORMAL;
        return owed;
    }
}
