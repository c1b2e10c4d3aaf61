package cssmin.minifier;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Tracks parenthesis nesting for a single minify pass.
 */
@RequiredArgsConstructor
final class ParenContext {

    /** Stands in for the function name of a paren that is not a call. */
    static final String NO_FUNCTION = "";

    private final @NonNull Set<String> calcFunctions;

    private final Deque<String> openFunctions = new ArrayDeque<>();

    @Getter
    private int calcDepth = 0;

    @Getter
    private String lastClosedFunction = NO_FUNCTION;

    boolean insideCalc() {
        return calcDepth > 0;
    }

    int depth() {
        return openFunctions.size();
    }

    /**
     * @param previous the last emitted token, {@code null} at the start of input
     */
    void open(Token previous) {
        var name = functionName(previous);
        if (calcFunctions.contains(name) || calcDepth > 0) {
            calcDepth++;
        }
        openFunctions.push(name);
    }

    void close() {
        if (calcDepth > 0) {
            calcDepth--;
        }
        var closed = openFunctions.poll();
        lastClosedFunction = closed != null ? closed : NO_FUNCTION;
    }

    static String functionName(Token previous) {
        if (previous == null || !previous.is(Token.Kind.WORD)) {
            return NO_FUNCTION;
        }
        return previous.text().toLowerCase(Locale.ROOT);
    }
}
