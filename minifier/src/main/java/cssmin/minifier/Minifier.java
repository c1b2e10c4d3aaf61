package cssmin.minifier;

import static lombok.AccessLevel.PRIVATE;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Removes comments and insignificant whitespace from CSS.
 * <p>
 * A minifier holds no state between calls and may be shared between threads.
 * Every call scans its input once, front to back.
 */
@RequiredArgsConstructor(access = PRIVATE)
public final class Minifier {

    private static final String IMPORTANT_COMMENT = "/*!";

    @Getter
    private final @NonNull MinifierSettings settings;

    private final SpacingRules rules;

    public Minifier() {
        this(MinifierSettings.DEFAULT);
    }

    public Minifier(@NonNull MinifierSettings settings) {
        this(settings, new SpacingRules(settings));
    }

    public String minify(@NonNull String css) {
        var pass = new Pass(new Scanner(css));
        return pass.run();
    }

    private final class Pass {

        private final Scanner scanner;
        private final StringBuilder output = new StringBuilder();
        private final ParenContext parens = new ParenContext(settings.getCalcFunctions());
        private final PendingSemicolon semicolon = new PendingSemicolon();

        private Token previous = null;
        private Token beforePrevious = null;
        private boolean whitespaceSkipped = false;

        Pass(Scanner scanner) {
            this.scanner = scanner;
        }

        String run() {
            while (scanner.hasNext()) {
                accept(scanner.next());
            }
            if (semicolon.finish()) {
                output.append(';');
            }
            return output.toString();
        }

        private void accept(Token token) {
            if (token.hidden()) {
                if (token.is(Token.Kind.WHITESPACE)) {
                    whitespaceSkipped = true;
                } else if (isPreserved(token)) {
                    emitComment(token);
                }
                return;
            }

            if (semicolon.resolve(token)) {
                output.append(';');
            }

            switch (token.kind()) {
            case SEMICOLON:
                semicolon.defer();
                return;
            case PAREN_OPEN:
                parens.open(previous);
                break;
            case PAREN_CLOSE:
                parens.close();
                break;
            default:
                break;
            }

            if (previous != null && rules.needsSpace(
                    previous,
                    token,
                    parens.insideCalc(),
                    parens.getLastClosedFunction(),
                    beforePrevious,
                    whitespaceSkipped)) {
                output.append(' ');
            }
            output.append(token.text());

            beforePrevious = previous;
            previous = token;
            whitespaceSkipped = false;
        }

        private boolean isPreserved(Token comment) {
            return settings.isPreserveImportantComments() && comment.text().startsWith(IMPORTANT_COMMENT);
        }

        private void emitComment(Token comment) {
            if (semicolon.resolve(comment)) {
                output.append(';');
            }
            if (whitespaceSkipped && output.length() > 0) {
                output.append(' ');
            }
            output.append(comment.text());

            // the lookback stays, so the next token is still spaced against the one before the comment
            whitespaceSkipped = false;
        }
    }
}
