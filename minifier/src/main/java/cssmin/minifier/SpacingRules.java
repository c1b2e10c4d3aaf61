package cssmin.minifier;

import static cssmin.minifier.Token.Kind.*;

import java.util.Locale;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Decides whether two tokens that were separated by whitespace, a comment or
 * nothing at all need a single space between them in the output.
 * <p>
 * Rules are tried in order and the first one that applies wins:
 * <ol>
 * <li>inside a calc-like function, {@code +} and {@code -} are always spaced</li>
 * <li>two words are always spaced</li>
 * <li>a word after {@code )} is spaced if the source had whitespace there, or
 *     unless the paren closed a selector pseudo-class</li>
 * <li>a media keyword before {@code (} is spaced, except {@code :not(}</li>
 * </ol>
 * Anything else is written without a space.
 */
@RequiredArgsConstructor
final class SpacingRules {

    private final @NonNull MinifierSettings settings;

    boolean needsSpace(
            @NonNull Token previous,
            @NonNull Token current,
            boolean insideCalc,
            @NonNull String lastClosedFunction,
            Token beforePrevious,
            boolean whitespaceSkipped) {
        if (insideCalc && (isSign(current) || isSign(previous))) {
            return true;
        }

        if (previous.is(WORD) && current.is(WORD)) {
            return true;
        }

        if (previous.is(PAREN_CLOSE) && current.is(WORD)) {
            if (whitespaceSkipped) {
                // descendant combinator
                return true;
            }
            return !settings.getSelectorPseudoClasses().contains(lastClosedFunction);
        }

        if (previous.is(WORD) && current.is(PAREN_OPEN)) {
            var keyword = previous.text().toLowerCase(Locale.ROOT);
            if (!settings.getMediaKeywords().contains(keyword)) {
                return false;
            }
            return !isPseudoClassNot(keyword, beforePrevious);
        }

        return false;
    }

    private static boolean isSign(Token token) {
        var text = token.text();
        return "+".equals(text) || "-".equals(text);
    }

    private static boolean isPseudoClassNot(String keyword, Token beforePrevious) {
        return "not".equals(keyword) && beforePrevious != null && beforePrevious.is(COLON);
    }
}
