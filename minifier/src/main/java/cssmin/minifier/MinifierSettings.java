package cssmin.minifier;

import java.util.Set;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Name sets and switches consulted while minifying. All names are lowercase.
 */
@Getter
@Builder(toBuilder = true)
public final class MinifierSettings {

    /** Functions whose {@code +} and {@code -} are arithmetic. */
    public static final Set<String> CALC_FUNCTIONS = Set.of(
        "calc",
        "clamp",
        "min",
        "max",
        "var");

    /** Pseudo-classes that may be followed directly by a chained simple selector. */
    public static final Set<String> SELECTOR_PSEUDO_CLASSES = Set.of(
        "not",
        "is",
        "where",
        "has",
        "nth-child",
        "nth-last-child",
        "nth-of-type",
        "nth-last-of-type",
        "dir",
        "lang",
        "host",
        "host-context",
        "part",
        "slotted");

    /** Media query keywords that keep their space before a parenthesis. */
    public static final Set<String> MEDIA_KEYWORDS = Set.of(
        "and",
        "or",
        "not");

    public static final MinifierSettings DEFAULT = builder().build();

    @NonNull
    @Builder.Default
    private final Set<String> calcFunctions = CALC_FUNCTIONS;

    @NonNull
    @Builder.Default
    private final Set<String> selectorPseudoClasses = SELECTOR_PSEUDO_CLASSES;

    @NonNull
    @Builder.Default
    private final Set<String> mediaKeywords = MEDIA_KEYWORDS;

    /** Keep {@code /*!} license comments instead of dropping them. */
    private final boolean preserveImportantComments;
}
