package shoal.lex;

/**
 * Rates how likely a text is written in a lexer's language, from 0.0 (no
 * idea) to 1.0 (certain). Implementations must not have side effects.
 */
@FunctionalInterface
public interface ConfidenceEstimator {

    ConfidenceEstimator NONE = text -> 0.0;

    double estimate(String text);
}
