package work.lcod.flow.lexer;

import java.util.List;
import java.util.Set;

/**
 * Reserved words of the Flow language.
 */
public final class Keywords {
    /** Multi-word phrases, longest first so a shorter prefix never wins. */
    public static final List<String> COMPOUND = List.of(
        "save the response headers as",
        "save the confidence as",
        "save the result as",
        "save the status as",
        "does not exist",
        "if still failing",
        "is not empty",
        "otherwise if",
        "divided by",
        "rounded to",
        "on failure",
        "on timeout",
        "is at least",
        "is at most",
        "is not",
        "is above",
        "is below",
        "is empty",
        "for each"
    );

    public static final Set<String> SINGLE = Set.of(
        "workflow", "config", "services", "trigger", "step", "if", "otherwise", "for", "each", "in",
        "set", "to", "ask", "save", "the", "result", "as", "confidence", "using", "with", "at", "on",
        "is", "contains", "exists", "and", "or", "not", "complete", "reject", "log", "skip", "retry",
        "times", "waiting", "every", "when", "manual", "plus", "minus", "env"
    );

    /** Keywords that open a statement and therefore never act as a value name. */
    public static final Set<String> STATEMENT = Set.of(
        "if", "set", "ask", "step", "complete", "reject", "log", "otherwise", "workflow", "config",
        "services", "trigger"
    );

    private Keywords() {}

    public static boolean isWordStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    public static boolean isWordPart(char ch) {
        return isWordStart(ch) || isDigit(ch) || ch == '-';
    }

    public static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    /** Whether {@code word} can be written as a bare identifier (used by the printer). */
    public static boolean isPlainIdentifier(String word) {
        if (word.isEmpty() || !isWordStart(word.charAt(0))) {
            return false;
        }
        for (int i = 1; i < word.length(); i++) {
            if (!isWordPart(word.charAt(i))) {
                return false;
            }
        }
        return !SINGLE.contains(word) && !"true".equals(word) && !"false".equals(word);
    }
}
