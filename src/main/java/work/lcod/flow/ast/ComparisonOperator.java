package work.lcod.flow.ast;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    IS("is", false),
    IS_NOT("is not", false),
    IS_ABOVE("is above", false),
    IS_BELOW("is below", false),
    IS_AT_LEAST("is at least", false),
    IS_AT_MOST("is at most", false),
    CONTAINS("contains", false),
    IS_EMPTY("is empty", true),
    IS_NOT_EMPTY("is not empty", true),
    EXISTS("exists", true),
    DOES_NOT_EXIST("does not exist", true);

    private final String keyword;
    private final boolean unary;

    ComparisonOperator(String keyword, boolean unary) {
        this.keyword = keyword;
        this.unary = unary;
    }

    public String keyword() {
        return keyword;
    }

    /** Unary operators ({@code is empty}, {@code exists}, ...) take no right operand. */
    public boolean isUnary() {
        return unary;
    }

    public static Optional<ComparisonOperator> fromKeyword(String text) {
        return Arrays.stream(values()).filter(op -> op.keyword.equals(text)).findFirst();
    }
}
