package work.lcod.flow.ast;

import java.util.Arrays;
import java.util.Optional;

public enum MathOperator {
    PLUS("plus"),
    MINUS("minus"),
    TIMES("times"),
    DIVIDED_BY("divided by"),
    ROUNDED_TO("rounded to");

    private final String keyword;

    MathOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<MathOperator> fromKeyword(String text) {
        return Arrays.stream(values()).filter(op -> op.keyword.equals(text)).findFirst();
    }
}
