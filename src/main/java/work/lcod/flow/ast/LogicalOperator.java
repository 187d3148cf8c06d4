package work.lcod.flow.ast;

public enum LogicalOperator {
    AND("and"),
    OR("or"),
    NOT("not");

    private final String keyword;

    LogicalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
