package work.lcod.flow.ast;

/**
 * 1-based line/column of the token a node starts at.
 */
public record SourceLocation(int line, int column) {
    public static final SourceLocation NONE = new SourceLocation(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
