package work.lcod.flow.lexer;

public enum TokenKind {
    INDENT,
    DEDENT,
    NEWLINE,
    EOF,
    STRING,
    STRING_PART,
    NUMBER,
    BOOLEAN,
    INTERP_START,
    INTERP_END,
    IDENTIFIER,
    KEYWORD,
    KEYWORD_COMPOUND,
    COLON,
    DOT
}
