package work.lcod.flow.lexer;

import java.util.Objects;

/**
 * One lexical unit with its 1-based source position.
 */
public record Token(TokenKind kind, String text, int line, int column) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean is(TokenKind expected, String value) {
        return kind == expected && text.equals(value);
    }

    /** True for single or compound keywords with the given text. */
    public boolean isKeyword(String value) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.KEYWORD_COMPOUND) && text.equals(value);
    }

    /** True for tokens that end the current statement. */
    public boolean endsStatement() {
        return kind == TokenKind.NEWLINE || kind == TokenKind.DEDENT || kind == TokenKind.EOF;
    }
}
