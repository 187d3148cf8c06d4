package work.lcod.flow.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.diagnostics.Severity;

/**
 * Turns Flow source text into tokens. Indentation is tracked with a stack of column widths
 * (4 spaces per level) and reported as INDENT/DEDENT tokens.
 */
public final class Lexer {
    private static final int INDENT_WIDTH = 4;
    private static final char END = '\0';

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int column = 1;

    private Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        this.indents.push(0);
    }

    public static List<Token> tokenize(String source) {
        return tokenize(source, "<input>");
    }

    public static List<Token> tokenize(String source, String fileName) {
        return new Lexer(source, fileName).run();
    }

    private List<Token> run() {
        boolean atLineStart = true;
        while (pos < source.length()) {
            if (atLineStart) {
                atLineStart = false;
                handleIndentation();
                char next = peek();
                if (next == '\n' || next == '\r') {
                    consumeLineBreak();
                    atLineStart = true;
                    continue;
                }
                if (next == '#') {
                    skipComment();
                    continue;
                }
                if (next == END) {
                    break;
                }
            }

            char ch = peek();
            if (ch == ' ') {
                skipSpaces();
            } else if (ch == '\n' || ch == '\r') {
                int newlineLine = line;
                int newlineColumn = column;
                consumeLineBreak();
                emitNewline(newlineLine, newlineColumn);
                atLineStart = true;
            } else if (ch == '#') {
                skipComment();
            } else if (ch == '"') {
                scanString();
            } else if (Keywords.isDigit(ch)) {
                scanNumber();
            } else if (ch == ':') {
                tokens.add(new Token(TokenKind.COLON, ":", line, column));
                advance();
            } else if (ch == '.') {
                tokens.add(new Token(TokenKind.DOT, ".", line, column));
                advance();
            } else if (Keywords.isWordStart(ch)) {
                scanWord();
            } else if (ch == '\t') {
                throw tabError();
            } else {
                throw error(
                    "Unexpected character \"" + ch + "\".",
                    "Remove this character or check for typos.",
                    "Flow only uses letters, numbers, spaces, quotes, colons, dots, and # for comments."
                );
            }
        }

        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenKind.DEDENT, "DEDENT", line, column));
        }
        tokens.add(new Token(TokenKind.EOF, "", line, column));
        return List.copyOf(tokens);
    }

    private void handleIndentation() {
        int startLine = line;
        int startColumn = column;
        int spaces = 0;
        while (peek() == ' ') {
            advance();
            spaces++;
        }
        char next = peek();
        if (next == '\t') {
            throw tabError();
        }
        if (next == '\n' || next == '\r' || next == END || next == '#') {
            return;
        }

        int current = indents.peek();
        if (spaces > current) {
            if (spaces - current != INDENT_WIDTH) {
                throw error(
                    "Unexpected indentation. I expected " + (current + INDENT_WIDTH) + " spaces but found " + spaces + ".",
                    "Flow uses exactly 4 spaces for each indent level.",
                    "Make sure each nested block is indented exactly 4 more spaces than its parent."
                );
            }
            indents.push(spaces);
            tokens.add(new Token(TokenKind.INDENT, "INDENT", startLine, startColumn));
        } else if (spaces < current) {
            while (indents.size() > 1 && indents.peek() > spaces) {
                indents.pop();
                tokens.add(new Token(TokenKind.DEDENT, "DEDENT", startLine, startColumn));
            }
            if (indents.peek() != spaces) {
                throw error(
                    "Indentation doesn't match any outer block. Found " + spaces + " spaces.",
                    "Make sure your indentation lines up with a previous block.",
                    "Each indent level in Flow is exactly 4 spaces."
                );
            }
        }
    }

    private void scanString() {
        int startLine = line;
        int startColumn = column;
        advance();
        var text = new StringBuilder();
        boolean interpolated = false;

        while (pos < source.length() && peek() != '"') {
            char ch = peek();
            if (ch == '\n' || ch == '\r') {
                throw unterminatedString();
            }
            if (ch == '{' && peekAt(1) != '{') {
                interpolated = true;
                tokens.add(new Token(TokenKind.STRING_PART, text.toString(), startLine, startColumn));
                text.setLength(0);
                tokens.add(new Token(TokenKind.INTERP_START, "{", line, column));
                advance();
                scanInterpolation();
                if (peek() != '}') {
                    throw error(
                        "Missing closing } in string interpolation.",
                        "Add a } to close the interpolation expression.",
                        "Example: \"Hello, {name}\""
                    );
                }
                tokens.add(new Token(TokenKind.INTERP_END, "}", line, column));
                advance();
            } else if (ch == '{' || (ch == '}' && peekAt(1) == '}')) {
                text.append(ch);
                advance();
                advance();
            } else if (ch == '\\') {
                advance();
                char escaped = advance();
                switch (escaped) {
                    case 'n':
                        text.append('\n');
                        break;
                    case 't':
                        text.append('\t');
                        break;
                    case '"':
                        text.append('"');
                        break;
                    case '\\':
                        text.append('\\');
                        break;
                    default:
                        text.append('\\').append(escaped);
                }
            } else {
                text.append(advance());
            }
        }

        if (pos >= source.length()) {
            throw unterminatedString();
        }
        advance();

        if (interpolated) {
            tokens.add(new Token(TokenKind.STRING_PART, text.toString(), line, column));
        } else {
            tokens.add(new Token(TokenKind.STRING, text.toString(), startLine, startColumn));
        }
    }

    private void scanInterpolation() {
        skipSpaces();
        int startLine = line;
        int startColumn = column;
        String name = readInterpolationWord();
        if (name.isEmpty()) {
            throw error(
                "Empty interpolation expression.",
                "Put a variable name inside the braces.",
                "Example: \"Hello, {name}\""
            );
        }
        tokens.add(new Token(TokenKind.IDENTIFIER, name, startLine, startColumn));

        while (peek() == '.') {
            tokens.add(new Token(TokenKind.DOT, ".", line, column));
            advance();
            int propertyLine = line;
            int propertyColumn = column;
            String property = readInterpolationWord();
            if (property.isEmpty()) {
                throw error(
                    "Expected a property name after the dot.",
                    "Add a property name.",
                    "Example: {order.total}"
                );
            }
            tokens.add(new Token(TokenKind.IDENTIFIER, property, propertyLine, propertyColumn));
        }
        skipSpaces();
    }

    private String readInterpolationWord() {
        var word = new StringBuilder();
        while (pos < source.length() && Keywords.isWordPart(peek())) {
            word.append(advance());
        }
        return word.toString();
    }

    private void scanNumber() {
        int startLine = line;
        int startColumn = column;
        var number = new StringBuilder();
        while (Keywords.isDigit(peek())) {
            number.append(advance());
        }
        if (peek() == '.' && Keywords.isDigit(peekAt(1))) {
            number.append(advance());
            while (Keywords.isDigit(peek())) {
                number.append(advance());
            }
        }
        tokens.add(new Token(TokenKind.NUMBER, number.toString(), startLine, startColumn));
    }

    private void scanWord() {
        int startLine = line;
        int startColumn = column;

        for (String compound : Keywords.COMPOUND) {
            if (matchesAhead(compound)) {
                for (int i = 0; i < compound.length(); i++) {
                    advance();
                }
                tokens.add(new Token(TokenKind.KEYWORD_COMPOUND, compound, startLine, startColumn));
                return;
            }
        }

        var word = new StringBuilder();
        while (pos < source.length() && Keywords.isWordPart(peek())) {
            word.append(advance());
        }
        String text = word.toString();
        TokenKind kind;
        if ("true".equals(text) || "false".equals(text)) {
            kind = TokenKind.BOOLEAN;
        } else if (Keywords.SINGLE.contains(text)) {
            kind = TokenKind.KEYWORD;
        } else {
            kind = TokenKind.IDENTIFIER;
        }
        tokens.add(new Token(kind, text, startLine, startColumn));
    }

    /** Case-insensitive match of {@code phrase} at the cursor, followed by a word boundary. */
    private boolean matchesAhead(String phrase) {
        if (pos + phrase.length() > source.length()) {
            return false;
        }
        if (!source.regionMatches(true, pos, phrase, 0, phrase.length())) {
            return false;
        }
        char after = peekAt(phrase.length());
        return !(Keywords.isWordStart(after) || Keywords.isDigit(after));
    }

    private void emitNewline(int newlineLine, int newlineColumn) {
        if (tokens.isEmpty()) {
            return;
        }
        TokenKind last = tokens.get(tokens.size() - 1).kind();
        if (last != TokenKind.NEWLINE && last != TokenKind.INDENT) {
            tokens.add(new Token(TokenKind.NEWLINE, "\\n", newlineLine, newlineColumn));
        }
    }

    private void consumeLineBreak() {
        if (peek() == '\r') {
            advance();
        }
        if (peek() == '\n') {
            advance();
        }
    }

    private void skipSpaces() {
        while (peek() == ' ') {
            advance();
        }
    }

    private void skipComment() {
        while (pos < source.length() && peek() != '\n') {
            advance();
        }
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : END;
    }

    private char advance() {
        char ch = peek();
        pos++;
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }

    private LexerException tabError() {
        return error(
            "Tabs are not allowed in Flow. Please use spaces (4 per indent level).",
            "Replace all tabs with 4 spaces.",
            "Most editors can convert tabs to spaces automatically.\n"
                + "Look for \"Convert Indentation to Spaces\" in your editor's command palette."
        );
    }

    private LexerException unterminatedString() {
        return error(
            "This string is missing its closing quote.",
            "Add a \" at the end of the string.",
            "Strings in Flow must be on a single line: \"like this\""
        );
    }

    private LexerException error(String message, String suggestion, String hint) {
        return new LexerException(
            FlowDiagnostic.of(Severity.ERROR, fileName, line, column, message, source, suggestion, hint)
        );
    }
}
