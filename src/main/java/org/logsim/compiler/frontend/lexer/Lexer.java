package org.logsim.compiler.frontend.lexer;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.names.NameTable;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.Pins;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Scanner) converts the characters of a circuit definition
 * into a sequence of tokens.
 * <p>
 * Tokens are produced lazily by {@link #nextToken()}; once the end of the source is
 * reached every further call returns an {@link TokenType#END_OF_FILE} token. Whitespace,
 * {@code #} line comments and {@code !...!} block comments are skipped. A character
 * that cannot start a token is reported once and returned as an
 * {@link TokenType#INVALID} token; the lexer never throws.
 */
public class Lexer {

    /** Section keywords of the language. */
    public static final String DEVICES = "DEVICES";
    /** Section keyword introducing connections. */
    public static final String CONNECT = "CONNECT";
    /** Section keyword introducing monitors. */
    public static final String MONITOR = "MONITOR";
    /** Keyword terminating the definition. */
    public static final String END = "END";

    private static final Set<String> KEYWORDS = buildKeywords();

    private final String source;
    private final NameTable names;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine;
    private int startColumn;

    /**
     * Creates a new Lexer.
     * @param source The circuit definition as a single string.
     * @param names The name table used to intern keywords and names.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, NameTable names, DiagnosticsEngine diagnostics) {
        this(source, names, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The circuit definition as a single string.
     * @param names The name table used to intern keywords and names.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, NameTable names, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.names = names;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * @param text A word.
     * @return {@code true} if the word is reserved and cannot be used as a device name.
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * Scans the whole remaining source.
     * @return The recognized tokens, ending with a single END_OF_FILE token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * Scans and returns the next token.
     * @return The next token, or END_OF_FILE when the source is exhausted.
     */
    public Token nextToken() {
        skipWhitespaceAndComments();
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName);
        }

        int start = current;
        char c = advance();
        switch (c) {
            case ',': return token(TokenType.COMMA, ",");
            case ';': return token(TokenType.SEMICOLON, ";");
            case ':': return token(TokenType.COLON, ":");
            case '.': return token(TokenType.DOT, ".");
            case '>': return token(TokenType.ARROW, ">");
            default:
                if (isDigit(c)) {
                    while (isDigit(peek())) advance();
                    return token(TokenType.NUMBER, source.substring(start, current));
                }
                if (isAlpha(c)) {
                    while (isAlphaNumeric(peek())) advance();
                    return word(source.substring(start, current));
                }
                diagnostics.reportError(CircuitErrorCode.INVALID_CHARACTER,
                        "Unexpected character: '" + c + "'", logicalFileName, startLine, startColumn);
                return token(TokenType.INVALID, String.valueOf(c));
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                // A line comment goes until the end of the line.
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '!') {
                int openLine = line;
                int openColumn = column;
                advance();
                while (!isAtEnd() && peek() != '!') advance();
                if (isAtEnd()) {
                    diagnostics.reportError(CircuitErrorCode.UNTERMINATED_COMMENT,
                            "Block comment opened with '!' is never closed.", logicalFileName, openLine, openColumn);
                    return;
                }
                advance(); // the closing '!'
            } else {
                return;
            }
        }
    }

    private Token word(String text) {
        TokenType type = KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.NAME;
        return new Token(type, text, names.lookup(text), startLine, startColumn, logicalFileName);
    }

    private Token token(TokenType type, String text) {
        return new Token(type, text, null, startLine, startColumn, logicalFileName);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }

    private static Set<String> buildKeywords() {
        Set<String> keywords = new HashSet<>(List.of(DEVICES, CONNECT, MONITOR, END));
        keywords.addAll(DeviceKind.keywords());
        keywords.addAll(Pins.allInputPins());
        keywords.addAll(Pins.DTYPE_OUTPUTS);
        return Set.copyOf(keywords);
    }
}
