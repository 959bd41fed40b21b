package org.logsim.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the circuit definition by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param nameId The interned id for keywords and names, {@code null} for everything else.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Integer nameId,
        int line,
        int column,
        String fileName
) {

    /**
     * @param keyword A reserved word.
     * @return {@code true} if this token is that keyword.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }
}
