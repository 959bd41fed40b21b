package org.logsim.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The ',' separating statements within a section. */
    COMMA,
    /** The ';' ending a section or the circuit. */
    SEMICOLON,
    /** The ':' following a section keyword. */
    COLON,
    /** The '.' between a device name and a pin name. */
    DOT,
    /** The '>' between the two ends of a connection. */
    ARROW,

    // Literals.
    /** A user-chosen identifier, such as a device name. */
    NAME,
    /** A run of decimal digits; the text is kept verbatim. */
    NUMBER,

    // Keywords.
    /** A reserved word: section keyword, device kind or pin name. */
    KEYWORD,

    // Miscellaneous.
    /** Represents the end of the source. */
    END_OF_FILE,
    /** A character that cannot start any token. Already reported by the lexer. */
    INVALID
}
