package org.logsim.compiler.api;

/**
 * Defines unique, testable codes for every problem the circuit compiler can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum CircuitErrorCode {
    // region Lexical Errors
    /** A character that cannot start any token. */
    INVALID_CHARACTER(Category.LEXICAL),
    /** A block comment opened with '!' was never closed. */
    UNTERMINATED_COMMENT(Category.LEXICAL),
    // endregion

    // region Syntax Errors
    /** A section keyword (DEVICES, CONNECT, MONITOR, END) is missing or out of order. */
    MISSING_SECTION(Category.SYNTAX),
    /** A section keyword is not followed by ':'. */
    MISSING_COLON(Category.SYNTAX),
    /** The DEVICES section declares no device. */
    NO_DEVICES(Category.SYNTAX),
    /** A device declaration does not start with a device kind keyword. */
    EXPECTED_DEVICE_KIND(Category.SYNTAX),
    /** A device name was expected. */
    EXPECTED_DEVICE_NAME(Category.SYNTAX),
    /** A device parameter (state, period, input count, waveform) was expected. */
    EXPECTED_PARAMETER(Category.SYNTAX),
    /** '>' was expected between the two ends of a connection. */
    EXPECTED_ARROW(Category.SYNTAX),
    /** An input pin name was expected after '.'. */
    EXPECTED_INPUT_PIN(Category.SYNTAX),
    /** An output pin name (Q, QBAR) was expected after '.'. */
    EXPECTED_OUTPUT_PIN(Category.SYNTAX),
    /** A statement is not followed by ',' or ';'. */
    EXPECTED_SEPARATOR(Category.SYNTAX),
    /** 'END' is not followed by ';'. */
    EXPECTED_END_SEMICOLON(Category.SYNTAX),
    /** The source ends before 'END;'. */
    UNEXPECTED_END_OF_FILE(Category.SYNTAX),
    /** Tokens follow 'END;'. */
    TRAILING_INPUT(Category.SYNTAX),
    // endregion

    // region Semantic Errors
    /** A device name is declared more than once. */
    DUPLICATE_DEVICE(Category.SEMANTIC),
    /** A connection or monitor references a device that was never declared. */
    UNDEFINED_DEVICE(Category.SEMANTIC),
    /** A pin is not defined for the kind of the referenced device. */
    INVALID_PIN(Category.SEMANTIC),
    /** An input already has a source. */
    INPUT_ALREADY_CONNECTED(Category.SEMANTIC),
    /** A device parameter is outside the domain of its kind. */
    INVALID_ARGUMENT(Category.SEMANTIC),
    /** An output is monitored twice. Reported as a warning. */
    DUPLICATE_MONITOR(Category.SEMANTIC);
    // endregion

    /**
     * The class of problem a code belongs to.
     */
    public enum Category {
        /** Problems found while scanning characters. */
        LEXICAL,
        /** Grammar violations. */
        SYNTAX,
        /** Violations of the circuit rules in well-formed statements. */
        SEMANTIC
    }

    private final Category category;

    CircuitErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category of this code.
     */
    public Category category() {
        return category;
    }
}
