package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.api.CircuitErrorCode;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Lexer;
import org.logsim.compiler.frontend.lexer.Token;
import org.logsim.compiler.frontend.lexer.TokenType;
import org.logsim.compiler.frontend.parser.ast.AstNode;
import org.logsim.compiler.frontend.parser.ast.ConnectionNode;
import org.logsim.compiler.frontend.parser.ast.DeviceNode;
import org.logsim.compiler.frontend.parser.ast.MonitorNode;
import org.logsim.runtime.model.DeviceKind;
import org.logsim.runtime.model.Pins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The recursive-descent parser for circuit definitions. It pulls tokens from a
 * {@link Lexer} with one token of lookahead and returns the well-formed statements of
 * the DEVICES, CONNECT and MONITOR sections, in source order.
 * <p>
 * A malformed statement is reported and skipped: the parser resynchronizes on the next
 * ',' or ';' (or on a section keyword) so that independent errors later in the file
 * are still found in the same pass. A statement that is complete but lacks its
 * separator is kept. The names of device declarations that broke off after the name
 * are collected in {@link #getIncompleteDevices()}.
 */
public class Parser {

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private Token current;
    private Token previous;
    private boolean endOfFileReported = false;
    private final Set<Integer> incompleteDevices = new LinkedHashSet<>();

    /**
     * Constructs a new Parser.
     * @param lexer The token source.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.current = fetch();
    }

    /**
     * Parses the complete definition.
     * @return The well-formed statements, devices first, then connections, then monitors.
     */
    public List<AstNode> parse() {
        List<AstNode> statements = new ArrayList<>();

        sectionHeader(Lexer.DEVICES, "The file should start with the keyword 'DEVICES'.");
        if (check(TokenType.SEMICOLON)) {
            error(CircuitErrorCode.NO_DEVICES, "There should be at least one device.");
            advance();
        } else {
            statementList(this::device, statements);
        }
        if (stopAtEndOfFile()) return statements;

        sectionHeader(Lexer.CONNECT, "';' after the last device should be followed by the keyword 'CONNECT'.");
        optionalStatementList(this::connection, statements);
        if (stopAtEndOfFile()) return statements;

        sectionHeader(Lexer.MONITOR, "';' after the last connection should be followed by the keyword 'MONITOR'.");
        optionalStatementList(this::monitor, statements);
        if (stopAtEndOfFile()) return statements;

        if (current.isKeyword(Lexer.END)) {
            advance();
            if (!match(TokenType.SEMICOLON)) {
                error(CircuitErrorCode.EXPECTED_END_SEMICOLON, "'END' should be followed by ';'.");
            }
        } else {
            error(CircuitErrorCode.MISSING_SECTION, "';' after the last monitor should be followed by the keyword 'END'.");
        }
        if (!isAtEnd() && !endOfFileReported) {
            diagnostics.reportError(CircuitErrorCode.TRAILING_INPUT,
                    "Unexpected '" + current.text() + "' after 'END;'.", current);
        }
        return statements;
    }

    /**
     * Returns the name ids of device declarations that were cut short by a syntax error
     * after their name had been read.
     * @return An unmodifiable view, filled in by {@link #parse()}.
     */
    public Set<Integer> getIncompleteDevices() {
        return Collections.unmodifiableSet(incompleteDevices);
    }

    private void sectionHeader(String keyword, String missingMessage) {
        if (current.isKeyword(keyword)) {
            advance();
            if (!match(TokenType.COLON)) {
                error(CircuitErrorCode.MISSING_COLON, "'" + keyword + "' should be followed by ':'.");
            }
        } else {
            error(CircuitErrorCode.MISSING_SECTION, missingMessage);
        }
    }

    private void optionalStatementList(Supplier<AstNode> statement, List<AstNode> out) {
        if (match(TokenType.SEMICOLON)) {
            return;
        }
        statementList(statement, out);
    }

    private void statementList(Supplier<AstNode> statement, List<AstNode> out) {
        while (true) {
            try {
                out.add(statement.get());
                if (!check(TokenType.COMMA) && !check(TokenType.SEMICOLON)) {
                    error(CircuitErrorCode.EXPECTED_SEPARATOR,
                            "Statements should be separated by ',' and the section ended by ';'.");
                    synchronize();
                }
            } catch (ParseError e) {
                synchronize();
            }
            if (match(TokenType.COMMA)) continue;
            match(TokenType.SEMICOLON);
            return;
        }
    }

    private AstNode device() {
        DeviceKind kind = current.type() == TokenType.KEYWORD ? DeviceKind.fromKeyword(current.text()) : null;
        if (kind == null) {
            throw error(CircuitErrorCode.EXPECTED_DEVICE_KIND,
                    "A device declaration should start with a device kind, but got '" + current.text() + "'.");
        }
        Token kindToken = advance();
        Token name = deviceName();
        Token parameter = null;
        if (kind.takesParameter()) {
            if (!check(TokenType.NUMBER)) {
                incompleteDevices.add(name.nameId());
                throw error(CircuitErrorCode.EXPECTED_PARAMETER, parameterHint(kind));
            }
            parameter = advance();
        }
        return new DeviceNode(kindToken, name, parameter);
    }

    private AstNode connection() {
        Token source = deviceName();
        Token sourcePin = null;
        if (match(TokenType.DOT)) {
            sourcePin = outputPin();
        }
        if (!match(TokenType.ARROW)) {
            throw error(CircuitErrorCode.EXPECTED_ARROW, "A connection should have '>' between its output and its input.");
        }
        Token target = deviceName();
        if (!match(TokenType.DOT)) {
            throw error(CircuitErrorCode.EXPECTED_INPUT_PIN,
                    "The input of a connection must be a device name followed by '.input_pin'.");
        }
        if (current.type() != TokenType.KEYWORD || !Pins.isInputPin(current.text())) {
            throw error(CircuitErrorCode.EXPECTED_INPUT_PIN,
                    "The input pin should be one of I1..I16, DATA, CLK, SET, CLEAR, but got '" + current.text() + "'.");
        }
        Token targetPin = advance();
        return new ConnectionNode(source, sourcePin, target, targetPin);
    }

    private AstNode monitor() {
        Token device = deviceName();
        Token pin = null;
        if (match(TokenType.DOT)) {
            pin = outputPin();
        }
        return new MonitorNode(device, pin);
    }

    private Token deviceName() {
        if (check(TokenType.NAME)) {
            return advance();
        }
        if (check(TokenType.KEYWORD)) {
            throw error(CircuitErrorCode.EXPECTED_DEVICE_NAME,
                    "'" + current.text() + "' is a reserved word and cannot be used as a device name.");
        }
        throw error(CircuitErrorCode.EXPECTED_DEVICE_NAME,
                "Expected a device name (a letter followed by letters, digits or '_'), but got '" + current.text() + "'.");
    }

    private Token outputPin() {
        if (current.type() == TokenType.KEYWORD && Pins.isOutputPin(current.text())) {
            return advance();
        }
        throw error(CircuitErrorCode.EXPECTED_OUTPUT_PIN, "Output pins can only be Q or QBAR, but got '" + current.text() + "'.");
    }

    private static String parameterHint(DeviceKind kind) {
        return switch (kind) {
            case SWITCH -> "A SWITCH needs an initial state of 0 or 1.";
            case CLOCK -> "A CLOCK needs its half-period as a positive integer.";
            case RC -> "An RC needs its period as a positive integer.";
            case AND, OR, NAND, NOR -> "An " + kind + " gate needs its number of inputs (1 to 16).";
            case SIGGEN -> "A SIGGEN needs a waveform made of 0s and 1s.";
            case XOR, DTYPE -> kind + " takes no parameter.";
        };
    }

    /**
     * Skips tokens up to the next statement boundary without consuming it.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            if (check(TokenType.COMMA) || check(TokenType.SEMICOLON)) return;
            if (current.isKeyword(Lexer.CONNECT) || current.isKeyword(Lexer.MONITOR) || current.isKeyword(Lexer.END)) return;
            advance();
        }
    }

    private boolean stopAtEndOfFile() {
        if (isAtEnd()) {
            error(CircuitErrorCode.UNEXPECTED_END_OF_FILE, "");
            return true;
        }
        return false;
    }

    /**
     * Reports an error at the current token. Running into the end of the source is
     * reported once, whatever was expected.
     */
    private ParseError error(CircuitErrorCode code, String message) {
        if (isAtEnd()) {
            if (!endOfFileReported) {
                endOfFileReported = true;
                diagnostics.reportError(CircuitErrorCode.UNEXPECTED_END_OF_FILE,
                        "The file ends too early. Check for missing sections or 'END;'.", current);
            }
        } else {
            diagnostics.reportError(code, message, current);
        }
        return new ParseError();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private Token advance() {
        previous = current;
        if (!isAtEnd()) {
            current = fetch();
        }
        return previous;
    }

    private boolean isAtEnd() {
        return current.type() == TokenType.END_OF_FILE;
    }

    /**
     * Invalid characters have already been reported by the lexer.
     */
    private Token fetch() {
        Token token = lexer.nextToken();
        while (token.type() == TokenType.INVALID) {
            token = lexer.nextToken();
        }
        return token;
    }

    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
