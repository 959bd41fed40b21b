package org.logsim.compiler.frontend.parser.ast;

/**
 * The base interface for the statements the parser produces. A circuit definition is
 * flat, so the nodes are leaves; each one carries the tokens needed to report
 * semantic problems at their source position.
 */
public sealed interface AstNode permits DeviceNode, ConnectionNode, MonitorNode {
}
