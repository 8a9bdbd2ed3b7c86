package org.tensorlatex.compiler.frontend.parser.features.update;

import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

/**
 * A {@code % update [metric] NAME} line.
 *
 * @param metric   Whether NAME is (re-)registered as a metric.
 * @param name     The tensor name.
 * @param position The offset of the {@code update} keyword.
 */
public record UpdateNode(boolean metric, String name, int position) implements AstNode {
}
