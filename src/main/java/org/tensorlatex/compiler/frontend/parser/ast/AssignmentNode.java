package org.tensorlatex.compiler.frontend.parser.ast;

import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.TensorRef;

/**
 * An equation {@code target = value}. The node keeps its sentence so that it can be re-run
 * by {@code % update} after the session has changed.
 *
 * @param target   The left-hand side, a tensor or covariant-derivative reference.
 * @param value    The right-hand side as parsed.
 * @param sentence The sentence the equation was parsed from.
 * @param position The offset of the left-hand side.
 */
public record AssignmentNode(TensorRef target, Expr value, String sentence, int position) implements AstNode {
}
