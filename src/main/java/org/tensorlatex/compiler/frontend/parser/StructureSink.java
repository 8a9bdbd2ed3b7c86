package org.tensorlatex.compiler.frontend.parser;

import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

/**
 * Receives each structure as soon as it has been parsed. The receiver usually executes the
 * structure right away, so that declarations are visible to the structures that follow.
 */
@FunctionalInterface
public interface StructureSink {

    void accept(AstNode node);
}
