package org.tensorlatex.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes handed from the parser to the semantic analyzer.
 */
public interface AstNode {

    /**
     * @return The offset of the first token of this node within its sentence.
     */
    int position();
}
