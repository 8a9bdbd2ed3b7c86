package org.tensorlatex.compiler.frontend.parser.features.define;

import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.directive.IDirectiveHandler;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the {@code define} macro.
 * Expected format: {@code % define ITEM { , ITEM }*} where an item is one of
 * <ul>
 *     <li>{@code [SYMMETRY] NAME [(dim)]}</li>
 *     <li>{@code basis [x, y, z]}</li>
 *     <li>{@code deriv symbolic} or {@code deriv _d}</li>
 *     <li>{@code index i = 0:2} or {@code index [i-l] = 0:2}</li>
 * </ul>
 */
public class DefineDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token macro = context.advance(); // consume define
        List<DefineNode.Item> items = new ArrayList<>();
        do {
            items.add(item(context));
        } while (context.accept(TokenType.COMMA));
        return new DefineNode(items, macro.position());
    }

    private DefineNode.Item item(ParsingContext context) {
        Token start = context.peek();
        if (context.accept(TokenType.BASIS_KWRD)) {
            context.expect(TokenType.LEFT_BRACKET);
            List<String> coordinates = new ArrayList<>();
            do {
                coordinates.add(context.tensors().symbol().name());
            } while (context.accept(TokenType.COMMA));
            context.expect(TokenType.RIGHT_BRACKET);
            return new DefineNode.Basis(coordinates, start.position());
        }
        if (context.accept(TokenType.DERIV_KWRD)) {
            return new DefineNode.DerivativeSetting(context.tensors().derivativeMode(), start.position());
        }
        if (context.accept(TokenType.INDEX_KWRD)) {
            return indexRange(context, start);
        }

        String keyword = context.accept(TokenType.SYMMETRY) ? context.previous().text() : null;
        String name = context.tensors().declaredName();
        Integer dimension = null;
        if (context.accept(TokenType.LEFT_PAREN)) {
            dimension = context.expectInteger();
            context.expect(TokenType.RIGHT_PAREN);
        }
        return new DefineNode.Declaration(keyword, name, dimension, start.position());
    }

    private DefineNode.Item indexRange(ParsingContext context, Token start) {
        List<String> labels = new ArrayList<>();
        if (context.accept(TokenType.LEFT_BRACKET)) {
            Token first = context.peek();
            String from = context.tensors().label();
            context.expect(TokenType.MINUS);
            String to = context.tensors().label();
            context.expect(TokenType.RIGHT_BRACKET);
            if (from.length() != 1 || to.length() != 1 || from.charAt(0) > to.charAt(0)) {
                throw new ParseException(String.format("invalid index range [%s-%s] at position %d", from, to, first.position()),
                        context.sentence(), first.position());
            }
            for (char c = from.charAt(0); c <= to.charAt(0); c++) {
                labels.add(String.valueOf(c));
            }
        } else {
            labels.add(context.tensors().label());
        }
        context.expect(TokenType.EQUAL);
        int from = context.expectInteger();
        context.expect(TokenType.COLON);
        Token stopToken = context.peek();
        int stop = context.expectInteger();
        if (stop < from) {
            throw new ParseException(String.format("empty index range %d:%d at position %d", from, stop, stopToken.position()),
                    context.sentence(), stopToken.position());
        }
        return new DefineNode.IndexRangeSetting(labels, from, stop, start.position());
    }
}
