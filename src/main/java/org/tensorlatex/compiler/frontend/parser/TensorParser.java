package org.tensorlatex.compiler.frontend.parser;

import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.semantics.TensorNames;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.DerivativeMode;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.Index;
import org.tensorlatex.symbolic.IndexPosition;
import org.tensorlatex.symbolic.Symbol;
import org.tensorlatex.symbolic.TensorOrigin;
import org.tensorlatex.symbolic.TensorRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses tensor references and the derivative operators acting on them.
 * <pre>
 * TENSOR -> SYMBOL [ '_' LOWER | '^' UPPER [ '_' LOWER ] ]
 * SYMBOL -> LETTER | DIACRITIC '{' SYMBOL '}' | MATHOP '{' NAME '}'
 * PARDRV -> [ VPHANTOM '{' MODE '}' ] { PARTIAL [ '^' INTEGER ] '_' INDEX }+ ( TENSOR | '(' EXPRESSION ')' )
 * COVDRV -> { NABLA ( '^' | '_' ) INDEX }+ TENSOR
 * </pre>
 */
public class TensorParser {

    private static final List<IndexPosition> CHRISTOFFEL =
            List.of(IndexPosition.UPPER, IndexPosition.LOWER, IndexPosition.LOWER);

    /**
     * A symbol with its namespace name and its LaTeX spelling.
     *
     * @param name  E.g. {@code ghat} or {@code Gamma}.
     * @param latex E.g. {@code \hat{g}} or {@code \Gamma}.
     */
    public record SymbolName(String name, String latex) {
    }

    /**
     * A parsed tensor with the parts needed to spell it again.
     *
     * @param ref        The reference.
     * @param symbol     Its symbol.
     * @param commaOrder The number of comma-derivative indices at the end.
     */
    public record ParsedTensor(TensorRef ref, SymbolName symbol, int commaOrder) {
    }

    private final ParsingContext context;

    public TensorParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses a tensor.
     * @param target Whether the tensor is the left-hand side of an assignment; a caret after a
     *               target always opens upper indices.
     * @return The reference.
     */
    public TensorRef tensor(boolean target) {
        return parsedTensor(target).ref();
    }

    /**
     * Parses a tensor and keeps its spelling.
     * @param forceIndices Whether a caret group is read as indices without further checks.
     * @return The parsed tensor.
     */
    public ParsedTensor parsedTensor(boolean forceIndices) {
        SymbolName symbol = symbol();
        List<Index> indices = new ArrayList<>();
        int commaOrder = 0;

        if (context.accept(TokenType.UNDERSCORE)) {
            commaOrder = lowerGroup(indices);
        } else if (context.check(TokenType.CARET)
                && !(context.checkAhead(1, TokenType.LEFT_BRACE) && context.checkAhead(2, TokenType.LEFT_BRACE))) {
            int mark = context.mark();
            context.advance();
            List<Index> upper = new ArrayList<>();
            int items = upperGroup(upper);
            if (items > 0) {
                List<Index> candidate = new ArrayList<>(upper);
                boolean lowerFollows = context.accept(TokenType.UNDERSCORE);
                int candidateComma = lowerFollows ? lowerGroup(candidate) : 0;
                String name = TensorNames.of(symbol.name(), positions(candidate, candidateComma));
                if (forceIndices || lowerFollows || items > 1 || context.getSession().isKnown(name)) {
                    indices = candidate;
                    commaOrder = candidateComma;
                } else {
                    context.reset(mark);
                }
            } else {
                context.reset(mark);
            }
        }
        return new ParsedTensor(build(symbol.name(), indices, commaOrder), symbol, commaOrder);
    }

    /**
     * Parses a symbol: a Latin letter, a Greek command (named without its backslash), a diacritic
     * form such as {@code \hat{g}} (named {@code ghat}) or {@code \mathop{name}}.
     * @return The symbol.
     */
    public SymbolName symbol() {
        if (context.accept(TokenType.LETTER)) {
            String text = context.previous().text();
            return new SymbolName(stripBackslash(text), text);
        }
        if (context.accept(TokenType.DIACRITIC)) {
            String diacritic = context.previous().text();
            context.expect(TokenType.LEFT_BRACE);
            SymbolName inner = symbol();
            context.expect(TokenType.RIGHT_BRACE);
            return new SymbolName(inner.name() + diacritic.substring(1), diacritic + "{" + inner.latex() + "}");
        }
        if (context.accept(TokenType.MATHOP)) {
            context.expect(TokenType.LEFT_BRACE);
            StringBuilder name = new StringBuilder();
            while (context.check(TokenType.LETTER) || context.check(TokenType.EULER) || context.check(TokenType.INTEGER)) {
                name.append(stripBackslash(context.advance().text()));
            }
            if (name.length() == 0) {
                throw context.unexpected(context.peek());
            }
            context.expect(TokenType.RIGHT_BRACE);
            return new SymbolName(name.toString(), "\\mathop{" + name + "}");
        }
        throw context.unexpected(context.peek());
    }

    /**
     * Parses a name as written in a directive, e.g. {@code hUD}, {@code \hat{g}DD} or {@code vU_dD}.
     * @return The concatenated name.
     */
    public String declaredName() {
        StringBuilder name = new StringBuilder(context.accept(TokenType.EULER) ? context.previous().text() : symbol().name());
        while (true) {
            if (context.check(TokenType.LETTER) || context.check(TokenType.DIACRITIC) || context.check(TokenType.MATHOP)) {
                name.append(symbol().name());
            } else if (context.check(TokenType.EULER)) {
                name.append(context.advance().text());
            } else if (context.check(TokenType.UNDERSCORE) && context.checkAhead(1, TokenType.LETTER)) {
                name.append(context.advance().text());
            } else {
                return name.toString();
            }
        }
    }

    /**
     * Checks whether the next tokens open a covariant derivative, {@code \nabla} or {@code \hat{\nabla}}.
     * @return true if they do.
     */
    public boolean startsCovariantDerivative() {
        return context.check(TokenType.NABLA)
                || (context.check(TokenType.DIACRITIC) && context.checkAhead(1, TokenType.LEFT_BRACE)
                && context.checkAhead(2, TokenType.NABLA));
    }

    /**
     * Parses a covariant derivative. The result names the derivative tensor, e.g. {@code vU_cdD}
     * for {@code \nabla_b v^a}; its indices are the operand's followed by the derivative indices in
     * the order written.
     * @return The derivative tensor reference.
     */
    public TensorRef covariantDerivative() {
        int position = context.peek().position();
        String diacritic = null;
        List<IndexPosition> derivativePositions = new ArrayList<>();
        List<Index> derivativeIndices = new ArrayList<>();
        do {
            String current = "";
            if (context.accept(TokenType.DIACRITIC)) {
                current = context.previous().text().substring(1);
                context.expect(TokenType.LEFT_BRACE);
                context.expect(TokenType.NABLA);
                context.expect(TokenType.RIGHT_BRACE);
            } else {
                context.expect(TokenType.NABLA);
            }
            if (diacritic == null) {
                diacritic = current;
            } else if (!diacritic.equals(current)) {
                throw new ParseException("mixed connections in covariant derivative at position " + position,
                        context.sentence(), position);
            }
            IndexPosition indexPosition;
            if (context.accept(TokenType.CARET)) {
                indexPosition = IndexPosition.UPPER;
            } else {
                context.expect(TokenType.UNDERSCORE);
                indexPosition = IndexPosition.LOWER;
            }
            derivativePositions.add(indexPosition);
            derivativeIndices.add(index(indexPosition));
        } while (startsCovariantDerivative());

        ParsedTensor operand = parsedTensor(true);
        List<Index> indices = new ArrayList<>(operand.ref().indices());
        indices.addAll(derivativeIndices);
        String name = operand.ref().name() + "_cd" + diacritic + TensorNames.suffix(derivativePositions);
        TensorOrigin origin = new TensorOrigin.Covariant(operand.ref().name(), operand.symbol().latex(),
                operand.ref().positions(), operand.commaOrder(), derivativePositions, diacritic,
                context.getSession().derivativeMode());
        return new TensorRef(name, indices, origin);
    }

    /**
     * Parses a partial derivative. Basis coordinates ({@code \partial_r}) always differentiate
     * symbolically; index labels do so in symbolic mode and yield derivative tensors in {@code _d}
     * mode. {@code \vphantom{_d}} or {@code \vphantom{symbolic}} in front selects the mode for
     * this operator only.
     * @return The derivative expression.
     */
    public Expr partialDerivative() {
        int position = context.peek().position();
        TranslationSession session = context.getSession();
        DerivativeMode mode = session.derivativeMode();
        if (context.accept(TokenType.VPHANTOM)) {
            context.expect(TokenType.LEFT_BRACE);
            mode = derivativeMode();
            context.expect(TokenType.RIGHT_BRACE);
        }

        List<Index> indices = new ArrayList<>();
        List<Symbol> coordinates = new ArrayList<>();
        do {
            context.expect(TokenType.PARTIAL);
            int order = 1;
            if (context.accept(TokenType.CARET)) {
                boolean braced = context.accept(TokenType.LEFT_BRACE);
                order = context.expectInteger();
                if (braced) {
                    context.expect(TokenType.RIGHT_BRACE);
                }
            }
            context.expect(TokenType.UNDERSCORE);
            Index index = index(IndexPosition.LOWER);
            for (int i = 0; i < order; i++) {
                if (index.isLabel() && session.isBasisSymbol(index.label())) {
                    coordinates.add(new Symbol(index.label()));
                } else {
                    indices.add(index);
                }
            }
        } while (context.check(TokenType.PARTIAL));

        Expr operand;
        boolean grouped = context.accept(TokenType.LEFT_PAREN);
        if (grouped) {
            operand = context.expressions().expression();
            context.expect(TokenType.RIGHT_PAREN);
        } else {
            operand = parsedTensor(true).ref();
        }

        Expr result = operand;
        if (!indices.isEmpty()) {
            if (mode == DerivativeMode.TENSOR) {
                result = operand instanceof TensorRef ref && !grouped
                        ? partialRef(ref, indices)
                        : TensorDifferentiator.differentiate(operand, indices);
            } else {
                if (session.basis().isEmpty()) {
                    throw new ParseException("cannot differentiate symbolically without basis", context.sentence(), position);
                }
                result = Expressions.derivative(operand, indices, List.of());
            }
        }
        if (!coordinates.isEmpty()) {
            result = Expressions.derivative(result, List.of(), coordinates);
        }
        return result;
    }

    /**
     * Parses a derivative mode literal: {@code symbolic} or {@code _d}.
     * @return The mode.
     */
    public DerivativeMode derivativeMode() {
        if (context.accept(TokenType.DERIV_TYPE)) {
            return DerivativeMode.SYMBOLIC;
        }
        if (context.check(TokenType.UNDERSCORE) && context.checkAhead(1, TokenType.LETTER)
                && context.peekAhead(1).text().equals("d")) {
            context.advance();
            context.advance();
            return DerivativeMode.TENSOR;
        }
        Token found = context.peek();
        throw new ParseException(String.format("expected token %s at position %d", TokenType.DERIV_TYPE, found.position()),
                context.sentence(), found.position());
    }

    /**
     * Parses a single index label, optionally braced.
     * @return The label without backslash, e.g. {@code mu}.
     */
    public String label() {
        boolean braced = context.accept(TokenType.LEFT_BRACE);
        String label = stripBackslash(context.expect(TokenType.LETTER).text());
        if (braced) {
            context.expect(TokenType.RIGHT_BRACE);
        }
        return label;
    }

    /**
     * Appends one derivative index to a tensor reference, naming the result like {@code vU_dD}.
     * @param operand The differentiated tensor.
     * @param indices The derivative indices.
     * @return The derivative tensor reference.
     */
    static TensorRef partialRef(TensorRef operand, List<Index> indices) {
        List<Index> combined = new ArrayList<>(operand.indices());
        combined.addAll(indices);
        TensorOrigin origin = operand.origin() instanceof TensorOrigin.Partial partial
                ? new TensorOrigin.Partial(partial.operandName(), partial.order() + indices.size())
                : new TensorOrigin.Partial(operand.name(), indices.size());
        return new TensorRef(TensorNames.partial(operand.name(), indices.size()), combined, origin);
    }

    private Index index(IndexPosition position) {
        boolean braced = context.accept(TokenType.LEFT_BRACE);
        Index index;
        if (context.check(TokenType.INTEGER)) {
            index = Index.concrete(position, context.expectInteger());
        } else {
            index = Index.labelled(position, stripBackslash(context.expect(TokenType.LETTER).text()));
        }
        if (braced) {
            context.expect(TokenType.RIGHT_BRACE);
        }
        return index;
    }

    /**
     * Reads the indices after a caret without failing.
     * @return The number of index items read (an integer counts as one item), 0 if the tokens
     *         do not form an index group.
     */
    private int upperGroup(List<Index> indices) {
        if (context.accept(TokenType.LEFT_BRACE)) {
            int items = 0;
            while (indexItem(IndexPosition.UPPER, indices)) {
                items++;
            }
            return items > 0 && context.accept(TokenType.RIGHT_BRACE) ? items : 0;
        }
        return indexItem(IndexPosition.UPPER, indices) ? 1 : 0;
    }

    /**
     * Reads the indices after an underscore, including comma-derivative indices.
     * @return The number of comma-derivative indices.
     */
    private int lowerGroup(List<Index> indices) {
        if (!context.accept(TokenType.LEFT_BRACE)) {
            if (!indexItem(IndexPosition.LOWER, indices)) {
                throw context.unexpected(context.peek());
            }
            return 0;
        }
        int before = indices.size();
        while (indexItem(IndexPosition.LOWER, indices)) {
            // collect
        }
        int commaOrder = 0;
        if (context.accept(TokenType.COMMA)) {
            int start = indices.size();
            while (indexItem(IndexPosition.LOWER, indices)) {
                // collect
            }
            commaOrder = indices.size() - start;
            if (commaOrder == 0) {
                throw context.unexpected(context.peek());
            }
        }
        if (indices.size() == before) {
            throw context.unexpected(context.peek());
        }
        context.expect(TokenType.RIGHT_BRACE);
        return commaOrder;
    }

    /**
     * Reads a label or an integer; every digit of an integer is one concrete index.
     */
    private boolean indexItem(IndexPosition position, List<Index> indices) {
        if (context.accept(TokenType.LETTER)) {
            indices.add(Index.labelled(position, stripBackslash(context.previous().text())));
            return true;
        }
        if (context.accept(TokenType.INTEGER)) {
            for (char digit : context.previous().text().toCharArray()) {
                indices.add(Index.concrete(position, digit - '0'));
            }
            return true;
        }
        return false;
    }

    private static List<IndexPosition> positions(List<Index> indices, int commaOrder) {
        return indices.subList(0, indices.size() - commaOrder).stream().map(Index::position).toList();
    }

    private static TensorRef build(String symbol, List<Index> indices, int commaOrder) {
        List<Index> own = indices.subList(0, indices.size() - commaOrder);
        String name = TensorNames.of(symbol, own.stream().map(Index::position).toList());
        if (commaOrder > 0) {
            return partialRef(new TensorRef(name, own, null), indices.subList(own.size(), indices.size()));
        }
        return new TensorRef(name, indices, christoffelOrigin(symbol, own));
    }

    private static TensorOrigin christoffelOrigin(String symbol, List<Index> indices) {
        if (!symbol.startsWith("Gamma")) {
            return null;
        }
        String diacritic = symbol.substring("Gamma".length());
        boolean connection = diacritic.isEmpty() || TensorNames.diacritic(symbol).equals(diacritic);
        if (connection && indices.stream().map(Index::position).toList().equals(CHRISTOFFEL)) {
            return new TensorOrigin.Christoffel(diacritic);
        }
        return null;
    }

    private static String stripBackslash(String text) {
        return text.startsWith("\\") ? text.substring(1) : text;
    }
}
