package org.tensorlatex.compiler.frontend.semantics.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.IndexRange;
import org.tensorlatex.compiler.frontend.semantics.Namespace;
import org.tensorlatex.compiler.frontend.semantics.Symmetry;
import org.tensorlatex.compiler.frontend.semantics.TensorDeclaration;
import org.tensorlatex.compiler.frontend.semantics.TensorKind;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.compiler.frontend.semantics.derived.DerivedObjectSynthesizer;
import org.tensorlatex.symbolic.Constant;
import org.tensorlatex.symbolic.Derivative;
import org.tensorlatex.symbolic.Expansion;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.FunctionCall;
import org.tensorlatex.symbolic.Index;
import org.tensorlatex.symbolic.Numeric;
import org.tensorlatex.symbolic.Power;
import org.tensorlatex.symbolic.Product;
import org.tensorlatex.symbolic.Rational;
import org.tensorlatex.symbolic.Sum;
import org.tensorlatex.symbolic.Symbol;
import org.tensorlatex.symbolic.SymbolDifferentiator;
import org.tensorlatex.symbolic.TensorRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the summation convention. An assignment is validated, then one component equation is
 * generated per combination of the target's free labels; pairs of bound labels become explicit
 * sums over their range. The target's symmetry is used to compute each independent component
 * only once.
 */
public class IndexEngine {

    private static final Logger log = LoggerFactory.getLogger(IndexEngine.class);

    private final DerivedObjectSynthesizer synthesizer;

    public IndexEngine(DerivedObjectSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Executes an assignment: every component of the target covered by its free labels is
     * computed, written into the namespace and recorded as a binding.
     * @param node    The assignment.
     * @param context The analysis context.
     * @throws TensorException if the equation violates the summation convention or refers to
     *                         unknown tensors.
     */
    public void assign(AssignmentNode node, AnalysisContext context) {
        TranslationSession session = context.session();
        TensorRef target = node.target();
        Expr value = node.value();

        resolve(value, context);
        if (target.rank() > 0 || isIndexed(value)) {
            value = Expansion.expand(value);
        }
        Set<IndexBalance.Occurrence> targetFree = IndexBalance.targetLabels(target);
        Set<IndexBalance.Occurrence> valueFree = IndexBalance.of(value, Set.of()).free();
        if (!value.isZero() && !valueFree.equals(targetFree)) {
            throw new TensorException("unbalanced free index");
        }

        Map<String, Integer> dimensions = labelDimensions(value, context);
        TensorDeclaration declaration = targetDeclaration(target, dimensions, context);
        for (Index index : target.indices()) {
            if (index.isLabel()) {
                mergeDimension(dimensions, index.label(), declaration.dimension());
            }
        }
        Map<String, IndexRange> ranges = ranges(value, target, dimensions, session);

        List<String> labels = new ArrayList<>();
        List<IndexRange> labelRanges = new ArrayList<>();
        for (IndexBalance.Occurrence occurrence : targetFree) {
            labels.add(occurrence.label());
            labelRanges.add(ranges.get(occurrence.label()));
        }

        Map<List<Integer>, Expr> canonicalValues = new HashMap<>();
        Map<List<Integer>, Expr> writes = new LinkedHashMap<>();
        for (int[] combination : TensorDeclaration.combinations(labelRanges)) {
            Map<String, Integer> bindings = new HashMap<>();
            for (int i = 0; i < labels.size(); i++) {
                bindings.put(labels.get(i), combination[i]);
            }
            int[] component = target.bind(bindings).components();
            checkRange(declaration, component);
            Symmetry.Canonical canonical = declaration.symmetry().canonicalize(component);
            Expr result;
            if (canonical.sign() == 0) {
                result = Rational.ZERO;
            } else {
                Expr canonicalValue = canonicalValues.get(canonical.key());
                if (canonicalValue == null) {
                    Expr computed = value.isZero() ? Rational.ZERO : evaluate(value, bindings, ranges, context);
                    canonicalValue = canonical.sign() > 0 ? computed : Expressions.negate(computed);
                    canonicalValues.put(canonical.key(), canonicalValue);
                }
                result = canonical.sign() > 0 ? canonicalValue : Expressions.negate(canonicalValue);
            }
            writes.put(Symmetry.Canonical.keyOf(component), result);
        }
        propagateToImages(declaration, writes);
        writes.forEach((component, result) -> context.bind(declaration.componentName(toArray(component)), result));

        session.metricNamed(target.name()).ifPresent(metric -> synthesizer.invalidate(metric, session));
        if (target.indices().stream().allMatch(Index::isLabel)) {
            session.recordDefiningEquation(target.name(), node);
        }
        log.debug("Assigned {} component(s) of {}", writes.size(), target.name());
    }

    /**
     * Evaluates an expression in which every index label is contracted.
     * @param expr    The parsed expression.
     * @param context The analysis context.
     * @return The value with all sums expanded.
     * @throws TensorException {@code free index in expression} if a label is left free.
     */
    public Expr evaluate(Expr expr, AnalysisContext context) {
        resolve(expr, context);
        Expr value = isIndexed(expr) ? Expansion.expand(expr) : expr;
        Set<IndexBalance.Occurrence> free = IndexBalance.of(value, Set.of()).free();
        if (!free.isEmpty()) {
            throw new TensorException(String.format("free index in expression: '%s'", free.iterator().next().label()));
        }
        Map<String, IndexRange> ranges = ranges(value, null, labelDimensions(value, context), context.session());
        return evaluate(value, Map.of(), ranges, context);
    }

    private Expr evaluate(Expr expr, Map<String, Integer> bindings, Map<String, IndexRange> ranges,
                          AnalysisContext context) {
        if (expr instanceof Numeric || expr instanceof Constant || expr instanceof Symbol) {
            return expr;
        }
        if (expr instanceof Sum sum) {
            List<Expr> terms = new ArrayList<>(sum.terms().size());
            for (Expr term : sum.terms()) {
                terms.add(evaluate(term, bindings, ranges, context));
            }
            return Expressions.add(terms);
        }
        List<String> bound = new ArrayList<>(IndexBalance.of(expr, bindings.keySet()).bound());
        if (bound.isEmpty()) {
            return evaluateNode(expr, bindings, ranges, context);
        }
        List<IndexRange> boundRanges = bound.stream().map(ranges::get).toList();
        List<Expr> terms = new ArrayList<>();
        for (int[] combination : TensorDeclaration.combinations(boundRanges)) {
            Map<String, Integer> inner = new HashMap<>(bindings);
            for (int i = 0; i < bound.size(); i++) {
                inner.put(bound.get(i), combination[i]);
            }
            terms.add(evaluateNode(expr, inner, ranges, context));
        }
        return Expressions.add(terms);
    }

    private Expr evaluateNode(Expr expr, Map<String, Integer> bindings, Map<String, IndexRange> ranges,
                              AnalysisContext context) {
        if (expr instanceof TensorRef ref) {
            return lookup(ref.bind(bindings), context);
        }
        if (expr instanceof Product product) {
            List<Expr> factors = new ArrayList<>(product.factors().size());
            for (Expr factor : product.factors()) {
                factors.add(evaluate(factor, bindings, ranges, context));
            }
            return Expressions.multiply(factors);
        }
        if (expr instanceof Power power) {
            return Expressions.power(evaluate(power.base(), bindings, ranges, context),
                    evaluate(power.exponent(), bindings, ranges, context));
        }
        if (expr instanceof FunctionCall call) {
            return Expressions.function(call.function(), evaluate(call.argument(), bindings, ranges, context));
        }
        if (expr instanceof Derivative derivative) {
            return differentiate(derivative, bindings, ranges, context);
        }
        return evaluate(expr, bindings, ranges, context);
    }

    private Expr differentiate(Derivative derivative, Map<String, Integer> bindings, Map<String, IndexRange> ranges,
                               AnalysisContext context) {
        List<Symbol> basis = context.session().basis();
        Expr result = evaluate(derivative.operand(), bindings, ranges, context);
        for (Index index : derivative.indices()) {
            int coordinate = index.isLabel() ? bindings.get(index.label()) : index.value();
            if (basis.isEmpty()) {
                throw new TensorException("cannot differentiate symbolically without basis");
            }
            if (coordinate >= basis.size()) {
                throw new TensorException(String.format("basis has no coordinate for index %d", coordinate));
            }
            result = SymbolDifferentiator.diff(result, basis.get(coordinate));
        }
        for (Symbol coordinate : derivative.coordinates()) {
            result = SymbolDifferentiator.diff(result, coordinate);
        }
        return result;
    }

    /**
     * Reads the value of a reference whose indices are all concrete.
     */
    private Expr lookup(TensorRef ref, AnalysisContext context) {
        Namespace namespace = context.session().namespace();
        if (ref.rank() == 0) {
            if (!namespace.hasValue(ref.name()) && synthesizer.canDerive(ref, context.session())) {
                synthesizer.derive(ref, context);
            }
            return namespace.value(ref.name()).orElseGet(() -> new Symbol(ref.name()));
        }
        TensorDeclaration declaration = namespace.declaration(ref.name())
                .orElseThrow(() -> new TensorException(String.format("undefined tensor '%s'", ref.name())));
        int[] component = ref.components();
        checkRange(declaration, component);
        return namespace.value(declaration.componentName(component)).orElse(Rational.ZERO);
    }

    /**
     * Makes sure every tensor referenced in an expression is declared, deriving missing ones.
     */
    private void resolve(Expr expr, AnalysisContext context) {
        List<TensorRef> refs = new ArrayList<>();
        Expressions.walk(expr, node -> {
            if (node instanceof TensorRef ref && ref.rank() > 0) {
                refs.add(ref);
            }
        });
        for (TensorRef ref : refs) {
            TranslationSession session = context.session();
            if (session.namespace().isDeclared(ref.name())) {
                continue;
            }
            if (!synthesizer.canDerive(ref, session)) {
                throw new TensorException(String.format("undefined tensor '%s'", ref.name()));
            }
            synthesizer.derive(ref, context);
        }
    }

    private TensorDeclaration targetDeclaration(TensorRef target, Map<String, Integer> dimensions,
                                                AnalysisContext context) {
        TranslationSession session = context.session();
        Namespace namespace = session.namespace();
        TensorDeclaration existing = namespace.declaration(target.name()).orElse(null);
        if (existing != null) {
            return existing;
        }
        int dimension = 0;
        if (target.rank() > 0) {
            for (Index index : target.indices()) {
                if (index.isLabel() && dimensions.containsKey(index.label())) {
                    dimension = dimensions.get(index.label());
                    break;
                }
            }
            if (dimension == 0) {
                dimension = session.defaultDimension();
            }
            if (dimension == 0) {
                throw new TensorException(String.format("cannot infer dimension of '%s'", target.name()));
            }
        }
        TensorDeclaration declaration = new TensorDeclaration(target.name(), target.positions(), dimension,
                Symmetry.NONE, TensorKind.COMPUTED);
        namespace.declare(declaration);
        for (int[] component : declaration.components()) {
            namespace.put(declaration.componentName(component), Rational.ZERO);
        }
        log.debug("Declared {} with dimension {} from its first assignment", target.name(), dimension);
        return declaration;
    }

    /**
     * Collects the dimension every label ranges over from the tensors it indexes.
     * @throws TensorException {@code dimension mismatch for index 'a'} if they disagree.
     */
    private Map<String, Integer> labelDimensions(Expr value, AnalysisContext context) {
        TranslationSession session = context.session();
        Map<String, Integer> dimensions = new HashMap<>();
        Expressions.walk(value, node -> {
            if (node instanceof TensorRef ref && ref.rank() > 0) {
                int dimension = session.namespace().declaration(ref.name()).map(TensorDeclaration::dimension).orElse(0);
                for (Index index : ref.indices()) {
                    if (index.isLabel() && dimension > 0) {
                        mergeDimension(dimensions, index.label(), dimension);
                    }
                }
            } else if (node instanceof Derivative derivative && !session.basis().isEmpty()) {
                for (Index index : derivative.indices()) {
                    if (index.isLabel()) {
                        mergeDimension(dimensions, index.label(), session.basis().size());
                    }
                }
            }
        });
        return dimensions;
    }

    private static void mergeDimension(Map<String, Integer> dimensions, String label, int dimension) {
        Integer known = dimensions.putIfAbsent(label, dimension);
        if (known != null && known != dimension) {
            throw new TensorException(String.format("dimension mismatch for index '%s'", label));
        }
    }

    private static Map<String, IndexRange> ranges(Expr value, TensorRef target, Map<String, Integer> dimensions,
                                                  TranslationSession session) {
        List<String> labels = new ArrayList<>();
        if (target != null) {
            target.indices().stream().filter(Index::isLabel).forEach(index -> labels.add(index.label()));
        }
        Expressions.walk(value, node -> {
            List<Index> indices = node instanceof TensorRef ref ? ref.indices()
                    : node instanceof Derivative derivative ? derivative.indices() : List.of();
            indices.stream().filter(Index::isLabel).forEach(index -> labels.add(index.label()));
        });
        Map<String, IndexRange> ranges = new HashMap<>();
        for (String label : labels) {
            if (ranges.containsKey(label)) {
                continue;
            }
            IndexRange range = session.indexRange(label).orElse(null);
            if (range == null) {
                int dimension = dimensions.getOrDefault(label, session.defaultDimension());
                if (dimension == 0) {
                    throw new TensorException(String.format("cannot determine the range of index '%s'", label));
                }
                range = IndexRange.of(dimension);
            }
            ranges.put(label, range);
        }
        return ranges;
    }

    private static void propagateToImages(TensorDeclaration declaration, Map<List<Integer>, Expr> writes) {
        if (declaration.symmetry().isNone()) {
            return;
        }
        Map<List<Integer>, Expr> images = new LinkedHashMap<>();
        writes.forEach((component, result) -> {
            Symmetry.Canonical canonical = declaration.symmetry().canonicalize(toArray(component));
            if (canonical.sign() == 0) {
                return;
            }
            Expr canonicalValue = canonical.sign() > 0 ? result : Expressions.negate(result);
            for (Symmetry.Canonical image : declaration.symmetry().images(canonical.indices())) {
                if (!writes.containsKey(image.key())) {
                    images.put(image.key(), image.sign() > 0 ? canonicalValue : Expressions.negate(canonicalValue));
                }
            }
        });
        writes.putAll(images);
    }

    private static void checkRange(TensorDeclaration declaration, int[] component) {
        for (int value : component) {
            if (value >= declaration.dimension()) {
                throw new TensorException(String.format("index %d out of range for '%s' of dimension %d",
                        value, declaration.name(), declaration.dimension()));
            }
        }
    }

    private static boolean isIndexed(Expr expr) {
        boolean[] indexed = {false};
        Expressions.walk(expr, node -> {
            if (node instanceof TensorRef ref && ref.rank() > 0
                    || node instanceof Derivative derivative && !derivative.indices().isEmpty()) {
                indexed[0] = true;
            }
        });
        return indexed[0];
    }

    private static int[] toArray(List<Integer> component) {
        return component.stream().mapToInt(Integer::intValue).toArray();
    }
}
