package org.tensorlatex.compiler.diagnostics;

/**
 * Raised on a tensor-semantic violation: illegal bound or unbalanced free indices,
 * inconsistent dimensions, undefined tensors or an undefined metric.
 * <p>
 * The index engine usually does not know where in the sentence the violation sits; the
 * translator attaches the position of the enclosing structure with {@link #locate}.
 */
public class TensorException extends LatexException {

    private final boolean generated;

    public TensorException(String message) {
        super(message, null, -1);
        this.generated = false;
    }

    public TensorException(String message, String sentence, int position) {
        super(message, sentence, position);
        this.generated = false;
    }

    private TensorException(TensorException unlocated, String sentence, int position) {
        super(unlocated.getMessage(), sentence, position, unlocated);
        this.generated = unlocated.generated;
    }

    private TensorException(String message, LatexException cause) {
        super(message, null, -1, cause);
        this.generated = true;
    }

    /**
     * Wraps an error raised while running an equation generated during synthesis. The result
     * carries no position, so it is located at the user's structure that asked for the object.
     * @param cause    The error, located in the generated equation.
     * @param equation The generated equation.
     * @return An unlocated error naming the generated equation once, however deep the nesting.
     */
    public static TensorException inGeneratedEquation(LatexException cause, String equation) {
        if (cause instanceof TensorException tensor && tensor.generated) {
            return new TensorException(tensor.getMessage(), cause);
        }
        return new TensorException(String.format("%s in generated equation '%s'", cause.getMessage(), equation), cause);
    }

    /**
     * Attaches a position to an error raised without one.
     * @param sentence The sentence being translated.
     * @param position The start of the enclosing structure.
     * @return This exception if it is already located, otherwise a located copy.
     */
    public TensorException locate(String sentence, int position) {
        if (position() >= 0 || sentence() != null) {
            return this;
        }
        return new TensorException(this, sentence, position);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.TENSOR_ERROR;
    }
}
