package solver;

/**
 * An instruction, operand type or call target without modelled semantics, or
 * a failure inside the solver itself.
 */
public class UnsupportedSmtOperationException extends SmtComparisonException {

    public UnsupportedSmtOperationException(String message) {
        super(message);
    }

    public UnsupportedSmtOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Category getCategory() {
        return Category.UNSUPPORTED_CONSTRUCT;
    }
}
