package solver;

/**
 * Base of the fatal conditions that end an SMT snippet comparison. The
 * category tells the outer tool how to report the failure.
 */
public abstract class SmtComparisonException extends RuntimeException {

    public enum Category {
        STRUCTURAL_MISMATCH,
        UNSUPPORTED_CONSTRUCT,
        SOLVER_TIMEOUT
    }

    protected SmtComparisonException(String message) {
        super(message);
    }

    protected SmtComparisonException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Category getCategory();
}
