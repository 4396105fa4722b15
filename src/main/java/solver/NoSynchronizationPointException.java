package solver;

public class NoSynchronizationPointException extends SmtComparisonException {

    public NoSynchronizationPointException(String message) {
        super(message);
    }

    @Override
    public Category getCategory() {
        return Category.STRUCTURAL_MISMATCH;
    }
}
