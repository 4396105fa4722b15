package solver;

public class OutOfTimeException extends SmtComparisonException {

    public OutOfTimeException(String message) {
        super(message);
    }

    @Override
    public Category getCategory() {
        return Category.SOLVER_TIMEOUT;
    }
}
