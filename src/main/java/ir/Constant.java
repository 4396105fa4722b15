package ir;

public abstract class Constant extends Value {

    protected Constant(IrType type) {
        super(type, null);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    /**
     * Structural equality of two literals, used by comparators that match
     * constants by value rather than by identity.
     */
    public abstract boolean sameValue(Constant other);
}
