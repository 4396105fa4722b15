package ir;

public class ConstantFP extends Constant {

    private final double value;

    public ConstantFP(IrType type, double value) {
        super(type);
        if (!type.isFloatingPointTy()) {
            throw new IllegalArgumentException("ConstantFP needs a floating point type, got " + type);
        }
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean sameValue(Constant other) {
        return other instanceof ConstantFP c && c.getType().equals(getType())
                && Double.doubleToRawLongBits(c.value) == Double.doubleToRawLongBits(value);
    }

    @Override
    public String toString() {
        return getType() + " " + value;
    }
}
