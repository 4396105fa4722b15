package ir;

public class ConstantInt extends Constant {

    // Sign-extended to 64 bits.
    private final long value;

    public ConstantInt(IrType type, long value) {
        super(type);
        if (!type.isIntegerTy()) {
            throw new IllegalArgumentException("ConstantInt needs an integer type, got " + type);
        }
        this.value = value;
    }

    public long getSExtValue() {
        return value;
    }

    @Override
    public boolean sameValue(Constant other) {
        return other instanceof ConstantInt c && c.getType().equals(getType()) && c.value == value;
    }

    @Override
    public String toString() {
        if (getType().isBoolTy()) {
            return "i1 " + (value != 0);
        }
        return getType() + " " + value;
    }
}
