package ir;

import java.util.Objects;

/**
 * Static type of an IR value. Integers of width 1 are booleans.
 */
public final class IrType {

    public enum Kind {
        VOID,
        INTEGER,
        FLOAT,
        DOUBLE,
        POINTER,
        LABEL
    }

    public static final IrType VOID = new IrType(Kind.VOID, 0);
    public static final IrType I1 = new IrType(Kind.INTEGER, 1);
    public static final IrType I8 = new IrType(Kind.INTEGER, 8);
    public static final IrType I16 = new IrType(Kind.INTEGER, 16);
    public static final IrType I32 = new IrType(Kind.INTEGER, 32);
    public static final IrType I64 = new IrType(Kind.INTEGER, 64);
    public static final IrType FLOAT = new IrType(Kind.FLOAT, 32);
    public static final IrType DOUBLE = new IrType(Kind.DOUBLE, 64);
    public static final IrType PTR = new IrType(Kind.POINTER, 64);
    public static final IrType LABEL = new IrType(Kind.LABEL, 0);

    private final Kind kind;
    private final int width;

    private IrType(Kind kind, int width) {
        this.kind = kind;
        this.width = width;
    }

    public static IrType intTy(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Integer width must be positive: " + width);
        }
        switch (width) {
            case 1:
                return I1;
            case 8:
                return I8;
            case 16:
                return I16;
            case 32:
                return I32;
            case 64:
                return I64;
            default:
                return new IrType(Kind.INTEGER, width);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isIntegerTy() {
        return kind == Kind.INTEGER;
    }

    public boolean isBoolTy() {
        return kind == Kind.INTEGER && width == 1;
    }

    public boolean isFloatTy() {
        return kind == Kind.FLOAT;
    }

    public boolean isDoubleTy() {
        return kind == Kind.DOUBLE;
    }

    public boolean isFloatingPointTy() {
        return kind == Kind.FLOAT || kind == Kind.DOUBLE;
    }

    public int getIntegerBitWidth() {
        if (kind != Kind.INTEGER) {
            throw new IllegalStateException("Not an integer type: " + this);
        }
        return width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IrType)) {
            return false;
        }
        IrType other = (IrType) o;
        return kind == other.kind && width == other.width;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, width);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INTEGER:
                return "i" + width;
            case FLOAT:
                return "float";
            case DOUBLE:
                return "double";
            case POINTER:
                return "ptr";
            case LABEL:
                return "label";
            default:
                return "void";
        }
    }
}
