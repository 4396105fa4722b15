package Engine;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPExpr;
import com.microsoft.z3.FPSort;
import com.microsoft.z3.Sort;
import ir.IrType;
import solver.UnsupportedSmtOperationException;

public class TypeUtils {

    // IEEE-754 binary32 / binary64 exponent and significand widths
    public static final int FLOAT_EBITS = 8;
    public static final int FLOAT_SBITS = 24;
    public static final int DOUBLE_EBITS = 11;
    public static final int DOUBLE_SBITS = 53;

    public static boolean isSupportedType(IrType type) {
        return type.isIntegerTy() || type.isFloatingPointTy();
    }

    public static FPSort fpSort(Context ctx, IrType type) {
        if (type.isFloatTy()) {
            return ctx.mkFPSort(FLOAT_EBITS, FLOAT_SBITS);
        }
        if (type.isDoubleTy()) {
            return ctx.mkFPSort(DOUBLE_EBITS, DOUBLE_SBITS);
        }
        throw new UnsupportedSmtOperationException("Not a floating point type: " + type);
    }

    public static FPSort doubleSort(Context ctx) {
        return ctx.mkFPSort(DOUBLE_EBITS, DOUBLE_SBITS);
    }

    public static Sort sortOf(Context ctx, IrType type) {
        if (type.isBoolTy()) {
            return ctx.getBoolSort();
        }
        if (type.isIntegerTy()) {
            return ctx.mkBitVecSort(type.getIntegerBitWidth());
        }
        if (type.isFloatingPointTy()) {
            return fpSort(ctx, type);
        }
        throw new UnsupportedSmtOperationException("Unsupported operand type " + type);
    }

    public static BitVecExpr asBV(Expr expr) {
        if (expr instanceof BitVecExpr bv) {
            return bv;
        }
        throw new UnsupportedSmtOperationException("Expected a bit-vector term but got " + describe(expr));
    }

    public static FPExpr asFP(Expr expr) {
        if (expr instanceof FPExpr fp) {
            return fp;
        }
        throw new UnsupportedSmtOperationException("Expected a floating point term but got " + describe(expr));
    }

    public static BoolExpr asBool(Expr expr) {
        if (expr instanceof BoolExpr b) {
            return b;
        }
        throw new UnsupportedSmtOperationException("Expected a boolean term but got " + describe(expr));
    }

    private static String describe(Expr expr) {
        return expr == null ? "null" : expr + " of sort " + expr.getSort();
    }
}
