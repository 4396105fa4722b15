package Engine;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPRMExpr;
import com.microsoft.z3.FPSort;
import ir.Constant;
import ir.ConstantFP;
import ir.ConstantInt;
import ir.Instruction;
import ir.IrType;
import ir.Opcode;
import ir.Value;
import solver.UnsupportedSmtOperationException;

/**
 * Turns IR operands into solver terms.
 */
public class Expression {

    public static Expr makeSymbol(Context ctx, IrType type, String name) {
        return ctx.mkConst(name, TypeUtils.sortOf(ctx, type));
    }

    public static Expr makeConstant(Context ctx, Constant constant) {
        IrType type = constant.getType();
        if (constant instanceof ConstantInt intConst) {
            long value = intConst.getSExtValue();
            if (type.isBoolTy()) {
                return ctx.mkBool(value != 0);
            }
            int width = type.getIntegerBitWidth();
            if (width > 64 && value < 0) {
                // mkBV(long) does not sign-extend past 64 bits
                return ctx.mkSignExt(width - 64, ctx.mkBV(value, 64));
            }
            return ctx.mkBV(value, width);
        }
        if (constant instanceof ConstantFP fpConst) {
            FPSort sort = TypeUtils.fpSort(ctx, type);
            double value = fpConst.getValue();
            if (Double.isNaN(value)) {
                return ctx.mkFPNaN(sort);
            }
            if (Double.isInfinite(value)) {
                return ctx.mkFPInf(sort, value < 0);
            }
            if (type.isFloatTy()) {
                return ctx.mkFP((float) value, sort);
            }
            return ctx.mkFP(value, sort);
        }
        throw new UnsupportedSmtOperationException("Unsupported constant type " + type);
    }

    /**
     * Constants become literals; every other value becomes a free variable
     * named {@code prefix + id}, so the two sides never share a variable.
     */
    public static Expr makeExpr(Context ctx, String prefix, Value value) {
        if (value instanceof Constant constant) {
            return makeConstant(ctx, constant);
        }
        return makeSymbol(ctx, value.getType(), prefix + value.getId());
    }

    /**
     * Equality of two terms; terms of different sorts can never be equal.
     */
    public static BoolExpr makeEquality(Context ctx, Expr left, Expr right) {
        if (!left.getSort().equals(right.getSort())) {
            return ctx.mkFalse();
        }
        return ctx.mkEq(left, right);
    }

    public static Expr makeCastExpr(Context ctx, Instruction inst, Expr src, Expr res) {
        IrType srcTy = inst.getSrcTy();
        IrType destTy = inst.getDestTy();
        FPRMExpr nearestEven = ctx.mkFPRoundNearestTiesToEven();
        switch (inst.getOpcode()) {
            case ZEXT:
            case SEXT: {
                int bits = destTy.getIntegerBitWidth() - srcTy.getIntegerBitWidth();
                if (srcTy.isBoolTy()) {
                    long whenTrue = inst.getOpcode() == Opcode.SEXT ? -1L : 1L;
                    return ctx.mkITE(TypeUtils.asBool(src),
                            makeConstant(ctx, new ConstantInt(destTy, whenTrue)),
                            makeConstant(ctx, new ConstantInt(destTy, 0)));
                }
                BitVecExpr bv = TypeUtils.asBV(src);
                return inst.getOpcode() == Opcode.ZEXT ? ctx.mkZeroExt(bits, bv) : ctx.mkSignExt(bits, bv);
            }
            case TRUNC: {
                BitVecExpr extract = ctx.mkExtract(destTy.getIntegerBitWidth() - 1, 0, TypeUtils.asBV(src));
                if (destTy.isBoolTy()) {
                    return ctx.mkEq(extract, ctx.mkBV(1, 1));
                }
                return extract;
            }
            case FPTRUNC:
            case FPEXT:
                return ctx.mkFPToFP(nearestEven, TypeUtils.asFP(src), TypeUtils.asFP(res).getSort());
            case FPTOUI:
            case FPTOSI: {
                BitVecExpr bv = ctx.mkFPToBV(ctx.mkFPRoundTowardZero(), TypeUtils.asFP(src),
                        destTy.getIntegerBitWidth(), inst.getOpcode() == Opcode.FPTOSI);
                if (destTy.isBoolTy()) {
                    return ctx.mkEq(bv, ctx.mkBV(1, 1));
                }
                return bv;
            }
            case UITOFP:
                return ctx.mkFPToFP(nearestEven, TypeUtils.asBV(src), TypeUtils.asFP(res).getSort(), false);
            case SITOFP:
                return ctx.mkFPToFP(nearestEven, TypeUtils.asBV(src), TypeUtils.asFP(res).getSort(), true);
            default:
                throw new UnsupportedSmtOperationException("Unsupported cast " + inst);
        }
    }
}
