package Engine;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPExpr;
import com.microsoft.z3.FPRMExpr;
import com.microsoft.z3.FPSort;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Solver;
import ir.CmpPredicate;
import ir.Instruction;
import ir.IrType;
import ir.Opcode;
import ir.Value;
import module.ValuePair;
import solver.UnsupportedSmtOperationException;
import utils.Log;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Encodes instructions of one snippet into a shared solver. Every encoded
 * instruction contributes exactly one assertion relating its result variable
 * to its operands; debug-info instructions contribute nothing.
 */
public class SmtEncoder {

    public static final String LEFT_PREFIX = "L_";
    public static final String RIGHT_PREFIX = "R_";

    private final Context ctx;
    private final Solver solver;
    private final Set<Integer> seededSerials = new HashSet<>();
    private int assertionCount;

    public SmtEncoder(Context ctx, Solver solver) {
        this.ctx = ctx;
        this.solver = solver;
    }

    public int getAssertionCount() {
        return assertionCount;
    }

    /**
     * Asserts that operands of {@code inst} already matched by the outer
     * comparator are equal across the two sides.
     *
     * @param snMap serial numbers of the side {@code inst} belongs to
     */
    public void mapOperands(Instruction inst, Map<Value, Integer> snMap, Map<Integer, ValuePair> mappedValuesBySn) {
        for (Value op : inst.getOperands()) {
            Integer serialNumber = snMap.get(op);
            if (serialNumber == null || seededSerials.contains(serialNumber)) {
                continue;
            }
            ValuePair values = mappedValuesBySn.get(serialNumber);
            if (values == null) {
                continue;
            }
            IrType leftTy = values.getLeft().getType();
            if (!leftTy.equals(values.getRight().getType()) || !TypeUtils.isSupportedType(leftTy)) {
                Log.debug("Not seeding input pair " + values + " of differing or opaque types");
                continue;
            }
            Expr left = Expression.makeExpr(ctx, LEFT_PREFIX, values.getLeft());
            Expr right = Expression.makeExpr(ctx, RIGHT_PREFIX, values.getRight());
            solver.add(ctx.mkEq(left, right));
            seededSerials.add(serialNumber);
        }
    }

    public void encodeInstruction(String prefix, Instruction inst) {
        if (inst.isDebugInfo()) {
            return;
        }
        Expr res = Expression.makeExpr(ctx, prefix, inst);
        BoolExpr e;
        switch (inst.getOpcode().getKind()) {
            case BINARY:
                e = encodeBinaryOperator(prefix, res, inst);
                break;
            case UNARY:
                e = encodeUnaryOperator(prefix, res, inst);
                break;
            case COMPARE:
                e = encodeCmpInstruction(prefix, res, inst);
                break;
            case CAST:
                e = encodeCastInstruction(prefix, res, inst);
                break;
            case CALL:
                e = encodeFunctionCall(prefix, res, inst);
                break;
            case SELECT:
                e = encodeSelect(prefix, res, inst);
                break;
            default:
                throw new UnsupportedSmtOperationException("Unsupported instruction with opcode " + inst.getOpcode().mnemonic());
        }
        solver.add(e);
        assertionCount++;
    }

    private Expr operand(String prefix, Instruction inst, int i) {
        return Expression.makeExpr(ctx, prefix, inst.getOperand(i));
    }

    private FPRMExpr roundingMode() {
        return ctx.mkFPRoundNearestTiesToEven();
    }

    private BoolExpr encodeUnaryOperator(String prefix, Expr res, Instruction inst) {
        if (inst.getOpcode() == Opcode.FNEG) {
            return ctx.mkEq(res, ctx.mkFPNeg(TypeUtils.asFP(operand(prefix, inst, 0))));
        }
        throw new UnsupportedSmtOperationException("Unsupported unary operator " + inst.getOpcode().mnemonic());
    }

    private BoolExpr encodeCmpInstruction(String prefix, Expr res, Instruction inst) {
        Expr op1 = operand(prefix, inst, 0);
        Expr op2 = operand(prefix, inst, 1);
        CmpPredicate predicate = inst.getPredicate();
        if (predicate == null) {
            throw new UnsupportedSmtOperationException("Comparison without predicate: " + inst);
        }
        BoolExpr e;
        if (predicate.isIntPredicate()) {
            e = encodeIntPredicate(predicate, op1, op2);
        } else {
            e = encodeFPPredicate(predicate, op1, op2);
        }
        return ctx.mkEq(res, e);
    }

    // Signedness is part of the predicate; pick the matching bit-vector primitive.
    private BoolExpr encodeIntPredicate(CmpPredicate predicate, Expr op1, Expr op2) {
        switch (predicate) {
            case ICMP_EQ:
                return ctx.mkEq(op1, op2);
            case ICMP_NE:
                return ctx.mkNot(ctx.mkEq(op1, op2));
            default:
                break;
        }
        BitVecExpr a = TypeUtils.asBV(op1);
        BitVecExpr b = TypeUtils.asBV(op2);
        switch (predicate) {
            case ICMP_UGE:
                return ctx.mkBVUGE(a, b);
            case ICMP_SGE:
                return ctx.mkBVSGE(a, b);
            case ICMP_ULE:
                return ctx.mkBVULE(a, b);
            case ICMP_SLE:
                return ctx.mkBVSLE(a, b);
            case ICMP_UGT:
                return ctx.mkBVUGT(a, b);
            case ICMP_SGT:
                return ctx.mkBVSGT(a, b);
            case ICMP_ULT:
                return ctx.mkBVULT(a, b);
            case ICMP_SLT:
                return ctx.mkBVSLT(a, b);
            default:
                throw new UnsupportedSmtOperationException("Unsupported integer predicate " + predicate);
        }
    }

    private BoolExpr encodeFPPredicate(CmpPredicate predicate, Expr op1, Expr op2) {
        if (predicate == CmpPredicate.FCMP_TRUE) {
            return ctx.mkTrue();
        }
        if (predicate == CmpPredicate.FCMP_FALSE) {
            return ctx.mkFalse();
        }
        FPExpr a = TypeUtils.asFP(op1);
        FPExpr b = TypeUtils.asFP(op2);
        BoolExpr anyNaN = ctx.mkOr(ctx.mkFPIsNaN(a), ctx.mkFPIsNaN(b));
        BoolExpr noNaN = ctx.mkNot(anyNaN);
        switch (predicate) {
            case FCMP_ORD:
                return noNaN;
            case FCMP_UNO:
                return anyNaN;
            case FCMP_OEQ:
                return ctx.mkAnd(noNaN, ctx.mkFPEq(a, b));
            case FCMP_UEQ:
                return ctx.mkOr(anyNaN, ctx.mkFPEq(a, b));
            case FCMP_ONE:
                return ctx.mkAnd(noNaN, ctx.mkNot(ctx.mkFPEq(a, b)));
            case FCMP_UNE:
                return ctx.mkOr(anyNaN, ctx.mkNot(ctx.mkFPEq(a, b)));
            case FCMP_OGE:
                return ctx.mkAnd(noNaN, ctx.mkFPGEq(a, b));
            case FCMP_UGE:
                return ctx.mkOr(anyNaN, ctx.mkFPGEq(a, b));
            case FCMP_OLE:
                return ctx.mkAnd(noNaN, ctx.mkFPLEq(a, b));
            case FCMP_ULE:
                return ctx.mkOr(anyNaN, ctx.mkFPLEq(a, b));
            case FCMP_OGT:
                return ctx.mkAnd(noNaN, ctx.mkFPGt(a, b));
            case FCMP_UGT:
                return ctx.mkOr(anyNaN, ctx.mkFPGt(a, b));
            case FCMP_OLT:
                return ctx.mkAnd(noNaN, ctx.mkFPLt(a, b));
            case FCMP_ULT:
                return ctx.mkOr(anyNaN, ctx.mkFPLt(a, b));
            default:
                throw new UnsupportedSmtOperationException("Unsupported floating point predicate " + predicate);
        }
    }

    private BoolExpr encodeCastInstruction(String prefix, Expr res, Instruction inst) {
        Expr op = operand(prefix, inst, 0);
        return ctx.mkEq(res, Expression.makeCastExpr(ctx, inst, op, res));
    }

    private BoolExpr encodeBinaryOperator(String prefix, Expr res, Instruction inst) {
        Expr op1 = operand(prefix, inst, 0);
        Expr op2 = operand(prefix, inst, 1);
        if (inst.getType().isBoolTy()) {
            return ctx.mkEq(res, encodeBoolOperator(inst, TypeUtils.asBool(op1), TypeUtils.asBool(op2)));
        }
        switch (inst.getOpcode()) {
            case ADD:
            case SUB:
            case MUL:
            case SHL:
                return encodeOverflowingBinaryOperator(res, inst, TypeUtils.asBV(op1), TypeUtils.asBV(op2));
            case FADD:
                return ctx.mkEq(res, ctx.mkFPAdd(roundingMode(), TypeUtils.asFP(op1), TypeUtils.asFP(op2)));
            case FSUB:
                return ctx.mkEq(res, ctx.mkFPSub(roundingMode(), TypeUtils.asFP(op1), TypeUtils.asFP(op2)));
            case FMUL:
                return ctx.mkEq(res, ctx.mkFPMul(roundingMode(), TypeUtils.asFP(op1), TypeUtils.asFP(op2)));
            case FDIV:
                return ctx.mkEq(res, ctx.mkFPDiv(roundingMode(), TypeUtils.asFP(op1), TypeUtils.asFP(op2)));
            case FREM:
                // frem truncates like fmod, the solver's fp.rem rounds to nearest
                throw new UnsupportedSmtOperationException("Unsupported binary operator frem");
            default:
                break;
        }
        BitVecExpr a = TypeUtils.asBV(op1);
        BitVecExpr b = TypeUtils.asBV(op2);
        switch (inst.getOpcode()) {
            case SDIV: {
                BoolExpr div = ctx.mkEq(res, ctx.mkBVSDiv(a, b));
                if (inst.isExact()) {
                    // inexact "exact" division leaves the result undefined
                    return ctx.mkImplies(ctx.mkEq(ctx.mkBVSRem(a, b), zero(a)), div);
                }
                return div;
            }
            case UDIV: {
                BoolExpr div = ctx.mkEq(res, ctx.mkBVUDiv(a, b));
                if (inst.isExact()) {
                    return ctx.mkImplies(ctx.mkEq(ctx.mkBVURem(a, b), zero(a)), div);
                }
                return div;
            }
            case SREM:
                return ctx.mkEq(res, ctx.mkBVSRem(a, b));
            case UREM:
                return ctx.mkEq(res, ctx.mkBVURem(a, b));
            case ASHR:
                return ctx.mkEq(res, ctx.mkBVASHR(a, b));
            case LSHR:
                return ctx.mkEq(res, ctx.mkBVLSHR(a, b));
            case AND:
                return ctx.mkEq(res, ctx.mkBVAND(a, b));
            case OR:
                return ctx.mkEq(res, ctx.mkBVOR(a, b));
            case XOR:
                return ctx.mkEq(res, ctx.mkBVXOR(a, b));
            default:
                throw new UnsupportedSmtOperationException("Unsupported binary operator " + inst.getOpcode().mnemonic());
        }
    }

    // i1 arithmetic wraps modulo 2
    private BoolExpr encodeBoolOperator(Instruction inst, BoolExpr a, BoolExpr b) {
        switch (inst.getOpcode()) {
            case AND:
            case MUL:
                return ctx.mkAnd(a, b);
            case OR:
                return ctx.mkOr(a, b);
            case XOR:
            case ADD:
            case SUB:
                return ctx.mkXor(a, b);
            default:
                throw new UnsupportedSmtOperationException("Unsupported boolean operator " + inst.getOpcode().mnemonic());
        }
    }

    /**
     * With nsw/nuw an overflowing operation yields poison. Encoded as
     * {@code <no overflow> => res == op1 <op> op2}, so res stays free exactly
     * when the operation can overflow.
     */
    private BoolExpr encodeOverflowingBinaryOperator(Expr res, Instruction inst, BitVecExpr a, BitVecExpr b) {
        BitVecExpr value;
        BoolExpr signedPrecond = null;
        BoolExpr unsignedPrecond = null;
        switch (inst.getOpcode()) {
            case ADD:
                value = ctx.mkBVAdd(a, b);
                if (inst.hasNoSignedWrap()) {
                    signedPrecond = ctx.mkAnd(ctx.mkBVAddNoOverflow(a, b, true), ctx.mkBVAddNoUnderflow(a, b));
                }
                if (inst.hasNoUnsignedWrap()) {
                    unsignedPrecond = ctx.mkBVAddNoOverflow(a, b, false);
                }
                break;
            case SUB:
                value = ctx.mkBVSub(a, b);
                if (inst.hasNoSignedWrap()) {
                    signedPrecond = ctx.mkAnd(ctx.mkBVSubNoOverflow(a, b), ctx.mkBVSubNoUnderflow(a, b, true));
                }
                if (inst.hasNoUnsignedWrap()) {
                    unsignedPrecond = ctx.mkBVSubNoUnderflow(a, b, false);
                }
                break;
            case MUL:
                value = ctx.mkBVMul(a, b);
                if (inst.hasNoSignedWrap()) {
                    signedPrecond = ctx.mkAnd(ctx.mkBVMulNoOverflow(a, b, true), ctx.mkBVMulNoUnderflow(a, b));
                }
                if (inst.hasNoUnsignedWrap()) {
                    unsignedPrecond = ctx.mkBVMulNoOverflow(a, b, false);
                }
                break;
            case SHL:
                value = ctx.mkBVSHL(a, b);
                // Poison when shifting out bits: shifting back must give the operand.
                BoolExpr inRange = ctx.mkBVULT(b, ctx.mkBV(a.getSortSize(), a.getSortSize()));
                if (inst.hasNoSignedWrap()) {
                    signedPrecond = ctx.mkAnd(inRange, ctx.mkEq(ctx.mkBVASHR(value, b), a));
                }
                if (inst.hasNoUnsignedWrap()) {
                    unsignedPrecond = ctx.mkAnd(inRange, ctx.mkEq(ctx.mkBVLSHR(value, b), a));
                }
                break;
            default:
                throw new UnsupportedSmtOperationException("Not an overflowing operator: " + inst.getOpcode().mnemonic());
        }
        BoolExpr eq = ctx.mkEq(res, value);
        if (signedPrecond != null && unsignedPrecond != null) {
            return ctx.mkImplies(ctx.mkAnd(signedPrecond, unsignedPrecond), eq);
        }
        if (signedPrecond != null) {
            return ctx.mkImplies(signedPrecond, eq);
        }
        if (unsignedPrecond != null) {
            return ctx.mkImplies(unsignedPrecond, eq);
        }
        return eq;
    }

    private BoolExpr encodeFunctionCall(String prefix, Expr res, Instruction inst) {
        String callee = inst.getCalleeName();
        if (KnownFunctions.isFmulAdd(callee)) {
            if (inst.getNumOperands() != 3) {
                throw new UnsupportedSmtOperationException("fmuladd expects 3 arguments: " + inst);
            }
            FPExpr op1 = TypeUtils.asFP(operand(prefix, inst, 0));
            FPExpr op2 = TypeUtils.asFP(operand(prefix, inst, 1));
            FPExpr op3 = TypeUtils.asFP(operand(prefix, inst, 2));
            return ctx.mkEq(res, ctx.mkFPAdd(roundingMode(), ctx.mkFPMul(roundingMode(), op1, op2), op3));
        }
        String function = KnownFunctions.uninterpretedName(callee);
        if (function != null) {
            // The solver only knows that equal inputs give equal outputs.
            if (inst.getNumOperands() != 1 || !inst.getOperand(0).getType().isDoubleTy()
                    || !inst.getType().isDoubleTy()) {
                throw new UnsupportedSmtOperationException("Call of " + callee + " is not double -> double: " + inst);
            }
            FPSort sort = TypeUtils.doubleSort(ctx);
            FuncDecl func = ctx.mkFuncDecl(function, sort, sort);
            return ctx.mkEq(res, ctx.mkApp(func, operand(prefix, inst, 0)));
        }
        throw new UnsupportedSmtOperationException("Call of unsupported function " + callee);
    }

    private BoolExpr encodeSelect(String prefix, Expr res, Instruction inst) {
        BoolExpr cond = TypeUtils.asBool(operand(prefix, inst, 0));
        Expr trueVal = operand(prefix, inst, 1);
        Expr falseVal = operand(prefix, inst, 2);
        return ctx.mkEq(res, ctx.mkITE(cond, trueVal, falseVal));
    }

    private BitVecExpr zero(BitVecExpr like) {
        return ctx.mkBV(0, like.getSortSize());
    }
}
