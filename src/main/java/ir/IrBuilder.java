package ir;

import java.util.Arrays;
import java.util.List;

/**
 * Appends instructions to a basic block.
 */
public class IrBuilder {

    private final BasicBlock block;

    public IrBuilder(BasicBlock block) {
        this.block = block;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public static ConstantInt constInt(IrType type, long value) {
        return new ConstantInt(type, value);
    }

    public static ConstantInt constBool(boolean value) {
        return new ConstantInt(IrType.I1, value ? 1 : 0);
    }

    public static ConstantFP constFP(IrType type, double value) {
        return new ConstantFP(type, value);
    }

    private Instruction insert(Instruction inst) {
        block.append(inst);
        return inst;
    }

    public Instruction binOp(Opcode opcode, String name, Value lhs, Value rhs) {
        return insert(new Instruction(opcode, lhs.getType(), name, List.of(lhs, rhs)));
    }

    /** Binary operation carrying the nsw/nuw/exact flags. */
    public Instruction binOp(Opcode opcode, String name, Value lhs, Value rhs,
                             boolean nsw, boolean nuw, boolean exact) {
        return insert(new Instruction(opcode, lhs.getType(), name, List.of(lhs, rhs),
                nsw, nuw, exact, null, null));
    }

    public Instruction add(String name, Value lhs, Value rhs) {
        return binOp(Opcode.ADD, name, lhs, rhs);
    }

    public Instruction addNsw(String name, Value lhs, Value rhs) {
        return binOp(Opcode.ADD, name, lhs, rhs, true, false, false);
    }

    public Instruction addNuw(String name, Value lhs, Value rhs) {
        return binOp(Opcode.ADD, name, lhs, rhs, false, true, false);
    }

    public Instruction sub(String name, Value lhs, Value rhs) {
        return binOp(Opcode.SUB, name, lhs, rhs);
    }

    public Instruction mul(String name, Value lhs, Value rhs) {
        return binOp(Opcode.MUL, name, lhs, rhs);
    }

    public Instruction shl(String name, Value lhs, Value rhs) {
        return binOp(Opcode.SHL, name, lhs, rhs);
    }

    public Instruction fneg(String name, Value op) {
        return insert(new Instruction(Opcode.FNEG, op.getType(), name, List.of(op)));
    }

    public Instruction icmp(CmpPredicate predicate, String name, Value lhs, Value rhs) {
        return insert(new Instruction(Opcode.ICMP, IrType.I1, name, List.of(lhs, rhs),
                false, false, false, predicate, null));
    }

    public Instruction fcmp(CmpPredicate predicate, String name, Value lhs, Value rhs) {
        return insert(new Instruction(Opcode.FCMP, IrType.I1, name, List.of(lhs, rhs),
                false, false, false, predicate, null));
    }

    public Instruction cast(Opcode opcode, String name, Value op, IrType destTy) {
        return insert(new Instruction(opcode, destTy, name, List.of(op)));
    }

    public Instruction select(String name, Value cond, Value trueVal, Value falseVal) {
        return insert(new Instruction(Opcode.SELECT, trueVal.getType(), name, List.of(cond, trueVal, falseVal)));
    }

    public Instruction call(String name, IrType retTy, String callee, Value... args) {
        return insert(new Instruction(Opcode.CALL, retTy, name, Arrays.asList(args),
                false, false, false, null, callee));
    }

    public Instruction debugValue(Value described) {
        return insert(new Instruction(Opcode.CALL, IrType.VOID, null, List.of(described),
                false, false, false, null, "llvm.dbg.value"));
    }

    public Instruction ret(Value value) {
        if (value == null) {
            return insert(new Instruction(Opcode.RET, IrType.VOID, null, List.of()));
        }
        return insert(new Instruction(Opcode.RET, IrType.VOID, null, List.of(value)));
    }
}
