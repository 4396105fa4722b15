package ir;

import java.util.Collections;
import java.util.List;

/**
 * A single IR instruction. Instructions are immutable apart from being placed
 * into their parent block once.
 */
public class Instruction extends Value {

    private static final String DEBUG_INTRINSIC_PREFIX = "llvm.dbg.";

    private final Opcode opcode;
    private final List<Value> operands;
    private final boolean noSignedWrap;
    private final boolean noUnsignedWrap;
    private final boolean exact;
    private final CmpPredicate predicate;
    private final String calleeName;

    private BasicBlock parent;

    public Instruction(Opcode opcode, IrType type, String name, List<Value> operands,
                       boolean noSignedWrap, boolean noUnsignedWrap, boolean exact,
                       CmpPredicate predicate, String calleeName) {
        super(type, name);
        this.opcode = opcode;
        this.operands = List.copyOf(operands);
        this.noSignedWrap = noSignedWrap;
        this.noUnsignedWrap = noUnsignedWrap;
        this.exact = exact;
        this.predicate = predicate;
        this.calleeName = calleeName;
    }

    public Instruction(Opcode opcode, IrType type, String name, List<Value> operands) {
        this(opcode, type, name, operands, false, false, false, null, null);
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public Value getOperand(int i) {
        return operands.get(i);
    }

    public int getNumOperands() {
        return operands.size();
    }

    public boolean hasNoSignedWrap() {
        return noSignedWrap;
    }

    public boolean hasNoUnsignedWrap() {
        return noUnsignedWrap;
    }

    public boolean isExact() {
        return exact;
    }

    public CmpPredicate getPredicate() {
        return predicate;
    }

    public String getCalleeName() {
        return calleeName;
    }

    void setParent(BasicBlock parent) {
        if (this.parent != null) {
            throw new IllegalStateException("Instruction already belongs to block " + this.parent.getName());
        }
        this.parent = parent;
    }

    public boolean isDebugInfo() {
        return opcode == Opcode.CALL && calleeName != null && calleeName.startsWith(DEBUG_INTRINSIC_PREFIX);
    }

    public boolean isTerminator() {
        return opcode.isTerminator();
    }

    /** Source type of a cast instruction. */
    public IrType getSrcTy() {
        return operands.get(0).getType();
    }

    /** Destination type of a cast instruction. */
    public IrType getDestTy() {
        return getType();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!getType().equals(IrType.VOID)) {
            sb.append('%').append(getName() != null ? getName() : "v" + getId()).append(" = ");
        }
        sb.append(opcode.mnemonic());
        if (noUnsignedWrap) {
            sb.append(" nuw");
        }
        if (noSignedWrap) {
            sb.append(" nsw");
        }
        if (exact) {
            sb.append(" exact");
        }
        if (predicate != null) {
            sb.append(' ').append(predicate.mnemonic());
        }
        if (calleeName != null) {
            sb.append(" @").append(calleeName);
        }
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
        }
        return sb.toString();
    }
}
