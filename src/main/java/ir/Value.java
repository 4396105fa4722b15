package ir;

import java.util.concurrent.atomic.AtomicLong;

/**
 * An operand of an instruction. Identity is reference identity; {@link #getId()}
 * is a process-unique number used to derive solver variable names.
 */
public abstract class Value {

    private static final AtomicLong ID_GENERATOR = new AtomicLong(0);

    private final long id;
    private final String name;
    private final IrType type;

    protected Value(IrType type, String name) {
        this.id = ID_GENERATOR.incrementAndGet();
        this.type = type;
        this.name = name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public IrType getType() {
        return type;
    }

    public boolean isConstant() {
        return false;
    }

    @Override
    public String toString() {
        if (name != null && !name.isEmpty()) {
            return type + " %" + name;
        }
        return type + " %v" + id;
    }
}
