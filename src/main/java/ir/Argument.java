package ir;

public class Argument extends Value {

    private final int argNo;

    public Argument(IrType type, String name, int argNo) {
        super(type, name);
        this.argNo = argNo;
    }

    public int getArgNo() {
        return argNo;
    }
}
