package ir;

/**
 * Mutable position inside a basic block. {@code size()} is the end position;
 * stepping back from position 0 yields -1, which the outer comparator turns
 * back into 0 with its own increment.
 */
public class BlockCursor {

    private final BasicBlock block;
    private int index;

    public BlockCursor(BasicBlock block, int index) {
        this.block = block;
        this.index = index;
    }

    public static BlockCursor begin(BasicBlock block) {
        return new BlockCursor(block, 0);
    }

    public BasicBlock getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    public void moveTo(int index) {
        this.index = index;
    }

    public void moveTo(BlockCursor other) {
        if (other.block != block) {
            throw new IllegalArgumentException("Cursor belongs to block " + other.block.getName()
                    + ", expected " + block.getName());
        }
        this.index = other.index;
    }

    public Instruction get() {
        if (atEnd() || index < 0) {
            throw new IllegalStateException("Cursor at " + index + " does not point into block " + block.getName());
        }
        return block.get(index);
    }

    public boolean atEnd() {
        return index >= block.size();
    }

    public void advance() {
        index++;
    }

    public void stepBack() {
        index--;
    }

    public BlockCursor copy() {
        return new BlockCursor(block, index);
    }

    public boolean samePosition(BlockCursor other) {
        return other.block == block && other.index == index;
    }

    @Override
    public String toString() {
        return block.getName() + "[" + index + "]";
    }
}
