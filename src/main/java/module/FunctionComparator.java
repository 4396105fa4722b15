package module;

import ir.BlockCursor;
import ir.Instruction;

/**
 * What the SMT core needs from the outer, structural instruction-by-instruction
 * comparator that drives it.
 */
public interface FunctionComparator {

    /**
     * Whether the comparator ignores {@code inst} when comparing (e.g. debug or
     * metadata-only instructions).
     */
    boolean maySkipInstruction(Instruction inst);

    /**
     * Structurally compares the two blocks starting at the given positions up
     * to their ends, updating the mapping state on the way.
     *
     * @param suppressSmt when true, the comparison must not call back into
     *                    the SMT core
     * @return 0 when the remaining instructions match, non-zero otherwise
     */
    int compareBlocksFrom(BlockCursor instL, BlockCursor instR, boolean suppressSmt);

    /**
     * Reverts the mapping changes of the instruction comparison that just
     * failed at {@code instL}/{@code instR}.
     */
    void undoLastInstCompare(BlockCursor instL, BlockCursor instR);

    ComparatorState getState();
}
