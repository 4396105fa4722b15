package module;

import ir.BlockCursor;
import ir.Instruction;
import utils.Log;

/**
 * Looks for the first pair of positions after which the outer comparator
 * matches the rest of both blocks structurally. Only the structural
 * comparator is used here, never the SMT core, so solver calls do not nest.
 */
public class SnippetEndFinder {

    private final FunctionComparator fComp;

    public SnippetEndFinder(FunctionComparator fComp) {
        this.fComp = fComp;
    }

    /**
     * Scans left positions from {@code instL} and, for each of them, right
     * positions from {@code instR}. On success the mapping created by the
     * matching structural comparison is left in place.
     */
    public SearchResult findSnippetEnd(BlockCursor instL, BlockCursor instR) {
        BlockCursor curL = instL.copy();
        BlockCursor curR = instR.copy();
        int candidates = 0;
        for (; !curL.atEnd(); curL.advance()) {
            if (isSkipped(curL.get())) {
                continue;
            }
            for (curR.moveTo(instR); !curR.atEnd(); curR.advance()) {
                if (isSkipped(curR.get())) {
                    continue;
                }
                candidates++;
                MappingAttempt attempt = MappingAttempt.open(fComp.getState());
                if (fComp.compareBlocksFrom(curL.copy(), curR.copy(), true) == 0) {
                    attempt.commit();
                    Log.debug("Synchronization point " + curL + " / " + curR + " after " + candidates + " candidates");
                    return SearchResult.found(curL, curR, attempt.getSnapshot());
                }
                attempt.rollback();
            }
        }
        Log.debug("No synchronization point from " + instL + " / " + instR + " among " + candidates + " candidates");
        return SearchResult.notFound();
    }

    private boolean isSkipped(Instruction inst) {
        return fComp.maySkipInstruction(inst) || inst.isDebugInfo();
    }
}
