package module;

import init.Config;
import ir.BlockCursor;
import solver.NoSynchronizationPointException;
import solver.SmtComparisonException;
import solver.SnippetSolver;
import solver.TimeBudget;
import utils.Log;
import utils.ResultExporter;
import utils.SmtResultRecord;

/**
 * Entry point of the SMT-based comparison of two diverging snippets.
 *
 * <p>Called by the outer comparator when two instructions differ. Repeatedly
 * searches for a synchronization point and tries to prove the snippets before
 * it equal, backtracking to later synchronization points when the proof fails.
 * Whatever the outcome, the mapping state of the outer comparator is reset to
 * what it was on entry, so that it maps the rest of the blocks afresh.
 */
public class SmtBlockComparator {

    private final FunctionComparator fComp;
    private final int smtTimeout;
    private final SnippetEndFinder finder;
    private final SnippetSolver solver;
    private ResultExporter exporter;

    public SmtBlockComparator(FunctionComparator fComp) {
        this(fComp, Config.smtTimeout);
    }

    /**
     * @param smtTimeout solver time budget per comparison in seconds, 0 or
     *                   less for no limit
     */
    public SmtBlockComparator(FunctionComparator fComp, int smtTimeout) {
        this.fComp = fComp;
        this.smtTimeout = smtTimeout;
        this.finder = new SnippetEndFinder(fComp);
        this.solver = new SnippetSolver(fComp);
    }

    /**
     * Comparator set up from {@link Config}: log level, timeout and a result
     * file at {@link Config#resultPath}. The caller closes the exporter.
     */
    public static SmtBlockComparator fromConfig(FunctionComparator fComp) {
        Log.initLogLevel();
        SmtBlockComparator comparator = new SmtBlockComparator(fComp, Config.smtTimeout);
        comparator.setExporter(new ResultExporter(Config.resultPath));
        Log.info("SMT comparison with timeout " + Config.smtTimeout + "s, results in " + Config.resultPath);
        return comparator;
    }

    public ResultExporter getExporter() {
        return exporter;
    }

    public void setExporter(ResultExporter exporter) {
        this.exporter = exporter;
    }

    public int getSmtTimeout() {
        return smtTimeout;
    }

    public SnippetSolver getSolver() {
        return solver;
    }

    /**
     * Compares the snippets starting at {@code instL} and {@code instR}.
     *
     * <p>On return both cursors point one instruction before the
     * synchronization point, as the caller increments them afterwards.
     *
     * @return 0 if the snippets were proven equal, 1 otherwise
     * @throws NoSynchronizationPointException if the blocks never match again
     * @throws solver.UnsupportedSmtOperationException if a snippet contains an
     *         instruction without modelled semantics
     * @throws solver.OutOfTimeException if the time budget ran out
     */
    public int compare(BlockCursor instL, BlockCursor instR) {
        return compare(instL, instR, TimeBudget.ofSeconds(smtTimeout));
    }

    public int compare(BlockCursor instL, BlockCursor instR, TimeBudget budget) {
        MappingSnapshot entry = MappingSnapshot.capture(fComp.getState());
        BlockCursor startL = instL.copy();
        BlockCursor startR = instR.copy();
        long startTime = System.currentTimeMillis();
        try {
            int res = doCompare(instL, instR, budget);
            export(res == SnippetSolver.EQUAL ? ResultExporter.CODE_EQUAL : ResultExporter.CODE_NOT_EQUAL,
                    startL, startR, instL, instR, startTime, null);
            // Internally the cursors point at the synchronization point, the
            // caller will step over it once more.
            instL.stepBack();
            instR.stepBack();
            return res;
        } catch (SmtComparisonException e) {
            if (e.getCategory() == SmtComparisonException.Category.SOLVER_TIMEOUT) {
                Log.warn("SMT comparison at " + startL + " / " + startR + " ran out of time");
            } else {
                Log.debug("SMT comparison at " + startL + " / " + startR + " aborted: " + e.getMessage());
            }
            export(ResultExporter.codeOf(e), startL, startR, instL, instR, startTime, e.getMessage());
            throw e;
        } finally {
            // Let the outer comparator do a fresh mapping of the rest.
            entry.restore(fComp.getState());
        }
    }

    private int doCompare(BlockCursor instL, BlockCursor instR, TimeBudget budget) {
        BlockCursor startL = instL.copy();
        BlockCursor startR = instR.copy();

        // The instructions have been found to differ, undo that comparison.
        fComp.undoLastInstCompare(instL, instR);
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.getState());

        do {
            // The first synchronization point is not necessarily the right
            // one, so all of them are tried in scan order.
            SearchResult sync = finder.findSnippetEnd(instL, instR);
            if (!sync.isFound()) {
                throw new NoSynchronizationPointException("No synchronization point after "
                        + startL + " / " + startR);
            }
            instL.moveTo(sync.getEndL());
            instR.moveTo(sync.getEndR());

            int res = solver.compareSnippets(startL, instL, startR, instR, sync.getBeforeMatch(), budget);
            if (res == SnippetSolver.EQUAL) {
                Log.debug("Snippets " + startL + ".." + instL + " and " + startR + ".." + instR + " are equal");
                return res;
            }

            preAttempt.restore(fComp.getState());
            // Step past this synchronization point so it is not found again.
            instR.advance();
            if (instR.atEnd()) {
                instR.moveTo(startR);
                instL.advance();
                if (instL.atEnd()) {
                    return res;
                }
            }
        } while (!instL.atEnd() || !instR.atEnd());

        return SnippetSolver.NOT_EQUAL;
    }

    private void export(int code, BlockCursor startL, BlockCursor startR, BlockCursor endL, BlockCursor endR,
                        long startTime, String message) {
        if (exporter == null) {
            return;
        }
        SmtResultRecord record = new SmtResultRecord(code, startL.getBlock().getName(), startR.getBlock().getName(),
                startL.getIndex(), startR.getIndex());
        record.setEndL(endL.getIndex());
        record.setEndR(endR.getIndex());
        record.setElapsedMillis(System.currentTimeMillis() - startTime);
        record.setMessage(message);
        exporter.writeResult(record);
    }
}
