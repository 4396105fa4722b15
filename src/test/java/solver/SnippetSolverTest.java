package solver;

import ir.Argument;
import ir.BasicBlock;
import ir.BlockCursor;
import ir.CmpPredicate;
import ir.Instruction;
import ir.IrBuilder;
import ir.IrType;
import module.ComparatorState;
import module.FunctionComparator;
import module.MappingSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static ir.IrBuilder.constFP;
import static ir.IrBuilder.constInt;
import static org.junit.jupiter.api.Assertions.*;

class SnippetSolverTest {

    /** Only hands out its state; the solver never calls back otherwise. */
    private static class StateOnly implements FunctionComparator {
        final ComparatorState state = new ComparatorState();

        @Override
        public boolean maySkipInstruction(Instruction inst) {
            return false;
        }

        @Override
        public int compareBlocksFrom(BlockCursor instL, BlockCursor instR, boolean suppressSmt) {
            throw new AssertionError("the solver must not compare blocks");
        }

        @Override
        public void undoLastInstCompare(BlockCursor instL, BlockCursor instR) {
            throw new AssertionError("the solver must not undo comparisons");
        }

        @Override
        public ComparatorState getState() {
            return state;
        }
    }

    private StateOnly fComp;
    private SnippetSolver solver;
    private BasicBlock left;
    private BasicBlock right;
    private IrBuilder lb;
    private IrBuilder rb;

    @BeforeEach
    void setUp() {
        fComp = new StateOnly();
        solver = new SnippetSolver(fComp);
        left = new BasicBlock("left");
        right = new BasicBlock("right");
        lb = new IrBuilder(left);
        rb = new IrBuilder(right);
    }

    /** Compares everything before the final instruction of each block. */
    private int compareUpToTerminators(MappingSnapshot preAttempt) {
        return solver.compareSnippets(BlockCursor.begin(left), new BlockCursor(left, left.size() - 1),
                BlockCursor.begin(right), new BlockCursor(right, right.size() - 1),
                preAttempt, TimeBudget.unlimited());
    }

    @Test
    void testSameComputationOnMatchedInputsIsEqual() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Argument b = new Argument(IrType.I32, "b", 1);
        Argument x = new Argument(IrType.I32, "x", 0);
        Argument y = new Argument(IrType.I32, "y", 1);
        Instruction resL = lb.add("resL", a, b);
        lb.ret(resL);
        Instruction resR = rb.add("resR", y, x);
        rb.ret(resR);

        fComp.state.map(a, x);
        fComp.state.map(b, y);
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(resL, resR);

        assertEquals(SnippetSolver.EQUAL, compareUpToTerminators(preAttempt));
        assertEquals(1, solver.getSolverCalls());
    }

    @Test
    void testDifferentComputationIsNotEqual() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Argument b = new Argument(IrType.I32, "b", 1);
        Argument x = new Argument(IrType.I32, "x", 0);
        Argument y = new Argument(IrType.I32, "y", 1);
        Instruction resL = lb.add("resL", a, b);
        lb.ret(resL);
        Instruction resR = rb.sub("resR", x, y);
        rb.ret(resR);

        fComp.state.map(a, x);
        fComp.state.map(b, y);
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(resL, resR);

        assertEquals(SnippetSolver.NOT_EQUAL, compareUpToTerminators(preAttempt));
    }

    @Test
    void testUnmatchedInputsAreFree() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Argument x = new Argument(IrType.I32, "x", 0);
        Instruction resL = lb.add("resL", a, constInt(IrType.I32, 0));
        lb.ret(resL);
        Instruction resR = rb.add("resR", x, constInt(IrType.I32, 0));
        rb.ret(resR);

        // a and x are never matched, so nothing ties them together
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(resL, resR);

        assertEquals(SnippetSolver.NOT_EQUAL, compareUpToTerminators(preAttempt));
    }

    @Test
    void testEmptySnippetSkipsSolver() {
        Argument a = new Argument(IrType.I32, "a", 0);
        lb.ret(a);
        Instruction r = rb.add("r", a, a);
        rb.ret(r);

        int res = solver.compareSnippets(BlockCursor.begin(left), BlockCursor.begin(left),
                BlockCursor.begin(right), new BlockCursor(right, 1),
                MappingSnapshot.capture(fComp.state), TimeBudget.unlimited());

        assertEquals(SnippetSolver.NOT_EQUAL, res);
        assertEquals(0, solver.getSolverCalls());
    }

    @Test
    void testNoMatchedOutputIsNotProven() {
        Instruction l = lb.add("l", constInt(IrType.I32, 1), constInt(IrType.I32, 2));
        lb.ret(l);
        Instruction r = rb.add("r", constInt(IrType.I32, 1), constInt(IrType.I32, 2));
        rb.ret(r);

        assertEquals(SnippetSolver.NOT_EQUAL, compareUpToTerminators(MappingSnapshot.capture(fComp.state)));
        assertEquals(0, solver.getSolverCalls());
    }

    @Test
    void testSignedOverflowIsNotAssumedToWrap() {
        Instruction o = lb.addNsw("o", constInt(IrType.I32, Integer.MAX_VALUE), constInt(IrType.I32, 1));
        lb.ret(o);
        Instruction p = rb.add("p", constInt(IrType.I32, Integer.MIN_VALUE), constInt(IrType.I32, 0));
        rb.ret(p);

        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(o, p);

        assertEquals(SnippetSolver.NOT_EQUAL, compareUpToTerminators(preAttempt));
    }

    @Test
    void testNoOverflowKeepsResultDetermined() {
        Instruction o = lb.addNsw("o", constInt(IrType.I32, 2), constInt(IrType.I32, 3));
        lb.ret(o);
        Instruction p = rb.add("p", constInt(IrType.I32, 5), constInt(IrType.I32, 0));
        rb.ret(p);

        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(o, p);

        assertEquals(SnippetSolver.EQUAL, compareUpToTerminators(preAttempt));
    }

    private int compareNaNAgainstTrue(CmpPredicate predicate) {
        Argument x = new Argument(IrType.DOUBLE, "x", 0);
        Argument y = new Argument(IrType.DOUBLE, "y", 0);
        Instruction c = lb.fcmp(predicate, "c", constFP(IrType.DOUBLE, Double.NaN), x);
        lb.ret(c);
        Instruction d = rb.fcmp(CmpPredicate.FCMP_TRUE, "d", y, y);
        rb.ret(d);

        fComp.state.map(x, y);
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(c, d);
        return compareUpToTerminators(preAttempt);
    }

    @Test
    void testOrderedComparisonWithNaNIsFalse() {
        assertEquals(SnippetSolver.NOT_EQUAL, compareNaNAgainstTrue(CmpPredicate.FCMP_OEQ));
    }

    @Test
    void testUnorderedComparisonWithNaNIsTrue() {
        assertEquals(SnippetSolver.EQUAL, compareNaNAgainstTrue(CmpPredicate.FCMP_UEQ));
    }

    @Test
    void testSpeculativeMappingDoesNotSeedInputs() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Argument x = new Argument(IrType.I32, "x", 0);
        Instruction resL = lb.add("resL", a, a);
        lb.ret(resL);
        Instruction resR = rb.add("resR", x, x);
        rb.ret(resR);

        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        // made by the search after the snapshot, so it must not constrain inputs
        fComp.state.map(a, x);
        fComp.state.map(resL, resR);

        assertEquals(SnippetSolver.NOT_EQUAL, compareUpToTerminators(preAttempt));
    }

    @Test
    void testUnsupportedInstructionIsReported() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Instruction l = lb.call("l", IrType.I32, "rand");
        lb.ret(l);
        Instruction r = rb.add("r", a, a);
        rb.ret(r);

        fComp.state.map(l, r);
        assertThrows(UnsupportedSmtOperationException.class,
                () -> compareUpToTerminators(MappingSnapshot.capture(fComp.state)));
    }

    @Test
    void testFailedProofIsChargedToBudget() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Argument x = new Argument(IrType.I32, "x", 0);
        Instruction resL = lb.add("resL", a, constInt(IrType.I32, 1));
        lb.ret(resL);
        Instruction resR = rb.add("resR", x, constInt(IrType.I32, 2));
        rb.ret(resR);
        fComp.state.map(a, x);
        MappingSnapshot preAttempt = MappingSnapshot.capture(fComp.state);
        fComp.state.map(resL, resR);

        long[] now = {0};
        TimeBudget budget = new TimeBudget(1000, () -> now[0] += 300);
        int res = solver.compareSnippets(BlockCursor.begin(left), new BlockCursor(left, 1),
                BlockCursor.begin(right), new BlockCursor(right, 1), preAttempt, budget);

        assertEquals(SnippetSolver.NOT_EQUAL, res);
        assertEquals(300, solver.getLastElapsedMillis());
        assertEquals(700, budget.getRemainingMillis());
    }
}
