package solver;

import Engine.Expression;
import Engine.SmtEncoder;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import ir.BlockCursor;
import ir.Instruction;
import ir.Value;
import module.FunctionComparator;
import module.MappingSnapshot;
import module.ValuePair;
import utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether two snippets are equivalent. The query is the conjunction of
 * <ol>
 *   <li>equality of the inputs already matched before the search,</li>
 *   <li>the encoding of both snippets,</li>
 *   <li>the negated equality of the outputs matched by the search.</li>
 * </ol>
 * If it is UNSAT, no input makes the outputs differ and the snippets are equal.
 */
public class SnippetSolver {

    public static final int EQUAL = 0;
    public static final int NOT_EQUAL = 1;

    private final FunctionComparator fComp;
    private int solverCalls;
    private long lastElapsedMillis;

    public SnippetSolver(FunctionComparator fComp) {
        this.fComp = fComp;
    }

    public int getSolverCalls() {
        return solverCalls;
    }

    public long getLastElapsedMillis() {
        return lastElapsedMillis;
    }

    /**
     * Compares {@code [startL, endL)} with {@code [startR, endR)}.
     *
     * @param preAttempt mapping before the synchronization search; inputs are
     *                   seeded from it so that speculative mappings made by the
     *                   search do not leak into the snippets
     * @throws OutOfTimeException when the solver used up the budget
     * @throws UnsupportedSmtOperationException when an instruction cannot be
     *                   encoded or the solver fails
     */
    public int compareSnippets(BlockCursor startL, BlockCursor endL, BlockCursor startR, BlockCursor endR,
                               MappingSnapshot preAttempt, TimeBudget budget) {
        // Without an instruction on each side there is nothing to map.
        if (startL.getIndex() >= endL.getIndex() || startR.getIndex() >= endR.getIndex()) {
            return NOT_EQUAL;
        }
        try (Context ctx = new Context()) {
            Solver s = ctx.mkSolver();
            if (budget.isLimited()) {
                Params params = ctx.mkParams();
                params.add("timeout", (int) Math.min(budget.getRemainingMillis(), Integer.MAX_VALUE));
                s.setParameters(params);
            }
            SmtEncoder encoder = new SmtEncoder(ctx, s);

            Set<Value> definedL = Collections.newSetFromMap(new IdentityHashMap<>());
            for (BlockCursor inst = startL.copy(); inst.getIndex() < endL.getIndex(); inst.advance()) {
                Instruction instruction = inst.get();
                encoder.mapOperands(instruction, preAttempt.getSnMapL(), preAttempt.getMappedValuesBySn());
                encoder.encodeInstruction(SmtEncoder.LEFT_PREFIX, instruction);
                definedL.add(instruction);
            }
            Set<Value> definedR = Collections.newSetFromMap(new IdentityHashMap<>());
            for (BlockCursor inst = startR.copy(); inst.getIndex() < endR.getIndex(); inst.advance()) {
                Instruction instruction = inst.get();
                encoder.mapOperands(instruction, preAttempt.getSnMapR(), preAttempt.getMappedValuesBySn());
                encoder.encodeInstruction(SmtEncoder.RIGHT_PREFIX, instruction);
                definedR.add(instruction);
            }

            List<BoolExpr> outputs = outputEqualities(ctx, definedL, definedR, fComp.getState().mappedValuesBySn);
            if (outputs.isEmpty()) {
                Log.debug("Snippets " + startL + ".." + endL + " / " + startR + ".." + endR + " have no matched outputs");
                return NOT_EQUAL;
            }
            s.add(ctx.mkNot(ctx.mkAnd(outputs.toArray(new BoolExpr[0]))));

            long start = budget.now();
            Status status = s.check();
            solverCalls++;
            if (status == Status.UNSATISFIABLE) {
                lastElapsedMillis = Math.max(0, budget.now() - start);
                Log.debug("Snippets proven equal in " + lastElapsedMillis + "ms");
                return EQUAL;
            }
            // Another synchronization point may still be tried with what is left.
            lastElapsedMillis = budget.charge(start);
            Log.debug("Snippets not proven equal (" + status + ") in " + lastElapsedMillis + "ms, " + budget);
            return NOT_EQUAL;
        } catch (Z3Exception e) {
            throw new UnsupportedSmtOperationException("Solver failure: " + e.getMessage(), e);
        }
    }

    private List<BoolExpr> outputEqualities(Context ctx, Set<Value> definedL, Set<Value> definedR,
                                            Map<Integer, ValuePair> mappedValuesBySn) {
        List<BoolExpr> equalities = new ArrayList<>();
        for (ValuePair pair : mappedValuesBySn.values()) {
            if (!definedL.contains(pair.getLeft()) && !definedR.contains(pair.getRight())) {
                continue;
            }
            equalities.add(Expression.makeEquality(ctx,
                    Expression.makeExpr(ctx, SmtEncoder.LEFT_PREFIX, pair.getLeft()),
                    Expression.makeExpr(ctx, SmtEncoder.RIGHT_PREFIX, pair.getRight())));
        }
        return equalities;
    }
}
