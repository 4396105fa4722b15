package Engine;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPExpr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import ir.Argument;
import ir.ConstantFP;
import ir.IrType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import solver.UnsupportedSmtOperationException;

import static ir.IrBuilder.constBool;
import static ir.IrBuilder.constFP;
import static ir.IrBuilder.constInt;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private Context ctx;

    @BeforeEach
    void setUp() {
        ctx = new Context();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void testSidesNeverShareVariables() {
        Argument a = new Argument(IrType.I32, "a", 0);
        Expr left = Expression.makeExpr(ctx, SmtEncoder.LEFT_PREFIX, a);
        Expr right = Expression.makeExpr(ctx, SmtEncoder.RIGHT_PREFIX, a);

        assertNotEquals(left, right);
        assertEquals(left, Expression.makeExpr(ctx, SmtEncoder.LEFT_PREFIX, a));
        assertTrue(left.toString().startsWith(SmtEncoder.LEFT_PREFIX));
    }

    @Test
    void testSortsFollowStaticTypes() {
        assertTrue(Expression.makeExpr(ctx, "L_", new Argument(IrType.I1, "b", 0)) instanceof BoolExpr);
        Expr bv = Expression.makeExpr(ctx, "L_", new Argument(IrType.I16, "s", 0));
        assertEquals(16, ((BitVecExpr) bv).getSortSize());
        FPExpr f = (FPExpr) Expression.makeExpr(ctx, "L_", new Argument(IrType.FLOAT, "f", 0));
        assertEquals(8, f.getEBits());
        assertEquals(24, f.getSBits());
        FPExpr d = (FPExpr) Expression.makeExpr(ctx, "L_", new Argument(IrType.DOUBLE, "d", 0));
        assertEquals(11, d.getEBits());
        assertEquals(53, d.getSBits());
    }

    @Test
    void testConstantsAreLiterals() {
        assertTrue(Expression.makeConstant(ctx, constBool(true)).isTrue());
        Expr minusOne = Expression.makeConstant(ctx, constInt(IrType.I8, -1));
        assertEquals("#xff", minusOne.toString());
    }

    @Test
    void testNaNConstantIsNaN() {
        ConstantFP nan = constFP(IrType.DOUBLE, Double.NaN);
        FPExpr expr = (FPExpr) Expression.makeConstant(ctx, nan);
        Solver s = ctx.mkSolver();
        s.add(ctx.mkNot(ctx.mkFPIsNaN(expr)));
        assertEquals(Status.UNSATISFIABLE, s.check());
    }

    @Test
    void testEqualityOfDifferentSortsIsFalse() {
        Expr a = Expression.makeExpr(ctx, "L_", new Argument(IrType.I32, "a", 0));
        Expr b = Expression.makeExpr(ctx, "R_", new Argument(IrType.I64, "b", 0));
        assertTrue(Expression.makeEquality(ctx, a, b).isFalse());
    }

    @Test
    void testPointerIsUnsupported() {
        assertThrows(UnsupportedSmtOperationException.class,
                () -> Expression.makeExpr(ctx, "L_", new Argument(IrType.PTR, "p", 0)));
    }
}
