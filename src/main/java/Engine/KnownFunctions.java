package Engine;

import java.util.Map;
import java.util.Set;

/**
 * Pure math functions that calls may target. Except for fused multiply-add
 * they are modelled as uninterpreted functions over doubles.
 */
public class KnownFunctions {

    private static final String FMULADD_PREFIX = "llvm.fmuladd.";

    private static final Set<String> UNINTERPRETED = Set.of(
        "acos", "asin", "atan",
        "cos", "cosh",
        "sin", "sinh",
        "tanh",
        "exp",
        "log", "log10",
        "sqrt"
    );

    private static final Map<String, String> INTRINSIC_ALIASES = Map.of(
        "llvm.sqrt.f64", "sqrt",
        "llvm.exp.f64", "exp",
        "llvm.log.f64", "log",
        "llvm.log10.f64", "log10",
        "llvm.sin.f64", "sin",
        "llvm.cos.f64", "cos"
    );

    public static boolean isFmulAdd(String callee) {
        return callee != null && callee.startsWith(FMULADD_PREFIX);
    }

    /**
     * @return the uninterpreted function name for {@code callee}, or null if
     * the callee is not a known pure function
     */
    public static String uninterpretedName(String callee) {
        if (callee == null) {
            return null;
        }
        if (UNINTERPRETED.contains(callee)) {
            return callee;
        }
        return INTRINSIC_ALIASES.get(callee);
    }
}
