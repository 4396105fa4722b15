package ir;

/**
 * Predicates of icmp/fcmp. Floating predicates come in an ordered (O*) family,
 * false when either operand is NaN, and an unordered (U*) family, true when
 * either operand is NaN.
 */
public enum CmpPredicate {
    FCMP_FALSE,
    FCMP_OEQ,
    FCMP_OGT,
    FCMP_OGE,
    FCMP_OLT,
    FCMP_OLE,
    FCMP_ONE,
    FCMP_ORD,
    FCMP_UNO,
    FCMP_UEQ,
    FCMP_UGT,
    FCMP_UGE,
    FCMP_ULT,
    FCMP_ULE,
    FCMP_UNE,
    FCMP_TRUE,
    ICMP_EQ,
    ICMP_NE,
    ICMP_UGT,
    ICMP_UGE,
    ICMP_ULT,
    ICMP_ULE,
    ICMP_SGT,
    ICMP_SGE,
    ICMP_SLT,
    ICMP_SLE;

    public boolean isIntPredicate() {
        return name().startsWith("ICMP_");
    }

    public boolean isFPPredicate() {
        return name().startsWith("FCMP_");
    }

    public String mnemonic() {
        return name().substring(5).toLowerCase();
    }
}
