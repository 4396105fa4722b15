package ir;

public enum Opcode {
    // binary
    ADD(Kind.BINARY),
    FADD(Kind.BINARY),
    SUB(Kind.BINARY),
    FSUB(Kind.BINARY),
    MUL(Kind.BINARY),
    FMUL(Kind.BINARY),
    UDIV(Kind.BINARY),
    SDIV(Kind.BINARY),
    FDIV(Kind.BINARY),
    UREM(Kind.BINARY),
    SREM(Kind.BINARY),
    FREM(Kind.BINARY),
    SHL(Kind.BINARY),
    LSHR(Kind.BINARY),
    ASHR(Kind.BINARY),
    AND(Kind.BINARY),
    OR(Kind.BINARY),
    XOR(Kind.BINARY),
    // unary
    FNEG(Kind.UNARY),
    // compare
    ICMP(Kind.COMPARE),
    FCMP(Kind.COMPARE),
    // cast
    TRUNC(Kind.CAST),
    ZEXT(Kind.CAST),
    SEXT(Kind.CAST),
    FPTRUNC(Kind.CAST),
    FPEXT(Kind.CAST),
    FPTOUI(Kind.CAST),
    FPTOSI(Kind.CAST),
    UITOFP(Kind.CAST),
    SITOFP(Kind.CAST),
    PTRTOINT(Kind.CAST),
    INTTOPTR(Kind.CAST),
    BITCAST(Kind.CAST),
    // other
    CALL(Kind.CALL),
    SELECT(Kind.SELECT),
    RET(Kind.TERMINATOR),
    BR(Kind.TERMINATOR),
    UNREACHABLE(Kind.TERMINATOR),
    LOAD(Kind.OTHER),
    STORE(Kind.OTHER),
    ALLOCA(Kind.OTHER),
    GETELEMENTPTR(Kind.OTHER),
    PHI(Kind.OTHER);

    public enum Kind {
        BINARY,
        UNARY,
        COMPARE,
        CAST,
        CALL,
        SELECT,
        TERMINATOR,
        OTHER
    }

    private final Kind kind;

    Opcode(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTerminator() {
        return kind == Kind.TERMINATOR;
    }

    public String mnemonic() {
        return name().toLowerCase();
    }
}
