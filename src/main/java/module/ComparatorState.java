package module;

import ir.Value;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The mapping state of the outer comparator: serial numbers of values on each
 * side, the pairs of values matched under each serial number and the pending
 * inlining decision. The SMT core borrows it and restores it through
 * {@link MappingSnapshot}.
 */
public class ComparatorState {

    public Map<Value, Integer> snMapL = new IdentityHashMap<>();
    public Map<Value, Integer> snMapR = new IdentityHashMap<>();
    public Map<Integer, ValuePair> mappedValuesBySn = new HashMap<>();
    public InliningRequest tryInline;

    private int nextSerialNumber = 0;

    /**
     * Records {@code left} and {@code right} as structurally equivalent.
     *
     * @return the serial number given to the pair
     */
    public int map(Value left, Value right) {
        int sn = nextSerialNumber++;
        snMapL.put(left, sn);
        snMapR.put(right, sn);
        mappedValuesBySn.put(sn, new ValuePair(left, right));
        return sn;
    }

    public int getNextSerialNumber() {
        return nextSerialNumber;
    }

    void setNextSerialNumber(int nextSerialNumber) {
        this.nextSerialNumber = nextSerialNumber;
    }

    public boolean sameMapping(ComparatorState other) {
        return snMapL.equals(other.snMapL)
                && snMapR.equals(other.snMapR)
                && mappedValuesBySn.equals(other.mappedValuesBySn)
                && Objects.equals(tryInline, other.tryInline);
    }
}
