package module;

import ir.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Immutable by-value copy of a {@link ComparatorState}. Restoring assigns
 * fresh copies, so one snapshot can be restored any number of times.
 */
public final class MappingSnapshot {

    private final Map<Value, Integer> snMapL;
    private final Map<Value, Integer> snMapR;
    private final Map<Integer, ValuePair> mappedValuesBySn;
    private final InliningRequest tryInline;
    private final int nextSerialNumber;

    private MappingSnapshot(ComparatorState state) {
        this.snMapL = Collections.unmodifiableMap(new IdentityHashMap<>(state.snMapL));
        this.snMapR = Collections.unmodifiableMap(new IdentityHashMap<>(state.snMapR));
        this.mappedValuesBySn = Collections.unmodifiableMap(new HashMap<>(state.mappedValuesBySn));
        this.tryInline = state.tryInline;
        this.nextSerialNumber = state.getNextSerialNumber();
    }

    public static MappingSnapshot capture(ComparatorState state) {
        return new MappingSnapshot(state);
    }

    public void restore(ComparatorState state) {
        state.snMapL = new IdentityHashMap<>(snMapL);
        state.snMapR = new IdentityHashMap<>(snMapR);
        state.mappedValuesBySn = new HashMap<>(mappedValuesBySn);
        state.tryInline = tryInline;
        state.setNextSerialNumber(nextSerialNumber);
    }

    public Map<Value, Integer> getSnMapL() {
        return snMapL;
    }

    public Map<Value, Integer> getSnMapR() {
        return snMapR;
    }

    public Map<Integer, ValuePair> getMappedValuesBySn() {
        return mappedValuesBySn;
    }

    public InliningRequest getTryInline() {
        return tryInline;
    }
}
