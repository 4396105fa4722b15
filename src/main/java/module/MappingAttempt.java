package module;

/**
 * Scope of one speculative change to the comparator state. The caller must
 * either {@link #commit()} to keep the changes or {@link #rollback()} to
 * restore the state captured when the attempt was opened.
 */
public final class MappingAttempt {

    private final ComparatorState state;
    private final MappingSnapshot before;
    private boolean closed;

    private MappingAttempt(ComparatorState state) {
        this.state = state;
        this.before = MappingSnapshot.capture(state);
    }

    public static MappingAttempt open(ComparatorState state) {
        return new MappingAttempt(state);
    }

    public MappingSnapshot getSnapshot() {
        return before;
    }

    public void commit() {
        ensureOpen();
        closed = true;
    }

    public void rollback() {
        ensureOpen();
        before.restore(state);
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Mapping attempt already closed");
        }
    }
}
