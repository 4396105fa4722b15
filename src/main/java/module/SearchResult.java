package module;

import ir.BlockCursor;

/**
 * Outcome of a synchronization point search: either the pair of positions
 * after which both blocks match again, or nothing.
 */
public final class SearchResult {

    private static final SearchResult NOT_FOUND = new SearchResult(null, null, null);

    private final BlockCursor endL;
    private final BlockCursor endR;
    private final MappingSnapshot beforeMatch;

    private SearchResult(BlockCursor endL, BlockCursor endR, MappingSnapshot beforeMatch) {
        this.endL = endL;
        this.endR = endR;
        this.beforeMatch = beforeMatch;
    }

    public static SearchResult found(BlockCursor endL, BlockCursor endR, MappingSnapshot beforeMatch) {
        return new SearchResult(endL.copy(), endR.copy(), beforeMatch);
    }

    public static SearchResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return endL != null;
    }

    public BlockCursor getEndL() {
        return endL;
    }

    public BlockCursor getEndR() {
        return endR;
    }

    /** Mapping state right before the successful structural comparison. */
    public MappingSnapshot getBeforeMatch() {
        return beforeMatch;
    }

    @Override
    public String toString() {
        return isFound() ? "Found(" + endL + ", " + endR + ")" : "NotFound";
    }
}
