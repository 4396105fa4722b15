package module;

import java.util.Objects;

/**
 * Pending decision of the outer comparator to inline a called function on
 * one side. Structural comparisons may set it as a side effect.
 */
public final class InliningRequest {

    private final String leftCallee;
    private final String rightCallee;

    public InliningRequest(String leftCallee, String rightCallee) {
        this.leftCallee = leftCallee;
        this.rightCallee = rightCallee;
    }

    public String getLeftCallee() {
        return leftCallee;
    }

    public String getRightCallee() {
        return rightCallee;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InliningRequest)) {
            return false;
        }
        InliningRequest other = (InliningRequest) o;
        return Objects.equals(leftCallee, other.leftCallee) && Objects.equals(rightCallee, other.rightCallee);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leftCallee, rightCallee);
    }

    @Override
    public String toString() {
        return "InliningRequest[" + leftCallee + ", " + rightCallee + "]";
    }
}
