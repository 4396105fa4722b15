package module;

import ir.Value;

import java.util.Objects;

/** A left value and the right value it is mapped to. */
public final class ValuePair {

    private final Value left;
    private final Value right;

    public ValuePair(Value left, Value right) {
        this.left = left;
        this.right = right;
    }

    public Value getLeft() {
        return left;
    }

    public Value getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValuePair)) {
            return false;
        }
        ValuePair other = (ValuePair) o;
        return left == other.left && right == other.right;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(left), System.identityHashCode(right));
    }

    @Override
    public String toString() {
        return "(" + left + " <-> " + right + ")";
    }
}
