package vimdebug.strong;

/**
 * Base for the small "strong" id wrappers used across the bridge, so that a
 * request id can't be handed to something expecting an envelope id.
 * Derived classes are final.
 */
public abstract class StrongT<T> {
    private final T v;

    StrongT(T v) {
        this.v = v;
    }

    public T get() {
        return v;
    }

    @Override
    public int hashCode() {
        return v.hashCode();
    }

    @Override
    public boolean equals(Object other) {
        return other != null
            && other.getClass() == getClass()
            && v.equals(((StrongT<?>)other).v);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + v + ")";
    }
}
