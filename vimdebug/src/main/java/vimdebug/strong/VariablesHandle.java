package vimdebug.strong;

public final class VariablesHandle extends StrongT<Integer> {
    public VariablesHandle(Integer v) {
        super(v);
    }

    public static VariablesHandle of(int v) {
        return new VariablesHandle(v);
    }
}
