package vimdebug.session;

import vimdebug.strong.VariablesHandle;

public final class ScopeEntry {
    public final String name;
    public final VariablesHandle handle;
    public final boolean expensive;

    ScopeEntry(String name, VariablesHandle handle, boolean expensive) {
        this.name = name;
        this.handle = handle;
        this.expensive = expensive;
    }
}
