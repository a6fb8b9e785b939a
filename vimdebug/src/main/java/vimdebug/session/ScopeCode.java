package vimdebug.session;

/**
 * Variable namespaces at a stack level. The code is what the hook's `variables` call expects.
 */
public enum ScopeCode {
    LOCAL("l", null),
    SCRIPT("s", "Script"),
    GLOBAL("g", "Global"),
    BUFFER("b", "Buffer"),
    WINDOW("w", "Window"),
    TAB("t", "Tab"),
    VIM("v", "Vim");

    public final String code;
    /**
     * null for LOCAL, which is named after the function it belongs to
     */
    public final String displayName;

    ScopeCode(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }
}
