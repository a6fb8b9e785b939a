package vimdebug.session;

public enum FrameKind {
    FUNCTION,
    SCRIPT,
    OTHER;

    /**
     * @param wireType the frame's `type` as the hook reports it ("UFUNC", "SCRIPT", ...)
     */
    public static FrameKind fromWire(String wireType) {
        if (wireType == null) {
            return OTHER;
        }
        switch (wireType) {
            case "UFUNC": return FUNCTION;
            case "SCRIPT": return SCRIPT;
            default: return OTHER;
        }
    }
}
