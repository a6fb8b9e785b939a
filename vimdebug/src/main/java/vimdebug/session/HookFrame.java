package vimdebug.session;

/**
 * A stack frame as reported by the hook. Never cached; every stackTrace asks again.
 */
public final class HookFrame {
    public final int stackLevel;
    public final String name;
    public final int line;
    public final String file;
    public final FrameKind kind;

    public HookFrame(int stackLevel, String name, int line, String file, FrameKind kind) {
        this.stackLevel = stackLevel;
        this.name = name;
        this.line = line;
        this.file = file;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return "HookFrame{" + stackLevel + " " + name + " " + file + ":" + line + " " + kind + "}";
    }
}
