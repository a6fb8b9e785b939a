package vimdebug.session;

public final class HookVariable {
    public final String name;
    public final String type;
    public final String value;

    public HookVariable(String name, String type, String value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }
}
