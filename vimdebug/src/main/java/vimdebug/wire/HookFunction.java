package vimdebug.wire;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * The operations named by payload.Function. Wire names are case sensitive and
 * intentionally inconsistent; they are whatever the hook script uses.
 */
public enum HookFunction {
    /** Notify: the interpreter stopped; a GetCommand long-poll follows */
    BREAK("Break"),

    /** Request (long-poll): hook is up, waiting for configuration to finish */
    INITIALIZE("Initialize"),
    /** Request (long-poll): interpreter is paused, waiting for a command */
    GET_COMMAND("GetCommand"),

    // serviced by the interpreter, issued by the bridge
    CLEAR_LINE_BREAKPOINTS("clearLineBreakpoints"),
    SET_LINE_BREAKPOINT("setLineBreakpoint"),
    STACK_TRACE("stackTrace"),
    VARIABLES("variables"),
    EVALUATE("evaluate"),
    EXECUTE("execute");

    public final String wireName;

    HookFunction(String wireName) {
        this.wireName = wireName;
    }

    /**
     * true for the interpreter-initiated long-polls that park in the command slot
     */
    public boolean opensSlot() {
        return this == INITIALIZE || this == GET_COMMAND;
    }

    private static final ImmutableMap<String, HookFunction> byWireName;
    static {
        var builder = ImmutableMap.<String, HookFunction>builder();
        for (var v : values()) {
            builder.put(v.wireName, v);
        }
        byWireName = builder.build();
    }

    public static Optional<HookFunction> fromWireName(String name) {
        return Optional.ofNullable(byWireName.get(name));
    }
}
