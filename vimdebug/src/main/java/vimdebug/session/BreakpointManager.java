package vimdebug.session;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.Log;
import vimdebug.wire.HookFunction;
import vimdebug.wire.HookMessage;

/**
 * Replaces the interpreter's line breakpoints for a file: one clearLineBreakpoints plus one
 * setLineBreakpoint per line, all in flight at once. The interpreter owns the registry;
 * nothing is remembered here.
 */
public class BreakpointManager {
    private final Correlator correlator_;

    public BreakpointManager(Correlator correlator) {
        this.correlator_ = correlator;
    }

    /**
     * Completes once every call has been answered. The lines are reported back as-is:
     * every requested line is considered verified without asking the interpreter.
     */
    public CompletableFuture<int[]> setBreakpoints(String file, int[] lines) {
        final var calls = new ArrayList<CompletableFuture<HookMessage>>(lines.length + 1);

        final var clearArgs = new JsonObject();
        clearArgs.addProperty("file", file);
        calls.add(correlator_.send(HookFunction.CLEAR_LINE_BREAKPOINTS, clearArgs));

        for (var line : lines) {
            final var setArgs = new JsonObject();
            setArgs.addProperty("file", file);
            setArgs.addProperty("line", line);
            calls.add(correlator_.send(HookFunction.SET_LINE_BREAKPOINT, setArgs));
        }

        Log.debug("setting " + lines.length + " breakpoint(s) in " + file);

        return CompletableFuture
            .allOf(calls.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                for (var call : calls) {
                    checkRegistryReply(call.join());
                }
                return lines.clone();
            });
    }

    private static void checkRegistryReply(HookMessage reply) {
        final var error = reply.argument("error");
        if (error != null) {
            throw new BridgeException(
                BridgeError.MALFORMED_REPLY,
                reply.functionName + " failed in Vim: " + (error.isJsonPrimitive() ? error.getAsString() : error.toString())
            );
        }
    }
}
