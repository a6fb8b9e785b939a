package vimdebug.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.strong.VariablesHandle;
import vimdebug.wire.HookFunction;

/**
 * Maps the opaque variablesReference handles given to the editor to (stack level, scope).
 *
 * Entries are only ever appended. The table is recycled when a new pause starts: old
 * entries are dropped, and handle numbering carries on from where it was, so a handle
 * from an earlier pause is reported as stale instead of aliasing a new entry.
 * Handles start at 1 since DAP uses 0 for "nothing to expand".
 */
public class VariableReferenceTable {
    public static final class VariableReference {
        public final int stackLevel;
        public final ScopeCode scope;

        VariableReference(int stackLevel, ScopeCode scope) {
            this.stackLevel = stackLevel;
            this.scope = scope;
        }
    }

    private static final ScopeCode[] alwaysPresent = {
        ScopeCode.SCRIPT,
        ScopeCode.GLOBAL,
        ScopeCode.BUFFER,
        ScopeCode.WINDOW,
        ScopeCode.TAB,
        ScopeCode.VIM
    };

    private final Correlator correlator_;
    private final ArrayList<VariableReference> refs_ = new ArrayList<>();
    /** handle of refs_.get(0) */
    private int base_ = 1;

    public VariableReferenceTable(Correlator correlator) {
        this.correlator_ = correlator;
    }

    public synchronized VariablesHandle add(int stackLevel, ScopeCode scope) {
        refs_.add(new VariableReference(stackLevel, scope));
        return VariablesHandle.of(base_ + refs_.size() - 1);
    }

    /**
     * One fresh handle per scope: the function's locals first (function frames only), then
     * script, global, buffer, window, tab and vim.
     */
    public synchronized List<ScopeEntry> scopesFor(HookFrame frame) {
        final var result = new ArrayList<ScopeEntry>();
        if (frame.kind == FrameKind.FUNCTION) {
            result.add(new ScopeEntry(frame.name, add(frame.stackLevel, ScopeCode.LOCAL), false));
        }
        for (var scope : alwaysPresent) {
            result.add(new ScopeEntry(scope.displayName, add(frame.stackLevel, scope), true));
        }
        return result;
    }

    public synchronized VariableReference resolve(VariablesHandle handle) {
        final int index = handle.get() - base_;
        if (index < 0 || index >= refs_.size()) {
            throw new BridgeException(
                BridgeError.INVALID_REFERENCE,
                handle.get() < base_ && handle.get() > 0
                    ? "variables reference " + handle.get() + " belongs to an earlier stop"
                    : "unknown variables reference " + handle.get()
            );
        }
        return refs_.get(index);
    }

    public CompletableFuture<List<HookVariable>> variablesFor(VariablesHandle handle) {
        final VariableReference ref;
        try {
            ref = resolve(handle);
        }
        catch (BridgeException e) {
            return CompletableFuture.failedFuture(e);
        }

        final var arguments = new JsonObject();
        arguments.addProperty("stack_level", ref.stackLevel);
        arguments.addProperty("scope", ref.scope.code);

        return correlator_
            .send(HookFunction.VARIABLES, arguments)
            .thenApply(ReplyParser::variables);
    }

    public synchronized void recycle() {
        base_ += refs_.size();
        refs_.clear();
    }

    public synchronized int size() {
        return refs_.size();
    }
}
