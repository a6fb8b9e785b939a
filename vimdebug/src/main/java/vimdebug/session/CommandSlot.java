package vimdebug.session;

import vimdebug.strong.EnvelopeID;
import vimdebug.wire.HookFunction;

/**
 * An interpreter long-poll the bridge is deliberately leaving unanswered.
 */
public final class CommandSlot {
    public final EnvelopeID envelopeId;
    public final HookFunction function;

    CommandSlot(EnvelopeID envelopeId, HookFunction function) {
        this.envelopeId = envelopeId;
        this.function = function;
    }

    @Override
    public String toString() {
        return "CommandSlot{" + function.wireName + " @" + envelopeId.get() + "}";
    }
}
