package vimdebug.wire;

import vimdebug.strong.EnvelopeID;

/**
 * One decoded interpreter -> bridge line.
 */
public final class InboundRecord {
    public final EnvelopeID id;
    public final HookMessage message;

    public InboundRecord(EnvelopeID id, HookMessage message) {
        this.id = id;
        this.message = message;
    }

    @Override
    public String toString() {
        return "[" + id.get() + ", " + message + "]";
    }
}
