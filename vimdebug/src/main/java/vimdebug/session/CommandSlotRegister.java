package vimdebug.session;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.Log;
import vimdebug.link.HookLink;
import vimdebug.strong.EnvelopeID;
import vimdebug.wire.HookFunction;
import vimdebug.wire.HookMessage;
import vimdebug.wire.WireCodec;

/**
 * Holds at most one open long-poll. An Initialize slot is only closed by an Initialize
 * reply, a GetCommand slot only by a GetCommand reply.
 */
public class CommandSlotRegister {
    public static final String COMMAND = "Command";

    private final HookLink link_;
    private CommandSlot slot_ = null;

    public CommandSlotRegister(HookLink link) {
        this.link_ = link;
    }

    /**
     * @throws BridgeException SLOT_OCCUPIED if a slot is already open; the open slot is kept
     */
    public synchronized CommandSlot open(EnvelopeID envelopeId, HookFunction function) {
        Preconditions.checkArgument(function.opensSlot(), "%s does not open a command slot", function);
        if (slot_ != null) {
            throw new BridgeException(
                BridgeError.SLOT_OCCUPIED,
                "refusing " + function.wireName + " @" + envelopeId.get() + ", " + slot_ + " is still open"
            );
        }
        slot_ = new CommandSlot(envelopeId, function);
        return slot_;
    }

    public synchronized Optional<CommandSlot> current() {
        return Optional.ofNullable(slot_);
    }

    public synchronized boolean isOpen(HookFunction function) {
        return slot_ != null && slot_.function == function;
    }

    /**
     * Answers the open slot and closes it. The reply is written before this returns.
     *
     * @throws BridgeException if no slot of that kind is open (NOT_READY for Initialize, NOT_PAUSED for GetCommand)
     */
    public synchronized void reply(HookFunction function, JsonObject arguments) {
        if (slot_ == null || slot_.function != function) {
            throw new BridgeException(
                function == HookFunction.INITIALIZE ? BridgeError.NOT_READY : BridgeError.NOT_PAUSED,
                "no open " + function.wireName + " request to reply to" + (slot_ == null ? "" : " (open: " + slot_ + ")")
            );
        }

        final var record = WireCodec.encode(slot_.envelopeId.get(), HookMessage.reply(function, arguments));
        slot_ = null;
        if (Log.isTraceEnabled()) {
            Log.trace("TX " + record);
        }
        link_.write(record);
    }

    public void replyCommand(StepCommand command) {
        final var arguments = new JsonObject();
        arguments.addProperty(COMMAND, command.wireName);
        reply(HookFunction.GET_COMMAND, arguments);
    }

    /**
     * Forget the open slot without answering it (connection gone).
     */
    public synchronized void drop() {
        slot_ = null;
    }
}
