package vimdebug.session;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.strong.EnvelopeID;
import vimdebug.testutils.RecordingLink;
import vimdebug.wire.HookFunction;

class CommandSlotRegisterTest {
    @Test
    void repliesToTheOpenSlotWithItsEnvelopeId() {
        final var link = new RecordingLink();
        final var slots = new CommandSlotRegister(link);

        slots.open(EnvelopeID.of(7), HookFunction.GET_COMMAND);
        slots.replyCommand(StepCommand.NEXT);

        assertEquals(
            "[7,{\"Message_type\":\"Reply\",\"Function\":\"GetCommand\",\"Arguments\":{\"Command\":\"next\"}}]",
            link.lastWrite()
        );
        assertTrue(slots.current().isEmpty());
    }

    @Test
    void secondSlotIsRefusedAndTheFirstKept() {
        final var slots = new CommandSlotRegister(new RecordingLink());
        slots.open(EnvelopeID.of(3), HookFunction.GET_COMMAND);

        final var e = assertThrows(BridgeException.class, () -> slots.open(EnvelopeID.of(4), HookFunction.GET_COMMAND));
        assertEquals(BridgeError.SLOT_OCCUPIED, e.getError());
        assertEquals(EnvelopeID.of(3), slots.current().get().envelopeId);
    }

    @Test
    void replyWithoutAMatchingSlotIsASequencingError() {
        final var link = new RecordingLink();
        final var slots = new CommandSlotRegister(link);

        var e = assertThrows(BridgeException.class, () -> slots.replyCommand(StepCommand.CONTINUE));
        assertEquals(BridgeError.NOT_PAUSED, e.getError());

        e = assertThrows(BridgeException.class, () -> slots.reply(HookFunction.INITIALIZE, new JsonObject()));
        assertEquals(BridgeError.NOT_READY, e.getError());

        // an Initialize slot can't be answered with a command
        slots.open(EnvelopeID.of(1), HookFunction.INITIALIZE);
        e = assertThrows(BridgeException.class, () -> slots.replyCommand(StepCommand.CONTINUE));
        assertEquals(BridgeError.NOT_PAUSED, e.getError());
        assertTrue(slots.isOpen(HookFunction.INITIALIZE));

        assertTrue(link.writes().isEmpty());
    }

    @Test
    void onlyLongPollsOpenSlots() {
        final var slots = new CommandSlotRegister(new RecordingLink());
        assertThrows(IllegalArgumentException.class, () -> slots.open(EnvelopeID.of(1), HookFunction.EVALUATE));
    }

    @Test
    void slotIsFreeAgainAfterReplyOrDrop() {
        final var slots = new CommandSlotRegister(new RecordingLink());

        slots.open(EnvelopeID.of(1), HookFunction.INITIALIZE);
        slots.reply(HookFunction.INITIALIZE, new JsonObject());
        slots.open(EnvelopeID.of(2), HookFunction.GET_COMMAND);
        slots.drop();
        slots.open(EnvelopeID.of(3), HookFunction.GET_COMMAND);

        assertTrue(slots.isOpen(HookFunction.GET_COMMAND));
    }
}
