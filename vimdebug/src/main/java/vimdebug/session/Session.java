package vimdebug.session;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

import com.google.common.collect.ImmutableTable;
import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.Config;
import vimdebug.Log;
import vimdebug.link.HookConnection;
import vimdebug.link.HookLink;
import vimdebug.strong.VariablesHandle;
import vimdebug.wire.HookFunction;
import vimdebug.wire.InboundRecord;
import vimdebug.wire.MessageType;
import vimdebug.wire.PushMode;
import vimdebug.wire.WireCodec;

/**
 * Everything tied to one hook connection: the correlator, the command slot, the variable
 * reference table, and the pause/resume state machine.
 *
 *   AWAITING_INIT --Initialize--> READY --configurationDone--> RUNNING
 *   RUNNING --Break, GetCommand--> PAUSED --cont/next/step/finish--> RUNNING
 *   any --link closed / terminate--> TERMINATED
 *
 * State changes and slot replies happen under this object's monitor.
 */
public class Session implements HookConnection.Listener {
    /**
     * Things the editor has to be told about. initialized() and stopped() are called with
     * the session's monitor held.
     */
    public interface Events {
        void initialized();
        void stopped(String reason);
        void terminated();
    }

    public static final String INTERRUPT_COMMAND = "breakint";
    public static final String FORCE_QUIT_COMMAND = "qa!";

    private final HookLink link_;
    private final Events events_;
    private final boolean bridgeStarted_;

    private final Correlator correlator_;
    private final CommandSlotRegister slots_;
    private final VariableReferenceTable refs_;
    private final BreakpointManager breakpoints_;

    private static final ImmutableTable<MessageType, HookFunction, BiConsumer<Session, InboundRecord>> routes =
        ImmutableTable.<MessageType, HookFunction, BiConsumer<Session, InboundRecord>>builder()
            .put(MessageType.NOTIFY, HookFunction.BREAK, Session::onBreak)
            .put(MessageType.REQUEST, HookFunction.INITIALIZE, Session::onInitialize)
            .put(MessageType.REQUEST, HookFunction.GET_COMMAND, Session::onGetCommand)
            .build();

    private SessionState state_ = SessionState.AWAITING_INIT;

    // what to call the next stop
    private String breakReason_ = null;
    private boolean interruptRequested_ = false;
    private StepCommand lastCommand_ = null;

    // bumped on every stop; frames from an earlier stop must not get handles in the current table
    private int pauseCount_ = 0;

    /**
     * @param bridgeStarted whether the bridge launched this interpreter (disconnect then quits it)
     */
    public Session(HookLink link, Events events, Config config, boolean bridgeStarted) {
        this.link_ = link;
        this.events_ = events;
        this.bridgeStarted_ = bridgeStarted;
        this.correlator_ = new Correlator(link, config.getRequestTimeout());
        this.slots_ = new CommandSlotRegister(link);
        this.refs_ = new VariableReferenceTable(correlator_);
        this.breakpoints_ = new BreakpointManager(correlator_);
    }

    public synchronized SessionState getState() {
        return state_;
    }

    public boolean isBridgeStarted() {
        return bridgeStarted_;
    }

    Correlator correlator() {
        return correlator_;
    }

    CommandSlotRegister slots() {
        return slots_;
    }

    //
    // inbound
    //

    @Override
    public void onLine(String line) {
        if (Log.isTraceEnabled()) {
            Log.trace("RX " + line);
        }

        WireCodec.decode(line).accept(
            reason -> Log.warn("dropping malformed record (" + reason + "): " + line),
            this::dispatch
        );
    }

    void dispatch(InboundRecord record) {
        final var message = record.message;

        if (message.messageType == MessageType.REPLY) {
            correlator_.dispatchReply(message);
            return;
        }

        final var function = message.function();
        final var route = function.isPresent() ? routes.get(message.messageType, function.get()) : null;
        if (route == null) {
            Log.warn("dropping unexpected " + message.messageType.wireName + "/" + message.functionName + " from Vim");
            return;
        }

        try {
            route.accept(this, record);
        }
        catch (BridgeException e) {
            Log.error(e.getMessage());
        }
    }

    private synchronized void onInitialize(InboundRecord record) {
        if (state_ != SessionState.AWAITING_INIT) {
            throw new BridgeException(BridgeError.SLOT_OCCUPIED, "unexpected Initialize while " + state_);
        }
        slots_.open(record.id, HookFunction.INITIALIZE);
        state_ = SessionState.READY;
        Log.debug("Vim is initializing, waiting for configurationDone");
        events_.initialized();
    }

    private synchronized void onBreak(InboundRecord record) {
        final var reason = record.message.argument("reason");
        breakReason_ = reason != null && reason.isJsonPrimitive() ? reason.getAsString() : null;
    }

    private synchronized void onGetCommand(InboundRecord record) {
        if (state_ != SessionState.RUNNING) {
            throw new BridgeException(BridgeError.SLOT_OCCUPIED, "unexpected GetCommand @" + record.id.get() + " while " + state_);
        }
        slots_.open(record.id, HookFunction.GET_COMMAND);
        state_ = SessionState.PAUSED;
        refs_.recycle();
        pauseCount_++;

        final var reason = stopReason();
        breakReason_ = null;
        interruptRequested_ = false;
        lastCommand_ = null;

        Log.debug("Vim paused (" + reason + ")");
        events_.stopped(reason);
    }

    private String stopReason() {
        if (breakReason_ != null && !breakReason_.isEmpty()) {
            return breakReason_;
        }
        if (interruptRequested_) {
            return "pause";
        }
        if (lastCommand_ != null && lastCommand_.isStep()) {
            return "step";
        }
        return "breakpoint";
    }

    @Override
    public void onClosed() {
        synchronized (this) {
            if (state_ == SessionState.TERMINATED) {
                return;
            }
            state_ = SessionState.TERMINATED;
            slots_.drop();
            refs_.recycle();
        }
        // fail outside the monitor, completions run dependent stages on this thread
        correlator_.failAll(new BridgeException(BridgeError.CONNECTION_CLOSED));
        events_.terminated();
    }

    //
    // editor decisions
    //

    public synchronized void configurationDone() {
        if (state_ != SessionState.READY) {
            throw new BridgeException(BridgeError.NOT_READY, "configurationDone while " + state_);
        }
        slots_.reply(HookFunction.INITIALIZE, new JsonObject());
        state_ = SessionState.RUNNING;
    }

    public synchronized void resume(StepCommand command) {
        if (state_ != SessionState.PAUSED) {
            throw new BridgeException(BridgeError.NOT_PAUSED);
        }
        slots_.replyCommand(command);
        state_ = SessionState.RUNNING;
        lastCommand_ = command;
    }

    /**
     * No-op if already paused. Otherwise interrupts Vim and waits for it to come back
     * with a GetCommand on its own.
     */
    public synchronized void pause() {
        switch (state_) {
            case PAUSED:
                return;
            case RUNNING:
                push(PushMode.EX, INTERRUPT_COMMAND);
                interruptRequested_ = true;
                return;
            case TERMINATED:
                throw new BridgeException(BridgeError.NOT_CONNECTED);
            default:
                throw new BridgeException(BridgeError.NOT_READY, "pause while " + state_);
        }
    }

    /**
     * Ends the session.
     *
     * @param force quit Vim; otherwise only the debugging session ends
     */
    public void terminate(boolean force) {
        synchronized (this) {
            if (state_ == SessionState.TERMINATED) {
                return;
            }
            if (slots_.isOpen(HookFunction.GET_COMMAND)) {
                slots_.replyCommand(force ? StepCommand.FORCE_QUIT : StepCommand.QUIT);
            }
            else if (force) {
                push(PushMode.EX, FORCE_QUIT_COMMAND);
            }
        }
        link_.close();
        // a link that was already gone never reports back
        onClosed();
    }

    private void push(PushMode mode, String command) {
        final var record = WireCodec.encodePush(mode, command);
        if (Log.isTraceEnabled()) {
            Log.trace("TX " + record);
        }
        link_.write(record);
    }

    //
    // introspection
    //

    public CompletableFuture<List<HookFrame>> stackTrace() {
        return correlator_
            .send(HookFunction.STACK_TRACE, new JsonObject())
            .thenApply(ReplyParser::frames);
    }

    public CompletableFuture<List<ScopeEntry>> scopes(int frameId) {
        final int requestedDuring;
        synchronized (this) {
            requestedDuring = pauseCount_;
        }
        return stackTrace().thenApply(frames -> {
            synchronized (this) {
                if (requestedDuring != pauseCount_) {
                    throw new BridgeException(BridgeError.INVALID_FRAME, "Frame " + frameId + " belongs to an earlier stop");
                }
                for (var frame : frames) {
                    if (frame.stackLevel == frameId) {
                        return refs_.scopesFor(frame);
                    }
                }
            }
            throw new BridgeException(BridgeError.INVALID_FRAME, "Invalid frame " + frameId);
        });
    }

    public CompletableFuture<List<HookVariable>> variables(VariablesHandle handle) {
        return refs_.variablesFor(handle);
    }

    /**
     * @param stackLevel nullable, Vim picks the current frame when absent
     * @param repl run it as an ex command rather than evaluating an expression
     * @return the result text, or Vim's failure text
     */
    public CompletableFuture<String> evaluate(String expression, Integer stackLevel, boolean repl) {
        final var arguments = new JsonObject();
        arguments.addProperty("expression", expression);
        if (stackLevel != null) {
            arguments.addProperty("stack_level", stackLevel);
        }
        return correlator_
            .send(repl ? HookFunction.EXECUTE : HookFunction.EVALUATE, arguments)
            .thenApply(ReplyParser::evaluation);
    }

    public CompletableFuture<int[]> setBreakpoints(String file, int[] lines) {
        return breakpoints_.setBreakpoints(file, lines);
    }
}
