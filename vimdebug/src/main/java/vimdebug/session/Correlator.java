package vimdebug.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.Log;
import vimdebug.link.HookLink;
import vimdebug.strong.RequestID;
import vimdebug.wire.HookFunction;
import vimdebug.wire.HookMessage;
import vimdebug.wire.WireCodec;

/**
 * Bridge-initiated requests to the hook, matched to their replies by Arguments.request_id.
 *
 * Every future handed out completes exactly once: with the matching reply, with
 * REQUEST_TIMEOUT, or with CONNECTION_CLOSED. An entry is only ever completed by whoever
 * managed to remove it from the pending map.
 */
public class Correlator {
    public static final String REQUEST_ID = "request_id";

    private final HookLink link_;
    private final Duration timeout_;
    private final AtomicLong nextRequestId_ = new AtomicLong();
    private final ConcurrentHashMap<RequestID, CompletableFuture<HookMessage>> pending_ = new ConcurrentHashMap<>();
    private volatile BridgeException closedWith_ = null;

    public Correlator(HookLink link, Duration timeout) {
        this.link_ = link;
        this.timeout_ = timeout;
    }

    public CompletableFuture<HookMessage> send(HookFunction function, JsonObject arguments) {
        final var closedWith = closedWith_;
        if (closedWith != null) {
            return CompletableFuture.failedFuture(closedWith);
        }

        final var id = RequestID.of(nextRequestId_.getAndIncrement());
        final var stamped = arguments == null ? new JsonObject() : arguments.deepCopy();
        stamped.addProperty(REQUEST_ID, id.get());

        final var future = new CompletableFuture<HookMessage>();
        pending_.put(id, future);

        // lost a race with failAll()
        if (closedWith_ != null && pending_.remove(id, future)) {
            future.completeExceptionally(closedWith_);
            return future;
        }

        CompletableFuture
            .delayedExecutor(timeout_.toMillis(), TimeUnit.MILLISECONDS)
            .execute(() -> {
                if (pending_.remove(id, future)) {
                    Log.warn(function.wireName + " request " + id.get() + " timed out after " + timeout_.toMillis() + "ms");
                    future.completeExceptionally(new BridgeException(
                        BridgeError.REQUEST_TIMEOUT,
                        "Vim did not answer '" + function.wireName + "' within " + timeout_.toMillis() + "ms"
                    ));
                }
            });

        final var record = WireCodec.encode(WireCodec.REQUEST_REF, HookMessage.request(function, stamped));
        if (Log.isTraceEnabled()) {
            Log.trace("TX " + record);
        }
        link_.write(record);

        return future;
    }

    /**
     * @return true if the reply resolved a pending request; stale, duplicate
     *         and unkeyed replies are dropped
     */
    public boolean dispatchReply(HookMessage reply) {
        final var idElement = reply.argument(REQUEST_ID);
        if (idElement == null || !idElement.isJsonPrimitive() || !idElement.getAsJsonPrimitive().isNumber()) {
            Log.debug("dropping reply without a numeric request_id: " + reply);
            return false;
        }

        final RequestID id;
        try {
            id = RequestID.of(idElement.getAsLong());
        }
        catch (NumberFormatException e) {
            Log.debug("dropping reply with a non-integer request_id: " + reply);
            return false;
        }

        final var future = pending_.remove(id);
        if (future == null) {
            Log.debug("dropping reply for unknown or expired request " + id.get());
            return false;
        }

        future.complete(reply);
        return true;
    }

    /**
     * Fails everything outstanding, and everything sent from now on.
     */
    public void failAll(BridgeException reason) {
        closedWith_ = reason;
        for (var id : new ArrayList<>(pending_.keySet())) {
            final var future = pending_.remove(id);
            if (future != null) {
                future.completeExceptionally(reason);
            }
        }
    }

    public int pendingCount() {
        return pending_.size();
    }
}
