package vimdebug.session;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.testutils.RecordingLink;
import vimdebug.wire.HookFunction;
import vimdebug.wire.HookMessage;
import vimdebug.wire.MessageType;

class CorrelatorTest {
    private static HookMessage replyFor(long requestId, String result) {
        final var args = new JsonObject();
        args.addProperty("request_id", requestId);
        args.addProperty("result", result);
        return new HookMessage(MessageType.REPLY, "evaluate", args);
    }

    private static long requestIdOf(String record) {
        return JsonParser.parseString(record).getAsJsonArray()
            .get(1).getAsJsonObject()
            .getAsJsonObject("Arguments")
            .get("request_id").getAsLong();
    }

    @Test
    void stampsRequestIdsAndSendsWithRefZero() {
        final var link = new RecordingLink();
        final var correlator = new Correlator(link, Duration.ofSeconds(10));

        final var args = new JsonObject();
        args.addProperty("expression", "1+1");
        correlator.send(HookFunction.EVALUATE, args);
        correlator.send(HookFunction.EVALUATE, args);

        final var writes = link.writes();
        assertEquals(2, writes.size());
        assertTrue(writes.get(0).startsWith("[0,"));
        assertEquals(0, requestIdOf(writes.get(0)));
        assertEquals(1, requestIdOf(writes.get(1)));
        // caller's object is left alone
        assertFalse(args.has("request_id"));
    }

    @Test
    void shuffledRepliesResolveTheirOwnRequests() {
        final var link = new RecordingLink();
        final var correlator = new Correlator(link, Duration.ofSeconds(10));

        final var futures = new ArrayList<CompletableFuture<HookMessage>>();
        for (int i = 0; i < 50; ++i) {
            futures.add(correlator.send(HookFunction.EVALUATE, new JsonObject()));
        }

        final var ids = new ArrayList<Long>();
        for (var record : link.writes()) {
            ids.add(requestIdOf(record));
        }
        Collections.shuffle(ids, new Random(1234));

        for (var id : ids) {
            assertTrue(correlator.dispatchReply(replyFor(id, "result-" + id)));
        }

        for (int i = 0; i < futures.size(); ++i) {
            final var reply = futures.get(i).join();
            assertEquals(i, reply.argument("request_id").getAsLong());
            assertEquals("result-" + i, reply.argument("result").getAsString());
        }
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void dropsRepliesNobodyIsWaitingFor() {
        final var correlator = new Correlator(new RecordingLink(), Duration.ofSeconds(10));
        final var future = correlator.send(HookFunction.STACK_TRACE, new JsonObject());

        assertFalse(correlator.dispatchReply(replyFor(99, "who?")));
        assertFalse(correlator.dispatchReply(new HookMessage(MessageType.REPLY, "evaluate", new JsonObject())));
        assertFalse(future.isDone());

        assertTrue(correlator.dispatchReply(replyFor(0, "ok")));
        // a second reply for the same id is stale
        assertFalse(correlator.dispatchReply(replyFor(0, "again")));
        assertEquals("ok", future.join().argument("result").getAsString());
    }

    @Test
    void failAllFailsEveryPendingRequestAndLaterOnes() {
        final var correlator = new Correlator(new RecordingLink(), Duration.ofSeconds(10));

        final var futures = new ArrayList<CompletableFuture<HookMessage>>();
        for (int i = 0; i < 5; ++i) {
            futures.add(correlator.send(HookFunction.VARIABLES, new JsonObject()));
        }

        correlator.failAll(new BridgeException(BridgeError.CONNECTION_CLOSED));

        assertEquals(0, correlator.pendingCount());
        for (var future : futures) {
            assertEquals(BridgeError.CONNECTION_CLOSED, errorOf(future));
        }

        final var late = correlator.send(HookFunction.VARIABLES, new JsonObject());
        assertEquals(BridgeError.CONNECTION_CLOSED, errorOf(late));
    }

    @Test
    void timesOutUnansweredRequests() throws Exception {
        final var correlator = new Correlator(new RecordingLink(), Duration.ofMillis(50));
        final var future = correlator.send(HookFunction.STACK_TRACE, new JsonObject());

        final var error = assertThrows(
            Exception.class,
            () -> future.get(5, TimeUnit.SECONDS)
        );
        assertTrue(error.getCause() instanceof BridgeException);
        assertEquals(BridgeError.REQUEST_TIMEOUT, ((BridgeException)error.getCause()).getError());
        assertEquals(0, correlator.pendingCount());

        // the reply finally shows up and is dropped
        assertFalse(correlator.dispatchReply(replyFor(0, "late")));
    }

    static BridgeError errorOf(CompletableFuture<?> future) {
        final var e = assertThrows(CompletionException.class, future::join);
        assertTrue(e.getCause() instanceof BridgeException, "unexpected " + e.getCause());
        return ((BridgeException)e.getCause()).getError();
    }
}
