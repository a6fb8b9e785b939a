package vimdebug.testutils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Scripted stand-in for the hook script running inside Vim. Services the bridge's requests
 * against a real breakpoint registry and canned stack/variables/evaluation data, and keeps
 * slot replies and pushes for the test to inspect.
 */
public class FakeVim {
    private final AtomicLong nextId_ = new AtomicLong(1);

    private final Map<String, TreeSet<Integer>> breakpoints_ = new HashMap<>();
    private final JsonArray frames_ = new JsonArray();
    private final Map<String, JsonArray> vars_ = new HashMap<>();
    private final Map<String, String> results_ = new HashMap<>();
    private final Map<String, String> errors_ = new HashMap<>();
    private final Set<String> unanswered_ = new HashSet<>();
    private volatile String breakpointError_ = null;

    public final List<JsonObject> requests = new ArrayList<>();
    public final List<String> executed = new ArrayList<>();

    /** `[ref, Reply]` records answering an Initialize or GetCommand */
    public final BlockingQueue<JsonArray> slotReplies = new LinkedBlockingQueue<>();
    /** `[mode, command]` records */
    public final BlockingQueue<JsonArray> pushes = new LinkedBlockingQueue<>();

    //
    // scripting
    //

    public synchronized FakeVim frame(int stackLevel, String name, int line, String file, String type) {
        final var frame = new JsonObject();
        frame.addProperty("stack_level", stackLevel);
        frame.addProperty("name", name);
        frame.addProperty("source_line", line);
        frame.addProperty("source_file", file);
        frame.addProperty("type", type);
        frames_.add(frame);
        return this;
    }

    public synchronized FakeVim variable(String scope, String name, String type, String value) {
        final var v = new JsonObject();
        v.addProperty("name", name);
        v.addProperty("type", type);
        v.addProperty("value", value);
        vars_.computeIfAbsent(scope, ignored -> new JsonArray()).add(v);
        return this;
    }

    public synchronized FakeVim evaluatesTo(String expression, String result) {
        results_.put(expression, result);
        return this;
    }

    public synchronized FakeVim failsWith(String expression, String error) {
        errors_.put(expression, error);
        return this;
    }

    /** requests for this function are swallowed, never answered */
    public synchronized FakeVim neverAnswer(String function) {
        unanswered_.add(function);
        return this;
    }

    public FakeVim failBreakpoints(String error) {
        breakpointError_ = error;
        return this;
    }

    public synchronized Set<Integer> breakpoints(String file) {
        final var lines = breakpoints_.get(file);
        return lines == null ? Set.of() : new TreeSet<>(lines);
    }

    public synchronized List<String> requestedFunctions() {
        final var result = new ArrayList<String>();
        for (var request : requests) {
            result.add(request.get("Function").getAsString());
        }
        return result;
    }

    //
    // records the interpreter sends on its own
    //

    public String initialize() {
        return record("Request", "Initialize", new JsonObject());
    }

    public String getCommand() {
        return record("Request", "GetCommand", new JsonObject());
    }

    public String breakNotify(String reason) {
        final var args = new JsonObject();
        if (reason != null) {
            args.addProperty("reason", reason);
        }
        return record("Notify", "Break", args);
    }

    private String record(String messageType, String function, JsonObject args) {
        return envelope(nextId_.getAndIncrement(), messageType, function, args);
    }

    public static String envelope(long id, String messageType, String function, JsonObject args) {
        final var payload = new JsonObject();
        payload.addProperty("Message_type", messageType);
        payload.addProperty("Function", function);
        payload.add("Arguments", args);
        final var record = new JsonArray();
        record.add(id);
        record.add(payload);
        return record.toString();
    }

    //
    // servicing the bridge
    //

    /**
     * Feed one record written by the bridge.
     *
     * @return the reply record to send back, if this record is a request that gets one
     */
    public synchronized Optional<String> onRecord(String line) {
        final var record = JsonParser.parseString(line).getAsJsonArray();

        if (record.get(0).getAsJsonPrimitive().isString()) {
            pushes.add(record);
            return Optional.empty();
        }

        final var payload = record.get(1).getAsJsonObject();
        final var messageType = payload.get("Message_type").getAsString();
        if (messageType.equals("Reply")) {
            slotReplies.add(record);
            return Optional.empty();
        }

        requests.add(payload);
        final var function = payload.get("Function").getAsString();
        if (unanswered_.contains(function)) {
            return Optional.empty();
        }

        final var args = payload.getAsJsonObject("Arguments");
        final var reply = new JsonObject();
        reply.add("request_id", args.get("request_id"));

        switch (function) {
            case "clearLineBreakpoints": {
                breakpoints_.remove(args.get("file").getAsString());
                break;
            }
            case "setLineBreakpoint": {
                if (breakpointError_ != null) {
                    reply.addProperty("error", breakpointError_);
                    break;
                }
                breakpoints_
                    .computeIfAbsent(args.get("file").getAsString(), ignored -> new TreeSet<>())
                    .add(args.get("line").getAsInt());
                break;
            }
            case "stackTrace": {
                reply.add("frames", frames_.deepCopy());
                break;
            }
            case "variables": {
                final var vars = vars_.get(args.get("scope").getAsString());
                reply.add("vars", vars == null ? new JsonArray() : vars.deepCopy());
                break;
            }
            case "evaluate": {
                final var expression = args.get("expression").getAsString();
                if (errors_.containsKey(expression)) {
                    reply.addProperty("error", errors_.get(expression));
                }
                else {
                    reply.addProperty("result", results_.getOrDefault(expression, ""));
                }
                break;
            }
            case "execute": {
                executed.add(args.get("expression").getAsString());
                reply.addProperty("result", "");
                break;
            }
            default:
                reply.addProperty("error", "E117: Unknown function: " + function);
        }

        return Optional.of(record("Reply", function, reply));
    }

    public JsonArray nextSlotReply() throws InterruptedException {
        return poll(slotReplies, "slot reply");
    }

    public JsonArray nextPush() throws InterruptedException {
        return poll(pushes, "push");
    }

    private static JsonArray poll(BlockingQueue<JsonArray> queue, String what) throws InterruptedException {
        final var v = queue.poll(5, TimeUnit.SECONDS);
        if (v == null) {
            throw new AssertionError("timed out waiting for a " + what);
        }
        return v;
    }

    public static String command(JsonElement slotReply) {
        return slotReply.getAsJsonArray().get(1).getAsJsonObject()
            .getAsJsonObject("Arguments")
            .get("Command").getAsString();
    }
}
