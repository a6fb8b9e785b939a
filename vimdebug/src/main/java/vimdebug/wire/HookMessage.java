package vimdebug.wire;

import java.util.Objects;
import java.util.Optional;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * The payload half of a `[id, payload]` record, in either direction.
 */
public final class HookMessage {
    public final MessageType messageType;
    /**
     * As received. Kept even when it doesn't name a known {@link HookFunction}, for logging.
     */
    public final String functionName;
    /**
     * nonNull, possibly empty
     */
    public final JsonObject arguments;

    public HookMessage(MessageType messageType, String functionName, JsonObject arguments) {
        this.messageType = Objects.requireNonNull(messageType);
        this.functionName = Objects.requireNonNull(functionName);
        this.arguments = arguments == null ? new JsonObject() : arguments;
    }

    public static HookMessage request(HookFunction function, JsonObject arguments) {
        return new HookMessage(MessageType.REQUEST, function.wireName, arguments);
    }

    public static HookMessage reply(HookFunction function, JsonObject arguments) {
        return new HookMessage(MessageType.REPLY, function.wireName, arguments);
    }

    public Optional<HookFunction> function() {
        return HookFunction.fromWireName(functionName);
    }

    /**
     * @return the argument, or null if absent or JSON null
     */
    public JsonElement argument(String name) {
        final var v = arguments.get(name);
        return v == null || v.isJsonNull() ? null : v;
    }

    @Override
    public String toString() {
        return "HookMessage{" + messageType.wireName + "/" + functionName + " " + arguments + "}";
    }
}
