package vimdebug.wire;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import vimdebug.Either;
import vimdebug.strong.EnvelopeID;

/**
 * Encodes and decodes the newline-delimited JSON records exchanged with the hook.
 *
 *   bridge -> hook:  [ref, {Message_type, Function, Arguments}]  or  [mode, command]
 *   hook -> bridge:  [id,  {Message_type, Function, Arguments}]
 *
 * Encoded records carry no trailing newline; the link adds it.
 */
public final class WireCodec {
    public static final String MESSAGE_TYPE = "Message_type";
    public static final String FUNCTION = "Function";
    public static final String ARGUMENTS = "Arguments";

    /** `ref` used for every bridge-initiated request; the real key is in Arguments.request_id */
    public static final long REQUEST_REF = 0;

    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private WireCodec() {}

    public static String encode(long ref, HookMessage message) {
        final var payload = new JsonObject();
        payload.addProperty(MESSAGE_TYPE, message.messageType.wireName);
        payload.addProperty(FUNCTION, message.functionName);
        payload.add(ARGUMENTS, message.arguments);

        final var record = new JsonArray();
        record.add(new JsonPrimitive(ref));
        record.add(payload);
        return gson.toJson(record);
    }

    public static String encodePush(PushMode mode, String command) {
        final var record = new JsonArray();
        record.add(mode.wireName);
        record.add(command);
        return gson.toJson(record);
    }

    /**
     * @return Left(reason) for anything that isn't a well formed inbound record
     */
    public static Either<String, InboundRecord> decode(String line) {
        final JsonElement root;
        try {
            root = JsonParser.parseString(line);
        }
        catch (JsonParseException e) {
            return Either.Left("not JSON: " + e.getMessage());
        }

        if (!root.isJsonArray() || root.getAsJsonArray().size() != 2) {
            return Either.Left("expected a two element array");
        }

        final var array = root.getAsJsonArray();
        final var idElement = array.get(0);
        final var payloadElement = array.get(1);

        if (!isNumber(idElement)) {
            return Either.Left("record id is not a number");
        }
        if (!payloadElement.isJsonObject()) {
            return Either.Left("record payload is not an object");
        }

        final long id;
        try {
            id = idElement.getAsLong();
        }
        catch (NumberFormatException e) {
            return Either.Left("record id is not an integer");
        }

        final var payload = payloadElement.getAsJsonObject();

        final var messageTypeElement = payload.get(MESSAGE_TYPE);
        if (!isString(messageTypeElement)) {
            return Either.Left("missing " + MESSAGE_TYPE);
        }
        final var messageType = MessageType.fromWireName(messageTypeElement.getAsString());
        if (messageType.isEmpty()) {
            return Either.Left("unknown " + MESSAGE_TYPE + " '" + messageTypeElement.getAsString() + "'");
        }

        final var functionElement = payload.get(FUNCTION);
        final String functionName;
        if (functionElement == null || functionElement.isJsonNull()) {
            functionName = "";
        }
        else if (isString(functionElement)) {
            functionName = functionElement.getAsString();
        }
        else {
            return Either.Left(FUNCTION + " is not a string");
        }

        final var argumentsElement = payload.get(ARGUMENTS);
        final JsonObject arguments;
        if (argumentsElement == null || argumentsElement.isJsonNull()) {
            arguments = new JsonObject();
        }
        else if (argumentsElement.isJsonObject()) {
            arguments = argumentsElement.getAsJsonObject();
        }
        else {
            return Either.Left(ARGUMENTS + " is not an object");
        }

        return Either.Right(new InboundRecord(
            EnvelopeID.of(id),
            new HookMessage(messageType.get(), functionName, arguments)
        ));
    }

    static boolean isNumber(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber();
    }

    static boolean isString(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }
}
