package vimdebug.session;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import vimdebug.BridgeError;
import vimdebug.BridgeException;
import vimdebug.wire.HookMessage;

/**
 * Pulls typed values out of hook replies. Anything missing or mistyped fails with
 * MALFORMED_REPLY, which fails the one operation that asked.
 */
final class ReplyParser {
    private ReplyParser() {}

    static List<HookFrame> frames(HookMessage reply) {
        final var frames = requireArray(reply, "frames");
        final var result = new ArrayList<HookFrame>(frames.size());
        for (var e : frames) {
            final var frame = requireObject(e, "frame");
            result.add(new HookFrame(
                requireInt(frame, "stack_level"),
                requireString(frame, "name"),
                requireInt(frame, "source_line"),
                requireString(frame, "source_file"),
                FrameKind.fromWire(optionalString(frame, "type"))
            ));
        }
        return result;
    }

    static List<HookVariable> variables(HookMessage reply) {
        final var vars = requireArray(reply, "vars");
        final var result = new ArrayList<HookVariable>(vars.size());
        for (var e : vars) {
            final var v = requireObject(e, "variable");
            result.add(new HookVariable(
                requireString(v, "name"),
                optionalString(v, "type"),
                requireString(v, "value")
            ));
        }
        return result;
    }

    /**
     * The evaluation result, or the interpreter's failure text if it reported one.
     */
    static String evaluation(HookMessage reply) {
        final var error = reply.argument("error");
        if (error != null) {
            return asText(error);
        }
        final var result = reply.argument("result");
        if (result == null) {
            throw malformed(reply.functionName + " reply has neither result nor error");
        }
        return asText(result);
    }

    private static String asText(JsonElement e) {
        return e.isJsonPrimitive() ? e.getAsString() : e.toString();
    }

    private static JsonArray requireArray(HookMessage reply, String name) {
        final var e = reply.argument(name);
        if (e == null || !e.isJsonArray()) {
            throw malformed(reply.functionName + " reply is missing '" + name + "'");
        }
        return e.getAsJsonArray();
    }

    private static JsonObject requireObject(JsonElement e, String what) {
        if (e == null || !e.isJsonObject()) {
            throw malformed(what + " entry is not an object: " + e);
        }
        return e.getAsJsonObject();
    }

    private static int requireInt(JsonObject o, String name) {
        final var e = o.get(name);
        if (e == null || !e.isJsonPrimitive()) {
            throw malformed("'" + name + "' missing in " + o);
        }
        try {
            return e.getAsInt();
        }
        catch (NumberFormatException ex) {
            throw malformed("'" + name + "' is not an integer in " + o);
        }
    }

    private static String requireString(JsonObject o, String name) {
        final var e = o.get(name);
        if (e == null || !e.isJsonPrimitive()) {
            throw malformed("'" + name + "' missing in " + o);
        }
        return e.getAsString();
    }

    private static String optionalString(JsonObject o, String name) {
        final var e = o.get(name);
        return e == null || !e.isJsonPrimitive() ? null : e.getAsString();
    }

    private static BridgeException malformed(String message) {
        return new BridgeException(BridgeError.MALFORMED_REPLY, message);
    }
}
