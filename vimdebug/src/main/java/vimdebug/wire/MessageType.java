package vimdebug.wire;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * payload.Message_type
 */
public enum MessageType {
    NOTIFY("Notify"),
    REQUEST("Request"),
    REPLY("Reply");

    public final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    private static final ImmutableMap<String, MessageType> byWireName;
    static {
        var builder = ImmutableMap.<String, MessageType>builder();
        for (var v : values()) {
            builder.put(v.wireName, v);
        }
        byWireName = builder.build();
    }

    public static Optional<MessageType> fromWireName(String name) {
        return Optional.ofNullable(byWireName.get(name));
    }
}
