package vimdebug.wire;

/**
 * First element of an unsolicited `[mode, command]` push.
 */
public enum PushMode {
    EX("ex"),
    NORMAL("normal");

    public final String wireName;

    PushMode(String wireName) {
        this.wireName = wireName;
    }
}
