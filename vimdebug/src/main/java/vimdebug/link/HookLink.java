package vimdebug.link;

/**
 * What a session needs from the transport: fire-and-forget writes and a way to hang up.
 */
public interface HookLink {
    /**
     * @param record one encoded record, without the line terminator
     */
    void write(String record);

    void close();

    boolean isClosed();
}
