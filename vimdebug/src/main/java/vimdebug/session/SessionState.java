package vimdebug.session;

public enum SessionState {
    DISCONNECTED,
    /** connected, waiting for the hook's Initialize long-poll */
    AWAITING_INIT,
    /** Initialize slot open, editor is configuring breakpoints */
    READY,
    RUNNING,
    /** GetCommand slot open */
    PAUSED,
    TERMINATED
}
