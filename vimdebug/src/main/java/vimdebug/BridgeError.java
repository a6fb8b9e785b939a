package vimdebug;

/**
 * Stable error codes reported to the editor. The numbers are part of the
 * editor-facing contract and must not be renumbered.
 */
public enum BridgeError {
    NOT_PAUSED(-100, "Vim is not paused"),
    INVALID_FRAME(-101, "Invalid frame"),
    INVALID_REFERENCE(-102, "Invalid variables reference"),
    NOT_CONNECTED(-103, "Vim is not connected"),
    CONNECTION_CLOSED(-104, "Connection to Vim closed"),
    REQUEST_TIMEOUT(-105, "Vim did not answer in time"),
    MALFORMED_REPLY(-106, "Malformed reply from Vim"),
    SLOT_OCCUPIED(-107, "A command request is already pending"),
    NOT_READY(-108, "Vim has not finished initializing");

    public final int code;
    public final String defaultMessage;

    BridgeError(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
