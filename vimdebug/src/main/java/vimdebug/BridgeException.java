package vimdebug;

import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;

public class BridgeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final BridgeError error_;

    public BridgeException(BridgeError error) {
        this(error, error.defaultMessage);
    }

    public BridgeException(BridgeError error, String message) {
        super(message);
        this.error_ = error;
    }

    public BridgeException(BridgeError error, String message, Throwable cause) {
        super(message, cause);
        this.error_ = error;
    }

    public BridgeError getError() {
        return error_;
    }

    public ResponseErrorException toResponseErrorException() {
        return new ResponseErrorException(new ResponseError(error_.code, getMessage(), null));
    }
}
