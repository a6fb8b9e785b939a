package vimdebug.strong;

/**
 * Correlation key of a bridge-initiated request, carried in {@code Arguments.request_id}.
 */
public final class RequestID extends StrongT<Long> {
    public RequestID(Long v) {
        super(v);
    }

    public static RequestID of(long v) {
        return new RequestID(v);
    }
}
