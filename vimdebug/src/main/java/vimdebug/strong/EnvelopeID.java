package vimdebug.strong;

/**
 * The first element of an inbound {@code [id, payload]} record.
 * Only meaningful for the long-polls that open a command slot.
 */
public final class EnvelopeID extends StrongT<Long> {
    public EnvelopeID(Long v) {
        super(v);
    }

    public static EnvelopeID of(long v) {
        return new EnvelopeID(v);
    }
}
