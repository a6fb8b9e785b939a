package vimdebug.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import vimdebug.link.HookLink;

/**
 * In-memory link. Records every write; optionally hands writes to a FakeVim and feeds its
 * replies straight back, on the writing thread.
 */
public class RecordingLink implements HookLink {
    private final List<String> writes_ = new ArrayList<>();
    private boolean closed_ = false;
    private int closeCount_ = 0;

    private FakeVim vim_ = null;
    private Consumer<String> inbound_ = null;

    public RecordingLink() {}

    /**
     * @param inbound where the fake's replies go, normally Session::onLine
     */
    public RecordingLink wireTo(FakeVim vim, Consumer<String> inbound) {
        this.vim_ = vim;
        this.inbound_ = inbound;
        return this;
    }

    @Override
    public void write(String record) {
        synchronized (this) {
            writes_.add(record);
        }
        if (vim_ != null) {
            vim_.onRecord(record).ifPresent(inbound_);
        }
    }

    @Override
    public synchronized void close() {
        closed_ = true;
        closeCount_++;
    }

    @Override
    public synchronized boolean isClosed() {
        return closed_;
    }

    public synchronized List<String> writes() {
        return new ArrayList<>(writes_);
    }

    public synchronized String lastWrite() {
        return writes_.isEmpty() ? null : writes_.get(writes_.size() - 1);
    }

    public synchronized int closeCount() {
        return closeCount_;
    }
}
