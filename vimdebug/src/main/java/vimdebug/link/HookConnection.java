package vimdebug.link;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import vimdebug.Log;

/**
 * One accepted hook connection: delivers newline-terminated records in order and
 * reports the end of the connection exactly once.
 */
public class HookConnection implements HookLink {
    public interface Listener {
        /**
         * Called on the connection's reader thread, once per record, in order.
         * The line has its terminator stripped.
         */
        void onLine(String line);

        /**
         * Called exactly once, on whichever thread noticed the connection was gone
         * (reader EOF, failed write, or an explicit close()).
         */
        void onClosed();
    }

    private static final ThreadFactory readerThreads = new ThreadFactoryBuilder()
        .setNameFormat("vimdebug-link-reader-%d")
        .setDaemon(true)
        .build();

    private final Socket socket_;
    private final Writer writer_;
    private final AtomicBoolean closed_ = new AtomicBoolean(false);
    private volatile Listener listener_;

    HookConnection(Socket socket) throws IOException {
        this.socket_ = socket;
        this.writer_ = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
    }

    public String describePeer() {
        return socket_.getInetAddress().getHostAddress() + ":" + socket_.getPort();
    }

    /**
     * Begin delivering records. Must be called exactly once.
     */
    void start(Listener listener) {
        if (listener_ != null) {
            throw new IllegalStateException("connection already started");
        }
        listener_ = listener;
        readerThreads.newThread(this::readLoop).start();
    }

    private void readLoop() {
        try (var reader = new BufferedReader(new InputStreamReader(socket_.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    listener_.onLine(line);
                }
                catch (RuntimeException e) {
                    // one bad record must not take the link down
                    Log.error("dropping record after handler failure", e);
                }
            }
        }
        catch (IOException e) {
            if (!closed_.get()) {
                Log.debug("hook connection read failed: " + e.getMessage());
            }
        }
        finally {
            close();
        }
    }

    /**
     * Fire-and-forget. A write on a closed connection is dropped; a failed write closes it.
     */
    @Override
    public void write(String record) {
        if (closed_.get()) {
            Log.warn("dropping write on closed hook connection: " + record);
            return;
        }
        try {
            synchronized (writer_) {
                writer_.write(record);
                writer_.write('\n');
                writer_.flush();
            }
        }
        catch (IOException e) {
            Log.error("hook connection write failed: " + e.getMessage());
            close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed_.get();
    }

    @Override
    public void close() {
        if (!closed_.compareAndSet(false, true)) {
            return;
        }
        try {
            socket_.close();
        }
        catch (IOException e) {
            Log.debug("error closing hook socket: " + e.getMessage());
        }
        final var listener = listener_;
        if (listener != null) {
            listener.onClosed();
        }
    }
}
