package vimdebug.link;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import vimdebug.Log;

/**
 * Listens for the hook. Only one connection is serviced at a time; connection attempts
 * made while one is active are accepted and closed straight away.
 */
public class HookServer implements AutoCloseable {
    private static final ThreadFactory acceptThreads = new ThreadFactoryBuilder()
        .setNameFormat("vimdebug-link-accept-%d")
        .setDaemon(true)
        .build();

    private final ServerSocket server_;
    private final Function<HookConnection, HookConnection.Listener> onConnect_;
    private final AtomicReference<HookConnection> active_ = new AtomicReference<>();

    private HookServer(ServerSocket server, Function<HookConnection, HookConnection.Listener> onConnect) {
        this.server_ = server;
        this.onConnect_ = onConnect;
    }

    /**
     * Bind and start accepting.
     *
     * @param onConnect called on the accept thread for each serviced connection;
     *                  returns the listener that will receive that connection's records
     */
    public static HookServer listen(String host, int port, Function<HookConnection, HookConnection.Listener> onConnect) throws IOException {
        final var server = new ServerSocket();
        try {
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(host, port), 1);
        }
        catch (IOException | RuntimeException e) {
            server.close();
            throw e;
        }

        Log.info("listening for Vim on " + host + ":" + server.getLocalPort());

        final var result = new HookServer(server, onConnect);
        acceptThreads.newThread(result::acceptLoop).start();
        return result;
    }

    public int getLocalPort() {
        return server_.getLocalPort();
    }

    public boolean hasActiveConnection() {
        return active_.get() != null;
    }

    private void acceptLoop() {
        while (!server_.isClosed()) {
            final Socket socket;
            try {
                socket = server_.accept();
            }
            catch (SocketException e) {
                // close() was called
                break;
            }
            catch (IOException e) {
                Log.error("accept failed", e);
                break;
            }

            final HookConnection connection;
            try {
                connection = new HookConnection(socket);
            }
            catch (IOException e) {
                Log.error("couldn't set up hook connection", e);
                closeQuietly(socket);
                continue;
            }

            if (!active_.compareAndSet(null, connection)) {
                Log.warn("ignoring connection from " + connection.describePeer() + ", Vim is already connected");
                closeQuietly(socket);
                continue;
            }

            Log.info("Vim connected from " + connection.describePeer());

            final HookConnection.Listener listener;
            try {
                listener = onConnect_.apply(connection);
            }
            catch (RuntimeException e) {
                Log.error("rejecting hook connection", e);
                active_.set(null);
                closeQuietly(socket);
                continue;
            }

            connection.start(new HookConnection.Listener() {
                @Override
                public void onLine(String line) {
                    listener.onLine(line);
                }

                @Override
                public void onClosed() {
                    active_.compareAndSet(connection, null);
                    Log.info("Vim disconnected");
                    listener.onClosed();
                }
            });
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        }
        catch (IOException e) {
            Log.debug("error closing socket: " + e.getMessage());
        }
    }

    /**
     * Stops listening and closes the active connection, if any.
     */
    @Override
    public void close() {
        try {
            server_.close();
        }
        catch (IOException e) {
            Log.debug("error closing hook server socket: " + e.getMessage());
        }
        final var connection = active_.get();
        if (connection != null) {
            connection.close();
        }
    }
}
