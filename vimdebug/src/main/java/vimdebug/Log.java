package vimdebug;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.eclipse.lsp4j.debug.OutputEventArguments;
import org.eclipse.lsp4j.debug.OutputEventArgumentsCategory;
import org.eclipse.lsp4j.debug.services.IDebugProtocolClient;

/**
 * Centralized logging for vimdebug.
 * - Writes to a log file if one is configured, otherwise to System.err.
 *   Never System.out, the editor may be speaking DAP over it.
 * - Optionally mirrors each line to the editor as a DAP output event
 *   (enabled by `trace` in launch/attach arguments).
 * - Respects a log level threshold (config key logLevel, default info).
 */
public final class Log {
    private static final String PREFIX = "[vimdebug] ";

    private static volatile PrintStream out = System.err;
    private static volatile LogLevel logLevel = LogLevel.INFO;

    // set while the editor has asked for traffic tracing
    private static volatile IDebugProtocolClient dapClient = null;

    private Log() {}

    public enum LogLevel {
        ERROR(0),
        INFO(1),
        DEBUG(2),
        TRACE(3);

        private final int level;

        LogLevel(int level) {
            this.level = level;
        }

        public boolean isEnabled(LogLevel threshold) {
            return this.level <= threshold.level;
        }

        public static LogLevel parse(String s) {
            switch (s.trim().toLowerCase()) {
                case "error": return ERROR;
                case "info": return INFO;
                case "debug": return DEBUG;
                case "trace": return TRACE;
                default:
                    throw new IllegalArgumentException("Invalid logLevel '" + s + "' (expected one of error, info, debug, trace).");
            }
        }
    }

    public static void setLogLevel(LogLevel level) {
        logLevel = level;
    }

    public static LogLevel getLogLevel() {
        return logLevel;
    }

    /**
     * Redirect log output to the given file (appending). A null path restores System.err.
     */
    public static void setLogFile(String path) throws FileNotFoundException {
        if (path == null) {
            out = System.err;
            return;
        }
        out = new PrintStream(new FileOutputStream(path, true), true, StandardCharsets.UTF_8);
    }

    static void setOutput(PrintStream stream) {
        out = stream;
    }

    /**
     * Pass null to stop forwarding (e.g. on disconnect).
     */
    public static void setDapClient(IDebugProtocolClient client) {
        dapClient = client;
    }

    public static boolean isTraceEnabled() {
        return LogLevel.TRACE.isEnabled(logLevel) || dapClient != null;
    }

    public static void info(String message) {
        if (!LogLevel.INFO.isEnabled(logLevel)) {
            return;
        }
        write(message);
        sendToDap(message, OutputEventArgumentsCategory.CONSOLE);
    }

    /**
     * Always logged regardless of log level.
     */
    public static void error(String message) {
        write("ERROR: " + message);
        sendToDap("ERROR: " + message, OutputEventArgumentsCategory.STDERR);
    }

    public static void error(String message, Throwable t) {
        error(message + ": " + t);
        t.printStackTrace(out);
    }

    public static void warn(String message) {
        if (!LogLevel.INFO.isEnabled(logLevel)) {
            return;
        }
        write("WARN: " + message);
        sendToDap("WARN: " + message, OutputEventArgumentsCategory.IMPORTANT);
    }

    public static void debug(String message) {
        if (!LogLevel.DEBUG.isEnabled(logLevel)) {
            return;
        }
        write("DEBUG: " + message);
        sendToDap("DEBUG: " + message, OutputEventArgumentsCategory.CONSOLE);
    }

    /**
     * Raw hook traffic. Logged at trace level, and sent to the editor whenever it asked for tracing.
     */
    public static void trace(String message) {
        if (LogLevel.TRACE.isEnabled(logLevel)) {
            write("TRACE: " + message);
        }
        sendToDap(message, OutputEventArgumentsCategory.CONSOLE);
    }

    private static void write(String message) {
        out.println(PREFIX + message);
    }

    private static void sendToDap(String message, String category) {
        IDebugProtocolClient client = dapClient;
        if (client != null) {
            try {
                var args = new OutputEventArguments();
                args.setCategory(category);
                args.setOutput(PREFIX + message + "\n");
                client.output(args);
            }
            catch (RuntimeException e) {
                // can't route this one through sendToDap again
                out.println(PREFIX + "Failed to send to DAP: " + e.getMessage());
            }
        }
    }
}
