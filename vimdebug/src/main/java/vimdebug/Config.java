package vimdebug;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Bridge configuration.
 *
 * Built from an argument string of the form
 *
 *   host=127.0.0.1,port=4321,dapPort=5678,hookScript=/opt/vimdebug/hook.vim,log=/tmp/vimdebug.log,logLevel=debug
 *
 * Any key missing from the string falls back to the system property `vimdebug.<key>`
 * or the environment variable `VIMDEBUG_<KEY>`, then to its default.
 */
public class Config {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 4321;
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    /**
     * where the hook connects to
     */
    private final String host_;
    private final int port_;

    /**
     * where the editor connects to; dapPort < 0 means "speak DAP over stdin/stdout"
     */
    private final String dapHost_;
    private final int dapPort_;

    private final Duration handshakeTimeout_;
    private final Duration requestTimeout_;

    /** nullable; path of the hook script `launch` sources when the editor doesn't name one */
    private final String hookScript_;

    /** nullable, System.err if null */
    private final String logFile_;
    private final Log.LogLevel logLevel_;

    Config(String host, int port, String dapHost, int dapPort, Duration handshakeTimeout, Duration requestTimeout, String hookScript, String logFile, Log.LogLevel logLevel) {
        this.host_ = host;
        this.port_ = port;
        this.dapHost_ = dapHost;
        this.dapPort_ = dapPort;
        this.handshakeTimeout_ = handshakeTimeout;
        this.requestTimeout_ = requestTimeout;
        this.hookScript_ = hookScript;
        this.logFile_ = logFile;
        this.logLevel_ = logLevel;
    }

    public static Config defaults() {
        return parse("");
    }

    public static Config parse(String argString) {
        final var raw = new HashMap<String, String>();

        if (argString != null && !argString.isBlank()) {
            for (var eachArg : argString.split(",")) {
                final var nameAndValue = eachArg.split("=", 2);
                if (nameAndValue.length != 2) {
                    throw new IllegalArgumentException("Invalid argument '" + eachArg + "' (expected name=value).");
                }
                raw.put(nameAndValue[0].trim().toLowerCase(), nameAndValue[1].trim());
            }
        }

        final var host = stringSetting(raw, "host", DEFAULT_HOST);
        final var port = intSetting(raw, "port", DEFAULT_PORT);
        final var dapHost = stringSetting(raw, "dapHost", DEFAULT_HOST);
        final var dapPort = intSetting(raw, "dapPort", -1);
        final var handshakeTimeout = millisSetting(raw, "handshakeTimeout", DEFAULT_HANDSHAKE_TIMEOUT);
        final var requestTimeout = millisSetting(raw, "requestTimeout", DEFAULT_REQUEST_TIMEOUT);
        final var hookScript = stringSetting(raw, "hookScript", null);
        final var logFile = stringSetting(raw, "log", null);
        final var logLevelString = stringSetting(raw, "logLevel", null);
        final var logLevel = logLevelString == null ? Log.LogLevel.INFO : Log.LogLevel.parse(logLevelString);

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port value (got '" + port + "', expected 0-65535).");
        }

        return new Config(host, port, dapHost, dapPort, handshakeTimeout, requestTimeout, hookScript, logFile, logLevel);
    }

    private static String stringSetting(Map<String, String> raw, String key, String defaultValue) {
        var v = raw.get(key.toLowerCase());
        if (v == null) {
            v = EnvUtil.getSetting(key);
        }
        return v == null ? defaultValue : v;
    }

    private static int intSetting(Map<String, String> raw, String key, int defaultValue) {
        final var v = stringSetting(raw, key, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value (got '" + v + "' but expected an integer).");
        }
    }

    private static Duration millisSetting(Map<String, String> raw, String key, Duration defaultValue) {
        final var millis = intSetting(raw, key, -1);
        if (millis < 0) {
            return defaultValue;
        }
        return Duration.ofMillis(millis);
    }

    public String getHost() {
        return host_;
    }

    public int getPort() {
        return port_;
    }

    public String getDapHost() {
        return dapHost_;
    }

    public int getDapPort() {
        return dapPort_;
    }

    public boolean getServeDapOverSocket() {
        return dapPort_ >= 0;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout_;
    }

    public Duration getRequestTimeout() {
        return requestTimeout_;
    }

    public String getHookScript() {
        return hookScript_;
    }

    public String getLogFile() {
        return logFile_;
    }

    public Log.LogLevel getLogLevel() {
        return logLevel_;
    }

    /**
     * Same settings, but listening for the hook on another port (launch/attach `port` argument).
     */
    public Config withPort(int port) {
        return new Config(host_, port, dapHost_, dapPort_, handshakeTimeout_, requestTimeout_, hookScript_, logFile_, logLevel_);
    }

    @Override
    public String toString() {
        return "Config{host=" + host_ + ", port=" + port_
            + ", dap=" + (getServeDapOverSocket() ? dapHost_ + ":" + dapPort_ : "stdio")
            + ", handshakeTimeout=" + handshakeTimeout_.toMillis() + "ms"
            + ", requestTimeout=" + requestTimeout_.toMillis() + "ms"
            + ", hookScript=" + hookScript_
            + ", log=" + (logFile_ == null ? "stderr" : logFile_)
            + ", logLevel=" + logLevel_ + "}";
    }
}
