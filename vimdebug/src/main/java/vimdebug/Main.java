package vimdebug;

import java.io.FileNotFoundException;
import java.util.concurrent.ExecutionException;

/**
 * Entry point. Arguments are config settings, either as one string or split up:
 *
 *   java -jar vimdebug-all.jar port=4321,logLevel=debug
 *   java -jar vimdebug-all.jar port=4321 logLevel=debug
 *
 * vimdebug-all.jar is the self-contained jar the build shades together with lsp4j, gson and guava.
 */
public class Main {
    public static void main(String[] args) {
        final Config config;
        try {
            config = Config.parse(String.join(",", args));
        }
        catch (IllegalArgumentException e) {
            Log.error(e.getMessage());
            System.exit(2);
            return;
        }

        Log.setLogLevel(config.getLogLevel());
        if (config.getLogFile() != null) {
            try {
                Log.setLogFile(config.getLogFile());
            }
            catch (FileNotFoundException e) {
                Log.error("couldn't open log file " + config.getLogFile() + ", logging to stderr", e);
            }
        }

        Log.info("starting, " + config);

        try {
            if (config.getServeDapOverSocket()) {
                DapServer.createForSocket(config);
            }
            else {
                // stdout belongs to DAP from here on
                final var dapEntry = DapServer.create(config, System.in, System.out);
                try {
                    dapEntry.launcher.startListening().get();
                }
                finally {
                    dapEntry.server.shutdown();
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (ExecutionException e) {
            Log.error("debugger connection failed", e.getCause());
            System.exit(1);
        }
        catch (Throwable e) {
            Log.error("fatal", e);
            System.exit(1);
        }

        Log.info("editor went away, exiting");
        System.exit(0);
    }
}
