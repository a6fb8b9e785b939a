package vimdebug;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.eclipse.lsp4j.debug.*;
import org.eclipse.lsp4j.debug.launch.DSPLauncher;
import org.eclipse.lsp4j.debug.services.IDebugProtocolClient;
import org.eclipse.lsp4j.debug.services.IDebugProtocolServer;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;

import vimdebug.link.HookServer;
import vimdebug.session.HookFrame;
import vimdebug.session.HookVariable;
import vimdebug.session.ScopeEntry;
import vimdebug.session.Session;
import vimdebug.session.StepCommand;
import vimdebug.strong.VariablesHandle;

/**
 * The editor-facing side. Every request is answered from the one hook session this server
 * owns; data requests return futures chained on the hook's replies, so the DAP listener
 * thread never waits on Vim.
 */
public class DapServer implements IDebugProtocolServer {
    /** Vim runs script on one thread, this is it */
    static final int THREAD_ID = 1;
    static final String THREAD_NAME = "Vim";

    private final Config config_;
    private IDebugProtocolClient clientProxy_;

    private volatile List<PathTransform> pathTransforms_ = new ArrayList<>();
    private volatile boolean clientSupportsRunInTerminal_ = true;

    private HookServer hookServer_ = null;
    private final CompletableFuture<Session> connected_ = new CompletableFuture<>();

    DapServer(Config config) {
        this.config_ = config;
    }

    void connectClient(IDebugProtocolClient client) {
        this.clientProxy_ = client;
    }

    static class DapEntry {
        public final DapServer server;
        public final Launcher<IDebugProtocolClient> launcher;
        private DapEntry(DapServer server, Launcher<IDebugProtocolClient> launcher) {
            this.server = server;
            this.launcher = launcher;
        }
    }

    /**
     * Serves one editor connection at a time, forever. Each editor connection gets its own
     * DapServer and so its own hook session.
     */
    static public void createForSocket(Config config) throws IOException, InterruptedException {
        final var host = config.getDapHost();
        final var port = config.getDapPort();

        try (var server = new ServerSocket()) {
            server.setReuseAddress(true);

            Log.info("binding dap server socket on " + host + ":" + port);
            server.bind(new InetSocketAddress(host, port));

            while (true) {
                Log.info("listening for inbound debugger connection on " + host + ":" + server.getLocalPort() + "...");

                try (var socket = server.accept()) {
                    Log.info("accepted debugger connection");

                    final var dapEntry = create(config, socket.getInputStream(), socket.getOutputStream());
                    try {
                        dapEntry.launcher.startListening().get(); // block until the connection closes
                    }
                    catch (ExecutionException e) {
                        Log.error("debugger connection failed", e.getCause());
                    }
                    finally {
                        dapEntry.server.shutdown();
                    }
                }

                Log.info("debugger connection closed");
            }
        }
    }

    static public DapEntry create(Config config, InputStream in, OutputStream out) {
        final var server = new DapServer(config);
        final var serverLauncher = DSPLauncher.createServerLauncher(server, in, out);
        server.connectClient(serverLauncher.getRemoteProxy());
        return new DapEntry(server, serverLauncher);
    }

    /**
     * Drops the hook session and stops listening. For when the editor goes away without
     * saying goodbye.
     */
    void shutdown() {
        final var session = connected_.getNow(null);
        if (session != null) {
            session.terminate(session.isBridgeStarted());
        }
        closeHookServer();
        Log.setDapClient(null);
    }

    //
    // session lifecycle
    //

    private class SessionEvents implements Session.Events {
        @Override
        public void initialized() {
            clientProxy_.initialized();
        }

        @Override
        public void stopped(String reason) {
            final var event = new StoppedEventArguments();
            event.setReason(reason);
            event.setThreadId(THREAD_ID);
            event.setAllThreadsStopped(true);
            clientProxy_.stopped(event);
        }

        @Override
        public void terminated() {
            clientProxy_.terminated(new TerminatedEventArguments());
            // no reconnects, a new debug session gets a new server
            closeHookServer();
        }
    }

    private synchronized CompletableFuture<Session> listen(int port, boolean bridgeStarted) {
        if (hookServer_ != null || connected_.isDone()) {
            throw new ResponseErrorException(new ResponseError(ResponseErrorCode.InvalidRequest, "already launched or attached", null));
        }

        try {
            hookServer_ = HookServer.listen(config_.getHost(), port, connection -> {
                final var session = new Session(connection, new SessionEvents(), config_, bridgeStarted);
                if (!connected_.complete(session)) {
                    throw new IllegalStateException("this debug session already had a Vim");
                }
                return session;
            });
        }
        catch (IOException e) {
            throw new ResponseErrorException(new ResponseError(
                ResponseErrorCode.InternalError,
                "couldn't listen for Vim on " + config_.getHost() + ":" + port + ": " + e.getMessage(),
                null
            ));
        }

        final var timeout = config_.getHandshakeTimeout();
        return connected_
            .copy()
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(e -> {
                final var cause = unwrap(e);
                if (cause instanceof TimeoutException) {
                    throw new BridgeException(BridgeError.NOT_CONNECTED, "Vim did not connect within " + timeout.toMillis() + "ms");
                }
                throw new CompletionException(cause);
            });
    }

    private synchronized void closeHookServer() {
        if (hookServer_ != null) {
            hookServer_.close();
        }
    }

    private Session session() {
        final var session = connected_.getNow(null);
        if (session == null) {
            throw new BridgeException(BridgeError.NOT_CONNECTED);
        }
        return session;
    }

    int hookPort() {
        synchronized (this) {
            return hookServer_ == null ? -1 : hookServer_.getLocalPort();
        }
    }

    //
    // errors
    //

    /**
     * Runs a request body, turning anything it throws (now or later) into a ResponseErrorException
     * the editor can show.
     */
    private static <T> CompletableFuture<T> guarded(Supplier<CompletableFuture<T>> body) {
        CompletableFuture<T> future;
        try {
            future = body.get();
        }
        catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        final var result = new CompletableFuture<T>();
        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            }
            else {
                result.completeExceptionally(toResponseError(error));
            }
        });
        return result;
    }

    static ResponseErrorException toResponseError(Throwable error) {
        final var cause = unwrap(error);
        if (cause instanceof ResponseErrorException) {
            return (ResponseErrorException)cause;
        }
        if (cause instanceof BridgeException) {
            final var e = (BridgeException)cause;
            Log.debug("request failed: " + e.getError() + " " + e.getMessage());
            return e.toResponseErrorException();
        }
        Log.error("internal error", cause);
        return new ResponseErrorException(new ResponseError(ResponseErrorCode.InternalError, String.valueOf(cause.getMessage()), null));
    }

    private static Throwable unwrap(Throwable e) {
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    private static ResponseErrorException invalidParams(String message) {
        return new ResponseErrorException(new ResponseError(ResponseErrorCode.InvalidParams, message, null));
    }

    //
    // launch / attach
    //

    @Override
    public CompletableFuture<Capabilities> initialize(InitializeRequestArguments args) {
        clientSupportsRunInTerminal_ = !Boolean.FALSE.equals(args.getSupportsRunInTerminalRequest());

        var c = new Capabilities();
        c.setSupportsConfigurationDoneRequest(true);
        c.setSupportsEvaluateForHovers(true);
        // accepted so editors stop asking, never verified
        c.setSupportsFunctionBreakpoints(true);
        c.setSupportsTerminateRequest(true);
        c.setSupportTerminateDebuggee(true);
        return CompletableFuture.completedFuture(c);
    }

    private void configureFromArgs(Map<String, Object> args) {
        if (Boolean.TRUE.equals(args.get("trace"))) {
            Log.setDapClient(clientProxy_);
        }

        pathTransforms_ = PathTransform.fromLaunchArgument(args.get("pathTransforms"));

        if (pathTransforms_.isEmpty()) {
            Log.info("No path transforms configured");
        }
        else {
            for (var transform : pathTransforms_) {
                Log.info(transform.toString());
            }
        }
    }

    private int portArg(Map<String, Object> args) {
        // json numbers come through as doubles
        final var v = args.get("port");
        if (v == null) {
            return config_.getPort();
        }
        if (!(v instanceof Number)) {
            throw invalidParams("'port' must be a number, got '" + v + "'");
        }
        final var port = ((Number)v).intValue();
        if (port < 0 || port > 65535) {
            throw invalidParams("'port' must be between 0 and 65535, got " + port);
        }
        return port;
    }

    private static String stringArg(Map<String, Object> args, String key, String defaultValue) {
        final var v = args.get(key);
        return v instanceof String && !((String)v).isEmpty() ? (String)v : defaultValue;
    }

    /**
     * `<vim> --cmd "source <hookScript>" <args...>`
     */
    static String[] vimCommandLine(String vim, String hookScript, Object extraArgs) {
        final var result = new ArrayList<String>();
        result.add(vim);
        result.add("--cmd");
        result.add("source " + hookScript);
        if (extraArgs instanceof List) {
            for (var e : (List<?>)extraArgs) {
                result.add(String.valueOf(e));
            }
        }
        return result.toArray(new String[0]);
    }

    @Override
    public CompletableFuture<Void> launch(Map<String, Object> args) {
        return guarded(() -> {
            configureFromArgs(args);

            if (!clientSupportsRunInTerminal_) {
                throw new ResponseErrorException(new ResponseError(ResponseErrorCode.InvalidRequest, "launching Vim needs an editor that supports runInTerminal; use attach instead", null));
            }

            final var hookScript = stringArg(args, "hookScript", config_.getHookScript());
            if (hookScript == null) {
                throw invalidParams("launch needs 'hookScript', the path of the Vim script that connects back to the debugger");
            }

            final var port = portArg(args);
            final var connected = listen(port, true);

            final var request = new RunInTerminalRequestArguments();
            request.setKind(RunInTerminalRequestArgumentsKind.INTEGRATED);
            request.setTitle("Vim");
            request.setCwd(stringArg(args, "cwd", System.getProperty("user.dir")));
            request.setArgs(vimCommandLine(stringArg(args, "vim", "vim"), hookScript, args.get("args")));

            if (args.get("env") instanceof Map) {
                final var env = new HashMap<String, String>();
                for (var e : ((Map<?,?>)args.get("env")).entrySet()) {
                    env.put(String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
                }
                request.setEnv(env);
            }

            Log.info("launching " + String.join(" ", request.getArgs()));

            return clientProxy_
                .runInTerminal(request)
                .thenCompose(response -> connected)
                .whenComplete((session, error) -> {
                    if (error != null) {
                        closeHookServer();
                    }
                })
                .thenApply(session -> (Void)null);
        });
    }

    @Override
    public CompletableFuture<Void> attach(Map<String, Object> args) {
        return guarded(() -> {
            configureFromArgs(args);
            return listen(portArg(args), false)
                .whenComplete((session, error) -> {
                    if (error != null) {
                        closeHookServer();
                    }
                })
                .thenApply(session -> (Void)null);
        });
    }

    @Override
    public CompletableFuture<Void> configurationDone(ConfigurationDoneArguments args) {
        return guarded(() -> {
            session().configurationDone();
            return CompletableFuture.completedFuture(null);
        });
    }

    //
    // breakpoints
    //

    @Override
    public CompletableFuture<SetBreakpointsResponse> setBreakpoints(SetBreakpointsArguments args) {
        return guarded(() -> {
            final var source = args.getSource();
            final var idePath = source.getPath();
            if (idePath == null) {
                throw invalidParams("breakpoints need a source path");
            }
            final var vimPath = PathTransform.ideToVim(pathTransforms_, idePath);
            Log.debug("bp for " + idePath + " -> " + vimPath);

            final var requested = args.getBreakpoints() == null ? new SourceBreakpoint[0] : args.getBreakpoints();
            final int[] lines = new int[requested.length];
            for (int i = 0; i < requested.length; ++i) {
                lines[i] = requested[i].getLine();
            }

            return session()
                .setBreakpoints(vimPath, lines)
                .thenApply(boundLines -> {
                    final var result = new Breakpoint[boundLines.length];
                    for (int i = 0; i < boundLines.length; ++i) {
                        final var bp = new Breakpoint();
                        // Vim doesn't tell us whether a line can hold a breakpoint
                        bp.setVerified(true);
                        bp.setLine(boundLines[i]);
                        bp.setSource(source);
                        result[i] = bp;
                    }
                    final var response = new SetBreakpointsResponse();
                    response.setBreakpoints(result);
                    return response;
                });
        });
    }

    @Override
    public CompletableFuture<SetFunctionBreakpointsResponse> setFunctionBreakpoints(SetFunctionBreakpointsArguments args) {
        final var requested = args.getBreakpoints() == null ? new FunctionBreakpoint[0] : args.getBreakpoints();
        final var result = new Breakpoint[requested.length];
        for (int i = 0; i < requested.length; ++i) {
            final var bp = new Breakpoint();
            bp.setVerified(false);
            bp.setMessage("function breakpoints are not supported");
            result[i] = bp;
        }
        final var response = new SetFunctionBreakpointsResponse();
        response.setBreakpoints(result);
        return CompletableFuture.completedFuture(response);
    }

    /**
     * No exception filters are advertised, but some editors send this anyway.
     */
    @Override
    public CompletableFuture<SetExceptionBreakpointsResponse> setExceptionBreakpoints(SetExceptionBreakpointsArguments args) {
        return CompletableFuture.completedFuture(new SetExceptionBreakpointsResponse());
    }

    //
    // inspection
    //

    @Override
    public CompletableFuture<ThreadsResponse> threads() {
        final var thread = new org.eclipse.lsp4j.debug.Thread();
        thread.setId(THREAD_ID);
        thread.setName(THREAD_NAME);

        final var response = new ThreadsResponse();
        response.setThreads(new org.eclipse.lsp4j.debug.Thread[] { thread });
        return CompletableFuture.completedFuture(response);
    }

    @Override
    public CompletableFuture<StackTraceResponse> stackTrace(StackTraceArguments args) {
        return guarded(() -> session().stackTrace().thenApply(frames -> {
            final int start = args.getStartFrame() == null ? 0 : Math.max(0, args.getStartFrame());
            final int levels = args.getLevels() == null || args.getLevels() <= 0 ? Integer.MAX_VALUE : args.getLevels();
            final int end = (int)Math.min((long)start + levels, frames.size());

            final var lspFrames = new ArrayList<StackFrame>();
            for (int i = start; i < end; ++i) {
                lspFrames.add(toLspFrame(frames.get(i)));
            }

            final var response = new StackTraceResponse();
            response.setStackFrames(lspFrames.toArray(new StackFrame[0]));
            response.setTotalFrames(frames.size());
            return response;
        }));
    }

    private StackFrame toLspFrame(HookFrame frame) {
        final var lspFrame = new StackFrame();
        lspFrame.setId(frame.stackLevel);
        lspFrame.setName(frame.name);
        lspFrame.setLine(frame.line);
        lspFrame.setColumn(1);

        if (frame.file != null && !frame.file.isEmpty()) {
            final var idePath = PathTransform.vimToIde(pathTransforms_, frame.file);
            final var source = new Source();
            source.setPath(idePath);
            final var fileName = Paths.get(frame.file).getFileName();
            source.setName(fileName == null ? idePath : fileName.toString());
            lspFrame.setSource(source);
        }

        return lspFrame;
    }

    @Override
    public CompletableFuture<ScopesResponse> scopes(ScopesArguments args) {
        return guarded(() -> session().scopes(args.getFrameId()).thenApply(entries -> {
            final var scopes = new ArrayList<Scope>();
            for (ScopeEntry entry : entries) {
                final var scope = new Scope();
                scope.setName(entry.name);
                scope.setVariablesReference(entry.handle.get());
                scope.setExpensive(entry.expensive);
                scopes.add(scope);
            }
            final var response = new ScopesResponse();
            response.setScopes(scopes.toArray(size -> new Scope[size]));
            return response;
        }));
    }

    @Override
    public CompletableFuture<VariablesResponse> variables(VariablesArguments args) {
        return guarded(() -> session().variables(VariablesHandle.of(args.getVariablesReference())).thenApply(vars -> {
            final var variables = new ArrayList<Variable>();
            for (HookVariable v : vars) {
                final var variable = new Variable();
                variable.setName(v.name);
                variable.setValue(v.value);
                variable.setType(v.type);
                // values arrive already rendered, nothing to expand
                variable.setVariablesReference(0);
                variables.add(variable);
            }
            final var response = new VariablesResponse();
            response.setVariables(variables.toArray(size -> new Variable[size]));
            return response;
        }));
    }

    @Override
    public CompletableFuture<EvaluateResponse> evaluate(EvaluateArguments args) {
        Log.debug("evaluate() called: expression=" + args.getExpression() + ", context=" + args.getContext() + ", frameId=" + args.getFrameId());
        final boolean repl = EvaluateArgumentsContext.REPL.equals(args.getContext());
        return guarded(() -> session().evaluate(args.getExpression(), args.getFrameId(), repl).thenApply(text -> {
            final var response = new EvaluateResponse();
            response.setResult(text);
            response.setVariablesReference(0);
            return response;
        }));
    }

    /**
     * Frames always carry a path the editor can open itself.
     */
    @Override
    public CompletableFuture<SourceResponse> source(SourceArguments args) {
        final var exceptionalResult = new CompletableFuture<SourceResponse>();
        final var error = new ResponseError(ResponseErrorCode.MethodNotFound, "'source' requests are not supported", null);
        exceptionalResult.completeExceptionally(new ResponseErrorException(error));
        return exceptionalResult;
    }

    //
    // execution control
    //

    @Override
    public CompletableFuture<Void> pause(PauseArguments args) {
        return guarded(() -> {
            session().pause();
            return CompletableFuture.completedFuture(null);
        });
    }

    @Override
    public CompletableFuture<ContinueResponse> continue_(ContinueArguments args) {
        return guarded(() -> {
            session().resume(StepCommand.CONTINUE);
            final var response = new ContinueResponse();
            response.setAllThreadsContinued(true);
            return CompletableFuture.completedFuture(response);
        });
    }

    @Override
    public CompletableFuture<Void> next(NextArguments args) {
        return resume(StepCommand.NEXT);
    }

    @Override
    public CompletableFuture<Void> stepIn(StepInArguments args) {
        return resume(StepCommand.STEP_IN);
    }

    @Override
    public CompletableFuture<Void> stepOut(StepOutArguments args) {
        return resume(StepCommand.STEP_OUT);
    }

    private CompletableFuture<Void> resume(StepCommand command) {
        return guarded(() -> {
            session().resume(command);
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * Quits Vim when asked to, or when we started it; otherwise lets it run on undebugged.
     */
    @Override
    public CompletableFuture<Void> disconnect(DisconnectArguments args) {
        return guarded(() -> {
            final var session = connected_.getNow(null);
            if (session != null) {
                final boolean force = Boolean.TRUE.equals(args.getTerminateDebuggee()) || session.isBridgeStarted();
                Log.info("editor disconnected" + (force ? ", quitting Vim" : ""));
                session.terminate(force);
            }
            closeHookServer();
            Log.setDapClient(null);
            return CompletableFuture.completedFuture(null);
        });
    }

    @Override
    public CompletableFuture<Void> terminate(TerminateArguments args) {
        return guarded(() -> {
            session().terminate(true);
            return CompletableFuture.completedFuture(null);
        });
    }
}
