package vimdebug.session;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import vimdebug.BridgeError;
import vimdebug.testutils.FakeVim;
import vimdebug.testutils.RecordingLink;
import vimdebug.wire.WireCodec;

class BreakpointManagerTest {
    private final FakeVim vim = new FakeVim();
    private final RecordingLink link = new RecordingLink();
    private final Correlator correlator = new Correlator(link, Duration.ofSeconds(5));
    private final BreakpointManager breakpoints = new BreakpointManager(correlator);

    BreakpointManagerTest() {
        link.wireTo(vim, line -> correlator.dispatchReply(WireCodec.decode(line).getRight().message));
    }

    @Test
    void replacesTheFilesBreakpoints() {
        assertArrayEquals(new int[] { 3, 7 }, breakpoints.setBreakpoints("/src/a.vim", new int[] { 3, 7 }).join());
        assertEquals(Set.of(3, 7), vim.breakpoints("/src/a.vim"));

        assertArrayEquals(new int[] { 12 }, breakpoints.setBreakpoints("/src/a.vim", new int[] { 12 }).join());
        assertEquals(Set.of(12), vim.breakpoints("/src/a.vim"));
    }

    @Test
    void leavesOtherFilesAlone() {
        breakpoints.setBreakpoints("/src/a.vim", new int[] { 1 }).join();
        breakpoints.setBreakpoints("/src/b.vim", new int[] { 2 }).join();
        breakpoints.setBreakpoints("/src/a.vim", new int[] {}).join();

        assertEquals(Set.of(), vim.breakpoints("/src/a.vim"));
        assertEquals(Set.of(2), vim.breakpoints("/src/b.vim"));
    }

    @Test
    void clearsBeforeSetting() {
        breakpoints.setBreakpoints("/src/a.vim", new int[] { 4, 5 }).join();
        assertEquals(List.of("clearLineBreakpoints", "setLineBreakpoint", "setLineBreakpoint"), vim.requestedFunctions());
    }

    @Test
    void anErrorFromVimFailsTheWholeCall() {
        vim.failBreakpoints("E161: Breakpoint not found");
        final var result = breakpoints.setBreakpoints("/src/a.vim", new int[] { 4 });
        assertEquals(BridgeError.MALFORMED_REPLY, CorrelatorTest.errorOf(result));
    }
}
