package vimdebug;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

class PathTransformTest {
    @Test
    void rewritesInBothDirections() {
        final var transform = new PathTransform("/home/me/proj", "/src");

        assertEquals(Optional.of("/src/plugin/a.vim"), transform.ideToVim("/home/me/proj/plugin/a.vim"));
        assertEquals(Optional.of("/home/me/proj/plugin/a.vim"), transform.vimToIde("/src/plugin/a.vim"));
        assertEquals(Optional.empty(), transform.ideToVim("/elsewhere/a.vim"));
    }

    @Test
    void matchingIgnoresCaseAndSeparatorStyle() {
        final var transform = new PathTransform("C:\\Users\\me\\proj", "/src");

        assertEquals(Optional.of("/src\\a.vim"), transform.ideToVim("c:/users/ME/proj\\a.vim"));
        assertEquals(Optional.of("/src/a.vim"), transform.ideToVim("C:\\\\Users/me\\proj/a.vim"));
    }

    @Test
    void firstMatchWinsAndUnmatchedPathsPassThrough() {
        final var transforms = List.of(
            new PathTransform("/a/b", "/one"),
            new PathTransform("/a", "/two")
        );

        assertEquals("/one/x.vim", PathTransform.ideToVim(transforms, "/a/b/x.vim"));
        assertEquals("/two/c/x.vim", PathTransform.ideToVim(transforms, "/a/c/x.vim"));
        assertEquals("/z/x.vim", PathTransform.ideToVim(transforms, "/z/x.vim"));
        assertEquals("/a/b/x.vim", PathTransform.vimToIde(transforms, "/one/x.vim"));
        assertNull(PathTransform.vimToIde(transforms, null));
    }

    @Test
    void readsLaunchArguments() {
        final var list = PathTransform.fromLaunchArgument(List.of(
            Map.of("idePrefix", "/home/me", "serverPrefix", "/src"),
            Map.of("idePrefix", "/x", "vimPrefix", "/y"),
            Map.of("idePrefix", "/missing-the-other-half"),
            "not a map"
        ));
        assertEquals(2, list.size());
        assertEquals("/y/f.vim", list.get(1).ideToVim("/x/f.vim").get());

        assertEquals(1, PathTransform.fromLaunchArgument(Map.of("idePrefix", "/a", "serverPrefix", "/b")).size());
        assertTrue(PathTransform.fromLaunchArgument(null).isEmpty());
    }
}
