package vimdebug;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites a path prefix between the editor's view of the filesystem and Vim's,
 * e.g. a project opened at /home/me/proj while Vim runs in a container under /src.
 *
 * Configured in launch/attach arguments as
 *
 *   "pathTransforms": [ { "idePrefix": "/home/me/proj", "serverPrefix": "/src" } ]
 */
public final class PathTransform {
    // as sent by the editor, no case or separator adjustments
    private final String idePrefix_;
    private final String vimPrefix_;

    private final Pattern lenientIdePrefix_;
    private final Pattern lenientVimPrefix_;

    public PathTransform(String idePrefix, String vimPrefix) {
        this.idePrefix_ = idePrefix;
        this.vimPrefix_ = vimPrefix;
        this.lenientIdePrefix_ = lenientPrefixPattern(idePrefix);
        this.lenientVimPrefix_ = lenientPrefixPattern(vimPrefix);
    }

    /** empty if the prefix doesn't match, never null */
    public Optional<String> ideToVim(String path) {
        return replacePrefix(path, lenientIdePrefix_, vimPrefix_);
    }

    /** empty if the prefix doesn't match, never null */
    public Optional<String> vimToIde(String path) {
        return replacePrefix(path, lenientVimPrefix_, idePrefix_);
    }

    @Override
    public String toString() {
        return "PathTransform{idePrefix='" + idePrefix_ + "', serverPrefix='" + vimPrefix_ + "'}";
    }

    /**
     * First matching transform wins; a path no transform matches passes through unchanged.
     */
    public static String ideToVim(List<PathTransform> transforms, String path) {
        if (path == null) {
            return null;
        }
        for (var transform : transforms) {
            final var result = transform.ideToVim(path);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return path;
    }

    public static String vimToIde(List<PathTransform> transforms, String path) {
        if (path == null) {
            return null;
        }
        for (var transform : transforms) {
            final var result = transform.vimToIde(path);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return path;
    }

    /**
     * Accepts a list of {idePrefix, serverPrefix} objects or a single such object.
     * Entries missing either prefix are skipped.
     */
    public static List<PathTransform> fromLaunchArgument(Object maybeNull_val) {
        final var result = new ArrayList<PathTransform>();
        if (maybeNull_val instanceof List) {
            for (var e : (List<?>)maybeNull_val) {
                if (e instanceof Map) {
                    fromOne((Map<?,?>)e).ifPresent(result::add);
                }
            }
        }
        else if (maybeNull_val instanceof Map) {
            fromOne((Map<?,?>)maybeNull_val).ifPresent(result::add);
        }
        return result;
    }

    private static Optional<PathTransform> fromOne(Map<?,?> map) {
        final var idePrefix = map.get("idePrefix");
        // "vimPrefix" reads better for us, "serverPrefix" is what launch.json files already say
        final var vimPrefix = map.containsKey("vimPrefix") ? map.get("vimPrefix") : map.get("serverPrefix");

        if (idePrefix instanceof String && vimPrefix instanceof String) {
            return Optional.of(new PathTransform((String)idePrefix, (String)vimPrefix));
        }
        Log.warn("ignoring path transform without idePrefix/serverPrefix: " + map);
        return Optional.empty();
    }

    /**
     * "C:\proj\src" matches "c:/PROJ/src/a.vim", "C:\\proj/src\a.vim" and so on.
     */
    private static Pattern lenientPrefixPattern(String prefix) {
        final var body = Arrays
            .stream(prefix.split("[\\\\/]+"))
            .map(Pattern::quote)
            .collect(Collectors.joining("[\\\\/]+"));
        return Pattern.compile("(?i)^" + body + "(.*)$", Pattern.DOTALL);
    }

    private static Optional<String> replacePrefix(String path, Pattern lenientPattern, String replacement) {
        final var m = lenientPattern.matcher(path);
        if (m.matches()) {
            return Optional.of(replacement + m.group(1));
        }
        return Optional.empty();
    }
}
