import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.elara.debug.DebugLevel;
import com.elara.debug.DebugSink;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.KconfigEnvironment;

/** Fixture helpers shared by the Kconfig tests. */
final class KconfigTestSupport {

    /** Collects warnings and errors; debug chatter is dropped. */
    static final class CollectingSink implements DebugSink {
        final List<String> messages = new ArrayList<>();

        @Override
        public void log(DebugLevel level, String tag, String message, Throwable error) {
            if (level.compareTo(DebugLevel.WARN) >= 0) messages.add(message);
        }

        boolean contains(String fragment) {
            for (String m : messages) {
                if (m.contains(fragment)) return true;
            }
            return false;
        }
    }

    static Path write(Path dir, String name, String... lines) throws IOException {
        Path p = dir.resolve(name);
        if (p.getParent() != null) Files.createDirectories(p.getParent());
        Files.writeString(p, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return p;
    }

    static Kconfig load(Path dir, String... lines) throws IOException {
        return load(dir, new CollectingSink(), lines);
    }

    static Kconfig load(Path dir, CollectingSink sink, String... lines) throws IOException {
        Path file = write(dir, "Kconfig", lines);
        return Kconfig.load(file, KconfigEnvironment.empty(), true, sink);
    }

    static String read(Path p) throws IOException {
        return Files.readString(p, StandardCharsets.UTF_8);
    }

    private KconfigTestSupport() {}
}
