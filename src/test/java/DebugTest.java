import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.KconfigEnvironment;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @TempDir
    Path dir;

    @Test
    void hub_starts_with_a_usable_sink() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().log(DebugLevel.WARN, "kconfig", "nobody listens", null));
    }

    @Test
    void load_without_sink_reports_through_the_hub() throws Exception {
        Path file = KconfigTestSupport.write(dir, "Kconfig",
                "config ARCH",
                "\tstring",
                "\toption env=\"NO_SUCH_VAR\"",
                "",
                "config B",
                "\tbool \"b\"");

        Kconfig k = Kconfig.load(file, KconfigEnvironment.empty(), true, null);
        assertTrue(k.getSymbol("B").setValue("n"));
        assertFalse(k.getSymbol("B").setValue("m"));

        Kconfig plain = Kconfig.load(file, KconfigEnvironment.empty());
        assertEquals("n", plain.getSymbol("B").getValue());
    }
}
