import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;
import com.elara.debug.DebugSink;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.KconfigEnvironment;

import static org.junit.jupiter.api.Assertions.*;

public class KconfigDiagnosticsTest {

    @TempDir
    Path dir;

    @Test
    void parse_warnings_carry_file_and_line() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        KconfigTestSupport.load(dir, sink,
                "config ARCH",
                "\tstring",
                "\toption env=\"NO_SUCH_VAR\"");

        String file = dir.resolve("Kconfig").toString();
        assertEquals(1, sink.messages.size(), sink.messages.toString());
        assertTrue(sink.messages.get(0).startsWith(file + ":3: warning: the symbol ARCH references"
                + " the non-existent environment variable NO_SUCH_VAR"), sink.messages.get(0));
    }

    @Test
    void warnings_can_be_disabled() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        Path file = KconfigTestSupport.write(dir, "Kconfig",
                "config ARCH",
                "\tstring",
                "\toption env=\"NO_SUCH_VAR\"",
                "",
                "config B",
                "\tbool \"b\"");

        Kconfig k = Kconfig.load(file, KconfigEnvironment.empty(), false, sink);
        assertTrue(sink.messages.isEmpty());

        k.getSymbol("B").setValue("m");
        assertTrue(sink.messages.isEmpty());

        k.enableWarnings();
        k.getSymbol("B").setValue("m");
        assertEquals(1, sink.messages.size());

        k.disableWarnings();
        k.getSymbol("B").setValue("m");
        assertEquals(1, sink.messages.size());
    }

    @Test
    void undef_warnings_are_off_by_default() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        Kconfig k = KconfigTestSupport.load(dir, sink,
                "config A",
                "\tbool \"a\"",
                "\tdepends on UNDEFINED");
        Path config = KconfigTestSupport.write(dir, ".config", "CONFIG_UNDEFINED=y");

        k.loadConfig(config.toString(), true);
        assertTrue(sink.messages.isEmpty(), sink.messages.toString());

        k.enableUndefWarnings();
        k.loadConfig(config.toString(), true);
        assertTrue(sink.contains(config + ":1: warning: attempt to assign the value \"y\" to the undefined"
                + " symbol UNDEFINED"), sink.messages.toString());
        assertNull(k.getSymbol("UNDEFINED").getUserValue());

        k.disableUndefWarnings();
        sink.messages.clear();
        k.loadConfig(config.toString(), true);
        assertTrue(sink.messages.isEmpty());
    }

    @Test
    void undefined_symbols_cannot_be_assigned() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        Kconfig k = KconfigTestSupport.load(dir, sink,
                "config A",
                "\tbool \"a\"",
                "\tdepends on UNDEFINED");

        assertFalse(k.getSymbol("UNDEFINED").isDefined());
        assertFalse(k.getSymbol("UNDEFINED").setValue("y"));
        assertEquals("UNDEFINED", k.getSymbol("UNDEFINED").getValue());
        assertTrue(sink.contains("the value 'y' is invalid for UNDEFINED"));
    }

    @Test
    void without_a_sink_warnings_go_to_the_global_hub() throws Exception {
        KconfigTestSupport.CollectingSink captured = new KconfigTestSupport.CollectingSink();
        DebugSink previous = Debug.get().getSink();
        Debug.get().setSink(captured);
        try {
            Kconfig k = KconfigTestSupport.load(dir, "config B", "\tbool \"b\"");
            k.setDiagnosticSink(null);

            k.getSymbol("B").setValue("m");
            assertTrue(captured.contains("the value 'm' is invalid for B"));

            KconfigTestSupport.CollectingSink own = new KconfigTestSupport.CollectingSink();
            k.setDiagnosticSink(own);
            captured.messages.clear();
            k.getSymbol("B").setValue("m");
            assertTrue(captured.messages.isEmpty());
            assertEquals(1, own.messages.size());
        } finally {
            Debug.get().setSink(previous);
        }
    }

    @Test
    void printing_sink_filters_by_level() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DebugSink sink = Debug.printing(new PrintStream(bytes, true, StandardCharsets.UTF_8), DebugLevel.WARN);

        sink.log(DebugLevel.DEBUG, "kconfig", "hidden", null);
        sink.log(DebugLevel.WARN, "kconfig", "shown", null);
        sink.log(DebugLevel.ERROR, "kconfig", "failed", new IllegalStateException("boom"));

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("shown"));
        assertTrue(text.contains("failed"));
        assertTrue(text.contains("IllegalStateException: boom"));
    }

    @Test
    void null_sink_restores_the_no_op_default() {
        DebugSink previous = Debug.get().getSink();
        try {
            Debug.get().setSink(null);
            assertNotNull(Debug.get().getSink());
            Debug.get().w("kconfig", "dropped");
            Debug.get().d("kconfig", "dropped");
        } finally {
            Debug.get().setSink(previous);
        }
    }

    @Test
    void summary_string() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir, "mainmenu \"Title\"");

        String s = k.toString();
        assertTrue(s.contains("main menu prompt \"Title\""), s);
        assertTrue(s.contains("srctree not set"), s);
        assertTrue(s.contains("config symbol prefix \"CONFIG_\""), s);
        assertTrue(s.contains("warnings enabled"), s);
    }
}
