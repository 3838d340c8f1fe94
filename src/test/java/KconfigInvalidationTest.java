import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.kconfig.Kconfig;
import com.elara.kconfig.Symbol;
import com.elara.kconfig.SymbolType;
import com.elara.kconfig.Tristate;

import static org.junit.jupiter.api.Assertions.*;

public class KconfigInvalidationTest {

    @TempDir
    Path dir;

    @Test
    void changes_propagate_through_chains() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config A",
                "\tbool \"a\"",
                "",
                "config B",
                "\tbool \"b\"",
                "\tdepends on A",
                "",
                "config C",
                "\tbool \"c\"",
                "\tdefault B",
                "",
                "config D",
                "\tstring",
                "\tdefault \"on\" if C",
                "\tdefault \"off\"");
        Symbol a = k.getSymbol("A");
        Symbol b = k.getSymbol("B");
        Symbol c = k.getSymbol("C");
        Symbol d = k.getSymbol("D");

        // Fill every cache first
        assertEquals("n", c.getValue());
        assertEquals("off", d.getValue());

        a.setValue("y");
        b.setValue("y");
        assertEquals("y", c.getValue());
        assertEquals("on", d.getValue());

        a.setValue("n");
        assertEquals(Tristate.N, b.getVisibility());
        assertEquals("n", b.getValue());
        assertEquals("n", c.getValue());
        assertEquals("off", d.getValue());
    }

    @Test
    void modules_change_invalidates_every_tristate() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config T",
                "\ttristate \"t\"",
                "\tdefault m");
        Symbol t = k.getSymbol("T");

        assertEquals("m", t.getValue());
        assertEquals(SymbolType.TRISTATE, t.getType());

        k.getModules().setValue("n");
        assertEquals("y", t.getValue());
        assertEquals(SymbolType.BOOL, t.getType());

        k.getModules().unsetValue();
        assertEquals("m", t.getValue());
    }

    @Test
    void unset_values_resets_everything() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config A",
                "\tbool \"a\"",
                "\tdefault y",
                "",
                "choice",
                "\tprompt \"c\"",
                "config C1",
                "\tbool \"c1\"",
                "config C2",
                "\tbool \"c2\"",
                "endchoice");
        k.getSymbol("A").setValue("n");
        k.getSymbol("C2").setValue("y");
        assertEquals("y", k.getSymbol("C2").getValue());

        k.unsetValues();
        assertEquals("y", k.getSymbol("A").getValue());
        assertEquals("n", k.getSymbol("C2").getValue());
        assertNull(k.getChoices().get(0).getUserSelection());
        assertNull(k.getChoices().get(0).getUserValue());
    }

    @Test
    void setting_the_same_value_twice_is_harmless() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config A",
                "\tbool \"a\"",
                "",
                "config B",
                "\tbool",
                "\tdefault A");

        k.getSymbol("A").setValue("y");
        k.getSymbol("A").setValue("y");
        assertEquals("y", k.getSymbol("B").getValue());
    }
}
