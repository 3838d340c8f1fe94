import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.kconfig.Kconfig;
import com.elara.kconfig.Symbol;
import com.elara.kconfig.Tristate;
import com.elara.kconfig.cli.ConfigPresets;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigPresetsTest {

    @TempDir
    Path dir;

    private Kconfig lowHigh() throws Exception {
        return KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\tbool \"a\"",
                "\tdefault y",
                "",
                "config B",
                "\ttristate \"b\"",
                "\tdefault y",
                "\tselect C",
                "",
                "config C",
                "\tbool \"c\"",
                "",
                "config KEEP",
                "\tbool \"keep\"",
                "\toption allnoconfig_y",
                "",
                "config NUM",
                "\tint \"num\"",
                "\tdefault 4");
    }

    private static void assertFixedPointLow(Kconfig k) {
        for (Symbol sym : k.getDefinedSymbols()) {
            List<Tristate> assignable = sym.getAssignable();
            if (assignable.isEmpty() || sym.isAllnoconfigY() || sym.getChoice() != null) continue;
            assertEquals(assignable.get(0), sym.getTriValue(), sym.getName());
        }
    }

    private static void assertFixedPointHigh(Kconfig k) {
        for (Symbol sym : k.getDefinedSymbols()) {
            List<Tristate> assignable = sym.getAssignable();
            if (assignable.isEmpty() || sym.getChoice() != null) continue;
            assertEquals(assignable.get(assignable.size() - 1), sym.getTriValue(), sym.getName());
        }
    }

    @Test
    void all_no_lowers_everything_except_allnoconfig_y() throws Exception {
        Kconfig k = lowHigh();

        ConfigPresets.allNo(k);

        assertEquals("n", k.getSymbol("MODULES").getValue());
        assertEquals("n", k.getSymbol("A").getValue());
        assertEquals("n", k.getSymbol("B").getValue());
        assertEquals("n", k.getSymbol("C").getValue());
        assertEquals("y", k.getSymbol("KEEP").getValue());
        assertEquals("4", k.getSymbol("NUM").getValue());
        assertFixedPointLow(k);
    }

    @Test
    void all_yes_raises_everything_and_picks_choice_defaults() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "",
                "config A",
                "\tbool \"a\"",
                "",
                "config B",
                "\ttristate \"b\"",
                "\tdepends on A",
                "",
                "config HIDDEN",
                "\tbool",
                "",
                "choice",
                "\tprompt \"pick\"",
                "\tdefault P2",
                "config P1",
                "\tbool \"p1\"",
                "config P2",
                "\tbool \"p2\"",
                "endchoice");

        ConfigPresets.allYes(k);

        assertEquals("y", k.getSymbol("MODULES").getValue());
        assertEquals("y", k.getSymbol("A").getValue());
        assertEquals("y", k.getSymbol("B").getValue());
        assertEquals("n", k.getSymbol("HIDDEN").getValue());
        assertEquals("n", k.getSymbol("P1").getValue());
        assertEquals("y", k.getSymbol("P2").getValue());
        assertSame(k.getSymbol("P2"), k.getChoices().get(0).getSelection());
        assertFixedPointHigh(k);
    }

    @Test
    void all_def_drops_user_values() throws Exception {
        Kconfig k = lowHigh();
        k.getSymbol("A").setValue("n");

        ConfigPresets.allDef(k);
        assertEquals("y", k.getSymbol("A").getValue());
    }

    @Test
    void old_def_loads_existing_values() throws Exception {
        Kconfig k = lowHigh();
        Path config = KconfigTestSupport.write(dir, ".config", "# CONFIG_A is not set");

        ConfigPresets.oldDef(k, config.toString());
        assertEquals("n", k.getSymbol("A").getValue());
        assertEquals("y", k.getSymbol("B").getValue());
    }

    @Test
    void list_new_reports_unassigned_changeable_symbols() throws Exception {
        Kconfig k = lowHigh();

        assertEquals(List.of(
                "CONFIG_MODULES=y",
                "CONFIG_A=y",
                "CONFIG_B=y",
                "CONFIG_KEEP=n",
                "CONFIG_NUM=4"), ConfigPresets.listNew(k));

        Path config = KconfigTestSupport.write(dir, ".config", "CONFIG_A=y", "CONFIG_NUM=5");
        k.loadConfig(config.toString(), true);
        assertEquals(List.of(
                "CONFIG_MODULES=y",
                "CONFIG_B=y",
                "CONFIG_KEEP=n"), ConfigPresets.listNew(k));
    }
}
