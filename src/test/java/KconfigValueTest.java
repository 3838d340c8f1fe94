import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.kconfig.Kconfig;
import com.elara.kconfig.Symbol;
import com.elara.kconfig.SymbolType;
import com.elara.kconfig.Tristate;

import static org.junit.jupiter.api.Assertions.*;

public class KconfigValueTest {

    @TempDir
    Path dir;

    @Test
    void user_value_of_invisible_symbol_is_kept_but_ignored() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config A",
                "\tbool \"a\"",
                "",
                "config B",
                "\tbool \"b\"",
                "\tdepends on A");
        Symbol a = k.getSymbol("A");
        Symbol b = k.getSymbol("B");

        assertTrue(b.setValue("y"));
        assertEquals(Tristate.N, b.getVisibility());
        assertEquals("n", b.getValue());
        assertEquals("y", b.getUserValue());
        assertNull(b.getConfigString());
        assertEquals("# CONFIG_A is not set\n", a.getConfigString());

        a.setValue("y");
        assertEquals(Tristate.Y, b.getVisibility());
        assertEquals("y", b.getValue());
        assertEquals("CONFIG_B=y\n", b.getConfigString());
    }

    @Test
    void default_is_clamped_to_active_range() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config X",
                "\tint",
                "\trange 1 10",
                "\tdefault 20");

        assertEquals("10", k.getSymbol("X").getValue());
        assertEquals(SymbolType.INT, k.getSymbol("X").getType());
    }

    @Test
    void out_of_range_user_value_falls_back_to_default() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config X",
                "\tint \"x\"",
                "\trange 1 10",
                "\tdefault 5");
        Symbol x = k.getSymbol("X");

        assertTrue(x.setValue("50"));
        assertEquals("5", x.getValue());

        assertTrue(x.setValue("7"));
        assertEquals("7", x.getValue());
        assertEquals("CONFIG_X=7\n", x.getConfigString());
    }

    @Test
    void malformed_int_is_rejected_with_warning() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        Kconfig k = KconfigTestSupport.load(dir, sink,
                "config X",
                "\tint \"x\"",
                "\tdefault 5");
        Symbol x = k.getSymbol("X");

        assertFalse(x.setValue("0x5"));
        assertFalse(x.setValue("five"));
        assertNull(x.getUserValue());
        assertEquals("5", x.getValue());
        assertTrue(sink.contains("the value 'five' is invalid for X"));
    }

    @Test
    void range_can_depend_on_a_condition() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config BIG",
                "\tbool \"big\"",
                "",
                "config X",
                "\tint \"x\"",
                "\trange 100 200 if BIG",
                "\trange 1 10",
                "\tdefault 50");
        Symbol x = k.getSymbol("X");

        assertEquals("10", x.getValue());
        k.getSymbol("BIG").setValue("y");
        assertEquals("100", x.getValue());
    }

    @Test
    void hex_without_default_uses_positive_low_end_of_range() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config H",
                "\thex \"h\"",
                "\trange 0x10 0x20");
        Symbol h = k.getSymbol("H");

        assertEquals("0x10", h.getValue());

        assertTrue(h.setValue("0x18"));
        assertEquals("0x18", h.getValue());
        // Kept verbatim, no 0x added
        assertTrue(h.setValue("18"));
        assertEquals("18", h.getValue());
        assertEquals("CONFIG_H=18\n", h.getConfigString());
    }

    @Test
    void first_default_with_true_condition_wins() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config COND",
                "\tbool \"cond\"",
                "",
                "config STR",
                "\tstring \"str\"",
                "\tdefault \"first\" if COND",
                "\tdefault \"second\"");
        Symbol str = k.getSymbol("STR");

        assertEquals("second", str.getValue());
        k.getSymbol("COND").setValue("y");
        assertEquals("first", str.getValue());
    }

    @Test
    void default_can_reference_another_symbol() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config BASE",
                "\tstring \"base\"",
                "\tdefault \"/usr\"",
                "",
                "config COPY",
                "\tstring",
                "\tdefault BASE");

        assertEquals("/usr", k.getSymbol("COPY").getValue());
        k.getSymbol("BASE").setValue("/opt");
        assertEquals("/opt", k.getSymbol("COPY").getValue());
    }

    @Test
    void string_values_are_escaped_in_config_lines() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config STR",
                "\tstring \"str\"",
                "\tdefault \"hello\"");
        Symbol str = k.getSymbol("STR");

        assertEquals("CONFIG_STR=\"hello\"\n", str.getConfigString());
        str.setValue("a \"quoted\" \\ path");
        assertEquals("CONFIG_STR=\"a \\\"quoted\\\" \\\\ path\"\n", str.getConfigString());
    }

    @Test
    void select_forces_a_minimum() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config Y",
                "\ttristate \"y\"",
                "\tselect Z",
                "",
                "config Z",
                "\ttristate");
        Symbol y = k.getSymbol("Y");
        Symbol z = k.getSymbol("Z");

        assertEquals("n", z.getValue());
        assertNull(z.getConfigString());

        y.setValue("y");
        assertEquals("y", z.getValue());
        assertEquals("CONFIG_Z=y\n", z.getConfigString());
        assertTrue(z.getAssignable().isEmpty());

        y.setValue("m");
        assertEquals("m", z.getValue());
    }

    @Test
    void selected_symbol_cannot_go_below_the_select() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\ttristate \"a\"",
                "\tselect S",
                "\tselect BS",
                "",
                "config S",
                "\ttristate \"s\"",
                "",
                "config BS",
                "\tbool \"bs\"");
        Symbol a = k.getSymbol("A");
        Symbol s = k.getSymbol("S");
        Symbol bs = k.getSymbol("BS");

        assertEquals(List.of(Tristate.N, Tristate.M, Tristate.Y), s.getAssignable());

        a.setValue("m");
        assertEquals(List.of(Tristate.M, Tristate.Y), s.getAssignable());
        assertEquals("m", s.getValue());
        // A bool selected to m is raised to y and pinned there
        assertTrue(bs.getAssignable().isEmpty());
        assertEquals("y", bs.getValue());
        bs.setValue("n");
        assertEquals("y", bs.getValue());

        s.setValue("n");
        assertEquals("m", s.getValue());

        a.setValue("y");
        assertEquals(List.of(Tristate.Y), s.getAssignable());
        assertEquals("y", s.getValue());
    }

    @Test
    void imply_sets_a_default_the_user_can_override() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\ttristate \"a\"",
                "\timply B",
                "",
                "config B",
                "\ttristate \"b\"");
        Symbol a = k.getSymbol("A");
        Symbol b = k.getSymbol("B");

        a.setValue("y");
        assertEquals("y", b.getValue());
        assertEquals(List.of(Tristate.N, Tristate.Y), b.getAssignable());

        b.setValue("n");
        assertEquals("n", b.getValue());
    }

    @Test
    void imply_has_no_effect_while_dependencies_are_unmet() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config DEP",
                "\tbool \"dep\"",
                "",
                "config A",
                "\tbool \"a\"",
                "\timply B",
                "",
                "config B",
                "\tbool \"b\"",
                "\tdepends on DEP");
        k.getSymbol("A").setValue("y");

        assertEquals("n", k.getSymbol("B").getValue());
        k.getSymbol("DEP").setValue("y");
        assertEquals("y", k.getSymbol("B").getValue());
    }

    @Test
    void tristate_is_bool_while_modules_is_off() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "",
                "config T",
                "\ttristate \"t\"",
                "\tdefault m");
        Symbol t = k.getSymbol("T");

        assertEquals(SymbolType.BOOL, t.getType());
        assertEquals(SymbolType.TRISTATE, t.getOrigType());
        assertEquals("y", t.getValue());
        assertFalse(t.setValue("x"));
        assertEquals(List.of(Tristate.N, Tristate.Y), t.getAssignable());
    }

    @Test
    void m_is_rejected_for_bool() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config B",
                "\tbool \"b\"");

        assertFalse(k.getSymbol("B").setValue("m"));
        assertNull(k.getSymbol("B").getUserValue());
    }

    @Test
    void constant_and_promptless_assignments() throws Exception {
        KconfigTestSupport.CollectingSink sink = new KconfigTestSupport.CollectingSink();
        Kconfig k = KconfigTestSupport.load(dir, sink,
                "config HIDDEN",
                "\tbool",
                "\tdefault y");

        assertFalse(k.getY().setValue("n"));
        assertTrue(sink.contains("constant symbol y"));

        assertTrue(k.getSymbol("HIDDEN").setValue("n"));
        assertTrue(sink.contains("which lacks prompts"));
        assertEquals("y", k.getSymbol("HIDDEN").getValue());
    }

    @Test
    void unset_value_restores_default() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config A",
                "\tbool \"a\"",
                "\tdefault y");
        Symbol a = k.getSymbol("A");

        a.setValue("n");
        assertEquals("n", a.getValue());
        a.unsetValue();
        assertNull(a.getUserValue());
        assertEquals("y", a.getValue());
    }

    @Test
    void value_is_always_assignable_when_assignable_is_known() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\ttristate \"a\"",
                "\tselect C",
                "\timply D",
                "",
                "config B",
                "\ttristate \"b\"",
                "\tdepends on A",
                "\tdefault y",
                "",
                "config C",
                "\ttristate \"c\"",
                "",
                "config D",
                "\tbool \"d\"",
                "",
                "config E",
                "\ttristate \"e\"",
                "\tdepends on A",
                "",
                "config F",
                "\ttristate \"f\"",
                "\tdepends on A",
                "\tdefault m");

        String[][] assignments = {
                {"A", "m"}, {"B", "y"}, {"E", "m"}, {"C", "n"}, {"F", "n"}, {"D", "n"}, {"E", "n"},
                {"A", "y"}, {"E", "y"}, {"A", "m"}, {"MODULES", "n"}, {"A", "n"}, {"MODULES", "y"},
                {"A", "m"}, {"B", "n"}
        };
        for (String[] a : assignments) {
            k.getSymbol(a[0]).setValue(a[1]);
            for (Symbol sym : k.getDefinedSymbols()) {
                List<Tristate> assignable = sym.getAssignable();
                if (!assignable.isEmpty()) {
                    assertTrue(assignable.contains(sym.getTriValue()),
                            sym.getName() + "=" + sym.getValue() + " not in " + assignable);
                }
            }
        }
    }

    @Test
    void module_visible_tristate_can_be_switched_off() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\ttristate",
                "\tdefault m",
                "",
                "config C",
                "\ttristate \"c\"",
                "\tdepends on A");
        Symbol c = k.getSymbol("C");

        assertEquals(Tristate.M, c.getVisibility());
        assertEquals("n", c.getValue());
        assertEquals(List.of(Tristate.N, Tristate.M), c.getAssignable());
        assertTrue(c.getAssignable().contains(c.getTriValue()));

        c.setValue("y");
        assertEquals("m", c.getValue());
        assertTrue(c.getAssignable().contains(c.getTriValue()));
    }

    @Test
    void module_visible_symbol_selected_to_m_is_pinned_to_m() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config MODULES",
                "\tbool \"modules\"",
                "\tdefault y",
                "",
                "config A",
                "\ttristate \"a\"",
                "\tdefault m",
                "",
                "config S",
                "\ttristate \"s\"",
                "\tdepends on A",
                "",
                "config SEL",
                "\ttristate \"sel\"",
                "\tdefault m",
                "\tselect S");
        Symbol s = k.getSymbol("S");

        assertEquals(Tristate.M, s.getVisibility());
        assertEquals(List.of(Tristate.M), s.getAssignable());
        assertEquals("m", s.getValue());
    }

    @Test
    void int_defaults_that_are_not_numbers_are_skipped() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config EMPTY",
                "\tint",
                "",
                "config X",
                "\tint \"x\"",
                "\trange 5 10",
                "\tdefault EMPTY",
                "\tdefault 7",
                "",
                "config Y",
                "\tint \"y\"",
                "\trange 5 10",
                "\tdefault EMPTY",
                "",
                "config Z",
                "\thex \"z\"",
                "\tdefault EMPTY",
                "\tdefault 0x20");

        assertEquals("", k.getSymbol("EMPTY").getValue());
        assertEquals("7", k.getSymbol("X").getValue());
        assertEquals("5", k.getSymbol("Y").getValue());
        assertEquals("CONFIG_Y=5\n", k.getSymbol("Y").getConfigString());
        assertEquals("0x20", k.getSymbol("Z").getValue());
    }

    @Test
    void int_without_numeric_default_or_positive_range_is_empty() throws Exception {
        Kconfig k = KconfigTestSupport.load(dir,
                "config EMPTY",
                "\tint",
                "",
                "config W",
                "\tint \"w\"",
                "\trange 0 10",
                "\tdefault EMPTY");

        assertEquals("", k.getSymbol("W").getValue());
        assertEquals("CONFIG_W=\n", k.getSymbol("W").getConfigString());
    }
}
