package com.elara.kconfig.cli;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.elara.debug.Debug;
import com.elara.kconfig.Choice;
import com.elara.kconfig.Kconfig;
import com.elara.kconfig.MenuNode;
import com.elara.kconfig.Symbol;
import com.elara.kconfig.SymbolType;
import com.elara.kconfig.Tristate;

/**
 * Whole-configuration policies, built only on the public {@link Kconfig} API.
 */
public final class ConfigPresets {

    private static final String TAG = "kconfig";

    // Passes before giving up on a configuration that never settles
    private static final int MAX_PASSES = 1000;

    private ConfigPresets() {}

    /**
     * Everything as low as it will go. Symbols with 'option allnoconfig_y'
     * are set to y first and left alone afterwards.
     */
    public static void allNo(Kconfig kconfig) {
        List<Symbol> syms = symbolsInMenuOrder(kconfig);
        for (Symbol sym : syms) {
            if (sym.isAllnoconfigY()) sym.setValue("y");
        }

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = false;
            for (Symbol sym : syms) {
                if (sym.getChoice() != null || sym.isAllnoconfigY()) continue;
                List<Tristate> assignable = sym.getAssignable();
                if (!assignable.isEmpty() && assignable.get(0).lessThan(sym.getTriValue())) {
                    sym.setValue(assignable.get(0).text());
                    changed = true;
                }
            }
            if (!changed) return;
        }
        Debug.get().w(TAG, "allnoconfig did not settle after " + MAX_PASSES + " passes");
    }

    /**
     * Everything as high as it will go. Choices end up in their highest mode
     * with the default selection.
     */
    public static void allYes(Kconfig kconfig) {
        List<Symbol> nonChoice = new ArrayList<>();
        for (Symbol sym : kconfig.getDefinedSymbols()) {
            if (sym.getChoice() == null) nonChoice.add(sym);
        }
        Set<Choice> choices = new LinkedHashSet<>();
        for (MenuNode node : kconfig.getMenuNodes()) {
            if (node.getChoice() != null) choices.add(node.getChoice());
        }

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = false;

            for (Symbol sym : nonChoice) {
                List<Tristate> assignable = sym.getAssignable();
                if (!assignable.isEmpty()) {
                    Tristate highest = assignable.get(assignable.size() - 1);
                    if (sym.getTriValue().lessThan(highest)) {
                        sym.setValue(highest.text());
                        changed = true;
                    }
                }
            }

            for (Choice choice : choices) {
                if (choice.getVisibility() == Tristate.Y) {
                    Symbol selection = choice.getDefaultSelection();
                    if (selection != null && selection != choice.getUserSelection()) {
                        selection.setValue("y");
                        changed = true;
                    }
                } else if (choice.getVisibility() == Tristate.M) {
                    for (Symbol sym : choice.getSymbols()) {
                        if (!"m".equals(sym.getUserValue()) && sym.getAssignable().contains(Tristate.M)) {
                            sym.setValue("m");
                            changed = true;
                        }
                    }
                }
            }

            if (!changed) return;
        }
        Debug.get().w(TAG, "allyesconfig did not settle after " + MAX_PASSES + " passes");
    }

    /** Defaults only: all user values dropped. */
    public static void allDef(Kconfig kconfig) {
        kconfig.unsetValues();
    }

    /** Loads an existing configuration, so that writing it back fills in new symbols. */
    public static void oldDef(Kconfig kconfig, String configFile) throws IOException {
        kconfig.loadConfig(configFile, true);
    }

    /**
     * Symbols the user could change but has not assigned, as
     * PREFIX&lt;NAME&gt;=&lt;value&gt; lines without newlines.
     */
    public static List<String> listNew(Kconfig kconfig) {
        List<String> res = new ArrayList<>();
        for (Symbol sym : kconfig.getDefinedSymbols()) {
            if (sym.getUserValue() != null) continue;

            SymbolType type = sym.getOrigType();
            boolean changeable = sym.getAssignable().size() > 1
                    || (sym.getVisibility() != Tristate.N
                        && (!type.isBoolOrTristate() || sym.getChoice() != null));
            if (!changeable) continue;

            if (type.isBoolOrTristate()) {
                res.add(kconfig.getConfigPrefix() + sym.getName() + "=" + sym.getTriValue().text());
            } else {
                String s = sym.getConfigString();
                if (s != null) res.add(s.substring(0, s.length() - 1));
            }
        }
        return res;
    }

    private static List<Symbol> symbolsInMenuOrder(Kconfig kconfig) {
        Set<Symbol> res = new LinkedHashSet<>();
        for (MenuNode node : kconfig.getMenuNodes()) {
            if (node.getSymbol() != null) res.add(node.getSymbol());
        }
        return new ArrayList<>(res);
    }
}
