package com.elara.kconfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ConfigStateStore
 *
 * Reads and writes symbol values in the .config format:
 *
 *   CONFIG_FOO=y
 *   CONFIG_BAR="some string"
 *   # CONFIG_BAZ is not set
 *
 * The prefix comes from the {@link Kconfig}. Written files match the C tools
 * byte for byte: one line per symbol that contributes a value, in menu order,
 * with banner comments for visible menus and comments.
 */
public final class ConfigStateStore {

    private final Kconfig kconfig;
    private final Pattern setPattern;
    private final Pattern unsetPattern;

    public ConfigStateStore(Kconfig kconfig) {
        this.kconfig = kconfig;
        String prefix = Pattern.quote(kconfig.getConfigPrefix());
        this.setPattern = Pattern.compile(prefix + "(\\w+)=(.*)");
        this.unsetPattern = Pattern.compile("# " + prefix + "(\\w+) is not set");
    }

    /**
     * Loads user values from a .config file. Equivalent to calling
     * {@link Symbol#setValue(String)} for each assignment, except that
     * assignments to promptless symbols are not reported.
     *
     * @param replace clear all existing user values first
     */
    public void load(String filename, boolean replace) throws IOException {
        Kconfig.SourceFile file = kconfig.openFile(filename);

        if (replace) {
            // Invalidates everything as a side effect
            kconfig.unsetValues();
        } else {
            kconfig.invalidateAll();
        }

        String[] lines = file.contents().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            loadLine(lines[i].stripTrailing(), file.name(), i + 1);
        }
    }

    private void loadLine(String line, String filename, int linenr) {
        String name;
        String val;
        Symbol sym;

        Matcher set = setPattern.matcher(line);
        if (set.lookingAt()) {
            name = set.group(1);
            val = set.group(2);
            sym = kconfig.getSymbol(name);
            if (sym == null || !sym.isDefined()) {
                warnUndef(name, val, filename, linenr);
                return;
            }

            if (sym.type == SymbolType.STRING && val.startsWith("\"")) {
                if (val.length() < 2 || !val.endsWith("\"")) {
                    kconfig.warn("malformed string literal", filename, linenr);
                    return;
                }
                // " can only appear as \" inside the string
                val = val.substring(1, val.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
            }

            if (sym.choice != null) {
                String mode = sym.choice.userValue;
                if (mode != null && !mode.equals(val)) {
                    kconfig.warn("assignment to " + name + " changes mode of containing choice from \""
                            + mode + "\" to \"" + val + "\"", filename, linenr);
                }
            }
        } else {
            Matcher unset = unsetPattern.matcher(line);
            if (!unset.lookingAt()) return;

            name = unset.group(1);
            val = "n";
            sym = kconfig.getSymbol(name);
            if (sym == null || !sym.isDefined()) {
                warnUndef(name, val, filename, linenr);
                return;
            }
        }

        if (sym.userValue != null) {
            kconfig.warn(name + " set more than once. Old value: \"" + sym.userValue + "\", new value: \""
                    + val + "\".", filename, linenr);
        }

        sym.setValueNoInvalidate(val, true);
    }

    private void warnUndef(String name, String val, String filename, int linenr) {
        kconfig.warnUndef("attempt to assign the value \"" + val + "\" to the undefined symbol " + name,
                filename, linenr);
    }

    /** Writes the current configuration, preceded by {@code header} verbatim. */
    public void write(Path path, String header) throws IOException {
        StringBuilder sb = new StringBuilder(header);
        for (String s : getConfigStrings()) sb.append(s);
        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }

    /** The .config lines, each ending in a newline, in the order they are written. */
    public List<String> getConfigStrings() {
        List<String> res = new ArrayList<>();

        MenuNode node = kconfig.getTopNode().list;
        if (node == null) return res;

        // Symbols defined in several places are written once
        Set<Symbol> written = new HashSet<>();

        while (true) {
            switch (node.kind) {
                case SYMBOL: {
                    Symbol sym = node.symbol;
                    if (written.add(sym)) {
                        String s = sym.getConfigString();
                        if (s != null) res.add(s);
                    }
                    break;
                }
                case MENU:
                    if (Expr.eval(node.dep) != Tristate.N && Expr.eval(node.visibility) != Tristate.N) {
                        res.add(banner(node));
                    }
                    break;
                case COMMENT:
                    if (Expr.eval(node.dep) != Tristate.N) res.add(banner(node));
                    break;
                default:
                    break;
            }

            // Iterative walk using parent pointers
            if (node.list != null) {
                node = node.list;
            } else if (node.next != null) {
                node = node.next;
            } else {
                while (true) {
                    node = node.parent;
                    if (node == null) return res;
                    if (node.next != null) {
                        node = node.next;
                        break;
                    }
                }
            }
        }
    }

    private static String banner(MenuNode node) {
        return "\n#\n# " + node.prompt.text() + "\n#\n";
    }
}
