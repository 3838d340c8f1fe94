package com.elara.kconfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders symbols, choices and menu nodes as Kconfig source.
 *
 * The output re-declares the item when fed back to the parser: one block per
 * definition site, with the properties that belong to the item itself (type,
 * options, defaults, ranges, selects, implies) on the first block only.
 * Conditions are printed with inherited dependencies included.
 */
final class KconfigWriter {

    private KconfigWriter() {}

    static String symbolToString(Symbol sym) {
        if (sym.nodes.isEmpty()) return "";
        Kconfig k = sym.kconfig;
        List<String> lines = new ArrayList<>();

        for (MenuNode node : sym.nodes) {
            lines.add((node.menuconfig ? "menuconfig " : "config ") + sym.name);
            boolean first = node == sym.nodes.get(0);

            if (first && sym.type != SymbolType.UNKNOWN) indent(lines, sym.type.typeName());
            addPrompt(lines, node, k);

            if (first) {
                if (sym.allnoconfigY) indent(lines, "option allnoconfig_y");
                if (sym == k.getDefconfigList()) indent(lines, "option defconfig_list");
                if (sym.envVar != null) indent(lines, "option env=\"" + sym.envVar + "\"");
                if (sym == k.getModules()) indent(lines, "option modules");

                for (Symbol.Range r : sym.ranges) {
                    indent(lines, "range " + Expr.toString(r.low()) + " " + Expr.toString(r.high())
                            + cond(r.condition(), k));
                }
                for (Symbol.Default d : sym.defaults) {
                    indent(lines, "default " + Expr.toString(d.value()) + cond(d.condition(), k));
                }
                for (Symbol.Select s : sym.selects) {
                    indent(lines, "select " + s.target().name + cond(s.condition(), k));
                }
                for (Symbol.Select s : sym.implies) {
                    indent(lines, "imply " + s.target().name + cond(s.condition(), k));
                }
            }

            addHelp(lines, node);
            if (node != sym.nodes.get(sym.nodes.size() - 1)) lines.add("");
        }
        return String.join("\n", lines) + "\n";
    }

    static String choiceToString(Choice choice) {
        if (choice.nodes.isEmpty()) return "";
        Kconfig k = choice.kconfig;
        List<String> lines = new ArrayList<>();

        for (MenuNode node : choice.nodes) {
            lines.add(choice.name == null ? "choice" : "choice " + choice.name);
            boolean first = node == choice.nodes.get(0);

            if (first && choice.type != SymbolType.UNKNOWN) indent(lines, choice.type.typeName());
            addPrompt(lines, node, k);

            if (first) {
                for (Choice.Default d : choice.defaults) {
                    indent(lines, "default " + d.symbol().name + cond(d.condition(), k));
                }
                if (choice.optional) indent(lines, "optional");
            }

            addHelp(lines, node);
            if (node != choice.nodes.get(choice.nodes.size() - 1)) lines.add("");
        }
        return String.join("\n", lines) + "\n";
    }

    static String nodeToString(MenuNode node) {
        switch (node.kind) {
            case SYMBOL:
                return symbolToString(node.symbol);
            case CHOICE:
                return choiceToString(node.choice);
            case MENU: {
                StringBuilder sb = new StringBuilder("menu \"" + Symbol.escape(node.prompt.text()) + "\"\n");
                if (node.dep != node.kconfig.getY()) {
                    sb.append("\tdepends on ").append(Expr.toString(node.dep)).append('\n');
                }
                if (node.visibility != node.kconfig.getY()) {
                    sb.append("\tvisible if ").append(Expr.toString(node.visibility)).append('\n');
                }
                return sb.toString();
            }
            case COMMENT: {
                StringBuilder sb = new StringBuilder("comment \"" + Symbol.escape(node.prompt.text()) + "\"\n");
                if (node.dep != node.kconfig.getY()) {
                    sb.append("\tdepends on ").append(Expr.toString(node.dep)).append('\n');
                }
                return sb.toString();
            }
            default:
                return "if " + Expr.toString(node.dep) + "\n";
        }
    }

    private static void addPrompt(List<String> lines, MenuNode node, Kconfig k) {
        if (node.prompt == null) return;
        indent(lines, "prompt \"" + Symbol.escape(node.prompt.text()) + "\"" + cond(node.prompt.condition(), k));
    }

    private static void addHelp(List<String> lines, MenuNode node) {
        if (node.help == null) return;
        indent(lines, "help");
        if (node.help.isEmpty()) return;
        for (String line : node.help.split("\n")) {
            indent(lines, "  " + line);
        }
    }

    // " if <expr>", or nothing for a plain y
    private static String cond(Expr.Node expr, Kconfig k) {
        return expr == k.getY() ? "" : " if " + Expr.toString(expr);
    }

    private static void indent(List<String> lines, String s) {
        lines.add("\t" + s);
    }
}
