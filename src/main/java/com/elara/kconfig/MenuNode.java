package com.elara.kconfig;

/**
 * A node of the menu tree. Each definition site of a symbol or choice, each
 * menu, comment and (while parsing) each if block gets one.
 *
 * Children hang off {@link #getList()} and continue through {@link #getNext()}.
 * After parsing, if nodes are gone and every node's parent is the menu,
 * choice or symbol (for implicit submenus) it shows up under.
 */
public final class MenuNode {

    /** A prompt text and the condition under which it is shown. */
    public static final class Prompt {
        private final String text;
        private final Expr.Node condition;

        Prompt(String text, Expr.Node condition) {
            this.text = text;
            this.condition = condition;
        }

        public String text() { return text; }
        public Expr.Node condition() { return condition; }
    }

    final Kconfig kconfig;
    ItemKind kind;
    Symbol symbol;
    Choice choice;

    MenuNode parent;
    MenuNode list;
    MenuNode next;

    Prompt prompt;
    String help;
    Expr.Node dep;
    Expr.Node visibility;
    boolean menuconfig;

    final String filename;
    final int linenr;

    MenuNode(Kconfig kconfig, ItemKind kind, MenuNode parent, String filename, int linenr) {
        this.kconfig = kconfig;
        this.kind = kind;
        this.parent = parent;
        this.filename = filename;
        this.linenr = linenr;
        this.dep = kconfig.getY();
        this.visibility = kconfig.getY();
    }

    public ItemKind getKind() { return kind; }

    /** The symbol for SYMBOL nodes, else null. */
    public Symbol getSymbol() { return symbol; }

    /** The choice for CHOICE nodes, else null. */
    public Choice getChoice() { return choice; }

    public MenuNode getParent() { return parent; }

    /** First child, or null. */
    public MenuNode getList() { return list; }

    /** Next sibling, or null. */
    public MenuNode getNext() { return next; }

    /** Prompt with its full condition (including dependencies), or null. */
    public Prompt getPrompt() { return prompt; }

    /** Help text ending in a newline, or null. */
    public String getHelp() { return help; }

    /** Dependencies of this node, including those inherited from parents. */
    public Expr.Node getDep() { return dep; }

    /** The 'visible if' condition (menus only; y elsewhere). */
    public Expr.Node getVisibility() { return visibility; }

    public boolean isMenuconfig() { return menuconfig; }

    public String getFilename() { return filename; }
    public int getLinenr() { return linenr; }

    public Location getLocation() {
        return new Location(filename, linenr);
    }

    /** True if the node is shown in a menu interface right now. */
    public boolean isVisible() {
        return prompt != null && Expr.eval(prompt.condition()) != Tristate.N;
    }

    @Override
    public String toString() {
        return KconfigWriter.nodeToString(this);
    }
}
