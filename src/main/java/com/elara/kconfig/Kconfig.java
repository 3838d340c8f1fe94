package com.elara.kconfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;
import com.elara.debug.DebugSink;

/**
 * A parsed Kconfig configuration: all symbols, choices and the menu tree,
 * plus the user values assigned to them.
 *
 * Typical use:
 *
 *   Kconfig kconf = Kconfig.load(Paths.get("Kconfig"), KconfigEnvironment.fromSystem());
 *   kconf.loadConfig(".config", true);
 *   kconf.getSymbol("FOO").setValue("y");
 *   kconf.writeConfig(Paths.get(".config"));
 *
 * A Kconfig instance is not thread-safe. Separate instances share no state.
 */
public final class Kconfig {

    public static final String DEFAULT_HEADER =
            "# Generated by Kconfiglib (https://github.com/ulfalizer/Kconfiglib)\n";

    static final String DEBUG_TAG = "kconfig";

    private static final Pattern SYM_REF = Pattern.compile("\\$([A-Za-z0-9_]+)");

    /** A file read for parsing or loading. {@code key} identifies it for include-cycle checks. */
    static final class SourceFile {
        private final String name;
        private final String key;
        private final String contents;

        SourceFile(String name, String key, String contents) {
            this.name = name;
            this.key = key;
            this.contents = contents;
        }

        String name() { return name; }
        String key() { return key; }
        String contents() { return contents; }
    }

    private final KconfigEnvironment environment;
    private final String filename;

    // All symbols by name, including referenced but undefined ones
    final Map<String, Symbol> syms = new LinkedHashMap<>();
    final Map<String, Symbol> constSyms = new LinkedHashMap<>();
    // Defined symbols in definition order
    final Set<Symbol> definedSyms = new LinkedHashSet<>();
    final List<Choice> choices = new ArrayList<>();
    final Map<String, Choice> namedChoices = new LinkedHashMap<>();

    private final Symbol n;
    private final Symbol m;
    private final Symbol y;
    private final Symbol modules;
    Symbol defconfigList;

    private final MenuNode topNode;

    private boolean printWarnings;
    private boolean printUndefWarnings;
    private DebugSink diagnosticSink;

    private final ConfigStateStore stateStore;

    private Kconfig(String filename, KconfigEnvironment environment, boolean printWarnings, DebugSink sink) {
        this.filename = filename;
        this.environment = environment;
        this.printWarnings = printWarnings;
        this.diagnosticSink = sink;

        this.n = newConstant("n");
        this.m = newConstant("m");
        this.y = newConstant("y");
        n.type = SymbolType.TRISTATE;
        m.type = SymbolType.TRISTATE;
        y.type = SymbolType.TRISTATE;

        this.modules = lookupSymbol("MODULES", false);

        // Predefined. Typically referenced from the defconfig_list symbol.
        Symbol uname = lookupSymbol("UNAME_RELEASE", false);
        uname.type = SymbolType.STRING;
        uname.defaults.add(new Symbol.Default(lookupConstSymbol(environment.getUnameRelease(), false), y));
        uname.envVar = "<uname release>";

        this.topNode = new MenuNode(this, ItemKind.MENU, null, filename, 0);
        topNode.prompt = new MenuNode.Prompt("Linux Kernel Configuration", y);

        this.stateStore = new ConfigStateStore(this);
    }

    private Symbol newConstant(String name) {
        Symbol sym = new Symbol(this, name, true);
        constSyms.put(name, sym);
        return sym;
    }

    // -------------------------
    // Loading
    // -------------------------

    /** Parses {@code file} using the process environment. */
    public static Kconfig load(Path file) throws IOException {
        return load(file, KconfigEnvironment.fromSystem());
    }

    public static Kconfig load(Path file, KconfigEnvironment environment) throws IOException {
        return load(file, environment, true, null);
    }

    /**
     * Parses a Kconfig file and everything it sources.
     *
     * @param printWarnings whether warnings (including those found while
     *                      parsing) are reported
     * @param sink          receives diagnostics instead of the global
     *                      {@link Debug} hub; may be null
     * @throws KconfigSyntaxError on malformed input
     * @throws IOException        if a file cannot be read
     */
    public static Kconfig load(Path file, KconfigEnvironment environment, boolean printWarnings,
                               DebugSink sink) throws IOException {
        Kconfig kconfig = new Kconfig(file.toString(), environment, printWarnings, sink);

        SourceFile top = kconfig.openFile(file.toString());
        new Parser(kconfig).parseTopLevel(top, kconfig.topNode);

        kconfig.topNode.list = kconfig.topNode.next;
        kconfig.topNode.next = null;

        TreeFinalizer.finalizeTree(kconfig.topNode);
        DependencyGraph.build(kconfig.definedSyms);

        kconfig.log(DebugLevel.DEBUG, "parsed " + file + ": " + kconfig.definedSyms.size()
                + " defined symbols, " + kconfig.choices.size() + " choices");
        return kconfig;
    }

    /**
     * Loads a .config file. With {@code replace}, all previous user values are
     * dropped first; otherwise the file's values are merged in.
     */
    public void loadConfig(String filename, boolean replace) throws IOException {
        stateStore.load(filename, replace);
    }

    /** Writes the configuration with {@link #DEFAULT_HEADER}. */
    public void writeConfig(Path path) throws IOException {
        writeConfig(path, DEFAULT_HEADER);
    }

    /** Writes the configuration; {@code header} is written verbatim at the top. */
    public void writeConfig(Path path, String header) throws IOException {
        stateStore.write(path, header);
        log(DebugLevel.DEBUG, "wrote " + path);
    }

    /** The .config lines that {@link #writeConfig} would write after the header. */
    public List<String> getConfigStrings() {
        return stateStore.getConfigStrings();
    }

    // -------------------------
    // Queries
    // -------------------------

    /**
     * Evaluates an expression against the current configuration. A bare m is
     * treated as m && MODULES, as in conditions inside Kconfig files.
     *
     * @throws KconfigSyntaxError if the expression is malformed
     */
    public Tristate evalString(String expr) {
        Tristate val = Expr.eval(new Parser(this).parseExpression(expr));
        if (val == Tristate.M && !"y".equals(modules.getValue())) val = Tristate.Y;
        return val;
    }

    /** Symbol by name, or null. Includes symbols that are referenced but never defined. */
    public Symbol getSymbol(String name) {
        return syms.get(name);
    }

    /** All non-constant symbols by name. */
    public Map<String, Symbol> getSymbols() {
        return Collections.unmodifiableMap(syms);
    }

    /** Symbols with at least one definition, in definition order. */
    public List<Symbol> getDefinedSymbols() {
        return new ArrayList<>(definedSyms);
    }

    public List<Choice> getChoices() {
        return Collections.unmodifiableList(choices);
    }

    /** A choice declared as 'choice NAME', or null. */
    public Choice getNamedChoice(String name) {
        return namedChoices.get(name);
    }

    public MenuNode getTopNode() { return topNode; }

    /** All menu nodes, depth first, starting with the top node. */
    public List<MenuNode> getMenuNodes() {
        List<MenuNode> res = new ArrayList<>();
        Deque<MenuNode> stack = new ArrayDeque<>();
        stack.push(topNode);
        while (!stack.isEmpty()) {
            MenuNode node = stack.pop();
            res.add(node);
            if (node.next != null && node != topNode) stack.push(node.next);
            if (node.list != null) stack.push(node.list);
        }
        return res;
    }

    public Symbol getN() { return n; }
    public Symbol getM() { return m; }
    public Symbol getY() { return y; }

    /** The module-enable symbol, MODULES. */
    public Symbol getModules() { return modules; }

    boolean modulesDisabled() {
        return "n".equals(modules.getValue());
    }

    /** The 'mainmenu' title with $NAME references expanded. */
    public String getMainmenuText() {
        return expandSymbolRefs(topNode.prompt.text());
    }

    /** The symbol with 'option defconfig_list', or null. */
    public Symbol getDefconfigList() { return defconfigList; }

    /**
     * The first file among the defconfig_list defaults whose condition holds
     * and which exists (looked up in srctree as well). Null if there is none.
     */
    public String getDefconfigFilename() {
        if (defconfigList == null) return null;
        for (Symbol.Default d : defconfigList.defaults) {
            if (Expr.eval(d.condition()) == Tristate.N) continue;
            String name = d.value() instanceof Symbol
                    ? ((Symbol) d.value()).getValue()
                    : Expr.eval(d.value()).text();
            Path resolved = resolve(expandSymbolRefs(name));
            if (resolved != null) return resolved.toString();
        }
        return null;
    }

    public String getFilename() { return filename; }
    public KconfigEnvironment getEnvironment() { return environment; }
    public String getSrctree() { return environment.getSrctree(); }
    public String getConfigPrefix() { return environment.getConfigPrefix(); }

    // -------------------------
    // Mutation
    // -------------------------

    /** Drops every user value, as if nothing had ever been assigned or loaded. */
    public void unsetValues() {
        for (Symbol sym : definedSyms) {
            sym.userValue = null;
            sym.invalidate();
        }
        for (Choice choice : choices) {
            choice.userValue = null;
            choice.userSelection = null;
            choice.invalidate();
        }
    }

    void invalidateAll() {
        // Undefined symbols never change value
        for (Symbol sym : definedSyms) sym.invalidate();
        for (Choice choice : choices) choice.invalidate();
    }

    // -------------------------
    // Diagnostics
    // -------------------------

    public void enableWarnings() { printWarnings = true; }
    public void disableWarnings() { printWarnings = false; }
    public void enableUndefWarnings() { printUndefWarnings = true; }
    public void disableUndefWarnings() { printUndefWarnings = false; }

    /** Routes diagnostics of this instance to {@code sink}; null restores the global hub. */
    public void setDiagnosticSink(DebugSink sink) {
        this.diagnosticSink = sink;
    }

    void warn(String msg) {
        warn(msg, null, 0);
    }

    void warn(String msg, String file, int linenr) {
        if (printWarnings) log(DebugLevel.WARN, location(file, linenr) + "warning: " + msg);
    }

    void warnUndef(String msg, String file, int linenr) {
        if (printUndefWarnings) log(DebugLevel.WARN, location(file, linenr) + "warning: " + msg);
    }

    private static String location(String file, int linenr) {
        return file == null ? "" : file + ":" + linenr + ": ";
    }

    private void log(DebugLevel level, String msg) {
        if (diagnosticSink != null) {
            diagnosticSink.log(level, DEBUG_TAG, msg, null);
        } else {
            Debug.get().log(level, DEBUG_TAG, msg, null);
        }
    }

    // -------------------------
    // Symbol table
    // -------------------------

    /**
     * Returns the symbol called {@code name}, creating it if needed. For
     * expressions passed to evalString, unknown names are reported and the
     * new symbol is not registered.
     */
    Symbol lookupSymbol(String name, boolean forEvalString) {
        Symbol sym = syms.get(name);
        if (sym != null) return sym;

        sym = new Symbol(this, name, false);
        if (forEvalString) {
            warn("no symbol " + name + " in configuration");
        } else {
            syms.put(name, sym);
        }
        return sym;
    }

    Symbol lookupConstSymbol(String name, boolean forEvalString) {
        Symbol sym = constSyms.get(name);
        if (sym != null) return sym;

        sym = new Symbol(this, name, true);
        if (!forEvalString) constSyms.put(name, sym);
        return sym;
    }

    // -------------------------
    // Expression construction
    // -------------------------

    /** e1 && e2, simplified against y and n. */
    Expr.Node makeAnd(Expr.Node e1, Expr.Node e2) {
        if (e1 == y) return e2;
        if (e2 == y) return e1;
        if (e1 == n || e2 == n) return n;
        return new Expr.And(e1, e2);
    }

    /** e1 || e2, simplified against y and n. */
    Expr.Node makeOr(Expr.Node e1, Expr.Node e2) {
        if (e1 == n) return e2;
        if (e2 == n) return e1;
        if (e1 == y || e2 == y) return y;
        return new Expr.Or(e1, e2);
    }

    // -------------------------
    // Files and variables
    // -------------------------

    /**
     * Replaces $NAME with the value of the symbol NAME if it is defined (or
     * environment-derived), else the variable NAME, else the empty string.
     */
    String expandSymbolRefs(String s) {
        Matcher matcher = SYM_REF.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Symbol sym = syms.get(name);
            String value;
            if (sym != null && (sym.isDefined() || sym.envVar != null)) {
                value = sym.getValue();
            } else {
                value = environment.get(name);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    // The path as given, then relative to srctree. Null if neither exists.
    private Path resolve(String name) {
        Path p = Paths.get(name);
        if (Files.isRegularFile(p)) return p;
        String srctree = getSrctree();
        if (!p.isAbsolute() && srctree != null) {
            Path q = Paths.get(srctree).resolve(name);
            if (Files.isRegularFile(q)) return q;
        }
        return null;
    }

    /** Reads a file, falling back on srctree for relative paths. */
    SourceFile openFile(String name) throws IOException {
        Path p = resolve(name);
        if (p == null) {
            String srctree = getSrctree();
            throw new IOException("Could not open \"" + name + "\". Perhaps the srctree variable"
                    + " (which was " + (srctree == null ? "unset" : "\"" + srctree + "\"")
                    + ") is set incorrectly.");
        }
        String contents = Files.readString(p, StandardCharsets.UTF_8);
        return new SourceFile(p.toString(), p.toRealPath().toString(), contents);
    }

    /** Like {@link #openFile}, with the location of the 'source' statement in errors. */
    SourceFile openSource(String name, String includingFile, int linenr) throws IOException {
        try {
            return openFile(name);
        } catch (IOException e) {
            throw new IOException(includingFile + ":" + linenr + ": " + e.getMessage()
                    + " Note that $FOO in a 'source' statement refers to the symbol FOO if it is"
                    + " defined, and to the environment variable FOO otherwise.", e);
        }
    }

    @Override
    public String toString() {
        return "configuration with " + syms.size() + " symbols, main menu prompt \"" + getMainmenuText()
                + "\", " + (getSrctree() == null ? "srctree not set" : "srctree \"" + getSrctree() + "\"")
                + ", config symbol prefix \"" + getConfigPrefix() + "\", warnings "
                + (printWarnings ? "enabled" : "disabled") + ", undef. symbol assignment warnings "
                + (printUndefWarnings ? "enabled" : "disabled");
    }
}
