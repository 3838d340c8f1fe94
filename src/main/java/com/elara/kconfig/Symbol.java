package com.elara.kconfig;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A configuration symbol, or a constant symbol (n, m, y and quoted strings in
 * expressions).
 *
 * Values, visibility and assignable sets are computed on demand and cached
 * until something they may depend on changes. See {@link #setValue(String)}.
 */
public final class Symbol implements Expr.Node {

    /** A default value together with the condition under which it applies. */
    public static final class Default {
        private final Expr.Node value;
        private final Expr.Node condition;

        Default(Expr.Node value, Expr.Node condition) {
            this.value = value;
            this.condition = condition;
        }

        public Expr.Node value() { return value; }
        public Expr.Node condition() { return condition; }
    }

    /** A select or imply of another symbol. */
    public static final class Select {
        private final Symbol target;
        private final Expr.Node condition;

        Select(Symbol target, Expr.Node condition) {
            this.target = target;
            this.condition = condition;
        }

        public Symbol target() { return target; }
        public Expr.Node condition() { return condition; }
    }

    /** An int/hex range with its condition. */
    public static final class Range {
        private final Symbol low;
        private final Symbol high;
        private final Expr.Node condition;

        Range(Symbol low, Symbol high, Expr.Node condition) {
            this.low = low;
            this.high = high;
            this.condition = condition;
        }

        public Symbol low() { return low; }
        public Symbol high() { return high; }
        public Expr.Node condition() { return condition; }
    }

    private static final List<Tristate> NONE = Collections.emptyList();
    private static final List<Tristate> ONLY_M = List.of(Tristate.M);
    private static final List<Tristate> ONLY_Y = List.of(Tristate.Y);
    private static final List<Tristate> M_Y = List.of(Tristate.M, Tristate.Y);
    private static final List<Tristate> N_M = List.of(Tristate.N, Tristate.M);
    private static final List<Tristate> N_Y = List.of(Tristate.N, Tristate.Y);
    private static final List<Tristate> N_M_Y = List.of(Tristate.N, Tristate.M, Tristate.Y);

    final Kconfig kconfig;
    final String name;
    final boolean constant;

    SymbolType type = SymbolType.UNKNOWN;
    final List<MenuNode> nodes = new ArrayList<>();
    final List<Default> defaults = new ArrayList<>();
    final List<Select> selects = new ArrayList<>();
    final List<Select> implies = new ArrayList<>();
    final List<Range> ranges = new ArrayList<>();

    Expr.Node directDep;
    Expr.Node revDep;
    Expr.Node weakRevDep;

    Choice choice;
    String envVar;
    boolean allnoconfigY;
    boolean defconfigList;
    boolean modulesOption;

    final List<Location> references = new ArrayList<>();

    // Dependency graph, filled in once parsing is done
    final Set<Symbol> directDependents = new LinkedHashSet<>();
    private List<Symbol> cachedDependents;

    // User state
    String userValue;

    // Caches
    private boolean valueValid;
    private String cachedValue;
    private boolean writeToConf;
    private boolean visibilityValid;
    private Tristate cachedVisibility;
    private boolean assignableValid;
    private List<Tristate> cachedAssignable;

    Symbol(Kconfig kconfig, String name, boolean constant) {
        this.kconfig = kconfig;
        this.name = name;
        this.constant = constant;
        Expr.Node n = constant && "n".equals(name) ? this : kconfig.getN();
        this.directDep = n;
        this.revDep = n;
        this.weakRevDep = n;
    }

    @Override
    public <R> R accept(Expr.Visitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    // -------------------------
    // Accessors
    // -------------------------

    public String getName() { return name; }
    public boolean isConstant() { return constant; }
    public Kconfig getConfig() { return kconfig; }

    /** The type as declared in the Kconfig files. */
    public SymbolType getOrigType() { return type; }

    /**
     * The effective type: tristate symbols behave as bool inside a choice in
     * y mode and whenever MODULES is n.
     */
    public SymbolType getType() {
        if (type == SymbolType.TRISTATE) {
            if ((choice != null && choice.getMode() == Tristate.Y) || kconfig.modulesDisabled()) {
                return SymbolType.BOOL;
            }
        }
        return type;
    }

    public List<MenuNode> getNodes() { return Collections.unmodifiableList(nodes); }
    public List<Default> getDefaults() { return Collections.unmodifiableList(defaults); }
    public List<Select> getSelects() { return Collections.unmodifiableList(selects); }
    public List<Select> getImplies() { return Collections.unmodifiableList(implies); }
    public List<Range> getRanges() { return Collections.unmodifiableList(ranges); }

    public Expr.Node getDirectDep() { return directDep; }
    public Expr.Node getRevDep() { return revDep; }
    public Expr.Node getWeakRevDep() { return weakRevDep; }

    /** The choice this symbol is a member of, or null. */
    public Choice getChoice() { return choice; }

    /** Environment variable the value is imported from (option env=...), or null. */
    public String getEnvVar() { return envVar; }

    public boolean isAllnoconfigY() { return allnoconfigY; }
    public boolean isDefconfigList() { return defconfigList; }

    /** True if the symbol has at least one definition site. */
    public boolean isDefined() { return !nodes.isEmpty(); }

    /** Definition sites, in parse order. */
    public List<Location> getDefinitionLocations() {
        List<Location> res = new ArrayList<>();
        for (MenuNode node : nodes) res.add(node.getLocation());
        return res;
    }

    /** Places where the symbol is referenced in an expression or property. */
    public List<Location> getReferenceLocations() {
        return Collections.unmodifiableList(references);
    }

    /** The value set via {@link #setValue(String)} or a loaded config, or null. */
    public String getUserValue() { return userValue; }

    // -------------------------
    // Computed state
    // -------------------------

    /** Max over the prompt conditions, further limited by the choice, if any. */
    public Tristate getVisibility() {
        if (visibilityValid) return cachedVisibility;

        Tristate vis = Tristate.N;
        for (MenuNode node : nodes) {
            if (node.prompt != null) {
                vis = Tristate.max(vis, Expr.eval(node.prompt.condition()));
            }
        }

        if (choice != null) {
            Tristate mode = choice.getMode();
            if (choice.type == SymbolType.TRISTATE && type != SymbolType.TRISTATE && mode != Tristate.Y) {
                // Non-tristate members of a tristate choice only show up in y mode
                vis = Tristate.N;
            } else if (type == SymbolType.TRISTATE && vis == Tristate.M && mode == Tristate.Y) {
                vis = Tristate.N;
            } else {
                vis = Tristate.min(vis, choice.getVisibility());
            }
        }

        if (vis == Tristate.M && (type != SymbolType.TRISTATE || kconfig.modulesDisabled())) {
            vis = Tristate.Y;
        }

        cachedVisibility = vis;
        visibilityValid = true;
        return vis;
    }

    /** The current value as a string: "n"/"m"/"y" for bool/tristate. */
    public String getValue() {
        if (valueValid) return cachedValue;
        String val = computeValue();
        cachedValue = val;
        valueValid = true;
        return val;
    }

    /** The current value as a tristate; n for non-bool/tristate symbols. */
    public Tristate getTriValue() {
        return Expr.eval(this);
    }

    private String computeValue() {
        if (constant || type == SymbolType.UNKNOWN) {
            writeToConf = false;
            return name;
        }

        Tristate vis = getVisibility();

        switch (type) {
            case BOOL:
            case TRISTATE:
                return computeTristateValue(vis).text();
            case INT:
            case HEX:
                return computeNumberValue(vis);
            case STRING:
                return computeStringValue(vis);
            default:
                throw new KconfigInternalError("unexpected type " + type + " for " + name);
        }
    }

    private Tristate computeTristateValue(Tristate vis) {
        Tristate val = Tristate.N;

        if (choice == null) {
            writeToConf = vis != Tristate.N;
            if (vis != Tristate.N && userValue != null) {
                val = Tristate.min(Tristate.fromText(userValue), vis);
            } else {
                for (Default d : defaults) {
                    Tristate cond = Expr.eval(d.condition);
                    if (cond != Tristate.N) {
                        writeToConf = true;
                        val = Tristate.min(Expr.eval(d.value), cond);
                        break;
                    }
                }

                // Implies only apply if the symbol's own dependencies are met
                if (Expr.eval(directDep) != Tristate.N) {
                    Tristate weak = Expr.eval(weakRevDep);
                    if (weak != Tristate.N) {
                        writeToConf = true;
                        val = Tristate.max(val, weak);
                    }
                }
            }

            Tristate rev = Expr.eval(revDep);
            if (rev != Tristate.N) {
                writeToConf = true;
                val = Tristate.max(val, rev);
            }
        } else {
            writeToConf = false;
            if (vis != Tristate.N) {
                Tristate mode = choice.getMode();
                if (mode != Tristate.N) {
                    writeToConf = true;
                    if (mode == Tristate.Y) {
                        val = choice.getSelection() == this ? Tristate.Y : Tristate.N;
                    } else if ("m".equals(userValue) || "y".equals(userValue)) {
                        val = Tristate.M;
                    }
                }
            }
        }

        if (val == Tristate.M && (getType() == SymbolType.BOOL || Expr.eval(weakRevDep) == Tristate.Y)) {
            val = Tristate.Y;
        }
        return val;
    }

    private String computeNumberValue(Tristate vis) {
        int base = type.base();
        String val = type.defaultValue();

        BigInteger low = null;
        BigInteger high = null;
        boolean hasActiveRange = false;
        for (Range r : ranges) {
            if (Expr.eval(r.condition) != Tristate.N) {
                hasActiveRange = true;
                low = rangeBound(r.low, base);
                high = rangeBound(r.high, base);
                break;
            }
        }

        writeToConf = vis != Tristate.N;

        if (vis != Tristate.N && userValue != null && Numbers.isBaseN(userValue, base)
                && (!hasActiveRange || inRange(Numbers.parse(userValue, base), low, high))) {
            // Kept verbatim, so that e.g. 0x prefixes survive
            return userValue;
        }

        boolean useDefault = true;
        for (Default d : defaults) {
            if (Expr.eval(d.condition) == Tristate.N) continue;
            writeToConf = true;

            // Non-numeric defaults (e.g. an empty int symbol) are skipped
            String candidate = valueOf(d.value);
            BigInteger num = Numbers.parse(candidate, base);
            if (num == null) continue;

            useDefault = false;
            val = candidate;
            if (hasActiveRange) {
                BigInteger clamped = null;
                if (num.compareTo(low) < 0) {
                    clamped = low;
                } else if (num.compareTo(high) > 0) {
                    clamped = high;
                }
                if (clamped != null) val = Numbers.format(clamped, type);
            }
            break;
        }

        // No user value or default applies. Fall back on the range's low end
        // if zero isn't allowed.
        if (useDefault && hasActiveRange && low.signum() > 0) {
            val = Numbers.format(low, type);
        }
        return val;
    }

    private String computeStringValue(Tristate vis) {
        writeToConf = vis != Tristate.N;
        if (vis != Tristate.N && userValue != null) return userValue;

        for (Default d : defaults) {
            if (Expr.eval(d.condition) != Tristate.N) {
                writeToConf = true;
                return valueOf(d.value);
            }
        }
        return type.defaultValue();
    }

    private static BigInteger rangeBound(Symbol bound, int base) {
        BigInteger v = Numbers.parse(bound.getValue(), base);
        return v == null ? BigInteger.ZERO : v;
    }

    private static boolean inRange(BigInteger v, BigInteger low, BigInteger high) {
        return v.compareTo(low) >= 0 && v.compareTo(high) <= 0;
    }

    private static String valueOf(Expr.Node expr) {
        if (expr instanceof Symbol) return ((Symbol) expr).getValue();
        return Expr.eval(expr).text();
    }

    /**
     * Values the symbol can currently be given through {@link #setValue(String)}.
     * Only meaningful for bool/tristate symbols; empty for others and when the
     * symbol is invisible or pinned by a select. A single entry means the value
     * is fixed by a select.
     */
    public List<Tristate> getAssignable() {
        if (assignableValid) return cachedAssignable;
        cachedAssignable = computeAssignable();
        assignableValid = true;
        return cachedAssignable;
    }

    private List<Tristate> computeAssignable() {
        if (!type.isBoolOrTristate()) return NONE;

        Tristate vis = getVisibility();
        if (vis == Tristate.N) return NONE;

        Tristate rev = Expr.eval(revDep);
        boolean boolLike = getType() == SymbolType.BOOL || Expr.eval(weakRevDep) == Tristate.Y;

        if (vis == Tristate.Y) {
            if (rev == Tristate.N) return boolLike ? N_Y : N_M_Y;
            if (rev == Tristate.Y) return ONLY_Y;
            // A bool selected to exactly m is pinned
            if (getType() == SymbolType.BOOL) return NONE;
            return boolLike ? ONLY_Y : M_Y;
        }

        // vis == m
        if (rev == Tristate.N) {
            return Expr.eval(weakRevDep) == Tristate.Y ? N_Y : N_M;
        }
        if (rev == Tristate.Y) return ONLY_Y;
        return ONLY_M;
    }

    /**
     * The line this symbol contributes to a .config file, including the
     * trailing newline, or null if it is not written out.
     */
    public String getConfigString() {
        if (envVar != null) return null;

        String val = getValue();
        if (!writeToConf) return null;

        String prefixed = kconfig.getConfigPrefix() + name;
        switch (type) {
            case BOOL:
            case TRISTATE:
                if ("n".equals(val)) return "# " + prefixed + " is not set\n";
                return prefixed + "=" + val + "\n";
            case INT:
            case HEX:
                return prefixed + "=" + val + "\n";
            case STRING:
                return prefixed + "=\"" + escape(val) + "\"\n";
            default:
                throw new KconfigInternalError("symbol " + name + " has unknown type " + type
                        + " but is written to the configuration");
        }
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // -------------------------
    // User values
    // -------------------------

    /**
     * Sets the user value. Values that are not valid for the symbol's type
     * produce a warning and are ignored. The user value is remembered even if
     * the symbol is currently invisible; it takes effect once it becomes visible.
     *
     * @return true if the value was accepted
     */
    public boolean setValue(String value) {
        if (!setValueNoInvalidate(value, false)) return false;

        if (this == kconfig.getModules()) {
            // MODULES affects the effective type of every tristate symbol
            kconfig.invalidateAll();
        } else {
            recursiveInvalidate();
        }
        return true;
    }

    /** Removes the user value, so that defaults and selects apply again. */
    public void unsetValue() {
        if (userValue == null) return;
        userValue = null;
        if (this == kconfig.getModules()) {
            kconfig.invalidateAll();
        } else {
            recursiveInvalidate();
        }
    }

    boolean setValueNoInvalidate(String value, boolean suppressPromptWarning) {
        if (constant) {
            kconfig.warn("attempt to assign the value '" + value + "' to the constant symbol " + name
                    + ". Assignment ignored.");
            return false;
        }

        if (!isValidValue(value)) {
            kconfig.warn("the value '" + value + "' is invalid for " + name + ", which has type "
                    + type + ". Assignment ignored.");
            return false;
        }

        if (!suppressPromptWarning && isDefined() && !hasPrompt()) {
            kconfig.warn("assigning '" + value + "' to the symbol " + name + " which lacks prompts, so"
                    + " the value will have no effect");
        }

        userValue = value;

        if (choice != null && type.isBoolOrTristate()) {
            if ("y".equals(value)) {
                choice.userValue = "y";
                choice.userSelection = this;
            } else if ("m".equals(value)) {
                choice.userValue = "m";
            }
        }
        return true;
    }

    private boolean isValidValue(String value) {
        if (value == null) return false;
        switch (type) {
            case BOOL:
                return "n".equals(value) || "y".equals(value);
            case TRISTATE:
                return Tristate.fromText(value) != null;
            case STRING:
                return true;
            case INT:
            case HEX:
                return Numbers.isBaseN(value, type.base());
            default:
                return false;
        }
    }

    boolean hasPrompt() {
        for (MenuNode node : nodes) {
            if (node.prompt != null) return true;
        }
        return false;
    }

    // -------------------------
    // Invalidation
    // -------------------------

    void invalidate() {
        valueValid = false;
        cachedValue = null;
        writeToConf = false;
        visibilityValid = false;
        cachedVisibility = null;
        assignableValid = false;
        cachedAssignable = null;
    }

    /** Invalidates this symbol and everything whose state may depend on it. */
    void recursiveInvalidate() {
        invalidate();
        for (Symbol dep : getDependents()) {
            dep.invalidate();
            if (dep.choice != null) dep.choice.invalidate();
        }
        if (choice != null) choice.invalidate();
    }

    /**
     * All symbols whose value may change when this symbol changes. Computed
     * once from the dependency graph and then cached; safe on cycles.
     */
    List<Symbol> getDependents() {
        if (cachedDependents == null) {
            cachedDependents = DependencyGraph.transitiveDependents(this);
        }
        return cachedDependents;
    }

    @Override
    public String toString() {
        return KconfigWriter.symbolToString(this);
    }
}
