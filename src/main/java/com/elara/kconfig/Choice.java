package com.elara.kconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A choice: a group of bool/tristate symbols of which at most one can be y.
 *
 * In y mode exactly one member (the selection) is y. In m mode any number of
 * tristate members can be m. In n mode (optional choices only) all members are n.
 */
public final class Choice {

    /** A default selection with its condition. */
    public static final class Default {
        private final Symbol symbol;
        private final Expr.Node condition;

        Default(Symbol symbol, Expr.Node condition) {
            this.symbol = symbol;
            this.condition = condition;
        }

        public Symbol symbol() { return symbol; }
        public Expr.Node condition() { return condition; }
    }

    private static final List<Tristate> NONE = Collections.emptyList();
    private static final List<Tristate> ONLY_M = List.of(Tristate.M);
    private static final List<Tristate> ONLY_Y = List.of(Tristate.Y);
    private static final List<Tristate> M_Y = List.of(Tristate.M, Tristate.Y);
    private static final List<Tristate> N_M = List.of(Tristate.N, Tristate.M);

    final Kconfig kconfig;
    final String name;

    SymbolType type = SymbolType.UNKNOWN;
    final List<Symbol> syms = new ArrayList<>();
    final List<Default> defaults = new ArrayList<>();
    final List<MenuNode> nodes = new ArrayList<>();
    boolean optional;

    String userValue;
    Symbol userSelection;

    private boolean modeValid;
    private Tristate cachedMode;
    private boolean visibilityValid;
    private Tristate cachedVisibility;
    private boolean selectionValid;
    private Symbol cachedSelection;
    private boolean assignableValid;
    private List<Tristate> cachedAssignable;

    Choice(Kconfig kconfig, String name) {
        this.kconfig = kconfig;
        this.name = name;
    }

    /** Name of a named choice, or null. */
    public String getName() { return name; }

    public SymbolType getOrigType() { return type; }

    /** Tristate choices act as bool choices while MODULES is n. */
    public SymbolType getType() {
        if (type == SymbolType.TRISTATE && kconfig.modulesDisabled()) return SymbolType.BOOL;
        return type;
    }

    public List<Symbol> getSymbols() { return Collections.unmodifiableList(syms); }
    public List<Default> getDefaults() { return Collections.unmodifiableList(defaults); }
    public List<MenuNode> getNodes() { return Collections.unmodifiableList(nodes); }
    public boolean isOptional() { return optional; }
    public String getUserValue() { return userValue; }
    public Symbol getUserSelection() { return userSelection; }

    public Tristate getVisibility() {
        if (visibilityValid) return cachedVisibility;

        Tristate vis = Tristate.N;
        for (MenuNode node : nodes) {
            if (node.prompt != null) {
                vis = Tristate.max(vis, Expr.eval(node.prompt.condition()));
            }
        }
        if (vis == Tristate.M && (type != SymbolType.TRISTATE || kconfig.modulesDisabled())) {
            vis = Tristate.Y;
        }

        cachedVisibility = vis;
        visibilityValid = true;
        return vis;
    }

    /** The choice mode: n, m or y. Non-optional choices are never n. */
    public Tristate getMode() {
        if (modeValid) return cachedMode;

        Tristate mode = Tristate.N;
        if (userValue != null) {
            mode = Tristate.min(Tristate.fromText(userValue), getVisibility());
        }
        if (mode == Tristate.N && !optional) mode = Tristate.M;
        if (mode == Tristate.M && getType() == SymbolType.BOOL) mode = Tristate.Y;

        cachedMode = mode;
        modeValid = true;
        return mode;
    }

    /** The member that is y, or null when the choice is not in y mode. */
    public Symbol getSelection() {
        if (selectionValid) return cachedSelection;
        cachedSelection = computeSelection();
        selectionValid = true;
        return cachedSelection;
    }

    private Symbol computeSelection() {
        if (getMode() != Tristate.Y) return null;
        if (userSelection != null && userSelection.getVisibility() == Tristate.Y) {
            return userSelection;
        }
        return getDefaultSelection();
    }

    /**
     * The member selected when the user has not picked a visible one: the
     * first default whose condition holds and whose symbol is visible, else
     * the first visible member.
     */
    public Symbol getDefaultSelection() {
        for (Default d : defaults) {
            if (Expr.eval(d.condition) != Tristate.N && d.symbol.getVisibility() != Tristate.N) {
                return d.symbol;
            }
        }
        for (Symbol sym : syms) {
            if (sym.getVisibility() != Tristate.N) return sym;
        }
        return null;
    }

    /** Modes that can currently be given through {@link #setValue(String)}. */
    public List<Tristate> getAssignable() {
        if (assignableValid) return cachedAssignable;
        cachedAssignable = computeAssignable();
        assignableValid = true;
        return cachedAssignable;
    }

    private List<Tristate> computeAssignable() {
        Tristate vis = getVisibility();
        if (vis == Tristate.N) return NONE;

        if (vis == Tristate.Y) {
            if (!optional) return getType() == SymbolType.BOOL ? ONLY_Y : M_Y;
            return ONLY_Y;
        }
        return optional ? N_M : ONLY_M;
    }

    /**
     * Sets the user mode. Only n, m and y are accepted; anything else is
     * reported and ignored.
     *
     * @return true if the value was accepted
     */
    public boolean setValue(String value) {
        Tristate mode = Tristate.fromText(value);
        if (mode == null) {
            kconfig.warn("the value '" + value + "' is invalid for the choice " + describe()
                    + ". Assignment ignored.");
            return false;
        }
        userValue = value;
        invalidateMembers();
        return true;
    }

    /** Forgets the user mode and selection. */
    public void unsetValue() {
        if (userValue == null && userSelection == null) return;
        userValue = null;
        userSelection = null;
        invalidateMembers();
    }

    private void invalidateMembers() {
        if (syms.isEmpty()) {
            invalidate();
        } else {
            // Member dependents include the choice and every sibling
            syms.get(0).recursiveInvalidate();
        }
    }

    void invalidate() {
        modeValid = false;
        cachedMode = null;
        visibilityValid = false;
        cachedVisibility = null;
        selectionValid = false;
        cachedSelection = null;
        assignableValid = false;
        cachedAssignable = null;
    }

    String describe() {
        return name == null ? "<choice>" : name;
    }

    @Override
    public String toString() {
        return KconfigWriter.choiceToString(this);
    }
}
