package com.elara.kconfig;

/**
 * Three-valued logic used throughout Kconfig: n (off) &lt; m (module) &lt; y (on).
 */
public enum Tristate {
    N("n"),
    M("m"),
    Y("y");

    private final String text;

    Tristate(String text) {
        this.text = text;
    }

    /** The literal used in Kconfig files and .config files ("n", "m" or "y"). */
    public String text() { return text; }

    public boolean lessThan(Tristate other) { return compareTo(other) < 0; }
    public boolean lessOrEqual(Tristate other) { return compareTo(other) <= 0; }
    public boolean greaterThan(Tristate other) { return compareTo(other) > 0; }
    public boolean greaterOrEqual(Tristate other) { return compareTo(other) >= 0; }

    public static Tristate min(Tristate a, Tristate b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Tristate max(Tristate a, Tristate b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Kconfig negation: n and y swap, m stays m. */
    public Tristate not() {
        switch (this) {
            case N: return Y;
            case Y: return N;
            default: return M;
        }
    }

    /** Parses "n", "m" or "y"; returns null for anything else. */
    public static Tristate fromText(String s) {
        if (s == null) return null;
        switch (s) {
            case "n": return N;
            case "m": return M;
            case "y": return Y;
            default: return null;
        }
    }

    @Override
    public String toString() { return text; }
}
