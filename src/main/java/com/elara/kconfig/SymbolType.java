package com.elara.kconfig;

/** Declared type of a symbol or choice. */
public enum SymbolType {
    BOOL("bool", 0, "n"),
    TRISTATE("tristate", 0, "n"),
    STRING("string", 0, ""),
    INT("int", 10, ""),
    HEX("hex", 16, ""),
    UNKNOWN("unknown", 0, "");

    private final String typeName;
    private final int base;
    private final String defaultValue;

    SymbolType(String typeName, int base, String defaultValue) {
        this.typeName = typeName;
        this.base = base;
        this.defaultValue = defaultValue;
    }

    /** Keyword used for the type in Kconfig files. */
    public String typeName() { return typeName; }

    /**
     * Number base used when the value takes part in a relational comparison.
     * 0 means the base is inferred from a 0x/0o/0b prefix.
     */
    public int base() { return base; }

    /** Value a symbol of this type gets when no user value or default applies. */
    String defaultValue() { return defaultValue; }

    public boolean isBoolOrTristate() {
        return this == BOOL || this == TRISTATE;
    }

    @Override
    public String toString() { return typeName; }
}
