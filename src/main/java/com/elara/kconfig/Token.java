package com.elara.kconfig;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Symbol symbol;

    Token(TokenType type, String lexeme, Symbol symbol) {
        this.type = type;
        this.lexeme = lexeme;
        this.symbol = symbol;
    }

    static Token keyword(TokenType type, String lexeme) {
        return new Token(type, lexeme, null);
    }

    static Token text(String text) {
        return new Token(TokenType.TEXT, text, null);
    }

    static Token symbol(Symbol sym) {
        return new Token(TokenType.SYMBOL, sym.getName(), sym);
    }

    public TokenType getType() { return type; }

    /** The symbol for SYMBOL tokens, else null. */
    public Symbol getSymbol() { return symbol; }

    @Override
    public String toString() {
        return type + " " + lexeme;
    }
}
