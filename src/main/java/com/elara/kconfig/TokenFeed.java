package com.elara.kconfig;

import java.util.List;

/** Cursor over the tokens of one logical line. */
public final class TokenFeed {
    private final String line;
    private final List<Token> tokens;
    private int current = 0;

    TokenFeed(String line, List<Token> tokens) {
        this.line = line;
        this.tokens = tokens;
    }

    /** The source line the tokens came from. */
    public String getLine() { return line; }

    public List<Token> getTokens() { return tokens; }

    /** Next token, or null at the end of the line. */
    public Token next() {
        if (current >= tokens.size()) return null;
        return tokens.get(current++);
    }

    /** Next token without consuming it, or null. */
    public Token peek() {
        return current < tokens.size() ? tokens.get(current) : null;
    }

    /** Consumes the next token if it has the given type. */
    public boolean check(TokenType type) {
        Token t = peek();
        if (t != null && t.type == type) {
            current++;
            return true;
        }
        return false;
    }

    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    void reset() {
        current = 0;
    }
}
