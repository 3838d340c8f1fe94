package com.elara.kconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one logical Kconfig line into tokens.
 *
 * Identifiers become symbols (registered in the owning {@link Kconfig} on first
 * sight), except right after keywords that take display text, where they are
 * kept as raw text. Quoted strings become constant symbols, again except where
 * raw text is expected.
 */
public class Lexer {

    // Leading junk such as "---" in "---help---" is skipped
    private static final Pattern INITIAL_TOKEN = Pattern.compile("[^\\w#]*(\\w+)\\s*");
    private static final Pattern ID_KEYWORD = Pattern.compile("([\\w./-]+)\\s*");

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("allnoconfig_y", TokenType.ALLNOCONFIG_Y);
        map.put("bool", TokenType.BOOL);
        map.put("boolean", TokenType.BOOL);
        map.put("choice", TokenType.CHOICE);
        map.put("comment", TokenType.COMMENT);
        map.put("config", TokenType.CONFIG);
        map.put("def_bool", TokenType.DEF_BOOL);
        map.put("def_tristate", TokenType.DEF_TRISTATE);
        map.put("default", TokenType.DEFAULT);
        map.put("defconfig_list", TokenType.DEFCONFIG_LIST);
        map.put("depends", TokenType.DEPENDS);
        map.put("endchoice", TokenType.ENDCHOICE);
        map.put("endif", TokenType.ENDIF);
        map.put("endmenu", TokenType.ENDMENU);
        map.put("env", TokenType.ENV);
        map.put("help", TokenType.HELP);
        map.put("hex", TokenType.HEX);
        map.put("if", TokenType.IF);
        map.put("imply", TokenType.IMPLY);
        map.put("int", TokenType.INT);
        map.put("mainmenu", TokenType.MAINMENU);
        map.put("menu", TokenType.MENU);
        map.put("menuconfig", TokenType.MENUCONFIG);
        map.put("modules", TokenType.MODULES);
        map.put("on", TokenType.ON);
        map.put("option", TokenType.OPTION);
        map.put("optional", TokenType.OPTIONAL);
        map.put("prompt", TokenType.PROMPT);
        map.put("range", TokenType.RANGE);
        map.put("select", TokenType.SELECT);
        map.put("source", TokenType.SOURCE);
        map.put("string", TokenType.STRING);
        map.put("tristate", TokenType.TRISTATE);
        map.put("visible", TokenType.VISIBLE);
        keywords = Collections.unmodifiableMap(map);
    }

    // Tokens after which identifiers and strings are plain text
    private static final Set<TokenType> STRING_LEX = EnumSet.of(
            TokenType.BOOL, TokenType.CHOICE, TokenType.COMMENT, TokenType.HEX, TokenType.INT,
            TokenType.MAINMENU, TokenType.MENU, TokenType.PROMPT, TokenType.SOURCE,
            TokenType.STRING, TokenType.TRISTATE);

    private final Kconfig kconfig;

    public Lexer(Kconfig kconfig) {
        this.kconfig = kconfig;
    }

    /** Keyword for {@code word}, or null. */
    static TokenType keyword(String word) {
        return keywords.get(word);
    }

    /**
     * Tokenizes a line of a Kconfig file. Returns null for blank and comment
     * lines. For help lines only the HELP token is returned, so that text after
     * "help" is never taken for symbol references.
     */
    public TokenFeed tokenize(String s, String filename, int linenr) {
        Matcher initial = INITIAL_TOKEN.matcher(s);
        if (!initial.lookingAt()) return null;

        String word = initial.group(1);
        TokenType type = keywords.get(word);
        if (type == null) {
            throw tokenizationError(s, filename, linenr);
        }

        List<Token> tokens = new ArrayList<>();
        tokens.add(Token.keyword(type, word));
        if (type == TokenType.HELP) return new TokenFeed(s, tokens);

        scan(s, initial.end(), tokens, false, filename, linenr);
        return new TokenFeed(s, tokens);
    }

    /**
     * Tokenizes a free-standing expression. Unknown names produce a warning
     * and are not registered.
     */
    public TokenFeed tokenizeExpression(String s) {
        List<Token> tokens = new ArrayList<>();
        scan(s, 0, tokens, true, null, 0);
        return new TokenFeed(s, tokens);
    }

    private void scan(String s, int i, List<Token> tokens, boolean forEvalString,
                      String filename, int linenr) {
        Matcher idKeyword = ID_KEYWORD.matcher(s);
        int len = s.length();

        while (i < len) {
            // Type of the previous token
            TokenType prev = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1).type;
            boolean rawText = prev != null && STRING_LEX.contains(prev);

            idKeyword.region(i, len);
            if (idKeyword.lookingAt()) {
                i = idKeyword.end();
                String name = idKeyword.group(1);
                TokenType kw = keywords.get(name);

                if (kw != null) {
                    tokens.add(Token.keyword(kw, name));
                } else if (rawText) {
                    // Unquoted prompt or title
                    tokens.add(Token.text(name));
                } else {
                    Symbol sym;
                    if (name.equals("n") || name.equals("m") || name.equals("y")) {
                        sym = kconfig.lookupConstSymbol(name, forEvalString);
                    } else {
                        sym = kconfig.lookupSymbol(name, forEvalString);
                        if (!forEvalString && prev != TokenType.CONFIG && prev != TokenType.MENUCONFIG) {
                            sym.references.add(new Location(filename, linenr));
                        }
                    }
                    tokens.add(Token.symbol(sym));
                }
                continue;
            }

            char c = s.charAt(i++);
            Token token;

            switch (c) {
                case '"':
                case '\'': {
                    StringBuilder val = new StringBuilder();
                    while (true) {
                        if (i >= len) throw tokenizationError(s, filename, linenr);
                        char ch = s.charAt(i);
                        if (ch == c) break;
                        if (ch == '\\') {
                            if (i + 1 >= len) throw tokenizationError(s, filename, linenr);
                            val.append(s.charAt(i + 1));
                            i += 2;
                        } else {
                            val.append(ch);
                            i++;
                        }
                    }
                    i++;

                    // option env="FOO" names a variable, not a constant symbol
                    boolean optionLine = !forEvalString && tokens.get(0).type == TokenType.OPTION;
                    if (rawText || optionLine) {
                        token = Token.text(val.toString());
                    } else {
                        token = Token.symbol(kconfig.lookupConstSymbol(val.toString(), forEvalString));
                    }
                    break;
                }
                case '&':
                    // A lone '&' is ignored
                    if (i >= len || s.charAt(i) != '&') continue;
                    token = Token.keyword(TokenType.AND, "&&");
                    i++;
                    break;
                case '|':
                    if (i >= len || s.charAt(i) != '|') continue;
                    token = Token.keyword(TokenType.OR, "||");
                    i++;
                    break;
                case '!':
                    if (i < len && s.charAt(i) == '=') {
                        token = Token.keyword(TokenType.UNEQUAL, "!=");
                        i++;
                    } else {
                        token = Token.keyword(TokenType.NOT, "!");
                    }
                    break;
                case '=':
                    token = Token.keyword(TokenType.EQUAL, "=");
                    break;
                case '(':
                    token = Token.keyword(TokenType.OPEN_PAREN, "(");
                    break;
                case ')':
                    token = Token.keyword(TokenType.CLOSE_PAREN, ")");
                    break;
                case '#':
                    // Comment
                    return;
                case '<':
                    if (i < len && s.charAt(i) == '=') {
                        token = Token.keyword(TokenType.LESS_EQUAL, "<=");
                        i++;
                    } else {
                        token = Token.keyword(TokenType.LESS, "<");
                    }
                    break;
                case '>':
                    if (i < len && s.charAt(i) == '=') {
                        token = Token.keyword(TokenType.GREATER_EQUAL, ">=");
                        i++;
                    } else {
                        token = Token.keyword(TokenType.GREATER, ">");
                    }
                    break;
                default:
                    // Whitespace and invalid characters are skipped
                    continue;
            }

            while (i < len && Character.isWhitespace(s.charAt(i))) i++;
            tokens.add(token);
        }
    }

    private static KconfigSyntaxError tokenizationError(String s, String filename, int linenr) {
        return new KconfigSyntaxError("Couldn't tokenize '" + s.strip() + "'", filename, linenr);
    }
}
