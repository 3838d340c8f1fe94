package com.elara.kconfig;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recursive-descent parser building the menu tree of a {@link Kconfig}.
 *
 * Dependencies are propagated while parsing: every prompt, default, range,
 * select and imply gets the 'depends on' of its definition site, the
 * dependencies of the enclosing menus/ifs/choices and (for prompts) any
 * enclosing 'visible if' ANDed into its condition.
 */
public class Parser {

    private final Kconfig kconfig;
    private final Lexer lexer;

    // Files currently being parsed, outermost first
    private final Deque<String> includeChain = new ArrayDeque<>();

    public Parser(Kconfig kconfig) {
        this.kconfig = kconfig;
        this.lexer = new Lexer(kconfig);
    }

    /** Parses the top-level Kconfig file into the tree below {@code top}. */
    void parseTopLevel(Kconfig.SourceFile file, MenuNode top) throws IOException {
        includeChain.addLast(file.key());
        parseBlock(new LineFeed(file.name(), file.contents()), null, top, kconfig.getY(), null, top);
        includeChain.removeLast();
    }

    /** Parses a standalone expression, as used by {@link Kconfig#evalString(String)}. */
    Expr.Node parseExpression(String s) {
        TokenFeed tokens = lexer.tokenizeExpression(s);
        Expr.Node expr = parseExpr(tokens, null, 0, true);
        if (!tokens.isAtEnd()) {
            throw parseError(tokens, "extra tokens at end of expression", null, 0);
        }
        return expr;
    }

    // -------------------------
    // Blocks
    // -------------------------

    /**
     * Parses the contents of a file, or of an if, menu or choice, appending
     * new nodes after {@code prevNode}. Returns the last node of the block.
     */
    private MenuNode parseBlock(LineFeed feed, TokenType endToken, MenuNode parent,
                                Expr.Node visibleIfDeps, TokenFeed prevLine, MenuNode prevNode)
            throws IOException {
        while (true) {
            TokenFeed tokens;
            if (prevLine != null) {
                tokens = prevLine;
                prevLine = null;
            } else {
                String line = feed.next();
                if (line == null) {
                    if (endToken != null) {
                        throw new KconfigSyntaxError("Unexpected end of file " + feed.getFilename()
                                + " (missing " + endToken.name().toLowerCase() + ")",
                                feed.getFilename(), feed.getLinenr());
                    }
                    prevNode.next = null;
                    return prevNode;
                }
                tokens = lexer.tokenize(line, feed.getFilename(), feed.getLinenr());
                if (tokens == null) continue;
            }

            String filename = feed.getFilename();
            int linenr = feed.getLinenr();
            Token t0 = tokens.next();

            switch (t0.type) {
                case CONFIG:
                case MENUCONFIG: {
                    Symbol sym = expectSymbol(tokens, "expected symbol name", filename, linenr);

                    MenuNode node = new MenuNode(kconfig, ItemKind.SYMBOL, parent, filename, linenr);
                    node.symbol = sym;
                    node.menuconfig = t0.type == TokenType.MENUCONFIG;

                    prevLine = parseProperties(feed, node, visibleIfDeps);

                    sym.nodes.add(node);
                    kconfig.definedSyms.add(sym);

                    prevNode.next = node;
                    prevNode = node;
                    break;
                }

                case SOURCE: {
                    Token pathTok = tokens.next();
                    if (pathTok == null) throw parseError(tokens, "expected file name", filename, linenr);
                    String path = kconfig.expandSymbolRefs(pathTok.lexeme);

                    Kconfig.SourceFile included = kconfig.openSource(path, filename, linenr);
                    if (includeChain.contains(included.key())) {
                        throw new KconfigSyntaxError("recursive 'source' of " + path + ": "
                                + String.join(" -> ", includeChain) + " -> " + included.key(),
                                filename, linenr);
                    }

                    includeChain.addLast(included.key());
                    prevNode = parseBlock(new LineFeed(included.name(), included.contents()), null,
                            parent, visibleIfDeps, null, prevNode);
                    includeChain.removeLast();
                    break;
                }

                case IF: {
                    MenuNode node = new MenuNode(kconfig, ItemKind.IF, parent, filename, linenr);
                    node.dep = kconfig.makeAnd(parent.dep, parseExpr(tokens, filename, linenr, true));

                    parseBlock(feed, TokenType.ENDIF, node, visibleIfDeps, null, node);
                    node.list = node.next;

                    prevNode.next = node;
                    prevNode = node;
                    break;
                }

                case MENU: {
                    MenuNode node = new MenuNode(kconfig, ItemKind.MENU, parent, filename, linenr);

                    TokenFeed pending = parseProperties(feed, node, visibleIfDeps);
                    node.prompt = new MenuNode.Prompt(textOf(tokens.next()), node.dep);

                    parseBlock(feed, TokenType.ENDMENU, node,
                            kconfig.makeAnd(visibleIfDeps, node.visibility), pending, node);
                    node.list = node.next;

                    prevNode.next = node;
                    prevNode = node;
                    break;
                }

                case COMMENT: {
                    MenuNode node = new MenuNode(kconfig, ItemKind.COMMENT, parent, filename, linenr);

                    prevLine = parseProperties(feed, node, visibleIfDeps);
                    node.prompt = new MenuNode.Prompt(textOf(tokens.next()), node.dep);

                    prevNode.next = node;
                    prevNode = node;
                    break;
                }

                case CHOICE: {
                    Token nameTok = tokens.next();
                    Choice choice;
                    if (nameTok == null) {
                        choice = new Choice(kconfig, null);
                        kconfig.choices.add(choice);
                    } else {
                        choice = kconfig.namedChoices.get(nameTok.lexeme);
                        if (choice == null) {
                            choice = new Choice(kconfig, nameTok.lexeme);
                            kconfig.choices.add(choice);
                            kconfig.namedChoices.put(nameTok.lexeme, choice);
                        }
                    }

                    MenuNode node = new MenuNode(kconfig, ItemKind.CHOICE, parent, filename, linenr);
                    node.choice = choice;

                    TokenFeed pending = parseProperties(feed, node, visibleIfDeps);
                    parseBlock(feed, TokenType.ENDCHOICE, node, visibleIfDeps, pending, node);
                    node.list = node.next;

                    choice.nodes.add(node);

                    prevNode.next = node;
                    prevNode = node;
                    break;
                }

                case MAINMENU: {
                    MenuNode top = kconfig.getTopNode();
                    top.prompt = new MenuNode.Prompt(textOf(tokens.next()), kconfig.getY());
                    break;
                }

                default:
                    if (t0.type == endToken) {
                        prevNode.next = null;
                        return prevNode;
                    }
                    throw parseError(tokens, "unrecognized construct", filename, linenr);
            }
        }
    }

    // -------------------------
    // Properties
    // -------------------------

    /**
     * Parses the properties following a config, menuconfig, choice, menu or
     * comment line and commits them with dependencies propagated. Returns the
     * first line that is not a property, already tokenized, or null at end of
     * file.
     */
    private TokenFeed parseProperties(LineFeed feed, MenuNode node, Expr.Node visibleIfDeps) {
        // Properties from this definition site only. A local 'depends on'
        // applies to these and not to properties from other sites.
        MenuNode.Prompt prompt = null;
        List<Symbol.Default> defaults = new ArrayList<>();
        List<Symbol.Select> selects = new ArrayList<>();
        List<Symbol.Select> implies = new ArrayList<>();
        List<Symbol.Range> ranges = new ArrayList<>();

        node.dep = kconfig.getY();

        TokenFeed lastLine = null;

        while (true) {
            String line = feed.next();
            if (line == null) break;

            String filename = feed.getFilename();
            int linenr = feed.getLinenr();

            TokenFeed tokens = lexer.tokenize(line, filename, linenr);
            if (tokens == null) continue;

            Token t0 = tokens.next();
            boolean done = false;

            switch (t0.type) {
                case DEPENDS:
                    if (!tokens.check(TokenType.ON)) {
                        throw parseError(tokens, "expected \"on\" after \"depends\"", filename, linenr);
                    }
                    node.dep = kconfig.makeAnd(node.dep, parseExpr(tokens, filename, linenr, true));
                    break;

                case HELP:
                    node.help = parseHelp(feed);
                    break;

                case SELECT:
                case IMPLY: {
                    if (node.kind != ItemKind.SYMBOL) {
                        throw parseError(tokens, "only symbols can "
                                + (t0.type == TokenType.SELECT ? "select" : "imply"), filename, linenr);
                    }
                    Symbol target = expectSymbol(tokens, "expected symbol after "
                            + t0.lexeme, filename, linenr);
                    Symbol.Select entry = new Symbol.Select(target, parseCond(tokens, filename, linenr));
                    if (t0.type == TokenType.SELECT) selects.add(entry);
                    else implies.add(entry);
                    break;
                }

                case BOOL:
                case TRISTATE:
                case INT:
                case HEX:
                case STRING:
                    setType(node, typeOf(t0.type), tokens, filename, linenr);
                    if (tokens.peek() != null) {
                        String text = textOf(tokens.next());
                        prompt = new MenuNode.Prompt(text, parseCond(tokens, filename, linenr));
                    }
                    break;

                case DEFAULT:
                    defaults.add(parseValAndCond(tokens, filename, linenr));
                    break;

                case DEF_BOOL:
                case DEF_TRISTATE:
                    setType(node, t0.type == TokenType.DEF_BOOL ? SymbolType.BOOL : SymbolType.TRISTATE,
                            tokens, filename, linenr);
                    defaults.add(parseValAndCond(tokens, filename, linenr));
                    break;

                case PROMPT: {
                    // Overrides earlier prompts at the same definition site
                    Token text = tokens.next();
                    if (text == null) throw parseError(tokens, "expected prompt text", filename, linenr);
                    prompt = new MenuNode.Prompt(textOf(text), parseCond(tokens, filename, linenr));
                    break;
                }

                case RANGE: {
                    Symbol low = expectSymbol(tokens, "expected range bounds", filename, linenr);
                    Symbol high = expectSymbol(tokens, "expected range bounds", filename, linenr);
                    ranges.add(new Symbol.Range(low, high, parseCond(tokens, filename, linenr)));
                    break;
                }

                case OPTION:
                    parseOption(tokens, node, defaults, filename, linenr);
                    break;

                case VISIBLE:
                    if (!tokens.check(TokenType.IF)) {
                        throw parseError(tokens, "expected \"if\" after \"visible\"", filename, linenr);
                    }
                    node.visibility = kconfig.makeAnd(node.visibility, parseExpr(tokens, filename, linenr, true));
                    break;

                case OPTIONAL:
                    if (node.kind != ItemKind.CHOICE) {
                        throw parseError(tokens, "\"optional\" is only valid for choices", filename, linenr);
                    }
                    node.choice.optional = true;
                    break;

                default:
                    // Not a property. Hand the line back to the caller.
                    tokens.reset();
                    lastLine = tokens;
                    done = true;
                    break;
            }
            if (done) break;
        }

        commitProperties(node, visibleIfDeps, prompt, defaults, selects, implies, ranges);
        return lastLine;
    }

    private void commitProperties(MenuNode node, Expr.Node visibleIfDeps, MenuNode.Prompt prompt,
                                  List<Symbol.Default> defaults, List<Symbol.Select> selects,
                                  List<Symbol.Select> implies, List<Symbol.Range> ranges) {
        node.dep = kconfig.makeAnd(node.dep, node.parent.dep);

        if (node.kind != ItemKind.SYMBOL && node.kind != ItemKind.CHOICE) return;

        if (prompt != null) {
            node.prompt = new MenuNode.Prompt(prompt.text(),
                    kconfig.makeAnd(kconfig.makeAnd(prompt.condition(), node.dep), visibleIfDeps));
        } else {
            node.prompt = null;
        }

        if (node.kind == ItemKind.CHOICE) {
            Choice choice = node.choice;
            for (Symbol.Default d : defaults) {
                if (!(d.value() instanceof Symbol)) {
                    throw new KconfigSyntaxError("choice default must be a symbol, got '"
                            + Expr.toString(d.value()) + "'", node.filename, node.linenr);
                }
                choice.defaults.add(new Choice.Default((Symbol) d.value(),
                        kconfig.makeAnd(d.condition(), node.dep)));
            }
            return;
        }

        Symbol sym = node.symbol;
        sym.directDep = kconfig.makeOr(sym.directDep, node.dep);

        for (Symbol.Default d : defaults) {
            sym.defaults.add(new Symbol.Default(d.value(), kconfig.makeAnd(d.condition(), node.dep)));
        }

        for (Symbol.Range r : ranges) {
            sym.ranges.add(new Symbol.Range(r.low(), r.high(), kconfig.makeAnd(r.condition(), node.dep)));
        }

        for (Symbol.Select s : selects) {
            Symbol target = s.target();
            Expr.Node cond = kconfig.makeAnd(s.condition(), node.dep);
            sym.selects.add(new Symbol.Select(target, cond));
            target.revDep = kconfig.makeOr(target.revDep, kconfig.makeAnd(sym, cond));
        }

        for (Symbol.Select s : implies) {
            Symbol target = s.target();
            Expr.Node cond = kconfig.makeAnd(s.condition(), node.dep);
            sym.implies.add(new Symbol.Select(target, cond));
            target.weakRevDep = kconfig.makeOr(target.weakRevDep, kconfig.makeAnd(sym, cond));
        }
    }

    private void parseOption(TokenFeed tokens, MenuNode node, List<Symbol.Default> defaults,
                             String filename, int linenr) {
        if (tokens.check(TokenType.ENV) && tokens.check(TokenType.EQUAL)) {
            Symbol sym = requireSymbolNode(node, tokens, "env", filename, linenr);
            Token varTok = tokens.next();
            if (varTok == null) throw parseError(tokens, "expected variable name", filename, linenr);
            String var = varTok.lexeme;
            sym.envVar = var;

            String value = kconfig.getEnvironment().get(var);
            if (value == null) {
                kconfig.warn("the symbol " + sym.name + " references the non-existent environment"
                        + " variable " + var + " (meaning the 'option env=\"" + var + "\"' will have"
                        + " no effect)", filename, linenr);
            } else {
                defaults.add(new Symbol.Default(kconfig.lookupConstSymbol(value, false), kconfig.getY()));
            }

        } else if (tokens.check(TokenType.DEFCONFIG_LIST)) {
            Symbol sym = requireSymbolNode(node, tokens, "defconfig_list", filename, linenr);
            if (kconfig.defconfigList == null) {
                kconfig.defconfigList = sym;
                sym.defconfigList = true;
            } else if (kconfig.defconfigList != sym) {
                kconfig.warn("'option defconfig_list' set on multiple symbols ("
                        + kconfig.defconfigList.name + " and " + sym.name + "). Only "
                        + kconfig.defconfigList.name + " will be used.", filename, linenr);
            }

        } else if (tokens.check(TokenType.MODULES)) {
            Symbol sym = requireSymbolNode(node, tokens, "modules", filename, linenr);
            sym.modulesOption = true;
            if (sym != kconfig.getModules()) {
                kconfig.warn("the 'modules' option is not supported on " + sym.name
                        + ". The module-enable symbol is always MODULES.", filename, linenr);
            }

        } else if (tokens.check(TokenType.ALLNOCONFIG_Y)) {
            Symbol sym = requireSymbolNode(node, tokens, "allnoconfig_y", filename, linenr);
            sym.allnoconfigY = true;

        } else {
            throw parseError(tokens, "unrecognized option", filename, linenr);
        }
    }

    private Symbol requireSymbolNode(MenuNode node, TokenFeed tokens, String option,
                                     String filename, int linenr) {
        if (node.kind != ItemKind.SYMBOL) {
            throw parseError(tokens, "the '" + option + "' option is only valid for symbols",
                    filename, linenr);
        }
        return node.symbol;
    }

    private void setType(MenuNode node, SymbolType type, TokenFeed tokens, String filename, int linenr) {
        if (node.kind == ItemKind.SYMBOL) {
            node.symbol.type = type;
        } else if (node.kind == ItemKind.CHOICE) {
            node.choice.type = type;
        } else {
            throw parseError(tokens, "only symbols and choices have types", filename, linenr);
        }
    }

    private static SymbolType typeOf(TokenType t) {
        switch (t) {
            case BOOL: return SymbolType.BOOL;
            case TRISTATE: return SymbolType.TRISTATE;
            case INT: return SymbolType.INT;
            case HEX: return SymbolType.HEX;
            case STRING: return SymbolType.STRING;
            default:
                throw new KconfigInternalError("not a type token: " + t);
        }
    }

    /**
     * Reads a help block. The text ends at the first non-blank line indented
     * less than the first line of the block; that line is pushed back.
     */
    private static String parseHelp(LineFeed feed) {
        String line;
        while (true) {
            line = feed.nextNoJoin();
            if (line == null || !isBlank(line)) break;
        }
        if (line == null) return "";

        int indent = indentation(line);
        if (indent == 0) {
            // No help text
            feed.unget();
            return "";
        }

        List<String> helpLines = new ArrayList<>();
        helpLines.add(stripTrailing(deindent(line, indent)));
        while (true) {
            line = feed.nextNoJoin();
            if (line == null || (!isBlank(line) && indentation(line) < indent)) break;
            helpLines.add(stripTrailing(deindent(line, indent)));
        }
        if (line != null) feed.unget();

        return stripTrailing(String.join("\n", helpLines)) + "\n";
    }

    // Non-empty and all whitespace
    private static boolean isBlank(String line) {
        return !line.isEmpty() && line.isBlank();
    }

    static int indentation(String line) {
        String expanded = expandTabs(line);
        return expanded.length() - expanded.stripLeading().length();
    }

    private static String deindent(String line, int indent) {
        String expanded = expandTabs(line);
        if (expanded.length() <= indent) return expanded;
        return expanded.substring(indent);
    }

    private static String stripTrailing(String s) {
        return s.stripTrailing();
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) return line;
        StringBuilder sb = new StringBuilder();
        int col = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = 8 - (col % 8);
                for (int k = 0; k < spaces; k++) sb.append(' ');
                col += spaces;
            } else {
                sb.append(c);
                col = (c == '\n' || c == '\r') ? 0 : col + 1;
            }
        }
        return sb.toString();
    }

    // -------------------------
    // Expressions
    //
    //   expr:     andExpr ['||' expr]
    //   andExpr:  factor ['&&' andExpr]
    //   factor:   <symbol> [<relation> <symbol>]
    //             '!' factor
    //             '(' expr ')'
    // -------------------------

    private Symbol.Default parseValAndCond(TokenFeed tokens, String filename, int linenr) {
        Expr.Node value = parseExpr(tokens, filename, linenr, false);
        return new Symbol.Default(value, parseCond(tokens, filename, linenr));
    }

    // Optional 'if <expr>'; y when absent
    private Expr.Node parseCond(TokenFeed tokens, String filename, int linenr) {
        return tokens.check(TokenType.IF) ? parseExpr(tokens, filename, linenr, true) : kconfig.getY();
    }

    /**
     * Parses an expression. With {@code transformM}, a bare m is rewritten to
     * m && MODULES, so that it behaves as n when modules are disabled.
     */
    private Expr.Node parseExpr(TokenFeed tokens, String filename, int linenr, boolean transformM) {
        Expr.Node and = parseAndExpr(tokens, filename, linenr, transformM);
        if (!tokens.check(TokenType.OR)) return and;
        return new Expr.Or(and, parseExpr(tokens, filename, linenr, transformM));
    }

    private Expr.Node parseAndExpr(TokenFeed tokens, String filename, int linenr, boolean transformM) {
        Expr.Node factor = parseFactor(tokens, filename, linenr, transformM);
        if (!tokens.check(TokenType.AND)) return factor;
        return new Expr.And(factor, parseAndExpr(tokens, filename, linenr, transformM));
    }

    private Expr.Node parseFactor(TokenFeed tokens, String filename, int linenr, boolean transformM) {
        Token token = tokens.next();
        if (token == null) throw parseError(tokens, "malformed expression", filename, linenr);

        switch (token.type) {
            case SYMBOL: {
                Expr.RelOp op = relation(tokens.peek());
                if (op == null) {
                    if (transformM && token.symbol == kconfig.getM()) {
                        return new Expr.And(kconfig.getM(), kconfig.getModules());
                    }
                    return token.symbol;
                }
                tokens.next();
                Token right = tokens.next();
                if (right == null || right.type != TokenType.SYMBOL) {
                    throw parseError(tokens, "malformed expression", filename, linenr);
                }
                return new Expr.Relation(op, token.symbol, right.symbol);
            }
            case NOT:
                return new Expr.Not(parseFactor(tokens, filename, linenr, transformM));
            case OPEN_PAREN: {
                Expr.Node expr = parseExpr(tokens, filename, linenr, transformM);
                if (!tokens.check(TokenType.CLOSE_PAREN)) {
                    throw parseError(tokens, "missing end parenthesis", filename, linenr);
                }
                return expr;
            }
            default:
                throw parseError(tokens, "malformed expression", filename, linenr);
        }
    }

    private static Expr.RelOp relation(Token t) {
        if (t == null) return null;
        switch (t.type) {
            case EQUAL: return Expr.RelOp.EQUAL;
            case UNEQUAL: return Expr.RelOp.UNEQUAL;
            case LESS: return Expr.RelOp.LESS;
            case LESS_EQUAL: return Expr.RelOp.LESS_EQUAL;
            case GREATER: return Expr.RelOp.GREATER;
            case GREATER_EQUAL: return Expr.RelOp.GREATER_EQUAL;
            default: return null;
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Symbol expectSymbol(TokenFeed tokens, String message, String filename, int linenr) {
        Token t = tokens.next();
        if (t == null || t.type != TokenType.SYMBOL) throw parseError(tokens, message, filename, linenr);
        return t.symbol;
    }

    // Display text. A missing text is treated as empty.
    private static String textOf(Token t) {
        return t == null ? "" : t.lexeme;
    }

    private static KconfigSyntaxError parseError(TokenFeed tokens, String message, String filename, int linenr) {
        return new KconfigSyntaxError("Couldn't parse '" + tokens.getLine().strip() + "': " + message,
                filename, linenr);
    }
}
