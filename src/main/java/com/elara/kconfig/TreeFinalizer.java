package com.elara.kconfig;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Post-parse pass over the menu tree:
 * - creates implicit submenus from dependencies on the preceding symbol
 * - moves the children of promptless nodes (ifs, invisible symbols) up into
 *   the parent's child list
 * - removes if nodes
 * - determines choice membership and choice types
 *
 * Nodes are finalized children first. The walk uses an explicit stack so that
 * long sibling chains and deep nesting do not grow the Java stack.
 */
final class TreeFinalizer {

    private enum Phase {
        START,
        CHILDREN,   // finalizing node.list, cur is the child being finalized
        AUTO_MENU,  // collecting following siblings that depend on node
        FINISH
    }

    private static final class Frame {
        final MenuNode node;
        Phase phase = Phase.START;
        MenuNode cur;
        boolean awaiting;

        Frame(MenuNode node) {
            this.node = node;
        }
    }

    private TreeFinalizer() {}

    static void finalizeTree(MenuNode root) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));

        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            MenuNode node = f.node;

            switch (f.phase) {
                case START:
                    if (node.list != null) {
                        f.phase = Phase.CHILDREN;
                        f.cur = node.list;
                        stack.push(new Frame(f.cur));
                    } else if (node.kind != ItemKind.IF) {
                        // No children yet. Following nodes might depend on this one.
                        f.phase = Phase.AUTO_MENU;
                        f.cur = node;
                    } else {
                        f.phase = Phase.FINISH;
                    }
                    break;

                case CHILDREN:
                    // Finalizing cur may have changed cur.next (implicit submenus)
                    f.cur = f.cur.next;
                    if (f.cur != null) {
                        stack.push(new Frame(f.cur));
                    } else {
                        f.phase = Phase.FINISH;
                    }
                    break;

                case AUTO_MENU:
                    if (f.awaiting) {
                        f.awaiting = false;
                        f.cur = f.cur.next;
                        f.cur.parent = node;
                    } else if (f.cur.next != null && hasAutoMenuDep(node, f.cur.next)) {
                        f.awaiting = true;
                        stack.push(new Frame(f.cur.next));
                    } else {
                        if (f.cur != node) {
                            // node.next .. cur become the children of node
                            node.list = node.next;
                            node.next = f.cur.next;
                            f.cur.next = null;
                        }
                        f.phase = Phase.FINISH;
                    }
                    break;

                case FINISH:
                    if (node.list != null) {
                        flatten(node.list);
                        removeIfs(node);
                    }
                    // Empty choices are possible, so this is done regardless of children
                    if (node.kind == ItemKind.CHOICE) finalizeChoice(node);
                    stack.pop();
                    break;

                default:
                    throw new KconfigInternalError("unknown finalization phase " + f.phase);
            }
        }
    }

    /**
     * True if node2 depends on the symbol of node1 in a way that makes it an
     * implicit child of node1. Looks at node2's prompt condition if it has a
     * prompt, else at its dependencies.
     */
    static boolean hasAutoMenuDep(MenuNode node1, MenuNode node2) {
        if (node1.kind != ItemKind.SYMBOL) return false;
        if (node2.prompt != null) return exprDependsOn(node2.prompt.condition(), node1.symbol);
        return node2.dep != null && exprDependsOn(node2.dep, node1.symbol);
    }

    /**
     * Matches sym, sym = y, sym = m, y = sym, m = sym, sym != n, n != sym, and
     * ANDs where either side matches.
     */
    static boolean exprDependsOn(Expr.Node expr, Symbol sym) {
        if (expr instanceof Symbol) return expr == sym;

        if (expr instanceof Expr.Relation) {
            Expr.Relation rel = (Expr.Relation) expr;
            if (!rel.op.isEquality()) return false;

            Symbol left = rel.left;
            Symbol right = rel.right;
            if (right == sym) {
                right = left;
                left = sym;
            }
            if (left != sym) return false;

            Kconfig k = sym.kconfig;
            return (rel.op == Expr.RelOp.EQUAL && right == k.getM())
                    || right == k.getY()
                    || (rel.op == Expr.RelOp.UNEQUAL && right == k.getN());
        }

        if (expr instanceof Expr.And) {
            Expr.And and = (Expr.And) expr;
            return exprDependsOn(and.left, sym) || exprDependsOn(and.right, sym);
        }

        return false;
    }

    /**
     * Moves the children of promptless nodes in the chain starting at
     * {@code node} so that they follow the node instead.
     */
    private static void flatten(MenuNode node) {
        while (node != null) {
            if (node.list != null && node.prompt == null) {
                MenuNode last = node.list;
                while (true) {
                    last.parent = node.parent;
                    if (last.next == null) break;
                    last = last.next;
                }
                last.next = node.next;
                node.next = node.list;
                node.list = null;
            }
            node = node.next;
        }
    }

    // Unlinks the (already flattened) if nodes among node's children
    private static void removeIfs(MenuNode node) {
        MenuNode first = node.list;
        while (first != null && first.kind == ItemKind.IF) first = first.next;

        MenuNode cur = first;
        while (cur != null) {
            if (cur.next != null && cur.next.kind == ItemKind.IF) {
                cur.next = cur.next.next;
            } else {
                cur = cur.next;
            }
        }
        node.list = first;
    }

    /**
     * Symbols directly under the choice node are its members. Symbols moved
     * into implicit submenus of another member are not.
     */
    private static void finalizeChoice(MenuNode node) {
        Choice choice = node.choice;

        for (MenuNode cur = node.list; cur != null; cur = cur.next) {
            if (cur.kind == ItemKind.SYMBOL) {
                cur.symbol.choice = choice;
                choice.syms.add(cur.symbol);
            }
        }

        // Untyped choices take the type of the first typed member
        if (choice.type == SymbolType.UNKNOWN) {
            for (Symbol sym : choice.syms) {
                if (sym.type != SymbolType.UNKNOWN) {
                    choice.type = sym.type;
                    break;
                }
            }
        }

        for (Symbol sym : choice.syms) {
            if (sym.type == SymbolType.UNKNOWN) sym.type = choice.type;
        }
    }
}
