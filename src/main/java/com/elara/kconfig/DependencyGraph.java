package com.elara.kconfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records which symbols may change value when another symbol changes, for
 * cache invalidation. The sets are conservative: every symbol appearing in an
 * expression that feeds into a symbol's value or visibility counts.
 */
final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * Fills {@link Symbol#directDependents} for every symbol referenced by a
     * defined symbol. Undefined symbols always evaluate to their name, so
     * nothing is recorded for them as dependents.
     */
    static void build(Collection<Symbol> definedSyms) {
        for (Symbol sym : definedSyms) {
            for (MenuNode node : sym.nodes) {
                if (node.prompt != null) dependOn(sym, node.prompt.condition());
            }

            for (Symbol.Default d : sym.defaults) {
                dependOn(sym, d.value());
                dependOn(sym, d.condition());
            }

            dependOn(sym, sym.revDep);
            dependOn(sym, sym.weakRevDep);

            for (Symbol.Range r : sym.ranges) {
                dependOn(sym, r.low());
                dependOn(sym, r.high());
                dependOn(sym, r.condition());
            }

            // Needed for imply, which only applies while the direct deps hold
            dependOn(sym, sym.directDep);

            if (sym.choice != null) {
                for (MenuNode node : sym.choice.nodes) {
                    if (node.prompt != null) dependOn(sym, node.prompt.condition());
                }
                for (Choice.Default d : sym.choice.defaults) {
                    dependOn(sym, d.condition());
                }
            }
        }
    }

    // Registers sym as a dependent of every non-constant symbol in expr
    private static void dependOn(Symbol sym, Expr.Node expr) {
        Deque<Expr.Node> work = new ArrayDeque<>();
        work.push(expr);
        while (!work.isEmpty()) {
            Expr.Node e = work.pop();
            if (e instanceof Symbol) {
                Symbol leaf = (Symbol) e;
                if (!leaf.isConstant()) leaf.directDependents.add(sym);
            } else if (e instanceof Expr.Not) {
                work.push(((Expr.Not) e).operand);
            } else if (e instanceof Expr.And) {
                work.push(((Expr.And) e).right);
                work.push(((Expr.And) e).left);
            } else if (e instanceof Expr.Or) {
                work.push(((Expr.Or) e).right);
                work.push(((Expr.Or) e).left);
            } else if (e instanceof Expr.Relation) {
                work.push(((Expr.Relation) e).right);
                work.push(((Expr.Relation) e).left);
            } else {
                throw new KconfigInternalError("unknown expression node " + e.getClass().getName());
            }
        }
    }

    /**
     * Everything that must be invalidated when {@code sym} changes: the
     * transitive closure over direct dependents, where members of a choice
     * also pull in all their siblings. Siblings are kept out of the direct
     * sets, which would otherwise be full of cycles.
     */
    static List<Symbol> transitiveDependents(Symbol sym) {
        Set<Symbol> seen = new LinkedHashSet<>();
        Deque<Symbol> work = new ArrayDeque<>();
        work.add(sym);

        while (!work.isEmpty()) {
            Symbol cur = work.poll();
            for (Symbol dep : cur.directDependents) {
                if (seen.add(dep)) work.add(dep);
            }
            if (cur.choice != null) {
                for (Symbol sibling : cur.choice.syms) {
                    if (sibling != cur && seen.add(sibling)) work.add(sibling);
                }
            }
        }

        seen.remove(sym);
        return new ArrayList<>(seen);
    }
}
