package com.elara.kconfig;

import java.math.BigInteger;

/**
 * Tri-state evaluation of expressions.
 *
 * Non-bool/tristate symbols are always n in a tristate sense, regardless of
 * their value. Constants other than "m" and "y" are n too.
 */
final class ExprEvaluator implements Expr.Visitor<Tristate> {

    static final ExprEvaluator INSTANCE = new ExprEvaluator();

    private ExprEvaluator() {}

    @Override
    public Tristate visitSymbol(Symbol sym) {
        if (!sym.getOrigType().isBoolOrTristate()) return Tristate.N;
        Tristate t = Tristate.fromText(sym.getValue());
        return t == null ? Tristate.N : t;
    }

    @Override
    public Tristate visitNot(Expr.Not expr) {
        return expr.operand.accept(this).not();
    }

    @Override
    public Tristate visitAnd(Expr.And expr) {
        Tristate left = expr.left.accept(this);
        // Short-circuit
        if (left == Tristate.N) return Tristate.N;
        return Tristate.min(left, expr.right.accept(this));
    }

    @Override
    public Tristate visitOr(Expr.Or expr) {
        Tristate left = expr.left.accept(this);
        // Short-circuit
        if (left == Tristate.Y) return Tristate.Y;
        return Tristate.max(left, expr.right.accept(this));
    }

    @Override
    public Tristate visitRelation(Expr.Relation expr) {
        Symbol op1 = expr.left;
        Symbol op2 = expr.right;
        String v1 = op1.getValue();
        String v2 = op2.getValue();

        int comp;
        if (op1.getOrigType() == SymbolType.STRING && op2.getOrigType() == SymbolType.STRING) {
            comp = Integer.signum(v1.compareTo(v2));
        } else {
            BigInteger n1 = Numbers.parse(v1, op1.getOrigType().base());
            BigInteger n2 = Numbers.parse(v2, op2.getOrigType().base());
            if (n1 != null && n2 != null) {
                comp = n1.compareTo(n2);
            } else if (expr.op.isEquality()) {
                comp = Integer.signum(v1.compareTo(v2));
            } else {
                // Ordering between non-numbers is never satisfied
                return Tristate.N;
            }
        }
        return expr.op.test(comp) ? Tristate.Y : Tristate.N;
    }
}
