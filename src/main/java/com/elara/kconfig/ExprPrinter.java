package com.elara.kconfig;

/** Renders expressions back to Kconfig syntax. */
final class ExprPrinter implements Expr.Visitor<String> {

    static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    @Override
    public String visitSymbol(Symbol sym) {
        return sym.isConstant() ? "\"" + Symbol.escape(sym.getName()) + "\"" : sym.getName();
    }

    @Override
    public String visitNot(Expr.Not expr) {
        if (expr.operand instanceof Symbol) return "!" + expr.operand.accept(this);
        return "!(" + expr.operand.accept(this) + ")";
    }

    @Override
    public String visitAnd(Expr.And expr) {
        return andOperand(expr.left) + " && " + andOperand(expr.right);
    }

    @Override
    public String visitOr(Expr.Or expr) {
        return expr.left.accept(this) + " || " + expr.right.accept(this);
    }

    @Override
    public String visitRelation(Expr.Relation expr) {
        return expr.left.accept(this) + " " + expr.op.text() + " " + expr.right.accept(this);
    }

    // OR binds weaker than AND, so OR operands of an AND need parentheses
    private String andOperand(Expr.Node operand) {
        String s = operand.accept(this);
        return operand instanceof Expr.Or ? "(" + s + ")" : s;
    }
}
