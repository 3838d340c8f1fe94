package com.elara.kconfig;

/**
 * Dependency expressions.
 *
 * An expression is either a {@link Symbol} leaf (constant or not) or one of the
 * operator nodes below. Nodes are immutable once built and are shared between
 * items when dependencies are propagated, never copied.
 *
 * A && B && C is represented right-nested: And(A, And(B, C)). Same for ||.
 */
public final class Expr {

    public interface Node {
        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitSymbol(Symbol sym);
        R visitNot(Not expr);
        R visitAnd(And expr);
        R visitOr(Or expr);
        R visitRelation(Relation expr);
    }

    /** The six relational operators. Relations always compare two symbols. */
    public enum RelOp {
        EQUAL("="),
        UNEQUAL("!="),
        LESS("<"),
        LESS_EQUAL("<="),
        GREATER(">"),
        GREATER_EQUAL(">=");

        private final String text;

        RelOp(String text) { this.text = text; }

        public String text() { return text; }

        /** True for = and !=, which fall back on string comparison. */
        public boolean isEquality() {
            return this == EQUAL || this == UNEQUAL;
        }

        boolean test(int comparison) {
            switch (this) {
                case EQUAL: return comparison == 0;
                case UNEQUAL: return comparison != 0;
                case LESS: return comparison < 0;
                case LESS_EQUAL: return comparison <= 0;
                case GREATER: return comparison > 0;
                case GREATER_EQUAL: return comparison >= 0;
                default:
                    throw new KconfigInternalError("unknown relation " + this);
            }
        }
    }

    // -------------------------
    // Operator nodes
    // -------------------------

    public static final class Not implements Node {
        public final Node operand;

        public Not(Node operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String toString() { return Expr.toString(this); }
    }

    public static final class And implements Node {
        public final Node left;
        public final Node right;

        public And(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String toString() { return Expr.toString(this); }
    }

    public static final class Or implements Node {
        public final Node left;
        public final Node right;

        public Or(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String toString() { return Expr.toString(this); }
    }

    public static final class Relation implements Node {
        public final RelOp op;
        public final Symbol left;
        public final Symbol right;

        public Relation(RelOp op, Symbol left, Symbol right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRelation(this);
        }

        @Override
        public String toString() { return Expr.toString(this); }
    }

    // -------------------------
    // Entry points
    // -------------------------

    /** Evaluates an expression to n, m or y against the current symbol values. */
    public static Tristate eval(Node expr) {
        return expr.accept(ExprEvaluator.INSTANCE);
    }

    /** Renders an expression in Kconfig syntax. */
    public static String toString(Node expr) {
        return expr.accept(ExprPrinter.INSTANCE);
    }

    private Expr() {}
}
