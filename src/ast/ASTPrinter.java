package ast;

import ast.expr.*;
import ast.stmt.*;

/**
 * Renders statements and expressions in the listing syntax the frontend reads.
 * Used for debug dumps and for the driver's output.
 */
public class ASTPrinter {
    private static final String INDENT = "    ";

    private ASTPrinter() {
    }

    public static String print(ASTContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (Function f : ctx.getFunctions()) {
            sb.append(print(f));
        }
        return sb.toString();
    }

    public static String print(Function f) {
        StringBuilder sb = new StringBuilder();
        sb.append(f.getReturnType()).append(' ').append(f.getName()).append("() ");
        new StatementWriter(sb).braced(f.getBody(), 0);
        sb.append('\n');
        return sb.toString();
    }

    public static String print(Statement stmt) {
        StringBuilder sb = new StringBuilder();
        stmt.accept(new StatementWriter(sb));
        return sb.toString();
    }

    public static String print(Expression expr) {
        return expr.accept(ExpressionWriter.INSTANCE);
    }

    private static class StatementWriter implements StatementVisitor<Void> {
        private final StringBuilder sb;
        private int depth;

        StatementWriter(StringBuilder sb) {
            this.sb = sb;
        }

        private void indent() {
            sb.append(INDENT.repeat(depth));
        }

        /**
         * Writes {@code stmt} as a brace-enclosed scope starting at the current
         * position, without a trailing newline.
         */
        void braced(Statement stmt, int level) {
            int saved = depth;
            depth = level + 1;
            sb.append("{\n");
            if (stmt instanceof BlockStatement block) {
                for (Statement child : block.getStatements()) {
                    child.accept(this);
                }
            } else {
                stmt.accept(this);
            }
            depth = level;
            indent();
            sb.append('}');
            depth = saved;
        }

        private void writeIf(IfStatement stmt) {
            sb.append("if (").append(print(stmt.getCondition())).append(") ");
            braced(stmt.getThen(), depth);
            Statement otherwise = stmt.getElse();
            if (otherwise != null) {
                sb.append(" else ");
                if (otherwise instanceof IfStatement elseIf) {
                    writeIf(elseIf);
                } else {
                    braced(otherwise, depth);
                }
            }
        }

        @Override
        public Void visit(BlockStatement stmt) {
            indent();
            braced(stmt, depth);
            sb.append('\n');
            return null;
        }

        @Override
        public Void visit(IfStatement stmt) {
            indent();
            writeIf(stmt);
            sb.append('\n');
            return null;
        }

        @Override
        public Void visit(WhileStatement stmt) {
            indent();
            sb.append("while (").append(print(stmt.getCondition())).append(") ");
            braced(stmt.getBody(), depth);
            sb.append('\n');
            return null;
        }

        @Override
        public Void visit(DoWhileStatement stmt) {
            indent();
            sb.append("do ");
            braced(stmt.getBody(), depth);
            sb.append(" while (").append(print(stmt.getCondition())).append(");\n");
            return null;
        }

        @Override
        public Void visit(BreakStatement stmt) {
            indent();
            sb.append("break;\n");
            return null;
        }

        @Override
        public Void visit(AssignStatement stmt) {
            indent();
            sb.append(stmt.getTarget()).append(" = ").append(print(stmt.getValue())).append(";\n");
            return null;
        }

        @Override
        public Void visit(ExpressionStatement stmt) {
            indent();
            sb.append(print(stmt.getExpression())).append(";\n");
            return null;
        }

        @Override
        public Void visit(ReturnStatement stmt) {
            indent();
            if (stmt.getValue() == null) {
                sb.append("return;\n");
            } else {
                sb.append("return ").append(print(stmt.getValue())).append(";\n");
            }
            return null;
        }
    }

    private static class ExpressionWriter implements ExpressionVisitor<String> {
        static final ExpressionWriter INSTANCE = new ExpressionWriter();

        private String operand(Expression expr, boolean parenthesize) {
            String text = expr.accept(this);
            return parenthesize ? "(" + text + ")" : text;
        }

        @Override
        public String visit(BoolLiteral expr) {
            return expr.getValue() ? "true" : "false";
        }

        @Override
        public String visit(IntLiteral expr) {
            return Long.toString(expr.getValue());
        }

        @Override
        public String visit(VarRef expr) {
            return expr.getName();
        }

        @Override
        public String visit(UnaryExpr expr) {
            Expression inner = expr.getOperand();
            boolean parens = inner.precedence() < Expression.PREC_UNARY || inner instanceof UnaryExpr
                    || (inner instanceof IntLiteral lit && lit.getValue() < 0);
            return expr.getOp().getSymbol() + operand(inner, parens);
        }

        @Override
        public String visit(BinaryExpr expr) {
            int prec = expr.precedence();
            String lhs = operand(expr.getLhs(), expr.getLhs().precedence() < prec);
            String rhs = operand(expr.getRhs(), expr.getRhs().precedence() <= prec);
            return lhs + " " + expr.getOp().getSymbol() + " " + rhs;
        }

        @Override
        public String visit(CallExpr expr) {
            StringBuilder sb = new StringBuilder(expr.getCallee()).append('(');
            for (int i = 0; i < expr.getArgs().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(expr.getArgs().get(i).accept(this));
            }
            return sb.append(')').toString();
        }
    }
}
