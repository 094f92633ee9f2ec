package ast;

import static org.junit.Assert.*;

import ast.expr.BinaryExpr;
import ast.expr.Expression;
import ast.expr.UnaryExpr;
import org.junit.Test;

public class ASTPrinterTest {
    private final Builder builder = new Builder(new ASTContext("unit"), new Provenance());

    @Test
    public void testNegationOfComparisonIsParenthesized() {
        Expression gt = builder.createBinary(BinaryExpr.Op.GT, builder.createVar("x"), builder.createInt(0));
        assertEquals("!(x > 0)", ASTPrinter.print(builder.createNot(gt)));
        assertEquals("!x", ASTPrinter.print(builder.createNot(builder.createVar("x"))));
        assertEquals("!(!x)", ASTPrinter.print(builder.createNot(builder.createNot(builder.createVar("x")))));
    }

    @Test
    public void testBinaryPrecedence() {
        Expression sum = builder.createBinary(BinaryExpr.Op.ADD, builder.createVar("a"), builder.createVar("b"));
        Expression product = builder.createBinary(BinaryExpr.Op.MUL, sum, builder.createVar("c"));
        assertEquals("(a + b) * c", ASTPrinter.print(product));

        Expression diff = builder.createBinary(BinaryExpr.Op.SUB, builder.createVar("a"),
                builder.createBinary(BinaryExpr.Op.SUB, builder.createVar("b"), builder.createVar("c")));
        assertEquals("a - (b - c)", ASTPrinter.print(diff));

        Expression neg = builder.createUnary(UnaryExpr.Op.NEG, builder.createInt(-1));
        assertEquals("-(-1)", ASTPrinter.print(neg));
    }

    @Test
    public void testElseIfChain() {
        var inner = builder.createIf(builder.createVar("b"),
                builder.createBlock(builder.createBreak()), builder.createBlock());
        var outer = builder.createIf(builder.createVar("a"), builder.createBlock(), inner);
        String expected = String.join("\n",
                "if (a) {",
                "} else if (b) {",
                "    break;",
                "} else {",
                "}",
                "");
        assertEquals(expected, ASTPrinter.print(outer));
    }
}
