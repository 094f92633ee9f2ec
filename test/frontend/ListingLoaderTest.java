package frontend;

import static org.junit.Assert.*;

import ast.ASTPrinter;
import ast.Function;
import ast.Origin;
import ast.expr.Expression;
import ast.stmt.BlockStatement;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;
import exception.StructureException;
import org.junit.Test;

public class ListingLoaderTest {
    private static final String UNIT = String.join("\n",
            "int f() {",
            "    while (true) {",
            "        if (x > 0) {",
            "            break;",
            "        }",
            "        y = y + 1;",
            "    }",
            "    return y;",
            "}",
            "void g() {",
            "    if (a) {",
            "        b();",
            "    } else if (c) {",
            "        d(1, x * (y + 2));",
            "    } else {",
            "        do {",
            "            e();",
            "        } while (!(x > 0) && y != 3);",
            "    }",
            "}",
            "");

    @Test
    public void testUnitRoundTrip() {
        ParsedListing listing = ListingLoader.loadUnit(UNIT, "unit.lst");
        assertEquals(2, listing.ast().getFunctions().size());
        assertEquals("int", listing.ast().getFunction("f").getReturnType());
        assertEquals(UNIT, ASTPrinter.print(listing.ast()));
    }

    @Test
    public void testOriginsCarryLines() {
        ParsedListing listing = ListingLoader.loadUnit(UNIT, "unit.lst");
        Function f = listing.ast().getFunction("f");
        WhileStatement loop = (WhileStatement) ((BlockStatement) f.getBody()).first();
        IfStatement guard = (IfStatement) ((BlockStatement) loop.getBody()).first();

        Origin loopOrigin = listing.provenance().getStatementOrigins(loop).iterator().next();
        assertEquals(2, loopOrigin.line());
        assertEquals("unit.lst", loopOrigin.unit());
        assertEquals("while (true) {", loopOrigin.text());

        Expression cond = guard.getCondition();
        Origin condOrigin = listing.provenance().getUseOrigins(cond).iterator().next();
        assertEquals(3, condOrigin.line());
        assertEquals("x > 0", condOrigin.text());
    }

    @Test
    public void testBranchesAreBlocks() {
        ParsedListing listing = ListingLoader.loadSnippet("while (c) a(); if (x) b(); else c();", "s.lst");
        BlockStatement body = (BlockStatement) listing.ast().getFunction(ListingLoader.SNIPPET_FUNCTION).getBody();
        WhileStatement loop = (WhileStatement) body.get(0);
        IfStatement ifStmt = (IfStatement) body.get(1);
        assertTrue(loop.getBody() instanceof BlockStatement);
        assertTrue(ifStmt.getThen() instanceof BlockStatement);
        assertTrue(ifStmt.getElse() instanceof BlockStatement);
        for (Statement stmt : body.getStatements()) {
            assertTrue(listing.provenance().hasStatement(stmt));
        }
        assertTrue(listing.provenance().hasStatement(loop.getBody()));
    }

    @Test
    public void testSnippetIsWrappedIntoMain() {
        ParsedListing listing = ListingLoader.loadSnippet("a(); // trailing comment\n/* block */ b();", "s.lst");
        String expected = String.join("\n",
                "void main() {",
                "    a();",
                "    b();",
                "}",
                "");
        assertEquals(expected, ASTPrinter.print(listing.ast()));
    }

    @Test
    public void testInfiniteLoopIdiom() {
        ParsedListing listing = ListingLoader.loadSnippet("while (true) { } while (1) { } while (x) { }", "s.lst");
        BlockStatement body = (BlockStatement) listing.ast().getFunction("main").getBody();
        assertTrue(((WhileStatement) body.get(0)).isInfinite());
        assertTrue(((WhileStatement) body.get(1)).isInfinite());
        assertFalse(((WhileStatement) body.get(2)).isInfinite());
    }

    @Test(expected = StructureException.class)
    public void testSyntaxError() {
        ListingLoader.loadSnippet("while (true) { break }", "bad.lst");
    }

    @Test(expected = StructureException.class)
    public void testLexerError() {
        ListingLoader.loadSnippet("x = 1 @ 2;", "bad.lst");
    }

    @Test
    public void testOversizedLiteral() {
        try {
            ListingLoader.loadSnippet("if (x > 99999999999999999999) { a(); }", "big.lst");
            fail("literal beyond 64 bits accepted");
        } catch (StructureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("big.lst:1:"));
            assertTrue(e.getMessage(), e.getMessage().contains("99999999999999999999"));
        }
    }
}
