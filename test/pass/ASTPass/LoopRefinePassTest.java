package pass.ASTPass;

import static org.junit.Assert.*;
import static pass.ASTPass.PassTestUtil.lines;
import static pass.ASTPass.PassTestUtil.parse;
import static pass.ASTPass.PassTestUtil.print;
import static pass.ASTPass.PassTestUtil.runToFixpoint;

import ast.Origin;
import ast.expr.Expression;
import ast.expr.UnaryExpr;
import ast.stmt.BlockStatement;
import ast.stmt.IfStatement;
import ast.stmt.WhileStatement;
import frontend.ListingLoader;
import frontend.ParsedListing;
import java.util.Set;
import org.junit.Test;

public class LoopRefinePassTest {
    private final LoopRefinePass pass = new LoopRefinePass();

    private String runOnce(ParsedListing listing) {
        assertTrue("expected a rewrite", pass.run(listing.ast(), listing.provenance()));
        return print(listing);
    }

    private String structure(String snippet) {
        ParsedListing listing = parse(snippet);
        runToFixpoint(listing, new LoopRefinePass(), new NestedScopeCombinePass());
        return print(listing);
    }

    @Test
    public void testGuardThenBreakBecomesWhile() {
        ParsedListing listing = parse("while (true) { if (x > 0) { break; } y = y + 1; }");
        assertEquals(lines(
                "void main() {",
                "    while (!(x > 0)) {",
                "        y = y + 1;",
                "    }",
                "}"), runOnce(listing));
        assertFalse(pass.run(listing.ast(), listing.provenance()));
    }

    @Test
    public void testWhileSplicesElseBranch() {
        assertEquals(lines(
                "void main() {",
                "    while (!c) {",
                "        a();",
                "        b();",
                "    }",
                "}"), runOnce(parse("while (true) { if (c) { break; } else { a(); } b(); }")));
    }

    @Test
    public void testBodyThenGuardBecomesDoWhile() {
        assertEquals(lines(
                "void main() {",
                "    do {",
                "        y = y + 1;",
                "    } while (!(x > 0));",
                "}"), structure("while (true) { y = y + 1; if (x > 0) { break; } }"));
    }

    @Test
    public void testDoWhileKeepsEarlierBreaks() {
        assertEquals(lines(
                "void main() {",
                "    do {",
                "        a();",
                "        if (c) {",
                "            b();",
                "            break;",
                "        }",
                "    } while (!d);",
                "}"), runOnce(parse("while (true) { a(); if (c) { b(); break; } if (d) { break; } }")));
    }

    @Test
    public void testCondToSeq() {
        ParsedListing listing = parse("while (true) { if (c) { a(); } else { b(); break; } }");
        assertEquals(lines(
                "void main() {",
                "    while (true) {",
                "        while (c) {",
                "            a();",
                "        }",
                "        b();",
                "        break;",
                "    }",
                "}"), runOnce(listing));

        runToFixpoint(listing, pass, new NestedScopeCombinePass());
        assertEquals(lines(
                "void main() {",
                "    while (c) {",
                "        a();",
                "    }",
                "    b();",
                "}"), print(listing));
    }

    @Test
    public void testCondToSeqNeg() {
        ParsedListing listing = parse("while (true) { if (c) { a(); break; } else { b(); } }");
        assertEquals(lines(
                "void main() {",
                "    while (true) {",
                "        while (!c) {",
                "            b();",
                "        }",
                "        a();",
                "        break;",
                "    }",
                "}"), runOnce(listing));
    }

    @Test
    public void testNestedDoWhile() {
        ParsedListing listing = parse("while (true) { a(); if (c) { b(); if (d) { break; } } }");
        assertEquals(lines(
                "void main() {",
                "    while (true) {",
                "        do {",
                "            a();",
                "        } while (!c);",
                "        b();",
                "        if (d) {",
                "            break;",
                "        }",
                "    }",
                "}"), runOnce(listing));

        runToFixpoint(listing, pass, new NestedScopeCombinePass());
        assertEquals(lines(
                "void main() {",
                "    do {",
                "        do {",
                "            a();",
                "        } while (!c);",
                "        b();",
                "    } while (!d);",
                "}"), print(listing));
    }

    @Test
    public void testLoopToSeqWithBareBreak() {
        assertEquals(lines(
                "void main() {",
                "    a();",
                "}"), structure("while (true) { a(); break; b(); }"));
    }

    @Test
    public void testLoopToSeqWithBreakingBranches() {
        assertEquals(lines(
                "void main() {",
                "    if (x > 0) {",
                "        a();",
                "    } else {",
                "        b();",
                "    }",
                "}"), structure("while (true) { if (x > 0) { a(); break; } else { b(); break; } }"));
    }

    @Test
    public void testLoopToSeqDropsUnreachableTail() {
        assertEquals(lines(
                "void main() {",
                "    s();",
                "    if (c) {",
                "        a();",
                "    } else {",
                "    }",
                "    t();",
                "}"), structure("while (true) { s(); if (c) { a(); break; u(); } else { break; } v(); } t();"));
    }

    @Test
    public void testWhileWinsOverDoWhile() {
        assertEquals(lines(
                "void main() {",
                "    while (!c) {",
                "        a();",
                "        if (d) {",
                "            break;",
                "        }",
                "    }",
                "}"), runOnce(parse("while (true) { if (c) { break; } a(); if (d) { break; } }")));
    }

    @Test
    public void testOnlyInfiniteLoopsAreRewritten() {
        ParsedListing listing = parse("while (x) { if (c) { break; } a(); } do { a(); } while (true);");
        String before = print(listing);
        assertFalse(pass.run(listing.ast(), listing.provenance()));
        assertEquals(before, print(listing));
    }

    @Test
    public void testTrailingIfElseIsNotFolded() {
        // the else-branch must run after the test, not before it
        ParsedListing listing = parse("while (true) { a(); if (c) { break; } else { b(); } }");
        String before = print(listing);
        assertFalse(pass.run(listing.ast(), listing.provenance()));
        assertEquals(before, print(listing));
    }

    @Test
    public void testBreakOfInnerLoopDoesNotCount() {
        ParsedListing listing = parse("while (true) { while (c) { break; } a(); }");
        assertFalse(pass.run(listing.ast(), listing.provenance()));
    }

    @Test
    public void testConditionalBreakBeforeTerminatorBlocksLoopToSeq() {
        ParsedListing listing = parse("while (true) { a(); if (c) { b(); break; } d(); break; }");
        assertFalse(pass.run(listing.ast(), listing.provenance()));
    }

    @Test
    public void testInnerLoopsAreStructuredFirst() {
        assertEquals(lines(
                "void main() {",
                "    while (!(x > 2)) {",
                "        do {",
                "            y = y + 1;",
                "        } while (!(y > x));",
                "        x = x + 1;",
                "    }",
                "}"), structure("while (true) { if (x > 2) { break; } "
                + "while (true) { y = y + 1; if (y > x) { break; } } x = x + 1; }"));
    }

    @Test
    public void testNegatedGuardKeepsOrigins() {
        ParsedListing listing = parse("while (true) {\n if (x > 0) { break; }\n y = y + 1;\n}");
        BlockStatement body = (BlockStatement) listing.ast().getFunction(ListingLoader.SNIPPET_FUNCTION).getBody();
        WhileStatement loop = (WhileStatement) body.first();
        Expression guard = ((IfStatement) ((BlockStatement) loop.getBody()).first()).getCondition();
        Set<Origin> guardOrigins = listing.provenance().getUseOrigins(guard);
        Set<Origin> loopOrigins = listing.provenance().getStatementOrigins(loop);
        assertFalse(guardOrigins.isEmpty());

        pass.run(listing.ast(), listing.provenance());

        WhileStatement rewritten = (WhileStatement) body.first();
        assertNotSame(loop, rewritten);
        UnaryExpr cond = (UnaryExpr) rewritten.getCondition();
        assertSame(guard, cond.getOperand());
        assertEquals(guardOrigins, listing.provenance().getUseOrigins(cond));
        assertEquals(loopOrigins, listing.provenance().getStatementOrigins(rewritten));
        assertEquals(2, guardOrigins.iterator().next().line());
    }
}
