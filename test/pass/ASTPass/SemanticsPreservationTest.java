package pass.ASTPass;

import static org.junit.Assert.*;
import static pass.ASTPass.PassTestUtil.parse;

import ast.ASTPrinter;
import ast.Function;
import driver.Config;
import frontend.ListingLoader;
import frontend.ParsedListing;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import pass.PassManager;

/**
 * Runs every listing before and after the whole pipeline on a grid of inputs
 * and compares what the two executions observably do.
 */
public class SemanticsPreservationTest {
    private static final String[] LISTINGS = {
            "while (true) { if (x > 0) { break; } x = x + 1; a(x); }",
            "while (true) { y = y + 1; a(y); if (y > 3) { break; } }",
            "while (true) { if (x > 0) { a(); break; } else { b(); break; } }",
            "while (true) { if (x < 3) { x = x + 1; a(x); } else { b(); break; } }",
            "while (true) { if (x >= 3) { b(); break; } else { x = x + 1; } }",
            "while (true) { a(); x = x + 1; y = y + 1; if (x > 2) { b(x); if (y > 0) { break; } } }",
            "while (true) { x = x + 1; if (x > 5) { break; } a(x); if (x > 3) { break; } }",
            "while (true) { if (x < 2) { x = x + 1; } else { if (y > 0) { break; } y = y + 1; } }",
            "while (true) { if (x > 2) { break; } while (true) { y = y + 1; if (y > x) { break; } } x = x + 1; }",
            "while (true) { a(); break; b(); } c();",
            "while (true) { if (f() > 0) { break; } a(); }",
            "while (true) { s(); if (c) { a(); break; u(); } else { break; } v(); } t();",
            "while (true) { if (x > 1) { return x; } x = x + 1; a(); } b();",
            "while (true) { if (c) { break; } else { a(); } c = c + 1; }",
            "if (x > 0) { a(); } if (!(x > 0)) { b(); }",
            "if (x > 0) { a(); } if (x < 0) { b(); } if (x == 0) { c(); }",
            "if (p) { a(); } if (!p && q) { b(); } if (!p && !q) { c(); }",
            "if (p) { x = 1; } if (!p) { x = 2; } while (true) { if (x > 3) { break; } x = x + 1; }",
    };

    /** loops that leave from the middle of their body, or only by returning */
    private static final Set<String> UNSTRUCTURABLE = Set.of(
            "while (true) { if (x < 2) { x = x + 1; } else { if (y > 0) { break; } y = y + 1; } }",
            "while (true) { if (x > 1) { return x; } x = x + 1; a(); } b();"
    );

    @Before
    public void setUp() {
        System.setProperty("oracle", "propositional");
        Config.reload();
        PassManager.resetInstance();
    }

    @After
    public void tearDown() {
        System.clearProperty("oracle");
        Config.reload();
        PassManager.resetInstance();
    }

    private static List<Map<String, Long>> inputs() {
        List<Map<String, Long>> result = new ArrayList<>();
        for (long x = -1; x <= 3; x++) {
            for (long y = -1; y <= 3; y++) {
                for (long c = 0; c <= 1; c++) {
                    for (long p = 0; p <= 1; p++) {
                        for (long q = 0; q <= 1; q++) {
                            result.add(Map.of("x", x, "y", y, "c", c, "p", p, "q", q));
                        }
                    }
                }
            }
        }
        return result;
    }

    @Test
    public void testPipelinePreservesBehaviour() {
        List<Map<String, Long>> inputs = inputs();
        for (String text : LISTINGS) {
            ParsedListing original = parse(text);
            ParsedListing structured = parse(text);
            PassManager.getInstance().run(structured.ast(), structured.provenance());

            Function before = original.ast().getFunction(ListingLoader.SNIPPET_FUNCTION);
            Function after = structured.ast().getFunction(ListingLoader.SNIPPET_FUNCTION);
            for (Map<String, Long> input : inputs) {
                ASTInterpreter.Outcome expected = ASTInterpreter.execute(before, input);
                ASTInterpreter.Outcome actual = ASTInterpreter.execute(after, input);
                assertNotEquals("test listing must terminate: " + text, "diverged", expected.exit());
                assertEquals(text + "\n=>\n" + ASTPrinter.print(after) + "on " + input, expected, actual);
            }
        }
    }

    @Test
    public void testEveryLoopIdiomIsStructured() {
        for (String text : LISTINGS) {
            ParsedListing structured = parse(text);
            PassManager.getInstance().run(structured.ast(), structured.provenance());
            String printed = ASTPrinter.print(structured.ast());
            assertEquals(text + "\n=>\n" + printed, UNSTRUCTURABLE.contains(text), printed.contains("while (true)"));
        }
    }
}
