package frontend;

import exception.StructureException;
import frontend.grammar.ListingLexer;
import frontend.grammar.ListingParser;

import java.io.IOException;
import java.nio.file.Path;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Reads listings into an unstructured AST. A listing is either a whole unit
 * ({@code void f() { ... }} functions) or a bare statement snippet, which is
 * wrapped into a function called {@code main}.
 */
public class ListingLoader {
    private static final Logger logger = LoggingManager.getLogger(ListingLoader.class);
    public static final String SNIPPET_FUNCTION = "main";

    private ListingLoader() {
    }

    public static ParsedListing loadFile(Path path) {
        try {
            CharStream input = CharStreams.fromPath(path);
            return loadUnit(input, path.getFileName().toString());
        } catch (IOException e) {
            throw new StructureException("failed to read listing " + path, e);
        }
    }

    public static ParsedListing loadUnit(String text, String unitName) {
        return loadUnit(CharStreams.fromString(text, unitName), unitName);
    }

    public static ParsedListing loadSnippet(String text, String unitName) {
        ListingParser parser = newParser(CharStreams.fromString(text, unitName), unitName);
        ListingParser.SnippetContext tree = parser.snippet();
        ASTGenerator gen = new ASTGenerator(unitName);
        gen.generateSnippet(tree, SNIPPET_FUNCTION);
        return new ParsedListing(gen.getContext(), gen.getProvenance());
    }

    private static ParsedListing loadUnit(CharStream input, String unitName) {
        ListingParser parser = newParser(input, unitName);
        ListingParser.UnitContext tree = parser.unit();
        ASTGenerator gen = new ASTGenerator(unitName);
        gen.visit(tree);
        logger.info("loaded {} with {} functions", unitName, gen.getContext().getFunctions().size());
        return new ParsedListing(gen.getContext(), gen.getProvenance());
    }

    private static ListingParser newParser(CharStream input, String unitName) {
        ThrowingErrorListener errors = new ThrowingErrorListener(unitName);
        ListingLexer lexer = new ListingLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        ListingParser parser = new ListingParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        return parser;
    }

    private static class ThrowingErrorListener extends BaseErrorListener {
        private final String unitName;

        ThrowingErrorListener(String unitName) {
            this.unitName = unitName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                int charPositionInLine, String msg, RecognitionException e) {
            throw StructureException.parseError(unitName + ":" + line + ":" + charPositionInLine + " " + msg);
        }
    }
}
