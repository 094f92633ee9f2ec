package frontend;

import ast.ASTContext;
import ast.Builder;
import ast.Function;
import ast.Origin;
import ast.Provenance;
import ast.expr.BinaryExpr;
import ast.expr.Expression;
import ast.expr.UnaryExpr;
import ast.stmt.BlockStatement;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import exception.StructureException;
import frontend.grammar.ListingBaseVisitor;
import frontend.grammar.ListingParser;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Builds the unstructured AST from a parsed listing. Every statement and every
 * expression gets the line it was read from as its origin.
 */
public class ASTGenerator extends ListingBaseVisitor<Object> {
    private static final Logger logger = LoggingManager.getLogger(ASTGenerator.class);
    private static final int MAX_ORIGIN_TEXT = 80;

    private final String unitName;
    private final ASTContext ctx;
    private final Provenance provenance;
    private final Builder builder;

    public ASTGenerator(String unitName) {
        this.unitName = unitName;
        this.ctx = new ASTContext(unitName);
        this.provenance = new Provenance();
        this.builder = new Builder(ctx, provenance);
    }

    public ASTContext getContext() {
        return ctx;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    /**
     * Wraps the statements of a snippet into a function named {@code name}.
     */
    public Function generateSnippet(ListingParser.SnippetContext snippet, String name) {
        List<Statement> stmts = new ArrayList<>();
        for (ListingParser.StatementContext sc : snippet.statement()) {
            stmts.add(statement(sc));
        }
        BlockStatement body = builder.createBlock(stmts);
        track(body, snippet);
        Function f = new Function(ctx, name, "void", body);
        ctx.addFunction(f);
        return f;
    }

    @Override
    public Object visitUnit(ListingParser.UnitContext unit) {
        for (ListingParser.FunctionContext fc : unit.function()) {
            visitFunction(fc);
        }
        return ctx;
    }

    @Override
    public Function visitFunction(ListingParser.FunctionContext fc) {
        BlockStatement body = (BlockStatement) visitBlock(fc.block());
        Function f = new Function(ctx, fc.fname.getText(), fc.retType.getText(), body);
        ctx.addFunction(f);
        logger.debug("generated function {} ({} slots so far)", f.getName(), ctx.size());
        return f;
    }

    @Override
    public Statement visitBlock(ListingParser.BlockContext bc) {
        List<Statement> stmts = new ArrayList<>();
        for (ListingParser.StatementContext sc : bc.statement()) {
            stmts.add(statement(sc));
        }
        return track(builder.createBlock(stmts), bc);
    }

    @Override
    public Statement visitBlockStmt(ListingParser.BlockStmtContext sc) {
        return visitBlock(sc.block());
    }

    @Override
    public Statement visitIfStmt(ListingParser.IfStmtContext sc) {
        Expression cond = expr(sc.expr());
        Statement then = branch(sc.then, false);
        Statement otherwise = null;
        if (sc.otherwise != null) {
            otherwise = branch(sc.otherwise, true);
        }
        return track(builder.createIf(cond, then, otherwise), sc);
    }

    @Override
    public Statement visitWhileStmt(ListingParser.WhileStmtContext sc) {
        Expression cond = expr(sc.expr());
        Statement body = branch(sc.statement(), false);
        return track(builder.createWhile(cond, body), sc);
    }

    @Override
    public Statement visitDoWhileStmt(ListingParser.DoWhileStmtContext sc) {
        Statement body = branch(sc.statement(), false);
        Expression cond = expr(sc.expr());
        return track(builder.createDoWhile(cond, body), sc);
    }

    @Override
    public Statement visitBreakStmt(ListingParser.BreakStmtContext sc) {
        return track(builder.createBreak(), sc);
    }

    @Override
    public Statement visitReturnStmt(ListingParser.ReturnStmtContext sc) {
        Expression value = sc.expr() == null ? null : expr(sc.expr());
        return track(builder.createReturn(value), sc);
    }

    @Override
    public Statement visitAssignStmt(ListingParser.AssignStmtContext sc) {
        return track(builder.createAssign(sc.ID().getText(), expr(sc.expr())), sc);
    }

    @Override
    public Statement visitExprStmt(ListingParser.ExprStmtContext sc) {
        return track(builder.createExpressionStatement(expr(sc.expr())), sc);
    }

    // --- expressions ---

    @Override
    public Expression visitParenExpr(ListingParser.ParenExprContext ec) {
        return expr(ec.expr());
    }

    @Override
    public Expression visitCallExpr(ListingParser.CallExprContext ec) {
        List<Expression> args = new ArrayList<>();
        for (ListingParser.ExprContext arg : ec.expr()) {
            args.add(expr(arg));
        }
        return track(builder.createCall(ec.ID().getText(), args), ec);
    }

    @Override
    public Expression visitUnaryExpr(ListingParser.UnaryExprContext ec) {
        UnaryExpr.Op op = ec.op.getText().equals("!") ? UnaryExpr.Op.NOT : UnaryExpr.Op.NEG;
        return track(builder.createUnary(op, expr(ec.expr())), ec);
    }

    @Override
    public Expression visitBinaryExpr(ListingParser.BinaryExprContext ec) {
        BinaryExpr.Op op = BinaryExpr.Op.fromSymbol(ec.op.getText());
        return track(builder.createBinary(op, expr(ec.expr(0)), expr(ec.expr(1))), ec);
    }

    @Override
    public Expression visitBoolLit(ListingParser.BoolLitContext ec) {
        return track(builder.createBool(ec.value.getText().equals("true")), ec);
    }

    @Override
    public Expression visitIntLit(ListingParser.IntLitContext ec) {
        String text = ec.INT().getText();
        try {
            return track(builder.createInt(Long.parseLong(text)), ec);
        } catch (NumberFormatException e) {
            throw StructureException.parseError(unitName + ":" + ec.getStart().getLine() + ":"
                    + ec.getStart().getCharPositionInLine() + " integer literal out of range " + text);
        }
    }

    @Override
    public Expression visitVarRef(ListingParser.VarRefContext ec) {
        return track(builder.createVar(ec.ID().getText()), ec);
    }

    // --- helpers ---

    private Statement statement(ListingParser.StatementContext sc) {
        return (Statement) visit(sc);
    }

    private Expression expr(ListingParser.ExprContext ec) {
        return (Expression) visit(ec);
    }

    /**
     * Branches and loop bodies are always blocks, except an else branch that
     * is itself an if (else-if chain).
     */
    private Statement branch(ListingParser.StatementContext sc, boolean elseBranch) {
        Statement stmt = statement(sc);
        if (stmt instanceof BlockStatement || (elseBranch && stmt instanceof IfStatement)) {
            return stmt;
        }
        return track(builder.createBlock(stmt), sc);
    }

    private <T extends Statement> T track(T stmt, ParserRuleContext rc) {
        provenance.addStatement(stmt, originOf(rc));
        return stmt;
    }

    private <T extends Expression> T track(T expr, ParserRuleContext rc) {
        provenance.addUse(expr, originOf(rc));
        return expr;
    }

    private Origin originOf(ParserRuleContext rc) {
        Token start = rc.getStart();
        Token stop = rc.getStop();
        String text;
        if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
            text = "";
        } else {
            text = start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
        }
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline);
        }
        text = text.strip();
        if (text.length() > MAX_ORIGIN_TEXT) {
            text = text.substring(0, MAX_ORIGIN_TEXT);
        }
        return new Origin(unitName, start.getLine(), text);
    }
}
