package pass.ASTPass;

import ast.Provenance;
import ast.expr.Expression;
import ast.stmt.BlockStatement;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import driver.Config;
import pass.ASTPass.analysis.WriteAnalysis;
import pass.ASTPass.rewrite.TransformPass;
import pass.ASTPassType;
import solver.Obligations;
import solver.Oracle;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges runs of adjacent else-less ifs into one if/else-if/else chain when
 * the oracle proves the guards form an exhaustive decision chain.
 * <p>
 * A run {@code if (g1) T1 ... if (gn) Tn} is accepted when every member after
 * the first satisfies {@code gk -> !g1 && ... && !g(k-1)} and the last one
 * satisfies {@code gn <-> !g1 && ... && !g(n-1)}. Then at most one guard
 * holds, exactly one holds, and the last branch becomes the plain else.
 * Guards are assumed free of side effects; a member is refused when an earlier
 * branch of the run may change what its guard reads.
 */
public class CondBasedRefinePass extends TransformPass implements AutoCloseable {
    private final Oracle oracle;

    public CondBasedRefinePass() {
        this(Config.getInstance().oracle.create());
    }

    public CondBasedRefinePass(Oracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public ASTPassType getType() {
        return ASTPassType.CondBasedRefine;
    }

    @Override
    protected void visit(Statement stmt) {
        if (!(stmt instanceof BlockStatement block) || block.size() < 2) {
            return;
        }
        List<Statement> stmts = block.getStatements();
        List<Statement> result = new ArrayList<>(stmts.size());
        boolean changed = false;
        int i = 0;
        while (i < stmts.size()) {
            int end = isCandidate(stmts.get(i)) ? findChainEnd(stmts, i) : -1;
            if (end > i) {
                result.add(buildChain(stmts.subList(i, end + 1)));
                log.debug("merged {} ifs guarded by {}", end - i + 1,
                        ((IfStatement) stmts.get(i)).getCondition());
                changed = true;
                i = end + 1;
            } else {
                result.add(stmts.get(i));
                i++;
            }
        }
        if (changed) {
            substitute(block, builder.createBlock(result));
        }
    }

    private static boolean isCandidate(Statement stmt) {
        return stmt instanceof IfStatement ifStmt && !ifStmt.hasElse();
    }

    /**
     * @return index of the member that closes the chain starting at
     *         {@code start}, or -1 if no provable chain starts there
     */
    private int findChainEnd(List<Statement> stmts, int start) {
        List<Expression> guards = new ArrayList<>();
        List<Statement> branches = new ArrayList<>();
        IfStatement first = (IfStatement) stmts.get(start);
        guards.add(first.getCondition());
        branches.add(first.getThen());

        for (int k = start + 1; k < stmts.size(); k++) {
            if (!isCandidate(stmts.get(k))) {
                return -1;
            }
            IfStatement member = (IfStatement) stmts.get(k);
            Expression guard = member.getCondition();
            for (Statement branch : branches) {
                if (WriteAnalysis.mayAffect(branch, guard)) {
                    return -1;
                }
            }
            Expression noneBefore = Obligations.noneOf(guards);
            if (oracle.prove(Obligations.iff(guard, noneBefore))) {
                return k;
            }
            if (!oracle.prove(Obligations.implies(guard, noneBefore))) {
                return -1;
            }
            guards.add(guard);
            branches.add(member.getThen());
        }
        return -1;
    }

    /**
     * if (g1) T1 else if (g2) T2 ... else Tn, each new if carrying the
     * origins of the member it stands for.
     */
    private Statement buildChain(List<Statement> members) {
        Provenance provenance = builder.getProvenance();
        IfStatement last = (IfStatement) members.get(members.size() - 1);
        Statement tail = last.getThen();
        for (int j = members.size() - 2; j >= 0; j--) {
            IfStatement member = (IfStatement) members.get(j);
            IfStatement merged = builder.createIf(member.getCondition(), member.getThen(), tail);
            provenance.copyStatement(member, merged);
            if (j == members.size() - 2) {
                provenance.copyStatement(last, merged);
            }
            tail = merged;
        }
        return tail;
    }

    @Override
    public void close() {
        oracle.close();
    }
}
