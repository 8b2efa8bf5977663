package org.fortranonjava.semantics;

import org.fortranonjava.astnode.DoConstructNode;
import org.fortranonjava.astnode.ExitStmtNode;
import org.fortranonjava.astnode.IfConstructNode;
import org.fortranonjava.astnode.Node;
import org.fortranonjava.astvisitor.ParseTreeMutator;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports EXIT statements that leave a DO CONCURRENT construct.
 * <p>
 * An EXIT without a construct name leaves the innermost DO construct; with a
 * name it leaves the enclosing construct of that name, which may be an IF
 * construct. One error is reported for every DO CONCURRENT construct the EXIT
 * would leave, the target included. An EXIT that belongs to no enclosing
 * construct is left alone here.
 */
public class DoConcurrentExitChecker implements ParseTreeMutator {
    static final String LEAVES_DO_CONCURRENT = "EXIT must not leave a DO CONCURRENT statement";

    private final SemanticsContext ctx;

    // Enclosing constructs, outermost first
    private final List<Node> constructs = new ArrayList<>();

    public DoConcurrentExitChecker(SemanticsContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public boolean pre(DoConstructNode node) {
        constructs.add(node);
        return true;
    }

    @Override
    public void post(DoConstructNode node) {
        constructs.remove(constructs.size() - 1);
    }

    @Override
    public boolean pre(IfConstructNode node) {
        constructs.add(node);
        return true;
    }

    @Override
    public void post(IfConstructNode node) {
        constructs.remove(constructs.size() - 1);
    }

    @Override
    public void post(ExitStmtNode exit) {
        int target = findTarget(exit.constructName);
        if (target < 0) {
            return;
        }
        for (int i = constructs.size() - 1; i >= target; i--) {
            if (constructs.get(i) instanceof DoConstructNode doConstruct && doConstruct.isDoConcurrent()) {
                ctx.sayError(exit.source, LEAVES_DO_CONCURRENT);
            }
        }
    }

    private int findTarget(String name) {
        for (int i = constructs.size() - 1; i >= 0; i--) {
            Node construct = constructs.get(i);
            if (name == null) {
                if (construct instanceof DoConstructNode) {
                    return i;
                }
            } else if (name.equalsIgnoreCase(constructName(construct))) {
                return i;
            }
        }
        return -1;
    }

    private static String constructName(Node construct) {
        if (construct instanceof DoConstructNode doConstruct) {
            return doConstruct.getName();
        }
        return ((IfConstructNode) construct).constructName;
    }
}
