package org.fortranonjava.astvisitor;

import org.fortranonjava.astnode.GotoStmtNode;
import org.fortranonjava.astnode.LabelDoStmtNode;
import org.fortranonjava.astnode.Node;

import java.util.Set;
import java.util.TreeSet;

/**
 * Collects every statement label that some statement in a subtree refers to.
 *
 * <p>Label references are back-references from a statement to the labeled
 * statement it names; they are not structural edges, so a label can only be
 * dropped from its statement once nothing refers to it any more.
 */
public class LabelReferenceCollector implements ParseTreeMutator {
    private final Set<Integer> referencedLabels = new TreeSet<>();

    public static Set<Integer> collect(Node root) {
        LabelReferenceCollector collector = new LabelReferenceCollector();
        ParseTreeWalker.walk(root, collector);
        return collector.referencedLabels;
    }

    public Set<Integer> getReferencedLabels() {
        return referencedLabels;
    }

    @Override
    public void post(GotoStmtNode node) {
        referencedLabels.add(node.target);
    }

    @Override
    public void post(LabelDoStmtNode node) {
        referencedLabels.add(node.doLabel);
    }
}
