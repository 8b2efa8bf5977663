package org.fortranonjava.astnode;

/**
 * Base class of action statements: simple statements that can appear as the
 * body of a single-statement IF and can terminate a label DO loop.
 */
public abstract class ActionStmtNode extends StatementNode {
    protected ActionStmtNode(int label) {
        super(label);
    }
}
