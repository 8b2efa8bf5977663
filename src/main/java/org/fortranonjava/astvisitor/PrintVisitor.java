package org.fortranonjava.astvisitor;

import org.fortranonjava.astnode.*;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void appendHeader(String kind, StatementNode node) {
        appendIndent();
        sb.append(kind);
        if (node.hasLabel()) {
            sb.append("  label:").append(node.label);
        }
    }

    private void appendSource(Node node) {
        if (node.getSource() != null) {
            sb.append("  pos:").append(node.getSource());
        }
        sb.append("\n");
    }

    private void child(String title, Node node) {
        if (node == null) {
            return;
        }
        appendIndent();
        sb.append(title).append(":\n");
        indentLevel++;
        node.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(ProgramNode node) {
        appendIndent();
        sb.append("ProgramNode:\n");
        indentLevel++;
        for (ProgramUnitNode unit : node.units) {
            unit.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(ProgramUnitNode node) {
        appendIndent();
        sb.append("ProgramUnitNode: ").append(node.kind).append(' ').append(node.name);
        if (!node.dummyArguments.isEmpty()) {
            sb.append('(').append(String.join(", ", node.dummyArguments)).append(')');
        }
        appendSource(node);
        indentLevel++;
        node.executionPart.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        appendIndent();
        sb.append("BlockNode:");
        appendSource(node);
        indentLevel++;
        for (Node element : node) {
            if (element == null) {
                appendIndent();
                sb.append("null\n");
            } else {
                element.accept(this);
            }
        }
        indentLevel--;
    }

    @Override
    public void visit(LabelDoStmtNode node) {
        appendHeader("LabelDoStmtNode: DO " + node.doLabel, node);
        if (node.constructName != null) {
            sb.append("  name:").append(node.constructName);
        }
        appendSource(node);
        indentLevel++;
        if (node.loopControl != null) {
            node.loopControl.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(NonLabelDoStmtNode node) {
        appendHeader("NonLabelDoStmtNode:", node);
        if (node.constructName != null) {
            sb.append("  name:").append(node.constructName);
        }
        appendSource(node);
        indentLevel++;
        if (node.loopControl != null) {
            node.loopControl.accept(this);
        }
        indentLevel--;
    }

    @Override
    public void visit(EndDoStmtNode node) {
        appendHeader("EndDoStmtNode:", node);
        if (node.constructName != null) {
            sb.append("  name:").append(node.constructName);
        }
        appendSource(node);
    }

    @Override
    public void visit(DoConstructNode node) {
        appendIndent();
        sb.append("DoConstructNode:");
        appendSource(node);
        indentLevel++;
        node.doStmt.accept(this);
        child("Body", node.body);
        node.endDo.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(IfConstructNode node) {
        appendIndent();
        sb.append("IfConstructNode:");
        if (node.constructName != null) {
            sb.append("  name:").append(node.constructName);
        }
        appendSource(node);
        indentLevel++;
        child("Condition", node.condition);
        child("Then", node.thenBlock);
        child("Else", node.elseBlock);
        indentLevel--;
    }

    @Override
    public void visit(IfStmtNode node) {
        appendHeader("IfStmtNode:", node);
        appendSource(node);
        indentLevel++;
        child("Condition", node.condition);
        child("Action", node.action);
        indentLevel--;
    }

    @Override
    public void visit(ContinueStmtNode node) {
        appendHeader("ContinueStmtNode:", node);
        appendSource(node);
    }

    @Override
    public void visit(AssignmentStmtNode node) {
        appendHeader("AssignmentStmtNode:", node);
        appendSource(node);
        indentLevel++;
        node.variable.accept(this);
        node.expr.accept(this);
        indentLevel--;
    }

    @Override
    public void visit(GotoStmtNode node) {
        appendHeader("GotoStmtNode: " + node.target, node);
        appendSource(node);
    }

    @Override
    public void visit(ExitStmtNode node) {
        appendHeader("ExitStmtNode:", node);
        if (node.constructName != null) {
            sb.append("  name:").append(node.constructName);
        }
        appendSource(node);
    }

    @Override
    public void visit(LoopControlNode node) {
        appendIndent();
        sb.append("LoopControlNode: ").append(node.kind);
        if (node.variable != null) {
            sb.append(' ').append(node.variable);
        }
        appendSource(node);
        indentLevel++;
        child("Lower", node.lower);
        child("Upper", node.upper);
        child("Step", node.step);
        child("Condition", node.condition);
        indentLevel--;
    }

    @Override
    public void visit(IdentifierNode node) {
        appendIndent();
        sb.append("IdentifierNode: ").append(node.name).append("\n");
    }

    @Override
    public void visit(NumberNode node) {
        appendIndent();
        sb.append("NumberNode: ").append(node.value).append("\n");
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        appendIndent();
        sb.append("BinaryOperatorNode: ").append(node.operator);
        appendSource(node);
        indentLevel++;
        if (node.left == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.left.accept(this);
        }
        if (node.right == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.right.accept(this);
        }
        indentLevel--;
    }
}
