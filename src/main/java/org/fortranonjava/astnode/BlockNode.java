package org.fortranonjava.astnode;

import org.fortranonjava.astvisitor.Visitor;
import org.fortranonjava.provenance.ProvenanceRange;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The BlockNode class represents an ordered sequence of statements and
 * constructs at one nesting level.
 * <p>
 * Elements live in an intrusive doubly linked list of {@link Element} cells, so
 * a contiguous run can be moved into another block by relinking its ends,
 * without copying it and without disturbing the cells around it. An
 * {@link Element} stays valid, and keeps its position, until it is itself
 * removed or moved. {@link #end()} is a sentinel that follows the last element.
 */
public class BlockNode extends AbstractNode implements Iterable<Node> {

    /**
     * One position in a block. The node it holds may be replaced in place.
     */
    public static final class Element {
        private Node node;
        private Element prev;
        private Element next;

        private Element(Node node) {
            this.node = node;
        }

        public Node getNode() {
            return node;
        }

        public void setNode(Node node) {
            this.node = node;
        }

        public Element getNext() {
            return next;
        }

        public Element getPrevious() {
            return prev;
        }
    }

    private final Element head = new Element(null);

    public BlockNode(ProvenanceRange source) {
        head.next = head;
        head.prev = head;
        this.source = source;
    }

    public BlockNode(List<? extends Node> elements, ProvenanceRange source) {
        this(source);
        for (Node node : elements) {
            add(node);
        }
    }

    public Element begin() {
        return head.next;
    }

    public Element end() {
        return head;
    }

    public boolean isEmpty() {
        return head.next == head;
    }

    /**
     * Counts the elements; linear in the size of the block.
     */
    public int size() {
        int count = 0;
        for (Element e = head.next; e != head; e = e.next) {
            count++;
        }
        return count;
    }

    public Element add(Node node) {
        return insertBefore(head, node);
    }

    public Element insertBefore(Element position, Node node) {
        Element element = new Element(node);
        element.prev = position.prev;
        element.next = position;
        position.prev.next = element;
        position.prev = element;
        return element;
    }

    public Node remove(Element element) {
        if (element == head) {
            throw new NoSuchElementException("cannot remove the end of a block");
        }
        element.prev.next = element.next;
        element.next.prev = element.prev;
        element.prev = null;
        element.next = null;
        return element.node;
    }

    /**
     * Moves the elements {@code [first, last)} of this block into a new block,
     * in constant time. {@code last} may be {@link #end()}.
     *
     * @return the new block, whose source covers the moved elements
     */
    public BlockNode extract(Element first, Element last) {
        BlockNode result = new BlockNode(null);
        if (first == last) {
            return result;
        }
        Element lastIncluded = last.prev;
        result.source = coverSources(first.node, lastIncluded.node);
        unlink(first, lastIncluded);
        result.link(result.head, first, lastIncluded);
        return result;
    }

    /**
     * Moves the elements {@code [first, last)} of {@code from} into this block
     * before {@code position}, in constant time.
     */
    public void splice(Element position, BlockNode from, Element first, Element last) {
        if (first == last) {
            return;
        }
        Element lastIncluded = last.prev;
        from.unlink(first, lastIncluded);
        link(position, first, lastIncluded);
    }

    private void unlink(Element first, Element lastIncluded) {
        Element before = first.prev;
        Element after = lastIncluded.next;
        before.next = after;
        after.prev = before;
    }

    private void link(Element position, Element first, Element lastIncluded) {
        Element before = position.prev;
        before.next = first;
        first.prev = before;
        lastIncluded.next = position;
        position.prev = lastIncluded;
    }

    private static ProvenanceRange coverSources(Node first, Node last) {
        ProvenanceRange a = first == null ? null : first.getSource();
        ProvenanceRange b = last == null ? null : last.getSource();
        if (a == null) {
            return b;
        }
        return b == null ? a : a.cover(b);
    }

    /**
     * Returns a snapshot of the nodes in order.
     */
    public List<Node> getElements() {
        List<Node> nodes = new ArrayList<>();
        for (Element e = head.next; e != head; e = e.next) {
            nodes.add(e.node);
        }
        return nodes;
    }

    @Override
    public Iterator<Node> iterator() {
        return new Iterator<>() {
            private Element at = head.next;

            @Override
            public boolean hasNext() {
                return at != head;
            }

            @Override
            public Node next() {
                if (at == head) {
                    throw new NoSuchElementException();
                }
                Node node = at.node;
                at = at.next;
                return node;
            }
        };
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     * This method is part of the Visitor design pattern, which allows
     * for defining new operations on the parse tree nodes without changing
     * the node classes.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
