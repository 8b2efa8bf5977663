package org.fortranonjava.semantics;

import org.fortranonjava.provenance.ProvenanceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sink of diagnostics. Messages are kept in the order they were
 * reported, which is traversal order for each checker.
 */
public class Messages {
    private final List<Message> messages = new ArrayList<>();

    public Message say(ProvenanceRange at, Severity severity, String text) {
        Message message = new Message(severity, at, text);
        messages.add(message);
        return message;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public boolean anyFatalError() {
        for (Message message : messages) {
            if (message.severity().isFatal()) {
                return true;
            }
        }
        return false;
    }

    public long count(Severity severity) {
        return messages.stream().filter(m -> m.severity() == severity).count();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Message message : messages) {
            sb.append(message).append('\n');
        }
        return sb.toString();
    }
}
