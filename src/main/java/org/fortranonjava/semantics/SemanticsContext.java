package org.fortranonjava.semantics;

import org.fortranonjava.CompilerOptions;
import org.fortranonjava.provenance.AllSources;
import org.fortranonjava.provenance.ProvenanceRange;
import org.fortranonjava.provenance.SourcePosition;

/**
 * State shared by the passes that run over one compiled unit: its options, its
 * provenance space, and the diagnostics reported so far.
 */
public class SemanticsContext {
    private final CompilerOptions compilerOptions;
    private final AllSources allSources;
    private final Messages messages = new Messages();

    public SemanticsContext(CompilerOptions compilerOptions, AllSources allSources) {
        this.compilerOptions = compilerOptions;
        this.allSources = allSources;
    }

    public CompilerOptions getCompilerOptions() {
        return compilerOptions;
    }

    public AllSources getAllSources() {
        return allSources;
    }

    public Messages getMessages() {
        return messages;
    }

    public Message say(ProvenanceRange at, Severity severity, String text) {
        Message message = messages.say(at, severity, text);
        logDebug("say: " + describe(message));
        return message;
    }

    public Message sayError(ProvenanceRange at, String text) {
        return say(at, Severity.ERROR, text);
    }

    public Message sayWarning(ProvenanceRange at, String text) {
        return say(at, Severity.WARNING, text);
    }

    /**
     * True if the unit has failed: an error was reported, or a warning while
     * warnings are treated as errors.
     */
    public boolean anyFatalError() {
        if (messages.anyFatalError()) {
            return true;
        }
        return compilerOptions.warningsAsErrors && messages.count(Severity.WARNING) > 0;
    }

    private String describe(Message message) {
        if (allSources != null && message.location() != null && allSources.isValid(message.location().start())) {
            SourcePosition pos = allSources.getSourcePosition(message.location().start());
            return pos + ": " + message.severity() + ": " + message.text();
        }
        return message.toString();
    }

    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }
}
