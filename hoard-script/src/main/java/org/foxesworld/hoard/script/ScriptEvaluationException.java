package org.foxesworld.hoard.script;

/**
 * Guest code failed to parse or threw while running.
 */
public final class ScriptEvaluationException extends RuntimeException {

    private final String sourceName;

    public ScriptEvaluationException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
