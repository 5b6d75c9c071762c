package com.shortspilot.orchestrator.stage;

/**
 * Classified failure reported by a stage executor.
 *
 * The scheduler only looks at the {@link Kind}: TRANSIENT failures are retried
 * on later invocations up to the retry ceiling, PERMANENT failures end the item.
 */
public class StageException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public StageException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public static StageException transientFailure(String message, Throwable cause) {
        return new StageException(Kind.TRANSIENT, message, cause);
    }

    public static StageException permanentFailure(String message) {
        return new StageException(Kind.PERMANENT, message);
    }

    public Kind getKind() { return kind; }

    public boolean isPermanent() { return kind == Kind.PERMANENT; }
}
