package io.layoffs.error;

/**
 * Raised when a stage cannot produce its complete output. The dataset handed to the stage is left
 * untouched, so callers never observe a partially applied stage.
 */
public class StageFailedException extends RuntimeException {
    private final String stage;

    public StageFailedException(String stage, String message) {
        super("stage '" + stage + "' failed: " + message);
        this.stage = stage;
    }

    public StageFailedException(String stage, Throwable cause) {
        super("stage '" + stage + "' failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String stage() { return stage; }
}
