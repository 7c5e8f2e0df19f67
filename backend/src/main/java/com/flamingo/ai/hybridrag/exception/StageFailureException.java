package com.flamingo.ai.hybridrag.exception;

/**
 * Exception raised when an external pipeline stage (search, embedding, LLM call) fails or times
 * out. Always handled by the component that owns the stage and turned into its fallback.
 */
public class StageFailureException extends RuntimeException {

  private final String stage;
  private final boolean timedOut;

  public StageFailureException(String stage, String message, Throwable cause) {
    this(stage, message, cause, false);
  }

  public StageFailureException(String stage, String message, Throwable cause, boolean timedOut) {
    super("Stage '" + stage + "' failed: " + message, cause);
    this.stage = stage;
    this.timedOut = timedOut;
  }

  public String getStage() {
    return stage;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
