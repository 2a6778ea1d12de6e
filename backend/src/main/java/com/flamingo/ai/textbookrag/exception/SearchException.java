package com.flamingo.ai.textbookrag.exception;

/**
 * Thrown when one of the searches behind hybrid retrieval fails with a checked error. Unchecked
 * failures of the embedding provider or the indexes propagate as they are.
 */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Textbook search is temporarily unavailable. Please try again.";

  private final String stage;

  public SearchException(String stage, String message, Throwable cause) {
    super(stage + " failed: " + message, cause);
    this.stage = stage;
  }

  /** Which search failed, e.g. {@code "vector search"}. */
  public String getStage() {
    return stage;
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
