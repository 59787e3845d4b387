package com.flamingo.ai.scopetree.exception;

/** Base class for failures that abort a scope tree build. */
public class ScopeTreeException extends RuntimeException {

  private final String code;
  private final String userMessage;

  public ScopeTreeException(String code, String message, String userMessage) {
    super(message);
    this.code = code;
    this.userMessage = userMessage;
  }

  public ScopeTreeException(String code, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = userMessage;
  }

  /** Machine-readable error code, one of the {@link ApiError} constants. */
  public String getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
