package com.flamingo.ai.scopetree.exception;

/** Exception thrown when a build request does not identify a usable source. */
public class UnsupportedSourceException extends ScopeTreeException {

  public UnsupportedSourceException(String message) {
    super(ApiError.UNSUPPORTED_SOURCE, message, message);
  }
}
