package com.flamingo.ai.scopetree.exception;

/** Exception thrown when the text of a source file cannot be read from disk. */
public class SourceReadException extends ScopeTreeException {

  private final String filePath;

  public SourceReadException(String filePath, Throwable cause) {
    super(
        ApiError.SOURCE_READ_ERROR,
        "Failed to read source file: " + filePath,
        "Source file could not be read: " + filePath,
        cause);
    this.filePath = filePath;
  }

  public String getFilePath() {
    return filePath;
  }
}
