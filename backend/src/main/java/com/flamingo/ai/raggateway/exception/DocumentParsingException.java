package com.flamingo.ai.raggateway.exception;

/** Exception thrown when a local document parser cannot read a file. */
public class DocumentParsingException extends RuntimeException {

  private final String mimeType;

  public DocumentParsingException(String mimeType, String message) {
    super(message);
    this.mimeType = mimeType;
  }

  public DocumentParsingException(String mimeType, String message, Throwable cause) {
    super(message, cause);
    this.mimeType = mimeType;
  }

  public String getMimeType() {
    return mimeType;
  }
}
