package com.github.dbmdz.altopipeline.provider;

/** Failure of a dictionary or NER provider while handling a single text. */
public class ProviderException extends RuntimeException {
  public ProviderException(String message) {
    super(message);
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
