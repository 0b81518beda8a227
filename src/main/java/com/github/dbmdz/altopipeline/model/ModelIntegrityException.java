package com.github.dbmdz.altopipeline.model;

/** Raised when the text element model would end up with duplicate or missing identifiers. */
public class ModelIntegrityException extends RuntimeException {
  public ModelIntegrityException(String message) {
    super(message);
  }
}
