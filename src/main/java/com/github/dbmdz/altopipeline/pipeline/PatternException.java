package com.github.dbmdz.altopipeline.pipeline;

import java.util.regex.PatternSyntaxException;

/** A regular expression handed to the pipeline could not be compiled. */
public class PatternException extends RuntimeException {
  private final String pattern;

  public PatternException(String pattern, PatternSyntaxException cause) {
    super(String.format("Invalid pattern '%s': %s", pattern, cause.getDescription()), cause);
    this.pattern = pattern;
  }

  public String getPattern() {
    return pattern;
  }
}
