package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.TextElement;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects elements whose text contains a match for a regular expression.
 *
 * <p>Uses {@link Matcher#find()}, anchors in the expression decide whether the whole text has to
 * match. The captured value is the first group if it participated in the match, the whole match
 * otherwise.
 */
public class RegexMatchingStrategy implements MatchingStrategy {
  public static final String OPERATION_PREFIX = "find:";

  private final Pattern pattern;

  public RegexMatchingStrategy(Pattern pattern) {
    this.pattern = pattern;
  }

  /** @throws PatternException if {@code regex} is not a valid regular expression */
  public static RegexMatchingStrategy compile(String regex) {
    try {
      return new RegexMatchingStrategy(Pattern.compile(regex));
    } catch (PatternSyntaxException e) {
      throw new PatternException(regex, e);
    }
  }

  @Override
  public String getOperationId() {
    return OPERATION_PREFIX + pattern.pattern();
  }

  @Override
  public Optional<Match> evaluate(TextElement element) {
    Matcher m = pattern.matcher(element.getText());
    if (!m.find()) {
      return Optional.empty();
    }
    String value = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
    return Optional.of(new Match(element, getOperationId(), value));
  }
}
