package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.TextElement;
import java.util.Objects;
import java.util.Optional;

/** An element that entered a selection, along with what the selecting operation found in it. */
public class Match {
  private final TextElement element;
  private final String operationId;
  private final String value;
  private final String provisionalCategory;

  public Match(TextElement element, String operationId, String value, String provisionalCategory) {
    this.element = Objects.requireNonNull(element);
    this.operationId = Objects.requireNonNull(operationId);
    this.value = value;
    this.provisionalCategory = provisionalCategory;
  }

  public Match(TextElement element, String operationId, String value) {
    this(element, operationId, value, null);
  }

  public TextElement getElement() {
    return element;
  }

  public String getOperationId() {
    return operationId;
  }

  /** The captured text or looked up value, recorded under the category label on categorize. */
  public String getValue() {
    return value;
  }

  /**
   * Category suggested by the selecting operation, only committed by {@link
   * Selection#categorize()}.
   */
  public Optional<String> getProvisionalCategory() {
    return Optional.ofNullable(provisionalCategory);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("Match{");
    sb.append(operationId).append(" on '").append(element.getId()).append('\'');
    if (value != null) {
      sb.append(", value='").append(value).append('\'');
    }
    if (provisionalCategory != null) {
      sb.append(", provisionalCategory='").append(provisionalCategory).append('\'');
    }
    sb.append('}');
    return sb.toString();
  }
}
