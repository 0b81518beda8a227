package com.github.dbmdz.altopipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single addressable unit of extracted text, i.e. an ALTO block, line or word.
 *
 * <p>Identity, text and position are fixed at parse time. The pipeline state ({@link
 * #getCategory()}, {@link #getMatchedBy()}, {@link #getResults()} and {@link #isRemoved()}) is
 * mutated in place by the pipeline operations. Not thread-safe.
 */
public class TextElement {
  private final String id;
  private final String text;
  private final ElementType type;
  private final ElementPosition position;
  private final ParsedFile sourceFile;

  private String category;
  private final List<String> matchedBy = new ArrayList<>();
  private final Map<String, String> results = new LinkedHashMap<>();
  private boolean removed = false;

  TextElement(
      String id, String text, ElementType type, ElementPosition position, ParsedFile sourceFile) {
    this.id = Objects.requireNonNull(id, "Text elements need an identifier");
    this.text = Objects.requireNonNull(text, "Text elements need a text, even if it is empty");
    this.type = type;
    this.position = position != null ? position : ElementPosition.UNKNOWN;
    this.sourceFile = sourceFile;
  }

  public String getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public ElementType getType() {
    return type;
  }

  public ElementPosition getPosition() {
    return position;
  }

  public ParsedFile getSourceFile() {
    return sourceFile;
  }

  public String getCategory() {
    return category;
  }

  public boolean hasCategory() {
    return category != null;
  }

  /** Operation identifiers that selected this element, in the order they were applied. */
  public List<String> getMatchedBy() {
    return Collections.unmodifiableList(matchedBy);
  }

  /** Named values recorded by the pipeline, in insertion order. */
  public Map<String, String> getResults() {
    return Collections.unmodifiableMap(results);
  }

  public boolean isRemoved() {
    return removed;
  }

  /** Overwrites any previous category, the last write wins. */
  public void setCategory(String category) {
    this.category = Objects.requireNonNull(category);
  }

  public void addMatchedBy(String operationId) {
    this.matchedBy.add(Objects.requireNonNull(operationId));
  }

  public void putResult(String name, String value) {
    this.results.put(name, value);
  }

  /** Soft delete, there is no way back. */
  public void markRemoved() {
    this.removed = true;
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("TextElement{");
    sb.append("id='").append(id).append('\'');
    sb.append(", text='").append(text).append('\'');
    if (category != null) {
      sb.append(", category='").append(category).append('\'');
    }
    if (!matchedBy.isEmpty()) {
      sb.append(", matchedBy=").append(matchedBy);
    }
    if (removed) {
      sb.append(", removed");
    }
    sb.append('}');
    return sb.toString();
  }
}
