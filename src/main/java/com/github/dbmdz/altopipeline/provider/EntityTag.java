package com.github.dbmdz.altopipeline.provider;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import java.util.Objects;

/** A span of a text that was recognized as a named entity. */
public class EntityTag {
  /** Character offsets into the tagged text, closed-open. */
  public final Range<Integer> span;

  public final String entityType;

  public EntityTag(Range<Integer> span, String entityType) {
    Preconditions.checkArgument(
        span.hasLowerBound() && span.hasUpperBound(), "Entity spans must be bounded");
    this.span = span;
    this.entityType = Objects.requireNonNull(entityType);
  }

  public EntityTag(int start, int end, String entityType) {
    this(Range.closedOpen(start, end), entityType);
  }

  public int getStart() {
    return span.lowerEndpoint();
  }

  public int getEnd() {
    return span.upperEndpoint();
  }

  /** The part of {@code text} covered by this tag. */
  public String coveredText(String text) {
    int end = Math.min(getEnd(), text.length());
    return text.substring(Math.min(getStart(), end), end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EntityTag entityTag = (EntityTag) o;
    return span.equals(entityTag.span) && entityType.equals(entityTag.entityType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(span, entityType);
  }

  @Override
  public String toString() {
    return "EntityTag{" + entityType + "@" + span + "}";
  }
}
