package com.github.dbmdz.altopipeline.model;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/** Granularity at which a parser exposes text elements, mapped to the ALTO element names. */
public enum ElementType {
  /* Order matters: From top of the page layout hierarchy to bottom */
  BLOCK("TextBlock"),
  LINE("TextLine"),
  WORD("String");

  private static final Map<String, ElementType> byTagName =
      ImmutableMap.copyOf(
          Arrays.stream(values()).collect(Collectors.toMap(t -> t.tagName, t -> t)));

  public final String tagName;

  ElementType(String tagName) {
    this.tagName = tagName;
  }

  /** Resolve a configured line type, either the ALTO tag name or the enum name. */
  public static ElementType fromName(String name) {
    ElementType type = byTagName.get(name);
    if (type != null) {
      return type;
    }
    try {
      return ElementType.valueOf(name.toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Unsupported line type '%s', must be one of %s", name, byTagName.keySet()),
          e);
    }
  }
}
