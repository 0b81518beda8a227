package com.github.dbmdz.altopipeline.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The text elements extracted from a single source file, in document order. */
public class ParsedFile {
  private final Path path;
  private final List<TextElement> elements = new ArrayList<>();
  private final Map<String, TextElement> elementsById = new HashMap<>();
  private final Map<String, String> metaData = new LinkedHashMap<>();

  public ParsedFile(Path path) {
    this.path = path;
  }

  /**
   * Append a new element to the file.
   *
   * @throws ModelIntegrityException if an element with the same identifier was already added
   */
  public TextElement addElement(
      String id, String text, ElementType type, ElementPosition position) {
    if (id == null || id.isEmpty()) {
      throw new ModelIntegrityException(
          String.format("Element #%d in %s has no identifier", elements.size(), path));
    }
    if (elementsById.containsKey(id)) {
      throw new ModelIntegrityException(
          String.format("Duplicate element identifier '%s' in %s", id, path));
    }
    TextElement element = new TextElement(id, text, type, position, this);
    elements.add(element);
    elementsById.put(id, element);
    return element;
  }

  public Path getPath() {
    return path;
  }

  /** All elements of the file, including removed ones. */
  public List<TextElement> getElements() {
    return Collections.unmodifiableList(elements);
  }

  public Optional<TextElement> getElement(String id) {
    return Optional.ofNullable(elementsById.get(id));
  }

  public Map<String, String> getMetaData() {
    return Collections.unmodifiableMap(metaData);
  }

  public void addMetaData(String name, String value) {
    this.metaData.put(name, value);
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
