package com.github.dbmdz.altopipeline.model;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * All parsed files of a processing session, keyed by their path and kept in the order they were
 * added.
 *
 * <p>The corpus is mutated in place by the pipeline and read by the exporters afterwards.
 */
public class ParsedCorpus {
  private final Map<Path, ParsedFile> files = new LinkedHashMap<>();

  /**
   * Add a parsed file to the corpus.
   *
   * @throws ModelIntegrityException if a file with the same path is already part of the corpus
   */
  public void addFile(ParsedFile file) {
    if (files.containsKey(file.getPath())) {
      throw new ModelIntegrityException(
          String.format("File %s was already added to the corpus", file.getPath()));
    }
    files.put(file.getPath(), file);
  }

  public Collection<ParsedFile> getFiles() {
    return Collections.unmodifiableCollection(files.values());
  }

  public Optional<ParsedFile> getFile(Path path) {
    return Optional.ofNullable(files.get(path));
  }

  /** All elements that have not been removed, in insertion order. */
  public List<TextElement> elements() {
    return allElementsStream().filter(e -> !e.isRemoved()).collect(ImmutableList.toImmutableList());
  }

  /** All elements including removed ones, for audit trails and diagnostics. */
  public List<TextElement> allElements() {
    return allElementsStream().collect(ImmutableList.toImmutableList());
  }

  private Stream<TextElement> allElementsStream() {
    return files.values().stream().flatMap(f -> f.getElements().stream());
  }

  public int size() {
    return elements().size();
  }

  public boolean isEmpty() {
    return files.isEmpty() || allElementsStream().allMatch(TextElement::isRemoved);
  }
}
