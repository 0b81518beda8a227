package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.provider.DictionaryLookupProvider;
import com.github.dbmdz.altopipeline.provider.NerProvider;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for pattern chains over a corpus.
 *
 * <p>Every call starts a new chain from the full set of non-removed elements, or from the files
 * of a named batch. Chains run one after another against the same corpus and see each other's
 * mutations. When two chains assign different categories to the same element, the one that ran
 * last wins.
 */
public class PatternPipeline {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final ParsedCorpus corpus;
  private final Map<String, List<MetadataCondition>> batches = new LinkedHashMap<>();

  public PatternPipeline(ParsedCorpus corpus) {
    this.corpus = Objects.requireNonNull(corpus);
  }

  public ParsedCorpus getCorpus() {
    return corpus;
  }

  /**
   * Register a batch, i.e. the files whose metadata satisfy all {@code conditions}. Redefining a
   * batch replaces its conditions.
   */
  public PatternPipeline defineBatch(String name, List<MetadataCondition> conditions) {
    Preconditions.checkArgument(StringUtils.isNotBlank(name), "Batches need a name");
    batches.put(name, ImmutableList.copyOf(conditions));
    return this;
  }

  public boolean hasBatch(String name) {
    return batches.containsKey(name);
  }

  /**
   * A root selection over the non-removed elements of the files in batch {@code name}.
   *
   * @throws IllegalArgumentException if no batch with that name was defined
   */
  public Selection batch(String name) {
    List<MetadataCondition> conditions = batches.get(name);
    if (conditions == null) {
      throw new IllegalArgumentException(
          String.format("Unknown batch '%s', known are %s", name, batches.keySet()));
    }
    long numFiles = corpus.getFiles().stream().filter(f -> matchesAll(conditions, f)).count();
    log.debug("Batch '{}' {} covers {} files", name, conditions, numFiles);
    return Selection.root(corpus, f -> matchesAll(conditions, f));
  }

  private static boolean matchesAll(List<MetadataCondition> conditions, ParsedFile file) {
    return conditions.stream().allMatch(c -> c.matches(file));
  }

  /** A root selection, the starting point of a chain. */
  public Selection reset() {
    return Selection.root(corpus);
  }

  public Selection find(String regex) {
    return reset().find(regex);
  }

  public Selection lookupDictionary(DictionaryLookupProvider dictionary) {
    return reset().lookupDictionary(dictionary);
  }

  public Selection tagEntities(NerProvider tagger) {
    return reset().tagEntities(tagger);
  }

  public Selection apply(MatchingStrategy strategy) {
    return reset().apply(strategy);
  }
}
