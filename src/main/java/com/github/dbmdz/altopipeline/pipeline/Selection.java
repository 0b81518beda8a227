package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.model.TextElement;
import com.github.dbmdz.altopipeline.provider.DictionaryLookupProvider;
import com.github.dbmdz.altopipeline.provider.NerProvider;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable set of matched text elements within a pipeline chain.
 *
 * <p>Selecting operations ({@link #find(String)}, {@link
 * #lookupDictionary(DictionaryLookupProvider)}, {@link #tagEntities(NerProvider)}) evaluate the
 * elements of this selection, or the files in scope for a root selection, and return a new
 * selection. Committing operations ({@link
 * #categorize(String)}, {@link #mark(String, String)}, {@link #remove()}) mutate the selected
 * elements in place and return this selection, so chains can continue after them:
 *
 * <pre>
 *   pipeline.find("^(\\d{1,3})\\.").categorize("id").remove();
 * </pre>
 *
 * Elements that have been removed are never candidates again, no matter which chain removed
 * them. There is no rollback: if an operation fails halfway through, the mutations it already
 * applied stay in place.
 */
public class Selection {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final String CATEGORIZE_PREFIX = "categorize:";

  private final ParsedCorpus corpus;
  private final ImmutableList<Match> matches;
  private final boolean root;
  private final Predicate<ParsedFile> scope;

  private Selection(
      ParsedCorpus corpus,
      ImmutableList<Match> matches,
      boolean root,
      Predicate<ParsedFile> scope) {
    this.corpus = corpus;
    this.matches = matches;
    this.root = root;
    this.scope = scope;
  }

  /** A selection without matches whose candidates are all non-removed elements of the corpus. */
  public static Selection root(ParsedCorpus corpus) {
    return root(corpus, f -> true);
  }

  /** A root selection whose candidates are the non-removed elements of the files in scope. */
  public static Selection root(ParsedCorpus corpus, Predicate<ParsedFile> scope) {
    return new Selection(corpus, ImmutableList.of(), true, scope);
  }

  /** Whether this is the start of a chain, i.e. candidates come from the whole corpus. */
  public boolean isRoot() {
    return root;
  }

  public List<Match> matches() {
    return matches;
  }

  public List<TextElement> elements() {
    return matches.stream().map(Match::getElement).collect(ImmutableList.toImmutableList());
  }

  public int size() {
    return matches.size();
  }

  public boolean isEmpty() {
    return matches.isEmpty();
  }

  /** The elements the next selecting operation evaluates. */
  List<TextElement> candidates() {
    if (root) {
      return corpus.elements().stream()
          .filter(e -> scope.test(e.getSourceFile()))
          .collect(ImmutableList.toImmutableList());
    }
    return matches.stream()
        .map(Match::getElement)
        .filter(e -> !e.isRemoved())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Narrow the selection to the elements whose text matches {@code regex}.
   *
   * @throws PatternException if the expression is invalid, before any element is touched
   */
  public Selection find(String regex) {
    return apply(RegexMatchingStrategy.compile(regex));
  }

  public Selection lookupDictionary(DictionaryLookupProvider dictionary) {
    return apply(new DictionaryMatchingStrategy(dictionary));
  }

  public Selection tagEntities(NerProvider tagger) {
    return apply(new EntityMatchingStrategy(tagger));
  }

  /** Evaluate every candidate with {@code strategy}, the matching ones form the new selection. */
  public Selection apply(MatchingStrategy strategy) {
    List<TextElement> candidates = candidates();
    ImmutableList.Builder<Match> selected = ImmutableList.builder();
    int numSelected = 0;
    for (TextElement element : candidates) {
      Optional<Match> match = strategy.evaluate(element);
      if (match.isPresent()) {
        strategy.commit(match.get());
        selected.add(match.get());
        numSelected++;
      }
    }
    log.debug(
        "{} selected {} of {} candidates",
        strategy.getOperationId(),
        numSelected,
        candidates.size());
    return new Selection(corpus, selected.build(), false, scope);
  }

  /**
   * Set the category of every selected element to {@code label} and record the captured values
   * under it. Previous categories are overwritten.
   */
  public Selection categorize(String label) {
    Preconditions.checkArgument(StringUtils.isNotBlank(label), "Category labels must not be blank");
    for (Match match : matches) {
      commitCategory(match, label);
    }
    return this;
  }

  /**
   * Commit the provisional categories suggested by the selecting operation, e.g. the entity types
   * from {@link #tagEntities(NerProvider)}.
   *
   * @throws IllegalStateException if a match has no provisional category, nothing is committed
   *     in that case
   */
  public Selection categorize() {
    for (Match match : matches) {
      if (!match.getProvisionalCategory().isPresent()) {
        throw new IllegalStateException(
            String.format(
                "%s did not suggest a category for element '%s', use categorize(label) instead",
                match.getOperationId(), match.getElement().getId()));
      }
    }
    for (Match match : matches) {
      commitCategory(match, match.getProvisionalCategory().get());
    }
    return this;
  }

  private void commitCategory(Match match, String label) {
    TextElement element = match.getElement();
    if (element.isRemoved()) {
      return;
    }
    element.setCategory(label);
    element.addMatchedBy(CATEGORIZE_PREFIX + label);
    if (match.getValue() != null) {
      element.putResult(label, match.getValue());
    }
  }

  /** Record {@code value} under {@code name} for every selected element. */
  public Selection mark(String name, String value) {
    Preconditions.checkArgument(StringUtils.isNotBlank(name), "Mark names must not be blank");
    for (Match match : matches) {
      if (!match.getElement().isRemoved()) {
        match.getElement().putResult(name, value);
      }
    }
    return this;
  }

  /** Exclude every selected element from later selections and from the export. */
  public Selection remove() {
    for (Match match : matches) {
      match.getElement().markRemoved();
    }
    return this;
  }

  /** Start a fresh chain over the non-removed elements of the whole corpus. */
  public Selection reset() {
    return root(corpus);
  }

  public Selection logMatches() {
    for (Match match : matches) {
      log.info(
          "Found pattern '{}' in element '{}' of {}: '{}'",
          match.getOperationId(),
          match.getElement().getId(),
          match.getElement().getSourceFile(),
          match.getElement().getText());
    }
    return this;
  }

  @Override
  public String toString() {
    return "Selection{" + (root ? "root" : matches.size() + " matches") + "}";
  }
}
