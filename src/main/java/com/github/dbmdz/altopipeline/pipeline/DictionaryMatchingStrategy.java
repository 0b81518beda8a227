package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.TextElement;
import com.github.dbmdz.altopipeline.provider.DictionaryLookupProvider;
import com.github.dbmdz.altopipeline.provider.DictionaryMatch;
import com.github.dbmdz.altopipeline.provider.ProviderException;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects elements that contain at least one dictionary entry.
 *
 * <p>The first looked up value is recorded under the dictionary's name, the dictionary's name is
 * the provisional category.
 */
public class DictionaryMatchingStrategy implements MatchingStrategy {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public static final String OPERATION_PREFIX = "lookup:";

  private final DictionaryLookupProvider provider;

  public DictionaryMatchingStrategy(DictionaryLookupProvider provider) {
    this.provider = provider;
  }

  @Override
  public String getOperationId() {
    return OPERATION_PREFIX + provider.getName();
  }

  @Override
  public Optional<Match> evaluate(TextElement element) {
    List<DictionaryMatch> found;
    try {
      found = provider.lookup(element.getText());
    } catch (ProviderException e) {
      return handleFailure(element, e);
    } catch (RuntimeException e) {
      return handleFailure(
          element,
          new ProviderException(
              String.format(
                  "Dictionary '%s' failed on element '%s'", provider.getName(), element.getId()),
              e));
    }
    if (found == null || found.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new Match(element, getOperationId(), found.get(0).value, provider.getName()));
  }

  private Optional<Match> handleFailure(TextElement element, ProviderException e) {
    if (!provider.hasRecoverableFailures()) {
      throw e;
    }
    log.warn(
        "Lookup in '{}' failed for element '{}', treating it as no match: {}",
        provider.getName(), element.getId(), e.getMessage());
    return Optional.empty();
  }

  @Override
  public void commit(Match match) {
    MatchingStrategy.super.commit(match);
    match.getElement().putResult(provider.getName(), match.getValue());
  }
}
