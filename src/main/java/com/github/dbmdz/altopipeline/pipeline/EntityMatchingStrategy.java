package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.TextElement;
import com.github.dbmdz.altopipeline.provider.EntityTag;
import com.github.dbmdz.altopipeline.provider.NerProvider;
import com.github.dbmdz.altopipeline.provider.ProviderException;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects elements with at least one named entity. The first entity's type becomes the
 * provisional category, its text the captured value.
 */
public class EntityMatchingStrategy implements MatchingStrategy {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public static final String OPERATION_PREFIX = "tag:";

  private final NerProvider provider;

  public EntityMatchingStrategy(NerProvider provider) {
    this.provider = provider;
  }

  @Override
  public String getOperationId() {
    return OPERATION_PREFIX + provider.getName();
  }

  @Override
  public Optional<Match> evaluate(TextElement element) {
    List<EntityTag> tags;
    try {
      tags = provider.tag(element.getText());
    } catch (ProviderException e) {
      return handleFailure(element, e);
    } catch (RuntimeException e) {
      return handleFailure(
          element,
          new ProviderException(
              String.format(
                  "Tagger '%s' failed on element '%s'", provider.getName(), element.getId()),
              e));
    }
    if (tags == null || tags.isEmpty()) {
      return Optional.empty();
    }
    EntityTag first = tags.get(0);
    return Optional.of(
        new Match(
            element, getOperationId(), first.coveredText(element.getText()), first.entityType));
  }

  private Optional<Match> handleFailure(TextElement element, ProviderException e) {
    if (!provider.hasRecoverableFailures()) {
      throw e;
    }
    log.warn(
        "Tagging with '{}' failed for element '{}', treating it as no match: {}",
        provider.getName(), element.getId(), e.getMessage());
    return Optional.empty();
  }
}
