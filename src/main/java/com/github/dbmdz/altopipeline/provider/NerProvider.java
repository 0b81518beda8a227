package com.github.dbmdz.altopipeline.provider;

import java.util.List;

/** Named-entity recognition over a single text. */
public interface NerProvider {
  String getName();

  /**
   * Tag the named entities in {@code text}.
   *
   * @return the tags ordered by their position in the text, an empty list if there are none
   * @throws ProviderException if tagging failed
   */
  List<EntityTag> tag(String text);

  /** See {@link DictionaryLookupProvider#hasRecoverableFailures()}. */
  default boolean hasRecoverableFailures() {
    return false;
  }
}
