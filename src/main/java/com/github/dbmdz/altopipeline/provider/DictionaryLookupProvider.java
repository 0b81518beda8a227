package com.github.dbmdz.altopipeline.provider;

import java.util.List;

/** Looks up the entries of a preloaded table in a text. */
public interface DictionaryLookupProvider {
  /** Name of the dictionary, used in operation identifiers and as the provisional category. */
  String getName();

  /**
   * Find all dictionary entries in {@code text}.
   *
   * @return the matching entries, an empty list if there are none
   * @throws ProviderException if the lookup failed
   */
  List<DictionaryMatch> lookup(String text);

  /**
   * Whether a {@link ProviderException} only affects the text it was raised for. If so, the
   * pipeline treats the failure as "no match" and carries on, otherwise it aborts.
   */
  default boolean hasRecoverableFailures() {
    return false;
  }
}
