package com.github.dbmdz.altopipeline.provider;

import java.util.Objects;

/** A dictionary key found in a text, together with the value the dictionary stores for it. */
public class DictionaryMatch {
  public final String key;
  public final String value;

  public DictionaryMatch(String key, String value) {
    this.key = Objects.requireNonNull(key);
    this.value = value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DictionaryMatch that = (DictionaryMatch) o;
    return key.equals(that.key) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return "DictionaryMatch{" + key + "=" + value + "}";
  }
}
