package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Restricts a batch to the files whose metadata value for a key matches.
 *
 * <p>The expected value is either a single value ({@code "22"}) or an inclusive numeric range
 * ({@code "23-24"}). Numeric values are compared as numbers, so {@code "0022"} matches {@code
 * "22"}. Files without the key never match.
 */
public class MetadataCondition {
  private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)$");

  private final String key;
  private final String values;
  private final Range<Integer> range;

  private MetadataCondition(String key, String values, Range<Integer> range) {
    this.key = key;
    this.values = values;
    this.range = range;
  }

  /**
   * @throws IllegalArgumentException if the key or the values are blank, or the range is empty
   */
  public static MetadataCondition parse(String key, String values) {
    Preconditions.checkArgument(StringUtils.isNotBlank(key), "Batch conditions need a key");
    Preconditions.checkArgument(
        StringUtils.isNotBlank(values), "Batch condition on '%s' needs values", key);
    String trimmed = values.trim();
    Matcher m = RANGE_PATTERN.matcher(trimmed);
    if (!m.matches()) {
      return new MetadataCondition(key, trimmed, null);
    }
    Integer lower = Ints.tryParse(m.group(1));
    Integer upper = Ints.tryParse(m.group(2));
    Preconditions.checkArgument(
        lower != null && upper != null && lower <= upper,
        "Invalid range '%s' in batch condition on '%s'",
        trimmed,
        key);
    return new MetadataCondition(key, trimmed, Range.closed(lower, upper));
  }

  public String getKey() {
    return key;
  }

  public boolean matches(ParsedFile file) {
    String actual = file.getMetaData().get(key);
    if (actual == null) {
      return false;
    }
    Integer number = Ints.tryParse(actual.trim());
    if (range != null) {
      return number != null && range.contains(number);
    }
    Integer expected = Ints.tryParse(values);
    if (number != null && expected != null) {
      return number.equals(expected);
    }
    return actual.equals(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MetadataCondition that = (MetadataCondition) o;
    return key.equals(that.key) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, values);
  }

  @Override
  public String toString() {
    return key + "=" + values;
  }
}
