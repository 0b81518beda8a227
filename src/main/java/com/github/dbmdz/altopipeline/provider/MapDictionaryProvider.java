package com.github.dbmdz.altopipeline.provider;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dictionary backed by an in-memory table.
 *
 * <p>A key matches if it occurs in the text and is neither preceded nor followed by a word
 * character, i.e. {@code Berlin} matches {@code "Berlin"} and {@code "Hotel Berlin."} but not
 * {@code "Berliner"}. Matching is case-sensitive, results are returned in table order.
 */
public class MapDictionaryProvider implements DictionaryLookupProvider {
  private final String name;
  private final ImmutableMap<String, String> table;
  private final ImmutableMap<String, Pattern> keyPatterns;

  public MapDictionaryProvider(String name, Map<String, String> table) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Dictionaries need a name");
    this.name = name;
    this.table = ImmutableMap.copyOf(table);
    ImmutableMap.Builder<String, Pattern> patterns = ImmutableMap.builder();
    for (String key : this.table.keySet()) {
      patterns.put(
          key,
          Pattern.compile(
              "(?<!\\w)" + Pattern.quote(key) + "(?!\\w)", Pattern.UNICODE_CHARACTER_CLASS));
    }
    this.keyPatterns = patterns.build();
  }

  @Override
  public String getName() {
    return name;
  }

  public Map<String, String> getTable() {
    return table;
  }

  @Override
  public List<DictionaryMatch> lookup(String text) {
    ImmutableList.Builder<DictionaryMatch> matches = ImmutableList.builder();
    keyPatterns.forEach(
        (key, pattern) -> {
          if (text.contains(key) && pattern.matcher(text).find()) {
            matches.add(new DictionaryMatch(key, table.get(key)));
          }
        });
    return matches.build();
  }

  @Override
  public String toString() {
    return "MapDictionaryProvider{" + name + ", " + table.size() + " entries}";
  }
}
