package com.github.dbmdz.altopipeline.provider;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tags entities with regular expressions, one per entity type.
 *
 * <p>Stands in for a statistical NER engine where the entity shapes are regular enough, e.g.
 * company suffixes or postal districts in directories. Every match of a rule becomes a tag, tags
 * are ordered by their start offset and, for equal starts, by rule order.
 */
public class RuleBasedNerProvider implements NerProvider {
  private final String name;
  private final ImmutableMap<String, Pattern> rules;

  public RuleBasedNerProvider(String name, Map<String, String> rules) {
    this.name = name;
    ImmutableMap.Builder<String, Pattern> compiled = ImmutableMap.builder();
    rules.forEach(
        (type, regex) -> {
          try {
            compiled.put(type, Pattern.compile(regex));
          } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(
                String.format("Invalid rule for entity type '%s' in tagger '%s'", type, name), e);
          }
        });
    this.rules = compiled.build();
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public List<EntityTag> tag(String text) {
    List<EntityTag> tags = new ArrayList<>();
    rules.forEach(
        (type, pattern) -> {
          Matcher m = pattern.matcher(text);
          while (m.find()) {
            if (m.end() > m.start()) {
              tags.add(new EntityTag(m.start(), m.end(), type));
            }
          }
        });
    // Stable sort, so rule order decides between tags with the same start
    tags.sort(Comparator.comparingInt(EntityTag::getStart));
    return tags;
  }
}
