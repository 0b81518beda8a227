package com.github.dbmdz.altopipeline.pipeline;

import com.github.dbmdz.altopipeline.config.PipelineConfig;
import com.github.dbmdz.altopipeline.config.PipelineConfig.BatchConfig;
import com.github.dbmdz.altopipeline.config.PipelineConfig.ConditionConfig;
import com.github.dbmdz.altopipeline.config.PipelineConfig.DictionaryConfig;
import com.github.dbmdz.altopipeline.config.PipelineConfig.StepConfig;
import com.github.dbmdz.altopipeline.provider.DictionaryLoader;
import com.github.dbmdz.altopipeline.provider.DictionaryLookupProvider;
import com.github.dbmdz.altopipeline.provider.NerProvider;
import com.github.dbmdz.altopipeline.provider.RuleBasedNerProvider;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs pipeline chains that are described in a configuration.
 *
 * <p>Every batch is one chain starting from the full corpus, or from the files matching the
 * batch's conditions, and its steps are applied in order. All steps of a batch are validated
 * before the first one runs.
 */
public class BatchRunner {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public enum StepType {
    FIND(true),
    LOOKUP(true),
    TAG(true),
    CATEGORIZE(false),
    MARK(false),
    REMOVE(false),
    RESET(false);

    /** Whether the step replaces the selection with the elements it matched. */
    final boolean selecting;

    StepType(boolean selecting) {
      this.selecting = selecting;
    }

    static StepType of(StepConfig step) {
      if (step.op == null) {
        throw new IllegalArgumentException("Pipeline step without 'op': " + step);
      }
      try {
        return StepType.valueOf(step.op.trim().toUpperCase());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            String.format("Unknown pipeline step '%s'", step.op), e);
      }
    }
  }

  private final PatternPipeline pipeline;
  private final Map<String, DictionaryLookupProvider> dictionaries = new LinkedHashMap<>();
  private final Map<String, NerProvider> taggers = new LinkedHashMap<>();

  public BatchRunner(PatternPipeline pipeline) {
    this.pipeline = pipeline;
  }

  /** Create a runner with the dictionaries and taggers declared in {@code config}. */
  public static BatchRunner fromConfig(PatternPipeline pipeline, PipelineConfig config)
      throws IOException {
    BatchRunner runner = new BatchRunner(pipeline);
    for (Map.Entry<String, DictionaryConfig> entry : config.dictionaries.entrySet()) {
      DictionaryConfig dictConfig = entry.getValue();
      DictionaryLoader loader = new DictionaryLoader(dictConfig.keyField, dictConfig.valueField);
      runner.registerDictionary(loader.load(entry.getKey(), config.resolve(dictConfig.path)));
    }
    config.taggers.forEach(
        (name, rules) -> runner.registerTagger(new RuleBasedNerProvider(name, rules)));
    return runner;
  }

  public BatchRunner registerDictionary(DictionaryLookupProvider dictionary) {
    this.dictionaries.put(dictionary.getName(), dictionary);
    return this;
  }

  public BatchRunner registerTagger(NerProvider tagger) {
    this.taggers.put(tagger.getName(), tagger);
    return this;
  }

  public void run(List<BatchConfig> batches) {
    for (BatchConfig batch : batches) {
      run(batch);
    }
  }

  /** Run a single batch and return the selection its last step produced. */
  public Selection run(BatchConfig batch) {
    List<MetadataCondition> conditions = toConditions(batch);
    StepType lastSelecting = null;
    for (StepConfig step : batch.steps) {
      StepType type = validate(step, lastSelecting);
      if (type.selecting) {
        lastSelecting = type;
      } else if (type == StepType.RESET) {
        lastSelecting = null;
      }
    }
    Selection start;
    if (conditions.isEmpty()) {
      start = pipeline.reset();
    } else {
      start = pipeline.defineBatch(batch.name, conditions).batch(batch.name);
    }
    Selection selection = start;
    for (StepConfig step : batch.steps) {
      selection = apply(start, selection, step);
    }
    log.info(
        "Batch '{}' finished after {} steps with {} selected elements",
        batch.name,
        batch.steps.size(),
        selection.size());
    return selection;
  }

  private static List<MetadataCondition> toConditions(BatchConfig batch) {
    if (batch.conditions == null || batch.conditions.isEmpty()) {
      return ImmutableList.of();
    }
    if (StringUtils.isBlank(batch.name)) {
      throw new IllegalArgumentException("Batches with conditions need a name");
    }
    ImmutableList.Builder<MetadataCondition> conditions = ImmutableList.builder();
    for (ConditionConfig condition : batch.conditions) {
      conditions.add(MetadataCondition.parse(condition.key, condition.values));
    }
    return conditions.build();
  }

  private StepType validate(StepConfig step, StepType lastSelecting) {
    StepType type = StepType.of(step);
    switch (type) {
      case FIND:
        requireField(step, "pattern", step.pattern);
        RegexMatchingStrategy.compile(step.pattern);
        break;
      case LOOKUP:
        requireField(step, "dictionary", step.dictionary);
        if (!dictionaries.containsKey(step.dictionary)) {
          throw new IllegalArgumentException(
              String.format(
                  "Unknown dictionary '%s', known are %s", step.dictionary, dictionaries.keySet()));
        }
        break;
      case TAG:
        requireField(step, "tagger", step.tagger);
        if (!taggers.containsKey(step.tagger)) {
          throw new IllegalArgumentException(
              String.format("Unknown tagger '%s', known are %s", step.tagger, taggers.keySet()));
        }
        break;
      case CATEGORIZE:
        if (step.label != null) {
          requireField(step, "label", step.label);
        } else if (lastSelecting != StepType.LOOKUP && lastSelecting != StepType.TAG) {
          // Only lookups and taggers suggest categories
          String after =
              lastSelecting != null ? "'" + lastSelecting.name().toLowerCase() + "'" : "reset";
          throw new IllegalArgumentException(
              String.format("Pipeline step '%s' needs a 'label' after %s", step.op, after));
        }
        break;
      case MARK:
        requireField(step, "name", step.name);
        break;
      default:
        break;
    }
    return type;
  }

  private static void requireField(StepConfig step, String field, String value) {
    if (StringUtils.isBlank(value)) {
      throw new IllegalArgumentException(
          String.format("Pipeline step '%s' needs a '%s'", step.op, field));
    }
  }

  /** Apply {@code step}, a {@code reset} returns to {@code start}, the root of the batch. */
  private Selection apply(Selection start, Selection selection, StepConfig step) {
    switch (StepType.of(step)) {
      case FIND:
        return selection.find(step.pattern);
      case LOOKUP:
        return selection.lookupDictionary(dictionaries.get(step.dictionary));
      case TAG:
        return selection.tagEntities(taggers.get(step.tagger));
      case CATEGORIZE:
        return step.label == null ? selection.categorize() : selection.categorize(step.label);
      case MARK:
        return selection.mark(step.name, step.value);
      case REMOVE:
        return selection.remove();
      case RESET:
        return start;
      default:
        throw new IllegalStateException("Unhandled pipeline step " + step.op);
    }
  }
}
