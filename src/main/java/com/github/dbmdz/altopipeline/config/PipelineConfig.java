package com.github.dbmdz.altopipeline.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for a processing session: how files are parsed, which metadata is attached to them,
 * which dictionaries and taggers are available, which pipeline batches run and what the export
 * looks like.
 */
@JacksonXmlRootElement(localName = "pipelineConfig")
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
  /** What constitutes a text element: {@code TextBlock}, {@code TextLine} or {@code String}. */
  @JacksonXmlProperty @JsonProperty public String lineType = "TextLine";

  @JacksonXmlProperty @JsonProperty public String fileEnding = ".xml";

  /** Static metadata added to every parsed file. */
  @JacksonXmlProperty @JsonProperty public Map<String, String> metaData = new LinkedHashMap<>();

  @JacksonXmlProperty @JsonProperty public FileNameStructure fileNameStructure;

  @JacksonXmlProperty @JsonProperty public ExportOptions export = new ExportOptions();

  @JacksonXmlProperty @JsonProperty
  public Map<String, DictionaryConfig> dictionaries = new LinkedHashMap<>();

  /** Rule-based taggers, by name, each mapping an entity type to a regular expression. */
  @JacksonXmlProperty @JsonProperty
  public Map<String, Map<String, String>> taggers = new LinkedHashMap<>();

  @JacksonXmlElementWrapper(localName = "batches")
  @JacksonXmlProperty(localName = "batch")
  @JsonProperty
  public List<BatchConfig> batches = new ArrayList<>();

  /** Directory that relative paths in the configuration are resolved against. */
  @JsonIgnore private Path basePath = Paths.get("");

  public PipelineConfig() {}

  public static PipelineConfig parse(String configFile) throws IOException {
    PipelineConfig config;
    if (configFile.endsWith(".json")) {
      config = new ObjectMapper().readValue(new File(configFile), PipelineConfig.class);
    } else if (configFile.endsWith(".xml")) {
      config = new XmlMapper().readValue(new File(configFile), PipelineConfig.class);
    } else {
      throw new UnsupportedOperationException("Unsupported file format: " + configFile);
    }
    Path parent = Paths.get(configFile).toAbsolutePath().getParent();
    if (parent != null) {
      config.basePath = parent;
    }
    return config;
  }

  public Path resolve(String path) {
    return basePath.resolve(path);
  }

  public static class FileNameStructure {
    /** Searched for in the file name, one group per value name. */
    @JacksonXmlProperty @JsonProperty public String pattern;

    @JacksonXmlElementWrapper(localName = "valueNames")
    @JacksonXmlProperty(localName = "valueName")
    @JsonProperty
    public List<String> valueNames = new ArrayList<>();

    public FileNameStructure() {}

    public FileNameStructure(String pattern, List<String> valueNames) {
      this.pattern = pattern;
      this.valueNames = valueNames;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DictionaryConfig {
    @JacksonXmlProperty @JsonProperty public String path;
    /** Field holding the lookup key if the dictionary is an array of objects. */
    @JacksonXmlProperty @JsonProperty public String keyField = "entry";
    /** Field holding the value if the dictionary is an array of objects. */
    @JacksonXmlProperty @JsonProperty public String valueField = "value";

    public DictionaryConfig() {}
  }

  /**
   * A named chain of steps. With {@code conditions}, the chain only sees the files whose metadata
   * satisfy all of them.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class BatchConfig {
    @JacksonXmlProperty @JsonProperty public String name;

    @JacksonXmlElementWrapper(localName = "conditions")
    @JacksonXmlProperty(localName = "condition")
    @JsonProperty
    public List<ConditionConfig> conditions = new ArrayList<>();

    @JacksonXmlElementWrapper(localName = "steps")
    @JacksonXmlProperty(localName = "step")
    @JsonProperty
    public List<StepConfig> steps = new ArrayList<>();

    public BatchConfig() {}
  }

  /**
   * File metadata {@code key} must equal {@code values}, or lie in it for a range like {@code
   * 23-24}.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ConditionConfig {
    @JacksonXmlProperty @JsonProperty public String key;
    @JacksonXmlProperty @JsonProperty public String values;

    public ConditionConfig() {}

    public ConditionConfig(String key, String values) {
      this.key = key;
      this.values = values;
    }
  }

  /** A single chained operation: {@code op} selects the operation, the other fields its input. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class StepConfig {
    @JacksonXmlProperty @JsonProperty public String op;
    @JacksonXmlProperty @JsonProperty public String pattern;
    @JacksonXmlProperty @JsonProperty public String label;
    @JacksonXmlProperty @JsonProperty public String name;
    @JacksonXmlProperty @JsonProperty public String value;
    @JacksonXmlProperty @JsonProperty public String dictionary;
    @JacksonXmlProperty @JsonProperty public String tagger;

    public StepConfig() {}

    public StepConfig(String op) {
      this.op = op;
    }

    @Override
    public String toString() {
      return "StepConfig{op='" + op + "'}";
    }
  }
}
