package com.github.dbmdz.altopipeline.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/** Controls which columns end up in the exported rows. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportOptions {
  @JacksonXmlProperty @JsonProperty public boolean printFilename = false;
  /** Element identifier, type and geometry. */
  @JacksonXmlProperty @JsonProperty public boolean printAttributes = true;
  /** Values recorded by categorize, lookup and mark operations. */
  @JacksonXmlProperty @JsonProperty public boolean printParserResults = true;
  @JacksonXmlProperty @JsonProperty public boolean printFileMetaData = false;
  @JacksonXmlProperty @JsonProperty public boolean printMatchedBy = false;
  @JacksonXmlProperty @JsonProperty public String delimiter = "\t";

  public ExportOptions() {}

  /** Options that keep everything needed to read an export back in. */
  public static ExportOptions full() {
    ExportOptions options = new ExportOptions();
    options.printFilename = true;
    options.printFileMetaData = true;
    options.printMatchedBy = true;
    return options;
  }
}
