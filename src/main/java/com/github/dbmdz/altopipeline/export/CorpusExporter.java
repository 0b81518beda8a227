package com.github.dbmdz.altopipeline.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.github.dbmdz.altopipeline.config.ExportOptions;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.model.TextElement;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Writer;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes the non-removed elements of a corpus to CSV/TSV or JSON.
 *
 * <p>Every element becomes one row with at least a {@code text} and a {@code category} column,
 * the other columns depend on the {@link ExportOptions}. The exporter only reads the corpus.
 */
public class CorpusExporter {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public static final String FILE = "file";
  public static final String TEXT = "text";
  public static final String CATEGORY = "category";
  public static final String ID = "id";
  public static final String TYPE = "type";
  public static final String MATCHED_BY = "matched_by";
  public static final String REMOVED = "removed";

  private final ParsedCorpus corpus;
  private final ExportOptions options;
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final CsvMapper csvMapper = new CsvMapper();

  public CorpusExporter(ParsedCorpus corpus) {
    this(corpus, new ExportOptions());
  }

  public CorpusExporter(ParsedCorpus corpus, ExportOptions options) {
    this.corpus = corpus;
    this.options = options;
  }

  /** Build the export rows for the given elements, columns in a fixed order. */
  public List<Map<String, Object>> rows(Collection<TextElement> elements) {
    return elements.stream().map(this::toRow).collect(ImmutableList.toImmutableList());
  }

  private Map<String, Object> toRow(TextElement element) {
    Map<String, Object> row = new LinkedHashMap<>();
    if (options.printFilename) {
      row.put(FILE, element.getSourceFile().getPath().toString());
    }
    row.put(TEXT, element.getText());
    row.put(CATEGORY, element.getCategory());
    if (options.printAttributes) {
      row.put(ID, element.getId());
      row.put(TYPE, element.getType().name());
      row.putAll(element.getPosition().toMap());
    }
    if (options.printParserResults) {
      element.getResults().forEach(row::putIfAbsent);
    }
    if (options.printFileMetaData) {
      element.getSourceFile().getMetaData().forEach(row::putIfAbsent);
    }
    if (options.printMatchedBy) {
      row.put(MATCHED_BY, element.getMatchedBy());
    }
    return row;
  }

  public void saveCsv(Path path) throws IOException {
    saveCsv(path, options.delimiter);
  }

  /** Write all non-removed elements to a single delimited file with a header line. */
  public void saveCsv(Path path, String delimiter) throws IOException {
    List<Map<String, Object>> rows = rows(corpus.elements());
    writeCsv(path, delimiter, rows);
    log.info("Exported {} elements to {}", rows.size(), path);
  }

  /** Write one delimited file per source file into {@code directory}. */
  public void saveCsvs(Path directory, String delimiter) throws IOException {
    Files.createDirectories(directory);
    String extension = "\t".equals(delimiter) ? ".tsv" : ".csv";
    for (Map.Entry<ParsedFile, Path> output : outputPaths(directory, extension).entrySet()) {
      writeCsv(output.getValue(), delimiter, rows(liveElements(output.getKey())));
    }
    log.info("Exported {} files to {}", corpus.getFiles().size(), directory);
  }

  public void saveJson(Path path) throws IOException {
    List<Map<String, Object>> rows = rows(corpus.elements());
    jsonMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), rows);
    log.info("Exported {} elements to {}", rows.size(), path);
  }

  public void saveJsons(Path directory) throws IOException {
    Files.createDirectories(directory);
    for (Map.Entry<ParsedFile, Path> output : outputPaths(directory, ".json").entrySet()) {
      jsonMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(output.getValue().toFile(), rows(liveElements(output.getKey())));
    }
    log.info("Exported {} files to {}", corpus.getFiles().size(), directory);
  }

  /**
   * Write every element, removed ones included, with its removal flag and the operations that
   * selected it.
   */
  public void saveAuditJson(Path path) throws IOException {
    List<Map<String, Object>> rows =
        corpus.allElements().stream()
            .map(
                e -> {
                  Map<String, Object> row = toRow(e);
                  row.put(REMOVED, e.isRemoved());
                  row.put(MATCHED_BY, e.getMatchedBy());
                  return row;
                })
            .collect(Collectors.toList());
    jsonMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), rows);
    log.info("Exported audit trail of {} elements to {}", rows.size(), path);
  }

  private static List<TextElement> liveElements(ParsedFile file) {
    return file.getElements().stream()
        .filter(e -> !e.isRemoved())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * One output file per source file, named after its base name. Source files from different
   * directories with the same base name get a numeric suffix in corpus order, e.g. {@code x_2}.
   */
  private Map<ParsedFile, Path> outputPaths(Path directory, String extension) {
    Map<ParsedFile, Path> paths = new LinkedHashMap<>();
    Set<String> usedNames = new HashSet<>();
    for (ParsedFile file : corpus.getFiles()) {
      String baseName = FilenameUtils.getBaseName(file.getPath().toString());
      String preferred = baseName + extension;
      String name = preferred;
      for (int suffix = 2; !usedNames.add(name); suffix++) {
        name = baseName + "_" + suffix + extension;
      }
      if (!name.equals(preferred)) {
        log.warn("{} is already taken, exporting {} to {}", preferred, file, name);
      }
      paths.put(file, directory.resolve(name));
    }
    return paths;
  }

  private void writeCsv(Path path, String delimiter, List<Map<String, Object>> rows)
      throws IOException {
    Preconditions.checkArgument(
        delimiter != null && delimiter.length() == 1, "Delimiter must be a single character");
    Set<String> columns = new LinkedHashSet<>(ImmutableList.of(TEXT, CATEGORY));
    rows.forEach(r -> columns.addAll(r.keySet()));
    CsvSchema.Builder schemaBuilder = CsvSchema.builder();
    columns.forEach(schemaBuilder::addColumn);
    CsvSchema schema =
        schemaBuilder.build().withHeader().withColumnSeparator(delimiter.charAt(0));
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        SequenceWriter csvWriter = csvMapper.writer(schema).writeValues(writer)) {
      for (Map<String, Object> row : rows) {
        Map<String, String> csvRow = new LinkedHashMap<>();
        for (String column : columns) {
          csvRow.put(column, toCell(row.get(column)));
        }
        csvWriter.write(csvRow);
      }
    }
  }

  private static String toCell(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Collection) {
      return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining("|"));
    }
    return value.toString();
  }
}
