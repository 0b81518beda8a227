package com.github.dbmdz.altopipeline.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.github.dbmdz.altopipeline.config.ExportOptions;
import com.github.dbmdz.altopipeline.formats.alto.AltoFileParser;
import com.github.dbmdz.altopipeline.model.ElementPosition;
import com.github.dbmdz.altopipeline.model.ElementType;
import com.github.dbmdz.altopipeline.model.ModelIntegrityException;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.model.TextElement;
import com.github.dbmdz.altopipeline.pipeline.PatternPipeline;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import javax.xml.stream.XMLStreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CorpusExporterTest {
  private static final TypeReference<List<Map<String, Object>>> ROWS =
      new TypeReference<List<Map<String, Object>>>() {};

  @TempDir Path tmpDir;

  private ParsedCorpus corpus;

  @BeforeEach
  public void setUp() throws IOException, XMLStreamException {
    corpus =
        new AltoFileParser()
            .withMetaData("year", "1951")
            .parseDirectory(Paths.get("src/test/resources/data/alto"));
    PatternPipeline pipeline = new PatternPipeline(corpus);
    pipeline.find("^(\\d{1,3})\\.").categorize("number");
    pipeline.find("°").mark("is_member", "true");
    pipeline.find("^unrelated$").remove();
  }

  private static List<Map<String, String>> readCsv(Path path, char separator) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
    try (MappingIterator<Map<String, String>> it =
        new CsvMapper().readerFor(Map.class).with(schema).readValues(path.toFile())) {
      return it.readAll();
    }
  }

  @Test
  public void testRowsWithDefaultOptions() {
    CorpusExporter exporter = new CorpusExporter(corpus);
    List<Map<String, Object>> rows = exporter.rows(corpus.elements());
    assertThat(rows).hasSize(6);
    Map<String, Object> first = rows.get(0);
    assertThat(first.keySet())
        .containsExactly(
            "text", "category", "id", "type", "page", "page_width", "page_height", "hpos", "vpos",
            "width", "height", "baseline", "number");
    assertThat(first)
        .containsEntry("text", "12. Acme & Cie.")
        .containsEntry("category", "number")
        .containsEntry("number", "12")
        .containsEntry("id", "TL1")
        .containsEntry("type", "LINE")
        .containsEntry("hpos", 100);
    assertThat(first).doesNotContainKeys("file", "year", "matched_by");
  }

  @Test
  public void testRowsWithFullOptions() {
    CorpusExporter exporter = new CorpusExporter(corpus, ExportOptions.full());
    Map<String, Object> member = exporter.rows(corpus.elements()).get(3);
    assertThat(member)
        .containsEntry("file", Paths.get("src/test/resources/data/alto/bscc_0001_a.xml").toString())
        .containsEntry("text", "° Hamburg")
        .containsEntry("is_member", "true")
        .containsEntry("year", "1951")
        .containsEntry("matched_by", ImmutableList.of("find:°"));
    assertThat(member.get("category")).isNull();
  }

  @Test
  public void testMinimalRows() {
    ExportOptions options = new ExportOptions();
    options.printAttributes = false;
    options.printParserResults = false;
    List<Map<String, Object>> rows = new CorpusExporter(corpus, options).rows(corpus.elements());
    assertThat(rows).allMatch(r -> r.keySet().size() == 2);
  }

  @Test
  public void testResultsDoNotOverwriteAttributes() {
    new PatternPipeline(corpus).find("Corp").categorize("id");
    Map<String, Object> row = new CorpusExporter(corpus).rows(corpus.elements()).get(2);
    assertThat(row).containsEntry("id", "TL3").containsEntry("category", "id");
  }

  @Test
  public void testSaveCsv() throws IOException {
    Path out = tmpDir.resolve("export.csv");
    new CorpusExporter(corpus).saveCsv(out, ";");
    List<Map<String, String>> rows = readCsv(out, ';');
    assertThat(rows).hasSize(6);
    assertThat(ImmutableList.copyOf(rows.get(0).keySet())).startsWith("text", "category");
    assertThat(rows.get(0)).containsEntry("text", "12. Acme & Cie.").containsEntry("id", "TL1");
    // Empty cells for missing values
    assertThat(rows.get(1)).containsEntry("category", "").containsEntry("is_member", "");
    assertThat(rows.get(3)).containsEntry("is_member", "true");
    assertThat(rows).extracting(r -> r.get("text")).doesNotContain("unrelated");
  }

  @Test
  public void testSaveCsvWithListColumns() throws IOException {
    ExportOptions options = new ExportOptions();
    options.printMatchedBy = true;
    Path out = tmpDir.resolve("export.tsv");
    new CorpusExporter(corpus, options).saveCsv(out);
    List<Map<String, String>> rows = readCsv(out, '\t');
    assertThat(rows.get(0)).containsEntry("matched_by", "find:^(\\d{1,3})\\.|categorize:number");
  }

  @Test
  public void testSaveCsvsPerFile() throws IOException {
    Path outDir = tmpDir.resolve("per_file");
    new CorpusExporter(corpus).saveCsvs(outDir, "\t");
    assertThat(outDir.resolve("bscc_0001_a.tsv")).exists();
    assertThat(outDir.resolve("bscc_0002_b.tsv")).exists();
    assertThat(readCsv(outDir.resolve("bscc_0001_a.tsv"), '\t')).hasSize(4);

    new CorpusExporter(corpus).saveCsvs(outDir, ",");
    assertThat(readCsv(outDir.resolve("bscc_0002_b.csv"), ',')).hasSize(2);
  }

  @Test
  public void testInvalidDelimiter() {
    assertThatThrownBy(() -> new CorpusExporter(corpus).saveCsv(tmpDir.resolve("x.csv"), "::"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testSaveJson() throws IOException {
    Path out = tmpDir.resolve("export.json");
    new CorpusExporter(corpus).saveJson(out);
    List<Map<String, Object>> rows = new ObjectMapper().readValue(out.toFile(), ROWS);
    assertThat(rows).hasSize(6);
    assertThat(rows.get(2)).containsEntry("text", "13. Acme Corp").containsEntry("number", "13");
    assertThat(rows.get(1)).containsEntry("category", null);
  }

  @Test
  public void testSaveJsonsPerFile() throws IOException {
    Path outDir = tmpDir.resolve("json");
    new CorpusExporter(corpus).saveJsons(outDir);
    List<Map<String, Object>> rows =
        new ObjectMapper().readValue(outDir.resolve("bscc_0002_b.json").toFile(), ROWS);
    assertThat(rows)
        .extracting(r -> r.get("text"))
        .containsExactly("14. Example Ltd., Hamburg", "München");
  }

  @Test
  public void testSameFileNameInDifferentDirectories() throws IOException {
    ParsedCorpus sameNames = new ParsedCorpus();
    for (String dir : ImmutableList.of("first", "second", "third")) {
      ParsedFile file = new ParsedFile(Paths.get(dir, "x.xml"));
      file.addElement("line_1", dir, ElementType.LINE, ElementPosition.UNKNOWN);
      sameNames.addFile(file);
    }
    ParsedFile suffixed = new ParsedFile(Paths.get("x_2.xml"));
    suffixed.addElement("line_1", "suffixed", ElementType.LINE, ElementPosition.UNKNOWN);
    sameNames.addFile(suffixed);

    Path outDir = tmpDir.resolve("same_names");
    new CorpusExporter(sameNames).saveJsons(outDir);
    ObjectMapper mapper = new ObjectMapper();
    assertThat(mapper.readValue(outDir.resolve("x.json").toFile(), ROWS))
        .extracting(r -> r.get("text"))
        .containsExactly("first");
    assertThat(mapper.readValue(outDir.resolve("x_2.json").toFile(), ROWS))
        .extracting(r -> r.get("text"))
        .containsExactly("second");
    assertThat(mapper.readValue(outDir.resolve("x_3.json").toFile(), ROWS))
        .extracting(r -> r.get("text"))
        .containsExactly("third");
    assertThat(mapper.readValue(outDir.resolve("x_2_2.json").toFile(), ROWS))
        .extracting(r -> r.get("text"))
        .containsExactly("suffixed");

    new CorpusExporter(sameNames).saveCsvs(outDir, ",");
    assertThat(readCsv(outDir.resolve("x_3.csv"), ','))
        .extracting(r -> r.get("text"))
        .containsExactly("third");
  }

  @Test
  public void testAuditIncludesRemovedElements() throws IOException {
    Path out = tmpDir.resolve("audit.json");
    new CorpusExporter(corpus).saveAuditJson(out);
    List<Map<String, Object>> rows = new ObjectMapper().readValue(out.toFile(), ROWS);
    assertThat(rows).hasSize(7);
    Map<String, Object> removed = rows.get(3);
    assertThat(removed)
        .containsEntry("text", "unrelated")
        .containsEntry("removed", true)
        .containsEntry("matched_by", ImmutableList.of("find:^unrelated$"));
    assertThat(rows.get(0)).containsEntry("removed", false);
  }

  @Test
  public void testJsonCanBeReadBack() throws IOException {
    Path out = tmpDir.resolve("full.json");
    new CorpusExporter(corpus, ExportOptions.full()).saveJson(out);
    ParsedCorpus imported = new CorpusImporter().readJson(out);

    assertThat(imported.getFiles()).hasSize(2);
    assertThat(imported.elements()).hasSize(corpus.size());
    for (int i = 0; i < corpus.size(); i++) {
      TextElement original = corpus.elements().get(i);
      TextElement copy = imported.elements().get(i);
      assertThat(copy.getId()).isEqualTo(original.getId());
      assertThat(copy.getText()).isEqualTo(original.getText());
      assertThat(copy.getType()).isEqualTo(original.getType());
      assertThat(copy.getCategory()).isEqualTo(original.getCategory());
      assertThat(copy.getPosition()).isEqualTo(original.getPosition());
      assertThat(copy.getMatchedBy()).isEqualTo(original.getMatchedBy());
    }
  }

  @Test
  public void testImportNeedsFileNames() throws IOException {
    Path out = tmpDir.resolve("plain.json");
    new CorpusExporter(corpus).saveJson(out);
    assertThatThrownBy(() -> new CorpusImporter().readJson(out))
        .isInstanceOf(ModelIntegrityException.class)
        .hasMessageContaining("'file'");
  }

  @Test
  public void testExportDoesNotTouchCorpus() throws IOException {
    new CorpusExporter(corpus, ExportOptions.full()).saveJson(tmpDir.resolve("a.json"));
    assertThat(Files.size(tmpDir.resolve("a.json"))).isPositive();
    assertThat(corpus.size()).isEqualTo(6);
    assertThat(corpus.allElements()).hasSize(7);
  }
}
