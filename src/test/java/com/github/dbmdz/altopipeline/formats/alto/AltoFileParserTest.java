package com.github.dbmdz.altopipeline.formats.alto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.github.dbmdz.altopipeline.config.PipelineConfig;
import com.github.dbmdz.altopipeline.formats.OcrFileParser;
import com.github.dbmdz.altopipeline.model.ElementType;
import com.github.dbmdz.altopipeline.model.ModelIntegrityException;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.model.TextElement;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.xml.stream.XMLStreamException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class AltoFileParserTest {
  private static final Path DATA = Paths.get("src/test/resources/data");
  private static final Path FIRST = DATA.resolve("alto/bscc_0001_a.xml");
  private static final Path SECOND = DATA.resolve("alto/bscc_0002_b.xml");

  @Test
  public void testParseLines() throws IOException, XMLStreamException {
    ParsedFile file = new AltoFileParser().parse(FIRST);
    assertThat(file.getElements())
        .extracting(TextElement::getText)
        .containsExactly(
            "12. Acme & Cie.", "Berlin W 8.", "13. Acme Corp", "unrelated", "° Hamburg");
    assertThat(file.getElements())
        .extracting(TextElement::getId)
        .containsExactly("TL1", "TL2", "TL3", "TL4", "TL5");
    assertThat(file.getElements()).allMatch(e -> e.getType() == ElementType.LINE);
    assertThat(file.getElements()).allMatch(e -> e.getSourceFile() == file);
  }

  @Test
  public void testParseBlocks() throws IOException, XMLStreamException {
    ParsedFile file = new AltoFileParser(ElementType.BLOCK).parse(FIRST);
    assertThat(file.getElements())
        .extracting(TextElement::getText)
        .containsExactly("12. Acme & Cie. Berlin W 8.", "13. Acme Corp unrelated ° Hamburg");
    assertThat(file.getElements()).extracting(TextElement::getId).containsExactly("TB1", "TB2");
  }

  @Test
  public void testParseWords() throws IOException, XMLStreamException {
    ParsedFile file = new AltoFileParser(ElementType.WORD).parse(FIRST);
    assertThat(file.getElements()).hasSize(13);
    assertThat(file.getElements().get(3).getText()).isEqualTo("Cie.");
    assertThat(file.getElements().get(3).getId()).isEqualTo("S4");
    assertThat(file.getElements().get(3).getPosition().toMap())
        .containsEntry("hpos", 430)
        .containsEntry("width", 150);
  }

  @Test
  public void testPositionsAndPages() throws IOException, XMLStreamException {
    ParsedFile file = new AltoFileParser().parse(FIRST);
    TextElement line = file.getElement("TL1").get();
    assertThat(line.getPosition().getPage().id).isEqualTo("P1");
    assertThat(line.getPosition().getPage().dimensions)
        .hasFieldOrPropertyWithValue("width", 2000.0)
        .hasFieldOrPropertyWithValue("height", 3000.0);
    assertThat(line.getPosition().toMap())
        .containsEntry("page", "P1")
        .containsEntry("hpos", 100)
        .containsEntry("vpos", 100)
        .containsEntry("width", 800)
        .containsEntry("height", 50)
        .containsEntry("baseline", "150");
  }

  @Test
  public void testMissingIdsAndMalformedValues() throws IOException, XMLStreamException {
    ParsedFile file = new AltoFileParser().parse(SECOND);
    assertThat(file.getElements())
        .extracting(TextElement::getId)
        .containsExactly("line_1", "line_2");
    assertThat(file.getElements())
        .extracting(TextElement::getText)
        .containsExactly("14. Example Ltd., Hamburg", "München");
    TextElement second = file.getElement("line_2").get();
    assertThat(second.getPosition().isComplete()).isFalse();
    assertThat(second.getPosition().toMap())
        .containsEntry("page_width", 1800)
        .containsEntry("vpos", 140)
        .doesNotContainKey("width");
  }

  @Test
  public void testFromReaderWithOldNamespace() throws XMLStreamException {
    String alto =
        "<alto xmlns=\"http://schema.ccs-gmbh.com/ALTO\"><Layout><Page>"
            + "<TextBlock><TextLine><String CONTENT=\"Hotel\"/><String CONTENT=\"Berlin\"/>"
            + "</TextLine></TextBlock></Page></Layout></alto>";
    ParsedFile file = new AltoFileParser().parse(Paths.get("inline.xml"), new StringReader(alto));
    assertThat(file.getElements()).hasSize(1);
    TextElement line = file.getElements().get(0);
    assertThat(line.getText()).isEqualTo("Hotel Berlin");
    assertThat(line.getId()).isEqualTo("line_1");
    assertThat(line.getPosition().getPage().id).isEqualTo("page_1");
    assertThat(line.getPosition().getPage().dimensions).isNull();
  }

  private static ParsedFile parseLines(String lines) throws XMLStreamException {
    String alto =
        "<alto xmlns=\"http://www.loc.gov/standards/alto/ns-v3#\"><Layout><Page ID=\"P1\">"
            + "<TextBlock ID=\"B1\">"
            + lines
            + "</TextBlock></Page></Layout></alto>";
    return new AltoFileParser().parse(Paths.get("ids.xml"), new StringReader(alto));
  }

  @Test
  public void testGeneratedIdsSkipLaterIds() throws XMLStreamException {
    ParsedFile file =
        parseLines(
            "<TextLine><String CONTENT=\"first\"/></TextLine>"
                + "<TextLine ID=\"line_1\"><String CONTENT=\"second\"/></TextLine>");
    assertThat(file.getElements())
        .extracting(TextElement::getId)
        .containsExactly("line_2", "line_1");
    assertThat(file.getElement("line_1").get().getText()).isEqualTo("second");
  }

  @Test
  public void testGeneratedIdsSkipEarlierIds() throws XMLStreamException {
    ParsedFile file =
        parseLines(
            "<TextLine ID=\"line_2\"><String CONTENT=\"first\"/></TextLine>"
                + "<TextLine><String CONTENT=\"second\"/></TextLine>"
                + "<TextLine><String CONTENT=\"third\"/></TextLine>");
    assertThat(file.getElements())
        .extracting(TextElement::getId)
        .containsExactly("line_2", "line_3", "line_4");
  }

  @Test
  public void testDeclaredEncoding(@TempDir Path tempDir) throws IOException, XMLStreamException {
    String alto =
        "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>"
            + "<alto xmlns=\"http://www.loc.gov/standards/alto/ns-v2#\"><Layout><Page>"
            + "<TextBlock><TextLine><String CONTENT=\"München\"/></TextLine></TextBlock>"
            + "</Page></Layout></alto>";
    Path path = tempDir.resolve("latin1.xml");
    Files.write(path, alto.getBytes(StandardCharsets.ISO_8859_1));
    ParsedFile file = new AltoFileParser().parse(path);
    assertThat(file.getElements()).extracting(TextElement::getText).containsExactly("München");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "http://schema.ccs-gmbh.com/ALTO",
        "http://www.loc.gov/standards/alto/ns-v2#",
        "http://www.loc.gov/standards/alto/ns-v3#",
        "http://www.loc.gov/standards/alto/ns-v4#"
      })
  public void testSupportedNamespaces(String namespace) throws XMLStreamException {
    String alto =
        "<alto xmlns=\"" + namespace + "\"><Layout><Page ID=\"P1\"><PrintSpace><TextBlock>"
            + "<TextLine ID=\"L1\"><String CONTENT=\"Acme\"/></TextLine>"
            + "</TextBlock></PrintSpace></Page></Layout></alto>";
    ParsedFile file = new AltoFileParser().parse(Paths.get("ns.xml"), new StringReader(alto));
    assertThat(file.getElements()).extracting(TextElement::getText).containsExactly("Acme");
  }

  @Test
  public void testRejectsUnqualifiedRoot() {
    assertThatThrownBy(
            () ->
                new AltoFileParser()
                    .parse(Paths.get("plain.xml"), new StringReader("<alto><Layout/></alto>")))
        .isInstanceOf(XMLStreamException.class)
        .hasMessageContaining("not a valid ALTO file");
  }

  @Test
  public void testRejectsForeignNamespace() {
    assertThatThrownBy(() -> new AltoFileParser().parse(DATA.resolve("not_alto.xml")))
        .isInstanceOf(XMLStreamException.class)
        .hasMessageContaining("not a valid ALTO file");
  }

  @Test
  public void testRejectsDuplicateIds() {
    assertThatThrownBy(() -> new AltoFileParser().parse(DATA.resolve("duplicate_ids.xml")))
        .isInstanceOf(ModelIntegrityException.class)
        .hasMessageContaining("L1");
  }

  @Test
  public void testParseDirectoryWithMetadata() throws IOException, XMLStreamException {
    OcrFileParser parser =
        new AltoFileParser()
            .withMetaData("title", "Some title")
            .withFileNameStructure("bscc_(\\d{4})_([a-z0-9]*)", ImmutableList.of("page", "part"));
    ParsedCorpus corpus = parser.parseDirectory(DATA.resolve("alto"));
    assertThat(corpus.getFiles())
        .extracting(f -> f.getPath().getFileName().toString())
        .containsExactly("bscc_0001_a.xml", "bscc_0002_b.xml");
    assertThat(corpus.size()).isEqualTo(7);
    ParsedFile first = corpus.getFile(FIRST).get();
    assertThat(first.getMetaData())
        .containsEntry("title", "Some title")
        .containsEntry("page", "0001")
        .containsEntry("part", "a");
  }

  @Test
  public void testParseDirectoryNeedsDirectory() {
    assertThatThrownBy(() -> new AltoFileParser().parseDirectory(FIRST))
        .isInstanceOf(IOException.class);
  }

  @Test
  public void testConfiguredParser() throws IOException, XMLStreamException {
    PipelineConfig config = new PipelineConfig();
    config.lineType = "TextBlock";
    config.metaData.put("year", "1951");
    ParsedFile file = new AltoFileParser(config).parse(FIRST);
    assertThat(file.getElements()).hasSize(2);
    assertThat(file.getMetaData()).containsExactly(entry("year", "1951"));
  }

  @Test
  public void testSanitizeText() {
    assertThat(OcrFileParser.sanitizeText("\uFEFF Acme\t&\nCie. \r")).isEqualTo("Acme&Cie.");
    assertThat(OcrFileParser.sanitizeText(null)).isEmpty();
  }
}
