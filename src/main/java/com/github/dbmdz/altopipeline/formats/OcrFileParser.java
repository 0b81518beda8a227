package com.github.dbmdz.altopipeline.formats;

import com.ctc.wstx.stax.WstxInputFactory;
import com.github.dbmdz.altopipeline.config.PipelineConfig;
import com.github.dbmdz.altopipeline.model.ElementType;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.google.common.collect.ImmutableList;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.xml.stream.XMLStreamException;
import org.apache.commons.lang3.StringUtils;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base class for parsers that build {@link ParsedFile}s from OCR markup. */
public abstract class OcrFileParser {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final WstxInputFactory xmlInputFactory = new WstxInputFactory();

  static {
    // Woodstox sometimes splits long text nodes, this option forces it to merge them together
    // before passing them to us
    xmlInputFactory.getConfig().doCoalesceText(true);
    // Ignore DTDs since they cause lookups to external URLs
    xmlInputFactory.getConfig().doSupportDTDs(false);
  }

  protected final ElementType elementType;
  private final String fileEnding;
  private final Map<String, String> metaData = new LinkedHashMap<>();
  private Pattern fileNamePattern;
  private List<String> fileNameValueNames = ImmutableList.of();

  protected OcrFileParser(ElementType elementType, String fileEnding) {
    this.elementType = elementType;
    this.fileEnding = fileEnding;
  }

  /** Apply the parsing and file metadata settings from a configuration. */
  protected OcrFileParser(PipelineConfig config) {
    this(ElementType.fromName(config.lineType), config.fileEnding);
    config.metaData.forEach(this::withMetaData);
    if (config.fileNameStructure != null) {
      this.withFileNameStructure(
          config.fileNameStructure.pattern, config.fileNameStructure.valueNames);
    }
  }

  /** Add a static metadata value to every file parsed from now on. */
  public OcrFileParser withMetaData(String name, String value) {
    this.metaData.put(name, value);
    return this;
  }

  /**
   * Extract metadata from the file names, each group of {@code pattern} is stored under the value
   * name at the same position.
   */
  public OcrFileParser withFileNameStructure(String pattern, List<String> valueNames) {
    this.fileNamePattern = Pattern.compile(pattern);
    this.fileNameValueNames = ImmutableList.copyOf(valueNames);
    return this;
  }

  public ElementType getElementType() {
    return elementType;
  }

  /** Parse all files with the configured ending in {@code directory}, sorted by their name. */
  public ParsedCorpus parseDirectory(Path directory) throws IOException, XMLStreamException {
    if (!Files.isDirectory(directory)) {
      throw new IOException(String.format("%s is not a directory", directory));
    }
    List<Path> paths;
    try (Stream<Path> listing = Files.list(directory)) {
      paths =
          listing
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().endsWith(fileEnding))
              .sorted()
              .collect(Collectors.toList());
    }
    log.info("Found {} files ending in '{}' in {}", paths.size(), fileEnding, directory);
    return parse(paths);
  }

  public ParsedCorpus parse(Collection<Path> paths) throws IOException, XMLStreamException {
    ParsedCorpus corpus = new ParsedCorpus();
    for (Path path : paths) {
      addTo(corpus, path);
    }
    log.info("Parsed {} text elements from {} files", corpus.size(), paths.size());
    return corpus;
  }

  public ParsedFile addTo(ParsedCorpus corpus, Path path) throws IOException, XMLStreamException {
    ParsedFile file = parse(path);
    corpus.addFile(file);
    return file;
  }

  /** Parse a file, the encoding is taken from its XML declaration and defaults to UTF-8. */
  public ParsedFile parse(Path path) throws IOException, XMLStreamException {
    try (InputStream input = new BufferedInputStream(Files.newInputStream(path))) {
      return read(path, (XMLStreamReader2) xmlInputFactory.createXMLStreamReader(input));
    }
  }

  /**
   * Parse the markup from {@code input}, {@code path} only serves as the identity of the file and
   * as the source for file name metadata.
   */
  public ParsedFile parse(Path path, Reader input) throws XMLStreamException {
    return read(path, (XMLStreamReader2) xmlInputFactory.createXMLStreamReader(input));
  }

  private ParsedFile read(Path path, XMLStreamReader2 xmlReader) throws XMLStreamException {
    ParsedFile file = new ParsedFile(path);
    try {
      readElements(xmlReader, file);
    } finally {
      xmlReader.close();
    }
    metaData.forEach(file::addMetaData);
    addFileNameMetaData(file);
    log.debug(
        "Parsed {} elements of type {} from {}", file.getElements().size(), elementType, path);
    return file;
  }

  private void addFileNameMetaData(ParsedFile file) {
    if (fileNamePattern == null) {
      return;
    }
    String fileName = file.getPath().getFileName().toString();
    Matcher m = fileNamePattern.matcher(fileName);
    if (m.find() && m.groupCount() == fileNameValueNames.size()) {
      for (int i = 0; i < fileNameValueNames.size(); i++) {
        file.addMetaData(fileNameValueNames.get(i), m.group(i + 1));
      }
    } else {
      log.warn("The file name structure does not match the file name of '{}'", file.getPath());
    }
  }

  /**
   * Read all text elements from the markup into {@code file}.
   *
   * <p>Implementers should only emit elements of the parser's {@link #elementType}.
   */
  protected abstract void readElements(XMLStreamReader2 xmlReader, ParsedFile file)
      throws XMLStreamException;

  /** Remove line breaks, tabs, carriage returns and byte order marks, then trim. */
  public static String sanitizeText(String text) {
    if (text == null) {
      return "";
    }
    return StringUtils.strip(StringUtils.replaceChars(text, "\n\r\t\uFEFF", null));
  }
}
