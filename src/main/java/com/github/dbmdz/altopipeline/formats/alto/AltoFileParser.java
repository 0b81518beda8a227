package com.github.dbmdz.altopipeline.formats.alto;

import com.github.dbmdz.altopipeline.config.PipelineConfig;
import com.github.dbmdz.altopipeline.formats.OcrFileParser;
import com.github.dbmdz.altopipeline.model.ElementPosition;
import com.github.dbmdz.altopipeline.model.ElementType;
import com.github.dbmdz.altopipeline.model.OcrPage;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.google.common.collect.ImmutableSet;
import java.awt.Dimension;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds text elements from ALTO markup.
 *
 * <p>Lines are made up of the {@code CONTENT} of their {@code String} children, blocks of the text
 * of their lines, both joined with a single space.
 */
public class AltoFileParser extends OcrFileParser {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public static final Set<String> NAMESPACES =
      ImmutableSet.of(
          "http://schema.ccs-gmbh.com/ALTO",
          "http://www.loc.gov/standards/alto/ns-v2#",
          "http://www.loc.gov/standards/alto/ns-v3#",
          "http://www.loc.gov/standards/alto/ns-v4#");

  public AltoFileParser() {
    this(ElementType.LINE);
  }

  public AltoFileParser(ElementType elementType) {
    super(elementType, ".xml");
  }

  public AltoFileParser(ElementType elementType, String fileEnding) {
    super(elementType, fileEnding);
  }

  public AltoFileParser(PipelineConfig config) {
    super(config);
  }

  @Override
  protected void readElements(XMLStreamReader2 xmlReader, ParsedFile file)
      throws XMLStreamException {
    ParseState state = new ParseState(file);
    boolean seenRoot = false;
    while (xmlReader.hasNext()) {
      int event = xmlReader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        if (!seenRoot) {
          checkNamespace(xmlReader, file);
          seenRoot = true;
        }
        handleStart(xmlReader, state);
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        handleEnd(xmlReader.getLocalName(), state);
      }
    }
    if (!seenRoot) {
      throw new XMLStreamException(String.format("%s has no root element", file.getPath()));
    }
    addPending(state);
  }

  private void checkNamespace(XMLStreamReader2 xmlReader, ParsedFile file)
      throws XMLStreamException {
    String namespace = xmlReader.getNamespaceURI();
    if (namespace == null || !NAMESPACES.contains(namespace)) {
      throw new XMLStreamException(
          String.format(
              "%s is not a valid ALTO file, unknown namespace '%s' on root element <%s>",
              file.getPath(), namespace, xmlReader.getLocalName()),
          xmlReader.getLocation());
    }
  }

  private void handleStart(XMLStreamReader2 xmlReader, ParseState state) {
    switch (xmlReader.getLocalName()) {
      case "Page":
        state.currentPage = readPage(xmlReader, state);
        break;
      case "TextBlock":
        state.blockAttributes = readAttributes(xmlReader, state.currentPage);
        state.blockLines = new ArrayList<>();
        break;
      case "TextLine":
        state.lineAttributes = readAttributes(xmlReader, state.currentPage);
        state.lineWords = new ArrayList<>();
        break;
      case "String":
        String content = xmlReader.getAttributeValue("", "CONTENT");
        if (content == null) {
          log.warn("<String> without CONTENT in {}, ignoring it", state.file.getPath());
          break;
        }
        if (state.lineWords != null) {
          state.lineWords.add(content);
        }
        if (elementType == ElementType.WORD) {
          emit(state, ElementType.WORD, readAttributes(xmlReader, state.currentPage), content);
        }
        break;
      default:
        break;
    }
  }

  private void handleEnd(String localName, ParseState state) {
    if ("TextLine".equals(localName) && state.lineWords != null) {
      String lineText = String.join(" ", state.lineWords);
      if (elementType == ElementType.LINE) {
        emit(state, ElementType.LINE, state.lineAttributes, lineText);
      }
      if (state.blockLines != null) {
        state.blockLines.add(lineText);
      }
      state.lineWords = null;
      state.lineAttributes = null;
    } else if ("TextBlock".equals(localName) && state.blockLines != null) {
      if (elementType == ElementType.BLOCK) {
        emit(state, ElementType.BLOCK, state.blockAttributes, String.join(" ", state.blockLines));
      }
      state.blockLines = null;
      state.blockAttributes = null;
    }
  }

  private void emit(ParseState state, ElementType type, Attributes attributes, String text) {
    int ordinal = state.ordinals.merge(type, 1, Integer::sum);
    String id = attributes.id;
    if (id != null && !id.isEmpty()) {
      state.takenIds.add(id);
    } else {
      id = null;
    }
    state.pending.add(new PendingElement(type, ordinal, id, text, attributes.position));
  }

  /**
   * Add the elements of the file in document order. Elements without an ID are named after their
   * type and ordinal, skipping names taken by a real ID anywhere in the file.
   */
  private static void addPending(ParseState state) {
    for (PendingElement element : state.pending) {
      String id = element.id;
      if (id == null) {
        int ordinal = element.ordinal;
        id = syntheticId(element.type, ordinal);
        while (state.takenIds.contains(id)) {
          ordinal++;
          id = syntheticId(element.type, ordinal);
        }
        state.takenIds.add(id);
      }
      state.file.addElement(id, sanitizeText(element.text), element.type, element.position);
    }
  }

  private static String syntheticId(ElementType type, int ordinal) {
    return String.format("%s_%d", type.name().toLowerCase(), ordinal);
  }

  private OcrPage readPage(XMLStreamReader2 xmlReader, ParseState state) {
    state.pageCount++;
    String id = xmlReader.getAttributeValue("", "ID");
    if (id == null || id.isEmpty()) {
      id = String.format("page_%d", state.pageCount);
    }
    Float width = parseDimension(xmlReader, "WIDTH");
    Float height = parseDimension(xmlReader, "HEIGHT");
    Dimension dims = null;
    if (width != null && height != null) {
      dims = new Dimension(width.intValue(), height.intValue());
    }
    return new OcrPage(id, dims);
  }

  private Attributes readAttributes(XMLStreamReader2 xmlReader, OcrPage page) {
    Float hpos = parseDimension(xmlReader, "HPOS");
    Float vpos = parseDimension(xmlReader, "VPOS");
    Float width = parseDimension(xmlReader, "WIDTH");
    Float height = parseDimension(xmlReader, "HEIGHT");
    if (hpos == null || vpos == null || width == null || height == null) {
      log.debug(
          "Incomplete coordinates encountered on <{}>: 'HPOS={}, VPOS={}, WIDTH={}, HEIGHT={}'",
          xmlReader.getLocalName(),
          hpos,
          vpos,
          width,
          height);
    }
    return new Attributes(
        xmlReader.getAttributeValue("", "ID"),
        ElementPosition.fromAlto(
            page, hpos, vpos, width, height, xmlReader.getAttributeValue("", "BASELINE")));
  }

  private static Float parseDimension(XMLStreamReader2 xmlReader, String name) {
    String value = xmlReader.getAttributeValue("", name);
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return Float.parseFloat(value);
    } catch (NumberFormatException e) {
      log.warn("Ignoring malformed {} value '{}' on <{}>", name, value, xmlReader.getLocalName());
      return null;
    }
  }

  private static class Attributes {
    final String id;
    final ElementPosition position;

    Attributes(String id, ElementPosition position) {
      this.id = id;
      this.position = position;
    }
  }

  private static class PendingElement {
    final ElementType type;
    final int ordinal;
    final String id;
    final String text;
    final ElementPosition position;

    PendingElement(
        ElementType type, int ordinal, String id, String text, ElementPosition position) {
      this.type = type;
      this.ordinal = ordinal;
      this.id = id;
      this.text = text;
      this.position = position;
    }
  }

  /** Mutable state while walking a single file. */
  private static class ParseState {
    final ParsedFile file;
    final Map<ElementType, Integer> ordinals = new EnumMap<>(ElementType.class);
    final List<PendingElement> pending = new ArrayList<>();
    final Set<String> takenIds = new HashSet<>();
    int pageCount = 0;
    OcrPage currentPage;
    Attributes blockAttributes;
    List<String> blockLines;
    Attributes lineAttributes;
    List<String> lineWords;

    ParseState(ParsedFile file) {
      this.file = file;
    }
  }
}
