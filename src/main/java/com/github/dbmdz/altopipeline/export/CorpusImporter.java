package com.github.dbmdz.altopipeline.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dbmdz.altopipeline.model.ElementPosition;
import com.github.dbmdz.altopipeline.model.ElementType;
import com.github.dbmdz.altopipeline.model.ModelIntegrityException;
import com.github.dbmdz.altopipeline.model.OcrPage;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.model.TextElement;
import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON export back into a corpus.
 *
 * <p>The export needs to have been written with file names and attributes. Text, category,
 * position and the matched-by trail are restored, values recorded by the pipeline and file
 * metadata are not, since they can't be told apart in the flat rows.
 */
public class CorpusImporter {
  private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE =
      new TypeReference<List<Map<String, Object>>>() {};

  private final ObjectMapper mapper = new ObjectMapper();

  public ParsedCorpus readJson(Path path) throws IOException {
    List<Map<String, Object>> rows = mapper.readValue(path.toFile(), ROWS_TYPE);
    Map<String, ParsedFile> files = new LinkedHashMap<>();
    int rowIdx = 0;
    for (Map<String, Object> row : rows) {
      String fileName = requireString(row, CorpusExporter.FILE, rowIdx, path);
      ParsedFile file = files.computeIfAbsent(fileName, f -> new ParsedFile(Paths.get(f)));
      TextElement element =
          file.addElement(
              requireString(row, CorpusExporter.ID, rowIdx, path),
              requireString(row, CorpusExporter.TEXT, rowIdx, path),
              row.containsKey(CorpusExporter.TYPE)
                  ? ElementType.valueOf((String) row.get(CorpusExporter.TYPE))
                  : ElementType.LINE,
              readPosition(row));
      Object category = row.get(CorpusExporter.CATEGORY);
      if (category != null) {
        element.setCategory(category.toString());
      }
      Object matchedBy = row.get(CorpusExporter.MATCHED_BY);
      if (matchedBy instanceof List) {
        ((List<?>) matchedBy).forEach(op -> element.addMatchedBy(String.valueOf(op)));
      }
      rowIdx++;
    }
    ParsedCorpus corpus = new ParsedCorpus();
    files.values().forEach(corpus::addFile);
    return corpus;
  }

  private static ElementPosition readPosition(Map<String, Object> row) {
    OcrPage page = null;
    Object pageId = row.get("page");
    if (pageId != null) {
      Float width = readFloat(row, "page_width");
      Float height = readFloat(row, "page_height");
      Dimension dims = null;
      if (width != null && height != null) {
        dims = new Dimension(width.intValue(), height.intValue());
      }
      page = new OcrPage(pageId.toString(), dims);
    }
    Object baseline = row.get("baseline");
    return ElementPosition.fromAlto(
        page,
        readFloat(row, "hpos"),
        readFloat(row, "vpos"),
        readFloat(row, "width"),
        readFloat(row, "height"),
        baseline != null ? baseline.toString() : null);
  }

  private static Float readFloat(Map<String, Object> row, String key) {
    Object value = row.get(key);
    if (value instanceof Number) {
      return ((Number) value).floatValue();
    }
    if (value instanceof String && !((String) value).isEmpty()) {
      return Float.parseFloat((String) value);
    }
    return null;
  }

  private static String requireString(Map<String, Object> row, String key, int rowIdx, Path path) {
    Object value = row.get(key);
    if (value == null) {
      throw new ModelIntegrityException(
          String.format("Row %d of %s has no '%s'", rowIdx, path, key));
    }
    return value.toString();
  }
}
