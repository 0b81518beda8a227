package com.github.dbmdz.altopipeline.model;

import java.awt.Dimension;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/* Identifier and size of a given OCR page */
public class OcrPage implements Comparable<OcrPage> {
  public final String id;
  public final Dimension dimensions;

  public OcrPage(String id, Dimension dimensions) {
    Objects.requireNonNull(id, "Pages need to have an identifier, check your source files!");
    this.id = id;
    this.dimensions = dimensions;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("page", id);
    if (dimensions != null) {
      map.put("page_width", dimensions.width);
      map.put("page_height", dimensions.height);
    }
    return map;
  }

  @Override
  public int compareTo(OcrPage o) {
    return this.id.compareTo(o.id);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    OcrPage ocrPage = (OcrPage) o;
    return id.equals(ocrPage.id) && Objects.equals(dimensions, ocrPage.dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, dimensions);
  }

  @Override
  public String toString() {
    String size = dimensions != null ? ", " + dimensions.width + "x" + dimensions.height : "";
    return "OcrPage{" + id + size + "}";
  }
}
