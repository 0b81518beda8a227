package com.github.dbmdz.altopipeline.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Geometry of a text element on its page.
 *
 * <p>Coordinates are stored as upper-left/lower-right corners, a value of {@code -1} marks a
 * coordinate that was missing from the source. The pipeline never interprets any of this, it is
 * carried through to the export unchanged.
 */
public class ElementPosition {
  public static final ElementPosition UNKNOWN = new ElementPosition(null, -1, -1, -1, -1, null);

  private final OcrPage page;
  private final float ulx;
  private final float uly;
  private final float lrx;
  private final float lry;
  private final String baseline;

  public ElementPosition(
      OcrPage page, float ulx, float uly, float lrx, float lry, String baseline) {
    this.page = page;
    this.ulx = ulx;
    this.uly = uly;
    this.lrx = lrx;
    this.lry = lry;
    this.baseline = baseline;
  }

  /** Build a position from ALTO-style offset and extent values. */
  public static ElementPosition fromAlto(
      OcrPage page, Float hpos, Float vpos, Float width, Float height, String baseline) {
    float ulx = hpos != null ? hpos : -1;
    float uly = vpos != null ? vpos : -1;
    float lrx = hpos != null && width != null ? hpos + width : -1;
    float lry = vpos != null && height != null ? vpos + height : -1;
    return new ElementPosition(page, ulx, uly, lrx, lry, baseline);
  }

  private static void addDimension(Map<String, Object> map, String name, float val) {
    if (val < 0) {
      return;
    }
    if (val == Math.rint(val)) {
      map.put(name, (int) val);
    } else {
      map.put(name, val);
    }
  }

  /** Flat representation with ALTO attribute semantics, as used by the exporters. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (page != null) {
      map.putAll(page.toMap());
    }
    addDimension(map, "hpos", ulx);
    addDimension(map, "vpos", uly);
    if (ulx >= 0 && lrx >= 0) {
      addDimension(map, "width", getWidth());
    }
    if (uly >= 0 && lry >= 0) {
      addDimension(map, "height", getHeight());
    }
    if (baseline != null) {
      map.put("baseline", baseline);
    }
    return map;
  }

  public OcrPage getPage() {
    return page;
  }

  public float getUlx() {
    return ulx;
  }

  public float getUly() {
    return uly;
  }

  public float getLrx() {
    return lrx;
  }

  public float getLry() {
    return lry;
  }

  public float getWidth() {
    return lrx - ulx;
  }

  public float getHeight() {
    return lry - uly;
  }

  public String getBaseline() {
    return baseline;
  }

  public boolean isComplete() {
    return ulx >= 0 && uly >= 0 && lrx >= 0 && lry >= 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ElementPosition that = (ElementPosition) o;
    return Float.compare(that.ulx, ulx) == 0
        && Float.compare(that.uly, uly) == 0
        && Float.compare(that.lrx, lrx) == 0
        && Float.compare(that.lry, lry) == 0
        && Objects.equals(page, that.page)
        && Objects.equals(baseline, that.baseline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(page, ulx, uly, lrx, lry, baseline);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("ElementPosition{");
    if (this.page != null) {
      sb.append("pageId='").append(page.id).append("', ");
    }
    sb.append("ulx=").append(ulx);
    sb.append(", uly=").append(uly);
    sb.append(", lrx=").append(lrx);
    sb.append(", lry=").append(lry);
    if (this.baseline != null) {
      sb.append(", baseline='").append(baseline).append('\'');
    }
    sb.append('}');
    return sb.toString();
  }
}
