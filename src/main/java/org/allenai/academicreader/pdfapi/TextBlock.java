package org.allenai.academicreader.pdfapi;

import com.gs.collections.api.list.primitive.FloatList;
import com.gs.collections.impl.list.mutable.primitive.FloatArrayList;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable value class for one block of text on a page, as the document engine hands it out.
 * A block is a run of lines the engine considers a unit (a paragraph, a heading, a caption).
 */
@Builder
@Value
public class TextBlock {
  public final String text;
  /**
   * List of floats [x0, y0, x1, y1] where [0,0] is upper left
   */
  public final FloatList bounds;
  public final int blockIndex;
  public final int pageIndex;

  public float x0() {
    return bounds.get(0);
  }

  public float y0() {
    return bounds.get(1);
  }

  public float x1() {
    return bounds.get(2);
  }

  public float y1() {
    return bounds.get(3);
  }

  public static TextBlock of(String text, float x0, float y0, float x1, float y1, int blockIndex, int pageIndex) {
    return TextBlock.builder()
      .text(text)
      .bounds(FloatArrayList.newListWith(x0, y0, x1, y1))
      .blockIndex(blockIndex)
      .pageIndex(pageIndex)
      .build();
  }
}
