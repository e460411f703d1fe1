package org.allenai.academicreader.pdfapi;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One page of blocks in the order the engine produced them, which is not necessarily reading order.
 */
@Builder
@Data
public class PDFPage {
  public final List<TextBlock> blocks;
  public final int pageIndex;
}
