package org.allenai.academicreader;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page after reading-order reconstruction, formula isolation and normalization. Blocks are
 * separated by a blank line in {@code processedText}.
 */
@Builder
@Value
public class ProcessedPage {
  int pageNumber;
  String processedText;
  List<String> mathFormulas;
  int blockCount;
}
