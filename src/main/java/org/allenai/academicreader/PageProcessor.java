package org.allenai.academicreader;

import org.allenai.academicreader.pdfapi.PDFPage;
import org.allenai.academicreader.pdfapi.TextBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one {@link PDFPage} of engine blocks into a {@link ProcessedPage}: blocks are put in
 * reading order, then each block has its formulas isolated and its text normalized, in that order.
 */
public class PageProcessor {
  private final MathFormulaIsolator mathIsolator;
  private final TextNormalizer normalizer;

  public PageProcessor(final MathFormulaIsolator mathIsolator, final TextNormalizer normalizer) {
    this.mathIsolator = mathIsolator;
    this.normalizer = normalizer;
  }

  public ProcessedPage process(final PDFPage page) {
    final List<TextBlock> blocks = page.getBlocks();
    final List<String> formulas = new ArrayList<>();
    final StringBuilder sb = new StringBuilder();
    for (final TextBlock block : ReadingOrder.sort(blocks)) {
      final String isolated = mathIsolator.isolate(block.getText(), formulas);
      final String cleaned = normalizer.normalize(isolated);
      if (cleaned.isEmpty())
        continue;
      if (sb.length() > 0)
        sb.append("\n\n");
      sb.append(cleaned);
    }
    return ProcessedPage.builder()
      .pageNumber(page.getPageIndex())
      .processedText(sb.toString())
      .mathFormulas(formulas)
      .blockCount(blocks.size())
      .build();
  }
}
