package org.allenai.academicreader;

import org.allenai.academicreader.pdfapi.TextBlock;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Puts a page's blocks into reading order. Handles at most two columns; anything with more
 * columns comes out top to bottom.
 */
public class ReadingOrder {
  private static final Comparator<TextBlock> BY_TOP = Comparator.comparingDouble(TextBlock::y0);

  /**
   * Page width is taken to be the largest right edge of any block. Blocks starting in the left
   * third form the left column, blocks starting in the right third the right column. When both
   * columns are populated they are merged by top edge, left column first on ties. Blocks that
   * start in the middle third of a two-column page belong to neither column and are not returned.
   * Otherwise all blocks are sorted by top edge. Sorting is stable.
   */
  public static List<TextBlock> sort(final List<TextBlock> blocks) {
    if (blocks.isEmpty())
      return new ArrayList<>(blocks);

    final double pageWidth = blocks.stream().mapToDouble(TextBlock::x1).max().getAsDouble();
    final double leftThird = pageWidth / 3;
    final double rightThird = 2 * pageWidth / 3;

    final List<TextBlock> left = blocks.stream()
      .filter(b -> b.x0() < leftThird)
      .sorted(BY_TOP)
      .collect(Collectors.toList());
    final List<TextBlock> right = blocks.stream()
      .filter(b -> b.x0() > rightThird)
      .sorted(BY_TOP)
      .collect(Collectors.toList());

    if (left.isEmpty() || right.isEmpty()) {
      final List<TextBlock> out = new ArrayList<>(blocks);
      out.sort(BY_TOP);
      return out;
    }

    final List<TextBlock> out = new ArrayList<>(left.size() + right.size());
    int l = 0;
    int r = 0;
    while (l < left.size() && r < right.size()) {
      if (right.get(r).y0() < left.get(l).y0())
        out.add(right.get(r++));
      else
        out.add(left.get(l++));
    }
    out.addAll(left.subList(l, left.size()));
    out.addAll(right.subList(r, right.size()));
    return out;
  }
}
