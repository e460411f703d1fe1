package org.allenai.academicreader;

import org.allenai.academicreader.pdfapi.TextBlock;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Test
public class ReadingOrderTest {
  private static TextBlock block(final String text, final float x0, final float y0, final float x1) {
    return TextBlock.of(text, x0, y0, x1, y0 + 20, 0, 0);
  }

  private static List<String> texts(final List<TextBlock> blocks) {
    return blocks.stream().map(TextBlock::getText).collect(Collectors.toList());
  }

  public void testPageWidthSixHundredExample() {
    final TextBlock a = block("A", 10, 10, 190);
    final TextBlock b = block("B", 400, 10, 600);
    final TextBlock c = block("C", 10, 50, 190);
    Assert.assertEquals(texts(ReadingOrder.sort(Arrays.asList(c, a, b))), Arrays.asList("A", "B", "C"));
  }

  public void testTwoColumnMergePicksSmallerTopAtEachStep() {
    final List<TextBlock> blocks = Arrays.asList(
      block("L1", 10, 100, 280),
      block("L2", 10, 300, 280),
      block("R1", 420, 50, 600),
      block("R2", 420, 200, 600),
      block("R3", 420, 400, 600));
    Assert.assertEquals(
      texts(ReadingOrder.sort(blocks)),
      Arrays.asList("R1", "L1", "R2", "L2", "R3"));
  }

  public void testLeftColumnWinsTies() {
    final List<TextBlock> blocks = Arrays.asList(
      block("R", 420, 10, 600),
      block("L", 10, 10, 280));
    Assert.assertEquals(texts(ReadingOrder.sort(blocks)), Arrays.asList("L", "R"));
  }

  public void testRemainderOfLongerColumnIsAppended() {
    final List<TextBlock> blocks = Arrays.asList(
      block("L1", 10, 10, 280),
      block("L2", 10, 20, 280),
      block("L3", 10, 30, 280),
      block("R1", 420, 15, 600));
    Assert.assertEquals(texts(ReadingOrder.sort(blocks)), Arrays.asList("L1", "R1", "L2", "L3"));
  }

  public void testSingleColumnSortsTopToBottom() {
    final List<TextBlock> blocks = Arrays.asList(
      block("third", 50, 300, 550),
      block("first", 50, 10, 550),
      block("second", 60, 100, 550));
    Assert.assertEquals(texts(ReadingOrder.sort(blocks)), Arrays.asList("first", "second", "third"));
  }

  public void testMiddleThirdBlocksAreLeftOutOfTwoColumnOrder() {
    final List<TextBlock> blocks = Arrays.asList(
      block("left", 10, 10, 180),
      block("middle", 250, 5, 350),
      block("right", 420, 10, 600));
    Assert.assertEquals(texts(ReadingOrder.sort(blocks)), Arrays.asList("left", "right"));
  }

  public void testEmptyPage() {
    Assert.assertTrue(ReadingOrder.sort(Collections.emptyList()).isEmpty());
  }
}
