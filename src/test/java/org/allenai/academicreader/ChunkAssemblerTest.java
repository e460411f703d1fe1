package org.allenai.academicreader;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Test
public class ChunkAssemblerTest {
  private static final String S1 = "This is sentence 01.";
  private static final String S2 = "This is sentence 02.";
  private static final String S3 = "This is sentence 03.";
  private static final String S4 = "This is sentence 04.";
  private static final String S5 = "This is sentence 05.";

  private static ProcessedPage page(final int number, final String text) {
    return ProcessedPage.builder()
      .pageNumber(number)
      .processedText(text)
      .mathFormulas(Collections.emptyList())
      .blockCount(1)
      .build();
  }

  public void testChunksSpanPages() {
    final List<Chunk> chunks = new ChunkAssembler(50).assemble(Arrays.asList(
      page(0, S1 + " " + S2 + " " + S3),
      page(1, S4 + "\n\n" + S5)));
    Assert.assertEquals(chunks.size(), 3);

    Assert.assertEquals(chunks.get(0).getChunkId(), 0);
    Assert.assertEquals(chunks.get(0).getText(), S1 + " " + S2);
    Assert.assertEquals(chunks.get(0).getPageStart(), 0);
    Assert.assertEquals(chunks.get(0).getPageEnd(), 0);
    Assert.assertEquals(chunks.get(0).getWordCount(), 8);

    Assert.assertEquals(chunks.get(1).getChunkId(), 1);
    Assert.assertEquals(chunks.get(1).getText(), S3 + " " + S4);
    Assert.assertEquals(chunks.get(1).getPageStart(), 0);
    Assert.assertEquals(chunks.get(1).getPageEnd(), 1);

    Assert.assertEquals(chunks.get(2).getChunkId(), 2);
    Assert.assertEquals(chunks.get(2).getText(), S5);
    Assert.assertEquals(chunks.get(2).getPageStart(), 1);
    Assert.assertEquals(chunks.get(2).getPageEnd(), 1);
  }

  public void testChunkClosedByNextPageEndsOnThatPage() {
    final List<Chunk> chunks = new ChunkAssembler(25).assemble(Arrays.asList(
      page(0, "First sentence on zero."),
      page(1, "Second sentence on one.")));
    Assert.assertEquals(chunks.size(), 2);
    Assert.assertEquals(chunks.get(0).getText(), "First sentence on zero.");
    Assert.assertEquals(chunks.get(0).getPageStart(), 0);
    Assert.assertEquals(chunks.get(0).getPageEnd(), 1);
    Assert.assertEquals(chunks.get(1).getPageStart(), 1);
    Assert.assertEquals(chunks.get(1).getPageEnd(), 1);
  }

  public void testOversizedSentenceStandsAlone() {
    final String longSentence = "This sentence is deliberately far longer than thirty characters.";
    final List<Chunk> chunks = new ChunkAssembler(30).assemble(Collections.singletonList(
      page(0, "Short one. " + longSentence + " Tail.")));
    Assert.assertEquals(chunks.size(), 3);
    Assert.assertEquals(chunks.get(0).getText(), "Short one.");
    Assert.assertEquals(chunks.get(1).getText(), longSentence);
    Assert.assertEquals(chunks.get(2).getText(), "Tail.");
  }

  public void testChunksStayWithinBudget() {
    final Random random = new Random(42);
    final StringBuilder text = new StringBuilder();
    int totalWords = 0;
    for (int i = 0; i < 200; i++) {
      final int words = 1 + random.nextInt(i % 20 == 0 ? 300 : 30);
      for (int w = 0; w < words; w++)
        text.append(w == 0 ? "" : " ").append("word");
      text.append(i % 3 == 0 ? "! " : ". ");
      totalWords += words;
    }

    final List<Chunk> chunks = new ChunkAssembler().assemble(Collections.singletonList(page(0, text.toString())));
    int chunkedWords = 0;
    for (final Chunk chunk : chunks) {
      final boolean singleSentence = chunk.getText().split("(?<=[.!?])\\s+").length == 1;
      Assert.assertTrue(chunk.getText().length() <= 1000 || singleSentence, "chunk " + chunk.getChunkId() + " too long");
      chunkedWords += chunk.getWordCount();
    }
    Assert.assertEquals(chunkedWords, totalWords);
  }

  public void testNoPagesNoChunks() {
    Assert.assertTrue(new ChunkAssembler().assemble(new ArrayList<>()).isEmpty());
    Assert.assertTrue(new ChunkAssembler().assemble(Collections.singletonList(page(0, "  "))).isEmpty());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonPositiveSizeIsRejected() {
    new ChunkAssembler(0);
  }
}
