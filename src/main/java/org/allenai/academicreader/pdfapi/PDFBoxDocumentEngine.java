package org.allenai.academicreader.pdfapi;

import com.gs.collections.api.list.primitive.FloatList;
import com.gs.collections.impl.list.mutable.primitive.FloatArrayList;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link DocumentEngine} backed by PDFBox. Loaded documents are kept in a {@link DocumentCache}
 * for the lifetime of the engine. PDFBox documents are not safe for concurrent use, so every
 * extraction holds the document's monitor.
 */
@Slf4j
public class PDFBoxDocumentEngine implements DocumentEngine, Closeable {
  /**
   * A line whose top is further below the previous line's bottom than this many line heights
   * starts a new block.
   */
  private static final float BLOCK_GAP_IN_LINE_HEIGHTS = 0.8f;

  private final DocumentCache<PDDocument> cache;

  public PDFBoxDocumentEngine() {
    this.cache = new DocumentCache<>(PDFBoxDocumentEngine::load);
  }

  private static PDDocument load(final Path path) throws IOException {
    if(!Files.isRegularFile(path))
      throw new FileNotFoundException("PDF file not found: " + path);
    return PDDocument.load(path.toFile());
  }

  private static String orEmpty(final String s) {
    return s == null ? "" : s.trim();
  }

  @Override
  public PDFDoc getDocument(final Path path) throws IOException {
    final PDDocument pdfBoxDoc = cache.get(path);
    synchronized (pdfBoxDoc) {
      final PDDocumentInformation info = pdfBoxDoc.getDocumentInformation();
      val meta = PDFMetadata.builder()
        .title(orEmpty(info.getTitle()))
        .author(orEmpty(info.getAuthor()))
        .subject(orEmpty(info.getSubject()))
        .creator(orEmpty(info.getCreator()))
        .producer(orEmpty(info.getProducer()))
        .encrypted(pdfBoxDoc.isEncrypted())
        .fileSize(Files.size(path))
        .build();
      return PDFDoc.builder()
        .path(path)
        .pageCount(pdfBoxDoc.getNumberOfPages())
        .meta(meta)
        .build();
    }
  }

  @Override
  public String getRawText(final Path path) throws IOException {
    final PDDocument pdfBoxDoc = cache.get(path);
    final StringBuilder sb = new StringBuilder();
    synchronized (pdfBoxDoc) {
      final int pageCount = pdfBoxDoc.getNumberOfPages();
      for(int page = 0; page < pageCount; page++) {
        sb.append(stripPage(pdfBoxDoc, page));
        sb.append("\n\n");
      }
    }
    return sb.toString().trim();
  }

  @Override
  public String getRawText(final Path path, final int page) throws IOException {
    final PDDocument pdfBoxDoc = cache.get(path);
    synchronized (pdfBoxDoc) {
      checkPage(pdfBoxDoc, page);
      return stripPage(pdfBoxDoc, page);
    }
  }

  @Override
  public List<TextBlock> getPageBlocks(final Path path, final int page) throws IOException {
    final PDDocument pdfBoxDoc = cache.get(path);
    final BlockCaptureTextStripper stripper = new BlockCaptureTextStripper();
    synchronized (pdfBoxDoc) {
      checkPage(pdfBoxDoc, page);
      stripper.setStartPage(page + 1);
      stripper.setEndPage(page + 1);
      // SIDE-EFFECT lines ivar in stripper is populated
      stripper.getText(pdfBoxDoc);
    }
    final List<TextBlock> blocks = toBlocks(stripper.lines, page);
    log.debug("Page {} of {}: {} lines in {} blocks", page, path, stripper.lines.size(), blocks.size());
    return blocks;
  }

  @Override
  public void close() throws IOException {
    cache.close();
  }

  private static void checkPage(final PDDocument pdfBoxDoc, final int page) throws NoSuchPageException {
    final int pageCount = pdfBoxDoc.getNumberOfPages();
    if(page < 0 || page >= pageCount)
      throw new NoSuchPageException(page, pageCount);
  }

  private static String stripPage(final PDDocument pdfBoxDoc, final int page) throws IOException {
    final PDFTextStripper stripper = new PDFTextStripper();
    stripper.setStartPage(page + 1);
    stripper.setEndPage(page + 1);
    return Normalizer.normalize(stripper.getText(pdfBoxDoc), Normalizer.Form.NFKC);
  }

  private static List<TextBlock> toBlocks(final List<RawLine> lines, final int pageIndex) {
    final List<TextBlock> blocks = new ArrayList<>();
    List<RawLine> current = new ArrayList<>();
    RawLine prev = null;
    for(final RawLine line : lines) {
      if(prev != null && startsNewBlock(prev, line)) {
        blocks.add(toBlock(current, blocks.size(), pageIndex));
        current = new ArrayList<>();
      }
      current.add(line);
      prev = line;
    }
    if(!current.isEmpty())
      blocks.add(toBlock(current, blocks.size(), pageIndex));
    return blocks;
  }

  private static boolean startsNewBlock(final RawLine prev, final RawLine line) {
    // jumping back up the page means a new column
    if(line.bounds().get(1) < prev.bounds().get(1))
      return true;
    final float gap = line.bounds().get(1) - prev.bounds().get(3);
    return gap > BLOCK_GAP_IN_LINE_HEIGHTS * Math.max(prev.height(), 1.0f);
  }

  private static TextBlock toBlock(final List<RawLine> lines, final int blockIndex, final int pageIndex) {
    float x0 = Float.POSITIVE_INFINITY;
    float y0 = Float.POSITIVE_INFINITY;
    float x1 = Float.NEGATIVE_INFINITY;
    float y1 = Float.NEGATIVE_INFINITY;
    for(final RawLine line : lines) {
      final FloatList b = line.bounds();
      x0 = Math.min(x0, b.get(0));
      y0 = Math.min(y0, b.get(1));
      x1 = Math.max(x1, b.get(2));
      y1 = Math.max(y1, b.get(3));
    }
    final String text = lines.stream().map(RawLine::lineText).collect(Collectors.joining("\n"));
    return TextBlock.of(text, x0, y0, x1, y1, blockIndex, pageIndex);
  }

  @Data(staticConstructor = "of")
  private final static class RawToken {
    public final String token;
    /**
     * [x0, y0, x1, y1] where [0,0] is upper left
     */
    public final FloatList bounds;

    static RawToken fromPositions(final String text, final List<TextPosition> textPositions) {
      float minX = Float.POSITIVE_INFINITY;
      float maxX = Float.NEGATIVE_INFINITY;
      float minY = Float.POSITIVE_INFINITY;
      float maxY = Float.NEGATIVE_INFINITY;
      for (TextPosition tp : textPositions) {
        // TextPosition.getY() is the baseline; the glyph extends upward by its height
        final float top = tp.getY() - tp.getHeight();
        minX = Math.min(minX, tp.getX());
        maxX = Math.max(maxX, tp.getX() + tp.getWidth());
        minY = Math.min(minY, top);
        maxY = Math.max(maxY, tp.getY());
      }
      return RawToken.of(
        Normalizer.normalize(text, Normalizer.Form.NFKC),
        FloatArrayList.newListWith(minX, minY, maxX, maxY));
    }
  }

  private final static class RawLine {
    private final List<RawToken> tokens = new ArrayList<>();

    void add(final RawToken token) {
      tokens.add(token);
    }

    RawToken last() {
      return tokens.get(tokens.size() - 1);
    }

    FloatList bounds() {
      float x0 = (float) tokens.stream().mapToDouble(t -> t.bounds.get(0)).min().getAsDouble();
      float y0 = (float) tokens.stream().mapToDouble(t -> t.bounds.get(1)).min().getAsDouble();
      float x1 = (float) tokens.stream().mapToDouble(t -> t.bounds.get(2)).max().getAsDouble();
      float y1 = (float) tokens.stream().mapToDouble(t -> t.bounds.get(3)).max().getAsDouble();
      return FloatArrayList.newListWith(x0, y0, x1, y1);
    }

    float height() {
      val bs = bounds();
      return bs.get(3) - bs.get(1);
    }

    /**
     * A token continues this line if it overlaps the last token vertically and starts to its right.
     */
    boolean continuesWith(final RawToken token) {
      final RawToken last = last();
      final boolean yOverlap = token.bounds.get(1) <= last.bounds.get(3)
        && token.bounds.get(3) >= last.bounds.get(1);
      final boolean toTheRight = token.bounds.get(0) >= last.bounds.get(0);
      return yOverlap && toTheRight;
    }

    String lineText() {
      return tokens.stream().map(RawToken::getToken).collect(Collectors.joining(" "));
    }
  }

  private static class BlockCaptureTextStripper extends PDFTextStripper {
    private final List<RawLine> lines = new ArrayList<>();
    private RawLine curLine;

    // Mandatory for sub-classes
    BlockCaptureTextStripper() throws IOException {
      super();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if(textPositions.isEmpty() || text.trim().isEmpty())
        return;
      final RawToken token = RawToken.fromPositions(text.trim(), textPositions);
      if(curLine == null || !curLine.continuesWith(token)) {
        curLine = new RawLine();
        lines.add(curLine);
      }
      curLine.add(token);
    }
  }
}
