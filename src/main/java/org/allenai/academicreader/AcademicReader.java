package org.allenai.academicreader;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.allenai.academicreader.pdfapi.DocumentEngine;
import org.allenai.academicreader.pdfapi.PDFDoc;
import org.allenai.academicreader.pdfapi.PDFPage;
import org.allenai.academicreader.pdfapi.TextBlock;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structures the text of an academic document: reading order, sections, citations, references
 * and chunks. Everything is recomputed from the engine on every call; nothing is cached here.
 *
 * Section detection and citation search run over the engine's raw text with each line
 * normalized, so line numbers and character offsets refer to that text. Reading order, formula
 * isolation and chunking work page by page from the engine's blocks.
 *
 * Engine failures (missing file, page out of range) propagate unchanged. Heuristic misses never
 * throw; they produce empty results.
 */
@Slf4j
public class AcademicReader {
  public static final String TRUNCATION_MARKER = "... [truncated]";

  /**
   * Sections returned by {@link #extractKeySections}, in this order.
   */
  public static final List<SectionName> KEY_SECTIONS = Collections.unmodifiableList(Arrays.asList(
    SectionName.ABSTRACT,
    SectionName.INTRODUCTION,
    SectionName.METHODS,
    SectionName.RESULTS,
    SectionName.CONCLUSION));

  @Builder
  public static class Options {
    @Builder.Default public int chunkSize = ChunkAssembler.DEFAULT_CHUNK_SIZE;
    @Builder.Default public int keySectionWordLimit = 500;
    @Builder.Default public int citationContextWidth = CitationExtractor.DEFAULT_CONTEXT_WIDTH;
    @Builder.Default public int heavilyCitedThreshold = 20;
    @Builder.Default public int recentReferenceYear = 2015;
    @Builder.Default public int minReferenceLength = ReferenceExtractor.DEFAULT_MIN_LENGTH;
    @Builder.Default public long referenceRegexTimeoutMs = ReferenceExtractor.DEFAULT_REGEX_TIMEOUT_MS;
    @Builder.Default public SectionPatterns sectionPatterns = SectionPatterns.defaults();
    @Builder.Default public ReferencePatterns referencePatterns = ReferencePatterns.defaults();
  }

  private final DocumentEngine engine;
  private final Options opts;
  private final TextNormalizer normalizer;
  private final PageProcessor pageProcessor;
  private final SectionDetector sectionDetector;
  private final CitationExtractor citationExtractor;
  private final ReferenceExtractor referenceExtractor;
  private final AbstractFinder abstractFinder;

  public AcademicReader(final DocumentEngine engine) {
    this(engine, Options.builder().build());
  }

  public AcademicReader(final DocumentEngine engine, final Options opts) {
    this.engine = engine;
    this.opts = opts;
    this.normalizer = new TextNormalizer();
    this.pageProcessor = new PageProcessor(new MathFormulaIsolator(), normalizer);
    this.sectionDetector = new SectionDetector(opts.sectionPatterns);
    this.citationExtractor = new CitationExtractor(CitationPatterns.DEFAULT_PATTERNS, opts.citationContextWidth);
    this.referenceExtractor =
      new ReferenceExtractor(opts.referencePatterns, opts.minReferenceLength, opts.referenceRegexTimeoutMs);
    this.abstractFinder = new AbstractFinder();
  }

  /**
   * The engine's raw text with every line normalized on its own.
   */
  public String documentText(final Path path) throws IOException {
    return normalizer.normalizeLines(engine.getRawText(path));
  }

  public DetectedSections detectSections(final Path path) throws IOException {
    final DetectedSections detected = DetectedSections.of(sectionDetector.detect(documentText(path)));
    log.debug("Sections found in {}: {}", path, detected.getSectionsFound());
    return detected;
  }

  /**
   * Content of the key sections present in the document, each cut to the configured number of
   * words.
   */
  public Map<SectionName, String> extractKeySections(final Path path) throws IOException {
    final DetectedSections detected = detectSections(path);
    final Map<SectionName, String> out = new LinkedHashMap<>();
    for (final SectionName name : KEY_SECTIONS) {
      final Section section = detected.get(name);
      if (section != null)
        out.put(name, Words.truncate(section.getContent(), opts.keySectionWordLimit, TRUNCATION_MARKER));
    }
    return out;
  }

  public AbstractExtraction extractAbstract(final Path path) throws IOException {
    final String text = documentText(path);
    return abstractFinder.find(DetectedSections.of(sectionDetector.detect(text)), text);
  }

  public SectionSummary getSectionSummary(final Path path) throws IOException {
    return SectionSummary.of(detectSections(path));
  }

  public CitationReport extractCitations(final Path path) throws IOException {
    final String text = documentText(path);
    final List<CitationMention> mentions = citationExtractor.findMentions(text);
    final DetectedSections detected = DetectedSections.of(sectionDetector.detect(text));
    final Section references = detected.get(SectionName.REFERENCES);
    final List<ReferenceEntry> entries = references == null ?
      Collections.emptyList() :
      referenceExtractor.extract(references.getContent());
    log.debug("{}: {} citation mentions, {} references", path, mentions.size(), entries.size());
    return CitationReport.of(mentions, entries);
  }

  public CitationSummary getCitationSummary(final Path path) throws IOException {
    return CitationSummary.of(extractCitations(path), opts.heavilyCitedThreshold, opts.recentReferenceYear);
  }

  public DocumentStructureReport analyzeDocumentStructure(final Path path) throws IOException {
    return new DocumentStructureReport(getSectionSummary(path), getCitationSummary(path));
  }

  public ProcessedPage extractAcademicText(final Path path, final int page) throws IOException {
    Preconditions.checkArgument(page >= 0, "Page must not be negative, was %s", page);
    final List<TextBlock> blocks = engine.getPageBlocks(path, page);
    return pageProcessor.process(PDFPage.builder().pageIndex(page).blocks(blocks).build());
  }

  public AcademicText extractAcademicText(final Path path) throws IOException {
    final PDFDoc doc = engine.getDocument(path);
    final List<ProcessedPage> pages = new ArrayList<>(doc.getPageCount());
    final StringBuilder fullText = new StringBuilder();
    for (int page = 0; page < doc.getPageCount(); page++) {
      final ProcessedPage processed = extractAcademicText(path, page);
      pages.add(processed);
      fullText.append(processed.getProcessedText()).append("\n\n");
    }
    return new AcademicText(fullText.toString().trim(), Collections.unmodifiableList(pages), doc.getPageCount());
  }

  public List<Chunk> chunkAcademicContent(final Path path) throws IOException {
    return chunkAcademicContent(path, opts.chunkSize);
  }

  public List<Chunk> chunkAcademicContent(final Path path, final int chunkSize) throws IOException {
    final ChunkAssembler assembler = new ChunkAssembler(chunkSize);
    return assembler.assemble(extractAcademicText(path).getPages());
  }
}
