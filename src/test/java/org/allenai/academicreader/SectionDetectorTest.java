package org.allenai.academicreader;

import lombok.extern.slf4j.Slf4j;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.allenai.academicreader.InMemoryDocumentEngine.lines;

@Test
@Slf4j
public class SectionDetectorTest {
  private final SectionDetector detector = new SectionDetector();

  private static final String PAPER = lines(
    "Title of Paper",
    "Some Author",
    "Abstract",
    "This paper studies things.",
    "",
    "1. Introduction",
    "Intro line one.",
    "Intro line two.",
    "2. Methods",
    "We did stuff.",
    "3. Results",
    "It worked well.",
    "REFERENCES",
    "[1] Smith, A. (2020). Title. Journal, 5, 1-10.");

  public void testDetectsSectionsWithLineRanges() {
    final List<Section> sections = detector.detect(PAPER);
    log.info("Detected: {}", sections);
    Assert.assertEquals(sections.size(), 5);

    final Section abs = sections.get(0);
    Assert.assertEquals(abs.getName(), SectionName.ABSTRACT);
    Assert.assertEquals(abs.getContent(), "This paper studies things.");
    Assert.assertEquals(abs.getLineStart(), 3);
    Assert.assertEquals(abs.getLineEnd(), 4);
    Assert.assertEquals(abs.getWordCount(), 4);

    final Section intro = sections.get(1);
    Assert.assertEquals(intro.getName(), SectionName.INTRODUCTION);
    Assert.assertEquals(intro.getContent(), "Intro line one.\nIntro line two.");
    Assert.assertEquals(intro.getLineStart(), 6);
    Assert.assertEquals(intro.getLineEnd(), 7);

    Assert.assertEquals(sections.get(2).getName(), SectionName.METHODS);
    Assert.assertEquals(sections.get(3).getName(), SectionName.RESULTS);

    final Section refs = sections.get(4);
    Assert.assertEquals(refs.getName(), SectionName.REFERENCES);
    Assert.assertEquals(refs.getLineStart(), 13);
    Assert.assertEquals(refs.getLineEnd(), 13);
  }

  public void testSectionsDoNotOverlapAndAreOrdered() {
    final List<Section> sections = detector.detect(PAPER);
    for (int i = 1; i < sections.size(); i++) {
      final Section prev = sections.get(i - 1);
      final Section next = sections.get(i);
      Assert.assertTrue(prev.getLineStart() <= prev.getLineEnd());
      Assert.assertTrue(prev.getLineEnd() < next.getLineStart(), prev.getName() + " overlaps " + next.getName());
    }
  }

  public void testPreambleBelongsToNoSection() {
    for (final Section s : detector.detect(PAPER))
      Assert.assertFalse(s.getContent().contains("Title of Paper"));
  }

  public void testHeaderWithoutContentIsNotReported() {
    final List<Section> sections = detector.detect(lines("Abstract", "Introduction", "Some text."));
    Assert.assertEquals(sections.size(), 1);
    Assert.assertEquals(sections.get(0).getName(), SectionName.INTRODUCTION);
  }

  public void testHeadersAreCaseInsensitive() {
    final List<Section> sections = detector.detect(lines("abstract", "text", "CONCLUSIONS", "more text"));
    Assert.assertEquals(sections.get(0).getName(), SectionName.ABSTRACT);
    Assert.assertEquals(sections.get(1).getName(), SectionName.CONCLUSION);
  }

  public void testEarlierSectionNameWinsWhenSeveralMatch() {
    final List<Section> sections = detector.detect(lines("4. Results and Discussion", "We found things."));
    Assert.assertEquals(sections.size(), 1);
    Assert.assertEquals(sections.get(0).getName(), SectionName.RESULTS);
  }

  public void testUnnumberedHeaderMustBeWholeLine() {
    Assert.assertTrue(detector.detect(lines("Results are shown below.", "text")).isEmpty());
  }

  public void testCustomPatterns() {
    final Map<SectionName, List<String>> regexes = new EnumMap<>(SectionName.class);
    regexes.put(SectionName.REFERENCES, Collections.singletonList("^Literature\\s*$"));
    final SectionDetector custom = new SectionDetector(new SectionPatterns(regexes));
    final List<Section> sections = custom.detect(lines("Abstract", "x", "Literature", "[1] Some reference here."));
    Assert.assertEquals(sections.size(), 1);
    Assert.assertEquals(sections.get(0).getName(), SectionName.REFERENCES);
  }

  public void testRepeatedNameKeepsLastOccurrence() {
    final DetectedSections detected = DetectedSections.of(detector.detect(lines(
      "Introduction", "first intro",
      "Methods", "how",
      "Introduction", "second intro")));
    Assert.assertEquals(detected.getTotalSections(), 2);
    Assert.assertEquals(detected.getSectionsFound(), Arrays.asList(SectionName.METHODS, SectionName.INTRODUCTION));
    Assert.assertEquals(detected.get(SectionName.INTRODUCTION).getContent(), "second intro");
  }

  public void testSummaryOfSingleSectionIsOtherDocument() {
    final SectionSummary summary = SectionSummary.of(DetectedSections.of(detector.detect(lines("Abstract", "Just this."))));
    Assert.assertEquals(summary.getTotalSections(), 1);
    Assert.assertEquals(summary.getEstimatedStructure(), DocumentType.OTHER_DOCUMENT);
    Assert.assertTrue(summary.has(SectionName.ABSTRACT));
    Assert.assertFalse(summary.has(SectionName.REFERENCES));
    Assert.assertEquals(summary.getSectionStatistics().get(SectionName.ABSTRACT).getPercentage(), 100.0);
  }

  public void testSummaryOfFullPaperIsAcademic() {
    final SectionSummary summary = SectionSummary.of(DetectedSections.of(detector.detect(PAPER)));
    Assert.assertEquals(summary.getTotalSections(), 5);
    Assert.assertEquals(summary.getEstimatedStructure(), DocumentType.ACADEMIC_PAPER);
    Assert.assertFalse(summary.has(SectionName.DISCUSSION));
    Assert.assertEquals(summary.getPresent().size(), SectionName.values().length);
    Assert.assertEquals(summary.getSectionStatistics().get(SectionName.METHODS).getWordCount(), 3);
  }

  public void testEmptyText() {
    Assert.assertTrue(detector.detect("").isEmpty());
    Assert.assertEquals(DetectedSections.of(detector.detect("")).getTotalSections(), 0);
  }
}
