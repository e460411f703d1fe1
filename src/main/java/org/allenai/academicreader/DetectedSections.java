package org.allenai.academicreader;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sections keyed by name. When a name occurs more than once in a document the last occurrence is
 * kept, and {@code sectionsFound} lists names in document order of the kept occurrences.
 */
@Value
public class DetectedSections {
  Map<SectionName, Section> sections;
  List<SectionName> sectionsFound;
  int totalSections;

  public static DetectedSections of(final List<Section> detected) {
    final LinkedHashMap<SectionName, Section> byName = new LinkedHashMap<>();
    for (final Section s : detected) {
      // re-insert so iteration order follows the kept occurrence
      byName.remove(s.getName());
      byName.put(s.getName(), s);
    }
    return new DetectedSections(
      Collections.unmodifiableMap(byName),
      Collections.unmodifiableList(new ArrayList<>(byName.keySet())),
      byName.size());
  }

  public boolean has(final SectionName name) {
    return sections.containsKey(name);
  }

  public Section get(final SectionName name) {
    return sections.get(name);
  }
}
