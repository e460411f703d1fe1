package org.allenai.academicreader;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Publication-year spread of a reference list. Min and max are null when no entry has a year.
 */
@Value
public class ReferenceYears {
  Integer minYear;
  Integer maxYear;
  int yearRange;
  int recentReferences;

  public static ReferenceYears of(final List<ReferenceEntry> references, final int recentSince) {
    final List<Integer> years = references.stream()
      .map(ReferenceEntry::numericYear)
      .filter(y -> y > 0)
      .collect(Collectors.toList());
    if (years.isEmpty())
      return new ReferenceYears(null, null, 0, 0);

    final int min = years.stream().mapToInt(Integer::intValue).min().getAsInt();
    final int max = years.stream().mapToInt(Integer::intValue).max().getAsInt();
    final int recent = (int) years.stream().filter(y -> y >= recentSince).count();
    return new ReferenceYears(min, max, max - min, recent);
  }
}
