package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One entry of a reference list. Only {@code referenceNumber} and {@code rawText} are always
 * filled in; the bibliographic fields are best-effort and empty when they could not be found.
 * {@code doi} and {@code url} are null when absent.
 */
@Builder
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReferenceEntry {
  int referenceNumber;
  String rawText;
  @Builder.Default String authorsRaw = "";
  @Builder.Default String year = "";
  @Builder.Default String title = "";
  @Builder.Default String journal = "";
  @Builder.Default String volume = "";
  @Builder.Default String issue = "";
  @Builder.Default String pages = "";
  String doi;
  String url;

  /**
   * The four-digit year without any disambiguating letter, or -1.
   */
  public int numericYear() {
    if (year.length() < 4)
      return -1;
    try {
      return Integer.parseInt(year.substring(0, 4));
    } catch (final NumberFormatException e) {
      return -1;
    }
  }
}
