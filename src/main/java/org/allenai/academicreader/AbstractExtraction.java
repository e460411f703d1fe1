package org.allenai.academicreader;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Result of looking for a document's abstract. {@code method} is "section" when an abstract header
 * was found, "heuristic" when the text was picked by the paragraph fallback, and null when nothing
 * was found.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AbstractExtraction {
  public static final String METHOD_SECTION = "section";
  public static final String METHOD_HEURISTIC = "heuristic";

  @JsonProperty("abstract")
  String abstractText;
  int wordCount;
  boolean found;
  String method;

  public static AbstractExtraction notFound() {
    return new AbstractExtraction("", 0, false, null);
  }
}
