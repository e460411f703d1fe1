package org.allenai.academicreader;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Patterns for reference lists: which lines start a new entry, how the entry number is written,
 * and the stricter whole-entry patterns used to pull out bibliographic fields.
 */
@Value
public class ReferencePatterns {
  public static final String authUnit = "\\p{Lu}[\\p{L}'`\\-]+";
  public static final String authOneName = authUnit + "(?: " + authUnit + ")?"; //space and repetition for things like De Mori
  public static final String authConnect = "(?:; |, |, and |; and | and )";
  public static final String authInitialsLast = "(?:\\p{Lu}\\.?(?:-| )?)+ " + authOneName;
  public static final String authInitialsLastList = authInitialsLast + "(?:" + authConnect + authInitialsLast + ")*";

  public static final String yearGroup = "(?<year>\\d{4}[a-z]?)";

  /**
   * A whole-entry pattern and the named groups it defines. Matched against the entry text with the
   * entry number already removed.
   */
  @Value
  public static class FieldPattern {
    Pattern pattern;
    List<String> fields;

    public static FieldPattern of(final String regex, final String... fields) {
      return new FieldPattern(Pattern.compile(regex), ImmutableList.copyOf(fields));
    }
  }

  List<Pattern> entryStarts;
  List<Pattern> numberMarkers;
  Pattern year;
  Pattern doi;
  Pattern url;
  List<FieldPattern> fieldPatterns;

  public static ReferencePatterns defaults() {
    return new ReferencePatterns(
      ImmutableList.of(
        Pattern.compile("^\\[\\d+\\]"),
        Pattern.compile("^\\d+\\."),
        Pattern.compile("^\\p{Lu}\\p{Ll}+,")),
      ImmutableList.of(
        Pattern.compile("^\\[\\d+\\]\\s*"),
        Pattern.compile("^\\d+\\.\\s*")),
      Pattern.compile("\\(" + yearGroup + "\\)"),
      Pattern.compile("doi[:\\s]*(10\\.\\d+/\\S+)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("https?://\\S+"),
      ImmutableList.of(
        // Smith, A. (2020). Title. Journal, 5(2), 1-10.
        FieldPattern.of(
          "^(?<authors>.+?)\\s*\\(" + yearGroup + "\\)\\.?\\s*(?<title>[^.]+)\\.\\s*(?<journal>[^,]+),\\s*"
            + "(?<volume>\\d+)(?:\\s*\\((?<issue>\\d+)\\))?,\\s*(?<pages>\\d+\\s*[-–]\\s*\\d+)",
          "authors", "year", "title", "journal", "volume", "issue", "pages"),
        // Smith, A. (2020). Title. Journal, 5(2).
        FieldPattern.of(
          "^(?<authors>.+?)\\s*\\(" + yearGroup + "\\)\\.?\\s*(?<title>[^.]+)\\.\\s*(?<journal>[^,]+),\\s*"
            + "(?<volume>\\d+)(?:\\s*\\((?<issue>\\d+)\\))?",
          "authors", "year", "title", "journal", "volume", "issue"),
        // Smith, A. (2020). Title. Venue
        FieldPattern.of(
          "^(?<authors>.+?)\\s*\\(" + yearGroup + "\\)\\.?\\s*(?<title>[^.]+)\\.(?:\\s*(?<journal>[^.,]+))?",
          "authors", "year", "title", "journal"),
        // E. Chang and A. Zakhor. Scalable video data placement. In Proc. SIGMOD, 1994.
        FieldPattern.of(
          "^(?<authors>" + authInitialsLastList + ")[.,] (?<title>[^.]+)\\. (?:(?:I|i)n:? )?(?<journal>.*?),? [1-2][0-9]{3}\\.",
          "authors", "title", "journal")));
  }
}
