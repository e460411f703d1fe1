package org.allenai.academicreader;

import lombok.NonNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matchers that give up after a time budget. Bibliographic patterns with nested repetition can
 * backtrack for a very long time on long, unpunctuated reference strings.
 */
final class RegexWithTimeout {
  public static class RegexTimeout extends RuntimeException {
    public RegexTimeout(final Pattern pattern) {
      super("Regex took too long: " + pattern.pattern());
    }
  }

  private RegexWithTimeout() { }

  public static Matcher matcher(final Pattern pattern, final CharSequence string, final long timeoutMs) {
    class TimeoutCharSequence implements CharSequence {
      private final CharSequence inner;
      private final long abortTime;

      public TimeoutCharSequence(final CharSequence inner, final long abortTime) {
        super();
        this.inner = inner;
        this.abortTime = abortTime;
      }

      public char charAt(int index) {
        if(System.currentTimeMillis() >= abortTime)
          throw new RegexTimeout(pattern);

        return inner.charAt(index);
      }

      public int length() {
        return inner.length();
      }

      public CharSequence subSequence(int start, int end) {
        return new TimeoutCharSequence(inner.subSequence(start, end), abortTime);
      }

      @NonNull
      public String toString() {
        return inner.toString();
      }
    }

    return pattern.matcher(new TimeoutCharSequence(string, System.currentTimeMillis() + timeoutMs));
  }
}
