package com.flamingo.ai.notevault.service.embedding;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Prepares raw markdown note content for embedding.
 *
 * <p>Strips emphasis, heading, strike and code markers, keeps only the label of inline links,
 * folds newlines into spaces, trims and finally truncates. Truncation runs last so the limit
 * applies to the cleaned text.
 */
@Component
public class TextPreprocessor {

  /** Cleaned text is cut to this many characters to bound embedding cost. */
  public static final int MAX_CHARS = 2000;

  private static final Pattern MARKDOWN_SYMBOLS = Pattern.compile("[#*_~`]");
  private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
  private static final Pattern NEWLINES = Pattern.compile("\\n+");

  public String clean(String content) {
    if (content == null) {
      return "";
    }
    String cleaned = MARKDOWN_SYMBOLS.matcher(content).replaceAll("");
    cleaned = LINK.matcher(cleaned).replaceAll("$1");
    cleaned = NEWLINES.matcher(cleaned).replaceAll(" ");
    cleaned = cleaned.trim();
    return truncate(cleaned);
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS) {
      return text;
    }
    int end = MAX_CHARS;
    // don't leave half a surrogate pair behind
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
