package com.scholary.videoengine.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits a narration script into segment texts.
 *
 * <p>Sentence mode packs whole sentences into segments sized for a target duration, assuming 150
 * spoken words per minute. A segment is closed once it reaches 80% of the target word count, and a
 * sentence that would push it past 120% starts a new one. Line mode takes each non-blank line as a
 * segment.
 */
@Component
public class ScriptSegmenter {

  static final double WORDS_PER_SECOND = 150.0 / 60.0;

  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+(?:[.!?]+|$)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public enum Mode {
    SENTENCES,
    LINES
  }

  /**
   * @throws IllegalArgumentException if the script is blank or the target is not positive
   */
  public List<String> segment(String script, int targetSegmentSeconds, Mode mode) {
    if (script == null || script.isBlank()) {
      throw new IllegalArgumentException("Script cannot be empty");
    }
    if (mode == Mode.LINES) {
      return byLines(script);
    }
    if (targetSegmentSeconds <= 0) {
      throw new IllegalArgumentException("Target segment duration must be positive");
    }
    return bySentences(script, targetSegmentSeconds);
  }

  /** Estimated narration time for a piece of text. */
  public static double estimateSeconds(String text) {
    return wordCount(text) / WORDS_PER_SECOND;
  }

  private List<String> bySentences(String script, int targetSegmentSeconds) {
    String clean = WHITESPACE.matcher(script).replaceAll(" ").trim();
    int targetWords = (int) (targetSegmentSeconds * WORDS_PER_SECOND);

    List<String> segments = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentWords = 0;

    for (String sentence : sentences(clean)) {
      int words = wordCount(sentence);
      if (!current.isEmpty() && currentWords + words > targetWords * 1.2) {
        segments.add(String.join(" ", current));
        current.clear();
        current.add(sentence);
        currentWords = words;
        continue;
      }
      current.add(sentence);
      currentWords += words;
      if (currentWords >= targetWords * 0.8) {
        segments.add(String.join(" ", current));
        current.clear();
        currentWords = 0;
      }
    }
    if (!current.isEmpty()) {
      segments.add(String.join(" ", current));
    }
    return segments;
  }

  private static List<String> byLines(String script) {
    return script
        .replace("\r\n", "\n")
        .replace('\r', '\n')
        .lines()
        .map(String::strip)
        .filter(line -> !line.isEmpty())
        .toList();
  }

  private static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    Matcher matcher = SENTENCE.matcher(text);
    while (matcher.find()) {
      String sentence = matcher.group().trim();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }

  private static int wordCount(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }
}
