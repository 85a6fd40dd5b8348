package dev.scholar.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Approximate string matcher over weighted fields, scoring each item in [0, 1] where lower is a
 * better match.
 *
 * <p>For each field the query is aligned against every substring of the (lower-cased) field text
 * using edit distance. An alignment costs {@code errors / patternLength + start / distance}: typos
 * and late starts both count against it. The best alignment below {@code threshold} is the field
 * score; a field above it does not match. An exact, whole-field match scores 0.
 *
 * <p>Matched field scores are combined as {@code prod(score ^ (weight * norm))} where {@code norm
 * = 1 / sqrt(tokenCount)} penalises long fields. Items with no matching field are dropped.
 *
 * @param <T> the item type
 */
public final class FuzzyMatcher<T> {

  /** Divides the match start offset; a match starting {@code distance} chars in costs 1.0. */
  static final int DISTANCE = 100;

  /** Stand-in for a zero field score so that the weighted product stays informative. */
  private static final double EPSILON = Math.ulp(1.0);

  private final List<Field<T>> fields;
  private final double threshold;
  private final int minMatchCharLength;

  /**
   * A searchable field with its relative weight.
   *
   * @param name field name, for logging and debugging
   * @param weight relative weight; weights are normalised to sum to 1
   * @param extractor reads the field text from an item (null is treated as empty)
   */
  public record Field<T>(String name, double weight, Function<T, String> extractor) {
    public Field {
      if (weight <= 0) {
        throw new IllegalArgumentException("Field weight must be positive: " + name);
      }
    }
  }

  /**
   * An item together with its match score (lower is better).
   *
   * @param item the matched item
   * @param score combined score in [0, 1]
   */
  public record Match<T>(T item, double score) {}

  public FuzzyMatcher(List<Field<T>> fields, double threshold, int minMatchCharLength) {
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("At least one field is required");
    }
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("threshold must be in [0.0, 1.0], got: " + threshold);
    }
    double totalWeight = fields.stream().mapToDouble(Field::weight).sum();
    this.fields =
        fields.stream()
            .map(f -> new Field<>(f.name(), f.weight() / totalWeight, f.extractor()))
            .toList();
    this.threshold = threshold;
    this.minMatchCharLength = minMatchCharLength;
  }

  /**
   * Scores every item against the query and returns the best matches.
   *
   * @param items the candidates, in their preferred tie-break order
   * @param query the search text
   * @param limit maximum number of matches to return
   * @return matches ordered by score ascending; equal scores keep the order of {@code items}
   */
  public List<Match<T>> search(List<T> items, String query, int limit) {
    String pattern = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    if (limit < 1 || pattern.length() < Math.max(1, minMatchCharLength)) {
      return List.of();
    }

    List<Match<T>> matches = new ArrayList<>();
    for (T item : items) {
      double total = 1.0;
      boolean matched = false;
      for (Field<T> field : fields) {
        String raw = field.extractor().apply(item);
        if (raw == null || raw.isEmpty()) {
          continue;
        }
        double fieldScore = scoreField(pattern, raw.toLowerCase(Locale.ROOT));
        if (fieldScore < 0) {
          continue;
        }
        matched = true;
        double base = fieldScore == 0.0 ? EPSILON : fieldScore;
        total *= Math.pow(base, field.weight() * norm(raw));
      }
      if (matched) {
        matches.add(new Match<>(item, total));
      }
    }

    matches.sort(Comparator.comparingDouble(Match<T>::score));
    return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
  }

  /**
   * Best alignment score of the pattern inside the text, or -1 if no alignment beats the
   * threshold.
   */
  double scoreField(String pattern, String text) {
    if (pattern.equals(text)) {
      return 0.0;
    }
    int m = pattern.length();
    int maxErrors = (int) Math.floor(threshold * m);
    int maxStart = (int) Math.floor(threshold * DISTANCE);
    // Alignments starting past maxStart or longer than m + maxErrors can never pass the threshold.
    int window = Math.min(text.length(), maxStart + m + maxErrors);

    // Sellers' algorithm: row i holds the cheapest alignment of pattern[0, i) ending at each
    // text position, along with the text offset where that alignment starts.
    int[] prevCost = new int[window + 1];
    int[] prevStart = new int[window + 1];
    int[] cost = new int[window + 1];
    int[] start = new int[window + 1];
    for (int j = 0; j <= window; j++) {
      prevStart[j] = j;
    }

    for (int i = 1; i <= m; i++) {
      char pc = pattern.charAt(i - 1);
      cost[0] = i;
      start[0] = 0;
      for (int j = 1; j <= window; j++) {
        int substitute = prevCost[j - 1] + (pc == text.charAt(j - 1) ? 0 : 1);
        int skipPattern = prevCost[j] + 1;
        int skipText = cost[j - 1] + 1;
        if (substitute <= skipPattern && substitute <= skipText) {
          cost[j] = substitute;
          start[j] = prevStart[j - 1];
        } else if (skipPattern <= skipText) {
          cost[j] = skipPattern;
          start[j] = prevStart[j];
        } else {
          cost[j] = skipText;
          start[j] = start[j - 1];
        }
      }
      int[] swapCost = prevCost;
      prevCost = cost;
      cost = swapCost;
      int[] swapStart = prevStart;
      prevStart = start;
      start = swapStart;
    }

    double best = Double.MAX_VALUE;
    for (int j = 1; j <= window; j++) {
      int errors = prevCost[j];
      if (errors > maxErrors || j - prevStart[j] < minMatchCharLength) {
        continue;
      }
      double score = (double) errors / m + (double) prevStart[j] / DISTANCE;
      best = Math.min(best, score);
    }
    if (best > threshold) {
      return -1;
    }
    return Math.max(0.001, best);
  }

  /** Field-length norm, {@code 1 / sqrt(tokens)} rounded to three decimals. */
  static double norm(String value) {
    int tokens = value.trim().isEmpty() ? 1 : value.trim().split(" +").length;
    return Math.round(1000.0 / Math.sqrt(tokens)) / 1000.0;
  }
}
