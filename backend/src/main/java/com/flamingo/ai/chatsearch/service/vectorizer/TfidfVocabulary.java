package com.flamingo.ai.chatsearch.service.vectorizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable TF-IDF vocabulary fit once over a corpus.
 *
 * <p>Terms are lowercased runs of two or more letters or digits. The vocabulary keeps the {@code
 * maxFeatures} most frequent corpus terms (ties broken alphabetically) and assigns column indices
 * in alphabetical order. Inverse document frequency is smoothed: {@code ln((1 + n) / (1 + df)) +
 * 1}.
 */
public final class TfidfVocabulary {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]{2,}");

  private final Map<String, Integer> termIndex;
  private final double[] idf;

  private TfidfVocabulary(Map<String, Integer> termIndex, double[] idf) {
    this.termIndex = termIndex;
    this.idf = idf;
  }

  /**
   * Fits a vocabulary over the given corpus.
   *
   * @param corpus the training documents
   * @param maxFeatures maximum number of terms to keep
   * @return the fitted vocabulary
   * @throws IllegalArgumentException if the corpus yields no terms
   */
  public static TfidfVocabulary fit(Collection<String> corpus, int maxFeatures) {
    if (maxFeatures <= 0) {
      throw new IllegalArgumentException("maxFeatures must be positive");
    }
    Map<String, Integer> documentFrequency = new HashMap<>();
    Map<String, Integer> corpusFrequency = new HashMap<>();
    int documents = 0;
    for (String document : corpus) {
      List<String> tokens = tokenize(document);
      if (tokens.isEmpty()) {
        continue;
      }
      documents++;
      for (String token : tokens) {
        corpusFrequency.merge(token, 1, Integer::sum);
      }
      for (String token : new HashSet<>(tokens)) {
        documentFrequency.merge(token, 1, Integer::sum);
      }
    }
    if (corpusFrequency.isEmpty()) {
      throw new IllegalArgumentException("Vectorizer corpus contains no terms");
    }

    List<String> selected =
        corpusFrequency.entrySet().stream()
            .sorted(
                Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()))
            .limit(maxFeatures)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();

    Map<String, Integer> termIndex = new LinkedHashMap<>();
    double[] idf = new double[selected.size()];
    for (int i = 0; i < selected.size(); i++) {
      String term = selected.get(i);
      termIndex.put(term, i);
      idf[i] = Math.log((1.0 + documents) / (1.0 + documentFrequency.get(term))) + 1.0;
    }
    return new TfidfVocabulary(Map.copyOf(termIndex), idf);
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  /**
   * Transforms text into an L2-normalized TF-IDF vector over this vocabulary.
   *
   * <p>Terms outside the vocabulary are ignored, so text with no known terms yields a zero vector.
   */
  public float[] transform(String text) {
    Map<Integer, Integer> counts = new HashMap<>();
    for (String token : tokenize(text)) {
      Integer index = termIndex.get(token);
      if (index != null) {
        counts.merge(index, 1, Integer::sum);
      }
    }
    double[] weights = new double[idf.length];
    double norm = 0.0;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      double weight = entry.getValue() * idf[entry.getKey()];
      weights[entry.getKey()] = weight;
      norm += weight * weight;
    }
    norm = Math.sqrt(norm);
    float[] vector = new float[idf.length];
    if (norm > 0) {
      for (int i = 0; i < weights.length; i++) {
        vector[i] = (float) (weights[i] / norm);
      }
    }
    return vector;
  }

  public int size() {
    return idf.length;
  }

  public boolean contains(String term) {
    return termIndex.containsKey(term);
  }

  Set<String> terms() {
    return termIndex.keySet();
  }
}
