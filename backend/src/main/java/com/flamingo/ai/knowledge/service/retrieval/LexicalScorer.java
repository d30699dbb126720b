package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.store.ChunkContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Term-frequency relevance used by the text fallback.
 *
 * <p>Scores follow BM25 term saturation without document frequencies (the candidate set is too
 * small for meaningful IDF), multiplied by the share of query terms a chunk contains. A chunk token
 * matches a term when it starts with it, mirroring the substring match used to fetch candidates.
 */
@Component
public class LexicalScorer {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "how", "in", "is", "it",
          "of", "on", "or", "that", "the", "this", "to", "was", "what", "when", "where", "which",
          "who", "why", "with");
  private static final double K1 = 1.2;
  private static final double B = 0.75;

  /** A candidate and its relevance. */
  public record Scored(ChunkContext chunk, double relevance) {}

  /**
   * Extracts distinct lower-case query terms in query order. Stop words are dropped unless the
   * query has nothing else.
   */
  public List<String> terms(String query, int maxTerms) {
    Set<String> all = new LinkedHashSet<>(tokenize(query));
    List<String> terms = new ArrayList<>();
    for (String token : all) {
      if (!STOP_WORDS.contains(token)) {
        terms.add(token);
      }
    }
    if (terms.isEmpty()) {
      terms.addAll(all);
    }
    return terms.size() > maxTerms ? List.copyOf(terms.subList(0, maxTerms)) : List.copyOf(terms);
  }

  /**
   * Ranks candidates by relevance. Candidates matching no term are dropped; ties keep candidate
   * order.
   */
  public List<Scored> rank(List<String> terms, List<ChunkContext> candidates) {
    if (terms.isEmpty() || candidates.isEmpty()) {
      return List.of();
    }
    List<List<String>> tokenized = new ArrayList<>(candidates.size());
    long totalTokens = 0;
    for (ChunkContext candidate : candidates) {
      List<String> tokens = tokenize(candidate.content());
      tokenized.add(tokens);
      totalTokens += tokens.size();
    }
    double averageLength = Math.max(1.0, (double) totalTokens / candidates.size());

    List<Scored> scored = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      double relevance = score(terms, tokenized.get(i), averageLength);
      if (relevance > 0.0) {
        scored.add(new Scored(candidates.get(i), relevance));
      }
    }
    scored.sort(Comparator.comparingDouble(Scored::relevance).reversed());
    return scored;
  }

  private static double score(List<String> terms, List<String> tokens, double averageLength) {
    double lengthNorm = 1.0 - B + B * tokens.size() / averageLength;
    double sum = 0.0;
    int matchedTerms = 0;
    for (String term : terms) {
      int frequency = 0;
      for (String token : tokens) {
        if (token.startsWith(term)) {
          frequency++;
        }
      }
      if (frequency > 0) {
        matchedTerms++;
        sum += frequency * (K1 + 1.0) / (frequency + K1 * lengthNorm);
      }
    }
    return sum * matchedTerms / terms.size();
  }

  private static List<String> tokenize(String text) {
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
}
