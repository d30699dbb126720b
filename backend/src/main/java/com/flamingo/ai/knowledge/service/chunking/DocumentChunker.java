package com.flamingo.ai.knowledge.service.chunking;

import com.flamingo.ai.knowledge.domain.enums.ChunkingStrategy;
import com.flamingo.ai.knowledge.domain.model.ChunkingOptions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits document text into overlapping chunks.
 *
 * <p>Every chunk is an exact slice of the input. Chunk {@code i + 1} starts {@code overlap}
 * characters before chunk {@code i} ends, so consecutive chunks share exactly {@code overlap}
 * characters and the non-overlapping parts add up to the text length. The strategies only differ
 * in where a chunk ends:
 *
 * <ul>
 *   <li>{@link ChunkingStrategy#FIXED} ends after {@code chunkSize} characters.
 *   <li>{@link ChunkingStrategy#RECURSIVE} ends at the last paragraph break that fits, else the
 *       last sentence end, else the last whitespace, else after {@code chunkSize} characters. A
 *       cut that would leave less than half the budget is passed over for the next finer unit.
 *   <li>{@link ChunkingStrategy#SEMANTIC} ends at the last sentence end that fits. A sentence
 *       longer than the budget is kept whole.
 * </ul>
 *
 * <p>Stateless and safe for concurrent use.
 */
@Service
@Slf4j
public class DocumentChunker {

  private static final int CHARS_PER_TOKEN = 4;

  /**
   * Chunks a text.
   *
   * @param text source text; blank text produces no chunks
   * @param options validated before use
   * @return chunks with order indices {@code 0..n-1}
   */
  public List<ChunkPiece> chunk(String text, ChunkingOptions options) {
    options.validate();
    if (text == null || text.isBlank()) {
      return List.of();
    }

    int length = text.length();
    int size = options.chunkSize();
    int overlap = options.overlap();
    int[] sentenceEnds =
        options.strategy() == ChunkingStrategy.SEMANTIC ? sentenceEnds(text) : null;

    List<ChunkPiece> pieces = new ArrayList<>();
    int start = 0;
    while (true) {
      int end =
          switch (options.strategy()) {
            case FIXED -> Math.min(start + size, length);
            case RECURSIVE -> recursiveEnd(text, start, size, overlap);
            case SEMANTIC -> semanticEnd(sentenceEnds, length, start, size, overlap);
          };
      pieces.add(piece(text, start, end, pieces.size()));
      if (end >= length) {
        break;
      }
      start = end - overlap;
    }

    log.debug(
        "Chunked {} chars into {} chunks ({}, size={}, overlap={})",
        length,
        pieces.size(),
        options.strategy(),
        size,
        overlap);
    return List.copyOf(pieces);
  }

  /** Token estimate used for chunk metadata: one token per four characters, rounded up. */
  public static int estimateTokens(int characterCount) {
    return (characterCount + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  private static ChunkPiece piece(String text, int start, int end, int orderIndex) {
    int characterCount = end - start;
    return new ChunkPiece(
        text.substring(start, end),
        orderIndex,
        characterCount,
        estimateTokens(characterCount),
        start,
        end);
  }

  // ---- recursive ----

  private static int recursiveEnd(String text, int start, int size, int overlap) {
    int limit = start + size;
    if (limit >= text.length()) {
      return text.length();
    }
    // the next chunk must start after this one
    int min = Math.max(start + overlap + 1, start + size / 2);

    int paragraph = text.lastIndexOf("\n\n", limit - 2);
    if (paragraph >= 0 && paragraph + 2 >= min) {
      return paragraph + 2;
    }
    for (int cut = limit; cut >= min; cut--) {
      if (isSentenceEnd(text, cut)) {
        return cut;
      }
    }
    for (int cut = limit; cut >= min; cut--) {
      if (Character.isWhitespace(text.charAt(cut - 1))) {
        return cut;
      }
    }
    return limit;
  }

  // ---- semantic ----

  private static int semanticEnd(int[] sentenceEnds, int length, int start, int size, int overlap) {
    int limit = start + size;
    if (limit >= length) {
      return length;
    }
    int min = start + overlap + 1;

    int index = Arrays.binarySearch(sentenceEnds, limit);
    int atOrBelow = index >= 0 ? index : -index - 2;
    if (atOrBelow >= 0 && sentenceEnds[atOrBelow] >= min) {
      return sentenceEnds[atOrBelow];
    }
    // no sentence end fits: keep the sentence whole
    int above = index >= 0 ? index + 1 : -index - 1;
    return above < sentenceEnds.length ? sentenceEnds[above] : length;
  }

  /** Positions right after each sentence terminator, ascending. */
  private static int[] sentenceEnds(String text) {
    List<Integer> ends = new ArrayList<>();
    for (int position = 1; position < text.length(); position++) {
      if (isSentenceEnd(text, position)) {
        ends.add(position);
      }
    }
    return ends.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Whether {@code position} directly follows a sentence: terminal punctuation followed by
   * whitespace, or a line break.
   */
  private static boolean isSentenceEnd(String text, int position) {
    if (position <= 0 || position >= text.length()) {
      return false;
    }
    char previous = text.charAt(position - 1);
    if (previous == '\n') {
      return true;
    }
    return (previous == '.' || previous == '!' || previous == '?')
        && Character.isWhitespace(text.charAt(position));
  }
}
