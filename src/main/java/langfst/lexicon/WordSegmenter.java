package langfst.lexicon;

import java.util.List;

/**
 * Splits a word into the sub-word tokens that spell it.
 */
@FunctionalInterface
public interface WordSegmenter {

    /** Returns a non-empty token sequence for {@code word}. */
    List<String> segment(String word);
}
