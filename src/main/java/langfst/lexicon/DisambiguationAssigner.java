// # Disambiguation symbols
//
// A lexicon transducer can only be determinized (after it is composed with a grammar) if no pronunciation equals
// another one and no pronunciation is a prefix of another one. Otherwise, after reading "k a t" the decoder could not
// tell whether it has finished "CAT" or is halfway through "CATS".
//
// We fix this by appending synthetic tokens `#1`, `#2`, ... to the pronunciations that need them:
//
// 1. Count how often each pronunciation occurs.
// 2. Record every proper, non-empty prefix of every pronunciation.
// 3. Walk the lexicon in order. A pronunciation that occurs once and is nobody's prefix stays as it is. Every other
//    entry gets `#1` the first time its pronunciation is seen, `#2` the second time, and so on.
//
// `#0` is never produced here. It is reserved for the self-loops added by `FstBuilder`.
package langfst.lexicon;

import langfst.InvalidLexiconException;
import org.apache.lucene.util.InfoStream;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DisambiguationAssigner {

    public static final String DISAMBIG_PREFIX = "#";

    /** The index of the global disambiguation symbol {@code #0}. */
    public static final int GLOBAL_DISAMBIG_INDEX = 0;

    private static final int FIRST_ALLOWED_DISAMBIG = GLOBAL_DISAMBIG_INDEX + 1;

    private DisambiguationAssigner() {
    }

    /** Formats disambiguation index {@code index} as a token, e.g. {@code #3}. */
    public static String disambigSymbol(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("disambiguation index must be >= 0, got " + index);
        }
        return DISAMBIG_PREFIX + index;
    }

    public static DisambiguatedLexicon assign(Lexicon lexicon) {
        return assign(lexicon, InfoStream.NO_OUTPUT);
    }

    /**
     * Returns a new lexicon in which no two pronunciations are equal and none is a proper prefix of another. The input
     * lexicon is not modified.
     *
     * @throws InvalidLexiconException if an entry has an empty pronunciation
     */
    public static DisambiguatedLexicon assign(Lexicon lexicon, InfoStream infoStream) {
        for (LexiconEntry entry : lexicon) {
            if (entry.tokens().isEmpty()) {
                throw new InvalidLexiconException(entry.word(), "empty pronunciation");
            }
        }
        Map<String, Integer> counts = countPronunciations(lexicon);
        Set<String> prefixes = collectProperPrefixes(lexicon);

        Map<String, Integer> lastUsed = new HashMap<>();
        List<LexiconEntry> result = new ArrayList<>(lexicon.size());
        int maxDisambig = FIRST_ALLOWED_DISAMBIG - 1;
        int rewritten = 0;
        for (LexiconEntry entry : lexicon) {
            String key = entry.pronunciationKey();
            if (counts.get(key) == 1 && prefixes.contains(key) == false) {
                result.add(entry);
                continue;
            }
            int disambig = lastUsed.merge(key, FIRST_ALLOWED_DISAMBIG, (previous, first) -> previous + 1);
            maxDisambig = Math.max(maxDisambig, disambig);

            List<String> tokens = new ArrayList<>(entry.tokens().size() + 1);
            tokens.addAll(entry.tokens());
            tokens.add(disambigSymbol(disambig));
            result.add(new LexiconEntry(entry.word(), tokens));
            rewritten++;
        }

        if (infoStream.isEnabled("DA")) {
            infoStream.message("DA", "entries=" + lexicon.size() + " rewritten=" + rewritten
                    + " distinctPronunciations=" + counts.size() + " maxDisambig=" + maxDisambig);
        }
        return new DisambiguatedLexicon(new Lexicon(result), maxDisambig);
    }

    static Map<String, Integer> countPronunciations(Lexicon lexicon) {
        Map<String, Integer> counts = new HashMap<>();
        for (LexiconEntry entry : lexicon) {
            counts.merge(entry.pronunciationKey(), 1, Integer::sum);
        }
        return counts;
    }

    // Drop the last token over and over; every shorter, non-empty key is somebody's proper prefix.
    static Set<String> collectProperPrefixes(Lexicon lexicon) {
        Set<String> prefixes = new HashSet<>();
        for (LexiconEntry entry : lexicon) {
            List<String> tokens = entry.tokens();
            for (int length = tokens.size() - 1; length > 0; length--) {
                prefixes.add(String.join(" ", tokens.subList(0, length)));
            }
        }
        return prefixes;
    }
}
