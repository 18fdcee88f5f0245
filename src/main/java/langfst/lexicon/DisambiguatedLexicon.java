package langfst.lexicon;

/**
 * The output of {@link DisambiguationAssigner#assign(Lexicon)}: the rewritten lexicon and the largest disambiguation
 * index it uses (0 when no entry needed one).
 */
public record DisambiguatedLexicon(Lexicon lexicon, int maxDisambigIndex) {
}
