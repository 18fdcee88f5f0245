package langfst;

import langfst.fst.LexiconFst;
import langfst.lexicon.Lexicon;
import langfst.symbols.SymbolTable;

/**
 * Everything {@link LangPreparer} produces for one language directory.
 *
 * @param tokens           the token table extended with {@code #0..#maxDisambig}
 * @param words            the word table extended with {@code #0} and the sentence symbols
 * @param lexicon          the generated lexicon
 * @param disambigLexicon  the lexicon with disambiguation symbols appended
 * @param maxDisambigIndex the largest disambiguation index in {@code disambigLexicon}
 * @param lexiconFst       the transducer of {@code lexicon}, without self-loops
 * @param disambigFst      the transducer of {@code disambigLexicon}, with {@code #0} self-loops
 */
public record PreparedLang(SymbolTable tokens,
                           SymbolTable words,
                           Lexicon lexicon,
                           Lexicon disambigLexicon,
                           int maxDisambigIndex,
                           LexiconFst lexiconFst,
                           LexiconFst disambigFst) {
}
