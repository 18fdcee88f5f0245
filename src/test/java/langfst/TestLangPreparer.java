package langfst;

import langfst.fst.Arc;
import langfst.lexicon.Lexicon;
import langfst.lexicon.LexiconEntry;
import langfst.lexicon.VocabularySegmenter;
import langfst.symbols.SymbolTable;
import org.apache.lucene.tests.util.LuceneTestCase;
import org.apache.lucene.util.InfoStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class TestLangPreparer extends LuceneTestCase {

    private static SymbolTable wordTable() {
        return SymbolTable.of("words", "<eps>", "!SIL", "<UNK>", "CAT", "CATS", "DOG", "KAT");
    }

    private static SymbolTable tokenTable() {
        return SymbolTable.of("tokens", "<unk>", "▁ca", "▁do", "t", "s", "g", "▁k", "a");
    }

    public void testPrepare() {
        SymbolTable words = wordTable();
        SymbolTable tokens = tokenTable();
        VocabularySegmenter segmenter = new VocabularySegmenter(List.of("▁ca", "▁do", "t", "s", "g", "▁k", "a"), "<unk>");

        PreparedLang lang = new LangPreparer(new LangConfig()).prepare(words, tokens, segmenter);

        assertEquals(Lexicon.of(
                LexiconEntry.of("CAT", "<unk>"),
                LexiconEntry.of("CATS", "<unk>"),
                LexiconEntry.of("DOG", "<unk>"),
                LexiconEntry.of("KAT", "<unk>"),
                LexiconEntry.of("<UNK>", "<unk>")), lang.lexicon());
        assertEquals(5, lang.maxDisambigIndex());
        assertEquals(List.of("<unk>", "#1"), lang.disambigLexicon().get(0).tokens());
        assertEquals(List.of("<unk>", "#5"), lang.disambigLexicon().get(4).tokens());

        // caller tables are untouched, copies are extended
        assertEquals(8, tokens.size());
        assertEquals(8 + 6, lang.tokens().size());
        assertEquals(13, lang.tokens().id("#5"));
        assertEquals(List.of("<eps>", "!SIL", "<UNK>", "CAT", "CATS", "DOG", "KAT", "#0", "<s>", "</s>"),
                lang.words().symbols());
        assertFalse(words.contains("#0"));
    }

    public void testPrepareLowercaseWords() {
        SymbolTable words = SymbolTable.of("words", "<eps>", "<UNK>", "cat", "cats", "kat");
        VocabularySegmenter segmenter = new VocabularySegmenter(List.of("▁ca", "t", "s", "▁k", "a"), "<unk>");

        PreparedLang lang = new LangPreparer(new LangConfig()).prepare(words, tokenTable(), segmenter);

        assertEquals(Lexicon.of(
                LexiconEntry.of("cat", "▁ca", "t"),
                LexiconEntry.of("cats", "▁ca", "t", "s"),
                LexiconEntry.of("kat", "▁k", "a", "t"),
                LexiconEntry.of("<UNK>", "<unk>")), lang.lexicon());
        assertEquals(List.of("▁ca", "t", "#1"), lang.disambigLexicon().get(0).tokens());
        assertEquals(lang.lexicon().get(1), lang.disambigLexicon().get(1));
        assertEquals(1, lang.maxDisambigIndex());
        assertTrue(lang.tokens().contains("#0"));
        assertTrue(lang.tokens().contains("#1"));
        assertFalse(lang.tokens().contains("#2"));

        int disambigToken = lang.tokens().id("#0");
        int disambigWord = lang.words().id("#0");
        assertTrue(lang.disambigFst().arcs().contains(Arc.of(0, 0, disambigToken, disambigWord)));
        for (Arc arc : lang.lexiconFst().arcs()) {
            assertFalse(arc.inputLabel() == disambigToken);
        }
    }

    public void testExistingDisambigTokenIsRejected() {
        SymbolTable tokens = SymbolTable.of("tokens", "<unk>", "a", "#1");
        Lexicon lexicon = Lexicon.of(LexiconEntry.of("A", "a"), LexiconEntry.of("AA", "a"));

        SymbolContractException e = expectThrows(SymbolContractException.class,
                () -> new LangPreparer(new LangConfig()).prepare(lexicon, SymbolTable.of("words", "<eps>", "A", "AA"),
                        tokens));
        assertEquals("#1", e.getSymbol());
    }

    public void testExistingWordSymbolsAreReused() {
        SymbolTable words = SymbolTable.of("words", "<eps>", "A", "#0", "<s>", "</s>");
        Lexicon lexicon = Lexicon.of(LexiconEntry.of("A", "a"));

        PreparedLang lang = new LangPreparer(new LangConfig()).prepare(lexicon, words, SymbolTable.of("tokens", "<unk>", "a"));

        assertEquals(words.symbols(), lang.words().symbols());
        assertTrue(lang.disambigFst().arcs().contains(Arc.of(0, 0, 2, 2)));
    }

    public void testInfoStream() {
        List<String> messages = new ArrayList<>();
        Lexicon lexicon = Lexicon.of(LexiconEntry.of("A", "a"), LexiconEntry.of("B", "a"));

        new LangPreparer(new LangConfig().setInfoStream(collecting(messages)))
                .prepare(lexicon, SymbolTable.of("words", "<eps>", "A", "B"), SymbolTable.of("tokens", "<unk>", "a"));

        assertTrue(messages.toString(), messages.stream().anyMatch(m -> m.startsWith("DA: ") && m.contains("maxDisambig=2")));
        assertTrue(messages.toString(), messages.stream().anyMatch(m -> m.startsWith("FST: added 1 #0 self-loops")));
        assertTrue(messages.toString(), messages.stream().anyMatch(m -> m.startsWith("LANG: ")));
    }

    // Verbose output must stay cheap on lexicons far larger than any automaton determinization could handle.
    public void testVerboseLargeLexicon() {
        Random random = random();
        int vocabularySize = 200;
        List<String> vocabulary = new ArrayList<>();
        for (int i = 0; i < vocabularySize; i++) {
            vocabulary.add("t" + i);
        }
        int numWords = TEST_NIGHTLY ? 200_000 : 20_000;
        List<String> wordSymbols = new ArrayList<>();
        wordSymbols.add("<eps>");
        List<LexiconEntry> entries = new ArrayList<>();
        for (int i = 0; i < numWords; i++) {
            int length = 1 + random.nextInt(6);
            List<String> tokens = new ArrayList<>();
            for (int j = 0; j < length; j++) {
                tokens.add(vocabulary.get(random.nextInt(vocabularySize)));
            }
            String word = "w" + i;
            wordSymbols.add(word);
            entries.add(new LexiconEntry(word, tokens));
        }
        List<String> tokenSymbols = new ArrayList<>();
        tokenSymbols.add("<unk>");
        tokenSymbols.addAll(vocabulary);
        List<String> messages = new ArrayList<>();

        PreparedLang lang = new LangPreparer(new LangConfig().setInfoStream(collecting(messages)))
                .prepare(new Lexicon(entries), SymbolTable.of("words", wordSymbols.toArray(new String[0])),
                        SymbolTable.of("tokens", tokenSymbols.toArray(new String[0])));

        assertEquals(numWords, lang.lexicon().size());
        String expected = "LANG: lexicon entries=" + numWords;
        String summary = messages.stream().filter(m -> m.startsWith(expected)).findFirst().orElse(null);
        assertNotNull(messages.size() + " messages", summary);
        assertTrue(summary, summary.contains(" L states=" + lang.lexiconFst().numStates()
                + " arcs=" + lang.lexiconFst().numArcs()));
        assertTrue(summary, summary.contains(" L_disambig states=" + lang.disambigFst().numStates()
                + " arcs=" + lang.disambigFst().numArcs()));
    }

    private static InfoStream collecting(List<String> messages) {
        return new InfoStream() {
            @Override
            public void message(String component, String message) {
                messages.add(component + ": " + message);
            }

            @Override
            public boolean isEnabled(String component) {
                return true;
            }

            @Override
            public void close() {
            }
        };
    }
}
