// # Vocabulary segmentation
//
// A stand-in for a trained sub-word model. The word is prefixed with the sentencepiece word-start marker `▁`, then
// split greedily: at each position we take the longest vocabulary piece that matches. Characters that no piece
// covers collapse into a single unknown token per run, which is also how sentencepiece reports them.
//
// Example with the vocabulary `▁ca`, `▁c`, `t`, `s`, `a`:
//
// ```
// CATS -> ▁ca t s
// ```
//
// Matching uses a character trie, one node per vocabulary prefix.
package langfst.lexicon;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class VocabularySegmenter implements WordSegmenter {

    public static final char WORD_START = '▁';

    private final Node root = new Node();
    private final String unknownToken;

    public VocabularySegmenter(Collection<String> vocabulary, String unknownToken) {
        this.unknownToken = unknownToken;
        for (String piece : vocabulary) {
            if (piece.isEmpty() == false) {
                add(piece);
            }
        }
    }

    private void add(String piece) {
        Node current = root;
        for (char c : piece.toCharArray()) {
            current = current.children.computeIfAbsent(c, k -> new Node());
        }
        current.piece = piece;
    }

    @Override
    public List<String> segment(String word) {
        String text = WORD_START + word;
        List<String> pieces = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            String match = null;
            Node current = root;
            for (int i = pos; i < text.length(); i++) {
                current = current.children.get(text.charAt(i));
                if (current == null) {
                    break;
                }
                if (current.piece != null) {
                    match = current.piece;
                }
            }
            if (match == null) {
                if (pieces.isEmpty() || pieces.get(pieces.size() - 1).equals(unknownToken) == false) {
                    pieces.add(unknownToken);
                }
                pos++;
            } else {
                pieces.add(match);
                pos += match.length();
            }
        }
        return pieces;
    }

    private static class Node {
        String piece;
        final Map<Character, Node> children = new HashMap<>();
    }
}
