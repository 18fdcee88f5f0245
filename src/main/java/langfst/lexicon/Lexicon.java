package langfst.lexicon;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable, ordered sequence of {@link LexiconEntry}. Order matters: it decides which disambiguation symbol an
 * entry receives. The same word may appear several times with different pronunciations.
 */
public final class Lexicon implements Iterable<LexiconEntry> {
    private final List<LexiconEntry> entries;

    public Lexicon(Collection<LexiconEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Lexicon of(LexiconEntry... entries) {
        return new Lexicon(List.of(entries));
    }

    public List<LexiconEntry> entries() {
        return entries;
    }

    public LexiconEntry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Iterator<LexiconEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Lexicon) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Lexicon" + entries;
    }
}
