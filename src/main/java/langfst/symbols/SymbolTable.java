// # Symbol tables
//
// A symbol table is a bidirectional mapping between symbols and non-negative integer ids. The compiler keeps two:
// one for tokens (the input side of the lexicon transducer) and one for words (the output side).
//
// The symbols live in a Lucene `BytesRefHash`. It hands out dense ordinals in insertion order and reports a repeated
// insert with a negative return value, which is exactly the "no duplicate symbols, remember insertion order"
// behavior we need. Ids in a symbol file need not be dense, so each ordinal is mapped to its id separately.
package langfst.symbols;

import langfst.SymbolContractException;
import langfst.UnknownSymbolException;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefHash;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SymbolTable {

    /** Epsilon; must have id 0 in the word table. */
    public static final String EPSILON = "<eps>";

    /** Unknown token; must have id 0 in the token table. */
    public static final String UNK = "<unk>";

    /** The global disambiguation symbol, used by self-loops. */
    public static final String GLOBAL_DISAMBIG = "#0";

    private final String name;
    private final BytesRefHash symbols = new BytesRefHash();
    private final Map<Integer, Integer> idToOrd = new HashMap<>();
    private int[] ordToId = new int[16];
    private int maxId = -1;

    public SymbolTable(String name) {
        this.name = name;
    }

    /** Creates a table that numbers {@code symbols} 0, 1, 2, ... in order. */
    public static SymbolTable of(String name, String... symbols) {
        SymbolTable table = new SymbolTable(name);
        for (String symbol : symbols) {
            table.add(symbol);
        }
        return table;
    }

    public String getName() {
        return name;
    }

    /**
     * Adds {@code symbol} with the next free id (one past the largest id so far).
     *
     * @return the new id
     * @throws SymbolContractException if the symbol is already present, or if the largest id is already
     *         {@link Integer#MAX_VALUE}
     */
    public int add(String symbol) {
        if (maxId == Integer.MAX_VALUE) {
            throw new SymbolContractException(symbol, "no id left for symbol '" + symbol + "' in symbol table '"
                    + name + "': largest id is already " + Integer.MAX_VALUE);
        }
        return add(symbol, maxId + 1);
    }

    /**
     * Adds {@code symbol} with the given id.
     *
     * @throws SymbolContractException if the symbol or the id is already present
     */
    public int add(String symbol, int id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got " + id + " for symbol '" + symbol + "'");
        }
        if (idToOrd.containsKey(id)) {
            throw new SymbolContractException(symbol, "id " + id + " is already used by '" + symbol(id)
                    + "' in symbol table '" + name + "'");
        }
        int ord = symbols.add(new BytesRef(symbol));
        if (ord < 0) {
            throw new SymbolContractException(symbol, "symbol '" + symbol + "' already exists in symbol table '"
                    + name + "' with id " + id(symbol));
        }
        ordToId = ArrayUtil.grow(ordToId, ord + 1);
        ordToId[ord] = id;
        idToOrd.put(id, ord);
        maxId = Math.max(maxId, id);
        return id;
    }

    /** Returns the id of {@code symbol}, adding it with the next free id if it is absent. */
    public int getOrAdd(String symbol) {
        int ord = symbols.find(new BytesRef(symbol));
        return ord < 0 ? add(symbol) : ordToId[ord];
    }

    /**
     * @throws UnknownSymbolException if the symbol is absent
     */
    public int id(String symbol) {
        int ord = symbols.find(new BytesRef(symbol));
        if (ord < 0) {
            throw new UnknownSymbolException(name, symbol);
        }
        return ordToId[ord];
    }

    public boolean contains(String symbol) {
        return symbols.find(new BytesRef(symbol)) >= 0;
    }

    /**
     * @throws UnknownSymbolException if no symbol has this id
     */
    public String symbol(int id) {
        Integer ord = idToOrd.get(id);
        if (ord == null) {
            throw new UnknownSymbolException(name, "id:" + id);
        }
        return symbols.get(ord, new BytesRef()).utf8ToString();
    }

    /** All symbols in insertion order. */
    public List<String> symbols() {
        List<String> result = new ArrayList<>(symbols.size());
        BytesRef scratch = new BytesRef();
        for (int ord = 0; ord < symbols.size(); ord++) {
            result.add(symbols.get(ord, scratch).utf8ToString());
        }
        return result;
    }

    public int size() {
        return symbols.size();
    }

    /** The largest id in the table, or -1 if it is empty. */
    public int maxId() {
        return maxId;
    }

    /** Returns an independent table with the same symbols, ids and insertion order. */
    public SymbolTable copy() {
        SymbolTable copy = new SymbolTable(name);
        BytesRef scratch = new BytesRef();
        for (int ord = 0; ord < symbols.size(); ord++) {
            copy.add(symbols.get(ord, scratch).utf8ToString(), ordToId[ord]);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "SymbolTable(" + name + ", size=" + size() + ")";
    }
}
