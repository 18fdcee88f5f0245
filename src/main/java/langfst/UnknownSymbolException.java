package langfst;

/**
 * Thrown when a token or word used by the lexicon is absent from its symbol table, or when an id has no symbol.
 */
public class UnknownSymbolException extends IllegalArgumentException {
    private final String symbol;
    private final String tableName;

    public UnknownSymbolException(String tableName, String symbol) {
        super("symbol '" + symbol + "' is not in symbol table '" + tableName + "'");
        this.symbol = symbol;
        this.tableName = tableName;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getTableName() {
        return tableName;
    }
}
