package langfst;

/**
 * Thrown when a symbol table breaks the contract the compiler relies on: a reserved symbol is missing or has the
 * wrong id, or a symbol (or id) would be added twice.
 */
public class SymbolContractException extends IllegalStateException {
    private final String symbol;

    public SymbolContractException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
