package com.barcache.core.exception;

/**
 * The provider does not know the requested symbol. Never retried.
 */
public class InvalidSymbolException extends MarketDataException {

    private final String symbol;

    public InvalidSymbolException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
