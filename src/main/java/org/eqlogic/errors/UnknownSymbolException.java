package org.eqlogic.errors;

public class UnknownSymbolException extends EquationalException {

    public UnknownSymbolException(String message) {
        super(ErrorKind.UNKNOWN_SYMBOL, message);
    }
}
