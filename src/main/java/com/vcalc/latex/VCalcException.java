package com.vcalc.latex;

/** Root of every failure raised by the vcalc engine. */
public class VCalcException extends RuntimeException {

    public VCalcException(String message) {
        super(message);
    }

    public VCalcException(String message, Throwable cause) {
        super(message, cause);
    }

    public VCalcException(Throwable cause) {
        super(cause);
    }
}
