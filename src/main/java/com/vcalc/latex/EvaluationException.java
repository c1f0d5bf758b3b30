package com.vcalc.latex;

/** A statement failed while being evaluated; the sequencer drops the statement. */
public class EvaluationException extends VCalcException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
