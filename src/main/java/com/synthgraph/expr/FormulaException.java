package com.synthgraph.expr;

/** A merge formula could not be tokenized or parsed. */
public class FormulaException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public FormulaException(String message) {
        super(message);
    }
}
