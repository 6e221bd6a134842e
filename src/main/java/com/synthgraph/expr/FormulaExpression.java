package com.synthgraph.expr;

import java.util.Set;

/** Node of a parsed merge formula. */
public interface FormulaExpression {

    /** Unary functions callable from a formula. */
    Set<String> FUNCTIONS = Set.of("abs", "ceil", "floor", "ampdb", "dbamp");

    /** Identifier that names the engine sample rate rather than an input. */
    String SAMPLE_RATE = "sr";

    record Number(String text) implements FormulaExpression {
    }

    record Identifier(String name, int position) implements FormulaExpression {
    }

    record Negate(FormulaExpression operand) implements FormulaExpression {
    }

    record Binary(char operator, FormulaExpression left, FormulaExpression right) implements FormulaExpression {
    }

    record Call(String function, FormulaExpression argument) implements FormulaExpression {
    }
}
