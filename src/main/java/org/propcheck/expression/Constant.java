package org.propcheck.expression;

import java.util.List;

/**
 * Costante logica: vale sempre {@code value}, indipendentemente dall'assegnamento.
 *
 * @param value valore di verità fisso
 */
public record Constant(boolean value) implements Expression {

    /** Costante vera (notazione {@code T} o {@code true}) */
    public static final Constant TRUE = new Constant(true);

    /** Costante falsa (notazione {@code F} o {@code false}) */
    public static final Constant FALSE = new Constant(false);

    @Override
    public boolean evaluate(long assignment) {
        return value;
    }

    @Override
    public String toNotation(List<String> variableNames) {
        return value ? "T" : "F";
    }
}
