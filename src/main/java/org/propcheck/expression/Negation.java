package org.propcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Negazione logica: vera se e solo se l'operando è falso.
 *
 * @param operand sottoespressione negata (non null)
 */
public record Negation(Expression operand) implements Expression {

    public Negation {
        Objects.requireNonNull(operand, "Operando per negazione non può essere null");
    }

    @Override
    public boolean evaluate(long assignment) {
        return !operand.evaluate(assignment);
    }

    @Override
    public String toNotation(List<String> variableNames) {
        return "!" + operand.toNotation(variableNames);
    }
}
