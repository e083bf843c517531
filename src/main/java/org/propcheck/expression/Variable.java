package org.propcheck.expression;

import org.propcheck.parser.VariableRegistry;

import java.util.List;

/**
 * Riferimento a una variabile proposizionale tramite il suo indice nel registro.
 *
 * Il valore della variabile è il bit {@code index} dell'assegnamento. L'indice è
 * compreso tra 0 e {@link VariableRegistry#MAX_VARIABLES} escluso.
 *
 * @param index posizione della variabile nel registro
 */
public record Variable(int index) implements Expression {

    public Variable {
        if (index < 0 || index >= VariableRegistry.MAX_VARIABLES) {
            throw new IllegalArgumentException("Indice variabile fuori intervallo [0, "
                    + VariableRegistry.MAX_VARIABLES + "): " + index);
        }
    }

    @Override
    public boolean evaluate(long assignment) {
        return ((assignment >>> index) & 1L) != 0;
    }

    @Override
    public String toNotation(List<String> variableNames) {
        String name = index < variableNames.size() ? variableNames.get(index) : "#" + index;
        return "[" + name + "]";
    }
}
