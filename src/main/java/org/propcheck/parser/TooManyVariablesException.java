package org.propcheck.parser;

import org.propcheck.PropCheckException;

/**
 * Sollevata quando viene incontrato il nome della variabile che supererebbe il limite
 * di {@link VariableRegistry#MAX_VARIABLES} variabili distinte.
 */
public class TooManyVariablesException extends PropCheckException {

    private final String variableName;

    public TooManyVariablesException(String variableName) {
        super("Oltre " + VariableRegistry.MAX_VARIABLES
                + " variabili proposizionali (variabile in eccesso: [" + variableName + "])");
        this.variableName = variableName;
    }

    /** @return nome della variabile che ha superato il limite */
    public String getVariableName() {
        return variableName;
    }
}
