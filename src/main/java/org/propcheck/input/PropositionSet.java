package org.propcheck.input;

import org.propcheck.expression.Expression;
import org.propcheck.parser.VariableRegistry;

import java.util.List;

/**
 * Proposizioni lette da un input, nell'ordine delle righe, con il registro delle
 * variabili popolato durante la lettura.
 *
 * L'ultima proposizione è la congettura, tutte le precedenti sono assiomi.
 *
 * @param sourceName nome dell'input di provenienza
 * @param propositions assiomi seguiti dalla congettura (almeno un elemento)
 * @param registry registro delle variabili, di sola lettura dopo il parsing
 */
public record PropositionSet(String sourceName, List<Expression> propositions, VariableRegistry registry) {

    public PropositionSet {
        if (propositions == null || propositions.isEmpty()) {
            throw new IllegalArgumentException("Insieme di proposizioni vuoto per " + sourceName);
        }
        if (registry == null) {
            throw new IllegalArgumentException("Registro variabili non può essere null");
        }
        propositions = List.copyOf(propositions);
    }

    /** @return proposizioni diverse dall'ultima */
    public List<Expression> axioms() {
        return propositions.subList(0, propositions.size() - 1);
    }

    /** @return ultima proposizione */
    public Expression conjecture() {
        return propositions.get(propositions.size() - 1);
    }
}
