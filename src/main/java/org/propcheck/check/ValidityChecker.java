package org.propcheck.check;

import org.propcheck.expression.Expression;
import org.propcheck.parser.VariableRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * VERIFICATORE DI VALIDITÀ - Enumerazione esaustiva degli assegnamenti
 *
 * Decide se l'ultima proposizione (congettura) è conseguenza logica delle precedenti
 * (assiomi) valutandole sotto ogni assegnamento delle variabili registrate.
 *
 * ALGORITMO:
 * 1. Gli assegnamenti sono generati in ordine numerico crescente, da 0 a 2^V - 1
 * 2. Per ciascuno si valutano gli assiomi, fermandosi al primo falso
 * 3. Se tutti gli assiomi sono veri gli assiomi risultano consistenti e si valuta la congettura
 * 4. La prima congettura falsa termina l'enumerazione con un controesempio
 * 5. Esaurito lo spazio: VERIFIED se gli assiomi sono stati soddisfatti almeno una volta,
 *    INCONSISTENT altrimenti
 *
 * Il costo è O(2^V · dimensione degli alberi): metodo a forza bruta, limitato dal tetto
 * di {@link VariableRegistry#MAX_VARIABLES} variabili.
 */
public class ValidityChecker {

    private static final Logger LOGGER = Logger.getLogger(ValidityChecker.class.getName());

    /**
     * Verifica la congettura rispetto agli assiomi.
     *
     * @param propositions assiomi seguiti dalla congettura (almeno un elemento)
     * @param variableNames nomi delle variabili in ordine di indice (al più 32)
     * @return esito della verifica con statistiche
     * @throws IllegalArgumentException se non ci sono proposizioni o le variabili sono troppe
     */
    public CheckResult check(List<Expression> propositions, List<String> variableNames) {
        validateInput(propositions, variableNames);

        int variableCount = variableNames.size();
        int axiomCount = propositions.size() - 1;
        Expression conjecture = propositions.get(axiomCount);
        long assignmentSpace = 1L << variableCount;

        LOGGER.info("Enumerazione di " + assignmentSpace + " assegnamenti ("
                + variableCount + " variabili, " + axiomCount + " assiomi)");

        CheckStatistics statistics = new CheckStatistics(variableCount, propositions.size());
        boolean consistent = false;

        for (long mask = 0; mask < assignmentSpace; mask++) {
            statistics.incrementAssignmentsEvaluated();

            if (!axiomsHold(propositions, axiomCount, mask)) {
                continue;
            }
            consistent = true;
            statistics.incrementAxiomModels();

            if (!conjecture.evaluate(mask)) {
                statistics.stopTimer();
                LOGGER.fine("Controesempio trovato all'assegnamento " + mask);
                return CheckResult.counterExample(mask, describeAssignment(mask, variableNames), statistics);
            }
        }

        statistics.stopTimer();
        LOGGER.fine("Enumerazione completata: " + statistics);
        return consistent ? CheckResult.verified(statistics) : CheckResult.inconsistent(statistics);
    }

    /**
     * Valuta gli assiomi in ordine fermandosi al primo falso.
     */
    private static boolean axiomsHold(List<Expression> propositions, int axiomCount, long mask) {
        for (int i = 0; i < axiomCount; i++) {
            if (!propositions.get(i).evaluate(mask)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Traduce un assegnamento nella lista (nome, valore) in ordine di indice.
     *
     * @param mask bitmask dell'assegnamento
     * @param variableNames nomi delle variabili in ordine di indice
     * @return valori di tutte le variabili registrate
     */
    public static List<VariableAssignment> describeAssignment(long mask, List<String> variableNames) {
        List<VariableAssignment> assignments = new ArrayList<>(variableNames.size());
        for (int i = 0; i < variableNames.size(); i++) {
            assignments.add(new VariableAssignment(variableNames.get(i), ((mask >>> i) & 1L) != 0));
        }
        return assignments;
    }

    private static void validateInput(List<Expression> propositions, List<String> variableNames) {
        if (propositions == null || propositions.isEmpty()) {
            throw new IllegalArgumentException("Nessuna proposizione da verificare");
        }
        if (propositions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista proposizioni non può contenere elementi null");
        }
        if (variableNames == null) {
            throw new IllegalArgumentException("Lista nomi variabili non può essere null");
        }
        if (variableNames.size() > VariableRegistry.MAX_VARIABLES) {
            throw new IllegalArgumentException("Numero di variabili oltre il limite di "
                    + VariableRegistry.MAX_VARIABLES + ": " + variableNames.size());
        }
    }
}
