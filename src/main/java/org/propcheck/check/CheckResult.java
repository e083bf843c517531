package org.propcheck.check;

import java.util.List;
import java.util.Objects;

/**
 * RISULTATO VERIFICA - Esito immutabile dell'enumerazione degli assegnamenti
 *
 * ESITI (mutuamente esclusivi):
 * • VERIFIED: la congettura vale in ogni assegnamento che soddisfa gli assiomi
 * • INCONSISTENT: nessun assegnamento soddisfa contemporaneamente tutti gli assiomi;
 *   esito informativo, non un errore
 * • COUNTER_EXAMPLE: esiste un assegnamento che soddisfa gli assiomi e falsifica la
 *   congettura; viene riportato il più piccolo in ordine numerico
 *
 * Nessun esito è un'eccezione: è compito del chiamante associarvi uno stato di uscita.
 */
public final class CheckResult {

    /** Esito della verifica */
    public enum Outcome {
        VERIFIED,
        INCONSISTENT,
        COUNTER_EXAMPLE
    }

    private final Outcome outcome;

    /** Bitmask del controesempio, significativo solo per COUNTER_EXAMPLE */
    private final long counterExampleMask;

    /** Valori delle variabili nel controesempio in ordine di indice, vuoto altrimenti */
    private final List<VariableAssignment> counterExample;

    private final CheckStatistics statistics;

    private CheckResult(Outcome outcome, long counterExampleMask,
                        List<VariableAssignment> counterExample, CheckStatistics statistics) {
        this.outcome = Objects.requireNonNull(outcome, "Esito non può essere null");
        this.counterExampleMask = counterExampleMask;
        this.counterExample = List.copyOf(counterExample);
        this.statistics = Objects.requireNonNull(statistics, "Statistiche non possono essere null");
    }

    //region FACTORY METHODS

    public static CheckResult verified(CheckStatistics statistics) {
        return new CheckResult(Outcome.VERIFIED, 0L, List.of(), statistics);
    }

    public static CheckResult inconsistent(CheckStatistics statistics) {
        return new CheckResult(Outcome.INCONSISTENT, 0L, List.of(), statistics);
    }

    /**
     * @param mask assegnamento che falsifica la congettura
     * @param assignments valori delle variabili sotto {@code mask}, in ordine di indice
     * @param statistics metriche dell'enumerazione
     */
    public static CheckResult counterExample(long mask, List<VariableAssignment> assignments,
                                             CheckStatistics statistics) {
        if (assignments == null) {
            throw new IllegalArgumentException("Controesempio richiede la lista degli assegnamenti");
        }
        return new CheckResult(Outcome.COUNTER_EXAMPLE, mask, assignments, statistics);
    }

    //endregion

    //region ACCESSORS

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isVerified() {
        return outcome == Outcome.VERIFIED;
    }

    public boolean isInconsistent() {
        return outcome == Outcome.INCONSISTENT;
    }

    public boolean isCounterExample() {
        return outcome == Outcome.COUNTER_EXAMPLE;
    }

    /**
     * @return bitmask del controesempio
     * @throws IllegalStateException se l'esito non è COUNTER_EXAMPLE
     */
    public long getCounterExampleMask() {
        if (!isCounterExample()) {
            throw new IllegalStateException("Nessun controesempio per esito " + outcome);
        }
        return counterExampleMask;
    }

    /** @return valori delle variabili nel controesempio (vuoto se non COUNTER_EXAMPLE) */
    public List<VariableAssignment> getCounterExample() {
        return counterExample;
    }

    public CheckStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        if (isCounterExample()) {
            return "CheckResult[" + outcome + ", mask=" + counterExampleMask + ", " + counterExample + "]";
        }
        return "CheckResult[" + outcome + "]";
    }
}
