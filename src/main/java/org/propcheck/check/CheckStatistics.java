package org.propcheck.check;

/**
 * STATISTICHE VERIFICA - Metriche raccolte durante una singola enumerazione
 *
 * Contatori di assegnamenti esaminati e assegnamenti che soddisfano gli assiomi,
 * più il tempo di esecuzione misurato tra costruzione e {@link #stopTimer()}.
 * L'enumerazione è sequenziale: nessuna sincronizzazione è necessaria.
 */
public class CheckStatistics {

    //region CONTATORI

    /** Numero di variabili distinte enumerate */
    private final int variableCount;

    /** Numero di proposizioni considerate (assiomi + congettura) */
    private final int propositionCount;

    /** Assegnamenti generati dall'enumerazione */
    private long assignmentsEvaluated = 0;

    /** Assegnamenti sotto cui tutti gli assiomi sono veri */
    private long axiomModels = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * @param variableCount numero di variabili enumerate
     * @param propositionCount numero di proposizioni verificate
     */
    public CheckStatistics(int variableCount, int propositionCount) {
        this.variableCount = variableCount;
        this.propositionCount = propositionCount;
        this.startTime = System.currentTimeMillis();
    }

    void incrementAssignmentsEvaluated() {
        assignmentsEvaluated++;
    }

    void incrementAxiomModels() {
        axiomModels++;
    }

    /**
     * Ferma la misurazione del tempo. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /** @return tempo di esecuzione in ms (parziale se il timer non è fermato) */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getPropositionCount() {
        return propositionCount;
    }

    public long getAssignmentsEvaluated() {
        return assignmentsEvaluated;
    }

    public long getAxiomModels() {
        return axiomModels;
    }

    /** @return numero totale di assegnamenti possibili, 2^variabili */
    public long getAssignmentSpace() {
        return 1L << variableCount;
    }

    @Override
    public String toString() {
        return String.format("Stats[vars=%d, propositions=%d, evaluated=%d/%d, axiomModels=%d, time=%dms]",
                variableCount, propositionCount, assignmentsEvaluated, getAssignmentSpace(),
                axiomModels, getExecutionTimeMs());
    }
}
