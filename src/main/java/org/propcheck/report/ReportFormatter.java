package org.propcheck.report;

import org.propcheck.check.CheckResult;
import org.propcheck.check.CheckStatistics;
import org.propcheck.check.VariableAssignment;

/**
 * Formattazione testuale dell'esito di una verifica.
 *
 * Per un controesempio produce una tabella con una riga per variabile, nell'ordine
 * di indice del registro; l'intestazione della tabella è omessa se non ci sono variabili.
 */
public class ReportFormatter {

    /** Larghezza della colonna dei nomi, allineati a destra */
    private static final int NAME_COLUMN_WIDTH = 40;

    static final String VERIFIED_MESSAGE = "Teorema verificato!";
    static final String INCONSISTENT_MESSAGE = "Gli assiomi non sono consistenti!";
    static final String FALSIFIED_MESSAGE = "Il teorema è falso!";
    static final String COUNTER_EXAMPLE_HEADER = "Controesempio:";

    /**
     * @param result esito della verifica
     * @return testo del report, una riga per elemento, terminato da a capo
     */
    public String format(CheckResult result) {
        StringBuilder report = new StringBuilder();

        switch (result.getOutcome()) {
            case VERIFIED -> report.append(VERIFIED_MESSAGE).append('\n');
            case INCONSISTENT -> report.append(INCONSISTENT_MESSAGE).append('\n');
            case COUNTER_EXAMPLE -> {
                report.append(FALSIFIED_MESSAGE).append('\n');
                if (!result.getCounterExample().isEmpty()) {
                    report.append(COUNTER_EXAMPLE_HEADER).append('\n');
                    report.append(row("Proposizione", "Valore"));
                    for (VariableAssignment assignment : result.getCounterExample()) {
                        report.append(row(assignment.name(), assignment.value() ? "Vero" : "Falso"));
                    }
                }
            }
        }

        return report.toString();
    }

    /**
     * Riepilogo delle metriche di esecuzione, mostrato in modalità verbosa.
     */
    public String formatStatistics(CheckStatistics statistics) {
        return "\n-->> STATISTICHE <<--\n"
                + "Variabili: " + statistics.getVariableCount() + "\n"
                + "Proposizioni: " + statistics.getPropositionCount() + "\n"
                + "Assegnamenti esaminati: " + statistics.getAssignmentsEvaluated()
                + " su " + statistics.getAssignmentSpace() + "\n"
                + "Assegnamenti che soddisfano gli assiomi: " + statistics.getAxiomModels() + "\n"
                + "Tempo: " + statistics.getExecutionTimeMs() + " ms\n";
    }

    private static String row(String name, String value) {
        return String.format("%" + NAME_COLUMN_WIDTH + "s %s\n", name, value);
    }
}
