package org.propcheck.input;

import org.propcheck.PropCheckException;

/**
 * Riga non riconosciuta dalla grammatica, nemmeno dopo il tentativo tra parentesi.
 */
public class PropositionSyntaxException extends PropCheckException {

    private final String sourceName;
    private final int lineNumber;
    private final String line;

    /**
     * @param sourceName nome dell'input (tipicamente il percorso del file)
     * @param lineNumber numero di riga a partire da 1
     * @param line testo della riga errata
     */
    public PropositionSyntaxException(String sourceName, int lineNumber, String line) {
        super("Errore di sintassi alla riga " + lineNumber + " in " + sourceName);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** @return numero di riga (1-based) */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
