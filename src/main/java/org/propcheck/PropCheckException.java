package org.propcheck;

/**
 * Errore fatale della fase di lettura e parsing delle proposizioni.
 *
 * Le condizioni rappresentate da questa gerarchia interrompono immediatamente
 * l'elaborazione: nessun risultato parziale viene prodotto e l'enumerazione non
 * viene avviata. Gli esiti dell'enumerazione (teorema falso, assiomi inconsistenti)
 * non sono errori e non passano mai da qui.
 */
public class PropCheckException extends RuntimeException {

    public PropCheckException(String message) {
        super(message);
    }

    public PropCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
