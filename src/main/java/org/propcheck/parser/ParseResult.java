package org.propcheck.parser;

import org.propcheck.expression.Expression;

/**
 * Esito di una primitiva di parsing: numero di caratteri consumati ed espressione costruita.
 *
 * Un conteggio pari a zero è il segnale uniforme di mancata corrispondenza, propagato
 * attraverso tutte le funzioni del parser.
 *
 * @param consumed caratteri consumati a partire dalla posizione di ingresso
 * @param expression espressione riconosciuta (null se {@code consumed == 0})
 */
record ParseResult(int consumed, Expression expression) {

    /** Nessuna corrispondenza: zero caratteri consumati */
    static final ParseResult NO_MATCH = new ParseResult(0, null);

    static ParseResult of(int consumed, Expression expression) {
        return new ParseResult(consumed, expression);
    }

    /** @return true se la primitiva ha riconosciuto un prefisso non vuoto */
    boolean matched() {
        return consumed > 0;
    }
}
