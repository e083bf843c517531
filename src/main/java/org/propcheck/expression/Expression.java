package org.propcheck.expression;

import java.util.List;

/**
 * ESPRESSIONE PROPOSIZIONALE - Nodo immutabile dell'albero sintattico
 *
 * Rappresenta una proposizione come albero di nodi, ciascuno dei quali è una funzione
 * pura da assegnamento (bitmask delle variabili) a valore di verità.
 *
 * VARIANTI AMMESSE (insieme chiuso):
 * • {@link Constant}: costante logica T / F
 * • {@link Variable}: lettura del bit associato alla variabile
 * • {@link Negation}: negazione di una sottoespressione
 * • {@link BinaryExpression}: operatore binario tra due sottoespressioni
 *
 * PROPRIETÀ:
 * • Ogni nodo possiede i propri figli in esclusiva (albero, nessuna condivisione)
 * • Costruito una sola volta dal parser e mai modificato successivamente
 * • Valutazione deterministica e priva di effetti collaterali
 */
public sealed interface Expression permits Constant, Variable, Negation, BinaryExpression {

    /**
     * Valuta l'espressione sotto un assegnamento delle variabili.
     *
     * @param assignment bitmask in cui il bit {@code i} è il valore della variabile di indice {@code i}
     * @return valore di verità dell'espressione
     */
    boolean evaluate(long assignment);

    /**
     * Ricostruisce la notazione testuale completamente parentesizzata dell'espressione.
     * Il risultato, riletto dal parser, produce un albero semanticamente identico.
     *
     * @param variableNames nomi delle variabili in ordine di indice
     * @return rappresentazione testuale con simboli ASCII canonici
     */
    String toNotation(List<String> variableNames);
}
