package org.propcheck.check;

/**
 * Valore di verità assegnato a una variabile in un controesempio.
 *
 * @param name nome della variabile come registrato
 * @param value valore della variabile nell'assegnamento
 */
public record VariableAssignment(String name, boolean value) {
}
