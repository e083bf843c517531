package org.propcheck.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * REGISTRO VARIABILI - Associazione stabile nome -> indice
 *
 * Assegna a ogni nome di variabile distinto un indice intero piccolo, nell'ordine
 * della prima occorrenza nell'intero input. L'indice è la posizione del bit che
 * rappresenta la variabile nell'assegnamento.
 *
 * INVARIANTI:
 * • L'indice di un nome non cambia mai una volta assegnato
 * • Gli indici crescono monotonamente seguendo l'ordine di prima occorrenza
 * • Il numero di variabili non supera mai {@link #MAX_VARIABLES}
 *
 * Il registro viene creato nuovo per ogni esecuzione, viene popolato durante la fase
 * di parsing (strettamente sequenziale) ed è di sola lettura per il resto dell'esecuzione.
 */
public class VariableRegistry {

    private static final Logger LOGGER = Logger.getLogger(VariableRegistry.class.getName());

    /** Limite di variabili distinte rappresentabili nell'assegnamento */
    public static final int MAX_VARIABLES = 32;

    /** Nomi registrati in ordine di indice */
    private final List<String> names = new ArrayList<>();

    /** Indice inverso nome -> posizione per ricerca in tempo costante */
    private final Map<String, Integer> indexByName = new HashMap<>();

    /**
     * Restituisce l'indice della variabile, registrandola se incontrata per la prima volta.
     *
     * Il confronto tra nomi è per uguaglianza esatta dopo la rimozione degli spazi
     * iniziali e finali; gli spazi interni sono conservati.
     *
     * @param name nome della variabile (non null)
     * @return indice della variabile nel registro
     * @throws TooManyVariablesException se il nome è il trentatreesimo distinto
     */
    public int resolve(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome variabile non può essere null");
        }

        String key = PropositionParser.trimSpaces(name);
        Integer existing = indexByName.get(key);
        if (existing != null) {
            return existing;
        }

        if (names.size() >= MAX_VARIABLES) {
            LOGGER.warning("Limite di " + MAX_VARIABLES + " variabili superato da [" + key + "]");
            throw new TooManyVariablesException(key);
        }

        int index = names.size();
        names.add(key);
        indexByName.put(key, index);
        LOGGER.finest("Registrata variabile [" + key + "] con indice " + index);
        return index;
    }

    /** @return numero di variabili registrate */
    public int size() {
        return names.size();
    }

    /**
     * @param index indice della variabile
     * @return nome registrato per quell'indice
     * @throws IllegalArgumentException se l'indice non è registrato
     */
    public String nameOf(int index) {
        if (index < 0 || index >= names.size()) {
            throw new IllegalArgumentException("Indice variabile non registrato: " + index);
        }
        return names.get(index);
    }

    /** @return vista non modificabile dei nomi in ordine di indice */
    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return "VariableRegistry" + names;
    }
}
