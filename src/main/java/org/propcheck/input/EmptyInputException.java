package org.propcheck.input;

import org.propcheck.PropCheckException;

/**
 * L'input non contiene alcuna proposizione: solo righe vuote o commenti.
 */
public class EmptyInputException extends PropCheckException {

    private final String sourceName;

    public EmptyInputException(String sourceName) {
        super("Nessun teorema da verificare in " + sourceName);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
