package org.propcheck.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.IntStream;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Cursore ad accesso diretto sui caratteri di una singola riga di input.
 *
 * Poggia su un {@link CharStream} ANTLR: le posizioni sono indici di code point e la
 * lettura oltre la fine della riga restituisce {@link #EOF} invece di sollevare errori,
 * così che le primitive del parser possano confrontare i caratteri senza controlli
 * di bordo espliciti.
 */
final class LineCursor {

    /** Valore restituito per qualunque posizione oltre l'ultimo carattere */
    static final int EOF = IntStream.EOF;

    private final CharStream stream;

    LineCursor(String line) {
        this.stream = CharStreams.fromString(line);
    }

    /** @return numero di caratteri (code point) della riga */
    int length() {
        return stream.size();
    }

    /**
     * @param position indice del carattere
     * @return code point alla posizione indicata, {@link #EOF} se fuori dalla riga
     */
    int charAt(int position) {
        if (position < 0 || position >= stream.size()) {
            return EOF;
        }
        stream.seek(position);
        return stream.LA(1);
    }

    /**
     * Verifica se il testo a partire da {@code position} inizia con {@code literal}.
     * Il confronto è case-sensitive.
     */
    boolean startsWith(int position, String literal) {
        for (int i = 0; i < literal.length(); i++) {
            if (charAt(position + i) != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Conta gli spazi consecutivi a partire da {@code position}.
     *
     * @return numero di caratteri di spaziatura saltati (0 se nessuno)
     */
    int skipSpaces(int position) {
        int end = position;
        while (PropositionParser.isSpace(charAt(end))) {
            end++;
        }
        return end - position;
    }

    /**
     * @param start posizione iniziale inclusa
     * @param end posizione finale esclusa
     * @return testo compreso nell'intervallo, stringa vuota se l'intervallo è vuoto
     */
    String text(int start, int end) {
        if (end <= start) {
            return "";
        }
        return stream.getText(Interval.of(start, end - 1));
    }
}
