package org.propcheck.input;

import org.propcheck.expression.Expression;
import org.propcheck.parser.PropositionParser;
import org.propcheck.parser.VariableRegistry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LETTORE PROPOSIZIONI - Dal file di testo alla lista di alberi
 *
 * FORMATO INPUT:
 * • Una proposizione per riga, codifica UTF-8; sequenze non valide sono sostituite
 *   con U+FFFD invece di interrompere la lettura
 * • Le righe sono separate solo da {@code \n}; un {@code \r} resta nella riga ed è
 *   trattato come spaziatura
 * • Righe che iniziano con {@code //} sono commenti e vengono saltate
 * • Righe vuote o composte solo da spazi vengono saltate
 * • Ogni altra riga deve essere una proposizione valida
 * • Almeno una proposizione: l'ultima è la congettura, le precedenti gli assiomi
 *
 * Un registro nuovo viene creato per ogni lettura e condiviso da tutte le righe, così
 * che gli indici seguano l'ordine di prima occorrenza nell'intero file.
 */
public class PropositionFileReader {

    private static final Logger LOGGER = Logger.getLogger(PropositionFileReader.class.getName());

    /** Prefisso che identifica una riga di commento (solo in prima colonna) */
    public static final String COMMENT_PREFIX = "//";

    /**
     * Legge e analizza un file di proposizioni.
     *
     * @param path percorso del file
     * @return proposizioni lette con il relativo registro
     * @throws IOException se il file non è leggibile
     * @throws PropositionSyntaxException alla prima riga sintatticamente errata
     * @throws org.propcheck.parser.TooManyVariablesException alla trentatreesima variabile distinta
     * @throws EmptyInputException se il file non contiene proposizioni
     */
    public PropositionSet read(Path path) throws IOException {
        LOGGER.info("Lettura proposizioni da " + path);
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return read(path.toString(), Arrays.asList(content.split("\n", -1)));
    }

    /**
     * Analizza righe già in memoria.
     *
     * @param sourceName nome dell'input usato nei messaggi di errore
     * @param lines righe senza terminatore
     * @return proposizioni lette con il relativo registro
     */
    public PropositionSet read(String sourceName, List<String> lines) {
        VariableRegistry registry = new VariableRegistry();
        PropositionParser parser = new PropositionParser(registry);
        List<Expression> propositions = new ArrayList<>();

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (isSkipped(line)) {
                continue;
            }

            Optional<Expression> proposition = parser.parseLine(line);
            if (proposition.isEmpty()) {
                LOGGER.warning("Riga " + lineNumber + " di " + sourceName + " non riconosciuta: " + line);
                throw new PropositionSyntaxException(sourceName, lineNumber, line);
            }

            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Riga " + lineNumber + ": " + proposition.get().toNotation(registry.names()));
            }
            propositions.add(proposition.get());
        }

        if (propositions.isEmpty()) {
            throw new EmptyInputException(sourceName);
        }

        LOGGER.info("Lette " + propositions.size() + " proposizioni con " + registry.size() + " variabili");
        return new PropositionSet(sourceName, propositions, registry);
    }

    /**
     * @return true per commenti e righe composte solo da spazi
     */
    static boolean isSkipped(String line) {
        if (line.startsWith(COMMENT_PREFIX)) {
            return true;
        }
        return line.chars().allMatch(PropositionParser::isSpace);
    }
}
