package org.propcheck;

import org.propcheck.check.CheckResult;
import org.propcheck.check.ValidityChecker;
import org.propcheck.input.PropositionFileReader;
import org.propcheck.input.PropositionSet;
import org.propcheck.report.ReportFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * PROPCHECK - Verifica automatica di enunciati della logica proposizionale
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di testo con una proposizione per riga
 * 2. PARSING: ogni riga diventa un albero di espressione, le variabili ricevono un
 *    indice in ordine di prima occorrenza (al più 32)
 * 3. VERIFICA: enumerazione di tutti gli assegnamenti; le righe tranne l'ultima sono
 *    assiomi, l'ultima è il teorema da dimostrare
 * 4. OUTPUT: teorema verificato, assiomi inconsistenti, oppure controesempio
 *
 * NOTAZIONE:
 * <pre>
 *    Variabile         [una stringa tra parentesi quadre]
 *    Implicazione      ( [A] =&gt; [B] )    ( [A] implies [B] )    ( [A] then [B] )
 *    Implicazione      ( [A] &lt;= [B] )    ( [A] if [B] )
 *    Se e solo se      ( [A] &lt;=&gt; [B] )   ( [A] iff [B] )
 *    And               ( [A] &amp; [B] )     ( [A] and [B] )
 *    Or                ( [A] | [B] )     ( [A] or [B] )
 *    Xor               ( [A] ^ [B] )     ( [A] xor [B] )
 *    Not               ![A]              not [A]
 *    Vero              T                 true
 *    Falso             F                 false
 * </pre>
 *
 * CODICI DI USCITA:
 * • 0: teorema verificato, oppure assiomi inconsistenti
 * • 1: errore di utilizzo, file non leggibile, errore di sintassi, input vuoto,
 *      troppe variabili, teorema falso
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto, trattenuto per non perdere il livello impostato da -v */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.propcheck");

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String VERBOSE_PARAM = "-v";

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = "Utilizzo: propcheck [-h] [-v] <file>";
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out));
    }

    /**
     * Esegue l'intera pipeline e restituisce il codice di uscita.
     *
     * @param args parametri della linea di comando
     * @param out destinazione del report e dei messaggi per l'utente
     * @return {@link #EXIT_SUCCESS} o {@link #EXIT_FAILURE}
     */
    static int run(String[] args, PrintStream out) {
        CheckerConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] " + e.getMessage());
            out.println(USAGE);
            return EXIT_FAILURE;
        }

        if (config.helpRequested()) {
            printApplicationHelp(out);
            return EXIT_SUCCESS;
        }
        // Il livello viene ripristinato a fine esecuzione
        Level previousLevel = PROJECT_LOGGER.getLevel();
        if (config.verbose()) {
            PROJECT_LOGGER.setLevel(Level.FINE);
        }

        try {
            return executePipeline(config, out);
        } catch (IOException | InvalidPathException e) {
            LOGGER.log(Level.WARNING, "Impossibile leggere " + config.inputPath(), e);
            out.println("[E] Impossibile aprire " + config.inputPath());
            return EXIT_FAILURE;
        } catch (PropCheckException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            PROJECT_LOGGER.setLevel(previousLevel);
        }
    }

    /**
     * Lettura -> verifica -> report. Le eccezioni della fase di parsing risalgono al chiamante.
     */
    private static int executePipeline(CheckerConfiguration config, PrintStream out) throws IOException {
        PropositionSet propositions = new PropositionFileReader().read(Path.of(config.inputPath()));

        CheckResult result = new ValidityChecker()
                .check(propositions.propositions(), propositions.registry().names());

        ReportFormatter formatter = new ReportFormatter();
        out.print(formatter.format(result));
        if (config.verbose()) {
            out.print(formatter.formatStatistics(result.getStatistics()));
        }

        return result.isCounterExample() ? EXIT_FAILURE : EXIT_SUCCESS;
    }

    /**
     * Carica {@code logging.properties} dal classpath. In sua assenza resta la
     * configurazione predefinita della JVM.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non caricata", e);
        }
    }

    //endregion

    //region HELP

    private static void printApplicationHelp(PrintStream out) {
        out.println(USAGE);
        out.println();
        out.println("Ogni riga del file tranne l'ultima è un assioma, l'ultima è il teorema da verificare.");
        out.println("Righe vuote e righe che iniziano con // sono ignorate. Al più 32 variabili.");
        out.println();
        out.println("OPZIONI:");
        out.println("  -h   Mostra questa guida");
        out.println("  -v   Modalità verbosa: log di parsing e statistiche di esecuzione");
        out.println();
        out.println("NOTAZIONE:");
        out.println("  Variabile      [nome]");
        out.println("  Implicazione   ([A] => [B])   ([A] implies [B])   ([A] then [B])");
        out.println("  Implicazione   ([A] <= [B])   ([A] if [B])");
        out.println("  Se e solo se   ([A] <=> [B])  ([A] iff [B])");
        out.println("  And            ([A] & [B])    ([A] and [B])");
        out.println("  Or             ([A] | [B])    ([A] or [B])");
        out.println("  Xor            ([A] ^ [B])    ([A] xor [B])");
        out.println("  Not            ![A]           not [A]");
        out.println("  Vero / Falso   T  true  /  F  false");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'esecuzione.
     *
     * @param inputPath file delle proposizioni (null solo se è richiesto l'help)
     * @param verbose log di dettaglio e statistiche
     * @param helpRequested mostra l'help senza eseguire verifiche
     */
    record CheckerConfiguration(String inputPath, boolean verbose, boolean helpRequested) {
    }

    /**
     * Parser dei parametri: esattamente un file, opzioni in qualunque posizione.
     */
    static class ArgumentParser {

        /**
         * @throws IllegalArgumentException se manca il file, ce n'è più di uno o un'opzione è sconosciuta
         */
        CheckerConfiguration parse(String[] args) {
            String inputPath = null;
            boolean verbose = false;

            for (String arg : args) {
                switch (arg) {
                    case HELP_PARAM -> {
                        return new CheckerConfiguration(null, false, true);
                    }
                    case VERBOSE_PARAM -> verbose = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + arg);
                        }
                        if (inputPath != null) {
                            throw new IllegalArgumentException("Specificare un solo file, ricevuti: "
                                    + inputPath + ", " + arg);
                        }
                        inputPath = arg;
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Nessun file di proposizioni specificato");
            }
            return new CheckerConfiguration(inputPath, verbose, false);
        }
    }

    //endregion
}
