package org.propcheck.parser;

import org.propcheck.expression.Constant;
import org.propcheck.expression.Expression;
import org.propcheck.expression.Negation;
import org.propcheck.expression.Variable;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER PROPOSIZIONI - Discesa ricorsiva sulla notazione completamente parentesizzata
 *
 * Trasforma una riga di testo in un albero {@link Expression}, risolvendo i nomi delle
 * variabili tramite il {@link VariableRegistry} condiviso per l'intero input.
 *
 * GRAMMATICA (spazi ignorati tra i token):
 * <pre>
 * Expr      := True | False | Variable | Not | Binary
 * True      := 'T' | "true"
 * False     := 'F' | "false"
 * Variable  := '[' testo ']'
 * Not       := ('!' | "not") Expr
 * Binary    := '(' Expr Operatore Expr ')'
 * Operatore := and &amp; | or | | xor ^ | then implies =&gt; | if &lt;= | iff &lt;=&gt;
 * </pre>
 *
 * REGOLE DI RICONOSCIMENTO:
 * • Le alternative di Expr sono provate nell'ordine indicato; vince la prima che consuma
 *   un prefisso non vuoto
 * • Ogni primitiva restituisce i caratteri consumati, zero indica mancata corrispondenza
 * • Non avendo precedenze, il raggruppamento è deciso solo dalle parentesi
 * • Le variabili sono registrate nel momento in cui vengono lette, anche all'interno di
 *   un tentativo poi scartato
 *
 * FALLBACK DI PRIMO LIVELLO:
 * • Se l'espressione non copre l'intera riga, la riga viene racchiusa tra parentesi e
 *   analizzata una seconda volta, così che {@code [P] and [Q]} sia accettata
 */
public class PropositionParser {

    private static final Logger LOGGER = Logger.getLogger(PropositionParser.class.getName());

    private final VariableRegistry registry;

    /**
     * @param registry registro delle variabili condiviso da tutte le righe dell'input
     */
    public PropositionParser(VariableRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registro variabili non può essere null");
        }
        this.registry = registry;
    }

    //region PUNTO DI INGRESSO

    /**
     * Analizza una riga completa come proposizione di primo livello.
     *
     * Il primo tentativo analizza la riga così com'è; se non viene consumata per intero
     * (spazi finali esclusi) si ritenta una sola volta sulla riga racchiusa tra parentesi.
     *
     * @param line testo della riga (senza terminatore)
     * @return espressione riconosciuta, vuoto se la riga è sintatticamente errata
     * @throws TooManyVariablesException se la riga introduce la trentatreesima variabile
     */
    public Optional<Expression> parseLine(String line) {
        if (line == null) {
            throw new IllegalArgumentException("Riga da analizzare non può essere null");
        }

        Optional<Expression> direct = parseWhole(line);
        if (direct.isPresent()) {
            return direct;
        }

        LOGGER.finest("Riga non coperta per intero, nuovo tentativo tra parentesi: " + line);
        return parseWhole("(" + line + ")");
    }

    /**
     * Analizza un'espressione che deve coprire l'intero testo, spazi finali esclusi.
     */
    private Optional<Expression> parseWhole(String text) {
        LineCursor cursor = new LineCursor(text);
        ParseResult result = parseExpression(cursor, 0);
        if (!result.matched()) {
            return Optional.empty();
        }

        int end = result.consumed() + cursor.skipSpaces(result.consumed());
        if (cursor.charAt(end) != LineCursor.EOF) {
            return Optional.empty();
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Proposizione riconosciuta: " + result.expression().toNotation(registry.names()));
        }
        return Optional.of(result.expression());
    }

    //endregion

    //region ALTERNATIVE DI EXPR

    /**
     * Expr: salta gli spazi iniziali e prova le alternative in ordine fisso.
     * L'ordine impedisce che un {@code T} o un {@code F} iniziale finisca all'analisi binaria.
     */
    ParseResult parseExpression(LineCursor cursor, int at) {
        int start = at + cursor.skipSpaces(at);

        ParseResult result = parseTrue(cursor, start);
        if (!result.matched()) {
            result = parseFalse(cursor, start);
        }
        if (!result.matched()) {
            result = parseVariable(cursor, start);
        }
        if (!result.matched()) {
            result = parseNot(cursor, start);
        }
        if (!result.matched()) {
            result = parseBinary(cursor, start);
        }

        if (!result.matched()) {
            return ParseResult.NO_MATCH;
        }
        return ParseResult.of(start - at + result.consumed(), result.expression());
    }

    /** True: un singolo {@code T}, qualunque cosa segua, oppure la parola {@code true}. */
    ParseResult parseTrue(LineCursor cursor, int at) {
        if (cursor.charAt(at) == 'T') {
            return ParseResult.of(1, Constant.TRUE);
        }
        if (cursor.startsWith(at, "true")) {
            return ParseResult.of(4, Constant.TRUE);
        }
        return ParseResult.NO_MATCH;
    }

    /** False: un singolo {@code F}, qualunque cosa segua, oppure la parola {@code false}. */
    ParseResult parseFalse(LineCursor cursor, int at) {
        if (cursor.charAt(at) == 'F') {
            return ParseResult.of(1, Constant.FALSE);
        }
        if (cursor.startsWith(at, "false")) {
            return ParseResult.of(5, Constant.FALSE);
        }
        return ParseResult.NO_MATCH;
    }

    /**
     * Variable: {@code [} seguito dal nome fino alla prima {@code ]}.
     *
     * Gli spazi iniziali e finali del nome sono scartati, quelli interni conservati.
     * Senza {@code ]} prima della fine della riga non c'è corrispondenza.
     *
     * @throws TooManyVariablesException se il nome è il trentatreesimo distinto
     */
    ParseResult parseVariable(LineCursor cursor, int at) {
        if (cursor.charAt(at) != '[') {
            return ParseResult.NO_MATCH;
        }

        int nameStart = at + 1;
        nameStart += cursor.skipSpaces(nameStart);

        int close = nameStart;
        while (cursor.charAt(close) != ']') {
            if (cursor.charAt(close) == LineCursor.EOF) {
                return ParseResult.NO_MATCH;
            }
            close++;
        }

        int nameEnd = close;
        while (nameEnd > nameStart && isSpace(cursor.charAt(nameEnd - 1))) {
            nameEnd--;
        }

        int index = registry.resolve(cursor.text(nameStart, nameEnd));
        return ParseResult.of(close + 1 - at, new Variable(index));
    }

    /** Not: {@code !} oppure {@code not}, seguito da una sola Expr. */
    ParseResult parseNot(LineCursor cursor, int at) {
        int prefix;
        if (cursor.startsWith(at, "!")) {
            prefix = 1;
        } else if (cursor.startsWith(at, "not")) {
            prefix = 3;
        } else {
            return ParseResult.NO_MATCH;
        }

        ParseResult operand = parseExpression(cursor, at + prefix);
        if (!operand.matched()) {
            return ParseResult.NO_MATCH;
        }
        return ParseResult.of(prefix + operand.consumed(), new Negation(operand.expression()));
    }

    /**
     * Binary: {@code (} Expr operatore Expr {@code )}.
     *
     * Il testo dell'operatore viene confrontato con la tabella solo dopo aver riconosciuto
     * l'operando destro e la parentesi di chiusura.
     */
    ParseResult parseBinary(LineCursor cursor, int at) {
        int position = at + cursor.skipSpaces(at);
        if (cursor.charAt(position) != '(') {
            return ParseResult.NO_MATCH;
        }
        position++;

        // Operando sinistro
        position += cursor.skipSpaces(position);
        ParseResult left = parseExpression(cursor, position);
        if (!left.matched()) {
            return ParseResult.NO_MATCH;
        }
        position += left.consumed();

        // Testo dell'operatore
        position += cursor.skipSpaces(position);
        int operatorStart = position;
        while (!endsOperatorToken(cursor, position)) {
            position++;
        }
        String operatorText = cursor.text(operatorStart, position);
        position += cursor.skipSpaces(position);

        // Operando destro
        ParseResult right = parseExpression(cursor, position);
        if (!right.matched()) {
            return ParseResult.NO_MATCH;
        }
        position += right.consumed();

        position += cursor.skipSpaces(position);
        if (cursor.charAt(position) != ')') {
            return ParseResult.NO_MATCH;
        }
        position++;

        Optional<OperatorToken> token = OperatorToken.fromText(operatorText);
        if (token.isEmpty()) {
            LOGGER.finest("Operatore non riconosciuto: '" + operatorText + "'");
            return ParseResult.NO_MATCH;
        }
        return ParseResult.of(position - at, token.get().build(left.expression(), right.expression()));
    }

    //endregion

    //region SUPPORTO LESSICALE

    /**
     * Il token operatore termina dove inizia una nuova sottoespressione: fine riga,
     * spazio, {@code ! ( [ T F} oppure l'inizio di {@code false}, {@code true}, {@code not}
     * (riconosciuti dalle prime due lettere).
     */
    private static boolean endsOperatorToken(LineCursor cursor, int position) {
        int c = cursor.charAt(position);
        if (c == LineCursor.EOF || isSpace(c)) {
            return true;
        }
        if (c == '!' || c == '(' || c == '[' || c == 'T' || c == 'F') {
            return true;
        }
        int next = cursor.charAt(position + 1);
        return (c == 'f' && next == 'a') || (c == 't' && next == 'r') || (c == 'n' && next == 'o');
    }

    /**
     * Spaziatura nel senso classico: spazio, tab, line feed, tab verticale, form feed,
     * carriage return.
     */
    public static boolean isSpace(int c) {
        return c == ' ' || (c >= '\t' && c <= '\r');
    }

    /** Rimuove la spaziatura iniziale e finale secondo {@link #isSpace(int)}. */
    static String trimSpaces(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    //endregion
}
