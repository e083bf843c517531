package org.propcheck.parser;

import org.propcheck.expression.BinaryExpression;
import org.propcheck.expression.BinaryOperator;
import org.propcheck.expression.Expression;

import java.util.Optional;

/**
 * Tabella dei token operatore riconosciuti tra i due operandi di un'espressione binaria.
 *
 * Ogni voce associa le grafie testuali (parola chiave e simbolo) all'operatore logico.
 * Le implicazioni inverse {@code if} e {@code <=} scambiano gli operandi: l'operando
 * destro diventa l'antecedente.
 */
enum OperatorToken {
    AND(BinaryOperator.AND, false, "and", "&"),
    OR(BinaryOperator.OR, false, "or", "|"),
    XOR(BinaryOperator.XOR, false, "xor", "^"),
    IMPLIES(BinaryOperator.IMPLIES, false, "then", "implies", "=>"),
    REVERSE_IMPLIES(BinaryOperator.IMPLIES, true, "if", "<="),
    IFF(BinaryOperator.IFF, false, "iff", "<=>");

    private final BinaryOperator operator;
    private final boolean reversed;
    private final String[] spellings;

    OperatorToken(BinaryOperator operator, boolean reversed, String... spellings) {
        this.operator = operator;
        this.reversed = reversed;
        this.spellings = spellings;
    }

    /**
     * Cerca il token corrispondente al testo scansionato (confronto case-sensitive).
     *
     * @param text testo dell'operatore così come compare nella riga
     * @return token riconosciuto, vuoto se il testo non è un operatore
     */
    static Optional<OperatorToken> fromText(String text) {
        for (OperatorToken token : values()) {
            for (String spelling : token.spellings) {
                if (spelling.equals(text)) {
                    return Optional.of(token);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Costruisce il nodo binario rispettando l'eventuale inversione degli operandi.
     *
     * @param writtenLeft operando scritto a sinistra
     * @param writtenRight operando scritto a destra
     */
    Expression build(Expression writtenLeft, Expression writtenRight) {
        return reversed
                ? new BinaryExpression(operator, writtenRight, writtenLeft)
                : new BinaryExpression(operator, writtenLeft, writtenRight);
    }
}
