package org.propcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Espressione binaria: applica {@code operator} ai valori dei due operandi.
 *
 * L'ordine degli operandi è quello semantico, non necessariamente quello scritto:
 * per l'implicazione inversa ({@code if}, {@code <=}) il parser scambia già gli
 * operandi, per cui {@code left} è sempre l'antecedente di {@link BinaryOperator#IMPLIES}.
 *
 * @param operator operatore logico
 * @param left operando sinistro (non null)
 * @param right operando destro (non null)
 */
public record BinaryExpression(BinaryOperator operator, Expression left, Expression right) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operatore binario non può essere null");
        Objects.requireNonNull(left, "Operando sinistro non può essere null");
        Objects.requireNonNull(right, "Operando destro non può essere null");
    }

    @Override
    public boolean evaluate(long assignment) {
        return operator.apply(left.evaluate(assignment), right.evaluate(assignment));
    }

    @Override
    public String toNotation(List<String> variableNames) {
        return "(" + left.toNotation(variableNames) + " " + operator.getSymbol() + " "
                + right.toNotation(variableNames) + ")";
    }
}
