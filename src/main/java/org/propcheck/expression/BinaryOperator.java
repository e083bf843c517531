package org.propcheck.expression;

/**
 * Operatori binari della logica proposizionale.
 *
 * SEMANTICA:
 * • AND: vero se entrambi gli operandi sono veri
 * • OR: vero se almeno un operando è vero
 * • XOR: vero se gli operandi hanno valore diverso
 * • IMPLIES: falso solo quando l'antecedente è vero e il conseguente falso (!A | B)
 * • IFF: vero se gli operandi hanno lo stesso valore
 */
public enum BinaryOperator {
    AND("&"),
    OR("|"),
    XOR("^"),
    IMPLIES("=>"),
    IFF("<=>");

    /** Simbolo ASCII canonico usato nella rappresentazione testuale */
    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Applica l'operatore a due valori di verità.
     *
     * @param left valore dell'operando sinistro
     * @param right valore dell'operando destro
     * @return risultato dell'operazione
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left ^ right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
        };
    }

    /** @return simbolo canonico dell'operatore */
    public String getSymbol() {
        return symbol;
    }
}
