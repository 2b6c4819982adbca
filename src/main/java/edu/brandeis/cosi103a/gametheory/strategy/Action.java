package edu.brandeis.cosi103a.gametheory.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A move in the prisoner's dilemma stage game.
 */
public enum Action {
    COOPERATE('C'),
    DEFECT('D');

    private final char symbol;

    Action(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Single-letter form used in JSON and on the command line ("C" or "D").
     */
    @JsonValue
    public String symbol() {
        return String.valueOf(symbol);
    }

    public Action opposite() {
        return this == COOPERATE ? DEFECT : COOPERATE;
    }

    @JsonCreator
    public static Action fromSymbol(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase();
        if (normalized.equals("C") || normalized.equals("COOPERATE")) {
            return COOPERATE;
        }
        if (normalized.equals("D") || normalized.equals("DEFECT")) {
            return DEFECT;
        }
        throw new IllegalArgumentException("Unknown action: " + value);
    }
}
