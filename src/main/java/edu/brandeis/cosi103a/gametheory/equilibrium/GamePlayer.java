package edu.brandeis.cosi103a.gametheory.equilibrium;

/**
 * The two seats of a bimatrix game.
 */
public enum GamePlayer {
    ROW,
    COLUMN
}
