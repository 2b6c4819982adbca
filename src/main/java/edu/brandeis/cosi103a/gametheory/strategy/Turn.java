package edu.brandeis.cosi103a.gametheory.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One completed round, seen from one player's side.
 *
 * @param round          1-based round number
 * @param ownAction      the move this player made
 * @param opponentAction the move the opponent made in the same round
 */
public record Turn(
    @JsonProperty("round") int round,
    @JsonProperty("ownAction") Action ownAction,
    @JsonProperty("opponentAction") Action opponentAction
) {}
