package edu.brandeis.cosi103a.gametheory.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gametheory.InvalidTournamentException;
import edu.brandeis.cosi103a.gametheory.InvalidTurnCountException;

import java.util.List;

/**
 * Tournament parameters shared by every run of an experiment. Runs keep their own copy, taken
 * when the run is created.
 */
public record ExperimentConfig(
    @JsonProperty("strategies") List<String> strategies,
    @JsonProperty("turns") int turns,
    @JsonProperty("repetitions") int repetitions,
    @JsonProperty("targetRuns") int targetRuns
) {
    public ExperimentConfig {
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
    }

    /**
     * @throws InvalidTurnCountException if turns is less than 1
     * @throws InvalidTournamentException if there are fewer than two strategies or a count is
     *                                    less than 1
     */
    public ExperimentConfig validate() {
        if (strategies.size() < 2) {
            throw new InvalidTournamentException(
                "Experiment config needs at least two strategies, got " + strategies.size());
        }
        if (turns < 1) {
            throw new InvalidTurnCountException("Turns must be at least 1, got " + turns);
        }
        if (repetitions < 1) {
            throw new InvalidTournamentException("Repetitions must be at least 1, got " + repetitions);
        }
        if (targetRuns < 1) {
            throw new InvalidTournamentException("Target runs must be at least 1, got " + targetRuns);
        }
        return this;
    }
}
