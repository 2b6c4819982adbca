package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.equilibrium.PayoffMatrix;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Parsed command line.
 */
record CliOptions(
    Command command,
    List<String> strategies,
    int turns,
    int repetitions,
    Optional<PayoffMatrix> matrix,
    Optional<Path> output
) {
    enum Command {
        TOURNAMENT,
        ANALYZE,
        EQUILIBRIUM,
        LIST_STRATEGIES
    }

    CliOptions {
        strategies = List.copyOf(strategies);
    }
}
