package edu.brandeis.cosi103a.gametheory.runner;

import edu.brandeis.cosi103a.gametheory.GameTheoryException;
import edu.brandeis.cosi103a.gametheory.equilibrium.PayoffMatrix;
import edu.brandeis.cosi103a.gametheory.equilibrium.SupportEnumerationCalculator;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDiscoveryService;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyInfo;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <p>Invocation:
 * <pre>
 * java -jar game-theory-lab.jar tournament \
 *   --strategy TitForTat --strategy Defector --strategy Grudger \
 *   --turns 200 --repetitions 10 --output ./results/tournament.json
 *
 * java -jar game-theory-lab.jar analyze --strategy Pavlov --turns 100
 *
 * java -jar game-theory-lab.jar equilibrium --matrix "3,0;5,1"
 *
 * java -jar game-theory-lab.jar --list-strategies
 * </pre>
 */
public class GameTheoryCli {

    static final int DEFAULT_TURNS = 200;
    static final int DEFAULT_REPETITIONS = 10;
    static final int MAX_STRATEGIES = 20;

    private final StrategyRegistry registry;
    private final ResultFileWriter writer;
    private final PrintStream out;

    GameTheoryCli(StrategyRegistry registry, ResultFileWriter writer, PrintStream out) {
        this.registry = registry;
        this.writer = writer;
        this.out = out;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        CliOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException | GameTheoryException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        StrategyRegistry registry = new StrategyDiscoveryService("").buildRegistry();
        GameTheoryCli cli = new GameTheoryCli(registry, new ResultFileWriter(), System.out);
        try {
            cli.run(options);
        } catch (GameTheoryException e) {
            System.err.printf("%s: %s%n", e.category(), e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            System.err.println("Failed to write results: " + e.getMessage());
            System.exit(1);
        }
    }

    void run(CliOptions options) throws IOException {
        MatchSimulator simulator = new MatchSimulator();
        Object result = switch (options.command()) {
            case LIST_STRATEGIES -> {
                listStrategies();
                yield null;
            }
            case TOURNAMENT -> new TournamentRunner(registry, simulator, MAX_STRATEGIES)
                .runTournament(options.strategies(), options.turns(), options.repetitions());
            case ANALYZE -> new StrategyAnalyzer(registry, simulator)
                .analyze(options.strategies().get(0), options.turns());
            case EQUILIBRIUM -> new SupportEnumerationCalculator()
                .computeEquilibria(options.matrix().orElseThrow());
        };
        if (result == null) {
            return;
        }

        out.println(writer.toJson(result));
        if (options.output().isPresent()) {
            writer.write(result, options.output().get());
            out.printf("Results written to %s%n", options.output().get());
        }
    }

    private void listStrategies() {
        List<StrategyInfo> strategies = registry.list(false);
        out.println("Available strategies:");
        out.println();
        for (StrategyInfo info : strategies) {
            String memory = info.classifier().memoryDepth() < 0
                ? "unbounded" : String.valueOf(info.classifier().memoryDepth());
            out.printf("  %-22s memory=%-9s %s%s%n", info.name(), memory,
                info.classifier().stochastic() ? "stochastic " : "", info.description());
        }
        out.println();
        out.println("Aliases: Pavlov, TFT, GTFT, AlternatingCooperator");
    }

    /**
     * Parses CLI arguments.
     *
     * @throws IllegalArgumentException if the command is unknown, required options are missing or
     *                                  a value does not parse
     * @throws edu.brandeis.cosi103a.gametheory.InvalidMatrixException if the matrix is ragged
     */
    static CliOptions parseArgs(String[] args) {
        if (args.length >= 1 && "--list-strategies".equals(args[0])) {
            return new CliOptions(CliOptions.Command.LIST_STRATEGIES, List.of(), DEFAULT_TURNS,
                DEFAULT_REPETITIONS, Optional.empty(), Optional.empty());
        }
        if (args.length < 1) {
            throw new IllegalArgumentException("Missing command");
        }

        CliOptions.Command command = switch (args[0]) {
            case "tournament" -> CliOptions.Command.TOURNAMENT;
            case "analyze" -> CliOptions.Command.ANALYZE;
            case "equilibrium" -> CliOptions.Command.EQUILIBRIUM;
            default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
        };

        List<String> strategies = new ArrayList<>();
        int turns = DEFAULT_TURNS;
        int repetitions = DEFAULT_REPETITIONS;
        PayoffMatrix matrix = null;
        Path output = null;

        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--strategy" -> strategies.add(value);
                case "--turns" -> turns = parseInt(flag, value);
                case "--repetitions" -> repetitions = parseInt(flag, value);
                case "--matrix" -> matrix = parseMatrix(value);
                case "--output" -> output = Path.of(value);
                default -> throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }

        if (command == CliOptions.Command.TOURNAMENT && strategies.size() < 2) {
            throw new IllegalArgumentException("tournament needs at least 2 --strategy options");
        }
        if (command == CliOptions.Command.ANALYZE && strategies.size() != 1) {
            throw new IllegalArgumentException("analyze needs exactly one --strategy option");
        }
        if (command == CliOptions.Command.EQUILIBRIUM && matrix == null) {
            throw new IllegalArgumentException("equilibrium needs --matrix");
        }

        return new CliOptions(command, strategies, turns, repetitions,
            Optional.ofNullable(matrix), Optional.ofNullable(output));
    }

    /**
     * Parses rows separated by ';' and cells separated by ',', e.g. {@code "3,0;5,1"}.
     */
    static PayoffMatrix parseMatrix(String text) {
        String[] rows = text.trim().split(";");
        double[][] values = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            String[] cells = rows[r].trim().split(",");
            values[r] = new double[cells.length];
            for (int c = 0; c < cells.length; c++) {
                try {
                    values[r][c] = Double.parseDouble(cells[c].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid matrix cell '" + cells[c] + "'", e);
                }
            }
        }
        return PayoffMatrix.of(values);
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + value, e);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar game-theory-lab.jar <command> [options]");
        System.err.println("       java -jar game-theory-lab.jar --list-strategies");
        System.err.println();
        System.err.println("Commands:");
        System.err.println("  tournament     Round-robin tournament between two or more strategies");
        System.err.println("  analyze        Play one strategy against Cooperator, Defector and TitForTat");
        System.err.println("  equilibrium    Nash equilibria of a symmetric payoff matrix");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --strategy <name>          Strategy name or alias (repeat for tournaments)");
        System.err.println("  --turns <n>                Turns per match (default: " + DEFAULT_TURNS + ")");
        System.err.println("  --repetitions <n>          Matches per ordered pair (default: " + DEFAULT_REPETITIONS + ")");
        System.err.println("  --matrix <rows>            Row payoffs, e.g. \"3,0;5,1\"");
        System.err.println("  --output <file>            Also write the JSON result to this file");
        System.err.println("  --list-strategies          List available strategies and exit");
    }
}
