package edu.brandeis.cosi103a.gametheory.analysis;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.Rating;
import edu.brandeis.cosi103a.gametheory.experiment.Experiment;
import edu.brandeis.cosi103a.gametheory.experiment.ExperimentRun;
import edu.brandeis.cosi103a.gametheory.experiment.ExperimentService;
import edu.brandeis.cosi103a.gametheory.experiment.RunStatus;
import edu.brandeis.cosi103a.gametheory.runner.Ranking;
import edu.brandeis.cosi103a.gametheory.runner.TournamentResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the outcomes of an experiment's runs.
 */
@Service
public class ExperimentAnalyzer {

    private final ExperimentService experimentService;
    private final GameInfo gameInfo;

    public ExperimentAnalyzer(ExperimentService experimentService) {
        this.experimentService = experimentService;
        this.gameInfo = GameInfo.getDefaultGameInfo();
    }

    /**
     * @throws edu.brandeis.cosi103a.gametheory.ExperimentNotFoundException if there is no such experiment
     */
    public ExperimentAnalysis analyze(String experimentId) {
        Experiment experiment = experimentService.getExperiment(experimentId);
        List<ExperimentRun> runs = experimentService.listRuns(experimentId);

        int failed = 0;
        List<TournamentResult> results = new ArrayList<>();
        for (ExperimentRun run : runs) {
            if (run.status() == RunStatus.FAILED) {
                failed++;
            } else if (run.status() == RunStatus.COMPLETED && run.results().isPresent()) {
                results.add(run.results().get());
            }
        }

        List<Double> cooperation = new ArrayList<>();
        List<Double> scores = new ArrayList<>();
        for (TournamentResult result : results) {
            cooperation.add(result.meanCooperationRate());
            scores.add(result.meanScore());
        }

        return new ExperimentAnalysis(experiment.id(), experiment.name(), runs.size(), results.size(), failed,
            MetricStats.of(cooperation), MetricStats.of(scores), strategyStats(results));
    }

    /**
     * One analysis per experiment, in the order given.
     */
    public List<ExperimentAnalysis> compare(List<String> experimentIds) {
        List<ExperimentAnalysis> analyses = new ArrayList<>(experimentIds.size());
        for (String id : experimentIds) {
            analyses.add(analyze(id));
        }
        return analyses;
    }

    private List<StrategyStats> strategyStats(List<TournamentResult> results) {
        Map<String, Accumulator> byStrategy = new LinkedHashMap<>();
        Map<String, Rating> ratings = new HashMap<>();

        for (TournamentResult result : results) {
            for (Ranking ranking : result.rankings()) {
                Accumulator acc = byStrategy.computeIfAbsent(ranking.strategy(), k -> new Accumulator());
                acc.runs++;
                acc.score += ranking.score();
                acc.cooperation += ranking.cooperationRate();
                if (ranking.rank() == 1) {
                    acc.wins++;
                }
            }
            ratings = TrueSkillRatingCalculator.update(ratings, result.rankings(), gameInfo);
        }

        List<StrategyStats> stats = new ArrayList<>();
        for (Map.Entry<String, Accumulator> entry : byStrategy.entrySet()) {
            Accumulator acc = entry.getValue();
            Rating rating = ratings.getOrDefault(entry.getKey(), gameInfo.getDefaultRating());
            stats.add(new StrategyStats(entry.getKey(), acc.runs, acc.score / acc.runs,
                acc.cooperation / acc.runs, acc.wins, TrueSkillRatingCalculator.conservativeRating(rating)));
        }
        stats.sort(Comparator.comparingDouble(StrategyStats::rating).reversed());
        return stats;
    }

    private static final class Accumulator {
        int runs;
        double score;
        double cooperation;
        int wins;
    }
}
