package edu.brandeis.cosi103a.gametheory.analysis;

import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.IPlayer;
import de.gesundkrank.jskills.ITeam;
import de.gesundkrank.jskills.Player;
import de.gesundkrank.jskills.Rating;
import de.gesundkrank.jskills.Team;
import de.gesundkrank.jskills.TrueSkillCalculator;
import edu.brandeis.cosi103a.gametheory.runner.Ranking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Multiplayer TrueSkill rating calculator using JSkills. Each tournament run is one
 * free-for-all game and each strategy a 1-person team; the run's leaderboard gives the ranks.
 */
public final class TrueSkillRatingCalculator {

    private static final Logger log = LoggerFactory.getLogger(TrueSkillRatingCalculator.class);

    private TrueSkillRatingCalculator() {}

    /**
     * Update ratings after a single run.
     *
     * @param ratings  current (mu, sigma) for all strategies; missing entries start at the default
     * @param rankings leaderboard of the run, first place first
     * @param gameInfo TrueSkill parameters
     * @return updated ratings (strategies absent from the run unchanged)
     */
    public static Map<String, Rating> update(
            Map<String, Rating> ratings,
            List<Ranking> rankings,
            GameInfo gameInfo) {

        Map<String, Rating> result = new HashMap<>(ratings);
        if (rankings.size() < 2) {
            return result;
        }

        Map<String, Player<String>> players = new HashMap<>();
        List<ITeam> teams = new ArrayList<>();
        int[] ranks = new int[rankings.size()];
        for (int i = 0; i < rankings.size(); i++) {
            String strategy = rankings.get(i).strategy();
            Player<String> player = new Player<>(strategy);
            players.put(strategy, player);
            teams.add(new Team(player, ratings.getOrDefault(strategy, gameInfo.getDefaultRating())));
            // leaderboard positions are unique; JSkills fails to converge on tied ranks
            ranks[i] = rankings.get(i).rank();
        }

        try {
            Map<IPlayer, Rating> newRatings = TrueSkillCalculator.calculateNewRatings(gameInfo, teams, ranks);
            for (Map.Entry<String, Player<String>> entry : players.entrySet()) {
                result.put(entry.getKey(), newRatings.get(entry.getValue()));
            }
        } catch (RuntimeException e) {
            log.warn("TrueSkill failed to converge, keeping existing ratings: {}", e.getMessage());
        }
        return result;
    }

    /**
     * Conservative display rating: mu - 3*sigma.
     */
    public static double conservativeRating(Rating rating) {
        return rating.getMean() - 3.0 * rating.getStandardDeviation();
    }
}
