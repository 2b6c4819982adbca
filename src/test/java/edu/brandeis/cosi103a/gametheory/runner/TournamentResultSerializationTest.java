package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TournamentResultSerializationTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final StrategyRegistry registry = StrategyRegistry.builtIn();

    @Test
    void tournamentResult_roundTrip() throws Exception {
        TournamentResult result = new TournamentRunner(registry, new MatchSimulator(), 20)
            .runTournament(List.of("TitForTat", "Defector", "Grudger", "Alternator"), 20, 2);

        TournamentResult restored = mapper.readValue(mapper.writeValueAsString(result), TournamentResult.class);

        assertEquals(result, restored);
        assertEquals(List.copyOf(result.cooperationRates().keySet()),
            List.copyOf(restored.cooperationRates().keySet()));
    }

    @Test
    void analysisResult_roundTrip() throws Exception {
        AnalysisResult result = new StrategyAnalyzer(registry, new MatchSimulator()).analyze("TitForTwoTats", 12);

        assertEquals(result, mapper.readValue(mapper.writeValueAsString(result), AnalysisResult.class));
    }

    @Test
    void matchResult_writesActionsAsSymbols() throws Exception {
        MatchResult match = new MatchSimulator().playMatch(
            registry.resolve("Alternator"), registry.resolve("Defector"), 3);

        String json = mapper.writeValueAsString(match);

        assertEquals(true, json.contains("\"actionsA\":[\"C\",\"D\",\"C\"]"), json);
        assertEquals(match, mapper.readValue(json, MatchResult.class));
    }
}
