package edu.brandeis.cosi103a.gametheory;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.gametheory.equilibrium.EquilibriumCalculator;
import edu.brandeis.cosi103a.gametheory.equilibrium.SupportEnumerationCalculator;
import edu.brandeis.cosi103a.gametheory.experiment.ExperimentRepository;
import edu.brandeis.cosi103a.gametheory.experiment.ExperimentRunRepository;
import edu.brandeis.cosi103a.gametheory.experiment.InMemoryExperimentRepository;
import edu.brandeis.cosi103a.gametheory.experiment.InMemoryExperimentRunRepository;
import edu.brandeis.cosi103a.gametheory.runner.MatchSimulator;
import edu.brandeis.cosi103a.gametheory.runner.StrategyAnalyzer;
import edu.brandeis.cosi103a.gametheory.runner.TournamentRunner;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyDiscoveryService;
import edu.brandeis.cosi103a.gametheory.strategy.StrategyRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot host for the evaluation engine and the experiment services.
 */
@SpringBootApplication
public class GameTheoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameTheoryApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public StrategyRegistry strategyRegistry(StrategyDiscoveryService discoveryService) {
        return discoveryService.buildRegistry();
    }

    @Bean
    public MatchSimulator matchSimulator() {
        return new MatchSimulator();
    }

    @Bean
    public TournamentRunner tournamentRunner(StrategyRegistry registry, MatchSimulator simulator,
                                             @Value("${evaluation.max-strategies:20}") int maxStrategies) {
        return new TournamentRunner(registry, simulator, maxStrategies);
    }

    @Bean
    public StrategyAnalyzer strategyAnalyzer(StrategyRegistry registry, MatchSimulator simulator) {
        return new StrategyAnalyzer(registry, simulator);
    }

    @Bean
    public EquilibriumCalculator equilibriumCalculator() {
        return new SupportEnumerationCalculator();
    }

    @Bean
    public ExperimentRepository experimentRepository() {
        return new InMemoryExperimentRepository();
    }

    @Bean
    public ExperimentRunRepository experimentRunRepository() {
        return new InMemoryExperimentRunRepository();
    }
}
