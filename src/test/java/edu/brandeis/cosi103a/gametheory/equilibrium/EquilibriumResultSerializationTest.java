package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EquilibriumResultSerializationTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();

    @Test
    void computedResult_survivesJsonRoundTrip() throws Exception {
        PayoffMatrix hawkDove = PayoffMatrix.of(new double[][] {{0, 3}, {1, 2}});
        EquilibriumResult result = new SupportEnumerationCalculator().computeEquilibria(hawkDove);

        String json = mapper.writeValueAsString(result);
        EquilibriumResult restored = mapper.readValue(json, EquilibriumResult.class);

        assertEquals(result, restored);
    }

    @Test
    void strategyProfile_rejectsInvalidDistribution() {
        assertThrows(IllegalArgumentException.class,
            () -> StrategyProfile.of(new double[] {0.5, 0.6}, new double[] {1.0}));
        assertThrows(IllegalArgumentException.class,
            () -> StrategyProfile.of(new double[] {1.5, -0.5}, new double[] {1.0}));
        assertThrows(IllegalArgumentException.class,
            () -> StrategyProfile.of(new double[0], new double[] {1.0}));
    }
}
