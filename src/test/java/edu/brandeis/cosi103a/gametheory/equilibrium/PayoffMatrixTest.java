package edu.brandeis.cosi103a.gametheory.equilibrium;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.InvalidMatrixException;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PayoffMatrixTest {

    @Test
    void of_rejectsEmptyAndRaggedMatrices() {
        assertThrows(InvalidMatrixException.class, () -> PayoffMatrix.of(new double[0][]));
        assertThrows(InvalidMatrixException.class, () -> PayoffMatrix.of(new double[][] {{}}));
        assertThrows(InvalidMatrixException.class, () -> PayoffMatrix.of(new double[][] {{1, 2}, {3}}));
        assertThrows(InvalidMatrixException.class, () -> PayoffMatrix.of(new double[][] {{1, Double.NaN}}));
    }

    @Test
    void of_copiesInput() {
        double[][] raw = {{3, 0}, {5, 1}};
        PayoffMatrix matrix = PayoffMatrix.of(raw);
        raw[0][0] = 100;

        assertEquals(3.0, matrix.get(0, 0));
    }

    @Test
    void fromRows_rejectsMissingCells() {
        assertThrows(InvalidMatrixException.class, () -> PayoffMatrix.fromRows(List.of()));
        assertThrows(InvalidMatrixException.class,
            () -> PayoffMatrix.fromRows(List.of(List.of(1.0, 2.0), List.of(3.0))));
    }

    @Test
    void json_roundTrip() throws Exception {
        ObjectMapper mapper = ObjectMapperFactory.create();
        PayoffMatrix matrix = PayoffMatrix.of(new double[][] {{3, 0}, {5, 1}});

        String json = mapper.writeValueAsString(matrix);

        assertEquals("{\"values\":[[3.0,0.0],[5.0,1.0]]}", json);
        assertEquals(matrix, mapper.readValue(json, PayoffMatrix.class));
    }
}
