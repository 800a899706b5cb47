package com.gt.recall.algorithm;

import com.gt.recall.algorithm.impl.AnkiAlgorithm;
import com.gt.recall.algorithm.impl.FixedGrowthAlgorithm;
import com.gt.recall.algorithm.impl.LeitnerAlgorithm;
import com.gt.recall.algorithm.impl.Sm2Algorithm;
import com.gt.recall.model.RepetitionAlgorithm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ExtendWith(SpringExtension.class)
public class AlgorithmRegistryTests {

    @Test
    public void testRequire() {
        AlgorithmRegistry registry = new AlgorithmRegistry(List.of(
                new Sm2Algorithm(3650),
                new AnkiAlgorithm(List.of(1, 10), 1, 4, 0.2, 1.2, 1.3, 8, 3650),
                new LeitnerAlgorithm(List.of(1, 2, 4, 8, 16), 3650),
                new FixedGrowthAlgorithm(2.0, 3650)));

        for (RepetitionAlgorithm id : RepetitionAlgorithm.values()) {
            assertEquals(id, registry.require(id).id());
        }
    }

    @Test
    public void testMissingAlgorithm() {
        AlgorithmRegistry registry = new AlgorithmRegistry(List.of(new Sm2Algorithm(3650)));

        assertThrows(IllegalArgumentException.class, () -> registry.require(RepetitionAlgorithm.LEITNER));
        assertThrows(IllegalArgumentException.class, () -> registry.require(null));
    }

    @Test
    public void testDuplicateAlgorithm() {
        assertThrows(IllegalStateException.class,
                () -> new AlgorithmRegistry(List.of(new Sm2Algorithm(3650), new Sm2Algorithm(100))));
    }
}
