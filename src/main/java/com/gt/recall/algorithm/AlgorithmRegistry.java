package com.gt.recall.algorithm;

import com.gt.recall.model.RepetitionAlgorithm;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class AlgorithmRegistry {

    private final Map<RepetitionAlgorithm, SchedulingAlgorithm> algorithms;

    public AlgorithmRegistry(List<SchedulingAlgorithm> list) {
        Map<RepetitionAlgorithm, SchedulingAlgorithm> map = new EnumMap<>(RepetitionAlgorithm.class);
        for (SchedulingAlgorithm algorithm : list) {
            if (map.put(algorithm.id(), algorithm) != null) {
                throw new IllegalStateException("Duplicate scheduling algorithm registered for " + algorithm.id());
            }
        }
        this.algorithms = Map.copyOf(map);
    }

    public SchedulingAlgorithm require(RepetitionAlgorithm id) {
        if (id == null) {
            throw new IllegalArgumentException("Algorithm is required");
        }

        SchedulingAlgorithm algorithm = algorithms.get(id);
        if (algorithm == null) {
            throw new IllegalArgumentException("Unsupported algorithm: " + id);
        }
        return algorithm;
    }
}
