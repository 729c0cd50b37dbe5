package com.seat.exchange.config;

import com.seat.exchange.dto.enums.OptimizerBackend;
import com.seat.exchange.matcher.strategies.CycleOptimizer;
import com.seat.exchange.matcher.strategies.HeuristicCycleOptimizer;
import com.seat.exchange.matcher.strategies.IntegerProgramCycleOptimizer;
import com.seat.exchange.matcher.strategies.SmallCycleHeuristic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;


@Slf4j
@Configuration
public class CycleOptimizerConfig {
    static final String SOLVER_CLASS = "org.ojalgo.optimisation.ExpressionsBasedModel";

    @Bean
    public CycleOptimizer cycleOptimizer(
            @Value("${exchange.optimizer.backend:auto}") String backend,
            SmallCycleHeuristic smallCycleHeuristic
    ) {
        return select(OptimizerBackend.from(backend), solverAvailable(), smallCycleHeuristic);
    }

    static CycleOptimizer select(OptimizerBackend backend, boolean solverAvailable, SmallCycleHeuristic heuristic) {
        if (backend == OptimizerBackend.HEURISTIC) {
            log.info("Cycle optimizer backend: heuristic (configured)");
            return new HeuristicCycleOptimizer(heuristic);
        }
        if (solverAvailable) {
            log.info("Cycle optimizer backend: ilp");
            return new IntegerProgramCycleOptimizer();
        }
        if (backend == OptimizerBackend.ILP) {
            log.warn("ILP backend requested but solver classes are missing, using heuristic");
        } else {
            log.info("Cycle optimizer backend: heuristic (no solver on classpath)");
        }
        return new HeuristicCycleOptimizer(heuristic);
    }

    static boolean solverAvailable() {
        return ClassUtils.isPresent(SOLVER_CLASS, CycleOptimizerConfig.class.getClassLoader());
    }
}
