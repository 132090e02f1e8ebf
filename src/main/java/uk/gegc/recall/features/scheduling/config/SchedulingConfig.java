package uk.gegc.recall.features.scheduling.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.application.CardStateMachine;
import uk.gegc.recall.features.scheduling.application.DueSetSelector;
import uk.gegc.recall.features.scheduling.application.IntervalCalculator;
import uk.gegc.recall.features.scheduling.application.MemoryStateUpdater;
import uk.gegc.recall.features.scheduling.application.RetrievabilityEstimator;
import uk.gegc.recall.features.scheduling.application.impl.ForgettingCurveScheduler;

/**
 * Builds the single configuration-bound scheduler instance. Callers receive it
 * by injection; there is no static accessor.
 */
@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    @Bean
    public RetrievabilityEstimator retrievabilityEstimator(SchedulingProperties properties) {
        return new RetrievabilityEstimator(properties.getStability().getMin());
    }

    @Bean
    public MemoryStateUpdater memoryStateUpdater(SchedulingProperties properties) {
        return new MemoryStateUpdater(properties);
    }

    @Bean
    public IntervalCalculator intervalCalculator(SchedulingProperties properties) {
        return new IntervalCalculator(properties);
    }

    @Bean
    public CardStateMachine cardStateMachine(IntervalCalculator intervalCalculator) {
        return new CardStateMachine(intervalCalculator);
    }

    @Bean
    public CardScheduler cardScheduler(SchedulingProperties properties,
                                       RetrievabilityEstimator retrievabilityEstimator,
                                       MemoryStateUpdater memoryStateUpdater,
                                       CardStateMachine cardStateMachine) {
        return new ForgettingCurveScheduler(properties, retrievabilityEstimator, memoryStateUpdater, cardStateMachine);
    }

    @Bean
    public DueSetSelector dueSetSelector() {
        return new DueSetSelector();
    }
}
