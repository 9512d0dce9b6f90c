package uk.gegc.recall.features.scheduling.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.recall.features.scheduling.application.MemoryModel;
import uk.gegc.recall.features.scheduling.application.impl.FsrsAlgorithm;
import uk.gegc.recall.shared.config.ReviewSchedulingProperties;

@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean
    public MemoryModel memoryModel(ReviewSchedulingProperties properties) {
        ReviewSchedulingProperties.Fsrs fsrs = properties.getFsrs();
        double[] weights = fsrs.getWeights() == null || fsrs.getWeights().length == 0
                ? FsrsAlgorithm.DEFAULT_WEIGHTS
                : fsrs.getWeights();
        log.info("FSRS memory model configured - retention: {}, maxInterval: {}d, customWeights: {}",
                fsrs.getRequestRetention(), fsrs.getMaximumIntervalDays(), weights != FsrsAlgorithm.DEFAULT_WEIGHTS);
        return new FsrsAlgorithm(weights, fsrs.getRequestRetention(), fsrs.getMaximumIntervalDays());
    }
}
