package app.revisio.core.config;

import app.revisio.core.review.algorithm.FsrsParameters;
import app.revisio.core.review.algorithm.FsrsScheduler;
import app.revisio.core.review.algorithm.IntervalFuzz;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(FsrsProps.class)
public class FsrsConfig {

    private static final Logger log = LoggerFactory.getLogger(FsrsConfig.class);

    @Bean
    public FsrsParameters fsrsParameters(FsrsProps props, ObjectMapper objectMapper) {
        FsrsParameters params = FsrsParameters.from(objectMapper.valueToTree(props));
        log.info("Review scheduler configured: retention={}, learningSteps={}, relearningSteps={}, maxInterval={}d",
                params.requestRetention(),
                params.learningStepsMinutes(),
                params.relearningStepsMinutes(),
                params.maximumIntervalDays());
        return params;
    }

    @Bean
    public FsrsScheduler fsrsScheduler(FsrsParameters params, FsrsProps props) {
        IntervalFuzz fuzz = props.fuzzingEnabled() ? IntervalFuzz.random() : IntervalFuzz.none();
        return new FsrsScheduler(params, fuzz);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
