package com.strategylab.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Connection settings for the single-run backtest service. */
@Configuration
@ConfigurationProperties(prefix = "strategylab.evaluator")
@Getter
@Setter
public class EvaluatorProperties {

    /** Endpoint accepting one resolved strategy per request. */
    private String url = "http://localhost:3001/api/backtest_strategy";

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Single backtests over long date ranges can take minutes. */
    private Duration timeout = Duration.ofMinutes(5);

    /** Used when a batch request names no benchmark. */
    private String defaultBenchmark = "SPY";

    /** Used when a batch request names no start date. */
    private String defaultStartDate = "max";
}
