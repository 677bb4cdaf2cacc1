package org.nowstart.orderflow.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.nowstart.orderflow.data.property.OrderEngineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OrderEngineConfig {

    @Bean
    public RateLimiter orderRateLimiter(OrderEngineProperties orderEngineProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(orderEngineProperties.rateLimitPerMinute())
                .timeoutDuration(Duration.ofMinutes(1))
                .build();
        return RateLimiter.of("order-worker", config);
    }

    @Bean
    public IntervalFunction orderRetryBackoff(OrderEngineProperties orderEngineProperties) {
        return IntervalFunction.ofExponentialBackoff(
                orderEngineProperties.backoffBase(),
                2.0,
                orderEngineProperties.backoffMax()
        );
    }
}
