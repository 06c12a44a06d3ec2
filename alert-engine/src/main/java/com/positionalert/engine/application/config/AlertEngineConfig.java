package com.positionalert.engine.application.config;

import com.positionalert.common.json.JacksonConfig;
import com.positionalert.engine.domain.alert.AlertEngine;
import com.positionalert.engine.domain.alert.AlertStateStore;
import com.positionalert.engine.domain.alert.SignalWindow;
import com.positionalert.engine.domain.dispatch.NotificationDispatcher;
import com.positionalert.engine.domain.marketdata.DataValidator;
import com.positionalert.engine.domain.marketdata.FetchSettings;
import com.positionalert.engine.domain.marketdata.MarketDataProvider;
import com.positionalert.engine.domain.marketdata.PricePrecedence;
import com.positionalert.engine.domain.marketdata.RateLimiter;
import com.positionalert.engine.domain.marketdata.SnapshotFetcher;
import com.positionalert.engine.domain.position.PositionSource;
import com.positionalert.engine.domain.run.AlertRunService;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tools.jackson.databind.json.JsonMapper;

@Slf4j
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonMapper jsonMapper() {
        return JacksonConfig.createJsonMapper();
    }

    @Bean
    public RateLimiter rateLimiter(AlertProperties properties) {
        var provider = properties.provider();
        var limiter = new RateLimiter(provider.rateLimitPerSec(), provider.maxRateLimitWait());
        log.info("Provider rate limit {} req/s, one request every {} ms",
                provider.rateLimitPerSec(), limiter.interval().toMillis());
        return limiter;
    }

    @Bean
    public SnapshotFetcher snapshotFetcher(
            MarketDataProvider marketDataProvider,
            RateLimiter rateLimiter,
            ThreadPoolTaskExecutor marketDataExecutor,
            AlertProperties properties,
            Clock clock) {
        var provider = properties.provider();
        var signals = properties.signals();
        var settings = FetchSettings.builder()
                .fetchTimeout(provider.fetchTimeout())
                .pricePrecedence(new PricePrecedence(provider.pricePrecedence()))
                .averageVolumeDays(provider.averageVolumeDays())
                .minuteBarLimit(signals.minutesEnabled() ? provider.minuteBarLimit() : 0)
                .secondBarLimit(signals.secondsEnabled() ? provider.secondBarLimit() : 0)
                .build();
        return new SnapshotFetcher(marketDataProvider, rateLimiter, marketDataExecutor, settings, clock);
    }

    @Bean
    public AlertEngine alertEngine(
            AlertStateStore alertStateStore,
            ThreadPoolTaskExecutor alertEvaluationExecutor,
            AlertProperties properties,
            Clock clock) {
        var signals = SignalWindowFactory.fromProperties(properties);
        var store = properties.store();
        log.info("Alert signals {} with store failure policy {}",
                signals.stream().map(SignalWindow::name).toList(), store.failurePolicy());
        return new AlertEngine(
                alertStateStore,
                signals,
                store.failurePolicy(),
                Duration.ofDays(store.recordTtlDays()),
                alertEvaluationExecutor,
                clock);
    }

    @Bean
    public AlertRunService alertRunService(
            PositionSource positionSource,
            SnapshotFetcher snapshotFetcher,
            DataValidator dataValidator,
            AlertEngine alertEngine,
            NotificationDispatcher notificationDispatcher,
            Clock clock) {
        return new AlertRunService(
                positionSource, snapshotFetcher, dataValidator, alertEngine, notificationDispatcher, clock);
    }
}
