package com.positionalert.engine.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter alertRunsCounter(MeterRegistry registry) {
        return Counter.builder("alert.runs")
                .description("Completed alert check runs")
                .register(registry);
    }

    @Bean
    public Counter initialAlertsCounter(MeterRegistry registry) {
        return Counter.builder("alert.alerts.initial")
                .description("Initial alerts decided")
                .register(registry);
    }

    @Bean
    public Counter incrementalAlertsCounter(MeterRegistry registry) {
        return Counter.builder("alert.alerts.incremental")
                .description("Incremental alerts decided")
                .register(registry);
    }

    @Bean
    public Counter suppressedAlertsCounter(MeterRegistry registry) {
        return Counter.builder("alert.alerts.suppressed")
                .description("Threshold crossings suppressed as duplicates or by store failure")
                .register(registry);
    }

    @Bean
    public Counter snapshotsFetchedCounter(MeterRegistry registry) {
        return Counter.builder("alert.snapshots.fetched")
                .description("Snapshots fetched from the provider")
                .register(registry);
    }

    @Bean
    public Counter snapshotsRejectedCounter(MeterRegistry registry) {
        return Counter.builder("alert.snapshots.rejected")
                .description("Snapshots rejected by validation")
                .register(registry);
    }

    @Bean
    public Counter runErrorsCounter(MeterRegistry registry) {
        return Counter.builder("alert.run.errors")
                .description("Per-ticker fetch, store and dispatch errors")
                .register(registry);
    }

    @Bean
    public Counter alertsSentCounter(MeterRegistry registry) {
        return Counter.builder("alert.dispatch.sent")
                .description("Alerts handed to the dispatcher successfully")
                .register(registry);
    }

    @Bean
    public Counter alertsFailedCounter(MeterRegistry registry) {
        return Counter.builder("alert.dispatch.failed")
                .description("Alerts the dispatcher could not deliver")
                .register(registry);
    }

    @Bean
    public Timer alertRunTimer(MeterRegistry registry) {
        return Timer.builder("alert.run.duration")
                .description("Wall-clock time of an alert check run")
                .register(registry);
    }
}
