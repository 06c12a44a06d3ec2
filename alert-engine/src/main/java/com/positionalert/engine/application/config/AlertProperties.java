package com.positionalert.engine.application.config;

import com.positionalert.engine.domain.alert.StoreFailurePolicy;
import com.positionalert.engine.domain.marketdata.PriceSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code alert.*}. The environment names operators know ({@code ALERT_THRESHOLD_PERCENT},
 * {@code MAX_CONCURRENT_FETCHES}, ...) are mapped onto these in application.yml.
 *
 * @param incrementalStepPercent further move needed for an incremental daily alert; defaults to the threshold
 */
@Validated
@ConfigurationProperties(prefix = "alert")
public record AlertProperties(
        @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal thresholdPercent,
        @DecimalMin(value = "0.0", inclusive = false) BigDecimal incrementalStepPercent,
        @NotNull @Valid Provider provider,
        @NotNull @Valid Store store,
        @NotNull @Valid Signals signals,
        @NotNull @Valid Positions positions,
        @NotNull @Valid Dispatch dispatch,
        @NotNull @Valid Schedule schedule,
        @NotNull @Valid Run run) {

    public BigDecimal effectiveIncrementalStep() {
        return incrementalStepPercent != null ? incrementalStepPercent : thresholdPercent;
    }

    public record Provider(
            @NotBlank String baseUrl,
            String apiKey,
            @Min(1) @Max(200) int maxConcurrentFetches,
            @Min(1) @Max(1000) int rateLimitPerSec,
            @NotNull Duration maxRateLimitWait,
            @NotNull Duration fetchTimeout,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout,
            @NotEmpty List<PriceSource> pricePrecedence,
            @Min(1) int averageVolumeDays,
            @Min(2) int minuteBarLimit,
            @Min(2) int secondBarLimit) {}

    public record Store(
            @Min(1) int recordTtlDays,
            @NotNull StoreFailurePolicy failurePolicy,
            @NotBlank String purgeCron,
            @NotBlank String purgeZone) {}

    /** Intraday signals; the daily signal is always on and driven by the threshold settings. */
    public record Signals(
            boolean secondsEnabled,
            boolean minutesEnabled,
            @NotNull @Valid List<Window> seconds,
            @NotNull @Valid Window minutes) {}

    /** @param stepPercent further move for an incremental alert; defaults to the threshold */
    public record Window(
            @NotBlank String name,
            @Min(1) int minSteps,
            @Min(1) int maxSteps,
            @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal thresholdPercent,
            @DecimalMin(value = "0.0", inclusive = false) BigDecimal stepPercent) {}

    public record Positions(@NotBlank String file) {}

    public record Dispatch(@NotNull @Pattern(regexp = "kafka|log") String mode, @NotNull Duration sendTimeout) {}

    /** @param cron Spring cron expression, {@code -} disables the schedule */
    public record Schedule(@NotBlank String cron, @NotBlank String zone, boolean runOnStartup) {}

    public record Run(@NotNull Duration timeLimit, @Min(1) @Max(200) int evaluationConcurrency) {}
}
