package com.positionalert.engine.domain.run;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Host-imposed end of a run. Work still outstanding at this instant is abandoned. */
public record RunDeadline(Instant at, Clock clock) {

    public static RunDeadline after(Duration limit, Clock clock) {
        return new RunDeadline(clock.instant().plus(limit), clock);
    }

    public Duration remaining() {
        var left = Duration.between(clock.instant(), at);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(at);
    }
}
