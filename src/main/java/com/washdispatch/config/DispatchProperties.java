package com.washdispatch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties("dispatch")
@Data
@Validated
public class DispatchProperties {

    /**
     * Currency every job is charged in.
     */
    @NotBlank
    private String currency = "AED";

    /**
     * Zone of the operating market, used for receipt dates.
     */
    @NotNull
    private ZoneId businessZone = ZoneId.of("Asia/Dubai");

    private Expiry expiry = new Expiry();

    private DutyTimeout dutyTimeout = new DutyTimeout();

    @Data
    public static class Expiry {
        /**
         * Turns the scheduled sweep on or off. The sweep itself can still be invoked directly.
         */
        private boolean enabled = true;

        /**
         * How long a PAID job may wait for a cleaner before it is refunded.
         */
        @NotNull
        private Duration gracePeriod = Duration.ofMinutes(15);

        /**
         * Delay between two sweeps, in milliseconds.
         */
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class DutyTimeout {
        private boolean enabled = true;

        /**
         * An ON_DUTY cleaner whose last location report is older than this goes off duty.
         */
        @NotNull
        private Duration staleAfter = Duration.ofMinutes(10);

        private long sweepIntervalMs = 60_000;
    }
}
