package com.herzen.coach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public class DomainModels {

    /** Reason codes returned to the caller when no intervention is delivered. */
    public enum DeferReason {
        SUBOPTIMAL_TIMING, NO_ELIGIBLE_STRATEGY, COOLDOWN_ACTIVE, DAILY_CAP_REACHED;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
