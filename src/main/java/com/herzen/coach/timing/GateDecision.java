package com.herzen.coach.timing;

import com.herzen.coach.domain.DomainModels.DeferReason;

public record GateDecision(boolean allowed, DeferReason reason, String detail) {

    public static GateDecision allow() {
        return new GateDecision(true, null, "eligible");
    }

    public static GateDecision deny(DeferReason reason, String detail) {
        return new GateDecision(false, reason, detail);
    }
}
