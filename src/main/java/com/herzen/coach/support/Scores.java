package com.herzen.coach.support;

public final class Scores {
    private Scores() {}

    public static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
