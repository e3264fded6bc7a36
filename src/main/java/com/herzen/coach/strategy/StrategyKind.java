package com.herzen.coach.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.context.ContextNormalizer;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of strategy kinds. Each kind carries its own applicability rule so the rule can be
 * tested, listed and referenced by name from configuration.
 */
public enum StrategyKind implements ApplicabilityRule {
    STRESS_RELIEF {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.stressLevel() >= 0.6;
        }
    },
    REFLECTION {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.stressLevel() >= 0.5 && ctx.cognitiveLoad() < 0.7;
        }
    },
    BREAK_REMINDER {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.energyLevel() < 0.4 || ctx.flags().contains(ContextNormalizer.FLAG_LONG_WITHOUT_BREAK);
        }
    },
    FOCUS_ENHANCEMENT {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.stressLevel() < 0.6
                    && ctx.energyLevel() >= 0.5
                    && ctx.cognitiveLoad() < 0.7
                    && (ctx.focusState() == FocusState.SHALLOW || ctx.focusState() == FocusState.DEEP);
        }
    },
    TASK_BATCHING {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.focusState() == FocusState.SCATTERED
                    || ctx.flags().contains(ContextNormalizer.FLAG_FREQUENT_SWITCHING)
                    || ctx.flags().contains(ContextNormalizer.FLAG_HIGH_TAB_COUNT);
        }
    },
    MOTIVATION_BOOST {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.energyLevel() < 0.5 && ctx.stressLevel() < 0.7;
        }
    },
    HABIT_FORMATION {
        private final Set<String> habitGoals = Set.of("habit", "habits", "consistency", "routine");

        @Override
        public boolean appliesTo(UserContext ctx) {
            return ctx.goals().stream().anyMatch(habitGoals::contains);
        }
    },
    PRIORITY_PLANNING {
        @Override
        public boolean appliesTo(UserContext ctx) {
            return !ctx.goals().isEmpty() && ctx.cognitiveLoad() < 0.6 && ctx.stressLevel() < 0.6;
        }
    };

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
