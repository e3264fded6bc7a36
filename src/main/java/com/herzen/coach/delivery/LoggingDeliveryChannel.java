package com.herzen.coach.delivery;

import com.herzen.coach.recommendation.RecommendationModels.Intervention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingDeliveryChannel implements DeliveryChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    @Override
    public void deliver(String userId, Intervention intervention) {
        log.info("Delivering {} to user={}: \"{}\" ({} steps, follow-up at {})",
                intervention.type().code(), userId, intervention.message(),
                intervention.actionSteps().size(), intervention.followUpAt());
    }
}
