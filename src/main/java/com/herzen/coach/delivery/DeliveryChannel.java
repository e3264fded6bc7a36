package com.herzen.coach.delivery;

import com.herzen.coach.recommendation.RecommendationModels.Intervention;

public interface DeliveryChannel {
    void deliver(String userId, Intervention intervention);
}
