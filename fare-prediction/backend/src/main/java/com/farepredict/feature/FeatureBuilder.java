package com.farepredict.feature;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Derives the model input vector from raw trip attributes.
 */
@Slf4j
@Component
public class FeatureBuilder {

    private static final Set<Integer> PEAK_HOURS = Set.of(8, 9, 17, 18, 19, 20);

    /**
     * @throws com.farepredict.exception.InvalidTimestampException if {@code pickupDatetime} cannot be parsed
     */
    public FeatureVector build(double pickupLat, double pickupLon,
                               double dropoffLat, double dropoffLon,
                               String pickupDatetime) {
        LocalDateTime pickup = TimestampParser.parse(pickupDatetime);

        int hour = pickup.getHour();
        int dayOfWeek = pickup.getDayOfWeek().getValue() - 1;
        double distance = GeoDistance.haversineKm(pickupLat, pickupLon, dropoffLat, dropoffLon);

        FeatureVector features = new FeatureVector(new double[] {
            distance,
            hour,
            dayOfWeek,
            pickup.getMonthValue(),
            pickup.getYear(),
            pickupLat,
            pickupLon,
            dropoffLat,
            dropoffLon,
            flag(hour >= 6 && hour < 12),
            flag(hour >= 12 && hour < 18),
            flag(hour >= 18 && hour < 22),
            flag(hour >= 22 || hour < 6),
            flag(dayOfWeek >= 5),
            flag((hour >= 7 && hour < 10) || (hour >= 16 && hour < 19)),
            flag(PEAK_HOURS.contains(hour))
        });
        log.debug("Features built | pickup={} | {}", pickup, features);
        return features;
    }

    private static double flag(boolean condition) {
        return condition ? 1.0 : 0.0;
    }
}
