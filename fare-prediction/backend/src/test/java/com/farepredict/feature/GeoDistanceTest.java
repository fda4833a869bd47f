package com.farepredict.feature;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeoDistanceTest {

    @Test
    void cityHallToTimesSquare_isAboutFiveAndAHalfKm() {
        double d = GeoDistance.haversineKm(40.7128, -74.0060, 40.7589, -73.9851);
        assertThat(d).isCloseTo(5.42, within(0.01));
    }

    @Test
    void isSymmetric() {
        double ab = GeoDistance.haversineKm(51.5007, -0.1246, 40.6892, -74.0445);
        double ba = GeoDistance.haversineKm(40.6892, -74.0445, 51.5007, -0.1246);
        assertThat(ab).isEqualTo(ba);
        assertThat(ab).isCloseTo(5574.8, within(0.5));
    }

    @Test
    void samePoint_isZero() {
        assertThat(GeoDistance.haversineKm(40.7128, -74.0060, 40.7128, -74.0060)).isZero();
    }

    @Test
    void antipodes_isHalfTheCircumference() {
        double d = GeoDistance.haversineKm(0.0, 0.0, 0.0, 180.0);
        assertThat(d).isCloseTo(Math.PI * GeoDistance.EARTH_RADIUS_KM, within(1e-6));
    }
}
