package com.proximity.hotels.domain.service;

import com.proximity.hotels.domain.exception.OutOfRangeException;
import com.proximity.hotels.domain.model.BoundingBox;
import com.proximity.hotels.domain.model.Coordinates;
import com.proximity.hotels.domain.model.GeoConstants;
import com.proximity.hotels.domain.model.Hotel;
import com.proximity.hotels.domain.model.HotelSearchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static com.proximity.hotels.module.test.support.TestFixtures.Coordinates.*;
import static com.proximity.hotels.module.test.support.TestFixtures.hotel;
import static com.proximity.hotels.module.test.support.TestFixtures.uuid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HotelSearchEngineTest {

    private final HotelSearchEngine engine = new HotelSearchEngine();

    @Test
    void testSearch_EmptyInput_ReturnsEmpty() {
        assertThat(engine.search(List.of(), ZAGREB_LAT, ZAGREB_LNG)).isEmpty();
    }

    @Test
    void testSearch_SingleHotel_ReturnedWithDistance() {
        Hotel vienna = hotel("Vienna", "100", VIENNA_LAT, VIENNA_LNG);

        List<HotelSearchResult> results = engine.search(List.of(vienna), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getHotel()).isSameAs(vienna);
        assertThat(results.get(0).getDistanceKm()).isCloseTo(268.0, within(15.0));
    }

    @Test
    void testSearch_CheapAndClose_AlwaysFirstRegardlessOfInputOrder() {
        Hotel cheapClose = hotel("Cheap Close", "50", 45.816, 15.983);
        Hotel medium = hotel("Medium", "150", 45.9, 16.1);
        Hotel expensiveFar = hotel("Expensive Far", "500", 46.5, 17.0);
        List<Hotel> hotels = new ArrayList<>(List.of(cheapClose, medium, expensiveFar));
        Random random = new Random(42);

        for (int i = 0; i < 10; i++) {
            Collections.shuffle(hotels, random);

            List<HotelSearchResult> results = engine.search(hotels, ZAGREB_LAT, ZAGREB_LNG);

            assertThat(results).extracting(r -> r.getHotel().getName())
                    .containsExactly("Cheap Close", "Medium", "Expensive Far");
        }
    }

    @Test
    void testSearch_EqualPrices_SortedByDistance() {
        Hotel far = hotel("Far", "100", VIENNA_LAT, VIENNA_LNG);
        Hotel near = hotel("Near", "100", 45.82, 15.99);
        Hotel farthest = hotel("Farthest", "100", PARIS_LAT, PARIS_LNG);

        List<HotelSearchResult> results = engine.search(List.of(far, farthest, near), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results).extracting(r -> r.getHotel().getName())
                .containsExactly("Near", "Far", "Farthest");
    }

    @Test
    void testSearch_EqualDistances_SortedByPrice() {
        Hotel pricey = hotel("Pricey", "300", VIENNA_LAT, VIENNA_LNG);
        Hotel cheap = hotel("Cheap", "80", VIENNA_LAT, VIENNA_LNG);
        Hotel mid = hotel("Mid", "120", VIENNA_LAT, VIENNA_LNG);

        List<HotelSearchResult> results = engine.search(List.of(pricey, cheap, mid), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results).extracting(r -> r.getHotel().getName())
                .containsExactly("Cheap", "Mid", "Pricey");
    }

    @Test
    void testSearch_IdenticalScores_OrderedById() {
        Hotel second = hotel(uuid(2), "Second", "100", VIENNA_LAT, VIENNA_LNG);
        Hotel first = hotel(uuid(1), "First", "100", VIENNA_LAT, VIENNA_LNG);
        Hotel third = hotel(uuid(3), "Third", "100", VIENNA_LAT, VIENNA_LNG);

        List<HotelSearchResult> results = engine.search(List.of(third, second, first), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results).extracting(r -> r.getHotel().getName())
                .containsExactly("First", "Second", "Third");
    }

    @Test
    void testSearch_PriceAndDistanceTradeOff_UsesEqualWeights() {
        // Cheapest but farthest vs. priciest but closest: both score 0.5, the mid one wins
        Hotel cheapFar = hotel(uuid(1), "Cheap Far", "100", 46.815, ZAGREB_LNG);
        Hotel priceyNear = hotel(uuid(2), "Pricey Near", "300", ZAGREB_LAT, ZAGREB_LNG);
        Hotel balanced = hotel(uuid(3), "Balanced", "150", 46.065, ZAGREB_LNG);

        List<HotelSearchResult> results = engine.search(List.of(cheapFar, priceyNear, balanced), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results.get(0).getHotel().getName()).isEqualTo("Balanced");
        assertThat(results).extracting(r -> r.getHotel().getName())
                .containsExactly("Balanced", "Cheap Far", "Pricey Near");
    }

    @Test
    void testSearch_NoRadius_IncludesAntipodalHotel() {
        Hotel antipode = hotel("Antipode", "100", -ZAGREB_LAT, ZAGREB_LNG - 180);
        Hotel local = hotel("Local", "100", ZAGREB_LAT, ZAGREB_LNG);

        List<HotelSearchResult> results = engine.search(List.of(antipode, local), ZAGREB_LAT, ZAGREB_LNG);

        assertThat(results).hasSize(2);
        assertThat(results.get(1).getDistanceKm()).isCloseTo(Math.PI * GeoConstants.EARTH_RADIUS_KM, within(1.0));
    }

    @Test
    void testSearch_WithRadius_ExcludesHotelsBeyondIt() {
        Hotel vienna = hotel("Vienna", "100", VIENNA_LAT, VIENNA_LNG);
        Hotel local = hotel("Local", "100", 45.82, 15.99);

        List<HotelSearchResult> results = engine.search(
                List.of(vienna, local), ZAGREB_LAT, ZAGREB_LNG, OptionalDouble.of(100));

        assertThat(results).extracting(r -> r.getHotel().getName()).containsExactly("Local");
    }

    @Test
    void testSearch_ZeroRadius_KeepsOnlyExactLocation() {
        Hotel here = hotel("Here", "100", ZAGREB_LAT, ZAGREB_LNG);
        Hotel near = hotel("Near", "100", 45.82, 15.99);

        List<HotelSearchResult> results = engine.search(
                List.of(here, near), ZAGREB_LAT, ZAGREB_LNG, OptionalDouble.of(0));

        assertThat(results).extracting(r -> r.getHotel().getName()).containsExactly("Here");
    }

    @Test
    void testSearch_AcrossAntimeridian_FindsHotelOnOtherSide() {
        Hotel west = hotel("West Side", "100", 0.0, -179.9);
        Hotel farWest = hotel("Far West", "100", 0.0, 170.0);

        List<HotelSearchResult> results = engine.search(
                List.of(west, farWest), 0.0, 179.9, OptionalDouble.of(50));

        assertThat(results).extracting(r -> r.getHotel().getName()).containsExactly("West Side");
        assertThat(results.get(0).getDistanceKm()).isCloseTo(22.24, within(0.1));
    }

    @Test
    void testSearch_NearPole_FindsHotelAcrossThePole() {
        // 1 degree to the pole plus 0.5 degree down the opposite meridian, about 167 km
        Hotel acrossPole = hotel("Across Pole", "100", 89.5, 180.0);

        List<HotelSearchResult> results = engine.search(
                List.of(acrossPole), 89.0, 0.0, OptionalDouble.of(300));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getDistanceKm()).isCloseTo(166.8, within(1.0));
    }

    @Test
    void testSearch_FromPole_AcceptsAnyLongitude() {
        Hotel nearPole = hotel("Near Pole", "100", 89.9, 123.0);
        Hotel southPole = hotel("South Pole", "100", -90.0, 0.0);

        List<HotelSearchResult> results = engine.search(
                List.of(nearPole, southPole), 90.0, 0.0, OptionalDouble.of(50));

        assertThat(results).extracting(r -> r.getHotel().getName()).containsExactly("Near Pole");
    }

    @Test
    void testSearch_InvalidQuery_ThrowsOutOfRange() {
        List<Hotel> hotels = List.of(hotel("Hotel", "100", 0, 0));

        assertThatThrownBy(() -> engine.search(hotels, 91, 0)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> engine.search(hotels, 0, -181)).isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> engine.search(hotels, Double.NaN, 0)).isInstanceOf(OutOfRangeException.class);
    }

    @Test
    void testSearch_InvalidQueryOnEmptyInput_StillThrows() {
        assertThatThrownBy(() -> engine.search(List.of(), 0, 200)).isInstanceOf(OutOfRangeException.class);
    }

    @Test
    void testSearch_NegativeOrNaNRadius_ThrowsOutOfRange() {
        List<Hotel> hotels = List.of(hotel("Hotel", "100", 0, 0));

        assertThatThrownBy(() -> engine.search(hotels, 0, 0, OptionalDouble.of(-1)))
                .isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> engine.search(hotels, 0, 0, OptionalDouble.of(Double.NaN)))
                .isInstanceOf(OutOfRangeException.class);
    }

    @Test
    void testCalculateDistanceKm_MatchesCoordinates() {
        double distance = engine.calculateDistanceKm(ZAGREB_LAT, ZAGREB_LNG, VIENNA_LAT, VIENNA_LNG);

        assertThat(distance).isCloseTo(
                Coordinates.of(ZAGREB_LAT, ZAGREB_LNG).distanceTo(Coordinates.of(VIENNA_LAT, VIENNA_LNG)),
                within(1e-9));
    }

    @Test
    void testCalculateBoundingBox_Equator_IsSymmetric() {
        BoundingBox box = engine.calculateBoundingBox(0.0, 0.0, 111.0);

        assertThat(box.getMinLat()).isCloseTo(-1.0, within(1e-9));
        assertThat(box.getMaxLat()).isCloseTo(1.0, within(1e-9));
        assertThat(box.getMinLon()).isCloseTo(-1.0, within(1e-3));
        assertThat(box.getMaxLon()).isCloseTo(1.0, within(1e-3));
        assertThat(box.crossesAntimeridian()).isFalse();
    }

    @Test
    void testCalculateBoundingBox_NearAntimeridian_Wraps() {
        BoundingBox box = engine.calculateBoundingBox(0.0, 179.5, 111.0);

        assertThat(box.crossesAntimeridian()).isTrue();
        assertThat(box.contains(Coordinates.of(0.0, -179.8))).isTrue();
        assertThat(box.contains(Coordinates.of(0.0, 179.0))).isTrue();
        assertThat(box.contains(Coordinates.of(0.0, 170.0))).isFalse();
        assertThat(box.contains(Coordinates.of(0.0, -170.0))).isFalse();
    }

    @Test
    void testCalculateBoundingBox_ReachingPole_SpansAllLongitudes() {
        BoundingBox box = engine.calculateBoundingBox(89.5, 10.0, 100.0);

        assertThat(box.getMinLon()).isEqualTo(-180.0);
        assertThat(box.getMaxLon()).isEqualTo(180.0);
        assertThat(box.getMaxLat()).isEqualTo(90.0);
    }

    @Test
    void testCalculateBoundingBox_NeverExcludesPointsWithinRadius() {
        Random random = new Random(7);
        double[] radii = {1, 25, 150, 800, 3000};

        for (int i = 0; i < 20_000; i++) {
            double centerLat = -90 + random.nextDouble() * 180;
            double centerLon = -180 + random.nextDouble() * 360;
            double radius = radii[random.nextInt(radii.length)];

            // Bias half of the points towards the center so the inside case is exercised
            double lat;
            double lon;
            if (random.nextBoolean()) {
                lat = clamp(centerLat + (random.nextDouble() - 0.5) * 2 * radius / 100, -90, 90);
                lon = wrap(centerLon + (random.nextDouble() - 0.5) * 2 * radius / 10);
            } else {
                lat = -90 + random.nextDouble() * 180;
                lon = -180 + random.nextDouble() * 360;
            }

            Coordinates center = Coordinates.of(centerLat, centerLon);
            Coordinates point = Coordinates.of(lat, lon);
            if (center.distanceTo(point) <= radius) {
                BoundingBox box = engine.calculateBoundingBox(centerLat, centerLon, radius);
                assertThat(box.contains(point))
                        .as("box %s around %s (r=%s km) must contain %s", box, center, radius, point)
                        .isTrue();
            }
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double wrap(double lon) {
        if (lon > 180) {
            return lon - 360;
        }
        if (lon < -180) {
            return lon + 360;
        }
        return lon;
    }
}
