package com.proximity.hotels.domain.service;

import com.proximity.hotels.domain.exception.OutOfRangeException;
import com.proximity.hotels.domain.model.BoundingBox;
import com.proximity.hotels.domain.model.Coordinates;
import com.proximity.hotels.domain.model.GeoConstants;
import com.proximity.hotels.domain.model.Hotel;
import com.proximity.hotels.domain.model.HotelSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Domain service ranking hotels around a query point.
 *
 * Two phases:
 * 1. Bounding box pre-filter: plain comparisons that drop hotels which cannot be inside
 *    the radius. The box may admit extra hotels near its corners but never drops one
 *    that is within the radius.
 * 2. Exact Haversine distance for the survivors, filtered against the radius.
 *
 * Survivors are ranked by a score mixing min/max normalized price and distance, lower
 * first. Hotels with an identical score are ordered by ID.
 *
 * Stateless; safe to call concurrently.
 */
@Service
public class HotelSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(HotelSearchEngine.class);

    private static final Comparator<ScoredResult> RANKING = Comparator
            .comparingDouble(ScoredResult::score)
            .thenComparing(scored -> scored.result().getHotel().getId());

    /**
     * Search without a radius limit.
     */
    public List<HotelSearchResult> search(Collection<Hotel> hotels, double latitude, double longitude) {
        return search(hotels, latitude, longitude, OptionalDouble.empty());
    }

    /**
     * Ranks every hotel within the radius of the query point, best first.
     *
     * @param hotels    Snapshot of hotels to search
     * @param latitude  Query latitude
     * @param longitude Query longitude
     * @param radiusKm  Search radius; {@link GeoConstants#DEFAULT_SEARCH_RADIUS_KM} when absent
     * @return Ranked results, empty when nothing matches
     * @throws OutOfRangeException if the query coordinate or the radius is invalid
     */
    public List<HotelSearchResult> search(Collection<Hotel> hotels, double latitude, double longitude,
            OptionalDouble radiusKm) {
        Objects.requireNonNull(hotels, "hotels must not be null");

        // Validated before touching any data
        Coordinates origin = Coordinates.of(latitude, longitude);
        double effectiveRadius = radiusKm.orElse(GeoConstants.DEFAULT_SEARCH_RADIUS_KM);
        if (Double.isNaN(effectiveRadius) || effectiveRadius < 0) {
            throw new OutOfRangeException("radiusKm", effectiveRadius, "Search radius must be zero or positive.");
        }

        BoundingBox box = calculateBoundingBox(latitude, longitude, effectiveRadius);

        List<HotelSearchResult> candidates = new ArrayList<>();
        for (Hotel hotel : hotels) {
            if (!box.contains(hotel.getLocation())) {
                continue;
            }
            double distanceKm = origin.distanceTo(hotel.getLocation());
            if (distanceKm <= effectiveRadius) {
                candidates.add(new HotelSearchResult(hotel, distanceKm));
            }
        }

        logger.debug("Search at {} radius={}km: {} of {} hotels matched (box={})",
                origin, effectiveRadius, candidates.size(), hotels.size(), box);

        if (candidates.size() <= 1) {
            return candidates;
        }
        return sortByPriceAndDistance(candidates);
    }

    /**
     * Haversine distance between two points in degrees.
     *
     * @throws OutOfRangeException if either point is invalid
     */
    public double calculateDistanceKm(double originLatitude, double originLongitude,
            double destinationLatitude, double destinationLongitude) {
        return Coordinates.of(originLatitude, originLongitude)
                .distanceTo(Coordinates.of(destinationLatitude, destinationLongitude));
    }

    /**
     * Box enclosing every point within {@code radiusKm} of the center.
     *
     * Latitude spans radius / 111 km per degree. Longitude spans the widest longitude
     * offset reached by the search circle, asin(sin(d) / cos(lat)), which grows towards
     * the poles. When the circle reaches a pole, or the center is on one, every longitude
     * is accepted. Longitudes are wrapped into [-180, 180], so a box crossing the
     * antimeridian ends up with minLon > maxLon.
     */
    BoundingBox calculateBoundingBox(double centerLat, double centerLon, double radiusKm) {
        double deltaLat = radiusKm / GeoConstants.KM_PER_DEGREE_LAT;
        double minLat = centerLat - deltaLat;
        double maxLat = centerLat + deltaLat;

        double cosLat = Math.cos(Math.toRadians(centerLat));
        boolean reachesPole = minLat <= GeoConstants.MIN_LATITUDE || maxLat >= GeoConstants.MAX_LATITUDE;

        if (cosLat <= GeoConstants.POLAR_COSINE_THRESHOLD || reachesPole) {
            return new BoundingBox(
                    Math.max(minLat, GeoConstants.MIN_LATITUDE),
                    Math.min(maxLat, GeoConstants.MAX_LATITUDE),
                    -GeoConstants.POLAR_LONGITUDE_RANGE,
                    GeoConstants.POLAR_LONGITUDE_RANGE);
        }

        // deltaLat < 90 - |centerLat| here, so the ratio stays below 1
        double ratio = Math.sin(Math.toRadians(deltaLat)) / cosLat;
        double deltaLon = Math.toDegrees(Math.asin(Math.min(1.0, ratio)));

        double minLon = centerLon - deltaLon;
        double maxLon = centerLon + deltaLon;
        if (minLon < GeoConstants.MIN_LONGITUDE) {
            minLon += 360.0;
        }
        if (maxLon > GeoConstants.MAX_LONGITUDE) {
            maxLon -= 360.0;
        }
        return new BoundingBox(minLat, maxLat, minLon, maxLon);
    }

    /**
     * score = normalizedPrice * PRICE_WEIGHT + normalizedDistance * DISTANCE_WEIGHT, where
     * each metric is rescaled to [0, 1] over the candidates (0 when all values are equal).
     */
    private List<HotelSearchResult> sortByPriceAndDistance(List<HotelSearchResult> candidates) {
        BigDecimal minPrice = candidates.get(0).getHotel().getPricePerNight();
        BigDecimal maxPrice = minPrice;
        double minDistance = Double.MAX_VALUE;
        double maxDistance = -Double.MAX_VALUE;

        for (HotelSearchResult candidate : candidates) {
            BigDecimal price = candidate.getHotel().getPricePerNight();
            minPrice = price.min(minPrice);
            maxPrice = price.max(maxPrice);
            minDistance = Math.min(minDistance, candidate.getDistanceKm());
            maxDistance = Math.max(maxDistance, candidate.getDistanceKm());
        }

        BigDecimal priceRange = maxPrice.subtract(minPrice);
        double distanceRange = maxDistance - minDistance;

        List<ScoredResult> scored = new ArrayList<>(candidates.size());
        for (HotelSearchResult candidate : candidates) {
            double normalizedPrice = priceRange.signum() > 0
                    ? candidate.getHotel().getPricePerNight().subtract(minPrice)
                            .divide(priceRange, MathContext.DECIMAL64).doubleValue()
                    : 0.0;
            double normalizedDistance = distanceRange > 0
                    ? (candidate.getDistanceKm() - minDistance) / distanceRange
                    : 0.0;

            double score = normalizedPrice * GeoConstants.PRICE_WEIGHT
                    + normalizedDistance * GeoConstants.DISTANCE_WEIGHT;
            scored.add(new ScoredResult(candidate, score));
        }

        scored.sort(RANKING);
        return scored.stream().map(ScoredResult::result).toList();
    }

    private static final class ScoredResult {
        private final HotelSearchResult result;
        private final double score;

        private ScoredResult(HotelSearchResult result, double score) {
            this.result = result;
            this.score = score;
        }

        HotelSearchResult result() {
            return result;
        }

        double score() {
            return score;
        }
    }
}
