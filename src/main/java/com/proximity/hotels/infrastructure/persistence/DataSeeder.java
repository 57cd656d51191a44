package com.proximity.hotels.infrastructure.persistence;

import com.proximity.hotels.application.port.out.HotelRepository;
import com.proximity.hotels.domain.model.Hotel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Data seeder for local development.
 * Runs when app.seeding.enabled=true and fills an empty store with sample hotels.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedHotels(HotelRepository hotelRepository, Clock clock) {
        return args -> {
            long existing = hotelRepository.count();
            if (existing > 0) {
                logger.info("Hotel store already holds {} hotels, skipping seeding", existing);
                return;
            }

            logger.info("Seeding sample hotels...");

            hotelRepository.add(Hotel.create("Hotel Esplanade Zagreb", new BigDecimal("180.00"), 45.8055, 15.9770, clock));
            hotelRepository.add(Hotel.create("Hostel Downtown Zagreb", new BigDecimal("35.00"), 45.8128, 15.9750, clock));
            hotelRepository.add(Hotel.create("Hotel Sacher Wien", new BigDecimal("420.00"), 48.2039, 16.3694, clock));
            hotelRepository.add(Hotel.create("Le Meurice Paris", new BigDecimal("950.00"), 48.8651, 2.3281, clock));
            hotelRepository.add(Hotel.create("Budget Inn Paris", new BigDecimal("79.00"), 48.8566, 2.3522, clock));
            hotelRepository.add(Hotel.create("Hotel Arts Barcelona", new BigDecimal("310.00"), 41.3868, 2.1963, clock));

            logger.info("Seeding complete: {} hotels", hotelRepository.count());
        };
    }
}
