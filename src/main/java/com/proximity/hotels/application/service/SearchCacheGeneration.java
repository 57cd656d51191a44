package com.proximity.hotels.application.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Version of the hotel store as seen by the search cache.
 *
 * Search keys embed the generation read before the store snapshot is taken, and every
 * mutation advances it after writing. A page computed from an older snapshot can only
 * land under an older key, which no later search asks for.
 */
@Component
public class SearchCacheGeneration {

    private final AtomicLong generation = new AtomicLong();

    public long current() {
        return generation.get();
    }

    public long advance() {
        return generation.incrementAndGet();
    }
}
