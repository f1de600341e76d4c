package com.lynkvertx.vzev.repository;

import com.lynkvertx.vzev.entity.IntervalReading;
import com.lynkvertx.vzev.model.ReadingQuality;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Interval Reading Repository
 */
@Repository
public interface IntervalReadingRepository extends JpaRepository<IntervalReading, Long> {

    /**
     * Readings of one meter with the given quality in [start, end), ascending
     */
    List<IntervalReading> findByMeterIdAndQualityAndSlotStartGreaterThanEqualAndSlotStartLessThanOrderBySlotStartAsc(
        Long meterId, ReadingQuality quality, Instant start, Instant end);

    /**
     * Stored readings of the given meters with a slot start in [start, end]
     */
    List<IntervalReading> findByMeterIdInAndSlotStartBetween(Collection<Long> meterIds, Instant start, Instant end);

    long countByMeterId(Long meterId);
}
