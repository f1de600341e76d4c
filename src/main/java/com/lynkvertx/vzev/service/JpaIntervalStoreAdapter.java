package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.entity.IntervalReading;
import com.lynkvertx.vzev.entity.Meter;
import com.lynkvertx.vzev.model.Reading;
import com.lynkvertx.vzev.model.ReadingQuality;
import com.lynkvertx.vzev.repository.IntervalReadingRepository;
import com.lynkvertx.vzev.repository.MeterRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Interval store backed by the interval_reading table. Returns VALID readings only.
 */
@Component
@RequiredArgsConstructor
public class JpaIntervalStoreAdapter implements IntervalStoreAdapter {

    private final MeterRepository meterRepository;
    private final IntervalReadingRepository readingRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Reading> readings(String meterExternalId, Instant start, Instant end) {
        Meter meter = meterRepository.findByExternalId(meterExternalId)
            .orElseThrow(() -> new EntityNotFoundException("Meter not found with external id: " + meterExternalId));

        return readingRepository
            .findByMeterIdAndQualityAndSlotStartGreaterThanEqualAndSlotStartLessThanOrderBySlotStartAsc(
                meter.getId(), ReadingQuality.VALID, start, end)
            .stream()
            .map(r -> toReading(meterExternalId, r))
            .collect(Collectors.toList());
    }

    private Reading toReading(String meterExternalId, IntervalReading entity) {
        return new Reading(meterExternalId, entity.getSlotStart(), entity.getEnergyKwh(), entity.getQuality());
    }
}
