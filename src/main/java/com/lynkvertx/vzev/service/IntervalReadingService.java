package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.dto.IntervalReadingDTO;
import com.lynkvertx.vzev.entity.IntervalReading;
import com.lynkvertx.vzev.entity.Member;
import com.lynkvertx.vzev.entity.Meter;
import com.lynkvertx.vzev.exception.DuplicateReadingException;
import com.lynkvertx.vzev.exception.InvalidReadingException;
import com.lynkvertx.vzev.model.ReadingQuality;
import com.lynkvertx.vzev.repository.CollectiveRepository;
import com.lynkvertx.vzev.repository.IntervalReadingRepository;
import com.lynkvertx.vzev.repository.MemberRepository;
import com.lynkvertx.vzev.repository.MeterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Interval Reading Service
 * Stores normalized interval readings delivered by the CSV importer
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntervalReadingService {

    private final CollectiveRepository collectiveRepository;
    private final MemberRepository memberRepository;
    private final MeterRepository meterRepository;
    private final IntervalReadingRepository readingRepository;

    /**
     * Import a batch of readings for meters of one collective.
     * The batch is stored all-or-nothing.
     *
     * @throws EntityNotFoundException   if the collective or a meter is unknown
     * @throws DuplicateReadingException if a slot is delivered twice or already stored
     * @throws InvalidReadingException   if an energy value is negative or finer than the stored scale
     */
    @Transactional
    public IntervalReadingDTO.ImportResultDTO importReadings(Long collectiveId, IntervalReadingDTO.BatchDTO batch) {
        if (!collectiveRepository.existsById(collectiveId)) {
            throw new EntityNotFoundException("Collective not found with id: " + collectiveId);
        }
        Set<Long> memberIds = memberRepository.findByCollectiveIdOrderByIdAsc(collectiveId).stream()
            .map(Member::getId)
            .collect(Collectors.toSet());

        Map<String, Meter> meters = new HashMap<>();
        Set<String> seen = new HashSet<>();
        List<IntervalReading> entities = new ArrayList<>();
        int notValid = 0;

        for (IntervalReadingDTO dto : batch.getReadings()) {
            Meter meter = meters.computeIfAbsent(dto.getMeterExternalId(), id -> resolveMeter(id, memberIds));
            Instant slotStart = dto.getSlotStart().toInstant();

            if (dto.getEnergyKwh().signum() < 0) {
                throw new InvalidReadingException(String.format(
                    "Negative energy %s kWh for meter %s at %s", dto.getEnergyKwh(), meter.getExternalId(), slotStart));
            }
            if (dto.getEnergyKwh().stripTrailingZeros().scale() > IntervalReading.ENERGY_SCALE) {
                throw new InvalidReadingException(String.format(
                    "Energy %s kWh for meter %s at %s has more than %d decimal places",
                    dto.getEnergyKwh(), meter.getExternalId(), slotStart, IntervalReading.ENERGY_SCALE));
            }
            if (!seen.add(slotKey(meter.getId(), slotStart))) {
                throw new DuplicateReadingException(meter.getExternalId(), slotStart);
            }

            ReadingQuality quality = ReadingQuality.fromCode(dto.getQuality());
            if (quality != ReadingQuality.VALID) {
                notValid++;
            }
            entities.add(IntervalReading.builder()
                .meterId(meter.getId())
                .slotStart(slotStart)
                .energyKwh(dto.getEnergyKwh())
                .quality(quality)
                .build());
        }

        rejectStoredSlots(entities, meters.values());

        readingRepository.saveAll(entities);
        log.info("Imported {} reading(s) for collective {} ({} not valid for billing)",
            entities.size(), collectiveId, notValid);
        return IntervalReadingDTO.ImportResultDTO.builder()
            .imported(entities.size())
            .notValid(notValid)
            .build();
    }

    /**
     * One lookup for the whole batch: stored readings of the batch's meters within its time range.
     */
    private void rejectStoredSlots(List<IntervalReading> entities, Collection<Meter> meters) {
        if (entities.isEmpty()) {
            return;
        }
        Instant first = entities.stream().map(IntervalReading::getSlotStart).min(Comparator.naturalOrder()).get();
        Instant last = entities.stream().map(IntervalReading::getSlotStart).max(Comparator.naturalOrder()).get();
        Map<Long, String> externalIds = meters.stream()
            .collect(Collectors.toMap(Meter::getId, Meter::getExternalId));

        Set<String> stored = readingRepository.findByMeterIdInAndSlotStartBetween(externalIds.keySet(), first, last)
            .stream()
            .map(reading -> slotKey(reading.getMeterId(), reading.getSlotStart()))
            .collect(Collectors.toSet());
        for (IntervalReading entity : entities) {
            if (stored.contains(slotKey(entity.getMeterId(), entity.getSlotStart()))) {
                throw new DuplicateReadingException(externalIds.get(entity.getMeterId()), entity.getSlotStart());
            }
        }
    }

    private static String slotKey(Long meterId, Instant slotStart) {
        return meterId + "@" + slotStart;
    }

    private Meter resolveMeter(String externalId, Set<Long> memberIds) {
        Meter meter = meterRepository.findByExternalId(externalId)
            .orElseThrow(() -> new EntityNotFoundException("Meter not found with external id: " + externalId));
        if (!memberIds.contains(meter.getMemberId())) {
            throw new EntityNotFoundException("Meter " + externalId + " does not belong to this collective");
        }
        return meter;
    }
}
