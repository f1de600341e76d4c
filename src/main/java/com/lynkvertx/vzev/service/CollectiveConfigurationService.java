package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.config.BillingEngineConfig;
import com.lynkvertx.vzev.dto.CollectiveDTO;
import com.lynkvertx.vzev.entity.Collective;
import com.lynkvertx.vzev.entity.Member;
import com.lynkvertx.vzev.entity.MemberFee;
import com.lynkvertx.vzev.entity.Meter;
import com.lynkvertx.vzev.exception.InvalidConfigurationException;
import com.lynkvertx.vzev.exception.InvalidRangeException;
import com.lynkvertx.vzev.model.CollectiveGraph;
import com.lynkvertx.vzev.model.CollectiveSettings;
import com.lynkvertx.vzev.model.CustomFee;
import com.lynkvertx.vzev.model.MemberInfo;
import com.lynkvertx.vzev.model.MeterInfo;
import com.lynkvertx.vzev.repository.CollectiveRepository;
import com.lynkvertx.vzev.repository.MemberFeeRepository;
import com.lynkvertx.vzev.repository.MemberRepository;
import com.lynkvertx.vzev.repository.MeterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collective Configuration Service
 *
 * Loads a collective from the database into immutable {@link CollectiveSettings} and
 * {@link MemberInfo} values and rejects configurations the engine cannot bill.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectiveConfigurationService {

    private final CollectiveRepository collectiveRepository;
    private final MemberRepository memberRepository;
    private final MeterRepository meterRepository;
    private final MemberFeeRepository feeRepository;
    private final BillingEngineConfig config;

    /**
     * Load and validate a collective.
     *
     * @throws EntityNotFoundException       if the collective does not exist
     * @throws InvalidConfigurationException if rates, interval or the host setup are missing
     * @throws InvalidRangeException         if the period bounds are missing or reversed
     */
    @Transactional(readOnly = true)
    public CollectiveGraph load(Long collectiveId) {
        Collective collective = collectiveRepository.findById(collectiveId)
            .orElseThrow(() -> new EntityNotFoundException("Collective not found with id: " + collectiveId));

        List<Member> members = memberRepository.findByCollectiveIdOrderByIdAsc(collectiveId);
        List<Long> memberIds = members.stream().map(Member::getId).collect(Collectors.toList());
        List<Meter> meters = members.isEmpty()
            ? List.of()
            : meterRepository.findByMemberIdInOrderByExternalIdAsc(memberIds);
        List<MemberFee> fees = members.isEmpty()
            ? List.of()
            : feeRepository.findByMemberIdInOrderByMemberIdAscPositionAsc(memberIds);

        Map<Long, List<MeterInfo>> metersByMember = meters.stream()
            .map(this::toMeterInfo)
            .collect(Collectors.groupingBy(MeterInfo::getMemberId));
        Map<Long, List<CustomFee>> feesByMember = fees.stream()
            .collect(Collectors.groupingBy(MemberFee::getMemberId,
                Collectors.mapping(this::toCustomFee, Collectors.toList())));

        List<MemberInfo> memberInfos = members.stream()
            .map(m -> toMemberInfo(m, metersByMember.getOrDefault(m.getId(), List.of()),
                feesByMember.getOrDefault(m.getId(), List.of())))
            .collect(Collectors.toList());

        CollectiveSettings settings = toSettings(collective);
        validate(settings, memberInfos);

        log.info("Configuration loaded: collective '{}', {} member(s), {} meter(s)",
            settings.getName(), memberInfos.size(), meters.size());
        return new CollectiveGraph(settings, memberInfos);
    }

    /**
     * Run the load-time checks on a collective that is about to be created, so that
     * configuration errors surface before any reading is imported.
     *
     * @throws InvalidConfigurationException if the zone, rates, interval or the host setup are invalid
     * @throws InvalidRangeException         if the period bounds are missing or reversed
     */
    void validateDraft(CollectiveDTO dto) {
        CollectiveSettings settings = CollectiveSettings.builder()
            .name(dto.getName())
            .zone(resolveZone(dto.getZoneId()))
            .localRate(dto.getLocalRate())
            .bkwBuyRate(dto.getBkwBuyRate())
            .bkwSellRate(dto.getBkwSellRate())
            .billingInterval(dto.getBillingInterval())
            .periodStart(dto.getPeriodStart())
            .periodEnd(dto.getPeriodEnd())
            .showDailyDetail(dto.isShowDailyDetail())
            .currency(dto.getCurrency() != null ? dto.getCurrency() : config.getDefaultCurrency())
            .build();

        List<MemberInfo> members = dto.getMembers().stream()
            .map(this::toMemberInfo)
            .collect(Collectors.toList());
        validate(settings, members);
    }

    /**
     * Reject configurations that cannot be billed; warn about suspicious ones.
     */
    void validate(CollectiveSettings settings, List<MemberInfo> members) {
        if (settings.getPeriodStart() == null || settings.getPeriodEnd() == null
            || !settings.getPeriodStart().isBefore(settings.getPeriodEnd())) {
            throw new InvalidRangeException(settings.getPeriodStart(), settings.getPeriodEnd());
        }
        if (settings.getBillingInterval() == null) {
            throw new InvalidConfigurationException("Billing interval is required");
        }
        requireRate("local_rate", settings.getLocalRate());
        requireRate("bkw_buy_rate", settings.getBkwBuyRate());
        requireRate("bkw_sell_rate", settings.getBkwSellRate());

        Set<String> externalIds = new HashSet<>();
        for (MemberInfo member : members) {
            for (MeterInfo meter : member.getMeters()) {
                if (!externalIds.add(meter.getExternalId())) {
                    throw new InvalidConfigurationException("Meter external id used twice: " + meter.getExternalId());
                }
            }
        }

        boolean hostWithVirtualMeters = members.stream()
            .filter(MemberInfo::isHost)
            .anyMatch(this::hasBothVirtualMeters);
        if (!hostWithVirtualMeters) {
            throw new InvalidConfigurationException(
                "No host member with both a virtual consumption and a virtual production meter");
        }

        if (settings.getLocalRate().signum() == 0) {
            log.warn("Collective local_rate is 0, local solar costs and revenue will be zero");
        }
        if (settings.getBkwBuyRate().signum() == 0) {
            log.warn("Collective bkw_buy_rate is 0, grid costs will be zero");
        }
    }

    private boolean hasBothVirtualMeters(MemberInfo member) {
        boolean consumption = member.getMeters().stream().anyMatch(m -> m.isVirtual() && !m.isProduction());
        boolean production = member.getMeters().stream().anyMatch(m -> m.isVirtual() && m.isProduction());
        return consumption && production;
    }

    private void requireRate(String name, BigDecimal rate) {
        if (rate == null) {
            throw new InvalidConfigurationException("Rate " + name + " is required");
        }
        if (rate.signum() < 0) {
            throw new InvalidConfigurationException("Rate " + name + " must not be negative: " + rate);
        }
    }

    private CollectiveSettings toSettings(Collective entity) {
        return CollectiveSettings.builder()
            .collectiveId(entity.getId())
            .name(entity.getName())
            .zone(resolveZone(entity.getZoneId()))
            .localRate(entity.getLocalRate())
            .bkwBuyRate(entity.getBkwBuyRate())
            .bkwSellRate(entity.getBkwSellRate())
            .billingInterval(entity.getBillingInterval())
            .periodStart(entity.getPeriodStart())
            .periodEnd(entity.getPeriodEnd())
            .showDailyDetail(entity.isShowDailyDetail())
            .currency(entity.getCurrency() != null ? entity.getCurrency() : config.getDefaultCurrency())
            .build();
    }

    private ZoneId resolveZone(String zoneId) {
        String id = zoneId == null || zoneId.isBlank() ? config.getDefaultZoneId() : zoneId;
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("Unknown time zone: " + id);
        }
    }

    private MeterInfo toMeterInfo(Meter entity) {
        return MeterInfo.builder()
            .externalId(entity.getExternalId())
            .name(entity.getName())
            .memberId(entity.getMemberId())
            .production(entity.isProduction())
            .virtual(entity.isVirtual())
            .build();
    }

    private CustomFee toCustomFee(MemberFee entity) {
        return CustomFee.builder()
            .name(entity.getName())
            .type(entity.getFeeType())
            .value(entity.getValue())
            .basis(entity.getBasis())
            .build();
    }

    private MemberInfo toMemberInfo(CollectiveDTO.MemberDTO dto) {
        List<MeterInfo> meters = dto.getMeters() == null ? List.of() : dto.getMeters().stream()
            .map(meter -> MeterInfo.builder()
                .externalId(meter.getExternalId())
                .name(meter.getName())
                .production(meter.isProduction())
                .virtual(meter.isVirtual())
                .build())
            .collect(Collectors.toList());
        List<CustomFee> fees = dto.getFees() == null ? List.of() : dto.getFees().stream()
            .map(fee -> CustomFee.builder()
                .name(fee.getName())
                .type(fee.getType())
                .value(fee.getValue())
                .basis(fee.getBasis())
                .build())
            .collect(Collectors.toList());
        return MemberInfo.builder()
            .firstName(dto.getFirstName())
            .lastName(dto.getLastName())
            .host(dto.isHost())
            .meters(meters)
            .fees(fees)
            .build();
    }

    private MemberInfo toMemberInfo(Member entity, List<MeterInfo> meters, List<CustomFee> fees) {
        return MemberInfo.builder()
            .id(entity.getId())
            .firstName(entity.getFirstName())
            .lastName(entity.getLastName())
            .street(entity.getStreet())
            .zip(entity.getZip())
            .city(entity.getCity())
            .canton(entity.getCanton())
            .host(entity.isHost())
            .meters(meters)
            .fees(fees)
            .build();
    }
}
