package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.dto.CollectiveDTO;
import com.lynkvertx.vzev.entity.Collective;
import com.lynkvertx.vzev.entity.Member;
import com.lynkvertx.vzev.entity.MemberFee;
import com.lynkvertx.vzev.entity.Meter;
import com.lynkvertx.vzev.exception.InvalidConfigurationException;
import com.lynkvertx.vzev.exception.InvalidRangeException;
import com.lynkvertx.vzev.model.FeeType;
import com.lynkvertx.vzev.repository.CollectiveRepository;
import com.lynkvertx.vzev.repository.MemberFeeRepository;
import com.lynkvertx.vzev.repository.MemberRepository;
import com.lynkvertx.vzev.repository.MeterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collective Service
 * Handles creation and lookup of collectives with their members and meters
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectiveService {

    private final CollectiveRepository collectiveRepository;
    private final MemberRepository memberRepository;
    private final MeterRepository meterRepository;
    private final MemberFeeRepository feeRepository;
    private final CollectiveConfigurationService configurationService;

    /**
     * Get collective by ID, including members and meters
     */
    @Transactional(readOnly = true)
    public CollectiveDTO getCollectiveById(Long id) {
        Collective collective = collectiveRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Collective not found with id: " + id));

        List<Member> members = memberRepository.findByCollectiveIdOrderByIdAsc(id);
        List<Long> memberIds = members.stream().map(Member::getId).collect(Collectors.toList());
        Map<Long, List<Meter>> metersByMember = members.isEmpty()
            ? Collections.emptyMap()
            : meterRepository.findByMemberIdInOrderByExternalIdAsc(memberIds).stream()
                .collect(Collectors.groupingBy(Meter::getMemberId));
        Map<Long, List<MemberFee>> feesByMember = members.isEmpty()
            ? Collections.emptyMap()
            : feeRepository.findByMemberIdInOrderByMemberIdAscPositionAsc(memberIds).stream()
                .collect(Collectors.groupingBy(MemberFee::getMemberId));

        List<CollectiveDTO.MemberDTO> memberDTOs = members.stream()
            .map(m -> toMemberDTO(m,
                metersByMember.getOrDefault(m.getId(), Collections.emptyList()),
                feesByMember.getOrDefault(m.getId(), Collections.emptyList())))
            .collect(Collectors.toList());

        return toDTO(collective, memberDTOs);
    }

    /**
     * Create a new collective together with its members, meters and fee lines.
     * The configuration is checked the same way a billing run checks it.
     *
     * @throws InvalidRangeException         if the period is empty or reversed
     * @throws InvalidConfigurationException if the zone or host setup is invalid or an external id is taken
     */
    @Transactional
    public CollectiveDTO createCollective(CollectiveDTO dto) {
        configurationService.validateDraft(dto);
        requireUniqueExternalIds(dto);

        Collective saved = collectiveRepository.save(toEntity(dto));

        List<CollectiveDTO.MemberDTO> memberDTOs = new ArrayList<>();
        for (CollectiveDTO.MemberDTO memberDTO : dto.getMembers()) {
            Member member = memberRepository.save(toMemberEntity(saved.getId(), memberDTO));
            List<Meter> meters = new ArrayList<>();
            for (CollectiveDTO.MeterDTO meterDTO : nullToEmpty(memberDTO.getMeters())) {
                meters.add(meterRepository.save(toMeterEntity(member.getId(), meterDTO)));
            }
            List<MemberFee> fees = new ArrayList<>();
            List<CollectiveDTO.FeeDTO> feeDTOs = nullToEmpty(memberDTO.getFees());
            for (int i = 0; i < feeDTOs.size(); i++) {
                fees.add(feeRepository.save(toFeeEntity(member.getId(), i, feeDTOs.get(i))));
            }
            memberDTOs.add(toMemberDTO(member, meters, fees));
        }

        log.info("Created collective '{}' with id: {} ({} member(s))",
            saved.getName(), saved.getId(), memberDTOs.size());
        return toDTO(saved, memberDTOs);
    }

    private void requireUniqueExternalIds(CollectiveDTO dto) {
        Set<String> seen = new HashSet<>();
        for (CollectiveDTO.MemberDTO member : dto.getMembers()) {
            for (CollectiveDTO.MeterDTO meter : nullToEmpty(member.getMeters())) {
                if (!seen.add(meter.getExternalId()) || meterRepository.existsByExternalId(meter.getExternalId())) {
                    throw new InvalidConfigurationException("Meter external id already in use: " + meter.getExternalId());
                }
            }
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Convert entity to DTO
     */
    private CollectiveDTO toDTO(Collective entity, List<CollectiveDTO.MemberDTO> members) {
        return CollectiveDTO.builder()
            .id(entity.getId())
            .name(entity.getName())
            .zoneId(entity.getZoneId())
            .currency(entity.getCurrency())
            .localRate(entity.getLocalRate())
            .bkwBuyRate(entity.getBkwBuyRate())
            .bkwSellRate(entity.getBkwSellRate())
            .billingInterval(entity.getBillingInterval())
            .periodStart(entity.getPeriodStart())
            .periodEnd(entity.getPeriodEnd())
            .showDailyDetail(entity.isShowDailyDetail())
            .members(members)
            .build();
    }

    private CollectiveDTO.MemberDTO toMemberDTO(Member entity, List<Meter> meters, List<MemberFee> fees) {
        return CollectiveDTO.MemberDTO.builder()
            .id(entity.getId())
            .firstName(entity.getFirstName())
            .lastName(entity.getLastName())
            .street(entity.getStreet())
            .zip(entity.getZip())
            .city(entity.getCity())
            .canton(entity.getCanton())
            .host(entity.isHost())
            .meters(meters.stream().map(this::toMeterDTO).collect(Collectors.toList()))
            .fees(fees.stream().map(this::toFeeDTO).collect(Collectors.toList()))
            .build();
    }

    private CollectiveDTO.FeeDTO toFeeDTO(MemberFee entity) {
        return CollectiveDTO.FeeDTO.builder()
            .name(entity.getName())
            .type(entity.getFeeType())
            .value(entity.getValue())
            .basis(entity.getBasis())
            .build();
    }

    private CollectiveDTO.MeterDTO toMeterDTO(Meter entity) {
        return CollectiveDTO.MeterDTO.builder()
            .id(entity.getId())
            .externalId(entity.getExternalId())
            .name(entity.getName())
            .production(entity.isProduction())
            .virtual(entity.isVirtual())
            .build();
    }

    /**
     * Convert DTO to entity
     */
    private Collective toEntity(CollectiveDTO dto) {
        return Collective.builder()
            .name(dto.getName())
            .zoneId(dto.getZoneId())
            .currency(dto.getCurrency())
            .localRate(dto.getLocalRate())
            .bkwBuyRate(dto.getBkwBuyRate())
            .bkwSellRate(dto.getBkwSellRate())
            .billingInterval(dto.getBillingInterval())
            .periodStart(dto.getPeriodStart())
            .periodEnd(dto.getPeriodEnd())
            .showDailyDetail(dto.isShowDailyDetail())
            .build();
    }

    private Member toMemberEntity(Long collectiveId, CollectiveDTO.MemberDTO dto) {
        return Member.builder()
            .collectiveId(collectiveId)
            .firstName(dto.getFirstName())
            .lastName(dto.getLastName())
            .street(dto.getStreet())
            .zip(dto.getZip())
            .city(dto.getCity())
            .canton(dto.getCanton())
            .host(dto.isHost())
            .build();
    }

    private Meter toMeterEntity(Long memberId, CollectiveDTO.MeterDTO dto) {
        return Meter.builder()
            .memberId(memberId)
            .externalId(dto.getExternalId())
            .name(dto.getName())
            .production(dto.isProduction())
            .virtual(dto.isVirtual())
            .build();
    }

    private MemberFee toFeeEntity(Long memberId, int position, CollectiveDTO.FeeDTO dto) {
        return MemberFee.builder()
            .memberId(memberId)
            .position(position)
            .name(dto.getName())
            .feeType(dto.getType())
            .value(dto.getValue())
            .basis(dto.getType() == FeeType.PER_KWH ? dto.getBasis() : null)
            .build();
    }
}
