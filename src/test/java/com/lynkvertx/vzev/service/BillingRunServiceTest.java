package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.dto.BillingRunResultDTO;
import com.lynkvertx.vzev.dto.CollectiveDTO;
import com.lynkvertx.vzev.dto.IntervalReadingDTO;
import com.lynkvertx.vzev.dto.MonthAvailabilityDTO;
import com.lynkvertx.vzev.exception.DuplicateReadingException;
import com.lynkvertx.vzev.exception.InvalidConfigurationException;
import com.lynkvertx.vzev.exception.InvalidReadingException;
import com.lynkvertx.vzev.exception.NonBillablePeriodException;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.model.BillingInterval;
import com.lynkvertx.vzev.model.FeeType;
import com.lynkvertx.vzev.model.Slot;
import com.lynkvertx.vzev.repository.IntervalReadingRepository;
import com.lynkvertx.vzev.repository.MeterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.lynkvertx.vzev.service.CollectiveFixture.ZURICH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@Transactional
class BillingRunServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 6, 1);
    private static final LocalDate END = LocalDate.of(2024, 6, 3);

    @Autowired
    private CollectiveService collectiveService;

    @Autowired
    private IntervalReadingService readingService;

    @Autowired
    private BillingRunService billingRunService;

    @Autowired
    private CalendarEngine calendar;

    @Autowired
    private MeterRepository meterRepository;

    @Autowired
    private IntervalReadingRepository readingRepository;

    private Long collectiveId;

    @BeforeEach
    void setUp() {
        collectiveId = collectiveService.createCollective(collectiveDTO()).getId();
    }

    @Test
    void createdCollectiveIsReadBackWithMembersAndMeters() {
        CollectiveDTO collective = collectiveService.getCollectiveById(collectiveId);

        assertThat(collective.getName()).isEqualTo("Sonnenweg");
        assertThat(collective.getMembers()).hasSize(2);
        assertThat(collective.getMembers().get(0).getMeters())
            .extracting(CollectiveDTO.MeterDTO::getExternalId)
            .containsExactly("H-C", "H-P", "V-C", "V-P");
        assertThat(collective.getMembers().get(1).getFees())
            .extracting(CollectiveDTO.FeeDTO::getName, CollectiveDTO.FeeDTO::getType)
            .containsExactly(tuple("Metering", FeeType.YEARLY));
    }

    @Test
    void reusedExternalIdIsRejected() {
        assertThatThrownBy(() -> collectiveService.createCollective(collectiveDTO()))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("H-C");
    }

    @Test
    void unknownZoneIsRejectedAtCreation() {
        CollectiveDTO dto = collectiveDTO();
        dto.setZoneId("Europe/Atlantis");

        assertThatThrownBy(() -> collectiveService.createCollective(dto))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("Europe/Atlantis");
    }

    @Test
    void hostWithoutVirtualMetersIsRejectedAtCreation() {
        CollectiveDTO dto = collectiveDTO();
        dto.getMembers().get(0).setMeters(List.of(meterDTO("X-C", false, false), meterDTO("X-VC", false, true)));
        dto.getMembers().get(1).setMeters(List.of(meterDTO("X-M", false, false)));

        assertThatThrownBy(() -> collectiveService.createCollective(dto))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("virtual");
        assertThat(meterRepository.existsByExternalId("X-C")).isFalse();
    }

    @Test
    void importedReadingsAreBilled() {
        IntervalReadingDTO.ImportResultDTO result = readingService.importReadings(collectiveId, scenarioBatch(true));

        assertThat(result.getImported()).isEqualTo(192 * 5);
        assertThat(result.getNotValid()).isZero();

        BillingRunResultDTO run = billingRunService.run(collectiveId);

        assertThat(run.getExcludedPeriods()).isEmpty();
        assertThat(run.getBills()).hasSize(2);
        Bill member = run.getBills().get(1);
        assertThat(member.getLastName()).isEqualTo("Muster");
        assertThat(member.getLocalCost()).isEqualByComparingTo("230.40");
        assertThat(member.getTotalFees()).isEqualByComparingTo("10.00");
        assertThat(member.getNetAmount()).isEqualByComparingTo("240.40");
        assertThat(run.getBills().get(0).getNetAmount()).isEqualByComparingTo("-230.40");
        assertThat(run.getExportRows()).hasSize(2);
        assertThat(run.getWarnings()).isEmpty();
    }

    @Test
    void incompleteDataIsReportedAndRefused() {
        readingService.importReadings(collectiveId, scenarioBatch(false));

        List<MonthAvailabilityDTO> months = billingRunService.monthOverview(collectiveId);
        assertThat(months).hasSize(1);
        assertThat(months.get(0).isBillable()).isFalse();
        assertThat(months.get(0).getMissing()).containsEntry("M-C", 192);

        BillingRunResultDTO run = billingRunService.run(collectiveId);
        assertThat(run.getBills()).isEmpty();
        assertThat(run.getExcludedPeriods()).extracting(BillingRunResultDTO.ExcludedPeriodDTO::getNonBillableMonths)
            .containsExactly(List.of("2024-06"));

        assertThatThrownBy(() -> billingRunService.billForPeriod(collectiveId, START, END))
            .isInstanceOf(NonBillablePeriodException.class);
    }

    @Test
    void substitutedReadingsAreStoredButNotBilled() {
        IntervalReadingDTO.BatchDTO batch = scenarioBatch(true);
        batch.getReadings().get(0).setQuality("V");

        IntervalReadingDTO.ImportResultDTO result = readingService.importReadings(collectiveId, batch);

        assertThat(result.getNotValid()).isEqualTo(1);
        assertThat(billingRunService.monthOverview(collectiveId).get(0).isBillable()).isFalse();
    }

    @Test
    void duplicateSlotRejectsTheWholeBatch() {
        IntervalReadingDTO.BatchDTO batch = scenarioBatch(true);
        batch.getReadings().add(batch.getReadings().get(5));

        assertThatThrownBy(() -> readingService.importReadings(collectiveId, batch))
            .isInstanceOf(DuplicateReadingException.class);

        Long meterId = meterRepository.findByExternalId("H-C").orElseThrow().getId();
        assertThat(readingRepository.countByMeterId(meterId)).isZero();
    }

    @Test
    void slotAlreadyStoredRejectsTheBatch() {
        readingService.importReadings(collectiveId, scenarioBatch(false));
        IntervalReadingDTO.BatchDTO again = new IntervalReadingDTO.BatchDTO(new ArrayList<>(List.of(
            reading("M-C", START.atStartOfDay(ZURICH).toOffsetDateTime(), "6"),
            reading("H-C", START.atStartOfDay(ZURICH).plusHours(1).toOffsetDateTime(), "4"))));

        assertThatThrownBy(() -> readingService.importReadings(collectiveId, again))
            .isInstanceOfSatisfying(DuplicateReadingException.class,
                ex -> assertThat(ex.getMessage()).contains("H-C"));

        Long memberMeterId = meterRepository.findByExternalId("M-C").orElseThrow().getId();
        assertThat(readingRepository.countByMeterId(memberMeterId)).isZero();
    }

    @Test
    void readingsOfAnotherMeterForStoredSlotsAreAccepted() {
        readingService.importReadings(collectiveId, scenarioBatch(false));
        List<IntervalReadingDTO> memberReadings = new ArrayList<>();
        addReadings(memberReadings, "M-C", calendar.expectedSlots(START, END, ZURICH), "6");

        IntervalReadingDTO.ImportResultDTO result =
            readingService.importReadings(collectiveId, new IntervalReadingDTO.BatchDTO(memberReadings));

        assertThat(result.getImported()).isEqualTo(192);
        assertThat(billingRunService.monthOverview(collectiveId).get(0).isBillable()).isTrue();
    }

    @Test
    void energyFinerThanStoredScaleIsRejected() {
        IntervalReadingDTO.BatchDTO batch = new IntervalReadingDTO.BatchDTO(new ArrayList<>(List.of(
            reading("H-C", START.atStartOfDay(ZURICH).toOffsetDateTime(), "0.1234567"))));

        assertThatThrownBy(() -> readingService.importReadings(collectiveId, batch))
            .isInstanceOf(InvalidReadingException.class)
            .hasMessageContaining("0.1234567");
    }

    @Test
    void trailingZerosBeyondStoredScaleAreAccepted() {
        IntervalReadingDTO.BatchDTO batch = new IntervalReadingDTO.BatchDTO(new ArrayList<>(List.of(
            reading("H-C", START.atStartOfDay(ZURICH).toOffsetDateTime(), "0.12345600"))));

        assertThat(readingService.importReadings(collectiveId, batch).getImported()).isEqualTo(1);
    }

    @Test
    void readingForForeignMeterIsNotFound() {
        IntervalReadingDTO.BatchDTO batch = new IntervalReadingDTO.BatchDTO(new ArrayList<>(List.of(
            IntervalReadingDTO.builder()
                .meterExternalId("UNKNOWN")
                .slotStart(START.atStartOfDay(ZURICH).toOffsetDateTime())
                .energyKwh(BigDecimal.ONE)
                .build())));

        assertThatThrownBy(() -> readingService.importReadings(collectiveId, batch))
            .isInstanceOf(EntityNotFoundException.class);
    }

    private IntervalReadingDTO.BatchDTO scenarioBatch(boolean withMemberMeter) {
        List<Slot> slots = calendar.expectedSlots(START, END, ZURICH);
        List<IntervalReadingDTO> readings = new ArrayList<>();
        addReadings(readings, "H-C", slots, "4");
        addReadings(readings, "H-P", slots, "10");
        addReadings(readings, "V-C", slots, "0");
        addReadings(readings, "V-P", slots, "0");
        if (withMemberMeter) {
            addReadings(readings, "M-C", slots, "6");
        }
        return new IntervalReadingDTO.BatchDTO(readings);
    }

    private static IntervalReadingDTO reading(String meter, OffsetDateTime slotStart, String kwh) {
        return IntervalReadingDTO.builder()
            .meterExternalId(meter)
            .slotStart(slotStart)
            .energyKwh(new BigDecimal(kwh))
            .quality("W")
            .build();
    }

    private static void addReadings(List<IntervalReadingDTO> readings, String meter, List<Slot> slots, String kwh) {
        for (Slot slot : slots) {
            readings.add(IntervalReadingDTO.builder()
                .meterExternalId(meter)
                .slotStart(slot.getStart().atOffset(ZoneOffset.UTC))
                .energyKwh(new BigDecimal(kwh))
                .quality("W")
                .build());
        }
    }

    private static CollectiveDTO collectiveDTO() {
        return CollectiveDTO.builder()
            .name("Sonnenweg")
            .zoneId("Europe/Zurich")
            .currency("CHF")
            .localRate(new BigDecimal("0.20"))
            .bkwBuyRate(new BigDecimal("0.30"))
            .bkwSellRate(new BigDecimal("0.10"))
            .billingInterval(BillingInterval.MONTHLY)
            .periodStart(START)
            .periodEnd(END)
            .members(List.of(
                CollectiveDTO.MemberDTO.builder()
                    .firstName("Hanna").lastName("Host").street("Sonnenweg 1").zip("3000").city("Bern").host(true)
                    .meters(List.of(
                        meterDTO("H-C", false, false),
                        meterDTO("H-P", true, false),
                        meterDTO("V-C", false, true),
                        meterDTO("V-P", true, true)))
                    .build(),
                CollectiveDTO.MemberDTO.builder()
                    .firstName("Max").lastName("Muster").street("Sonnenweg 3").zip("3000").city("Bern")
                    .meters(List.of(meterDTO("M-C", false, false)))
                    .fees(List.of(CollectiveDTO.FeeDTO.builder()
                        .name("Metering")
                        .type(FeeType.YEARLY)
                        .value(new BigDecimal("120"))
                        .build()))
                    .build()))
            .build();
    }

    private static CollectiveDTO.MeterDTO meterDTO(String externalId, boolean production, boolean virtual) {
        return CollectiveDTO.MeterDTO.builder()
            .externalId(externalId)
            .name(externalId)
            .production(production)
            .virtual(virtual)
            .build();
    }
}
