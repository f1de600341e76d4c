package com.lynkvertx.vzev.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Engine view of a collective member and the meters it owns.
 * Host and producer are roles on the same type: any member owning a physical
 * production meter is a producer.
 */
@Value
@Builder(toBuilder = true)
public class MemberInfo {

    Long id;
    String firstName;
    String lastName;
    String street;
    String zip;
    String city;
    String canton;
    boolean host;
    @Singular
    List<MeterInfo> meters;
    /** Custom fee lines in application order */
    @Singular
    List<CustomFee> fees;

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public boolean isProducer() {
        return meters.stream().anyMatch(MeterInfo::isPhysicalProduction);
    }
}
