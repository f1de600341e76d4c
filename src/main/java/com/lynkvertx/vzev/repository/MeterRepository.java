package com.lynkvertx.vzev.repository;

import com.lynkvertx.vzev.entity.Meter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Meter Repository
 */
@Repository
public interface MeterRepository extends JpaRepository<Meter, Long> {

    Optional<Meter> findByExternalId(String externalId);

    /**
     * All meters of the given members, ordered by external id
     */
    List<Meter> findByMemberIdInOrderByExternalIdAsc(Collection<Long> memberIds);

    boolean existsByExternalId(String externalId);
}
