package com.lynkvertx.vzev.repository;

import com.lynkvertx.vzev.entity.MemberFee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Member Fee Repository
 */
@Repository
public interface MemberFeeRepository extends JpaRepository<MemberFee, Long> {

    /**
     * Fee lines of the given members in application order
     */
    List<MemberFee> findByMemberIdInOrderByMemberIdAscPositionAsc(Collection<Long> memberIds);
}
