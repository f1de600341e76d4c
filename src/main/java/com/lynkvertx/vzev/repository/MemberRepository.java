package com.lynkvertx.vzev.repository;

import com.lynkvertx.vzev.entity.Member;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Member Repository
 */
@Repository
public interface MemberRepository extends JpaRepository<Member, Long> {

    List<Member> findByCollectiveIdOrderByIdAsc(Long collectiveId);
}
