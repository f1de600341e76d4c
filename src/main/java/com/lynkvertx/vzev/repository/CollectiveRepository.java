package com.lynkvertx.vzev.repository;

import com.lynkvertx.vzev.entity.Collective;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Collective Repository
 */
@Repository
public interface CollectiveRepository extends JpaRepository<Collective, Long> {
}
