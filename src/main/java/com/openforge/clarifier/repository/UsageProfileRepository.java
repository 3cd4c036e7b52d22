package com.openforge.clarifier.repository;

import com.openforge.clarifier.domain.UsageProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface UsageProfileRepository extends JpaRepository<UsageProfile, Long> {

    Optional<UsageProfile> findByUserId(String userId);

    /**
     * Single-statement "+1" executed by the database, so concurrent increments
     * for the same user cannot lose updates.
     *
     * @return number of rows touched: 0 when the user has no profile yet
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update UsageProfile p
               set p.usageCount = p.usageCount + 1
             where p.userId = :userId
            """)
    int incrementUsageCount(@Param("userId") String userId);
}
