package com.flaretrack.core.repository;

import com.flaretrack.core.domain.Flare;
import com.flaretrack.core.domain.Flare.FlareStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for flare snapshots.
 * Every lookup is scoped by owning user.
 */
@Repository
public interface FlareRepository extends JpaRepository<Flare, UUID> {

    /**
     * Find a flare only if it belongs to the given user.
     */
    Optional<Flare> findByIdAndUserId(UUID id, String userId);

    List<Flare> findByUserIdOrderByStartDateDesc(String userId);

    /**
     * Flares whose status differs from the given one; with RESOLVED, the open flares.
     */
    List<Flare> findByUserIdAndStatusNotOrderByStartDateDesc(String userId, FlareStatus status);

    List<Flare> findByUserIdAndStatusOrderByEndDateDesc(String userId, FlareStatus status);

    List<Flare> findByUserIdAndBodyRegionIdOrderByStartDateDesc(String userId, String bodyRegionId);

    /**
     * Flares that started inside [since, until].
     */
    @Query("SELECT f FROM Flare f WHERE f.userId = :userId AND f.startDate >= :since AND f.startDate <= :until ORDER BY f.startDate DESC")
    List<Flare> findStartedBetween(
            @Param("userId") String userId,
            @Param("since") Instant since,
            @Param("until") Instant until);
}
