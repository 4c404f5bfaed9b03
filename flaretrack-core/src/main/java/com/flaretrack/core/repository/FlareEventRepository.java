package com.flaretrack.core.repository;

import com.flaretrack.core.domain.FlareEvent;
import org.springframework.data.repository.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the flare event log.
 * Append-only: no update or delete operations are exposed.
 */
@org.springframework.stereotype.Repository
public interface FlareEventRepository extends Repository<FlareEvent, UUID> {

    FlareEvent save(FlareEvent event);

    /**
     * Log of one flare in append order, scoped by owner.
     */
    List<FlareEvent> findByFlareIdAndUserIdOrderBySequenceNumberAsc(UUID flareId, String userId);

    /**
     * Logs of several flares of the same user, for analytics scans.
     */
    List<FlareEvent> findByUserIdAndFlareIdIn(String userId, Collection<UUID> flareIds);

    long countByFlareId(UUID flareId);
}
