package com.lendingengine.events;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the append-only event journal.
 */
@Repository
public interface LendingEventRepository extends JpaRepository<LendingEvent, String> {

    List<LendingEvent> findByAccountOrderByOccurredAtAsc(String account);

    List<LendingEvent> findByEventTypeOrderByOccurredAtAsc(LendingEventType eventType);
}
