package com.github.spud.leadagent.infrastructure.persistence.repository;

import com.github.spud.leadagent.infrastructure.persistence.entity.EscalationEvent;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EscalationEventRepository extends JpaRepository<EscalationEvent, UUID> {
}
