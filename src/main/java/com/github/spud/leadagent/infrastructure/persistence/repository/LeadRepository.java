package com.github.spud.leadagent.infrastructure.persistence.repository;

import com.github.spud.leadagent.domain.memory.LeadStatus;
import com.github.spud.leadagent.infrastructure.persistence.entity.Lead;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadRepository extends JpaRepository<Lead, UUID> {

  Optional<Lead> findByEmail(String email);

  @Query("""
    SELECT l FROM Lead l
     WHERE l.nextFollowupAt <= :now
       AND l.status IN :statuses
     ORDER BY l.nextFollowupAt
    """)
  List<Lead> findDueForFollowup(@Param("now") OffsetDateTime now,
    @Param("statuses") Collection<LeadStatus> statuses, Pageable pageable);

}
