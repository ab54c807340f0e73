package com.github.spud.leadagent.infrastructure.persistence.repository;

import com.github.spud.leadagent.infrastructure.persistence.entity.Interaction;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InteractionRepository extends JpaRepository<Interaction, Long> {

  /**
   * 最近的交互记录（倒序）
   */
  List<Interaction> findByLeadIdOrderByCreatedAtDescIdDesc(UUID leadId, Limit limit);

}
