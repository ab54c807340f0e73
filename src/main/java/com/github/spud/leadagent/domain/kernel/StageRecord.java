package com.github.spud.leadagent.domain.kernel;

import com.github.spud.leadagent.domain.state.PipelineState;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * 单个阶段的执行记录，用于追踪
 */
@Data
@Builder
public class StageRecord {

  private PipelineState state;
  private String event;
  private String summary;
  private long durationMs;
  private String error;
  private Instant timestamp;
}
