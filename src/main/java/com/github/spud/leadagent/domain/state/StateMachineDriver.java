package com.github.spud.leadagent.domain.state;

import com.github.spud.leadagent.domain.kernel.RunState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - 编排器与 StateMachine 的适配层
 * <p>
 * 每次运行使用独立的状态机实例，事件被拒绝时直接抛出，由编排器顶层兜底。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final StateMachineFactory<PipelineState, PipelineEvent> stateMachineFactory;

  /**
   * 为一次运行创建并启动状态机
   */
  public StateMachine<PipelineState, PipelineEvent> start(String traceId) {
    StateMachine<PipelineState, PipelineEvent> sm = stateMachineFactory.getStateMachine(traceId);
    sm.startReactively().block();
    return sm;
  }

  /**
   * 获取当前状态
   */
  public PipelineState currentState(StateMachine<PipelineState, PipelineEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成，事件被拒绝时抛出 IllegalStateException
   */
  public PipelineState fire(StateMachine<PipelineState, PipelineEvent> sm, PipelineEvent event,
    RunState runState) {
    PipelineState from = currentState(sm);

    StateMachineEventResult<PipelineState, PipelineEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    if (result == null
      || result.getResultType() != StateMachineEventResult.ResultType.ACCEPTED) {
      log.warn("Event {} rejected in state {}: traceId={}", event, from, runState.getTraceId());
      throw new IllegalStateException("Event " + event + " rejected in state " + from);
    }

    PipelineState to = currentState(sm);
    log.debug("Transition {} --({})--> {}: traceId={}", from, event, to, runState.getTraceId());
    return to;
  }

  /**
   * 停止状态机
   */
  public void stop(StateMachine<PipelineState, PipelineEvent> sm) {
    sm.stopReactively().block();
  }

  /**
   * 判断是否处于终态
   */
  public boolean isFinished(StateMachine<PipelineState, PipelineEvent> sm) {
    return PipelineState.isFinal(currentState(sm));
  }
}
