package com.github.spud.leadagent.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * 流水线状态机配置
 * <pre>
 * 状态流转（无环）:
 *   INTAKE --(ACCEPTED)--> LOAD_CONTEXT
 *   LOAD_CONTEXT --(CONTEXT_LOADED)--> DECIDE
 *   DECIDE --(RETRIEVAL_REQUIRED)--> RETRIEVE
 *   DECIDE --(RETRIEVAL_SKIPPED)--> COMPOSE
 *   RETRIEVE --(EVIDENCE_READY)--> COMPOSE
 *   COMPOSE --(ESCALATION_REQUIRED)--> ESCALATE
 *   COMPOSE --(ACTIONS_PENDING)--> TOOLS
 *   COMPOSE --(RESPONSE_READY)--> MEMORY
 *   TOOLS --(ACTIONS_DONE)--> MEMORY
 *   ESCALATE --(HANDOFF_DONE)--> MEMORY
 *   MEMORY --(MEMORY_WRITTEN)--> FINALIZE
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class PipelineStateConfig extends
  EnumStateMachineConfigurerAdapter<PipelineState, PipelineEvent> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<PipelineState, PipelineEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<PipelineState, PipelineEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(PipelineState.INTAKE)
      .states(EnumSet.allOf(PipelineState.class))
      .end(PipelineState.FINALIZE);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<PipelineState, PipelineEvent> transitions)
    throws Exception {
    transitions
      .withExternal()
      .source(PipelineState.INTAKE).target(PipelineState.LOAD_CONTEXT)
      .event(PipelineEvent.ACCEPTED)
      .and()
      .withExternal()
      .source(PipelineState.LOAD_CONTEXT).target(PipelineState.DECIDE)
      .event(PipelineEvent.CONTEXT_LOADED)
      .and()

      // 分支一：是否检索
      .withExternal()
      .source(PipelineState.DECIDE).target(PipelineState.RETRIEVE)
      .event(PipelineEvent.RETRIEVAL_REQUIRED)
      .and()
      .withExternal()
      .source(PipelineState.DECIDE).target(PipelineState.COMPOSE)
      .event(PipelineEvent.RETRIEVAL_SKIPPED)
      .and()
      .withExternal()
      .source(PipelineState.RETRIEVE).target(PipelineState.COMPOSE)
      .event(PipelineEvent.EVIDENCE_READY)
      .and()

      // 分支二：转人工 / 执行动作 / 直接写入
      .withExternal()
      .source(PipelineState.COMPOSE).target(PipelineState.ESCALATE)
      .event(PipelineEvent.ESCALATION_REQUIRED)
      .and()
      .withExternal()
      .source(PipelineState.COMPOSE).target(PipelineState.TOOLS)
      .event(PipelineEvent.ACTIONS_PENDING)
      .and()
      .withExternal()
      .source(PipelineState.COMPOSE).target(PipelineState.MEMORY)
      .event(PipelineEvent.RESPONSE_READY)
      .and()

      // 汇合
      .withExternal()
      .source(PipelineState.TOOLS).target(PipelineState.MEMORY)
      .event(PipelineEvent.ACTIONS_DONE)
      .and()
      .withExternal()
      .source(PipelineState.ESCALATE).target(PipelineState.MEMORY)
      .event(PipelineEvent.HANDOFF_DONE)
      .and()
      .withExternal()
      .source(PipelineState.MEMORY).target(PipelineState.FINALIZE)
      .event(PipelineEvent.MEMORY_WRITTEN);
  }
}
