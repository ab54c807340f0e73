package com.github.spud.leadagent.domain.kernel;

import java.util.Map;

/**
 * 入站线索消息
 */
public record InboundLead(String email, String name, String message, String source,
                          Map<String, Object> metadata) {

}
