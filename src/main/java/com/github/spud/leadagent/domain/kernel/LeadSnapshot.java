package com.github.spud.leadagent.domain.kernel;

/**
 * 线索快照，运行期间只读
 */
public record LeadSnapshot(String id, String email, String name, String company,
                           String status) {

}
