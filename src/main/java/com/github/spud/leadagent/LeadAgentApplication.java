package com.github.spud.leadagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadAgentApplication.class, args);
  }

}
