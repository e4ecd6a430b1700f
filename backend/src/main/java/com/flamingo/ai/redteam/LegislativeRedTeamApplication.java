package com.flamingo.ai.redteam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the legislative red team service. */
@SpringBootApplication
public class LegislativeRedTeamApplication {

  public static void main(String[] args) {
    SpringApplication.run(LegislativeRedTeamApplication.class, args);
  }
}
