package com.flamingo.ai.redteam.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for parsing, detection and batch analysis. */
@Configuration
@ConfigurationProperties(prefix = "redteam")
@Getter
@Setter
public class RedTeamConfig {

  private Parsing parsing = new Parsing();
  private Detection detection = new Detection();
  private Analysis analysis = new Analysis();

  @Getter
  @Setter
  public static class Parsing {
    /** Substring the root's namespace declaration must contain to pass validation. */
    private String expectedNamespace = "xml.house.gov/schemas/uslm";
  }

  @Getter
  @Setter
  public static class Detection {
    /**
     * Keep only the first circular finding per distinct node set. Off by default, so every cycle
     * path the traversal closes is reported.
     */
    private boolean deduplicateCycles = false;
  }

  @Getter
  @Setter
  public static class Analysis {
    private int parserThreads = 4;
    private int queueCapacity = 100;
  }
}
