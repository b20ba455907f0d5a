package com.flamingo.ai.notevault.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the embedding pipeline and semantic search. */
@Configuration
@ConfigurationProperties(prefix = "vault")
@Getter
@Setter
public class VaultConfig {

  private Embedding embedding = new Embedding();
  private Queue queue = new Queue();
  private Retry retry = new Retry();
  private Search search = new Search();

  @Getter
  @Setter
  public static class Embedding {
    private String modelName = "text-embedding-3-small";

    /** Length every stored and query vector must have. */
    private int dimensions = 384;

    private int timeoutSeconds = 30;
  }

  @Getter
  @Setter
  public static class Queue {
    /** Upper bound on embedding jobs in flight at once. */
    private int maxConcurrent = 5;

    /** How long shutdown waits for in-flight jobs before giving up. */
    private long shutdownTimeoutMs = 10_000;
  }

  @Getter
  @Setter
  public static class Retry {
    /** Total attempts per job, including the first one. */
    private int maxAttempts = 4;

    /** Delay before the first retry; doubles (by {@link #multiplier}) for each further retry. */
    private long initialBackoffMs = 1000;

    private double multiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 10;

    /** Requests asking for more results are capped here. */
    private int maxLimit = 50;

    private double defaultThreshold = 0.7;
  }
}
