package com.jobmatch.matcher.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "matcher")
public class MatcherProperties {

  private List<String> platforms =
      new ArrayList<>(List.of("apec", "linkedin", "indeed", "jungle", "hellowork"));
  private List<String> regions = new ArrayList<>(List.of("france"));

  private Storage storage = new Storage();
  private Embedding embedding = new Embedding();
  private Clustering clustering = new Clustering();
  private Ensemble ensemble = new Ensemble();
  private Inference inference = new Inference();
  private Enrichment enrichment = new Enrichment();
  private Training training = new Training();
  private Users users = new Users();

  @Data
  public static class Storage {
    /** Either "s3" or "local". */
    private String type = "local";
    private String bucket;
    private String rootDirectory = "./data/object-store";
  }

  @Data
  public static class Embedding {
    private int batchSize = 512;
  }

  @Data
  public static class Clustering {
    private int maxClusters = 10;
    private int fallbackClusters = 3;
    private long randomSeed = 50L;
    private int restarts = 10;
    private int maxIterations = 300;
    private double tolerance = 1e-4;
  }

  @Data
  public static class Ensemble {
    private double holdoutFraction = 0.2;
    private long randomSeed = 50L;
    private int forestTrees = 100;
    private int boostingRounds = 50;
    private int neighbors = 5;
  }

  @Data
  public static class Inference {
    private int rankingCap = 20;
    private int displayCap = 20;
    private int fallbackSize = 10;
  }

  @Data
  public static class Enrichment {
    private int maxConcurrentCalls = 4;
    private long requestTimeoutSeconds = 300;
  }

  @Data
  public static class Training {
    private boolean autoPromote = true;
  }

  @Data
  public static class Users {
    private String storeFile = "./data/user-profiles.json";
  }
}
