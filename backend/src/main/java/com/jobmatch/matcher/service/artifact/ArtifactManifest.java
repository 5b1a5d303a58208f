package com.jobmatch.matcher.service.artifact;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Index of a bundle: what it holds and how the roster scored. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactManifest {

  private String platform;
  private String region;

  /** Canonical directory the members are promoted into. */
  private String version;
  private int clusterCount;
  private int dimension;
  private int postingCount;
  private List<String> roster;
  private Map<String, Double> modelScores;
  private String bestModel;
  private List<String> members;
  private Instant createdAt;
}
