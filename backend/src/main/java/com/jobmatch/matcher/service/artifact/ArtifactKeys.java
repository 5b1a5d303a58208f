package com.jobmatch.matcher.service.artifact;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.jobmatch.matcher.service.ensemble.ClassifierFamily;

/**
 * Storage layout of an artifact bundle. Member names are shared by staging and canonical areas.
 * Canonical members live under a per-version directory; the canonical manifest names the live
 * version.
 */
public final class ArtifactKeys {

  static final String CANONICAL_ROOT = "clustering_results";
  static final String STAGING_ROOT = "temp/" + CANONICAL_ROOT;

  public static final String MANIFEST = "manifest.json";
  public static final String CENTROID_MODEL = "kmeans_model.json";
  public static final String CENTROIDS = "cluster_centers.bin";
  public static final String EMBEDDINGS = "paragraph_embeddings.bin";
  public static final String LABELS = "labels.bin";

  private static final DateTimeFormatter VERSION_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");

  private ArtifactKeys() {}

  public static String stagingPrefix(String platform, String region) {
    return STAGING_ROOT + "/" + platform + "/" + region + "/";
  }

  public static String canonicalPrefix(String platform, String region) {
    return CANONICAL_ROOT + "/" + platform + "/" + region + "/";
  }

  /** Directory holding the members of one published version. */
  public static String versionPrefix(String platform, String region, String version) {
    return canonicalPrefix(platform, region) + version + "/";
  }

  /** A fresh version id: UTC timestamp plus a random suffix so close runs never collide. */
  public static String newVersion() {
    return ZonedDateTime.now(ZoneOffset.UTC).format(VERSION_FORMAT)
        + "-"
        + UUID.randomUUID().toString().substring(0, 8);
  }

  public static String corpusTable(String platform, String region) {
    return platform + "_" + region + ".csv";
  }

  public static String classifier(String modelName) {
    return modelName + "_model.json";
  }

  /** Every member a complete bundle holds for the given roster, manifest last. */
  public static List<String> members(String platform, String region, List<String> roster) {
    List<String> members = new ArrayList<>();
    members.add(CENTROID_MODEL);
    members.add(CENTROIDS);
    members.add(EMBEDDINGS);
    members.add(LABELS);
    members.add(corpusTable(platform, region));
    roster.forEach(name -> members.add(classifier(name)));
    members.add(MANIFEST);
    return members;
  }

  /** Roster names in voting order. */
  public static List<String> defaultRoster() {
    List<String> roster = new ArrayList<>();
    for (ClassifierFamily family : ClassifierFamily.values()) {
      roster.add(family.getModelName());
    }
    return roster;
  }
}
