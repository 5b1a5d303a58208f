package com.jobmatch.matcher.service.artifact;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.exception.ArtifactNotFoundException;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.service.clustering.CentroidModel;
import com.jobmatch.matcher.service.corpus.CorpusCsvCodec;
import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;
import com.jobmatch.matcher.service.ensemble.ClusterClassifier;
import com.jobmatch.matcher.service.ensemble.ScoredClassifier;
import com.jobmatch.matcher.service.storage.ObjectStorage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists artifact bundles. Training writes to the staging area, {@link #promote} moves a staged
 * bundle to the canonical area, and inference only ever {@link #load}s canonical bundles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactStore {

  private final ObjectStorage objectStorage;
  private final ObjectMapper objectMapper;
  private final CorpusCsvCodec corpusCsvCodec;

  /**
   * Writes every bundle member under the staging prefix, replacing whatever was staged before. The
   * manifest is written last. Not atomic across members.
   *
   * @return the staged keys
   */
  public List<String> stage(ArtifactBundle bundle) {
    String platform = bundle.getPlatform();
    String region = bundle.getRegion();
    String prefix = ArtifactKeys.stagingPrefix(platform, region);
    for (String stale : objectStorage.list(prefix)) {
      objectStorage.delete(stale);
    }

    ClassifierEnsemble ensemble = bundle.getEnsemble();
    List<String> roster = new ArrayList<>(ensemble.getMembers().keySet());
    List<String> members = ArtifactKeys.members(platform, region, roster);

    Map<String, byte[]> contents = new LinkedHashMap<>();
    contents.put(ArtifactKeys.CENTROID_MODEL, toJson(bundle.getCentroidModel()));
    contents.put(ArtifactKeys.CENTROIDS, TensorCodec.encodeMatrix(bundle.getCentroids()));
    contents.put(ArtifactKeys.EMBEDDINGS, TensorCodec.encodeMatrix(bundle.getEmbeddings()));
    contents.put(ArtifactKeys.LABELS, TensorCodec.encodeLabels(bundle.getLabels()));
    contents.put(
        ArtifactKeys.corpusTable(platform, region),
        corpusCsvCodec.writeCleaned(bundle.getPostings(), bundle.getLabels()));
    for (ScoredClassifier member : ensemble.getMembers().values()) {
      contents.put(ArtifactKeys.classifier(member.getName()), classifierJson(member));
    }

    ArtifactManifest manifest =
        ArtifactManifest.builder()
            .platform(platform)
            .region(region)
            .version(ArtifactKeys.newVersion())
            .clusterCount(bundle.getCentroidModel().getClusterCount())
            .dimension(bundle.getCentroidModel().getDimension())
            .postingCount(bundle.size())
            .roster(roster)
            .modelScores(ensemble.getScores())
            .bestModel(ensemble.getBestModel())
            .members(members)
            .createdAt(Instant.now())
            .build();
    contents.put(ArtifactKeys.MANIFEST, toJson(manifest));

    List<String> staged = new ArrayList<>();
    for (String member : members) {
      String key = prefix + member;
      objectStorage.put(key, contents.get(member));
      staged.add(key);
    }
    log.info("Staged {} artifacts for {} - {}", staged.size(), platform, region);
    return staged;
  }

  public PromotionResult promote(String platform, String region) {
    return promote(platform, region, null);
  }

  /**
   * Promotes staged members into the canonical directory of the staged version in three phases:
   * copy all, verify all, then delete the staged copy of each verified member. A failure on one
   * member is recorded and the others continue.
   *
   * <p>Publishing the manifest is the only write that switches the live bundle, and it happens
   * only once every member the manifest names is present under its version. Until then readers
   * keep loading the previous bundle untouched.
   *
   * @param only member names to promote, or null for everything staged
   */
  public PromotionResult promote(String platform, String region, Set<String> only) {
    String staging = ArtifactKeys.stagingPrefix(platform, region);
    PromotionResult result = new PromotionResult(platform, region);

    List<String> candidates = new ArrayList<>();
    for (String key : objectStorage.list(staging)) {
      candidates.add(key.substring(staging.length()));
    }
    if (only != null) {
      for (String requested : only) {
        if (!candidates.contains(requested)) {
          result.markFailed(requested, "not present in staging");
        }
      }
      candidates.retainAll(only);
    }
    boolean publishManifest = candidates.remove(ArtifactKeys.MANIFEST);
    if (candidates.isEmpty() && !publishManifest) {
      log.warn("Nothing staged to promote for {} - {}", platform, region);
      return result;
    }

    ArtifactManifest manifest = stagedManifest(platform, region);
    if (manifest == null) {
      log.error("No staged manifest for {} - {}, nothing can be promoted", platform, region);
      candidates.forEach(member -> result.markFailed(member, "no staged manifest"));
      return result;
    }
    String target = ArtifactKeys.versionPrefix(platform, region, manifest.getVersion());

    List<String> copied = new ArrayList<>();
    for (String member : candidates) {
      try {
        objectStorage.copy(staging + member, target + member);
        copied.add(member);
      } catch (RuntimeException e) {
        log.error("Failed to copy {}{} to {}", staging, member, target, e);
        result.markFailed(member, "copy failed: " + e.getMessage());
      }
    }

    List<String> verified = new ArrayList<>();
    for (String member : copied) {
      if (sameContent(staging + member, target + member, result, member)) {
        verified.add(member);
      }
    }

    for (String member : verified) {
      removeStaged(staging + member, result, member);
    }

    if (publishManifest) {
      publish(platform, region, manifest, result);
    }

    log.info(
        "Promotion for {} - {} (version {}): {} promoted, {} failed",
        platform,
        region,
        manifest.getVersion(),
        result.getPromoted().size(),
        result.getFailed().size());
    return result;
  }

  private void publish(
      String platform, String region, ArtifactManifest manifest, PromotionResult result) {
    String staging = ArtifactKeys.stagingPrefix(platform, region);
    String target = ArtifactKeys.versionPrefix(platform, region, manifest.getVersion());
    List<String> missing = new ArrayList<>();
    for (String member : manifest.getMembers()) {
      if (!ArtifactKeys.MANIFEST.equals(member) && !objectStorage.exists(target + member)) {
        missing.add(member);
      }
    }
    if (!missing.isEmpty()) {
      log.warn("Holding back manifest for {} - {}, not promoted: {}", platform, region, missing);
      result.markFailed(
          ArtifactKeys.MANIFEST, "held back until promoted: " + String.join(", ", missing));
      return;
    }

    String previous = liveVersion(platform, region);
    String live = ArtifactKeys.canonicalPrefix(platform, region) + ArtifactKeys.MANIFEST;
    try {
      objectStorage.copy(staging + ArtifactKeys.MANIFEST, live);
    } catch (RuntimeException e) {
      log.error("Failed to publish manifest for {} - {}", platform, region, e);
      result.markFailed(ArtifactKeys.MANIFEST, "copy failed: " + e.getMessage());
      return;
    }
    if (sameContent(staging + ArtifactKeys.MANIFEST, live, result, ArtifactKeys.MANIFEST)) {
      removeStaged(staging + ArtifactKeys.MANIFEST, result, ArtifactKeys.MANIFEST);
      log.info("Version {} is live for {} - {}", manifest.getVersion(), platform, region);
      pruneVersions(platform, region, manifest.getVersion(), previous);
    }
  }

  private boolean sameContent(
      String stagedKey, String canonicalKey, PromotionResult result, String member) {
    try {
      if (Arrays.equals(objectStorage.get(stagedKey), objectStorage.get(canonicalKey))) {
        return true;
      }
      log.error("Canonical copy of {} differs from staged copy", member);
      result.markFailed(member, "verification failed: content differs");
    } catch (RuntimeException e) {
      log.error("Failed to verify {}", canonicalKey, e);
      result.markFailed(member, "verification failed: " + e.getMessage());
    }
    return false;
  }

  private void removeStaged(String stagedKey, PromotionResult result, String member) {
    try {
      objectStorage.delete(stagedKey);
      result.markPromoted(member);
    } catch (RuntimeException e) {
      log.error("Promoted {} but could not remove the staged copy", member, e);
      result.markFailed(member, "staged copy not removed: " + e.getMessage());
    }
  }

  /** Deletes canonical versions other than the live one and the one it replaced. */
  private void pruneVersions(String platform, String region, String live, String previous) {
    String canonical = ArtifactKeys.canonicalPrefix(platform, region);
    try {
      for (String key : objectStorage.list(canonical)) {
        String relative = key.substring(canonical.length());
        int slash = relative.indexOf('/');
        if (slash < 0) {
          continue;
        }
        String version = relative.substring(0, slash);
        if (!version.equals(live) && !version.equals(previous)) {
          objectStorage.delete(key);
        }
      }
    } catch (RuntimeException e) {
      log.warn("Could not prune superseded versions for {} - {}", platform, region, e);
    }
  }

  private ArtifactManifest stagedManifest(String platform, String region) {
    String key = ArtifactKeys.stagingPrefix(platform, region) + ArtifactKeys.MANIFEST;
    if (!objectStorage.exists(key)) {
      return null;
    }
    ArtifactManifest manifest = fromJson(objectStorage.get(key), ArtifactManifest.class);
    return manifest.getVersion() == null ? null : manifest;
  }

  private String liveVersion(String platform, String region) {
    String key = ArtifactKeys.canonicalPrefix(platform, region) + ArtifactKeys.MANIFEST;
    if (!objectStorage.exists(key)) {
      return null;
    }
    try {
      return fromJson(objectStorage.get(key), ArtifactManifest.class).getVersion();
    } catch (RuntimeException e) {
      log.warn("Unreadable canonical manifest for {} - {}", platform, region, e);
      return null;
    }
  }

  /**
   * Reads the live canonical bundle: the version named by the canonical manifest.
   *
   * @throws ArtifactNotFoundException if the manifest or any member it names is missing
   */
  public ArtifactBundle load(String platform, String region) {
    String canonical = ArtifactKeys.canonicalPrefix(platform, region);
    ArtifactManifest manifest =
        fromJson(read(canonical, ArtifactKeys.MANIFEST, platform, region), ArtifactManifest.class);
    if (manifest.getVersion() == null) {
      throw new ArtifactNotFoundException(
          String.format("Manifest for %s - %s names no version", platform, region));
    }
    String prefix = ArtifactKeys.versionPrefix(platform, region, manifest.getVersion());

    List<String> roster = manifest.getRoster() == null ? List.of() : manifest.getRoster();
    for (String member : ArtifactKeys.members(platform, region, roster)) {
      if (!ArtifactKeys.MANIFEST.equals(member) && !objectStorage.exists(prefix + member)) {
        throw new ArtifactNotFoundException(
            String.format("Artifact %s missing for %s - %s", member, platform, region));
      }
    }

    CentroidModel stored =
        fromJson(
            read(prefix, ArtifactKeys.CENTROID_MODEL, platform, region), CentroidModel.class);
    double[][] centroids =
        TensorCodec.decodeMatrix(read(prefix, ArtifactKeys.CENTROIDS, platform, region));
    double[][] embeddings =
        TensorCodec.decodeMatrix(read(prefix, ArtifactKeys.EMBEDDINGS, platform, region));
    int[] labels = TensorCodec.decodeLabels(read(prefix, ArtifactKeys.LABELS, platform, region));
    String tableName = ArtifactKeys.corpusTable(platform, region);
    List<CleanedPosting> postings =
        corpusCsvCodec.readCleaned(read(prefix, tableName, platform, region), prefix + tableName);

    if (embeddings.length != labels.length || postings.size() != labels.length) {
      throw new IllegalStateException(
          String.format(
              "Inconsistent bundle for %s - %s: %d postings, %d embeddings, %d labels",
              platform, region, postings.size(), embeddings.length, labels.length));
    }

    List<ScoredClassifier> members = new ArrayList<>();
    Map<String, Double> scores =
        manifest.getModelScores() == null ? Map.of() : manifest.getModelScores();
    for (String name : roster) {
      ClusterClassifier classifier =
          fromJson(
              read(prefix, ArtifactKeys.classifier(name), platform, region),
              ClusterClassifier.class);
      members.add(new ScoredClassifier(name, classifier, scores.getOrDefault(name, 0.0)));
    }

    return ArtifactBundle.builder()
        .platform(platform)
        .region(region)
        .centroidModel(
            new CentroidModel(
                centroids.length,
                centroids,
                labels,
                stored.getInertia(),
                stored.getDispersion()))
        .embeddings(embeddings)
        .postings(postings)
        .ensemble(new ClassifierEnsemble(members))
        .build();
  }

  /** Whether a canonical manifest exists for the pair. */
  public boolean isPublished(String platform, String region) {
    String prefix = ArtifactKeys.canonicalPrefix(platform, region);
    return objectStorage.exists(prefix + ArtifactKeys.MANIFEST);
  }

  private byte[] read(String prefix, String member, String platform, String region) {
    try {
      return objectStorage.get(prefix + member);
    } catch (ResourceNotFoundException e) {
      throw new ArtifactNotFoundException(
          String.format("Artifact %s missing for %s - %s", member, platform, region), e);
    }
  }

  private byte[] classifierJson(ScoredClassifier member) {
    try {
      return objectMapper
          .writerFor(ClusterClassifier.class)
          .writeValueAsBytes(member.getClassifier());
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize classifier " + member.getName(), e);
    }
  }

  private byte[] toJson(Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private <T> T fromJson(byte[] content, Class<T> type) {
    try {
      return objectMapper.readValue(content, type);
    } catch (IOException e) {
      throw new IllegalStateException("Corrupt artifact of type " + type.getSimpleName(), e);
    }
  }
}
