package com.jobmatch.matcher.controller;

import java.util.Map;
import java.util.Set;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobmatch.matcher.service.artifact.ArtifactPublisher;
import com.jobmatch.matcher.service.artifact.PromotionResult;
import com.jobmatch.matcher.service.corpus.CorpusPublisher;
import com.jobmatch.matcher.service.corpus.CorpusPublisher.CorpusTransfer;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Moves staged models and corpora into their published locations. */
@Slf4j
@RestController
@RequestMapping("/finalize")
@RequiredArgsConstructor
@Tag(name = "Publication", description = "Promotion of staged artifacts")
public class PublicationController {

  private final ArtifactPublisher artifactPublisher;
  private final CorpusPublisher corpusPublisher;

  @PostMapping("/transfer-models")
  @Operation(
      summary = "Promote every staged model bundle",
      description = "Reports promoted and failed members per platform and region",
      responses = {@ApiResponse(responseCode = "200", description = "Promotion attempted")})
  public ResponseEntity<PublicationReport<PromotionResult>> transferModels() {
    Map<String, PromotionResult> results = artifactPublisher.promoteAll();
    boolean success = results.values().stream().allMatch(PromotionResult::isSuccess);
    log.info("Model transfer finished, success={}", success);
    return ResponseEntity.ok(new PublicationReport<>(success, results));
  }

  @PostMapping("/transfer-models/{platform}/{region}")
  @Operation(
      summary = "Promote one staged bundle",
      description = "With a body listing member names, only those members are retried")
  public ResponseEntity<PromotionResult> transferModel(
      @PathVariable String platform,
      @PathVariable String region,
      @RequestBody(required = false) Set<String> members) {
    Set<String> only = members == null || members.isEmpty() ? null : members;
    return ResponseEntity.ok(artifactPublisher.promote(platform, region, only));
  }

  @PostMapping("/transfer-summarize")
  @Operation(
      summary = "Publish every staged summarized corpus",
      responses = {@ApiResponse(responseCode = "200", description = "Transfer attempted")})
  public ResponseEntity<PublicationReport<CorpusTransfer>> transferSummarize() {
    Map<String, CorpusTransfer> results = corpusPublisher.finalizeAll();
    boolean success = results.values().stream().allMatch(CorpusTransfer::isSuccess);
    log.info("Corpus transfer finished, success={}", success);
    return ResponseEntity.ok(new PublicationReport<>(success, results));
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Schema(description = "Per-pair publication outcome keyed <platform>_<region>")
  public static class PublicationReport<T> {
    @JsonProperty("success")
    private boolean success;

    @JsonProperty("details")
    private Map<String, T> details;
  }
}
