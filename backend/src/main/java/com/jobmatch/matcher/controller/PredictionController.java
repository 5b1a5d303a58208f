package com.jobmatch.matcher.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.jobmatch.matcher.dto.prediction.PredictionRequest;
import com.jobmatch.matcher.dto.prediction.PredictionResponse;
import com.jobmatch.matcher.dto.training.PairTrainingResult;
import com.jobmatch.matcher.dto.training.TrainingReport;
import com.jobmatch.matcher.service.prediction.JobPredictionService;
import com.jobmatch.matcher.service.training.ClusteringTrainingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
@Tag(name = "Job Matching", description = "Cluster training and job recommendations")
public class PredictionController {

  private final JobPredictionService jobPredictionService;
  private final ClusteringTrainingService clusteringTrainingService;

  @PostMapping("/predict-summary")
  @Operation(
      summary = "Recommend postings for a candidate summary",
      description =
          "Classifies the summary with the published ensemble, ranks the postings of the winning"
              + " cluster, filters them and attaches a cover letter and skill summaries")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Recommendations computed"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "No published model for the pair"),
        @ApiResponse(responseCode = "502", description = "Embedding provider failure")
      })
  public ResponseEntity<PredictionResponse> predictFromSummary(
      @Valid @RequestBody PredictionRequest request) {
    log.info(
        "Prediction request for {} - {} ({})",
        request.getPlatform(),
        request.getRegion(),
        request.getTypeSummary());
    return ResponseEntity.ok(jobPredictionService.predict(request));
  }

  @PostMapping("/process-all-clustering-in-background")
  @Operation(
      summary = "Retrain every platform and region",
      description = "Starts a full training run on the background executor and returns at once")
  @ApiResponse(responseCode = "202", description = "Training started")
  public ResponseEntity<Map<String, String>> runAllClusteringInBackground() {
    if (clusteringTrainingService.trainAllInBackground().isEmpty()) {
      return ResponseEntity.status(HttpStatus.ACCEPTED)
          .body(Map.of("message", "Clustering is already running in the background."));
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(Map.of("message", "Clustering process started in the background."));
  }

  @GetMapping("/training-status")
  @Operation(summary = "Report of the most recent training run")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Last report returned"),
        @ApiResponse(responseCode = "204", description = "No training run has finished yet")
      })
  public ResponseEntity<TrainingReport> getTrainingStatus() {
    return clusteringTrainingService
        .getLastReport()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PostMapping("/train/{platform}/{region}")
  @Operation(summary = "Train a single platform and region synchronously")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Pair trained"),
        @ApiResponse(responseCode = "409", description = "Another training run is in progress")
      })
  public ResponseEntity<PairTrainingResult> trainPair(
      @PathVariable String platform, @PathVariable String region) {
    return ResponseEntity.ok(clusteringTrainingService.trainPair(platform, region));
  }
}
