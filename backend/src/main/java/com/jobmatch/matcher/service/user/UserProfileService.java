package com.jobmatch.matcher.service.user;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.dto.prediction.PredictionRequest;
import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.dto.user.LikedPost;
import com.jobmatch.matcher.dto.user.PredictionRecord;
import com.jobmatch.matcher.dto.user.UserProfile;
import com.jobmatch.matcher.exception.ResourceNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

  static final Map<String, String> REGION_DISPLAY_NAMES =
      Map.of(
          "ile_de_france", "Île-de-France",
          "hauts_de_france", "Hauts-de-France",
          "alpes_cote_dazur", "Côte d'Azur",
          "Others", "Autres régions");

  private final IUserProfileRepository repository;

  public UserProfile getOrCreateByEmail(String email) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    return repository.getOrCreateByEmail(email);
  }

  public UserProfile getUser(String userId) {
    return repository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
  }

  public UserProfile getUserByEmail(String email) {
    return repository
        .findByEmail(email)
        .orElseThrow(() -> new ResourceNotFoundException("No user registered for " + email));
  }

  public boolean exists(String userId) {
    return repository.findById(userId).isPresent();
  }

  /**
   * Stores the outcome of a prediction.
   *
   * @throws com.jobmatch.matcher.exception.DuplicatePredictionException if the same file or text
   *     was already matched for this platform and region
   */
  public PredictionRecord recordPrediction(
      PredictionRequest request, int majority, List<RankedPosting> postings) {
    PredictionRecord record =
        PredictionRecord.builder()
            .deduplicationKey(deduplicationKey(request))
            .platform(request.getPlatform())
            .region(request.getRegion())
            .summaryType(request.getTypeSummary())
            .filename(request.getFilename())
            .textSummary(request.getSummarizedText())
            .cityForFilter(
                request.getCityForFilter() == null
                    ? null
                    : REGION_DISPLAY_NAMES.getOrDefault(
                        request.getCityForFilter(), request.getCityForFilter()))
            .educationLevel(request.getEducationLevel())
            .majority(majority)
            .predictJobs(List.copyOf(postings))
            .addedDate(Instant.now())
            .build();
    repository.appendPredictionResult(request.getUserId(), record);
    log.info("Stored prediction {} for user {}", record.getDeduplicationKey(), request.getUserId());
    return record;
  }

  public List<PredictionRecord> getPredictionHistory(String userId) {
    return repository.findPredictionResults(userId);
  }

  public LikedPost likePost(String userId, JobPosting posting) {
    if (posting == null || posting.getUrl() == null || posting.getUrl().isBlank()) {
      throw new IllegalArgumentException("A liked post needs a Url");
    }
    LikedPost liked = LikedPost.builder().posting(posting).addedDate(Instant.now()).build();
    repository.addLikedPost(userId, liked);
    return liked;
  }

  public boolean unlikePost(String userId, String url) {
    return repository.removeLikedPost(userId, url);
  }

  public List<LikedPost> getLikedPosts(String userId) {
    return repository.findLikedPosts(userId);
  }

  public boolean updateCvResume(String userId, String content) {
    return repository.updateCvResume(userId, content);
  }

  public String getCvResume(String userId) {
    return getUser(userId).getCvResume();
  }

  /**
   * Platform, region and a SHA-256 of the file name for CV summaries or of the text for free-text
   * prompts. A file name sent along with a prompt is ignored; a CV without one falls back to the
   * text.
   */
  static String deduplicationKey(PredictionRequest request) {
    boolean fromFile = "cv".equals(request.getTypeSummary()) && request.getFilename() != null;
    String source =
        fromFile ? "file:" + request.getFilename() : "text:" + request.getSummarizedText();
    return request.getPlatform() + ":" + request.getRegion() + ":" + sha256(source);
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
