package com.jobmatch.matcher.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.dto.user.LikedPost;
import com.jobmatch.matcher.dto.user.PredictionRecord;
import com.jobmatch.matcher.dto.user.UserProfile;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.service.user.UserProfileService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/analytics/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "Job seeker profiles, liked posts and prediction history")
public class UserProfileController {

  private final UserProfileService userProfileService;

  @PostMapping
  @Operation(summary = "Get or create the profile registered under an email")
  public ResponseEntity<UserProfile> getOrCreateUser(@Valid @RequestBody UserRequest request) {
    return ResponseEntity.ok(userProfileService.getOrCreateByEmail(request.getEmail()));
  }

  @GetMapping("/by-email")
  @Operation(
      summary = "Find a profile by email",
      responses = {
        @ApiResponse(responseCode = "200", description = "Profile found"),
        @ApiResponse(responseCode = "404", description = "No profile for the email")
      })
  public ResponseEntity<UserProfile> getUserByEmail(@RequestParam String email) {
    return ResponseEntity.ok(userProfileService.getUserByEmail(email));
  }

  @GetMapping("/{userId}/predictions")
  @Operation(summary = "Prediction history of a user")
  public ResponseEntity<List<PredictionRecord>> getPredictionHistory(@PathVariable String userId) {
    return ResponseEntity.ok(userProfileService.getPredictionHistory(userId));
  }

  @GetMapping("/{userId}/liked-posts")
  @Operation(summary = "Liked posts of a user")
  public ResponseEntity<List<LikedPost>> getLikedPosts(@PathVariable String userId) {
    return ResponseEntity.ok(userProfileService.getLikedPosts(userId));
  }

  @PostMapping("/{userId}/liked-posts")
  @Operation(summary = "Like a posting")
  public ResponseEntity<LikedPost> addLikedPost(
      @PathVariable String userId, @RequestBody JobPosting posting) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(userProfileService.likePost(userId, posting));
  }

  @DeleteMapping("/{userId}/liked-posts")
  @Operation(
      summary = "Remove a liked posting by URL",
      responses = {
        @ApiResponse(responseCode = "200", description = "Removed"),
        @ApiResponse(responseCode = "404", description = "No liked post with that URL")
      })
  public ResponseEntity<Map<String, String>> removeLikedPost(
      @PathVariable String userId, @RequestParam String url) {
    if (!userProfileService.unlikePost(userId, url)) {
      throw new ResourceNotFoundException("No liked post found with the specified URL.");
    }
    return ResponseEntity.ok(Map.of("message", "Liked post removed successfully."));
  }

  @PutMapping("/{userId}/cv-resume")
  @Operation(summary = "Store the CV summary of a user")
  public ResponseEntity<Map<String, String>> updateCvResume(
      @PathVariable String userId, @Valid @RequestBody CvResumeRequest request) {
    boolean updated = userProfileService.updateCvResume(userId, request.getContent());
    return ResponseEntity.ok(Map.of("status", updated ? "cv_updated" : "cv_identical"));
  }

  @GetMapping("/{userId}/cv-resume")
  @Operation(summary = "CV summary of a user")
  public ResponseEntity<Map<String, String>> getCvResume(@PathVariable String userId) {
    String content = userProfileService.getCvResume(userId);
    if (content == null) {
      throw new ResourceNotFoundException("No CV resume stored for user " + userId);
    }
    return ResponseEntity.ok(Map.of("cv_resume", content));
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class UserRequest {
    @NotBlank(message = "email is required")
    @Email
    private String email;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CvResumeRequest {
    @NotBlank(message = "content is required")
    private String content;
  }
}
