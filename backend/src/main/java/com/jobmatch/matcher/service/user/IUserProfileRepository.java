package com.jobmatch.matcher.service.user;

import java.util.List;
import java.util.Optional;

import com.jobmatch.matcher.dto.user.LikedPost;
import com.jobmatch.matcher.dto.user.PredictionRecord;
import com.jobmatch.matcher.dto.user.UserProfile;

/** Storage for job seeker profiles. Implementations must be safe for concurrent use. */
public interface IUserProfileRepository {

  Optional<UserProfile> findById(String userId);

  Optional<UserProfile> findByEmail(String email);

  /** Returns the profile registered under the email, creating an empty one if there is none. */
  UserProfile getOrCreateByEmail(String email);

  /**
   * Appends a prediction to the user's history.
   *
   * @throws com.jobmatch.matcher.exception.DuplicatePredictionException if a record with the same
   *     de-duplication key is already stored
   * @throws com.jobmatch.matcher.exception.ResourceNotFoundException if the user does not exist
   */
  void appendPredictionResult(String userId, PredictionRecord record);

  List<PredictionRecord> findPredictionResults(String userId);

  void addLikedPost(String userId, LikedPost likedPost);

  /** Removes every liked post with the given URL; false when none matched. */
  boolean removeLikedPost(String userId, String url);

  List<LikedPost> findLikedPosts(String userId);

  /** Stores the CV text; false when it is identical to the stored one. */
  boolean updateCvResume(String userId, String content);
}
