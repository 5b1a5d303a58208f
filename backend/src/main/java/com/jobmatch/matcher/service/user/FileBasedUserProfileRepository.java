package com.jobmatch.matcher.service.user;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.user.LikedPost;
import com.jobmatch.matcher.dto.user.PredictionRecord;
import com.jobmatch.matcher.dto.user.UserProfile;
import com.jobmatch.matcher.exception.DuplicatePredictionException;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.exception.StorageException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps every profile in memory and rewrites a single JSON file after each change. Mutations are
 * serialized on the repository so a duplicate check and its append cannot interleave.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileBasedUserProfileRepository implements IUserProfileRepository {

  private final ObjectMapper objectMapper;
  private final MatcherProperties properties;
  private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();
  private Path storeFile;

  @PostConstruct
  public void init() {
    storeFile = Paths.get(properties.getUsers().getStoreFile());
    try {
      Path parent = storeFile.toAbsolutePath().getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      log.warn("Failed to ensure directory for user store '{}': {}", storeFile, e.getMessage());
    }
    loadProfiles();
  }

  @Override
  public Optional<UserProfile> findById(String userId) {
    if (userId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(profiles.get(userId));
  }

  @Override
  public Optional<UserProfile> findByEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    String normalized = normalizeEmail(email);
    return profiles.values().stream().filter(p -> normalized.equals(p.getEmail())).findFirst();
  }

  @Override
  public synchronized UserProfile getOrCreateByEmail(String email) {
    Optional<UserProfile> existing = findByEmail(email);
    if (existing.isPresent()) {
      return existing.get();
    }
    UserProfile profile =
        UserProfile.builder()
            .id(UUID.randomUUID().toString())
            .email(normalizeEmail(email))
            .createdAt(Instant.now())
            .build();
    profiles.put(profile.getId(), profile);
    saveProfiles();
    log.info("Created user profile {}", profile.getId());
    return profile;
  }

  @Override
  public synchronized void appendPredictionResult(String userId, PredictionRecord record) {
    UserProfile profile = require(userId);
    boolean duplicate =
        profile.getPredictionResults().stream()
            .anyMatch(r -> Objects.equals(r.getDeduplicationKey(), record.getDeduplicationKey()));
    if (duplicate) {
      throw new DuplicatePredictionException(userId, record.getDeduplicationKey());
    }
    profile.getPredictionResults().add(record);
    saveProfiles();
  }

  @Override
  public List<PredictionRecord> findPredictionResults(String userId) {
    return read(userId, UserProfile::getPredictionResults);
  }

  @Override
  public synchronized void addLikedPost(String userId, LikedPost likedPost) {
    require(userId).getLikedPosts().add(likedPost);
    saveProfiles();
  }

  @Override
  public synchronized boolean removeLikedPost(String userId, String url) {
    boolean removed =
        require(userId)
            .getLikedPosts()
            .removeIf(post -> post.getPosting() != null && url.equals(post.getPosting().getUrl()));
    if (removed) {
      saveProfiles();
    }
    return removed;
  }

  @Override
  public List<LikedPost> findLikedPosts(String userId) {
    return read(userId, UserProfile::getLikedPosts);
  }

  @Override
  public synchronized boolean updateCvResume(String userId, String content) {
    UserProfile profile = require(userId);
    if (Objects.equals(profile.getCvResume(), content)) {
      return false;
    }
    profile.setCvResume(content);
    saveProfiles();
    return true;
  }

  private synchronized <T> List<T> read(String userId, Function<UserProfile, List<T>> field) {
    return new ArrayList<>(field.apply(require(userId)));
  }

  private UserProfile require(String userId) {
    return findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
  }

  private static String normalizeEmail(String email) {
    return email.strip().toLowerCase(Locale.ROOT);
  }

  private void loadProfiles() {
    if (!Files.exists(storeFile)) {
      log.debug("No user store found at {}, starting empty", storeFile);
      return;
    }
    try {
      List<UserProfile> stored =
          objectMapper.readValue(
              storeFile.toFile(),
              objectMapper.getTypeFactory().constructCollectionType(List.class, UserProfile.class));
      for (UserProfile profile : stored) {
        profiles.put(profile.getId(), profile);
      }
      log.info("Loaded {} user profiles from {}", profiles.size(), storeFile);
    } catch (IOException e) {
      throw new StorageException("Failed to read user store " + storeFile, e);
    }
  }

  private void saveProfiles() {
    Path temp = storeFile.resolveSibling(storeFile.getFileName() + ".tmp");
    try {
      List<UserProfile> snapshot = new ArrayList<>(profiles.values());
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
      Files.move(
          temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved {} user profiles to {}", snapshot.size(), storeFile);
    } catch (IOException e) {
      throw new StorageException("Failed to write user store " + storeFile, e);
    }
  }
}
