package com.jobmatch.matcher.service.corpus;

import java.util.List;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.service.storage.ObjectStorage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLoader {

  private final ObjectStorage objectStorage;
  private final CorpusCsvCodec corpusCsvCodec;

  /**
   * Reads the summarized corpus staged for training.
   *
   * @throws com.jobmatch.matcher.exception.ResourceNotFoundException if no corpus is staged
   * @throws com.jobmatch.matcher.exception.InvalidCorpusException if the CSV has no Summary column
   */
  public List<JobPosting> load(String platform, String region) {
    String key = CorpusKeys.staged(platform, region);
    List<JobPosting> postings = corpusCsvCodec.readPostings(objectStorage.get(key), key);
    log.info("Loaded {} postings from {}", postings.size(), key);
    return postings;
  }
}
