package com.jobmatch.matcher.service.corpus;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.service.storage.ObjectStorage;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Moves staged summarized corpora to their final location once training is done with them. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusPublisher {

  private final ObjectStorage objectStorage;
  private final CorpusCsvCodec corpusCsvCodec;
  private final MatcherProperties properties;

  public Map<String, CorpusTransfer> finalizeAll() {
    Map<String, CorpusTransfer> results = new LinkedHashMap<>();
    for (String platform : properties.getPlatforms()) {
      for (String region : properties.getRegions()) {
        results.put(platform + "_" + region, finalizeCorpus(platform, region));
      }
    }
    return results;
  }

  public CorpusTransfer finalizeCorpus(String platform, String region) {
    String source = CorpusKeys.staged(platform, region);
    String target = CorpusKeys.finalized(platform, region);
    try {
      byte[] content = objectStorage.get(source);
      int rows = corpusCsvCodec.countRows(content, source);
      objectStorage.put(target, content);
      objectStorage.delete(source);
      log.info("Finalized corpus {} -> {} ({} rows)", source, target, rows);
      return new CorpusTransfer(source, target, rows, true, null);
    } catch (ResourceNotFoundException e) {
      log.warn("No staged corpus at {}", source);
      return new CorpusTransfer(source, target, 0, false, "no staged corpus");
    } catch (RuntimeException e) {
      log.error("Failed to finalize corpus {}", source, e);
      return new CorpusTransfer(source, target, 0, false, e.getMessage());
    }
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CorpusTransfer {
    private String source;
    private String target;
    private int rows;
    private boolean success;
    private String error;
  }
}
