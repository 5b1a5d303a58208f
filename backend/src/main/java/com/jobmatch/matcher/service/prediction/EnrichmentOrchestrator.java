package com.jobmatch.matcher.service.prediction;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.exception.EnrichmentCancelledException;
import com.jobmatch.matcher.exception.GenerationProviderException;
import com.jobmatch.matcher.service.generation.BilingualSectionParser;
import com.jobmatch.matcher.service.generation.BilingualSectionParser.BilingualText;
import com.jobmatch.matcher.service.generation.GenerationServiceSelector;
import com.jobmatch.matcher.service.generation.PromptTemplateLoader;
import com.jobmatch.matcher.service.generation.TextGenerationService;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates the cover letter and skill summaries for every displayed posting.
 *
 * <p>All generation calls of a request run concurrently on the enrichment executor, gated by a
 * semaphore shared across requests so that no more than {@code maxConcurrentCalls} provider calls
 * are in flight at once. A failed call leaves its two fields empty. When the per-request deadline
 * passes the unfinished calls are cancelled together and their fields stay empty, while calls that
 * already completed still fill theirs. Interruption of the waiting thread cancels the unfinished
 * calls too and aborts the request.
 */
@Slf4j
@Service
public class EnrichmentOrchestrator {

  private final GenerationServiceSelector generationServiceSelector;
  private final BilingualSectionParser sectionParser;
  private final ThreadPoolTaskExecutor executor;
  private final MatcherProperties properties;
  private final Semaphore permits;
  private final Map<EnrichmentKind, String> prompts = new EnumMap<>(EnrichmentKind.class);

  public EnrichmentOrchestrator(
      GenerationServiceSelector generationServiceSelector,
      BilingualSectionParser sectionParser,
      PromptTemplateLoader templateLoader,
      @Qualifier("enrichmentExecutor") ThreadPoolTaskExecutor executor,
      MatcherProperties properties) {
    this.generationServiceSelector = generationServiceSelector;
    this.sectionParser = sectionParser;
    this.executor = executor;
    this.properties = properties;
    this.permits =
        new Semaphore(Math.max(1, properties.getEnrichment().getMaxConcurrentCalls()), true);
    for (EnrichmentKind kind : EnrichmentKind.values()) {
      try {
        prompts.put(kind, templateLoader.load(kind.getTemplateName()));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  public void enrich(List<RankedPosting> postings, String candidateText) {
    if (postings.isEmpty()) {
      return;
    }
    TextGenerationService generator;
    try {
      generator = generationServiceSelector.getService();
    } catch (GenerationProviderException e) {
      log.warn("Skipping enrichment of {} postings: {}", postings.size(), e.getMessage());
      return;
    }

    Map<String, String> mdc = MDC.getCopyOfContextMap();
    List<Task> tasks = new ArrayList<>();
    for (RankedPosting posting : postings) {
      String context = candidateText + "\n" + posting.getCleanedSummary();
      for (EnrichmentKind kind : EnrichmentKind.values()) {
        Future<BilingualText> future =
            executor.submit(() -> generate(generator, kind, context, mdc));
        tasks.add(new Task(posting, kind, future));
      }
    }
    log.debug("Submitted {} enrichment calls for {} postings", tasks.size(), postings.size());

    long deadline =
        System.nanoTime()
            + TimeUnit.SECONDS.toNanos(properties.getEnrichment().getRequestTimeoutSeconds());
    int failed = 0;
    for (int i = 0; i < tasks.size(); i++) {
      Task task = tasks.get(i);
      try {
        long remaining = Math.max(0, deadline - System.nanoTime());
        task.kind.apply(task.posting, task.future.get(remaining, TimeUnit.NANOSECONDS));
      } catch (ExecutionException | CancellationException e) {
        failed++;
        Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
        log.warn(
            "Enrichment {} failed for {}: {}",
            task.kind,
            task.posting.getPosting().getUrl(),
            cause == null ? e.getMessage() : cause.getMessage());
      } catch (TimeoutException e) {
        int cancelled = cancelFrom(tasks, i);
        int salvaged = applyCompleted(tasks, i);
        log.warn(
            "Enrichment deadline passed, cancelled {} of {} calls, kept {} finished late results",
            cancelled,
            tasks.size(),
            salvaged);
        return;
      } catch (InterruptedException e) {
        cancelFrom(tasks, i);
        Thread.currentThread().interrupt();
        throw new EnrichmentCancelledException("Enrichment interrupted", e);
      }
    }
    if (failed > 0) {
      log.warn("{} of {} enrichment calls failed", failed, tasks.size());
    }
  }

  int availablePermits() {
    return permits.availablePermits();
  }

  private BilingualText generate(
      TextGenerationService generator,
      EnrichmentKind kind,
      String context,
      Map<String, String> mdc)
      throws InterruptedException {
    // the caller thread may run this task itself when the pool is saturated
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try {
      permits.acquire();
      try {
        return sectionParser.parse(generator.generate(prompts.get(kind), List.of(context)));
      } finally {
        permits.release();
      }
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private static int cancelFrom(List<Task> tasks, int start) {
    int cancelled = 0;
    for (int i = start; i < tasks.size(); i++) {
      if (tasks.get(i).future.cancel(true)) {
        cancelled++;
      }
    }
    return cancelled;
  }

  /** Applies results of tasks from {@code start} on that finished before they were cancelled. */
  private static int applyCompleted(List<Task> tasks, int start) {
    int applied = 0;
    for (int i = start; i < tasks.size(); i++) {
      Task task = tasks.get(i);
      if (!task.future.isDone() || task.future.isCancelled()) {
        continue;
      }
      try {
        task.kind.apply(task.posting, task.future.get());
        applied++;
      } catch (ExecutionException e) {
        log.warn(
            "Enrichment {} failed for {}: {}",
            task.kind,
            task.posting.getPosting().getUrl(),
            e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new EnrichmentCancelledException("Enrichment interrupted", e);
      }
    }
    return applied;
  }

  private static final class Task {
    private final RankedPosting posting;
    private final EnrichmentKind kind;
    private final Future<BilingualText> future;

    private Task(RankedPosting posting, EnrichmentKind kind, Future<BilingualText> future) {
      this.posting = posting;
      this.kind = kind;
      this.future = future;
    }
  }
}
