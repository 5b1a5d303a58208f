package com.jobmatch.matcher.service.prediction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.exception.EnrichmentCancelledException;
import com.jobmatch.matcher.exception.GenerationProviderException;
import com.jobmatch.matcher.fixtures.MatcherFixtures;
import com.jobmatch.matcher.service.generation.BilingualSectionParser;
import com.jobmatch.matcher.service.generation.GenerationServiceSelector;
import com.jobmatch.matcher.service.generation.PromptTemplateLoader;
import com.jobmatch.matcher.service.generation.TextGenerationService;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrichmentOrchestrator Tests")
class EnrichmentOrchestratorTest {

  private static final String ANSWER =
      "### English Version\nEnglish text\n### Version Française\nTexte français\n";

  @Mock private GenerationServiceSelector generationServiceSelector;
  @Mock private TextGenerationService generator;

  private final PromptTemplateLoader templateLoader = new PromptTemplateLoader();
  private ThreadPoolTaskExecutor executor;
  private MatcherProperties properties;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(6);
    executor.setMaxPoolSize(6);
    executor.setThreadNamePrefix("enrichment-test-");
    executor.initialize();
    properties = new MatcherProperties();
    properties.getEnrichment().setMaxConcurrentCalls(2);
    properties.getEnrichment().setRequestTimeoutSeconds(10);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
    MDC.clear();
  }

  private EnrichmentOrchestrator orchestrator() {
    return new EnrichmentOrchestrator(
        generationServiceSelector,
        new BilingualSectionParser(),
        templateLoader,
        executor,
        properties);
  }

  @Test
  @DisplayName("Should fill all six fields of every posting")
  void shouldEnrichEveryPosting() {
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList())).thenReturn(ANSWER);
    List<RankedPosting> postings = postings(2);

    orchestrator().enrich(postings, "candidate with spark");

    assertThat(postings)
        .allSatisfy(
            posting -> {
              assertThat(posting.getCoverLetterEn()).isEqualTo("English text");
              assertThat(posting.getCoverLetterFr()).isEqualTo("Texte français");
              assertThat(posting.getMissingSkillsEn()).isEqualTo("English text");
              assertThat(posting.getMatchingSkillsFr()).isEqualTo("Texte français");
            });
    verify(generator, times(6)).generate(anyString(), anyList());
  }

  @Test
  @DisplayName("Should ground each call on the candidate text and the posting summary")
  void shouldPassGroundingContext() {
    when(generationServiceSelector.getService()).thenReturn(generator);
    List<String> contexts = new ArrayList<>();
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              List<String> context = invocation.getArgument(1);
              synchronized (contexts) {
                contexts.addAll(context);
              }
              return ANSWER;
            });

    orchestrator().enrich(postings(1), "candidate text");

    assertThat(contexts).hasSize(3).containsOnly("candidate text\nsummary 0");
  }

  @Test
  @DisplayName("A failing call leaves only its own fields empty")
  void shouldIsolateFailedCall() throws Exception {
    String coverLetterPrompt = templateLoader.load(EnrichmentKind.COVER_LETTER.getTemplateName());
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              if (coverLetterPrompt.equals(invocation.getArgument(0))) {
                throw new GenerationProviderException("rate limited");
              }
              return ANSWER;
            });
    List<RankedPosting> postings = postings(2);

    orchestrator().enrich(postings, "candidate");

    assertThat(postings)
        .allSatisfy(
            posting -> {
              assertThat(posting.getCoverLetterEn()).isEmpty();
              assertThat(posting.getCoverLetterFr()).isEmpty();
              assertThat(posting.getMissingSkillsEn()).isEqualTo("English text");
              assertThat(posting.getMatchingSkillsEn()).isEqualTo("English text");
            });
  }

  @Test
  @DisplayName("Should never exceed the configured number of simultaneous calls")
  void shouldBoundConcurrency() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
              Thread.sleep(20);
              inFlight.decrementAndGet();
              return ANSWER;
            });
    EnrichmentOrchestrator orchestrator = orchestrator();

    orchestrator.enrich(postings(4), "candidate");

    assertThat(peak.get()).isBetween(1, 2);
    assertThat(orchestrator.availablePermits()).isEqualTo(2);
    verify(generator, times(12)).generate(anyString(), anyList());
  }

  @Test
  @DisplayName("Should keep results that finished while an earlier call was still running")
  void shouldKeepFinishedResultsAtDeadline() {
    properties.getEnrichment().setRequestTimeoutSeconds(1);
    properties.getEnrichment().setMaxConcurrentCalls(6);
    CountDownLatch never = new CountDownLatch(1);
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              List<String> context = invocation.getArgument(1);
              if (context.get(0).endsWith("summary 0")) {
                never.await(30, TimeUnit.SECONDS);
              }
              return ANSWER;
            });
    List<RankedPosting> postings = postings(2);

    orchestrator().enrich(postings, "candidate");

    assertThat(postings.get(0).getCoverLetterEn()).isEmpty();
    assertThat(postings.get(1).getCoverLetterEn()).isEqualTo("English text");
    assertThat(postings.get(1).getMissingSkillsFr()).isEqualTo("Texte français");
    assertThat(postings.get(1).getMatchingSkillsEn()).isEqualTo("English text");
  }

  @Test
  @DisplayName("Should give up on calls still running at the deadline")
  void shouldCancelAtDeadline() {
    properties.getEnrichment().setRequestTimeoutSeconds(1);
    CountDownLatch never = new CountDownLatch(1);
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              never.await(30, TimeUnit.SECONDS);
              return ANSWER;
            });
    List<RankedPosting> postings = postings(1);

    long started = System.nanoTime();
    orchestrator().enrich(postings, "candidate");

    assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started)).isLessThan(10);
    assertThat(postings.get(0).getCoverLetterEn()).isEmpty();
    assertThat(postings.get(0).getMatchingSkillsFr()).isEmpty();
  }

  @Test
  @DisplayName("Should abort when the waiting thread is interrupted")
  void shouldAbortOnInterrupt() {
    CountDownLatch never = new CountDownLatch(1);
    when(generationServiceSelector.getService()).thenReturn(generator);
    lenient()
        .when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              never.await(30, TimeUnit.SECONDS);
              return ANSWER;
            });
    EnrichmentOrchestrator orchestrator = orchestrator();
    List<RankedPosting> postings = postings(1);

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> orchestrator.enrich(postings, "candidate"))
          .isInstanceOf(EnrichmentCancelledException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("Should skip enrichment when no provider is configured")
  void shouldSkipWithoutProvider() {
    when(generationServiceSelector.getService())
        .thenThrow(new GenerationProviderException("No text generation service is configured"));
    List<RankedPosting> postings = postings(2);

    orchestrator().enrich(postings, "candidate");

    assertThat(postings).allSatisfy(posting -> assertThat(posting.getCoverLetterEn()).isEmpty());
    verifyNoInteractions(generator);
  }

  @Test
  @DisplayName("Should carry the caller's logging context into the workers")
  void shouldPropagateMdc() {
    MDC.put("userId", "user-42");
    List<String> seen = new ArrayList<>();
    when(generationServiceSelector.getService()).thenReturn(generator);
    when(generator.generate(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              synchronized (seen) {
                seen.add(MDC.get("userId"));
              }
              return ANSWER;
            });

    orchestrator().enrich(postings(1), "candidate");

    assertThat(seen).hasSize(3).containsOnly("user-42");
    assertThat(MDC.get("userId")).isEqualTo("user-42");
  }

  private static List<RankedPosting> postings(int count) {
    List<RankedPosting> postings = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      postings.add(
          RankedPosting.builder()
              .posting(MatcherFixtures.posting(i))
              .cleanedSummary("summary " + i)
              .similarity(90.0)
              .build());
    }
    return postings;
  }
}
