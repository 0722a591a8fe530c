package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.classifier.QueryClassifier;
import com.openforge.chatrouter.classifier.QueryType;
import com.openforge.chatrouter.domain.MemorySummary;
import com.openforge.chatrouter.repository.MemorySummaryRepository;
import com.openforge.chatrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryServiceTest {

    private static final String OWNER = "student-42";

    @Mock
    private MemorySummaryRepository summaryRepository;

    private MutableClock             clock;
    private InMemoryMemoryRepository repository;
    private PersonalFactExtractor    extractor;
    private MemoryService            service;

    @BeforeEach
    void setUp() {
        clock      = new MutableClock(Instant.parse("2026-02-02T08:00:00Z"));
        repository = new InMemoryMemoryRepository();
        extractor  = new PersonalFactExtractor();
        service    = service(MemoryProperties.defaults(), new HashingEmbeddingAdapter(1024));
    }

    private MemoryService service(MemoryProperties props, EmbeddingAdapter embedder) {
        return new MemoryService(repository, summaryRepository, embedder, new MemoryRanker(props),
                extractor, new QueryClassifier(), props, clock);
    }

    @Nested
    @DisplayName("personal recall")
    class PersonalRecall {

        @Test
        @DisplayName("should recall the user's name for a personal query even with unrelated memories present")
        void recallsName() {
            service.storeMemory(OWNER, "User's name is Kunal", List.of("name"), 5);
            service.storeMemory(OWNER, "User is preparing for the physics olympiad", List.of("goal"), 3);
            service.storeMemory(OWNER, "User prefers short explanations with examples", List.of(), 2);

            MemoryContext ctx = service.retrieveRelevant(OWNER, "What is my name?", 8, ContextLevel.COMPREHENSIVE);

            assertThat(ctx.personalFacts()).containsEntry("name", "Kunal");
            assertThat(ctx.contextString())
                    .startsWith("Known facts about the user:")
                    .contains("- name: Kunal")
                    .contains("User's name is Kunal");
            assertThat(ctx.memories().get(0).forced()).isTrue();
            assertThat(ctx.stats().forced()).isEqualTo(1);
        }

        @Test
        @DisplayName("should map 'who am i' to the name fact")
        void whoAmI() {
            service.storeMemory(OWNER, "User's name is Kunal", List.of("name"), 5);

            MemoryContext ctx = service.retrieveRelevant(OWNER, "Who am I?", 8, ContextLevel.COMPREHENSIVE);

            assertThat(ctx.personalFacts()).containsEntry("name", "Kunal");
        }

        @Test
        @DisplayName("should never return another owner's memories")
        void ownerScoped() {
            service.storeMemory("someone-else", "User's name is Priya", List.of("name"), 5);

            MemoryContext ctx = service.retrieveRelevant(OWNER, "What is my name?", 8, ContextLevel.COMPREHENSIVE);

            assertThat(ctx.memories()).isEmpty();
            assertThat(ctx.hasContent()).isFalse();
        }
    }

    @Nested
    @DisplayName("candidate selection")
    class CandidateSelection {

        @Test
        @DisplayName("should find an old relevant record behind more newer records than the candidate limit")
        void oldRelevantRecordFound() {
            service.storeMemory(OWNER, "User struggles with thermodynamics entropy problems", List.of(), 3);
            for (int i = 0; i < MemoryProperties.defaults().candidateLimit(); i++) {
                clock.advance(Duration.ofMinutes(1));
                service.storeMemory(OWNER, "Filler note " + i + " about cooking recipe " + i, List.of(), 2);
            }

            MemoryContext ctx = service.retrieveRelevant(OWNER, "thermodynamics entropy problems", 5,
                    ContextLevel.COMPREHENSIVE, QueryType.GENERAL);

            assertThat(ctx.memories()).extracting(m -> m.record().content())
                    .contains("User struggles with thermodynamics entropy problems");
        }

        @Test
        @DisplayName("should return the nearest records first from the in-memory store")
        void nearestFirst() {
            HashingEmbeddingAdapter embedder = new HashingEmbeddingAdapter(1024);
            service.storeMemory(OWNER, "User likes basketball", List.of(), 2);
            clock.advance(Duration.ofMinutes(1));
            service.storeMemory(OWNER, "User enjoys painting landscapes", List.of(), 2);

            List<MemoryRecord> candidates = repository.findCandidates(OWNER,
                    embedder.embed("basketball"), 1, clock.instant());

            assertThat(candidates).extracting(MemoryRecord::content).containsExactly("User likes basketball");
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("should stop returning a record once its retention has passed")
        void expiredExcluded() {
            service.storeMemory(OWNER, "User's name is Kunal", List.of("name"), 5);

            clock.advance(Duration.ofDays(181));

            MemoryContext ctx = service.retrieveRelevant(OWNER, "What is my name?", 8, ContextLevel.COMPREHENSIVE);
            assertThat(ctx.memories()).isEmpty();
            assertThat(ctx.personalFacts()).isEmpty();
            assertThat(service.fingerprint(OWNER)).isEqualTo(MemoryService.EMPTY_FINGERPRINT);
        }

        @Test
        @DisplayName("should set expiry to creation time plus retention")
        void expirySet() {
            MemoryRecord record = service.storeMemory(OWNER, "User likes chess", Set.of("Hobby"), 9);

            assertThat(record.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(180)));
            assertThat(record.importance()).isEqualTo(5);
            assertThat(record.tags()).containsExactly("hobby");
        }
    }

    @Nested
    @DisplayName("facts")
    class Facts {

        @Test
        @DisplayName("should supersede an older fact with the same tag")
        void supersedes() {
            service.storeFacts(OWNER, extractor.extract("My name is Kunal"));
            clock.advance(Duration.ofMinutes(5));
            service.storeFacts(OWNER, extractor.extract("Actually, call me Raj"));

            MemoryContext ctx = service.retrieveRelevant(OWNER, "What is my name?", 8, ContextLevel.COMPREHENSIVE);

            assertThat(ctx.personalFacts()).containsEntry("name", "Raj");
            assertThat(ctx.memories()).extracting(m -> m.record().content()).containsExactly("User's name is Raj");
        }

        @Test
        @DisplayName("should skip a fact that is already stored")
        void skipsDuplicate() {
            service.storeFacts(OWNER, extractor.extract("My name is Kunal"));

            List<MemoryRecord> second = service.storeFacts(OWNER, extractor.extract("my name is kunal"));

            assertThat(second).isEmpty();
            assertThat(repository.findActiveIds(OWNER, clock.instant())).hasSize(1);
        }
    }

    @Nested
    @DisplayName("context levels and budget")
    class Levels {

        @Test
        @DisplayName("should cap LIGHT context at two records")
        void light() {
            for (int i = 0; i < 5; i++) {
                service.storeMemory(OWNER, "Physics homework note " + i, List.of(), 3);
            }

            MemoryContext ctx = service.retrieveRelevant(OWNER, "physics homework", 5, ContextLevel.LIGHT,
                    QueryType.GENERAL);

            assertThat(ctx.memories()).hasSize(2);
        }

        @Test
        @DisplayName("should drop records below the similarity floor for general queries")
        void similarityFloor() {
            service.storeMemory(OWNER, "User enjoys baking sourdough bread", List.of(), 3);

            MemoryContext ctx = service.retrieveRelevant(OWNER, "explain quantum tunnelling", 5,
                    ContextLevel.COMPREHENSIVE, QueryType.GENERAL);

            assertThat(ctx.memories()).isEmpty();
            assertThat(ctx.contextString()).isEmpty();
        }

        @Test
        @DisplayName("should respect the token budget")
        void tokenBudget() {
            MemoryProperties tight = new MemoryProperties(Duration.ofDays(180),
                    new MemoryProperties.Weights(0.6, 0.25, 0.15), 0.35, 0.1, Duration.ofDays(30),
                    10, 200, Duration.ofDays(56), Duration.ofDays(365));
            MemoryService budgeted = service(tight, new HashingEmbeddingAdapter(1024));
            budgeted.storeMemory(OWNER, "Physics homework about the pendulum", List.of(), 3);
            budgeted.storeMemory(OWNER, "Physics homework about the inclined plane", List.of(), 3);

            MemoryContext ctx = budgeted.retrieveRelevant(OWNER, "physics homework", 5,
                    ContextLevel.COMPREHENSIVE, QueryType.GENERAL);

            assertThat(ctx.memories()).hasSize(1);
        }

        @Test
        @DisplayName("should append live summaries on COMPREHENSIVE only")
        void summaries() {
            service.storeMemory(OWNER, "Physics homework about the pendulum", List.of(), 3);
            MemorySummary summary = MemorySummary.builder()
                    .ownerId(OWNER)
                    .period(MemorySummary.Period.WEEKLY)
                    .periodStart(Instant.parse("2026-01-26T00:00:00Z"))
                    .summaryText("The user worked on pendulum problems.")
                    .sourceCount(3)
                    .expiresAt(Instant.parse("2026-03-23T00:00:00Z"))
                    .build();
            when(summaryRepository.findByOwnerIdAndExpiresAtAfterOrderByPeriodStartDesc(eq(OWNER), any()))
                    .thenReturn(List.of(summary));

            MemoryContext comprehensive = service.retrieveRelevant(OWNER, "physics homework", 5,
                    ContextLevel.COMPREHENSIVE, QueryType.GENERAL);
            MemoryContext balanced = service.retrieveRelevant(OWNER, "physics homework", 5,
                    ContextLevel.BALANCED, QueryType.GENERAL);

            assertThat(comprehensive.summaries()).hasSize(1);
            assertThat(comprehensive.contextString()).contains("Earlier conversation summaries:")
                    .contains("[weekly from 2026-01-26T00:00:00Z]");
            assertThat(balanced.summaries()).isEmpty();
        }
    }

    @Test
    @DisplayName("should change the fingerprint when memories change")
    void fingerprint() {
        String empty = service.fingerprint(OWNER);
        MemoryRecord first = service.storeMemory(OWNER, "User likes chess", List.of(), 3);
        String one = service.fingerprint(OWNER);
        service.deactivate(OWNER, first.id());
        String afterDeactivate = service.fingerprint(OWNER);

        assertThat(empty).isEqualTo(MemoryService.EMPTY_FINGERPRINT);
        assertThat(one).isNotEqualTo(empty).hasSize(64);
        assertThat(afterDeactivate).isEqualTo(MemoryService.EMPTY_FINGERPRINT);
        assertThat(service.fingerprint(OWNER)).isEqualTo(afterDeactivate);
    }

    @Test
    @DisplayName("should refuse to deactivate another owner's record")
    void deactivateOwnerScoped() {
        MemoryRecord record = service.storeMemory(OWNER, "User likes chess", List.of(), 3);

        assertThat(service.deactivate("intruder", record.id())).isFalse();
        assertThat(repository.findById(record.id()).orElseThrow().active()).isTrue();
    }

    @Test
    @DisplayName("should wrap embedding failures in MemoryRetrievalException")
    void embeddingFailure() {
        EmbeddingAdapter failing = mock(EmbeddingAdapter.class);
        when(failing.embed(anyString())).thenThrow(new EmbeddingClient.EmbeddingException("embedding API down"));
        MemoryService broken = service(MemoryProperties.defaults(), failing);

        assertThatThrownBy(() -> broken.retrieveRelevant(OWNER, "What is my name?", 8, ContextLevel.COMPREHENSIVE))
                .isInstanceOf(MemoryService.MemoryRetrievalException.class)
                .hasRootCauseMessage("embedding API down");
    }

    @Test
    @DisplayName("should reject blank owner or content when storing")
    void storeValidation() {
        assertThatThrownBy(() -> service.storeMemory(" ", "text", List.of(), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.storeMemory(OWNER, "", List.of(), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
