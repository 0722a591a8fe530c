package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.domain.MemorySummary;
import com.openforge.chatrouter.repository.MemorySummaryRepository;
import com.openforge.chatrouter.router.FallbackRouter;
import com.openforge.chatrouter.router.RoutingRequest;
import com.openforge.chatrouter.router.RoutingResult;
import com.openforge.chatrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemorySummaryServiceTest {

    private static final String  OWNER      = "student-7";
    private static final Instant WEEK_START = Instant.parse("2026-10-05T00:00:00Z");

    @Mock
    private MemorySummaryRepository summaryRepository;

    @Mock
    private FallbackRouter router;

    private MutableClock             clock;
    private InMemoryMemoryRepository repository;
    private MemorySummaryService     service;

    @BeforeEach
    void setUp() {
        clock      = new MutableClock(Instant.parse("2026-10-14T10:00:00Z"));
        repository = new InMemoryMemoryRepository();
        service    = new MemorySummaryService(repository, summaryRepository, router,
                MemoryProperties.defaults(), clock);
    }

    private void storeAt(String content, Instant createdAt) {
        repository.save(new MemoryRecord(content.hashCode() + "", OWNER, content, List.of(1f), 3, Set.of(),
                createdAt, createdAt.plus(Duration.ofDays(180)), true));
    }

    @Nested
    @DisplayName("summarize")
    class Summarize {

        @Test
        @DisplayName("should store the routed summary for the week's records")
        void storesSummary() {
            storeAt("User's name is Kunal", WEEK_START.plus(Duration.ofDays(1)));
            storeAt("User is studying organic chemistry", WEEK_START.plus(Duration.ofDays(3)));
            storeAt("Outside the week", WEEK_START.minus(Duration.ofDays(2)));
            when(router.route(any())).thenReturn(new RoutingResult(
                    "```\nThe user, Kunal, studies organic chemistry.\n```", "groq", "llama", 1, 20, 30, false, List.of()));
            when(summaryRepository.findByOwnerIdAndPeriodAndPeriodStart(OWNER, MemorySummary.Period.WEEKLY, WEEK_START))
                    .thenReturn(Optional.empty());
            when(summaryRepository.save(any(MemorySummary.class))).thenAnswer(inv -> inv.getArgument(0));

            Optional<MemorySummary> summary = service.summarizePreviousPeriod(OWNER, MemorySummary.Period.WEEKLY);

            assertThat(summary).isPresent();
            assertThat(summary.get().getSummaryText()).isEqualTo("The user, Kunal, studies organic chemistry.");
            assertThat(summary.get().getSourceCount()).isEqualTo(2);
            assertThat(summary.get().getPeriodStart()).isEqualTo(WEEK_START);
            assertThat(summary.get().getExpiresAt()).isEqualTo(WEEK_START.plus(Duration.ofDays(56)));

            ArgumentCaptor<RoutingRequest> request = ArgumentCaptor.forClass(RoutingRequest.class);
            verify(router).route(request.capture());
            assertThat(request.getValue().message())
                    .contains("User's name is Kunal")
                    .doesNotContain("Outside the week");
        }

        @Test
        @DisplayName("should not store anything when every provider failed")
        void degradedNotStored() {
            storeAt("User's name is Kunal", WEEK_START.plus(Duration.ofDays(1)));
            when(router.route(any())).thenReturn(RoutingResult.degraded("sorry", 5, List.of()));

            Optional<MemorySummary> summary = service.summarize(OWNER, MemorySummary.Period.WEEKLY, WEEK_START);

            assertThat(summary).isEmpty();
            verify(summaryRepository, never()).save(any());
        }

        @Test
        @DisplayName("should skip a period without records")
        void emptyPeriod() {
            Optional<MemorySummary> summary = service.summarize(OWNER, MemorySummary.Period.MONTHLY,
                    Instant.parse("2026-09-01T00:00:00Z"));

            assertThat(summary).isEmpty();
            verifyNoInteractions(router, summaryRepository);
        }
    }

    @Nested
    @DisplayName("period arithmetic")
    class Periods {

        @Test
        @DisplayName("should start the previous week on Monday UTC")
        void previousWeek() {
            assertThat(MemorySummaryService.previousPeriodStart(MemorySummary.Period.WEEKLY, clock.instant()))
                    .isEqualTo(WEEK_START);
            assertThat(MemorySummaryService.periodEnd(MemorySummary.Period.WEEKLY, WEEK_START))
                    .isEqualTo(Instant.parse("2026-10-12T00:00:00Z"));
        }

        @Test
        @DisplayName("should start the previous month on the first UTC")
        void previousMonth() {
            Instant start = MemorySummaryService.previousPeriodStart(MemorySummary.Period.MONTHLY, clock.instant());

            assertThat(start).isEqualTo(Instant.parse("2026-09-01T00:00:00Z"));
            assertThat(MemorySummaryService.periodEnd(MemorySummary.Period.MONTHLY, start))
                    .isEqualTo(Instant.parse("2026-10-01T00:00:00Z"));
        }
    }
}
