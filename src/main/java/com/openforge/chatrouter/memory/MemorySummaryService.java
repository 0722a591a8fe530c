package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.classifier.QueryClassification;
import com.openforge.chatrouter.domain.MemorySummary;
import com.openforge.chatrouter.llm.SendParams;
import com.openforge.chatrouter.repository.MemorySummaryRepository;
import com.openforge.chatrouter.router.FallbackRouter;
import com.openforge.chatrouter.router.RoutingRequest;
import com.openforge.chatrouter.router.RoutingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Compresses an owner's memory records for a finished week or month into a
 * {@link MemorySummary}, which "comprehensive" retrieval pulls in after the
 * individual records.
 *
 * The compression itself is an ordinary routed chat request, so it competes
 * for the same quotas and falls back the same way.  A degraded routing
 * result is never stored as a summary, and scheduled runs only look at the
 * latest finished period, so that period is left without one.
 */
@Slf4j
@Service
public class MemorySummaryService {

    static final int MAX_RECORDS_PER_SUMMARY = 100;

    private static final SendParams SUMMARY_PARAMS = new SendParams(0.3, 400);

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private static final String SYSTEM_PROMPT =
            "You compress notes about a student into a short factual summary. "
          + "Output plain prose only, no markdown, no preamble.";

    private static final String PROMPT_TEMPLATE = """
        Below are facts remembered about one user during the %s starting %s.
        Merge duplicates and keep stable personal facts (name, studies, goals, preferences) and notable events.
        Write at most five sentences in the third person ("The user ...").

        Facts:
        %s
        """;

    private final MemoryRepository        repository;
    private final MemorySummaryRepository summaryRepository;
    private final FallbackRouter          router;
    private final MemoryProperties        props;
    private final Clock                   clock;

    public MemorySummaryService(MemoryRepository repository,
                                MemorySummaryRepository summaryRepository,
                                FallbackRouter router,
                                MemoryProperties props,
                                Clock clock) {
        this.repository        = repository;
        this.summaryRepository = summaryRepository;
        this.router            = router;
        this.props             = props;
        this.clock             = clock;
    }

    /** Summarises the most recent complete week or month. */
    public Optional<MemorySummary> summarizePreviousPeriod(String ownerId, MemorySummary.Period period) {
        return summarize(ownerId, period, previousPeriodStart(period, clock.instant()));
    }

    /**
     * Builds or replaces the summary of one period.
     *
     * @return empty when the period has no records or every provider failed
     */
    public Optional<MemorySummary> summarize(String ownerId, MemorySummary.Period period, Instant periodStart) {
        Instant now = clock.instant();
        Instant end = periodEnd(period, periodStart);
        List<MemoryRecord> records = repository.findCreatedBetween(ownerId, periodStart, end, now);
        if (records.isEmpty()) {
            log.debug("[Summary] No records for owner {} in {} period from {}", ownerId, period, periodStart);
            return Optional.empty();
        }

        StringBuilder facts = new StringBuilder();
        records.stream()
               .sorted((a, b) -> a.createdAt().compareTo(b.createdAt()))
               .limit(MAX_RECORDS_PER_SUMMARY)
               .forEach(r -> facts.append("- (importance ").append(r.importance()).append(") ")
                                  .append(r.content()).append('\n'));

        String label = period == MemorySummary.Period.WEEKLY ? "week" : "month";
        RoutingResult result = router.route(new RoutingRequest(
                "summary-" + UUID.randomUUID(),
                QueryClassification.general(),
                SYSTEM_PROMPT,
                null,
                List.of(),
                PROMPT_TEMPLATE.formatted(label, periodStart, facts),
                SUMMARY_PARAMS));

        if (result.degraded()) {
            log.warn("[Summary] No provider available; {} period from {} for owner {} stays unsummarised",
                    period, periodStart, ownerId);
            return Optional.empty();
        }

        String text = CODE_FENCE.matcher(result.text().trim()).replaceAll("").trim();
        if (text.isEmpty()) {
            log.warn("[Summary] Empty summary from {} for owner {}", result.providerId(), ownerId);
            return Optional.empty();
        }

        MemorySummary summary = summaryRepository
                .findByOwnerIdAndPeriodAndPeriodStart(ownerId, period, periodStart)
                .orElseGet(() -> MemorySummary.builder()
                        .ownerId(ownerId)
                        .period(period)
                        .periodStart(periodStart)
                        .build());
        summary.setSummaryText(text);
        summary.setSourceCount(records.size());
        summary.setExpiresAt(periodStart.plus(retentionFor(period)));

        MemorySummary saved = summaryRepository.save(summary);
        log.info("[Summary] {} summary for owner {} from {} ({} records, via {})",
                period, ownerId, periodStart, records.size(), result.providerId());
        return Optional.of(saved);
    }

    // ── Period arithmetic (UTC) ──────────────────────────────────────────────

    static Instant previousPeriodStart(MemorySummary.Period period, Instant now) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate start = switch (period) {
            case WEEKLY  -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
            case MONTHLY -> today.withDayOfMonth(1).minusMonths(1);
        };
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    static Instant periodEnd(MemorySummary.Period period, Instant start) {
        LocalDate day = start.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate end = switch (period) {
            case WEEKLY  -> day.plusWeeks(1);
            case MONTHLY -> day.plusMonths(1);
        };
        return end.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private Duration retentionFor(MemorySummary.Period period) {
        return period == MemorySummary.Period.WEEKLY
                ? props.weeklySummaryRetention()
                : props.monthlySummaryRetention();
    }
}
