package com.openforge.chatrouter.memory;

import com.openforge.chatrouter.domain.MemorySummary;
import com.openforge.chatrouter.repository.MemorySummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;

/**
 * Background housekeeping for long-term memory.
 *
 *   purgeExpired()       hourly    drop expired records and summaries
 *   weeklySummaries()    Mon 03:00 summarise last week per active owner
 *   monthlySummaries()   1st 04:00 summarise last month per active owner
 *
 * Schedules are UTC and overridable through {@code chat-router.memory.*-cron}.
 * One owner's failure is logged and does not stop the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MemoryMaintenanceJob {

    private final MemoryRepository        repository;
    private final MemorySummaryRepository summaryRepository;
    private final MemorySummaryService    summaryService;
    private final Clock                   clock;

    @Scheduled(cron = "${chat-router.memory.purge-cron:0 15 * * * *}", zone = "UTC")
    public void purgeExpired() {
        Instant now = clock.instant();
        long records   = repository.deleteExpired(now);
        int  summaries = summaryRepository.deleteExpired(now);
        if (records > 0 || summaries > 0) {
            log.info("[Memory] Purged {} expired records and {} expired summaries", records, summaries);
        }
    }

    @Scheduled(cron = "${chat-router.memory.weekly-summary-cron:0 0 3 * * MON}", zone = "UTC")
    public void weeklySummaries() {
        summarizeAll(MemorySummary.Period.WEEKLY);
    }

    @Scheduled(cron = "${chat-router.memory.monthly-summary-cron:0 0 4 1 * *}", zone = "UTC")
    public void monthlySummaries() {
        summarizeAll(MemorySummary.Period.MONTHLY);
    }

    int summarizeAll(MemorySummary.Period period) {
        Instant now   = clock.instant();
        Instant start = MemorySummaryService.previousPeriodStart(period, now);
        Set<String> owners = repository.findOwnersWithRecordsSince(start, now);

        int written = 0;
        for (String ownerId : owners) {
            try {
                if (summaryService.summarize(ownerId, period, start).isPresent()) {
                    written++;
                }
            } catch (RuntimeException e) {
                log.warn("[Memory] {} summary failed for owner {}: {}", period, ownerId, e.getMessage(), e);
            }
        }
        log.info("[Memory] {} summaries: {} written for {} active owners", period, written, owners.size());
        return written;
    }
}
