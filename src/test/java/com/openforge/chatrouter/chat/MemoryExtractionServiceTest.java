package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.memory.MemoryRecord;
import com.openforge.chatrouter.memory.MemoryService;
import com.openforge.chatrouter.memory.PersonalFactExtractor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryExtractionServiceTest {

    private static final String OWNER = "student-3";

    @Mock
    private MemoryService memoryService;

    private ExecutorService         executor;
    private MemoryExtractionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        service  = new MemoryExtractionService(memoryService, new PersonalFactExtractor(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static MemoryRecord record(String content, String tag) {
        return new MemoryRecord("id-" + tag, OWNER, content, List.of(), 3, Set.of(tag),
                Instant.EPOCH, Instant.EPOCH.plusSeconds(60), true);
    }

    @Test
    @DisplayName("should store facts found in the user's message")
    @SuppressWarnings("unchecked")
    void storesFacts() throws Exception {
        when(memoryService.storeFacts(eq(OWNER), anyList()))
                .thenReturn(List.of(record("User's name is Kunal", "name")));

        int stored = service.submit(OWNER, "req-1", "Hi, my name is Kunal").get(5, TimeUnit.SECONDS);

        ArgumentCaptor<List<PersonalFactExtractor.Fact>> facts = ArgumentCaptor.forClass(List.class);
        verify(memoryService).storeFacts(eq(OWNER), facts.capture());
        assertThat(facts.getValue()).extracting(PersonalFactExtractor.Fact::value).containsExactly("Kunal");
        assertThat(stored).isEqualTo(1);
        verify(memoryService, never()).storeMemory(anyString(), anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("should store an explicit remember request as a note")
    void remembersNote() throws Exception {
        when(memoryService.storeFacts(eq(OWNER), anyList())).thenReturn(List.of());
        when(memoryService.storeMemory(OWNER, "my exam is on the 12th", List.of("note"),
                MemoryExtractionService.NOTE_IMPORTANCE))
                .thenReturn(record("my exam is on the 12th", "note"));

        int stored = service.submit(OWNER, "req-2", "Please remember that my exam is on the 12th.")
                .get(5, TimeUnit.SECONDS);

        assertThat(stored).isEqualTo(1);
    }

    @Test
    @DisplayName("should complete with zero instead of failing when storage breaks")
    void failureIsContained() throws Exception {
        when(memoryService.storeFacts(eq(OWNER), anyList()))
                .thenThrow(new MemoryService.MemoryStoreException("store down", new RuntimeException()));

        int stored = service.submit(OWNER, "req-3", "My name is Kunal").get(5, TimeUnit.SECONDS);

        assertThat(stored).isZero();
    }
}
