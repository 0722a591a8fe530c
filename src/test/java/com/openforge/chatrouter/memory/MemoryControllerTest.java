package com.openforge.chatrouter.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MemoryControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-14T09:00:00Z");

    @Mock
    private MemoryService memoryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MemoryController(memoryService))
                .defaultRequest(get("/").accept(MediaType.APPLICATION_JSON))
                .build();
    }

    private static MemoryRecord nameRecord() {
        return new MemoryRecord("m-1", "u1", "User's name is Kunal", List.of(), 5, Set.of("name"),
                NOW, NOW.plusSeconds(3600), true);
    }

    @Test
    @DisplayName("should store a memory with default importance and return 201")
    void store() throws Exception {
        when(memoryService.storeMemory(eq("u1"), eq("I like chess"), anyCollection(), eq(3)))
                .thenReturn(new MemoryRecord("m-2", "u1", "I like chess", List.of(), 3, Set.of(),
                        NOW, null, true));

        mockMvc.perform(post("/api/memories")
                        .header(MemoryController.OWNER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"I like chess\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("m-2"))
                .andExpect(jsonPath("$.importance").value(3));
    }

    @Test
    @DisplayName("should reject blank content without touching the store")
    void blankContent() throws Exception {
        mockMvc.perform(post("/api/memories")
                        .header(MemoryController.OWNER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(memoryService);
    }

    @Test
    @DisplayName("should map a store failure to 503")
    void storeUnavailable() throws Exception {
        when(memoryService.storeMemory(eq("u1"), eq("note"), anyCollection(), anyInt()))
                .thenThrow(new MemoryService.MemoryStoreException("down", new IllegalStateException("milvus")));

        mockMvc.perform(post("/api/memories")
                        .header(MemoryController.OWNER_HEADER, "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"note\",\"importance\":2}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("should return ranked memories and personal facts from a search")
    void search() throws Exception {
        MemoryContext ctx = new MemoryContext(
                List.of(new ScoredMemory(nameRecord(), 0.82, 0.9, true)),
                List.of(),
                "- User's name is Kunal",
                Map.of("name", "Kunal"),
                "fp",
                new MemoryContext.Stats(3, 1, 1, 6, 4L));
        when(memoryService.retrieveRelevant("u1", "what is my name", 5, ContextLevel.LIGHT)).thenReturn(ctx);

        mockMvc.perform(get("/api/memories/search")
                        .header(MemoryController.OWNER_HEADER, "u1")
                        .param("q", "what is my name")
                        .param("level", "light"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memories[0].id").value("m-1"))
                .andExpect(jsonPath("$.memories[0].forced").value(true))
                .andExpect(jsonPath("$.personalFacts.name").value("Kunal"))
                .andExpect(jsonPath("$.summaryCount").value(0));
    }

    @Test
    @DisplayName("should reject an unknown context level")
    void unknownLevel() throws Exception {
        mockMvc.perform(get("/api/memories/search")
                        .header(MemoryController.OWNER_HEADER, "u1")
                        .param("q", "anything")
                        .param("level", "exhaustive"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(memoryService);
    }

    @Test
    @DisplayName("should return 404 when deactivating a memory the owner does not have")
    void deactivate() throws Exception {
        when(memoryService.deactivate("u1", "m-1")).thenReturn(true);
        when(memoryService.deactivate("u1", "m-9")).thenReturn(false);

        mockMvc.perform(delete("/api/memories/m-1").header(MemoryController.OWNER_HEADER, "u1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/memories/m-9").header(MemoryController.OWNER_HEADER, "u1"))
                .andExpect(status().isNotFound());
    }
}
