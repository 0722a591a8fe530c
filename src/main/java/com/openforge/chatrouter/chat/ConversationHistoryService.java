package com.openforge.chatrouter.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.chatrouter.domain.Conversation;
import com.openforge.chatrouter.llm.model.Message;
import com.openforge.chatrouter.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conversation history: the earlier user and assistant turns sent along
 * with each new message.
 *
 * Responsibilities:
 *   - Deserialize history from Conversation.history (JSON array in DB)
 *   - Append the new exchange after each answered request
 *   - Trim to the last {@code chat-router.chat.history-window} messages
 *
 * System prompts and memory blocks are rebuilt per request and never stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService {

    private static final TypeReference<List<Message>> MESSAGE_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper           objectMapper;
    private final ConversationRepository conversationRepository;
    private final ChatProperties         props;

    // ── Load ─────────────────────────────────────────────────────────────────

    /**
     * History of a conversation, oldest first.  Empty for a new conversation.
     *
     * @throws ChatRequestException if the conversation belongs to another owner
     */
    @Transactional(readOnly = true)
    public List<Message> load(String ownerId, String conversationId) {
        return conversationRepository.findByConversationId(conversationId)
                .map(c -> {
                    requireOwner(c, ownerId);
                    return parse(c);
                })
                .orElseGet(ArrayList::new);
    }

    public Optional<Conversation> find(String conversationId) {
        return conversationRepository.findByConversationId(conversationId);
    }

    // ── Append ───────────────────────────────────────────────────────────────

    /**
     * Appends messages to the conversation, creating it on first use, and
     * persists the trimmed history.
     */
    @Transactional
    public void append(String ownerId, String conversationId, String chatType, Message... messages) {
        Conversation conversation = conversationRepository.findByConversationId(conversationId)
                .orElseGet(() -> Conversation.builder()
                        .conversationId(conversationId)
                        .ownerId(ownerId)
                        .chatType(chatType)
                        .build());
        requireOwner(conversation, ownerId);

        List<Message> history = parse(conversation);
        history.addAll(List.of(messages));
        trim(history);

        try {
            conversation.setHistory(objectMapper.writeValueAsString(history));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize history for conversation " + conversationId, e);
        }
        conversation.setTurnCount(conversation.getTurnCount() + 1);
        conversationRepository.save(conversation);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Message> parse(Conversation conversation) {
        String json = conversation.getHistory();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, MESSAGE_LIST_TYPE));
        } catch (JsonProcessingException e) {
            log.error("[History] Failed to deserialize history for conversation {}: {}",
                    conversation.getConversationId(), e.getMessage());
            return new ArrayList<>();
        }
    }

    /** Sliding window: keep the most recent {@code historyWindow} messages. */
    private void trim(List<Message> history) {
        int max = Math.max(0, props.historyWindow());
        if (history.size() <= max) return;
        List<Message> tail = new ArrayList<>(history.subList(history.size() - max, history.size()));
        history.clear();
        history.addAll(tail);
        log.debug("[History] Trimmed history to {} messages", history.size());
    }

    private static void requireOwner(Conversation conversation, String ownerId) {
        if (!conversation.getOwnerId().equals(ownerId)) {
            throw new ChatRequestException("Conversation " + conversation.getConversationId()
                    + " belongs to another owner");
        }
    }
}
