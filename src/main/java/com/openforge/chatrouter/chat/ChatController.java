package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.chat.dto.ChatRequestBody;
import com.openforge.chatrouter.chat.dto.ChatResponseBody;
import com.openforge.chatrouter.chat.dto.HistoryResponse;
import com.openforge.chatrouter.domain.Conversation;
import com.openforge.chatrouter.llm.RequestCancelledException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for chat.
 *
 * Endpoints:
 *   POST /api/chat                           answer one message
 *   GET  /api/chat/{conversationId}/history  stored turns of a conversation
 *
 * The owner comes from the {@code X-Owner-Id} header, set by the gateway
 * that authenticated the caller.  A degraded answer is still HTTP 200 with
 * {@code degraded=true}; only invalid input maps to an error status.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final ChatOrchestrator           orchestrator;
    private final ConversationHistoryService historyService;

    @PostMapping
    public ResponseEntity<ChatResponseBody> chat(@RequestHeader(OWNER_HEADER) String ownerId,
                                                 @Valid @RequestBody ChatRequestBody req) {
        String conversationId = req.conversationId() != null && !req.conversationId().isBlank()
                ? req.conversationId()
                : UUID.randomUUID().toString();
        try {
            ChatResult result = orchestrator.handleChatRequest(ownerId, conversationId, req.message(), req.chatType());
            return ResponseEntity.ok(ChatResponseBody.from(conversationId, result));
        } catch (ChatRequestException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RequestCancelledException e) {
            log.info("[Chat] Request for conversation {} cancelled: {}", conversationId, e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Request cancelled");
        }
    }

    @GetMapping("/{conversationId}/history")
    public ResponseEntity<HistoryResponse> history(@RequestHeader(OWNER_HEADER) String ownerId,
                                                   @PathVariable String conversationId) {
        Conversation conversation = historyService.find(conversationId)
                .filter(c -> c.getOwnerId().equals(ownerId))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Conversation not found: " + conversationId));
        return ResponseEntity.ok(new HistoryResponse(
                conversation.getConversationId(),
                conversation.getChatType(),
                conversation.getTurnCount(),
                historyService.load(ownerId, conversationId)));
    }
}
