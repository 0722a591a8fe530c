package com.openforge.chatrouter.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.chatrouter.llm.model.Message;

import java.util.List;

/** Response body for GET /api/chat/{conversationId}/history. */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record HistoryResponse(
        String        conversationId,
        String        chatType,
        int           turnCount,
        List<Message> messages
) {}
