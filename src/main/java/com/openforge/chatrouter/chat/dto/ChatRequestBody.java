package com.openforge.chatrouter.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/chat.
 *
 * @param conversationId optional; if null the server generates a UUID
 * @param chatType       e.g. "study_assistant"; defaults to "general"
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatRequestBody(

        @NotBlank(message = "message must not be blank")
        @Size(max = 8000, message = "message must not exceed 8000 characters")
        String message,

        String conversationId,

        String chatType
) {}
