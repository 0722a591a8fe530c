package com.openforge.chatrouter.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/** Request body for POST /api/providers/{id}/cooldown. */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record CooldownRequest(
        @Min(1) @Max(86_400) long seconds
) {}
