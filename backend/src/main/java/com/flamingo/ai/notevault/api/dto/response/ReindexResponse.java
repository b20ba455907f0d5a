package com.flamingo.ai.notevault.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Response DTO for reindex requests. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReindexResponse(String message, int queuedCount) {}
