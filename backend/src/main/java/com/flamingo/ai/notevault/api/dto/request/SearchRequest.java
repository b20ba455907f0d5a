package com.flamingo.ai.notevault.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a semantic search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 500, message = "Query must not exceed 500 characters")
  private String query;

  /** Defaults to {@code vault.search.default-limit} when absent. */
  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 50, message = "Limit must not exceed 50")
  private Integer limit;

  /** Defaults to {@code vault.search.default-threshold} when absent. */
  @DecimalMin(value = "0.0", message = "Threshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Threshold must be between 0 and 1")
  private Double threshold;

  private List<String> tags;
}
