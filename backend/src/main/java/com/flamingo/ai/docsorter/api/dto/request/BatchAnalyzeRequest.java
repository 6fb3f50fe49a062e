package com.flamingo.ai.docsorter.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analysing several documents at once. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAnalyzeRequest {

  @NotEmpty(message = "At least one item is required")
  @Size(max = 100, message = "At most 100 items per batch")
  private List<@Valid Item> items;

  private Boolean useAI;
  private Boolean forceAI;
  private Boolean useCache;
  private Boolean forceRefresh;

  @DecimalMin(value = "0.0", message = "Threshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Threshold must be between 0 and 1")
  private Double aiConfidenceThreshold;

  /** Concurrency of chunked processing. */
  @Min(value = 1, message = "Batch size must be at least 1")
  @Max(value = 20, message = "Batch size must not exceed 20")
  private Integer aiBatchSize;

  private String model;

  /** One document of a batch. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Item {
    private String filePath;

    @NotNull(message = "Text is required")
    private String text;

    private String model;
  }
}
