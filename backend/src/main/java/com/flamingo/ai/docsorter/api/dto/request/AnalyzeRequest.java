package com.flamingo.ai.docsorter.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analysing one document. Unset options fall back to configuration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  private String filePath;

  @NotNull(message = "Text is required")
  @Size(max = 1_000_000, message = "Text must not exceed 1000000 characters")
  private String text;

  private Boolean useAI;
  private Boolean forceAI;
  private Boolean useCache;
  private Boolean forceRefresh;

  @DecimalMin(value = "0.0", message = "Threshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Threshold must be between 0 and 1")
  private Double aiConfidenceThreshold;

  private String model;
}
