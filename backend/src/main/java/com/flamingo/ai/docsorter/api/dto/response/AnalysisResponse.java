package com.flamingo.ai.docsorter.api.dto.response;

import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private String filePath;
  private String clientName;
  private double clientConfidence;
  private String date;
  private double dateConfidence;
  private String docType;
  private double docTypeConfidence;
  private double overallConfidence;
  private List<String> snippets;
  private AnalysisSource source;
  private String title;
  private String suggestedFilename;

  public static AnalysisResponse from(
      DocumentAnalysis analysis, String filePath, String suggestedFilename) {
    return AnalysisResponse.builder()
        .filePath(filePath)
        .clientName(analysis.getClientName())
        .clientConfidence(analysis.getClientConfidence())
        .date(analysis.getDate())
        .dateConfidence(analysis.getDateConfidence())
        .docType(analysis.getDocType())
        .docTypeConfidence(analysis.getDocTypeConfidence())
        .overallConfidence(analysis.getOverallConfidence())
        .snippets(analysis.getSnippets())
        .source(analysis.getSource())
        .title(analysis.getTitle())
        .suggestedFilename(suggestedFilename)
        .build();
  }
}
