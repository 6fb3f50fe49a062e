package com.flamingo.ai.docsorter.service.cache;

import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.time.Instant;
import java.util.List;

/** Serialized form of one cache entry. */
public record CacheSnapshotEntry(
    String key,
    Instant insertedAt,
    Instant lastAccessedAt,
    String clientName,
    double clientConfidence,
    String date,
    double dateConfidence,
    String docType,
    double docTypeConfidence,
    List<String> snippets,
    AnalysisSource source) {

  static CacheSnapshotEntry from(
      String key, DocumentAnalysis analysis, Instant insertedAt, Instant lastAccessedAt) {
    return new CacheSnapshotEntry(
        key,
        insertedAt,
        lastAccessedAt,
        analysis.getClientName(),
        analysis.getClientConfidence(),
        analysis.getDate(),
        analysis.getDateConfidence(),
        analysis.getDocType(),
        analysis.getDocTypeConfidence(),
        analysis.getSnippets(),
        analysis.getSource());
  }

  DocumentAnalysis toAnalysis() {
    return DocumentAnalysis.builder()
        .clientName(clientName)
        .clientConfidence(clientConfidence)
        .date(date)
        .dateConfidence(dateConfidence)
        .docType(docType)
        .docTypeConfidence(docTypeConfidence)
        .snippets(snippets)
        .source(source != null ? source : AnalysisSource.AI)
        .textHash(key)
        .build();
  }
}
