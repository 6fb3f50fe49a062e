package com.flamingo.ai.docsorter.service.heuristic;

/** Wires the heuristic components without a Spring context. */
public final class HeuristicTestSupport {

  private HeuristicTestSupport() {}

  public static HeuristicExtractor heuristicExtractor() {
    DateExtractor dateExtractor = new DateExtractor();
    DocumentTypeClassifier classifier = new DocumentTypeClassifier();
    ClientNameExtractor clientNameExtractor = new ClientNameExtractor();
    return new HeuristicExtractor(
        classifier,
        new TitleDetector(dateExtractor),
        dateExtractor,
        clientNameExtractor,
        new ConfidenceScorer(classifier, clientNameExtractor));
  }
}
