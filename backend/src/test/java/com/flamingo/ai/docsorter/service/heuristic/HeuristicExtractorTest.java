package com.flamingo.ai.docsorter.service.heuristic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.service.cache.ContentHasher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HeuristicExtractorTest {

  private static final String INVOICE =
      "INVOICE #12345\nBill to: Acme Corporation\nInvoice Date: January 15, 2024";

  private final HeuristicExtractor extractor = HeuristicTestSupport.heuristicExtractor();

  @Test
  @DisplayName("should extract type, client and date from a simple invoice")
  void shouldExtractAllFields_whenInvoiceText() {
    DocumentAnalysis analysis = extractor.extract(INVOICE, "invoice.txt");

    assertThat(analysis.getDocType()).isEqualTo("Invoice");
    assertThat(analysis.getClientName()).isEqualTo("Acme Corporation");
    assertThat(analysis.getDate()).isEqualTo("2024-01-15");
    assertThat(analysis.getOverallConfidence()).isGreaterThan(0.5);
    assertThat(analysis.getSource()).isEqualTo(AnalysisSource.REGEX);
    assertThat(analysis.getTextHash()).isEqualTo(ContentHasher.sha256Hex(INVOICE));
    assertThat(analysis.hasAllFields()).isTrue();
  }

  @Test
  @DisplayName("should keep evidence lines as snippets")
  void shouldCollectSnippets_whenFieldsFound() {
    DocumentAnalysis analysis = extractor.extract(INVOICE, "invoice.txt");

    assertThat(analysis.getSnippets())
        .contains("Bill to: Acme Corporation", "Invoice Date: January 15, 2024")
        .doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("should return an empty unclassified result for blank text")
  void shouldReturnEmpty_whenTextBlank() {
    DocumentAnalysis analysis = extractor.extract("   \n\t ", "blank.txt");

    assertThat(analysis.getDocType()).isEqualTo(DocumentAnalysis.UNCLASSIFIED);
    assertThat(analysis.getClientName()).isNull();
    assertThat(analysis.getDate()).isNull();
    assertThat(analysis.getOverallConfidence()).isZero();
    assertThat(analysis.getSource()).isEqualTo(AnalysisSource.REGEX);
  }

  @Test
  @DisplayName("should leave fields empty when the text has no recognisable evidence")
  void shouldReturnUnclassified_whenNoEvidence() {
    DocumentAnalysis analysis =
        extractor.extract("lorem ipsum dolor sit amet\nconsectetur adipiscing elit", null);

    assertThat(analysis.getDocType()).isEqualTo(DocumentAnalysis.UNCLASSIFIED);
    assertThat(analysis.getDocTypeConfidence()).isZero();
    assertThat(analysis.getDate()).isNull();
    assertThat(analysis.getDateConfidence()).isZero();
  }

  @Test
  @DisplayName("should never throw on unusual input")
  void shouldNotThrow_whenInputIsOdd() {
    assertThatCode(() -> extractor.extract(null, null)).doesNotThrowAnyException();
    assertThatCode(() -> extractor.extract("\u0000\uffff///--::", "x")).doesNotThrowAnyException();
    assertThatCode(() -> extractor.extract("Bill to:", "x")).doesNotThrowAnyException();
    assertThatCode(() -> extractor.extract("99/99/9999 13-13-13", "x"))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should keep every confidence within [0, 1]")
  void shouldBoundConfidences() {
    String text =
        "INVOICE\nINVOICE\nInvoice number 1\nBilled to: Globex LLC\nBill to: Globex LLC\n"
            + "Amount due: 100\nPayment due: 2024-03-01\nTotal amount: 100\n"
            + "Invoice invoice invoice";

    DocumentAnalysis analysis = extractor.extract(text, "many.txt");

    assertThat(analysis.getClientConfidence()).isBetween(0.0, 1.0);
    assertThat(analysis.getDateConfidence()).isBetween(0.0, 1.0);
    assertThat(analysis.getDocTypeConfidence()).isBetween(0.0, 1.0);
    assertThat(analysis.getOverallConfidence()).isBetween(0.0, 1.0);
  }
}
