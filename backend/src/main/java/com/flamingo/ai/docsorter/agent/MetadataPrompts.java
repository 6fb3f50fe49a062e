package com.flamingo.ai.docsorter.agent;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompt text for language-model metadata extraction.
 *
 * <p>The single-document prompt asks for one JSON object with the seven metadata fields. The
 * batch prompt wraps one such object per document in a {@code documents} array, in input order.
 */
public final class MetadataPrompts {

  public static final String TRUNCATION_MARKER = "\n\n[Text truncated...]";

  static final String DOCUMENT_SEPARATOR = "\n\n" + "=".repeat(50) + "\n\n";

  public static final String SYSTEM_PROMPT =
      """
      You are a document metadata extraction assistant. Analyze document text and extract the
      client, the document date and the document type.

      REQUIREMENTS:
      1. Respond with ONLY valid JSON, no text before or after it.
      2. Use exactly the field names below.
      3. Confidence scores are numbers between 0.0 and 1.0.
      4. When information is not found use null for the value and 0.0 for its confidence.
      5. Quote short text snippets that support your findings.

      REQUIRED JSON STRUCTURE:
      {
        "clientName": "string or null",
        "clientConfidence": 0.0,
        "date": "YYYY-MM-DD or null",
        "dateConfidence": 0.0,
        "docType": "string or null",
        "docTypeConfidence": 0.0,
        "snippets": ["supporting text"]
      }

      FIELD GUIDELINES:
      - clientName: company, organization or person the document is addressed to or issued by
      - date: the document date in YYYY-MM-DD format
      - docType: one of Invoice, Receipt, Contract, Statement, Report, Proposal, Resume, Letter,
        Tax Document, Legal Document, or another short type name
      - snippets: 1 to 3 short excerpts from the text

      EXAMPLES:

      Input: "INVOICE #12345\\nAcme Corporation\\nInvoice Date: January 15, 2024\\nDue: $1,500"
      Output: {"clientName": "Acme Corporation", "clientConfidence": 0.95, "date": "2024-01-15",
      "dateConfidence": 0.90, "docType": "Invoice", "docTypeConfidence": 0.98,
      "snippets": ["INVOICE #12345", "Invoice Date: January 15, 2024"]}

      Input: "SERVICE AGREEMENT\\nBetween ABC Company and XYZ Corp\\nEffective Date: March 1, 2024"
      Output: {"clientName": "ABC Company", "clientConfidence": 0.85, "date": "2024-03-01",
      "dateConfidence": 0.80, "docType": "Contract", "docTypeConfidence": 0.90,
      "snippets": ["SERVICE AGREEMENT", "Effective Date: March 1, 2024"]}

      Input: "Random text with no clear structure or identifiable information"
      Output: {"clientName": null, "clientConfidence": 0.0, "date": null, "dateConfidence": 0.0,
      "docType": null, "docTypeConfidence": 0.0, "snippets": []}
      """;

  private MetadataPrompts() {}

  /**
   * Builds the user message for a single document.
   *
   * @param text document text
   * @param maxChars truncation limit
   * @return user prompt
   */
  public static String userPrompt(String text, int maxChars) {
    return """
        Extract the metadata from this document and respond with the JSON object only.

        Document text:
        """
        + truncate(text, maxChars);
  }

  /**
   * Builds the user message for several documents answered in one call.
   *
   * @param texts document texts in input order
   * @param maxCharsPerDocument per-document truncation limit
   * @return user prompt
   */
  public static String batchUserPrompt(List<String> texts, int maxCharsPerDocument) {
    String documents =
        IntStream.range(0, texts.size())
            .mapToObj(
                i -> "Document " + (i + 1) + ":\n" + truncate(texts.get(i), maxCharsPerDocument))
            .collect(Collectors.joining(DOCUMENT_SEPARATOR));

    return """
        Extract the metadata from each of the %d documents below. Respond with ONLY a JSON object
        of the form {"documents": [ ... ]} holding exactly one metadata object per document, in
        the same order as the documents appear.

        %s
        """
        .formatted(texts.size(), documents);
  }

  static String truncate(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    if (text.length() <= maxChars) {
      return text;
    }
    return text.substring(0, maxChars) + TRUNCATION_MARKER;
  }
}
