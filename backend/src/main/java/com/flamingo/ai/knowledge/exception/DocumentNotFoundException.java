package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a document is not found. */
public class DocumentNotFoundException extends KnowledgeRetrievalException {

  private final UUID documentId;

  public DocumentNotFoundException(UUID documentId) {
    super("Document not found: " + documentId, "The document does not exist.");
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
