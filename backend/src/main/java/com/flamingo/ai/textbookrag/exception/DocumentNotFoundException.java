package com.flamingo.ai.textbookrag.exception;

/** Thrown when a lookup or deletion names a document with no indexed chunks. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super("No chunks indexed for document '" + documentId + "'");
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
