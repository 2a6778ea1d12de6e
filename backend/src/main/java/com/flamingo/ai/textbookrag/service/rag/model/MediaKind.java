package com.flamingo.ai.textbookrag.service.rag.model;

/** Kind of non-text content that can be linked to a chunk. */
public enum MediaKind {
  IMAGE,
  TABLE
}
