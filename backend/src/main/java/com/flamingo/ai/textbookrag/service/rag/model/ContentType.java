package com.flamingo.ai.textbookrag.service.rag.model;

import java.util.Locale;

/** Kinds of academic content a chunk can hold. */
public enum ContentType {
  TEXT,
  DEFINITION,
  THEOREM,
  PROOF,
  DERIVATION,
  EXAMPLE,
  EXERCISE,
  SOLUTION,
  TABLE,
  IMAGE,
  FORMULA;

  /** Lower-case wire name, e.g. {@code "definition"}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
