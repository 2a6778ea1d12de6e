package com.flamingo.ai.textbookrag.service.rag.chunking;

import com.flamingo.ai.textbookrag.service.rag.model.CollectionKind;
import java.util.Optional;

/** Structural header families recognized in page text. */
public enum HeaderKind {
  CHAPTER(null),
  SECTION(null),
  THEOREM(null),
  DEFINITION(null),
  EXERCISE(CollectionKind.EXERCISE),
  EXAMPLE(CollectionKind.EXAMPLE),
  MISCELLANEOUS(CollectionKind.MISCELLANEOUS),
  SUMMARY(null);

  private final CollectionKind collectionKind;

  HeaderKind(CollectionKind collectionKind) {
    this.collectionKind = collectionKind;
  }

  /** The collection this header opens; empty for headers that only close one. */
  public Optional<CollectionKind> opensCollection() {
    return Optional.ofNullable(collectionKind);
  }
}
