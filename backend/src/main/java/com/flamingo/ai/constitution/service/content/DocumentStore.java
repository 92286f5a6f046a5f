package com.flamingo.ai.constitution.service.content;

import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import java.time.Instant;
import java.util.Optional;

/** Durable source of the constitution document. */
public interface DocumentStore {

  /**
   * Returns the document, loading it from the source on first use.
   *
   * @return the parsed document
   * @throws com.flamingo.ai.constitution.exception.SourceUnavailableException if the source is
   *     missing or malformed
   */
  ConstitutionDocument get();

  /**
   * Re-reads the source, replacing the held document.
   *
   * @return the freshly parsed document
   * @throws com.flamingo.ai.constitution.exception.SourceUnavailableException if the source is
   *     missing or malformed; the previously held document is kept
   */
  ConstitutionDocument reload();

  /** Time of the last successful load, if any. */
  Optional<Instant> lastLoaded();
}
