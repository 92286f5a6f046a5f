package com.flamingo.ai.constitution.service.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.exception.SourceUnavailableException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/** Loads the constitution from a JSON resource ({@code classpath:} or {@code file:}). */
@Component
@Slf4j
public class JsonFileDocumentStore implements DocumentStore {

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String location;

  private volatile ConstitutionDocument document;
  private volatile Instant loadedAt;

  public JsonFileDocumentStore(
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper,
      Clock clock,
      ConstitutionProperties properties) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.location = properties.getSource().getLocation();
  }

  @Override
  public ConstitutionDocument get() {
    ConstitutionDocument current = document;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (document == null) {
        load();
      }
      return document;
    }
  }

  @Override
  public synchronized ConstitutionDocument reload() {
    log.info("Reloading constitution from {}", location);
    return load();
  }

  @Override
  public Optional<Instant> lastLoaded() {
    return Optional.ofNullable(loadedAt);
  }

  private ConstitutionDocument load() {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      log.error("Constitution source not found: {}", location);
      throw new SourceUnavailableException(location, "Constitution source not found: " + location);
    }

    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      log.error("Failed to read constitution source {}: {}", location, e.getMessage());
      throw new SourceUnavailableException(
          location, "Failed to read constitution source: " + e.getMessage(), e);
    }

    if (root == null || !root.isObject() || !root.path("chapters").isArray()) {
      log.error(
          "Malformed constitution source {}: expected an object with a chapters list", location);
      throw new SourceUnavailableException(
          location, "Malformed constitution source: expected an object with a chapters list");
    }

    ConstitutionDocument parsed;
    try {
      parsed = objectMapper.treeToValue(root, ConstitutionDocument.class);
    } catch (IOException e) {
      log.error("Malformed constitution source {}: {}", location, e.getMessage());
      throw new SourceUnavailableException(
          location, "Malformed constitution source: " + e.getMessage(), e);
    }
    validate(parsed);

    document = parsed;
    loadedAt = clock.instant();
    log.info(
        "Loaded constitution '{}' with {} chapters from {}",
        parsed.getTitle(),
        parsed.getChapters().size(),
        location);
    return parsed;
  }

  private void validate(ConstitutionDocument parsed) {
    Set<Integer> seen = new HashSet<>();
    for (Chapter chapter : parsed.getChapters()) {
      if (chapter.getChapterNumber() <= 0 || !seen.add(chapter.getChapterNumber())) {
        throw new SourceUnavailableException(
            location,
            "Malformed constitution source: invalid or duplicate chapter number "
                + chapter.getChapterNumber());
      }
    }
    if (parsed.getChapters().isEmpty()) {
      log.warn("Constitution source {} contains no chapters", location);
    }
  }
}
