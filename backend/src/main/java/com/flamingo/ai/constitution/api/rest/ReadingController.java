package com.flamingo.ai.constitution.api.rest;

import com.flamingo.ai.constitution.api.dto.response.ReadingThresholdResponse;
import com.flamingo.ai.constitution.service.reading.ReadingCompletionEstimator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for reading-progress support. */
@RestController
@RequestMapping("/api/constitution/reading")
@RequiredArgsConstructor
public class ReadingController {

  private final ReadingCompletionEstimator readingCompletionEstimator;

  /** Gets the completion threshold for a chapter or article. */
  @GetMapping("/threshold")
  public ResponseEntity<ReadingThresholdResponse> getThreshold(
      @RequestParam String itemType, @RequestParam String reference) {
    double minutes = readingCompletionEstimator.thresholdMinutes(itemType, reference);
    return ResponseEntity.ok(new ReadingThresholdResponse(itemType, reference, minutes));
  }
}
