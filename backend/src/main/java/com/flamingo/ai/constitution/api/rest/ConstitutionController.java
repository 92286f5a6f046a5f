package com.flamingo.ai.constitution.api.rest;

import com.flamingo.ai.constitution.api.dto.response.ReloadResponse;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.service.ConstitutionService;
import com.flamingo.ai.constitution.service.content.ConstitutionOverview;
import com.flamingo.ai.constitution.service.content.NavigationStructure;
import com.flamingo.ai.constitution.service.content.Preamble;
import com.flamingo.ai.constitution.service.search.SearchEngine;
import com.flamingo.ai.constitution.service.search.SearchFilters;
import com.flamingo.ai.constitution.service.search.SearchRequest;
import com.flamingo.ai.constitution.service.search.SearchResponse;
import com.flamingo.ai.constitution.service.search.SearchSuggester;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for reading and searching the constitution. */
@RestController
@RequestMapping("/api/constitution")
@RequiredArgsConstructor
public class ConstitutionController {

  private final ConstitutionService constitutionService;
  private final SearchEngine searchEngine;
  private final SearchSuggester searchSuggester;

  /** Gets the document overview. */
  @GetMapping
  public ResponseEntity<ConstitutionOverview> getOverview() {
    return ResponseEntity.ok(constitutionService.getOverview());
  }

  /** Gets the full document. */
  @GetMapping("/document")
  public ResponseEntity<ConstitutionDocument> getDocument() {
    return ResponseEntity.ok(constitutionService.getDocument());
  }

  /** Gets the full preamble. */
  @GetMapping("/preamble")
  public ResponseEntity<Preamble> getPreamble(HttpServletRequest request) {
    return ResponseEntity.ok(
        constitutionService.getPreamble(ViewerContextResolver.resolve(request)));
  }

  /** Gets the chapter and article tree for navigation menus. */
  @GetMapping("/navigation")
  public ResponseEntity<NavigationStructure> getNavigation() {
    return ResponseEntity.ok(constitutionService.getNavigation());
  }

  /** Gets a chapter by number. */
  @GetMapping("/chapters/{chapterNumber}")
  public ResponseEntity<Chapter> getChapter(
      @PathVariable int chapterNumber, HttpServletRequest request) {
    return ResponseEntity.ok(
        constitutionService.getChapter(chapterNumber, ViewerContextResolver.resolve(request)));
  }

  /** Gets an article by chapter and article number. */
  @GetMapping("/chapters/{chapterNumber}/articles/{articleNumber}")
  public ResponseEntity<Article> getArticle(
      @PathVariable int chapterNumber,
      @PathVariable int articleNumber,
      HttpServletRequest request) {
    return ResponseEntity.ok(
        constitutionService.getArticle(
            chapterNumber, articleNumber, ViewerContextResolver.resolve(request)));
  }

  /** Searches every level of the document. */
  @GetMapping("/search")
  public ResponseEntity<SearchResponse> search(
      @RequestParam(name = "q", defaultValue = "") String query,
      @RequestParam(required = false) String chapter,
      @RequestParam(required = false) String article,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(defaultValue = "true") boolean highlight,
      @RequestParam(defaultValue = "false") boolean noCache,
      HttpServletRequest request) {
    SearchRequest searchRequest =
        SearchRequest.builder()
            .query(query)
            .filters(new SearchFilters(chapter, article))
            .limit(limit)
            .offset(offset)
            .highlight(highlight)
            .bypassCache(noCache)
            .viewer(ViewerContextResolver.resolve(request))
            .build();
    return ResponseEntity.ok(searchEngine.search(searchRequest));
  }

  /** Suggests queries for a partial search input. */
  @GetMapping("/search/suggestions")
  public ResponseEntity<List<String>> suggest(
      @RequestParam(name = "q", defaultValue = "") String query,
      @RequestParam(defaultValue = "5") int limit) {
    return ResponseEntity.ok(searchSuggester.suggest(query, limit));
  }

  /** Re-reads the document source. */
  @PostMapping("/reload")
  public ResponseEntity<ReloadResponse> reload() {
    return ResponseEntity.ok(ReloadResponse.fromDocument(constitutionService.reload()));
  }
}
