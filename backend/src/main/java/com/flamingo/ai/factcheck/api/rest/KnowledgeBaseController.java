package com.flamingo.ai.factcheck.api.rest;

import com.flamingo.ai.factcheck.api.dto.request.AddDocumentsRequest;
import com.flamingo.ai.factcheck.api.dto.response.KnowledgeBaseStatus;
import com.flamingo.ai.factcheck.service.knowledge.KnowledgeBaseService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the local knowledge base. */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeBaseController {

  private final KnowledgeBaseService knowledgeBaseService;

  /** Adds curated documents to the local index. */
  @PostMapping("/documents")
  public ResponseEntity<Map<String, Object>> addDocuments(
      @Valid @RequestBody AddDocumentsRequest request) {
    int indexed = knowledgeBaseService.addDocuments(request.getDocuments());
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("indexed", indexed));
  }

  @GetMapping("/status")
  public ResponseEntity<KnowledgeBaseStatus> status() {
    return ResponseEntity.ok(knowledgeBaseService.status());
  }
}
