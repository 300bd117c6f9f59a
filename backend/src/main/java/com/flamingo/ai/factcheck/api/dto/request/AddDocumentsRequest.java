package com.flamingo.ai.factcheck.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for adding curated fact-check documents to the local index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddDocumentsRequest {

  @NotEmpty(message = "At least one document is required")
  @Size(max = 100, message = "At most 100 documents per request")
  private List<@Valid DocumentEntry> documents;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class DocumentEntry {

    @NotBlank(message = "Document content is required")
    private String content;

    @NotBlank(message = "Document source is required")
    private String source;

    private String url;
  }
}
