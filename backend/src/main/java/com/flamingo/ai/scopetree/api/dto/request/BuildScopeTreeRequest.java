package com.flamingo.ai.scopetree.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for building the scope tree of one file. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildScopeTreeRequest {

  @NotBlank(message = "File path is required")
  private String filePath;

  /** File contents; when absent the file is read from the server's disk. */
  private String fileText;

  @Valid private BuildOptionsRequest options;
}
