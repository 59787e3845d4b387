package com.flamingo.ai.scopetree.api.dto.response;

import com.flamingo.ai.scopetree.service.outline.OutlineEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a rendered outline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutlineResponse {

  private String filePath;
  private long totalValue;
  private int nodeCount;
  private List<OutlineEntry> entries;
}
