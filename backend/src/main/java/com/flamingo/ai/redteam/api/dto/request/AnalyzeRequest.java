package com.flamingo.ai.redteam.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analysing a batch of USLM documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  /** Bill the findings belong to, e.g. {@code 118-hr-1234}; {@code null} for existing code. */
  @Size(max = 64, message = "Bill id must be at most 64 characters")
  private String billId;

  @NotEmpty(message = "At least one document is required")
  private List<String> documents;
}
