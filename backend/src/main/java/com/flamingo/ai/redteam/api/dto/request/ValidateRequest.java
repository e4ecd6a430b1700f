package com.flamingo.ai.redteam.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for validating one USLM document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateRequest {

  @NotNull(message = "XML is required")
  private String xml;
}
