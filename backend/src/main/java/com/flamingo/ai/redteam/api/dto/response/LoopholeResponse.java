package com.flamingo.ai.redteam.api.dto.response;

import com.flamingo.ai.redteam.service.loophole.Finding;
import com.flamingo.ai.redteam.service.loophole.LoopholeType;
import com.flamingo.ai.redteam.service.loophole.Severity;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a finding, shaped like a row of the loopholes table. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopholeResponse {

  private String billId;
  private LoopholeType type;
  private Severity severity;
  private String description;
  private List<String> affectedSections;
  private boolean reviewed;

  /** Creates a LoopholeResponse from a finding; {@code reviewed} always starts out false. */
  public static LoopholeResponse fromFinding(String billId, Finding finding) {
    return LoopholeResponse.builder()
        .billId(billId)
        .type(finding.type())
        .severity(finding.severity())
        .description(finding.description())
        .affectedSections(finding.affectedNodes())
        .reviewed(false)
        .build();
  }
}
