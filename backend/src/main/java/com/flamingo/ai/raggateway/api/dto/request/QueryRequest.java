package com.flamingo.ai.raggateway.api.dto.request;

import com.flamingo.ai.raggateway.query.ConversationTurn;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  @NotBlank(message = "Organization id is required")
  private String orgId;

  /** "v1" or "v2". If null, uses the configured default. */
  private String ragVersion;

  private List<ConversationTurn> conversationHistory;
}
