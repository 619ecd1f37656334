package com.flamingo.ai.raggateway.api.rest;

import com.flamingo.ai.raggateway.api.dto.request.QueryRequest;
import com.flamingo.ai.raggateway.query.ChatEnvelope;
import com.flamingo.ai.raggateway.query.QueryRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for answering questions. */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

  private final QueryRouter queryRouter;

  /** Answers a question with the requested (or default) backend. */
  @PostMapping
  public ResponseEntity<ChatEnvelope> query(@Valid @RequestBody QueryRequest request) {
    ChatEnvelope envelope =
        queryRouter.route(
            request.getQuery(),
            request.getOrgId(),
            request.getRagVersion(),
            request.getConversationHistory());
    return ResponseEntity.ok(envelope);
  }
}
