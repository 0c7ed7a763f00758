package com.newsroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterIssuesResponse(List<NewsletterIssueSummary> issues) {
  public NewsletterIssuesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応
    issues = issues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(issues));
  }
}
