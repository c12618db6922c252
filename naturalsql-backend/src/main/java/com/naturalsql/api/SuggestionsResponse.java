package com.naturalsql.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for request suggestions.
 */
@Data
@Builder
public class SuggestionsResponse {
    private String currentRequest;
    private List<String> suggestions;
    private List<SimilarRequestResponse> similarRequests;
}
