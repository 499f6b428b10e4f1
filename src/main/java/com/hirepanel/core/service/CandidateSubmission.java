package com.hirepanel.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hirepanel.core.model.PriorityKeyword;

import java.util.List;

/**
 * Inputs for one candidate evaluation.
 *
 * @param candidateName    display name, also the key for rejecting overlapping runs
 * @param resume           structured resume, passed verbatim into prompts
 * @param jobPosting       job posting text
 * @param priorityKeywords ranked keywords from the job posting analysis (may be empty)
 */
public record CandidateSubmission(
    String candidateName,
    JsonNode resume,
    String jobPosting,
    List<PriorityKeyword> priorityKeywords
) {

    public CandidateSubmission {
        if (candidateName == null || candidateName.isBlank()) {
            throw new IllegalArgumentException("candidateName is required");
        }
        jobPosting = jobPosting != null ? jobPosting : "";
        priorityKeywords = priorityKeywords != null ? List.copyOf(priorityKeywords) : List.of();
    }
}
