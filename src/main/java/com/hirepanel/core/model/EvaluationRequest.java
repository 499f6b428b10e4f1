package com.hirepanel.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything needed to evaluate one persona in one run. Consumed once.
 *
 * @param persona          the evaluating persona
 * @param candidateProfile structured resume data, passed into the prompt verbatim
 * @param jobPosting       job posting text
 * @param domainContext    classifier snippet for this persona (may be empty)
 * @param modelName        model used for every persona in the run
 * @param temperature      sampling temperature for the run
 */
public record EvaluationRequest(
    Persona persona,
    JsonNode candidateProfile,
    String jobPosting,
    String domainContext,
    String modelName,
    double temperature
) {}
