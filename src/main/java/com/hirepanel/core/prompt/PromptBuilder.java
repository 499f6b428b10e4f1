package com.hirepanel.core.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.Criterion;
import com.hirepanel.core.model.EvaluationRequest;
import com.hirepanel.core.model.Persona;
import org.springframework.stereotype.Component;

/**
 * Composes the persona-specific evaluation prompt: persona profile, a shared scoring
 * rubric, the numbered criteria, the classifier's domain context, then the job posting
 * and resume verbatim.
 * <p>
 * Output format is not described here; the response schema is sent to the backend
 * alongside the prompt.
 */
@Component
public class PromptBuilder {

    static final String SCORING_FRAMEWORK = """
            ## Evaluation Task

            **COMPETITIVE FRAMEWORK**: You are evaluating this candidate against other director-level candidates in today's hyper-competitive market.

            **SCORING RUBRIC (1-10):**
            - **1-3 = Reject**: Missing core requirements, red flags, poor fit
            - **4-5 = Weak**: Some qualifications but significant gaps or concerns
            - **6-7 = Solid**: Meets requirements but not exceptional, average candidate
            - **8-9 = Strong**: Exceeds requirements, top 20% candidate
            - **10 = Exceptional**: Best-in-class, transformational hire

            **CALIBRATION**: Most candidates score 4-7. Only give 8+ if you'd genuinely hire them over 80% of other director-level candidates. Be specific about gaps and weaknesses - this feedback helps candidates improve.

            Review the attached resume against the job posting and score using this rubric. Focus particularly on your areas of expertise:""";

    private final ObjectMapper objectMapper;

    public PromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String build(EvaluationRequest request) {
        Persona persona = request.persona();
        var sb = new StringBuilder();

        sb.append("## Persona: ").append(persona.displayName()).append("\n\n");
        if (!persona.background().isEmpty()) {
            sb.append("### Your Background:\n");
            persona.background().forEach(b -> sb.append("- ").append(b).append('\n'));
            sb.append('\n');
        }
        if (!persona.evaluationApproach().isBlank()) {
            sb.append("### Your Evaluation Approach:\n").append(persona.evaluationApproach()).append("\n\n");
        }

        sb.append(SCORING_FRAMEWORK).append("\n\n");

        int i = 1;
        for (Criterion criterion : persona.criteria()) {
            sb.append("### ").append(i++).append(". ").append(criterion.title()).append(" (1-10)\n\n");
            if (!criterion.description().isBlank()) {
                sb.append(criterion.description()).append("\n\n");
            }
            criterion.bullets().forEach(b -> sb.append("- ").append(b).append('\n'));
            sb.append('\n');
        }

        String domainContext = request.domainContext();
        if (domainContext != null && !domainContext.isBlank()) {
            sb.append(domainContext).append('\n');
        }

        sb.append("## Job Posting:\n").append(request.jobPosting() != null ? request.jobPosting() : "").append("\n\n");
        sb.append("## Resume:\n").append(renderProfile(request)).append("\n\n");

        String focus = persona.focus().isBlank() ? "your areas of expertise" : persona.focus();
        sb.append("Please provide your detailed evaluation focusing on ").append(focus).append('.');
        return sb.toString();
    }

    private String renderProfile(EvaluationRequest request) {
        if (request.candidateProfile() == null) {
            return "{}";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.candidateProfile());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render candidate profile: " + e.getOriginalMessage(), e);
        }
    }
}
