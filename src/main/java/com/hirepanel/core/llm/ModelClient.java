package com.hirepanel.core.llm;

/**
 * Sends one schema-constrained prompt to the inference backend.
 * <p>
 * Implementations are stateless and safe to call from several threads at once.
 * Every failure is reported as a {@link ModelCallException} carrying its
 * {@link com.hirepanel.core.model.ErrorKind}.
 */
public interface ModelClient {

    /**
     * @param request prompt, response schema, model and sampling settings
     * @return the parsed JSON payload, already validated against {@code request.responseSchema()}
     * @throws ModelCallException on unreachable backend, malformed JSON or schema violation
     */
    RawModelPayload evaluate(ModelRequest request);
}
