package com.adlanda.mediphant.model;

/**
 * Which external credentials were supplied at startup.
 *
 * @param embeddingCredential Status of the embedding provider key
 * @param vectorCredential    Status of the vector backend key
 */
public record ExternalServicesSettings(
        CredentialStatus embeddingCredential,
        CredentialStatus vectorCredential
) {
    /**
     * The mode an orchestrator starts in, before any client has been built.
     */
    public OrchestratorMode initialMode() {
        return embeddingCredential == CredentialStatus.PRESENT && vectorCredential == CredentialStatus.PRESENT
                ? OrchestratorMode.VECTOR_READY
                : OrchestratorMode.FALLBACK_ONLY;
    }
}
