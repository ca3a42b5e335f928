package com.adlanda.mediphant.model;

/**
 * Which search path an orchestrator instance uses.
 */
public enum OrchestratorMode {

    /** Embedding and vector index are configured and have not failed yet. */
    VECTOR_READY,

    /** Only the local lexical search is used. Terminal state. */
    FALLBACK_ONLY
}
