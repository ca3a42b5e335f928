package com.adlanda.mediphant.exception;

/**
 * Failure of an external dependency: embedding provider, vector index or generative model.
 *
 * On the query path this is always recovered locally. The indexer treats it as fatal.
 */
public class UpstreamServiceException extends RuntimeException {

    public UpstreamServiceException(String message) {
        super(message);
    }

    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
