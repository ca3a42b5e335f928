package com.adlanda.mediphant.exception;

/**
 * Thrown when chunking a corpus document yields no retrievable lines.
 */
public class EmptyCorpusException extends RuntimeException {

    public EmptyCorpusException(String sourceRef) {
        super("No chunks created from corpus: " + sourceRef);
    }
}
