package com.draupnir.policy.corpus;

/**
 * I/O or decode failure while reading a file
 */
public class CorpusReadException extends CorpusException {

    public CorpusReadException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
