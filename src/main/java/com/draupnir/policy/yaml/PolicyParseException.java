package com.draupnir.policy.yaml;

import com.draupnir.policy.corpus.CorpusException;

/**
 * Text could not be parsed as YAML/JSON
 */
public class PolicyParseException extends CorpusException {

    public PolicyParseException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
