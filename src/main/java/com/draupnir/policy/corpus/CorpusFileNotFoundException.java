package com.draupnir.policy.corpus;

public class CorpusFileNotFoundException extends CorpusException {

    public CorpusFileNotFoundException(String path) {
        super(path, "File not found: " + path);
    }
}
