package com.draupnir.policy.posture;

import com.draupnir.policy.corpus.CorpusEntry;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.model.PolicyDocument;

/**
 * Loads and parses a corpus file on demand
 */
@FunctionalInterface
public interface DocumentSource {

    PolicyDocument load(CorpusEntry entry) throws CorpusException;
}
