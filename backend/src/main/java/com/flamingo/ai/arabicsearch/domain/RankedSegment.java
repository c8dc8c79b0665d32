package com.flamingo.ai.arabicsearch.domain;

import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptSegment;

/**
 * One ranked hit.
 *
 * @param documentId backend document id
 * @param score backend relevance score, passed through unchanged
 * @param modeUsed mode that actually produced the hit
 * @param segment the stored transcript segment
 */
public record RankedSegment(
    String documentId, Double score, SearchMode modeUsed, TranscriptSegment segment) {}
