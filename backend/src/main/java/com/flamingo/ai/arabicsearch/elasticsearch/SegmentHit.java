package com.flamingo.ai.arabicsearch.elasticsearch;

/** A search hit: document id, backend score and the stored segment. */
public record SegmentHit(String id, Double score, TranscriptSegment segment) {}
