package com.gemflush.orchestrator.fingerprint;

/** A competitor named in one response; position is its list number, if listed. */
public record CompetitorMention(String name, Integer position) {
}
