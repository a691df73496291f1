package com.gentoro.claimgraph.model;

/** A prediction market attached to a claim. */
public record MarketReference(String id, String title, String url, double relevance) {}
