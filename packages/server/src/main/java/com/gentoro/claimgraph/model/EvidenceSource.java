package com.gentoro.claimgraph.model;

/** A web document returned by evidence search. */
public record EvidenceSource(String title, String url, String snippet) {}
