package com.gentoro.claimgraph.model;

/** Undirected similarity edge of the candidate graph. */
public record GraphEdge(String source, String target, double weight) {}
