package com.williamcallahan.contextbudget.domain.trim;

/**
 * How token costs were computed for a trim.
 */
public enum TokenCountingMode {

    /**
     * A BPE encoding was resolved and loaded (a real profile or its byte-level fallback).
     */
    TIKTOKEN("tiktoken"),

    /**
     * No encoding could be resolved; costs are estimated from character length.
     */
    HEURISTIC("heuristic");

    private final String label;

    TokenCountingMode(String label) {
        this.label = label;
    }

    /**
     * Returns the wire label reported in trim metrics.
     *
     * @return lower-case mode label
     */
    public String label() {
        return label;
    }
}
