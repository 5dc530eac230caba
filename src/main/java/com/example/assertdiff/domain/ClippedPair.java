package com.example.assertdiff.domain;

/**
 * Expected and actual strings after clipping to a display width.
 */
public record ClippedPair(String expected, String actual) {}
