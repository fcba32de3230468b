package com.uconnect.admissionsBot.retrieval.model;

/**
 * A slice of a source document. {@code position} is the character offset of the slice in the
 * source and drives the final reading order.
 */
public record DocumentSegment(String text, int position) {
}
