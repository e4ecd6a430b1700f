package com.flamingo.ai.redteam.service.analysis;

/**
 * A document in a batch that could not be parsed.
 *
 * @param index position of the document in the submitted batch (0-based)
 * @param message parser error message
 */
public record DocumentFailure(int index, String message) {}
