package com.agentbridge.service;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Gatekeeper for chat text before it is typed into an agent window.
 */
@Component
public class InputSanitizer {

    static final int MAX_LENGTH = 10_000;

    /**
     * @return the text with NUL characters removed, or empty when it is blank or
     * longer than {@value #MAX_LENGTH} characters
     */
    public Optional<String> sanitize(String input) {
        if (input == null || input.isBlank() || input.length() > MAX_LENGTH) {
            return Optional.empty();
        }
        String cleaned = input.replace("\0", "");
        return cleaned.isBlank() ? Optional.empty() : Optional.of(cleaned);
    }
}
