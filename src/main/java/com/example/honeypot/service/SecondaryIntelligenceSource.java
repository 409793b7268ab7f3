package com.example.honeypot.service;

import com.example.honeypot.model.ExtractedIntelligence;

import java.util.List;
import java.util.Optional;

/**
 * Proposes extraction candidates the pattern pass may have missed. Proposals are unverified input.
 */
public interface SecondaryIntelligenceSource {

    Optional<ExtractedIntelligence> propose(String message, List<String> context);
}
