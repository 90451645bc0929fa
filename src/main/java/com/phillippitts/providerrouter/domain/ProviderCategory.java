package com.phillippitts.providerrouter.domain;

/**
 * Capability category a provider serves.
 */
public enum ProviderCategory {
    TEXT_GENERATION,
    REASONING,
    CODING,
    CREATIVE,
    TRANSLATION,
    SPEECH_SYNTHESIS,
    IMAGE_GENERATION
}
