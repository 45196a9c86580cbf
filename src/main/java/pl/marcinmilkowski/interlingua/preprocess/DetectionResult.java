package pl.marcinmilkowski.interlingua.preprocess;

import pl.marcinmilkowski.interlingua.lexicon.Language;

/**
 * Detected language with a confidence in [0, 1].
 */
public record DetectionResult(Language language, double confidence) {
}
