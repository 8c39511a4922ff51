package com.image.ai.pipeline.derivation;

/**
 * Short description of what is literally visible in an image. Implementations
 * must be deterministic for identical input, never return blank text, and be
 * safe to call from several pipeline runs at once.
 */
public interface CaptionGenerator {

    String describe(DecodedImage image);
}
