package com.scholary.medforce.whisper;

/**
 * A single segment of transcribed audio.
 *
 * <p>Times are seconds relative to the start of the audio window that was sent.
 */
public record TranscriptSegment(double start, double end, String text) {}
