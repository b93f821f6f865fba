package com.scholary.medforce.whisper;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Wraps raw PCM audio in a minimal WAV container so the Whisper API can decode it.
 *
 * <p>Format: 16-bit signed PCM, mono, little-endian, at the given sample rate.
 */
public final class WavEncoder {

  public static final int HEADER_SIZE = 44;
  private static final int BITS_PER_SAMPLE = 16;
  private static final int CHANNELS = 1;
  public static final int BYTES_PER_SAMPLE = CHANNELS * BITS_PER_SAMPLE / 8;

  private WavEncoder() {}

  /**
   * Build a WAV file holding the given PCM16LE mono payload.
   *
   * @param pcm raw PCM16LE mono audio
   * @param sampleRate samples per second
   * @return the WAV bytes, header included
   */
  public static byte[] encodePcm16LeMono(byte[] pcm, int sampleRate) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    int blockAlign = BYTES_PER_SAMPLE;
    int byteRate = sampleRate * blockAlign;

    ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + pcm.length);
    out.writeBytes(new byte[] {'R', 'I', 'F', 'F'});
    writeLeInt(out, 36 + pcm.length);
    out.writeBytes(new byte[] {'W', 'A', 'V', 'E'});

    out.writeBytes(new byte[] {'f', 'm', 't', ' '});
    writeLeInt(out, 16);
    writeLeShort(out, 1); // PCM
    writeLeShort(out, CHANNELS);
    writeLeInt(out, sampleRate);
    writeLeInt(out, byteRate);
    writeLeShort(out, blockAlign);
    writeLeShort(out, BITS_PER_SAMPLE);

    out.writeBytes(new byte[] {'d', 'a', 't', 'a'});
    writeLeInt(out, pcm.length);
    out.writeBytes(pcm);
    return out.toByteArray();
  }

  /** Playback duration of a PCM16LE mono payload. */
  public static double durationSeconds(int pcmBytes, int sampleRate) {
    return (double) pcmBytes / (sampleRate * BYTES_PER_SAMPLE);
  }

  private static void writeLeShort(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
  }

  private static void writeLeInt(ByteArrayOutputStream out, int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
    out.write((v >>> 16) & 0xFF);
    out.write((v >>> 24) & 0xFF);
  }
}
