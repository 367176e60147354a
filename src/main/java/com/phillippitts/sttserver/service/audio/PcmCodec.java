package com.phillippitts.sttserver.service.audio;

import com.phillippitts.sttserver.exception.InvalidAudioException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.ShortBuffer;
import java.util.Objects;

import static com.phillippitts.sttserver.service.audio.AudioFormat.NORMALIZATION_DIVISOR;
import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.sttserver.service.audio.AudioFormat.SAMPLES_PER_CHUNK;

/**
 * Converts between raw PCM16LE bytes and normalized float samples.
 *
 * <p>Stateless and thread-safe. The HTTP layer decodes request bodies with {@link #decode(byte[])};
 * engines whose native API consumes 16-bit PCM convert back with {@link #encode(float[])}.
 */
public final class PcmCodec {

    private PcmCodec() {}

    /**
     * Decodes little-endian signed 16-bit mono PCM into samples in roughly [-1.0, 1.0].
     *
     * @param pcm raw request body
     * @return one float per 16-bit sample, computed as {@code sample / 32767.0f}
     * @throws InvalidAudioException with {@code EMPTY_INPUT} for zero bytes,
     *                               {@code MISALIGNED_LENGTH} for an odd byte count
     */
    public static float[] decode(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (pcm.length == 0) {
            throw new InvalidAudioException(0, InvalidAudioException.Reason.EMPTY_INPUT, "audio payload is empty");
        }
        if (pcm.length % REQUIRED_BLOCK_ALIGN != 0) {
            throw new InvalidAudioException(pcm.length, InvalidAudioException.Reason.MISALIGNED_LENGTH,
                    "length must be a multiple of " + REQUIRED_BLOCK_ALIGN + " bytes (16-bit samples)");
        }
        ShortBuffer shorts = ByteBuffer.wrap(pcm).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer();
        float[] samples = new float[shorts.remaining()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = shorts.get(i) / NORMALIZATION_DIVISOR;
        }
        return samples;
    }

    /**
     * Encodes normalized samples back to PCM16LE. Values are scaled by 32767, rounded and clamped
     * to the signed 16-bit range.
     *
     * @param samples normalized samples
     * @return little-endian PCM bytes, two per sample
     */
    public static byte[] encode(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * REQUIRED_BLOCK_ALIGN).order(ByteOrder.LITTLE_ENDIAN);
        for (float sample : samples) {
            long scaled = Math.round((double) sample * NORMALIZATION_DIVISOR);
            buffer.putShort((short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, scaled)));
        }
        return buffer.array();
    }

    /**
     * Returns a fresh chunk of digital silence used to warm up the engine at startup.
     *
     * @return {@code 16000 * 10} zero samples
     */
    public static float[] silentChunk() {
        return new float[SAMPLES_PER_CHUNK];
    }
}
