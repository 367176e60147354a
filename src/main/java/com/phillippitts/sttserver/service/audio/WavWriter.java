package com.phillippitts.sttserver.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.sttserver.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.sttserver.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Writes minimal PCM WAV files in the fixed server format (16 kHz, 16-bit signed PCM, mono,
 * little-endian). whisper.cpp reads its input from such a file.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes normalized samples as a WAV file.
     *
     * @param samples normalized samples, re-encoded with {@link PcmCodec#encode(float[])}
     * @param wavPath output file path (will be created or overwritten)
     */
    public static void writeSamples(float[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        writePcm16LeMono16kHz(PcmCodec.encode(samples), wavPath);
    }

    /**
     * Writes a WAV file containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file path (will be created or overwritten)
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(header(pcm.length));
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the 44-byte RIFF/WAVE header for a data chunk of the given size.
     */
    static byte[] header(int dataSize) {
        ByteBuffer header = ByteBuffer.allocate(WAV_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        header.put(ascii("RIFF"));
        header.putInt(WAV_HEADER_SIZE - 8 + dataSize);
        header.put(ascii("WAVE"));
        header.put(ascii("fmt "));
        header.putInt(16);                       // fmt chunk size for PCM
        header.putShort((short) 1);              // PCM
        header.putShort((short) REQUIRED_CHANNELS);
        header.putInt(REQUIRED_SAMPLE_RATE);
        header.putInt(REQUIRED_BYTE_RATE);
        header.putShort((short) REQUIRED_BLOCK_ALIGN);
        header.putShort((short) REQUIRED_BITS_PER_SAMPLE);
        header.put(ascii("data"));
        header.putInt(dataSize);
        return header.array();
    }

    private static byte[] ascii(String tag) {
        return tag.getBytes(StandardCharsets.US_ASCII);
    }
}
