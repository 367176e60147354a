/**
 * Audio format constants and conversions for the transcription boundary.
 *
 * <p>Requests carry raw PCM16LE mono 16 kHz bytes. {@link com.phillippitts.sttserver.service.audio.PcmCodec}
 * turns them into normalized floats (divisor 32767) before a job is submitted, and engines that need
 * bytes again re-encode them. {@link com.phillippitts.sttserver.service.audio.WavWriter} wraps PCM in a
 * RIFF header for whisper.cpp.
 *
 * @see com.phillippitts.sttserver.service.audio.AudioFormat
 * @since 1.0
 */
package com.phillippitts.sttserver.service.audio;
