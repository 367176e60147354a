/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - X-Request-ID or a generated UUID, set by
 *       {@link com.phillippitts.sttserver.config.logging.MdcFilter}</li>
 *   <li>{@code jobId} - dispatcher sequence number, set by the transcription worker while it runs a job</li>
 * </ul>
 *
 * <p>Log Format (log4j2-spring.xml):
 * <pre>
 * 2025-10-17 15:42:32.529 [transcription-worker] [requestId] [jobId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.sttserver.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.sttserver.config.logging;
