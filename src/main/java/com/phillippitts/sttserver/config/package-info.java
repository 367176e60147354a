/**
 * Application-wide configuration.
 *
 * <ul>
 *   <li>{@code config.stt} - engine selection, model validation and the dispatcher/worker beans</li>
 *   <li>{@code config.logging} - request correlation for Log4j2 (MDC filter)</li>
 * </ul>
 *
 * @see com.phillippitts.sttserver.config.stt
 * @since 1.0
 */
package com.phillippitts.sttserver.config;
