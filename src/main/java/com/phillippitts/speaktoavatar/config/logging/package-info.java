/**
 * Logging infrastructure and ThreadContext (MDC) configuration.
 *
 * <p>Log4j2 with ThreadContext keys for request correlation across the pipeline and join pools.
 *
 * <p>ThreadContext keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, set by {@link com.phillippitts.speaktoavatar.config.logging.MdcFilter}</li>
 *   <li>{@code roomId} - live id of the room a join, leave or stream is working on</li>
 *   <li>{@code sessionId} - id of the streamed query</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2025-10-17 15:42:32.529 [pipeline-1] [requestId] [roomId] [sessionId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.speaktoavatar.config.logging;
