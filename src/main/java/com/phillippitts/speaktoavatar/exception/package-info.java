/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.speaktoavatar.exception.SpeakToAvatarException}
 * and maps to one error kind:
 * <ul>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.ConnectionException} - transport or
 *       handshake failure, including timeout and TLS variants</li>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.ProtocolException} - malformed frame,
 *       unexpected message or event, decompression failure</li>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.SessionException} - remote side rejected
 *       a session start, drive or finish</li>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException} - duplicate
 *       pending join or active cooldown</li>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.StreamCancelledException} - cooperative
 *       cancellation was observed</li>
 *   <li>{@link com.phillippitts.speaktoavatar.exception.OperationTimeoutException} - a bounded
 *       wait was exceeded</li>
 * </ul>
 *
 * <p>HTTP status mapping lives in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.speaktoavatar.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.speaktoavatar.exception;
