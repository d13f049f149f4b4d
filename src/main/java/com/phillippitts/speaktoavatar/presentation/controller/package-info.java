/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/avatar/join_room}, {@code DELETE /api/avatar/leave_room/{roomId}},
 *       {@code POST /api/reset_connections}, {@code GET /api/connection_status}
 *       - {@link com.phillippitts.speaktoavatar.presentation.controller.RoomController}</li>
 *   <li>{@code POST /api/query/stream}, {@code POST /api/query/cancel/{sessionId}}
 *       - {@link com.phillippitts.speaktoavatar.presentation.controller.QueryController}</li>
 *   <li>{@code POST /api/voice/recognize}
 *       - {@link com.phillippitts.speaktoavatar.presentation.controller.VoiceController}</li>
 * </ul>
 *
 * <p>Controllers only map HTTP onto service calls; errors are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.speaktoavatar.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.speaktoavatar.presentation.controller;
