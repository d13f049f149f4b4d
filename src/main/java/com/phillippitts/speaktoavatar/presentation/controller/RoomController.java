package com.phillippitts.speaktoavatar.presentation.controller;

import com.phillippitts.speaktoavatar.service.coordinator.ConnectionStatus;
import com.phillippitts.speaktoavatar.service.coordinator.JoinResult;
import com.phillippitts.speaktoavatar.service.coordinator.JoinRoomRequest;
import com.phillippitts.speaktoavatar.service.coordinator.LeaveResult;
import com.phillippitts.speaktoavatar.service.coordinator.ResetResult;
import com.phillippitts.speaktoavatar.service.coordinator.RoomCoordinator;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Room lifecycle: join, leave, reset and status. Coordinator errors are mapped to status codes
 * by the global exception handler.
 */
@RestController
@RequestMapping("/api")
class RoomController {

    private final RoomCoordinator coordinator;

    RoomController(RoomCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/avatar/join_room")
    ResponseEntity<JoinResult> joinRoom(@Valid @RequestBody JoinRoomRequest request) {
        return ResponseEntity.ok(coordinator.join(request));
    }

    @DeleteMapping("/avatar/leave_room/{roomId}")
    ResponseEntity<LeaveResult> leaveRoom(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(coordinator.leave(roomId));
    }

    @PostMapping("/reset_connections")
    ResponseEntity<ResetResult> resetConnections() {
        return ResponseEntity.ok(coordinator.reset());
    }

    @GetMapping("/connection_status")
    ResponseEntity<ConnectionStatus> connectionStatus() {
        return ResponseEntity.ok(coordinator.status());
    }
}
