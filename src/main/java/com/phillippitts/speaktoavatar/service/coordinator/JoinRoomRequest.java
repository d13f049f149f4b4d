package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.service.client.avatar.RoleConfig;
import com.phillippitts.speaktoavatar.service.client.avatar.VideoConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request to put the avatar live in a room. Blank RTC fields and role fall back to the
 * {@code avatar.*} defaults.
 *
 * @param liveId     room / live id
 * @param avatarType {@code pic} or {@code 3min}, defaults to {@code 3min}
 */
public record JoinRoomRequest(
        @NotBlank(message = "live_id is required") String liveId,
        @Pattern(regexp = "pic|3min", message = "avatar_type must be 'pic' or '3min'") String avatarType,
        String role,
        String rtcAppId,
        String rtcRoomId,
        String rtcUid,
        String rtcToken,
        String background,
        VideoConfig videoConfig,
        RoleConfig roleConfig
) {

    public static JoinRoomRequest of(String liveId) {
        return new JoinRoomRequest(liveId, null, null, null, null, null, null, null, null, null);
    }

    @Override
    public String toString() {
        return "JoinRoomRequest[liveId=" + liveId + ", avatarType=" + avatarType + ", role=" + role
                + ", rtcRoomId=" + rtcRoomId + "]";
    }
}
