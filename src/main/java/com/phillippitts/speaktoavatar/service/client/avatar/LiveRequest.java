package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Everything needed to start one avatar live stream.
 *
 * @param liveId     live id, also used as the room id
 * @param avatarType rendering model
 * @param role       avatar character id
 * @param target     where video is pushed
 * @param background optional background image URL
 * @param video      optional output video settings
 * @param roleConfig optional avatar placement
 */
public record LiveRequest(String liveId, AvatarType avatarType, String role, StreamingTarget target,
                          String background, VideoConfig video, RoleConfig roleConfig) {

    public LiveRequest {
        if (liveId == null || liveId.isBlank()) {
            throw new IllegalArgumentException("liveId must not be blank");
        }
        Objects.requireNonNull(avatarType, "avatarType must not be null");
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        Objects.requireNonNull(target, "target must not be null");
    }

    /** Init body of the start-live message. Credentials come from the client configuration. */
    JSONObject toInitJson(String appid, String token) {
        JSONObject avatar = new JSONObject()
                .put("avatar_type", avatarType.wireName())
                .put("input_mode", "audio")
                .put("role", role);
        if (background != null && !background.isBlank()) {
            avatar.put("background", background);
        }
        if (roleConfig != null && !roleConfig.isEmpty()) {
            avatar.put("role_conf", roleConfig.toJson());
        }
        JSONObject init = new JSONObject()
                .put("live", new JSONObject().put("live_id", liveId))
                .put("auth", new JSONObject().put("appid", appid).put("token", token))
                .put("avatar", avatar)
                .put("streaming", target.toJson());
        if (video != null) {
            init.put("video", video.toJson());
        }
        return init;
    }
}
