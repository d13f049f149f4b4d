package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;

/**
 * Avatar placement inside the frame. Every field is optional; role width is clamped to
 * 100..5760 and the top offset to at least 0.
 */
public record RoleConfig(Integer roleWidth, Integer leftOffset, Integer topOffset) {

    static final int MIN_ROLE_WIDTH = 100;
    static final int MAX_ROLE_WIDTH = 5760;

    public RoleConfig {
        if (roleWidth != null) {
            roleWidth = VideoConfig.clamp(roleWidth, MIN_ROLE_WIDTH, MAX_ROLE_WIDTH);
        }
        if (topOffset != null) {
            topOffset = Math.max(0, topOffset);
        }
    }

    public boolean isEmpty() {
        return roleWidth == null && leftOffset == null && topOffset == null;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (roleWidth != null) {
            json.put("role_width", roleWidth);
        }
        if (leftOffset != null) {
            json.put("role_left_offset", leftOffset);
        }
        if (topOffset != null) {
            json.put("role_top_offset", topOffset);
        }
        return json;
    }
}
