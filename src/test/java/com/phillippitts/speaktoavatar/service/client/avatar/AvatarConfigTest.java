package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvatarConfigTest {

    @Test
    void videoConfigClampsToSupportedRange() {
        VideoConfig tiny = new VideoConfig(10, 5000, 1);

        assertThat(tiny.width()).isEqualTo(VideoConfig.MIN_DIMENSION);
        assertThat(tiny.height()).isEqualTo(VideoConfig.MAX_DIMENSION);
        assertThat(tiny.bitrate()).isEqualTo(VideoConfig.MIN_BITRATE);
        assertThat(new VideoConfig(720, 1280, 99_999).bitrate()).isEqualTo(VideoConfig.MAX_BITRATE);
    }

    @Test
    void roleConfigClampsWidthAndTopOffset() {
        RoleConfig role = new RoleConfig(10, -40, -5);

        assertThat(role.roleWidth()).isEqualTo(RoleConfig.MIN_ROLE_WIDTH);
        assertThat(role.leftOffset()).isEqualTo(-40);
        assertThat(role.topOffset()).isZero();
        assertThat(role.toJson().getInt("role_left_offset")).isEqualTo(-40);
    }

    @Test
    void emptyRoleConfigIsLeftOutOfInitMessage() {
        LiveRequest request = new LiveRequest("r", AvatarType.PIC, "role",
                StreamingTarget.rtmp("rtmp://example/live"), "", null, new RoleConfig(null, null, null));

        JSONObject init = request.toInitJson("app", "tok");

        assertThat(init.getJSONObject("avatar").has("role_conf")).isFalse();
        assertThat(init.getJSONObject("avatar").has("background")).isFalse();
        assertThat(init.has("video")).isFalse();
        assertThat(init.getJSONObject("streaming").getString("rtmp_addr")).isEqualTo("rtmp://example/live");
    }

    @Test
    void avatarTypeDefaultsToThreeMinute() {
        assertThat(AvatarType.fromWireName(null)).isEqualTo(AvatarType.THREE_MIN);
        assertThat(AvatarType.fromWireName("PIC")).isEqualTo(AvatarType.PIC);
        assertThatThrownBy(() -> AvatarType.fromWireName("video")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rtcTargetHidesTokenInToString() {
        assertThat(StreamingTarget.rtc("a", "r", "u", "secret").toString()).doesNotContain("secret");
    }

    @Test
    void describesKnownAndUnknownCodes() {
        assertThat(AvatarErrorCode.describe(4002)).isEqualTo("concurrency limit exceeded");
        assertThat(AvatarErrorCode.describe(1)).isEqualTo("unknown error");
    }
}
