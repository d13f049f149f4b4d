package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Where the avatar's video is pushed: a ByteRTC room or an RTMP address.
 */
public interface StreamingTarget {

    JSONObject toJson();

    static StreamingTarget rtc(String appId, String roomId, String uid, String token) {
        return new Rtc(appId, roomId, uid, token);
    }

    static StreamingTarget rtmp(String address) {
        return new Rtmp(address);
    }

    record Rtc(String appId, String roomId, String uid, String token) implements StreamingTarget {

        public Rtc {
            Objects.requireNonNull(appId, "appId must not be null");
            Objects.requireNonNull(roomId, "roomId must not be null");
            Objects.requireNonNull(uid, "uid must not be null");
            Objects.requireNonNull(token, "token must not be null");
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "bytertc")
                    .put("rtc_app_id", appId)
                    .put("rtc_room_id", roomId)
                    .put("rtc_uid", uid)
                    .put("rtc_token", token);
        }

        @Override
        public String toString() {
            return "Rtc[appId=" + appId + ", roomId=" + roomId + ", uid=" + uid + ", token=****]";
        }
    }

    record Rtmp(String address) implements StreamingTarget {

        public Rtmp {
            Objects.requireNonNull(address, "address must not be null");
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "rtmp").put("rtmp_addr", address);
        }
    }
}
