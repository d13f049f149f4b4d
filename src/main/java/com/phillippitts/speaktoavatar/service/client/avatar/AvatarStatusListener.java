package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;

/**
 * Receives events the avatar service pushes without being asked. Called on the socket reader
 * thread, so implementations must return quickly.
 */
public interface AvatarStatusListener {

    /** A {@code |DAT|02|} status event such as playback start or end. */
    void onStatus(String liveId, String type, JSONObject data);

    /** A {@code |MSG|01|} error notification. */
    void onError(String liveId, int code, String message);
}
