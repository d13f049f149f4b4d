package com.phillippitts.speaktoavatar.service.events;

import com.phillippitts.speaktoavatar.service.client.avatar.AvatarErrorCode;
import com.phillippitts.speaktoavatar.service.client.avatar.AvatarStatusListener;
import com.phillippitts.speaktoavatar.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs what the avatar service pushes on its own and counts its errors. Error logs are throttled
 * per code to avoid log spam from a service stuck in a failing state.
 */
@Component
class AvatarEventsListener implements AvatarStatusListener {
    private static final Logger LOG = LogManager.getLogger(AvatarEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<Integer, Instant> lastLog = new ConcurrentHashMap<>();
    private final PipelineMetrics metrics;

    AvatarEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onStatus(String liveId, String type, JSONObject data) {
        LOG.debug("Avatar status for live {}: type={}, data={}", liveId, type, data);
    }

    @Override
    public void onError(String liveId, int code, String message) {
        metrics.incrementAvatarError(code);
        if (shouldLog(code)) {
            LOG.warn("Avatar error for live {}: code={} ({}), message={}", liveId, code,
                    AvatarErrorCode.describe(code), message);
        }
    }

    // Package-private for tests
    boolean shouldLog(int code) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(code);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(code, now);
            return true;
        }
        return false;
    }
}
