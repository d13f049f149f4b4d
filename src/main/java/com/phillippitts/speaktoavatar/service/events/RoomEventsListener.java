package com.phillippitts.speaktoavatar.service.events;

import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinFailedEvent;
import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinedEvent;
import com.phillippitts.speaktoavatar.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns coordinator events into join metrics.
 */
@Component
class RoomEventsListener {
    private static final Logger LOG = LogManager.getLogger(RoomEventsListener.class);

    private final PipelineMetrics metrics;

    RoomEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onJoined(RoomJoinedEvent e) {
        metrics.recordJoinSuccess(e.durationMs());
        LOG.debug("Room {} joined in {}ms", e.liveId(), e.durationMs());
    }

    @EventListener
    void onJoinFailed(RoomJoinFailedEvent e) {
        if (e.rejected() || "cancelled".equals(e.reason())) {
            metrics.incrementJoinRejected(e.reason());
        } else {
            metrics.incrementJoinFailure(e.reason());
        }
        LOG.debug("Room {} join not completed: reason={}", e.liveId(), e.reason());
    }
}
