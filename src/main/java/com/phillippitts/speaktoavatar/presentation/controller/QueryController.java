package com.phillippitts.speaktoavatar.presentation.controller;

import com.phillippitts.speaktoavatar.config.properties.PipelineProperties;
import com.phillippitts.speaktoavatar.service.pipeline.PipelineOrchestrator;
import com.phillippitts.speaktoavatar.service.pipeline.QueryRequest;
import com.phillippitts.speaktoavatar.service.pipeline.StreamEvent;
import com.phillippitts.speaktoavatar.service.pipeline.StreamEventSink;
import com.phillippitts.speaktoavatar.service.session.StreamSession;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Streams the progress of a query as server-sent events, one JSON object per {@code data:} line.
 */
@RestController
@RequestMapping("/api/query")
class QueryController {

    private static final Logger LOG = LogManager.getLogger(QueryController.class);

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties props;

    QueryController(PipelineOrchestrator orchestrator, PipelineProperties props) {
        this.orchestrator = orchestrator;
        this.props = props;
    }

    @PostMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter stream(@Valid @RequestBody QueryRequest request) {
        SseEmitter emitter = new SseEmitter(props.getEmitterTimeoutMs());
        StreamSession session = orchestrator.submit(request, emitterSink(emitter));
        emitter.onTimeout(() -> {
            LOG.warn("Stream {} emitter timed out, cancelling", session.sessionId());
            session.token().cancel();
        });
        emitter.onError(e -> session.token().cancel());
        return emitter;
    }

    @PostMapping("/cancel/{sessionId}")
    ResponseEntity<Map<String, Object>> cancel(@PathVariable("sessionId") String sessionId) {
        int cancelled = orchestrator.cancel(sessionId);
        return ResponseEntity.ok(Map.of("session_id", sessionId, "cancelled", cancelled));
    }

    static StreamEventSink emitterSink(SseEmitter emitter) {
        return event -> {
            try {
                emitter.send(SseEmitter.event().data(event.toJson().toString()));
            } catch (IOException e) {
                emitter.completeWithError(e);
                throw new UncheckedIOException(e);
            }
            if (event.type().isTerminal()) {
                emitter.complete();
            }
        };
    }
}
