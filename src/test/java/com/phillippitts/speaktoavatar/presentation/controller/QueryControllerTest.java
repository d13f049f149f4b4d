package com.phillippitts.speaktoavatar.presentation.controller;

import com.phillippitts.speaktoavatar.service.pipeline.StreamEvent;
import com.phillippitts.speaktoavatar.service.pipeline.StreamEventSink;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryControllerTest {

    @Test
    void progressEventsKeepTheEmitterOpen() {
        SseEmitter emitter = new SseEmitter(1_000L);
        StreamEventSink sink = QueryController.emitterSink(emitter);

        sink.accept(StreamEvent.start("s-1", "hi"));
        sink.accept(StreamEvent.textChunk("Hello", "Hello"));

        assertThatCode(() -> sink.accept(StreamEvent.sentence("Hello.", false))).doesNotThrowAnyException();
    }

    @Test
    void terminalEventCompletesTheEmitter() {
        SseEmitter emitter = new SseEmitter(1_000L);
        StreamEventSink sink = QueryController.emitterSink(emitter);

        sink.accept(StreamEvent.complete("Hello.", "s-1"));

        // a completed emitter refuses further events, which cancels the stream upstream
        assertThatThrownBy(() -> sink.accept(StreamEvent.textChunk("late", "late")))
                .isInstanceOf(IllegalStateException.class);
    }
}
