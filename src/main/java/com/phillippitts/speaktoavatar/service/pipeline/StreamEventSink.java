package com.phillippitts.speaktoavatar.service.pipeline;

/**
 * Receives the progress events of one streamed query, in order, on the pipeline thread.
 */
@FunctionalInterface
public interface StreamEventSink {

    void accept(StreamEvent event);
}
