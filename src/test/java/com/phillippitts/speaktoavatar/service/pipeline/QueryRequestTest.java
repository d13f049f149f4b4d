package com.phillippitts.speaktoavatar.service.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryRequestTest {

    @Test
    void fillsDefaults() {
        QueryRequest request = new QueryRequest("hi", null, " ", "", "");

        assertThat(request.userId()).isEqualTo(QueryRequest.DEFAULT_USER);
        assertThat(request.speaker()).isEqualTo(QueryRequest.DEFAULT_SPEAKER);
        assertThat(request.sessionId()).isNull();
        assertThat(request.liveId()).isNull();
    }

    @Test
    void keepsExplicitValues() {
        QueryRequest request = new QueryRequest("hi", "u1", "s1", "voice", "room");

        assertThat(request.userId()).isEqualTo("u1");
        assertThat(request.sessionId()).isEqualTo("s1");
        assertThat(request.speaker()).isEqualTo("voice");
        assertThat(request.liveId()).isEqualTo("room");
    }
}
