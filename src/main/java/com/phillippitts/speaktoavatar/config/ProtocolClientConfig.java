package com.phillippitts.speaktoavatar.config;

import com.phillippitts.speaktoavatar.service.client.transport.JavaWebSocketTransport;
import com.phillippitts.speaktoavatar.service.client.transport.TransportFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the protocol clients and the registries.
 */
@Configuration
public class ProtocolClientConfig {

    /** WebSocket transports backed by Java-WebSocket. */
    @Bean
    public TransportFactory transportFactory() {
        return JavaWebSocketTransport::new;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
