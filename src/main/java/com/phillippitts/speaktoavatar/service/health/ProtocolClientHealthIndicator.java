package com.phillippitts.speaktoavatar.service.health;

import com.phillippitts.speaktoavatar.service.client.ProtocolClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the TTS, STT and avatar connections.
 *
 * <p>Reports connection status for monitoring and alerting:
 * <ul>
 *   <li>UP: every client connected</li>
 *   <li>DEGRADED: at least one client connected</li>
 *   <li>DOWN: no client connected</li>
 * </ul>
 *
 * <p>Clients connect on demand, so DOWN right after startup only means nothing has been asked
 * of them yet. Exposed via /actuator/health endpoint.
 */
@Component
public class ProtocolClientHealthIndicator implements HealthIndicator {

    private final List<ProtocolClient> clients;

    public ProtocolClientHealthIndicator(List<ProtocolClient> clients) {
        this.clients = List.copyOf(clients);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        long connected = 0;
        for (ProtocolClient client : clients) {
            if (client.isConnected()) {
                connected++;
            }
            details.put(client.serviceName(), clientStatus(client));
        }

        Health.Builder builder = new Health.Builder();
        if (!clients.isEmpty() && connected == clients.size()) {
            builder.up().withDetail("status", "All clients connected");
        } else if (connected > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial connectivity");
        } else {
            builder.down().withDetail("status", "No client connected");
        }
        return builder.withDetails(details).build();
    }

    private static Map<String, Object> clientStatus(ProtocolClient client) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", client.state().name().toLowerCase(Locale.ROOT));
        if (client.boundId() != null) {
            status.put("bound", client.boundId());
        }
        return status;
    }
}
