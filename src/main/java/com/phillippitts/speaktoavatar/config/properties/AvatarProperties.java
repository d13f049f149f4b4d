package com.phillippitts.speaktoavatar.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the avatar live-control WebSocket.
 *
 * <p>{@code avatar.strategies} lists the connection attempts made by one connect call, in order.
 * The defaults first try with certificate verification, then twice without it, the last time
 * with a longer timeout.
 */
@ConfigurationProperties(prefix = "avatar")
@Validated
public class AvatarProperties {

    @NotBlank
    private String url = "wss://openspeech.bytedance.com/virtual_human/avatar_live/live";

    private String appid = "";

    private String token = "";

    /** Role used when a join request names none. */
    @NotBlank
    private String defaultRole = "250623-zhibo-linyunzhi";

    /** ByteRTC target used for fields a join request leaves blank. */
    private String rtcAppId = "";

    private String rtcRoomId = "";

    private String rtcUid = "";

    private String rtcToken = "";

    @Positive
    private long healthTimeoutMs = 5_000;

    /** Bound for the start-live acknowledgment sent by the avatar service itself. */
    @Positive
    private long startLiveTimeoutMs = 20_000;

    /** Pause between sending stop-live and closing the socket. */
    @Positive
    private long stopGraceMs = 500;

    @Positive
    private long closeTimeoutMs = 10_000;

    /** Pause between two connection strategies. */
    @Positive
    private long strategyDelayMs = 2_000;

    @Valid
    @NotEmpty
    private List<ConnectStrategy> strategies = new ArrayList<>(List.of(
            new ConnectStrategy(true, 25_000),
            new ConnectStrategy(false, 25_000),
            new ConnectStrategy(false, 35_000)));

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAppid() {
        return appid;
    }

    public void setAppid(String appid) {
        this.appid = appid;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getDefaultRole() {
        return defaultRole;
    }

    public void setDefaultRole(String defaultRole) {
        this.defaultRole = defaultRole;
    }

    public String getRtcAppId() {
        return rtcAppId;
    }

    public void setRtcAppId(String rtcAppId) {
        this.rtcAppId = rtcAppId;
    }

    public String getRtcRoomId() {
        return rtcRoomId;
    }

    public void setRtcRoomId(String rtcRoomId) {
        this.rtcRoomId = rtcRoomId;
    }

    public String getRtcUid() {
        return rtcUid;
    }

    public void setRtcUid(String rtcUid) {
        this.rtcUid = rtcUid;
    }

    public String getRtcToken() {
        return rtcToken;
    }

    public void setRtcToken(String rtcToken) {
        this.rtcToken = rtcToken;
    }

    public long getHealthTimeoutMs() {
        return healthTimeoutMs;
    }

    public void setHealthTimeoutMs(long healthTimeoutMs) {
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public long getStartLiveTimeoutMs() {
        return startLiveTimeoutMs;
    }

    public void setStartLiveTimeoutMs(long startLiveTimeoutMs) {
        this.startLiveTimeoutMs = startLiveTimeoutMs;
    }

    public long getStopGraceMs() {
        return stopGraceMs;
    }

    public void setStopGraceMs(long stopGraceMs) {
        this.stopGraceMs = stopGraceMs;
    }

    public long getCloseTimeoutMs() {
        return closeTimeoutMs;
    }

    public void setCloseTimeoutMs(long closeTimeoutMs) {
        this.closeTimeoutMs = closeTimeoutMs;
    }

    public long getStrategyDelayMs() {
        return strategyDelayMs;
    }

    public void setStrategyDelayMs(long strategyDelayMs) {
        this.strategyDelayMs = strategyDelayMs;
    }

    public List<ConnectStrategy> getStrategies() {
        return strategies;
    }

    public void setStrategies(List<ConnectStrategy> strategies) {
        this.strategies = strategies;
    }

    /**
     * One connection attempt: TLS verification on or off, and how long to wait.
     */
    public static class ConnectStrategy {
        private boolean verifySsl = true;

        @Positive
        private long timeoutMs = 25_000;

        public ConnectStrategy() {
        }

        public ConnectStrategy(boolean verifySsl, long timeoutMs) {
            this.verifySsl = verifySsl;
            this.timeoutMs = timeoutMs;
        }

        public boolean isVerifySsl() {
            return verifySsl;
        }

        public void setVerifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
