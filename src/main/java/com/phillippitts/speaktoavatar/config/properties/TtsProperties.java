package com.phillippitts.speaktoavatar.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and synthesis settings for the bidirectional TTS WebSocket.
 *
 * <p>Credentials default to empty and must be supplied per environment.
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public class TtsProperties {

    @NotBlank
    private String url = "wss://voice.ap-southeast-1.bytepluses.com/api/v3/tts/bidirection";

    private String appKey = "";

    private String accessKey = "";

    @NotBlank
    private String resourceId = "volc.service_type.1000009";

    /** Some regional endpoints present certificates that fail strict verification. */
    private boolean verifySsl = false;

    /** Bound for the socket open and the ConnectionStarted acknowledgment. */
    @Positive
    private long connectTimeoutMs = 10_000;

    /** Bound for the SessionStarted acknowledgment. */
    @Positive
    private long sessionTimeoutMs = 10_000;

    /** Maximum silence between two frames of one synthesis. */
    @Positive
    private long receiveTimeoutMs = 30_000;

    /** How long a cancelled synthesis keeps reading until SessionFinished. */
    @Positive
    private long drainTimeoutMs = 5_000;

    @Positive
    private long healthTimeoutMs = 5_000;

    @Positive
    private long closeTimeoutMs = 10_000;

    @Positive
    private int sampleRate = 16_000;

    @NotBlank
    private String audioFormat = "pcm";

    @NotBlank
    private String uid = "1234";

    @NotBlank
    private String defaultSpeaker = "BV001_streaming";

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAppKey() {
        return appKey;
    }

    public void setAppKey(String appKey) {
        this.appKey = appKey;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public boolean isVerifySsl() {
        return verifySsl;
    }

    public void setVerifySsl(boolean verifySsl) {
        this.verifySsl = verifySsl;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getSessionTimeoutMs() {
        return sessionTimeoutMs;
    }

    public void setSessionTimeoutMs(long sessionTimeoutMs) {
        this.sessionTimeoutMs = sessionTimeoutMs;
    }

    public long getReceiveTimeoutMs() {
        return receiveTimeoutMs;
    }

    public void setReceiveTimeoutMs(long receiveTimeoutMs) {
        this.receiveTimeoutMs = receiveTimeoutMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public long getHealthTimeoutMs() {
        return healthTimeoutMs;
    }

    public void setHealthTimeoutMs(long healthTimeoutMs) {
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public long getCloseTimeoutMs() {
        return closeTimeoutMs;
    }

    public void setCloseTimeoutMs(long closeTimeoutMs) {
        this.closeTimeoutMs = closeTimeoutMs;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public String getDefaultSpeaker() {
        return defaultSpeaker;
    }

    public void setDefaultSpeaker(String defaultSpeaker) {
        this.defaultSpeaker = defaultSpeaker;
    }
}
