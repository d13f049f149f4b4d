package com.phillippitts.speaktoavatar.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the streaming speech-recognition WebSocket.
 */
@ConfigurationProperties(prefix = "stt")
@Validated
public class SttProperties {

    @NotBlank
    private String url = "wss://voice.ap-southeast-1.bytepluses.com/api/v3/sauc/bigmodel";

    private String appKey = "";

    private String accessKey = "";

    @NotBlank
    private String resourceId = "volc.bigasr.sauc.duration";

    private boolean verifySsl = true;

    @Positive
    private long connectTimeoutMs = 10_000;

    /** Maximum wait for the next recognition result once audio has been sent. */
    @Positive
    private long resultTimeoutMs = 15_000;

    @Positive
    private long healthTimeoutMs = 5_000;

    @Positive
    private long closeTimeoutMs = 10_000;

    /** Audio duration carried by one streamed segment. */
    @Positive
    private int segmentDurationMs = 200;

    @Positive
    private int sampleRate = 16_000;

    @NotBlank
    private String uid = "speaktoavatar";

    private boolean enableItn = true;

    private boolean enablePunc = true;

    private boolean enableDdc = true;

    private boolean showUtterances = true;

    private boolean enableNonstream = false;

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

    public long getResultTimeoutMs() {
        return resultTimeoutMs;
    }

    public void setResultTimeoutMs(long resultTimeoutMs) {
        this.resultTimeoutMs = resultTimeoutMs;
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

    public int getSegmentDurationMs() {
        return segmentDurationMs;
    }

    public void setSegmentDurationMs(int segmentDurationMs) {
        this.segmentDurationMs = segmentDurationMs;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public boolean isEnableItn() {
        return enableItn;
    }

    public void setEnableItn(boolean enableItn) {
        this.enableItn = enableItn;
    }

    public boolean isEnablePunc() {
        return enablePunc;
    }

    public void setEnablePunc(boolean enablePunc) {
        this.enablePunc = enablePunc;
    }

    public boolean isEnableDdc() {
        return enableDdc;
    }

    public void setEnableDdc(boolean enableDdc) {
        this.enableDdc = enableDdc;
    }

    public boolean isShowUtterances() {
        return showUtterances;
    }

    public void setShowUtterances(boolean showUtterances) {
        this.showUtterances = showUtterances;
    }

    public boolean isEnableNonstream() {
        return enableNonstream;
    }

    public void setEnableNonstream(boolean enableNonstream) {
        this.enableNonstream = enableNonstream;
    }
}
