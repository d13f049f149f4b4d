package com.phillippitts.speaktoavatar.presentation.controller;

import com.phillippitts.speaktoavatar.service.client.stt.SttClient;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Speech recognition over a raw 16-bit mono PCM body.
 */
@RestController
@RequestMapping("/api/voice")
class VoiceController {

    private final SttClient sttClient;

    VoiceController(SttClient sttClient) {
        this.sttClient = sttClient;
    }

    @PostMapping(path = "/recognize", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<Map<String, Object>> recognize(@RequestBody byte[] pcm,
                                                  @RequestParam(name = "sampleRate", defaultValue = "16000")
                                                  int sampleRate) {
        String text = sttClient.recognize(pcm, sampleRate);
        return ResponseEntity.ok(Map.of("text", text, "audio_bytes", pcm.length));
    }
}
