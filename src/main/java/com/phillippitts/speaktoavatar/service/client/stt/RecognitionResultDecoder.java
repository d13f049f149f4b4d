package com.phillippitts.speaktoavatar.service.client.stt;

import com.phillippitts.speaktoavatar.service.protocol.Frame;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Turns recognition response frames into {@link RecognitionResult}s.
 *
 * <p>The service has used several payload shapes over time. Text is taken from the first of
 * these that is present:
 * <ol>
 *   <li>{@code result.text}, or {@code result} itself when it is a string</li>
 *   <li>{@code text}</li>
 *   <li>{@code sentence[0].text}, or {@code sentence.text} when it is an object</li>
 *   <li>{@code utterances[0].text}</li>
 * </ol>
 * Finality is taken from {@code is_final}, then {@code result.is_final}, then the frame's
 * last-packet marker.
 */
public final class RecognitionResultDecoder {

    private RecognitionResultDecoder() {
    }

    public static RecognitionResult decode(Frame frame) {
        JSONObject payload = frame.payloadAsJson();
        return new RecognitionResult(extractText(payload), extractFinal(payload, frame.isLastPacket()),
                frame.sequence());
    }

    static String extractText(JSONObject payload) {
        Object result = payload.opt("result");
        if (result instanceof JSONObject r && r.has("text")) {
            return r.optString("text", "");
        }
        if (result instanceof String s) {
            return s;
        }
        if (payload.has("text")) {
            return payload.optString("text", "");
        }
        Object sentence = payload.opt("sentence");
        if (sentence instanceof JSONArray list) {
            return firstText(list);
        }
        if (sentence instanceof JSONObject s) {
            return s.optString("text", "");
        }
        Object utterances = payload.opt("utterances");
        if (utterances instanceof JSONArray list) {
            return firstText(list);
        }
        return "";
    }

    static boolean extractFinal(JSONObject payload, boolean lastPacket) {
        if (payload.has("is_final")) {
            return payload.optBoolean("is_final", false);
        }
        JSONObject result = payload.optJSONObject("result");
        if (result != null && result.has("is_final")) {
            return result.optBoolean("is_final", false);
        }
        return lastPacket;
    }

    private static String firstText(JSONArray list) {
        if (list.isEmpty()) {
            return "";
        }
        JSONObject first = list.optJSONObject(0);
        return first == null ? "" : first.optString("text", "");
    }
}
