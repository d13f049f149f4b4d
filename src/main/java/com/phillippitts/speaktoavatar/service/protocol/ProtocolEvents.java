package com.phillippitts.speaktoavatar.service.protocol;

/**
 * Event codes of the connection/session/task state machine.
 *
 * <p>Client events are below 50; server acknowledgements for the connection level sit at 50-52,
 * for the session level at 150-153, and TTS sentence/audio notifications at 350-352.
 */
public final class ProtocolEvents {

    public static final int NONE = 0;

    public static final int START_CONNECTION = 1;
    public static final int FINISH_CONNECTION = 2;
    public static final int CONNECTION_STARTED = 50;
    public static final int CONNECTION_FAILED = 51;
    public static final int CONNECTION_FINISHED = 52;

    public static final int START_SESSION = 100;
    public static final int FINISH_SESSION = 102;
    public static final int SESSION_STARTED = 150;
    public static final int SESSION_FINISHED = 152;
    public static final int SESSION_FAILED = 153;

    public static final int TASK_REQUEST = 200;

    public static final int TTS_SENTENCE_START = 350;
    public static final int TTS_SENTENCE_END = 351;
    public static final int TTS_RESPONSE = 352;

    private ProtocolEvents() {
    }

    /** Connection-level events that carry no session id. */
    public static boolean isConnectionLevel(int event) {
        return event == START_CONNECTION || event == FINISH_CONNECTION
                || event == CONNECTION_STARTED || event == CONNECTION_FAILED
                || event == CONNECTION_FINISHED;
    }

    /** Server session notifications that carry a session id followed by a metadata string. */
    public static boolean isSessionStatus(int event) {
        return event == SESSION_STARTED || event == SESSION_FINISHED || event == SESSION_FAILED;
    }

    public static String name(int event) {
        return switch (event) {
            case NONE -> "None";
            case START_CONNECTION -> "StartConnection";
            case FINISH_CONNECTION -> "FinishConnection";
            case CONNECTION_STARTED -> "ConnectionStarted";
            case CONNECTION_FAILED -> "ConnectionFailed";
            case CONNECTION_FINISHED -> "ConnectionFinished";
            case START_SESSION -> "StartSession";
            case FINISH_SESSION -> "FinishSession";
            case SESSION_STARTED -> "SessionStarted";
            case SESSION_FINISHED -> "SessionFinished";
            case SESSION_FAILED -> "SessionFailed";
            case TASK_REQUEST -> "TaskRequest";
            case TTS_SENTENCE_START -> "TTSSentenceStart";
            case TTS_SENTENCE_END -> "TTSSentenceEnd";
            case TTS_RESPONSE -> "TTSResponse";
            default -> "Event(" + event + ")";
        };
    }
}
