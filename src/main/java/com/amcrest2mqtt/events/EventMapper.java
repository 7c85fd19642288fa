package com.amcrest2mqtt.events;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.device.Capabilities;
import com.amcrest2mqtt.device.DeviceEvent;
import com.amcrest2mqtt.topics.Channel;
import java.util.Optional;

/**
 * Maps device events to binary sensor states. Rules, first match wins:
 * <ol>
 *   <li>the model's motion code: {@code motion}, on while {@code action=Start}</li>
 *   <li>{@code CrossRegionDetection} with {@code data.ObjectType=Human} on models with human detection:
 *       {@code human}, on while {@code action=Start}</li>
 *   <li>{@code _DoTalkAction_} on doorbells: {@code doorbell}, on for {@code data.Action=Invite}</li>
 * </ol>
 * The result depends only on the event and the capabilities.
 */
public class EventMapper {
    public static final String HUMAN_DETECTION_CODE = "CrossRegionDetection";
    public static final String TALK_ACTION_CODE = "_DoTalkAction_";
    static final String START = "Start";
    static final String HUMAN = "Human";
    static final String INVITE = "Invite";

    final Capabilities capabilities;

    public EventMapper(Capabilities capabilities) {
        this.capabilities = checkNotNull(capabilities);
    }

    public Optional<SensorUpdate> map(DeviceEvent event) {
        String code = event.code();

        if (code.equals(capabilities.motionEventCode())) {
            return Optional.of(SensorUpdate.of(Channel.MOTION, START.equals(event.action())));
        }

        if (capabilities.supportsHuman() && code.equals(HUMAN_DETECTION_CODE)
                && HUMAN.equals(event.payload().path("data").path("ObjectType").asText())) {
            return Optional.of(SensorUpdate.of(Channel.HUMAN, START.equals(event.action())));
        }

        if (capabilities.isDoorbell() && code.equals(TALK_ACTION_CODE)) {
            String talkAction = event.payload().path("data").path("Action").asText();
            return Optional.of(SensorUpdate.of(Channel.DOORBELL, INVITE.equals(talkAction)));
        }

        return Optional.empty();
    }
}
