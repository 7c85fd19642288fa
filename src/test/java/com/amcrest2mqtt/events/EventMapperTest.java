package com.amcrest2mqtt.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.amcrest2mqtt.device.Capabilities;
import com.amcrest2mqtt.device.DeviceEvent;
import com.amcrest2mqtt.device.EventStreamParser;
import com.amcrest2mqtt.topics.Channel;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class EventMapperTest {
    static DeviceEvent parse(String part) {
        DeviceEvent event = EventStreamParser.parseEvent(part);
        if (event == null) {
            throw new IllegalArgumentException(part);
        }
        return event;
    }

    static Optional<SensorUpdate> map(String deviceType, String part) {
        return new EventMapper(Capabilities.forDeviceType(deviceType)).map(parse(part));
    }

    @Test
    public void videoMotionStartOnAd410() {
        assertEquals(Optional.of(SensorUpdate.of(Channel.MOTION, true)),
                map("AD410", "Code=VideoMotion;action=Start;index=0"));
        assertEquals(Optional.of(SensorUpdate.of(Channel.MOTION, false)),
                map("AD410", "Code=VideoMotion;action=Stop;index=0"));
    }

    @Test
    public void ad110ReportsMotionAsProfileAlarmTransmit() {
        assertEquals(Optional.of(SensorUpdate.of(Channel.MOTION, true)),
                map("AD110", "Code=ProfileAlarmTransmit;action=Start;index=0"));
        assertFalse(map("AD110", "Code=VideoMotion;action=Start;index=0").isPresent());
    }

    @Test
    public void humanDetectionStop() {
        assertEquals(Optional.of(ImmutableSensorUpdate.of(Channel.HUMAN, "off")),
                map("AD410", "Code=CrossRegionDetection;action=Stop;index=0;data={\"ObjectType\":\"Human\",}"));
        assertEquals(Optional.of(ImmutableSensorUpdate.of(Channel.HUMAN, "on")),
                map("AD410", "Code=CrossRegionDetection;action=Start;index=0;data={\"ObjectType\":\"Human\"}"));
    }

    @Test
    public void crossRegionDetectionOfOtherObjectsIsNotMapped() {
        assertFalse(map("AD410",
                "Code=CrossRegionDetection;action=Start;index=0;data={\"ObjectType\":\"Vehicle\"}").isPresent());
        assertFalse(map("AD110",
                "Code=CrossRegionDetection;action=Start;index=0;data={\"ObjectType\":\"Human\"}").isPresent());
    }

    @Test
    public void doorbellPress() {
        assertEquals(Optional.of(ImmutableSensorUpdate.of(Channel.DOORBELL, "on")),
                map("AD110", "Code=_DoTalkAction_;action=Pulse;index=0;data={\"Action\":\"Invite\"}"));
        assertEquals(Optional.of(ImmutableSensorUpdate.of(Channel.DOORBELL, "off")),
                map("AD110", "Code=_DoTalkAction_;action=Pulse;index=0;data={\"Action\":\"Hangup\"}"));
    }

    @Test
    public void unrecognisedModelHasNoDoorbell() {
        assertFalse(map("IPC-T5442", "Code=_DoTalkAction_;action=Pulse;index=0;data={\"Action\":\"Invite\"}")
                .isPresent());
        assertEquals(Optional.of(SensorUpdate.of(Channel.MOTION, true)),
                map("IPC-T5442", "Code=VideoMotion;action=Start;index=0"));
    }

    @Test
    public void unknownCodesAreNotMapped() {
        assertFalse(map("AD410", "Code=NewFile;action=Pulse;index=0;data={\"File\":\"/mnt/sd/1.jpg\"}").isPresent());
        assertFalse(map("AD410", "Code=CallNoAnswered;action=Start;index=0").isPresent());
    }

    @Test
    public void mappingDependsOnlyOnTheEvent() {
        EventMapper mapper = new EventMapper(Capabilities.forDeviceType("AD410"));
        DeviceEvent start = parse("Code=VideoMotion;action=Start;index=0");
        Optional<SensorUpdate> first = mapper.map(start);
        mapper.map(parse("Code=VideoMotion;action=Stop;index=0"));

        assertEquals(first, mapper.map(start));
    }
}
