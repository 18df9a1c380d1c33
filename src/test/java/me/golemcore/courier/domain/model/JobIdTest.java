package me.golemcore.courier.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobIdTest {

    @Test
    void equalityIsStructural() {
        assertEquals(JobId.of("U1", "2024-01-01 00:00:00"), JobId.of("U1", "2024-01-01 00:00:00"));
        assertEquals(JobId.of("U1", "2024-01-01 00:00:00").hashCode(),
                JobId.of("U1", "2024-01-01 00:00:00").hashCode());
    }

    @Test
    void colludingLegacyStringsStayDistinct() {
        JobId first = JobId.of("U1", "2");
        JobId second = JobId.of("U", "12");

        assertEquals(first.asLegacyString(), second.asLegacyString());
        assertNotEquals(first, second);
    }

    @Test
    void recordKeyAndJobIdAgree() {
        RecordKey key = new RecordKey("U1", "2024-01-01 00:00:00");

        assertEquals(key, key.jobId().key());
        assertEquals("U12024-01-01 00:00:00", key.jobId().toString());
    }

    @Test
    void sharedChannelRequiresDistinctChannelId() {
        ScheduleRecord direct = ScheduleRecord.builder().recipientId("R1").build();
        ScheduleRecord sameAsRecipient = ScheduleRecord.builder().recipientId("R1").channelId("R1").build();
        ScheduleRecord channel = ScheduleRecord.builder().recipientId("R1").channelId("C1").build();

        assertFalse(direct.hasSharedChannel());
        assertFalse(sameAsRecipient.hasSharedChannel());
        assertTrue(channel.hasSharedChannel());
    }
}
