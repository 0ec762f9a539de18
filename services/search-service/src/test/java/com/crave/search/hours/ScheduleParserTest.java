package com.crave.search.hours;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.DayOfWeek;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScheduleParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesTwelveAndTwentyFourHourTimes() {
        assertThat(ScheduleParser.parseTime("12 am")).isEqualTo(0);
        assertThat(ScheduleParser.parseTime("12:30 PM")).isEqualTo(750);
        assertThat(ScheduleParser.parseTime("7pm")).isEqualTo(1140);
        assertThat(ScheduleParser.parseTime("17:45")).isEqualTo(1065);
        assertThat(ScheduleParser.parseTime("noon")).isNull();
    }

    @Test
    void dayMapSkipsMetadataKeysAndUnknownDays() throws Exception {
        WeeklySchedule schedule = ScheduleParser.parse(objectMapper.readTree(
            "{\"Monday\":\"11:00 AM – 10:00 PM\",\"timezone\":\"UTC\",\"holiday\":\"9-5\"}"
        ));

        assertThat(schedule).isNotNull();
        List<TimeSegment> monday = schedule.segmentsFor(DayOfWeek.MONDAY);
        assertThat(monday).hasSize(1);
        assertThat(monday.get(0).getStart()).isEqualTo(660);
        assertThat(monday.get(0).getEnd()).isEqualTo(1320);
        assertThat(schedule.segmentsFor(DayOfWeek.TUESDAY)).isEmpty();
    }

    @Test
    void dayValueMayListSeveralSegments() throws Exception {
        WeeklySchedule schedule = ScheduleParser.parse(objectMapper.readTree(
            "{\"saturday\":[\"11:00 AM - 2:00 PM\",{\"open\":\"5:00 PM\",\"close\":\"1:00 AM\"}]}"
        ));

        List<TimeSegment> saturday = schedule.segmentsFor(DayOfWeek.SATURDAY);
        assertThat(saturday).hasSize(2);
        assertThat(saturday.get(0).isCrossesMidnight()).isFalse();
        assertThat(saturday.get(1).isCrossesMidnight()).isTrue();
    }

    @Test
    void entryListReadsDayAndValueKeys() throws Exception {
        WeeklySchedule schedule = ScheduleParser.parse(objectMapper.readTree(
            "[{\"day\":\"tuesday\",\"open\":\"08:00\",\"close\":\"16:00\"},"
                + "{\"weekday\":\"Wednesday\",\"hours\":\"8am-4pm\"},"
                + "{\"hours\":\"no day\"}]"
        ));

        assertThat(schedule.segmentsFor(DayOfWeek.TUESDAY)).hasSize(1);
        assertThat(schedule.segmentsFor(DayOfWeek.WEDNESDAY).get(0).getEnd()).isEqualTo(960);
        assertThat(schedule.segmentsFor(DayOfWeek.THURSDAY)).isEmpty();
    }

    @Test
    void uniformTextAppliesToEveryDay() throws Exception {
        WeeklySchedule schedule = ScheduleParser.parse(objectMapper.readTree("\"10:00 AM - 9:00 PM\""));

        for (DayOfWeek day : DayOfWeek.values()) {
            assertThat(schedule.segmentsFor(day)).hasSize(1);
        }
    }

    @Test
    void unusableDocumentsYieldNoSchedule() throws Exception {
        assertThat(ScheduleParser.parse(null)).isNull();
        assertThat(ScheduleParser.parse(objectMapper.readTree("\"\""))).isNull();
        assertThat(ScheduleParser.parse(objectMapper.readTree("true"))).isNull();
        assertThat(ScheduleParser.parse(objectMapper.readTree("{\"monday\":\"closed\"}"))).isNull();
        assertThat(ScheduleParser.parse(objectMapper.readTree("{\"monday\":{\"open\":\"abc\",\"close\":\"xyz\"}}")))
            .isNull();
    }

    @Test
    void garbledDayObjectDoesNotInvalidateOtherDays() throws Exception {
        WeeklySchedule schedule = ScheduleParser.parse(objectMapper.readTree(
            "{\"monday\":{\"open\":\"abc\",\"close\":\"xyz\"},\"tuesday\":{\"open\":\"9:00 AM\",\"close\":\"5:00 PM\"}}"
        ));

        assertThat(schedule).isNotNull();
        assertThat(schedule.segmentsFor(DayOfWeek.MONDAY)).isEmpty();
        assertThat(schedule.segmentsFor(DayOfWeek.TUESDAY)).singleElement()
            .satisfies(segment -> {
                assertThat(segment.getStart()).isEqualTo(540);
                assertThat(segment.getEnd()).isEqualTo(1020);
            });
    }

    @Test
    void closeAtOrBeforeOpenCrossesMidnight() {
        assertThat(TimeSegment.between(1080, 120).isCrossesMidnight()).isTrue();
        assertThat(TimeSegment.between(540, 1020).isCrossesMidnight()).isFalse();
    }
}
