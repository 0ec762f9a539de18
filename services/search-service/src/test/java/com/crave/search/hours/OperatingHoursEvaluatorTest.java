package com.crave.search.hours;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class OperatingHoursEvaluatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OperatingHoursEvaluator evaluator = new OperatingHoursEvaluator();

    // 2024-01-15 is a Monday; New York is UTC-5 in January.
    private static final Instant MONDAY_NOON_NY = Instant.parse("2024-01-15T17:00:00Z");
    private static final Instant MONDAY_EVENING_NY = Instant.parse("2024-01-15T23:00:00Z");

    @Test
    void openInsideTodaysSegment() throws Exception {
        HoursSource source = new HoursSource(
            json("{\"monday\":\"9:00 AM - 5:00 PM\",\"tuesday\":\"9:00 AM - 5:00 PM\"}"),
            "America/New_York",
            null
        );

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status).isNotNull();
        assertThat(status.isOpen()).isTrue();
        assertThat(status.getClosesAtDisplay()).isEqualTo("5:00 PM");
        assertThat(status.getClosesInMinutes()).isEqualTo(300);
        assertThat(status.getNextOpenDisplay()).isNull();
    }

    @Test
    void closedAfterHoursReportsTomorrowsOpening() throws Exception {
        HoursSource source = new HoursSource(
            json("{\"monday\":\"9:00 AM - 5:00 PM\",\"tuesday\":\"9:30 AM - 5:00 PM\"}"),
            "America/New_York",
            null
        );

        OperatingStatus status = evaluator.evaluate(source, MONDAY_EVENING_NY);

        assertThat(status.isOpen()).isFalse();
        assertThat(status.getNextOpenDisplay()).isEqualTo("9:30 AM tomorrow");
    }

    @Test
    void closedBeforeOpeningReportsSameDayTimeWithoutLabel() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"5:00 PM - 11:00 PM\"}"), "America/New_York", null);

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status.isOpen()).isFalse();
        assertThat(status.getNextOpenDisplay()).isEqualTo("5:00 PM");
    }

    @Test
    void nextOpeningSeveralDaysOutUsesShortDayName() throws Exception {
        HoursSource source = new HoursSource(json("{\"wednesday\":\"9:00 AM - 5:00 PM\"}"), "America/New_York", null);

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status.isOpen()).isFalse();
        assertThat(status.getNextOpenDisplay()).isEqualTo("9:00 AM Wed");
    }

    @Test
    void nextOpeningPicksEarliestSegmentRegardlessOfListOrder() throws Exception {
        HoursSource source = new HoursSource(
            json("{\"monday\":\"9:00 AM - 5:00 PM\",\"tuesday\":[\"6:00 PM - 10:00 PM\",\"7:00 AM - 11:00 AM\"]}"),
            "America/New_York",
            null
        );

        OperatingStatus status = evaluator.evaluate(source, MONDAY_EVENING_NY);

        assertThat(status.isOpen()).isFalse();
        assertThat(status.getNextOpenDisplay()).isEqualTo("7:00 AM tomorrow");
    }

    @Test
    void onlyOpeningAlreadyPassedTodayWrapsToNextWeek() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"9:00 AM - 5:00 PM\"}"), "America/New_York", null);

        OperatingStatus status = evaluator.evaluate(source, MONDAY_EVENING_NY);

        assertThat(status.isOpen()).isFalse();
        assertThat(status.getNextOpenDisplay()).isEqualTo("9:00 AM Mon");
    }

    @Test
    void previousDaySegmentCrossingMidnightKeepsVenueOpen() throws Exception {
        HoursSource source = new HoursSource(json("{\"friday\":\"6:00 PM - 2:00 AM\"}"), "America/New_York", null);
        // Saturday 01:00 in New York
        Instant saturdayEarly = Instant.parse("2024-01-20T06:00:00Z");

        OperatingStatus status = evaluator.evaluate(source, saturdayEarly);

        assertThat(status.isOpen()).isTrue();
        assertThat(status.getClosesAtDisplay()).isEqualTo("2:00 AM");
        assertThat(status.getClosesInMinutes()).isEqualTo(60);
    }

    @Test
    void segmentCrossingMidnightCountsMinutesIntoNextDay() throws Exception {
        HoursSource source = new HoursSource(json("{\"friday\":\"6:00 PM - 2:00 AM\"}"), "America/New_York", null);
        // Friday 23:00 in New York
        Instant fridayLate = Instant.parse("2024-01-20T04:00:00Z");

        OperatingStatus status = evaluator.evaluate(source, fridayLate);

        assertThat(status.isOpen()).isTrue();
        assertThat(status.getClosesInMinutes()).isEqualTo(180);
    }

    @Test
    void fallsBackToUtcOffsetWhenZoneIsMissing() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"9-17\"}"), null, -300.0);

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status.isOpen()).isTrue();
        assertThat(status.getClosesInMinutes()).isEqualTo(300);
    }

    @Test
    void twelveHourRangeWithUtcOffsetAtTwoInTheAfternoon() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"9:00 AM - 5:00 PM\"}"), null, -300.0);
        // 19:00 UTC is 14:00 at UTC-5
        Instant mondayTwoPmLocal = Instant.parse("2024-01-15T19:00:00Z");

        OperatingStatus status = evaluator.evaluate(source, mondayTwoPmLocal);

        assertThat(status).isNotNull();
        assertThat(status.isOpen()).isTrue();
        assertThat(status.getClosesAtDisplay()).isEqualTo("5:00 PM");
        assertThat(status.getClosesInMinutes()).isEqualTo(180);
    }

    @Test
    void unknownZoneFallsBackToOffset() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"9-17\"}"), "Mars/Olympus_Mons", -300.0);

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status).isNotNull();
        assertThat(status.isOpen()).isTrue();
    }

    @Test
    void zoneEmbeddedInHoursDocumentIsHonoured() throws Exception {
        HoursSource source = HoursSource.fromLocation(
            json("{\"monday\":\"9:00 AM - 5:00 PM\",\"timezone\":\"America/New_York\"}"),
            null,
            null
        );

        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status.isOpen()).isTrue();
    }

    @Test
    void undeterminedWithoutZoneOrOffset() throws Exception {
        HoursSource source = new HoursSource(json("{\"monday\":\"9:00 AM - 5:00 PM\"}"), null, null);

        assertThat(evaluator.evaluate(source, MONDAY_NOON_NY)).isNull();
    }

    @Test
    void undeterminedWithoutUsableSchedule() throws Exception {
        assertThat(evaluator.evaluate(new HoursSource(json("42"), "UTC", null), MONDAY_NOON_NY)).isNull();
        assertThat(evaluator.evaluate(new HoursSource(json("{\"monday\":\"closed\"}"), "UTC", null), MONDAY_NOON_NY))
            .isNull();
        assertThat(evaluator.evaluate(null, MONDAY_NOON_NY)).isNull();
        HoursSource garbled = new HoursSource(
            json("{\"monday\":{\"open\":\"abc\",\"close\":\"xyz\"}}"),
            "America/New_York",
            null
        );
        assertThat(evaluator.evaluate(garbled, MONDAY_NOON_NY)).isNull();
    }

    @Test
    void restaurantMetadataIsUsedWhenLocationHasNothing() throws Exception {
        JsonNode metadata = json(
            "{\"hours\":{\"monday\":\"9:00 AM - 5:00 PM\"},\"timezone\":\"America/New_York\"}"
        );

        HoursSource source = HoursSource.resolve(null, null, null, metadata);
        OperatingStatus status = evaluator.evaluate(source, MONDAY_NOON_NY);

        assertThat(status.isOpen()).isTrue();
    }

    @Test
    void formatsMinutesOnTwelveHourClock() {
        assertThat(OperatingHoursEvaluator.formatMinutes(0)).isEqualTo("12:00 AM");
        assertThat(OperatingHoursEvaluator.formatMinutes(720)).isEqualTo("12:00 PM");
        assertThat(OperatingHoursEvaluator.formatMinutes(1020)).isEqualTo("5:00 PM");
        assertThat(OperatingHoursEvaluator.formatMinutes(1440 + 90)).isEqualTo("1:30 AM");
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }
}
