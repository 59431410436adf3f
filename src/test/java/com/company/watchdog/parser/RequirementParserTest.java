package com.company.watchdog.parser;

import com.company.watchdog.domain.Requirement;
import com.company.watchdog.domain.enums.ValidationFailure;
import com.company.watchdog.exception.ConfigParseException;
import com.company.watchdog.exception.RequirementValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequirementParserTest {

    private final RequirementParser parser = new RequirementParser();

    @Test
    void shouldParseEveryFieldOfRangeForm() {
        Requirement requirement = parser.parse(
                "CHECKHOURS0-9 CHECKMINUTES0-10 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS3600");

        assertThat(requirement.getHoursLower()).isEqualTo(0);
        assertThat(requirement.getHoursUpper()).isEqualTo(9);
        assertThat(requirement.getMinutesLower()).isEqualTo(0);
        assertThat(requirement.getMinutesUpper()).isEqualTo(10);
        assertThat(requirement.getMinutesStride()).isNull();
        assertThat(requirement.hasMinuteStride()).isFalse();
        assertThat(requirement.isIncludeWeekdays()).isTrue();
        assertThat(requirement.isIncludeWeekends()).isFalse();
        assertThat(requirement.getMinNum()).isEqualTo(5);
        assertThat(requirement.getMaxNum()).isEqualTo(20);
        assertThat(requirement.getLookbackSeconds()).isEqualTo(3600);
    }

    @Test
    void shouldParseMinuteStride() {
        Requirement requirement = parser.parse(
                "CHECKHOURS0-9 CHECKMINUTES*/10 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS3600");

        assertThat(requirement.getMinutesStride()).isEqualTo(10);
        assertThat(requirement.getMinutesLower()).isNull();
        assertThat(requirement.getMinutesUpper()).isNull();
        assertThat(requirement.hasMinuteStride()).isTrue();
    }

    @Test
    void shouldAcceptTokensInAnyOrderWithExtraWhitespace() {
        Requirement requirement = parser.parse(
                "  LOOKBACKSECONDS60\tWEEKENDS MAXNUM3  MINNUM0 WEEKDAYS CHECKMINUTES5-5 CHECKHOURS23-23 ");

        assertThat(requirement.getHoursLower()).isEqualTo(23);
        assertThat(requirement.getHoursUpper()).isEqualTo(23);
        assertThat(requirement.getMinutesLower()).isEqualTo(5);
        assertThat(requirement.isIncludeWeekdays()).isTrue();
        assertThat(requirement.isIncludeWeekends()).isTrue();
        assertThat(requirement.getMinNum()).isZero();
        assertThat(requirement.getMaxNum()).isEqualTo(3);
        assertThat(requirement.getLookbackSeconds()).isEqualTo(60);
    }

    @Test
    void shouldAllowMinNumEqualToMaxNum() {
        Requirement requirement = parser.parse(
                "CHECKHOURS0-23 CHECKMINUTES0-59 WEEKDAYS MINNUM7 MAXNUM7 LOOKBACKSECONDS60");

        assertThat(requirement.getMinNum()).isEqualTo(7);
        assertThat(requirement.getMaxNum()).isEqualTo(7);
    }

    @Test
    void shouldRejectSwitchedHoursRange() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS9-5 CHECKMINUTES0-0 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .isInstanceOf(RequirementValidationException.class)
                .hasMessage("bad hours relationship")
                .extracting("failure").isEqualTo(ValidationFailure.BAD_HOURS_RELATIONSHIP);
    }

    @Test
    void shouldRejectSwitchedMinutesRange() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES9-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .isInstanceOf(RequirementValidationException.class)
                .hasMessage("bad minutes relationship");
    }

    @Test
    void shouldReportMissingHoursBeforeValidatingOtherSections() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKMINUTES9-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .isInstanceOf(RequirementValidationException.class)
                .hasMessage("missing CHECKHOURS")
                .extracting("failure").isEqualTo(ValidationFailure.MISSING_KEYWORD);
    }

    @Test
    void shouldRejectSwitchedMinMax() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES9-15 WEEKDAYS MINNUM500 MAXNUM20 LOOKBACKSECONDS1000"))
                .hasMessage("bad minnum/maxnum")
                .extracting("failure").isEqualTo(ValidationFailure.BAD_MIN_MAX);
    }

    @Test
    void shouldRejectMinutesOutOfRange() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-60 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .hasMessage("out of range minutes specified")
                .extracting("failure").isEqualTo(ValidationFailure.MINUTES_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectHoursOutOfRange() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-24 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .hasMessage("out of range hours specified")
                .extracting("failure").isEqualTo(ValidationFailure.HOURS_OUT_OF_RANGE);
    }

    @Test
    void shouldRejectMissingDayOfWeek() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-5 MINNUM5 MAXNUM20 LOOKBACKSECONDS1000"))
                .hasMessage("No weekend/weekday info supplied")
                .extracting("failure").isEqualTo(ValidationFailure.MISSING_DAY_OF_WEEK);
    }

    @Test
    void shouldRejectZeroLookback() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS0"))
                .extracting("failure").isEqualTo(ValidationFailure.BAD_LOOKBACK);
    }

    @ParameterizedTest
    @CsvSource({
            "31536001",
            "10000000000000",
            "9223372036854775807"
    })
    void shouldRejectLookbackLongerThanOneYear(String lookbackSeconds) {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-23 CHECKMINUTES0-59 WEEKDAYS WEEKENDS MINNUM1 MAXNUM5 LOOKBACKSECONDS" + lookbackSeconds))
                .isInstanceOf(RequirementValidationException.class)
                .hasMessage("bad lookback seconds")
                .extracting("failure").isEqualTo(ValidationFailure.BAD_LOOKBACK);
    }

    @Test
    void shouldAcceptLookbackOfExactlyOneYear() {
        Requirement requirement = parser.parse(
                "CHECKHOURS0-23 CHECKMINUTES0-59 WEEKDAYS WEEKENDS MINNUM1 MAXNUM5 LOOKBACKSECONDS31536000");

        assertThat(requirement.getLookbackSeconds()).isEqualTo(RequirementParser.MAX_LOOKBACK_SECONDS);
    }

    @Test
    void shouldRejectLowercaseAndPunctuation() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-5 weekdays MINNUM5 MAXNUM20 LOOKBACKSECONDS60"))
                .hasMessage("Bad characters detected in requirements")
                .extracting("failure").isEqualTo(ValidationFailure.BAD_CHARACTERS);

        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS60;"))
                .extracting("failure").isEqualTo(ValidationFailure.BAD_CHARACTERS);
    }

    @ParameterizedTest
    @CsvSource({
            "CHECKMINUTES*/0, BAD_MINUTE_STRIDE",
            "CHECKMINUTES*/59, BAD_MINUTE_STRIDE",
            "CHECKMINUTES*/, MALFORMED_VALUE",
            "CHECKMINUTES10, MALFORMED_VALUE",
            "CHECKMINUTES1-2-3, MALFORMED_VALUE"
    })
    void shouldRejectBadMinuteRules(String minutesToken, ValidationFailure expected) {
        String text = "CHECKHOURS0-5 " + minutesToken + " WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS60";

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOf(RequirementValidationException.class)
                .extracting("failure").isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MAXNUM20 LOOKBACKSECONDS60, missing MINNUM",
            "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MINNUM5 LOOKBACKSECONDS60, missing MAXNUM",
            "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20, missing LOOKBACKSECONDS",
            "CHECKHOURS0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS60, missing CHECKMINUTES"
    })
    void shouldNameTheMissingKeyword(String text, String expectedMessage) {
        assertThatThrownBy(() -> parser.parse(text))
                .hasMessage(expectedMessage)
                .extracting("failure").isEqualTo(ValidationFailure.MISSING_KEYWORD);
    }

    @Test
    void shouldRejectUnknownAndDuplicateTokens() {
        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS60 EVERYDAY"))
                .extracting("failure").isEqualTo(ValidationFailure.UNKNOWN_TOKEN);

        assertThatThrownBy(() -> parser.parse(
                "CHECKHOURS0-5 CHECKHOURS6-7 CHECKMINUTES0-5 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS60"))
                .hasMessage("duplicate CHECKHOURS")
                .extracting("failure").isEqualTo(ValidationFailure.DUPLICATE_KEYWORD);
    }

    @Test
    void shouldTreatValidationFailuresAsParseErrors() {
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(ConfigParseException.class);
    }
}
