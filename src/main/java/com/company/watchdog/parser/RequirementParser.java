package com.company.watchdog.parser;

import com.company.watchdog.domain.Requirement;
import com.company.watchdog.domain.enums.ValidationFailure;
import com.company.watchdog.exception.RequirementValidationException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses a requirement line such as
 * {@code CHECKHOURS9-17 CHECKMINUTES*&#47;10 WEEKDAYS MINNUM5 MAXNUM20 LOOKBACKSECONDS3600}.
 *
 * <p>Every field must be spelled out; nothing is defaulted. Any problem is reported as a
 * {@link RequirementValidationException} carrying a {@link ValidationFailure} kind.
 */
@Component
public class RequirementParser {

    static final String CHECK_HOURS = "CHECKHOURS";
    static final String CHECK_MINUTES = "CHECKMINUTES";
    static final String MIN_NUM = "MINNUM";
    static final String MAX_NUM = "MAXNUM";
    static final String LOOKBACK_SECONDS = "LOOKBACKSECONDS";
    static final String WEEKDAYS = "WEEKDAYS";
    static final String WEEKENDS = "WEEKENDS";

    private static final List<String> VALUE_KEYWORDS =
            List.of(CHECK_HOURS, CHECK_MINUTES, MIN_NUM, MAX_NUM, LOOKBACK_SECONDS);

    private static final Pattern ALLOWED_CHARACTERS = Pattern.compile("[A-Z0-9\\s*/-]*");

    private static final String MINUTE_STRIDE_PREFIX = "*/";

    /** One year. Eligibility walks ten candidate minutes per lookback minute. */
    static final long MAX_LOOKBACK_SECONDS = 365L * 24 * 60 * 60;

    public Requirement parse(String requirementText) {
        if (requirementText == null || !ALLOWED_CHARACTERS.matcher(requirementText).matches()) {
            throw fail(ValidationFailure.BAD_CHARACTERS, "Bad characters detected in requirements");
        }

        Map<String, String> values = new HashMap<>();
        boolean includeWeekdays = false;
        boolean includeWeekends = false;

        for (String token : requirementText.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.equals(WEEKDAYS)) {
                if (includeWeekdays) {
                    throw fail(ValidationFailure.DUPLICATE_KEYWORD, "duplicate " + WEEKDAYS);
                }
                includeWeekdays = true;
                continue;
            }
            if (token.equals(WEEKENDS)) {
                if (includeWeekends) {
                    throw fail(ValidationFailure.DUPLICATE_KEYWORD, "duplicate " + WEEKENDS);
                }
                includeWeekends = true;
                continue;
            }

            String keyword = keywordOf(token);
            if (keyword == null) {
                throw fail(ValidationFailure.UNKNOWN_TOKEN, "unrecognized token " + token);
            }
            if (values.putIfAbsent(keyword, token.substring(keyword.length())) != null) {
                throw fail(ValidationFailure.DUPLICATE_KEYWORD, "duplicate " + keyword);
            }
        }

        for (String keyword : List.of(CHECK_HOURS, CHECK_MINUTES)) {
            requirePresent(values, keyword);
        }
        if (!includeWeekdays && !includeWeekends) {
            throw fail(ValidationFailure.MISSING_DAY_OF_WEEK, "No weekend/weekday info supplied");
        }
        for (String keyword : List.of(MAX_NUM, MIN_NUM, LOOKBACK_SECONDS)) {
            requirePresent(values, keyword);
        }

        Requirement.RequirementBuilder builder = Requirement.builder()
                .includeWeekdays(includeWeekdays)
                .includeWeekends(includeWeekends);

        parseHours(values.get(CHECK_HOURS), builder);
        parseMinutes(values.get(CHECK_MINUTES), builder);
        parseMinMax(values.get(MIN_NUM), values.get(MAX_NUM), builder);
        parseLookback(values.get(LOOKBACK_SECONDS), builder);

        return builder.build();
    }

    private void parseHours(String value, Requirement.RequirementBuilder builder) {
        long[] bounds = parseRange(value, "Couldn't parse hours info");
        if (bounds[0] > bounds[1]) {
            throw fail(ValidationFailure.BAD_HOURS_RELATIONSHIP, "bad hours relationship");
        }
        if (bounds[0] < 0 || bounds[1] > 23) {
            throw fail(ValidationFailure.HOURS_OUT_OF_RANGE, "out of range hours specified");
        }
        builder.hoursLower((int) bounds[0]).hoursUpper((int) bounds[1]);
    }

    private void parseMinutes(String value, Requirement.RequirementBuilder builder) {
        if (value.startsWith(MINUTE_STRIDE_PREFIX)) {
            long stride = parseNumber(value.substring(MINUTE_STRIDE_PREFIX.length()),
                    "Couldn't parse minutes info");
            if (stride <= 0 || stride >= 59) {
                throw fail(ValidationFailure.BAD_MINUTE_STRIDE, "bad minutes stride");
            }
            builder.minutesStride((int) stride);
            return;
        }

        long[] bounds = parseRange(value, "Couldn't parse minutes info");
        if (bounds[0] > bounds[1]) {
            throw fail(ValidationFailure.BAD_MINUTES_RELATIONSHIP, "bad minutes relationship");
        }
        if (bounds[0] < 0 || bounds[1] > 59) {
            throw fail(ValidationFailure.MINUTES_OUT_OF_RANGE, "out of range minutes specified");
        }
        builder.minutesLower((int) bounds[0]).minutesUpper((int) bounds[1]);
    }

    private void parseMinMax(String minValue, String maxValue, Requirement.RequirementBuilder builder) {
        long minNum = parseNumber(minValue, "Couldn't parse " + MIN_NUM);
        long maxNum = parseNumber(maxValue, "Couldn't parse " + MAX_NUM);
        if (minNum < 0 || minNum > maxNum) {
            throw fail(ValidationFailure.BAD_MIN_MAX, "bad minnum/maxnum");
        }
        builder.minNum(minNum).maxNum(maxNum);
    }

    private void parseLookback(String value, Requirement.RequirementBuilder builder) {
        long lookbackSeconds = parseNumber(value, "Couldn't parse " + LOOKBACK_SECONDS);
        if (lookbackSeconds <= 0 || lookbackSeconds > MAX_LOOKBACK_SECONDS) {
            throw fail(ValidationFailure.BAD_LOOKBACK, "bad lookback seconds");
        }
        builder.lookbackSeconds(lookbackSeconds);
    }

    private long[] parseRange(String value, String malformedMessage) {
        int dash = value.indexOf('-');
        if (dash < 0) {
            throw fail(ValidationFailure.MALFORMED_VALUE, malformedMessage);
        }
        long lower = parseNumber(value.substring(0, dash), malformedMessage);
        long upper = parseNumber(value.substring(dash + 1), malformedMessage);
        return new long[]{lower, upper};
    }

    private long parseNumber(String digits, String malformedMessage) {
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw fail(ValidationFailure.MALFORMED_VALUE, malformedMessage);
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw fail(ValidationFailure.MALFORMED_VALUE, malformedMessage);
        }
    }

    private static String keywordOf(String token) {
        for (String keyword : VALUE_KEYWORDS) {
            if (token.startsWith(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static void requirePresent(Map<String, String> values, String keyword) {
        if (!values.containsKey(keyword)) {
            throw fail(ValidationFailure.MISSING_KEYWORD, "missing " + keyword);
        }
    }

    private static RequirementValidationException fail(ValidationFailure failure, String message) {
        return new RequirementValidationException(failure, message);
    }
}
