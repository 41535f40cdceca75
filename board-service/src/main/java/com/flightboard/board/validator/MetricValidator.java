package com.flightboard.board.validator;

import com.flightboard.board.constants.CacheConstants;
import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.exception.FlightBoardValidationException;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guards names, tags, cache keys and invalidation patterns before they reach the
 * cache gateway or the metrics sink. Every violation is thrown to the caller.
 */
public final class MetricValidator {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_TAGS = 20;
    public static final int MAX_TAG_KEY_LENGTH = 50;
    public static final int MAX_TAG_VALUE_LENGTH = 200;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.\\-]+$");
    private static final Pattern CACHE_PATTERN_CHARSET = Pattern.compile("^[A-Za-z0-9_.\\-:*?\\[\\]]+$");
    private static final Pattern BARE_WILDCARD = Pattern.compile("^[*?]+$");

    private MetricValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateMetricName(String name) {
        validateName(name, ValidationMessages.METRIC_NAME_REQUIRED,
                ValidationMessages.METRIC_NAME_TOO_LONG, ValidationMessages.METRIC_NAME_INVALID);
    }

    public static void validateMetricValue(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FlightBoardValidationException(ValidationMessages.METRIC_VALUE_INVALID);
        }
    }

    public static void validateEventName(String name) {
        validateName(name, ValidationMessages.EVENT_NAME_REQUIRED,
                ValidationMessages.EVENT_NAME_TOO_LONG, ValidationMessages.EVENT_NAME_INVALID);
    }

    /**
     * Null or empty tags are accepted; a present map is checked entry by entry.
     */
    public static void validateTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return;
        }
        if (tags.size() > MAX_TAGS) {
            throw new FlightBoardValidationException(ValidationMessages.TOO_MANY_TAGS);
        }

        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (!StringUtils.hasText(tag.getKey())) {
                throw new FlightBoardValidationException(ValidationMessages.TAG_KEY_REQUIRED);
            }
            if (tag.getKey().length() > MAX_TAG_KEY_LENGTH) {
                throw new FlightBoardValidationException(ValidationMessages.TAG_KEY_TOO_LONG);
            }
            if (tag.getValue() != null && tag.getValue().length() > MAX_TAG_VALUE_LENGTH) {
                throw new FlightBoardValidationException(ValidationMessages.TAG_VALUE_TOO_LONG);
            }
        }
    }

    public static void validatePattern(String pattern) {
        if (!StringUtils.hasText(pattern)) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_REQUIRED);
        }
        if (pattern.length() > CacheConstants.MAX_PATTERN_LENGTH) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_TOO_LONG);
        }
        if (!CACHE_PATTERN_CHARSET.matcher(pattern).matches()) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_INVALID);
        }
        if (BARE_WILDCARD.matcher(pattern).matches()) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_TOO_BROAD);
        }
        validateCharacterClasses(pattern);
    }

    public static void validateCacheKey(String key) {
        if (!StringUtils.hasText(key)) {
            throw new FlightBoardValidationException(ValidationMessages.CACHE_KEY_REQUIRED);
        }
        if (key.length() > CacheConstants.MAX_KEY_LENGTH) {
            throw new FlightBoardValidationException(ValidationMessages.CACHE_KEY_TOO_LONG);
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new FlightBoardValidationException(ValidationMessages.CACHE_KEY_INVALID);
            }
        }
    }

    private static void validateName(String name, String requiredMessage, String tooLongMessage,
                                     String invalidMessage) {
        if (name == null || name.isEmpty()) {
            throw new FlightBoardValidationException(requiredMessage);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new FlightBoardValidationException(tooLongMessage);
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new FlightBoardValidationException(invalidMessage);
        }
    }

    private static void validateCharacterClasses(String pattern) {
        boolean open = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '[') {
                if (open) {
                    throw new FlightBoardValidationException(ValidationMessages.PATTERN_UNBALANCED);
                }
                open = true;
            } else if (open && c == '-' && pattern.charAt(i - 1) != '['
                    && i + 1 < pattern.length() && pattern.charAt(i + 1) != ']'
                    && pattern.charAt(i + 1) < pattern.charAt(i - 1)) {
                throw new FlightBoardValidationException(ValidationMessages.PATTERN_BAD_RANGE);
            } else if (c == ']') {
                if (!open || pattern.charAt(i - 1) == '[') {
                    throw new FlightBoardValidationException(ValidationMessages.PATTERN_UNBALANCED);
                }
                open = false;
            }
        }
        if (open) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_UNBALANCED);
        }
    }
}
