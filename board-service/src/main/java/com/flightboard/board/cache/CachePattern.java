package com.flightboard.board.cache;

import com.flightboard.board.constants.ValidationMessages;
import com.flightboard.board.exception.FlightBoardValidationException;
import com.flightboard.board.validator.MetricValidator;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A validated glob used for bulk invalidation. {@code *} matches any run of characters,
 * {@code ?} a single character and {@code [...]} one character of the class. The glob is
 * passed verbatim to Redis {@code SCAN MATCH}; locally it is compiled to an equivalent regex.
 */
public final class CachePattern {

    private final String glob;
    private final Pattern regex;

    private CachePattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static CachePattern of(String glob) {
        MetricValidator.validatePattern(glob);
        try {
            return new CachePattern(glob, Pattern.compile(toRegex(glob)));
        } catch (PatternSyntaxException e) {
            throw new FlightBoardValidationException(ValidationMessages.PATTERN_INVALID);
        }
    }

    public boolean matches(String key) {
        return key != null && regex.matcher(key).matches();
    }

    public String glob() {
        return glob;
    }

    private static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    regex.append(']');
                    inClass = false;
                } else if (c == '-' || Character.isLetterOrDigit(c)) {
                    regex.append(c);
                } else {
                    regex.append('\\').append(c);
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    regex.append('[');
                    inClass = true;
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
