package com.gatekeeper.policy;

import com.gatekeeper.model.Rate;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rate strings of the form {@code "<count> per [<amount>] <unit>"}, for example
 * {@code "5 per 5 minutes"} or {@code "100 per hour"}.
 */
public final class RateParser {

    private static final Pattern RATE = Pattern.compile(
            "^\\s*(\\d+)\\s+per\\s+(?:(\\d+)\\s+)?(second|minute|hour|day)s?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private RateParser() {
    }

    public static Rate parse(String rate) {
        if (rate == null) {
            throw new PolicyConfigurationException("Rate limit string is missing");
        }
        Matcher matcher = RATE.matcher(rate);
        if (!matcher.matches()) {
            throw new PolicyConfigurationException("Malformed rate limit string: '" + rate + "'");
        }
        try {
            int count = Integer.parseInt(matcher.group(1));
            long amount = matcher.group(2) != null ? Long.parseLong(matcher.group(2)) : 1L;
            if (count <= 0 || amount <= 0) {
                throw new PolicyConfigurationException("Rate limit values must be positive: '" + rate + "'");
            }
            long period = Math.multiplyExact(amount, unitSeconds(matcher.group(3)));
            return new Rate(count, period);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new PolicyConfigurationException("Rate limit out of range: '" + rate + "'", e);
        }
    }

    private static long unitSeconds(String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "second" -> 1L;
            case "minute" -> 60L;
            case "hour" -> 3_600L;
            case "day" -> 86_400L;
            default -> throw new PolicyConfigurationException("Unknown time unit: " + unit);
        };
    }
}
