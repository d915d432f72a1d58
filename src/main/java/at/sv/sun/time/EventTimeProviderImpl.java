package at.sv.sun.time;

import at.sv.sun.InvalidSolarComputation;
import at.sv.sun.SolarEvent;
import at.sv.sun.SolarEventDoesNotOccur;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class EventTimeProviderImpl implements EventTimeProvider {

    private static final Pattern OFFSET_EXPRESSION = Pattern.compile("([a-zA-Z_]+)\\s*(?:([+-])\\s*(\\d+))?");

    private final SunTimesProvider sunTimesProvider;
    private final Map<String, LocalTime> timeCache;

    public EventTimeProviderImpl(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
        timeCache = new ConcurrentHashMap<>();
    }

    @Override
    public ZonedDateTime getTime(String input, ZonedDateTime dateTime) {
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidEventTimeExpression("Empty time expression");
        }
        if (Character.isDigit(trimmed.charAt(0))) {
            return dateTime.with(parseTime(trimmed));
        }
        try {
            return parseOffsetExpression(trimmed, dateTime);
        } catch (SolarEventDoesNotOccur | InvalidSolarComputation | InvalidEventTimeExpression e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidEventTimeExpression("Failed to parse time expression '" + input + "': " + e.getMessage());
        }
    }

    private LocalTime parseTime(String input) {
        return timeCache.computeIfAbsent(input, k -> {
            try {
                return LocalTime.parse(k);
            } catch (DateTimeParseException e) {
                throw new InvalidEventTimeExpression("Invalid time '" + k + "': " + e.getMessage());
            }
        });
    }

    private ZonedDateTime parseOffsetExpression(String input, ZonedDateTime dateTime) {
        Matcher matcher = OFFSET_EXPRESSION.matcher(input);
        if (!matcher.matches()) {
            throw new InvalidEventTimeExpression("Invalid time expression: '" + input + "'");
        }
        ZonedDateTime eventTime = sunTimesProvider.getEvent(parseSunKeyword(matcher.group(1)), dateTime);
        if (matcher.group(2) == null) {
            return eventTime;
        }
        long offset = Long.parseLong(matcher.group(3));
        if ("+".equals(matcher.group(2))) {
            return eventTime.plusMinutes(offset);
        } else {
            return eventTime.minusMinutes(offset);
        }
    }

    private static SolarEvent parseSunKeyword(String keyword) {
        SolarEvent event = SolarEvent.fromKeyword(keyword);
        if (event == null) {
            throw new InvalidEventTimeExpression("Invalid sun keyword: '" + keyword + "'");
        }
        return event;
    }
}
