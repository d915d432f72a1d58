package at.sv.sun;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All solar events of one date and location. Events that do not occur are absent from {@link #getEvents()} and
 * reported as {@code null} in the JSON representation.
 */
public final class SolarEventReport {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String ABSENT_TIME = "--:--:--";
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Getter
    private final GeoCoordinate coordinate;
    @Getter
    private final LocalDate date;
    @Getter
    private final ZoneId zone;
    private final Map<SolarEvent, ZonedDateTime> events;
    @Getter
    private final Duration daylightLength;

    SolarEventReport(GeoCoordinate coordinate, LocalDate date, ZoneId zone, Map<SolarEvent, ZonedDateTime> events,
                     Duration daylightLength) {
        this.coordinate = coordinate;
        this.date = date;
        this.zone = zone;
        this.events = events.isEmpty() ? new EnumMap<>(SolarEvent.class) : new EnumMap<>(events);
        this.daylightLength = daylightLength;
    }

    public Optional<ZonedDateTime> get(SolarEvent event) {
        return Optional.ofNullable(events.get(event));
    }

    /**
     * @return the occurring events in chronological order
     */
    public Map<SolarEvent, ZonedDateTime> getEvents() {
        return Collections.unmodifiableMap(events);
    }

    /**
     * @return every event keyword mapped to its ISO-8601 timestamp, or to {@code null} if it does not occur, followed
     * by {@code daylight_length}
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (SolarEvent event : SolarEvent.values()) {
            map.put(event.getKeyword(), get(event).map(DateTimeFormatter.ISO_OFFSET_DATE_TIME::format).orElse(null));
        }
        map.put("daylight_length", daylightLength.toString());
        return map;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize solar events of " + date, e);
        }
    }

    public String toDebugString() {
        StringBuilder builder = new StringBuilder();
        for (SolarEvent event : SolarEvent.values()) {
            if (!builder.isEmpty()) {
                builder.append('\n');
            }
            builder.append(event.getKeyword()).append(": ").append(get(event).map(TIME_FORMATTER::format).orElse(ABSENT_TIME));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "SolarEventReport{" + coordinate + " on " + date + " " + toMap() + '}';
    }
}
