package at.sv.sun;

import at.sv.sun.time.EventTimeProvider;
import at.sv.sun.time.EventTimeProviderImpl;
import at.sv.sun.time.InvalidEventTimeExpression;
import at.sv.sun.time.SunTimesProviderImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Command(name = "sun-times", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints sunrise, sunset, solar noon and twilight times for a location and date.")
public final class SunTimesCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SunTimesCli.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to compute the sun times for. Default: today in the selected zone.")
    String date;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:ZONE}",
            description = "The time zone used for the date and the printed times, e.g. Europe/Vienna or +01:00. " +
                          "Default: the system time zone.")
    String zone;
    @Option(names = "--json",
            defaultValue = "false",
            description = "Print the sun times as JSON. Events that do not occur are printed as null. " +
                          "Resolved --at expressions are added under \"at\".")
    boolean json;
    @Option(names = "--at", paramLabel = "<expression>",
            description = "Resolve a time expression, e.g. 'sunset-30', 'civil_dawn+10' or '07:30'. Can be repeated.")
    List<String> expressions = new ArrayList<>();

    private final Supplier<ZonedDateTime> currentTime;

    public SunTimesCli() {
        this(ZonedDateTime::now);
    }

    public SunTimesCli(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SunTimesCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "cli");
        assertGeographicConfigurations();
        ZoneId zoneId = parseZone();
        ZonedDateTime now = currentTime.get().withZoneSameInstant(zoneId);
        LocalDate localDate = parseDate(now);
        LOG.debug("Computing sun times for [{}, {}] on {} in {}", latitude, longitude, localDate, zoneId);

        SolarPositionEngine engine = new SolarPositionEngine(latitude, longitude);
        SolarEventReport report = engine.getEvents(localDate, zoneId);
        Map<String, String> resolved = resolveExpressions(
                new EventTimeProviderImpl(new SunTimesProviderImpl(engine)), localDate.atStartOfDay(zoneId));
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(report, resolved));
        } else {
            printReport(out, report, now);
            printExpressions(out, resolved);
        }
        out.flush();
    }

    private static void printReport(PrintWriter out, SolarEventReport report, ZonedDateTime now) {
        out.println("Location: " + report.getCoordinate());
        out.println("Date:     " + report.getDate());
        out.println("Timezone: " + report.getZone());
        out.println();
        out.println(report.toDebugString());
        out.println();
        out.println("daylight: " + FormatUtil.formatDuration(report.getDaylightLength()));
        if (report.getDate().equals(now.toLocalDate())) {
            Optional<ZonedDateTime> sunrise = report.get(SolarEvent.SUNRISE);
            Optional<ZonedDateTime> sunset = report.get(SolarEvent.SUNSET);
            if (sunrise.isPresent() && sunset.isPresent()
                && !now.isBefore(sunrise.get()) && now.isBefore(sunset.get())) {
                out.println("daylight left: " + FormatUtil.formatDuration(Duration.between(now, sunset.get())));
            }
        }
    }

    private static void printExpressions(PrintWriter out, Map<String, String> resolved) {
        if (resolved.isEmpty()) {
            return;
        }
        out.println();
        resolved.forEach((expression, time) -> out.println(expression + ": " + (time == null ? "does not occur" : time)));
    }

    /**
     * @return every expression mapped to its ISO-8601 timestamp, or to {@code null} if its sun event does not occur
     */
    private Map<String, String> resolveExpressions(EventTimeProvider provider, ZonedDateTime dateTime) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String expression : expressions) {
            try {
                ZonedDateTime time = provider.getTime(expression, dateTime);
                resolved.put(expression, DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time));
            } catch (SolarEventDoesNotOccur e) {
                LOG.debug("'{}' cannot be resolved: {}", expression, e.getMessage());
                resolved.put(expression, null);
            } catch (InvalidEventTimeExpression e) {
                fail("--at " + e.getMessage());
            }
        }
        return resolved;
    }

    private static String toJson(SolarEventReport report, Map<String, String> resolved) {
        if (resolved.isEmpty()) {
            return report.toJson();
        }
        Map<String, Object> map = new LinkedHashMap<>(report.toMap());
        map.put("at", resolved);
        try {
            return MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize solar events of " + report.getDate(), e);
        }
    }

    private void assertGeographicConfigurations() {
        if (!(latitude >= -90 && latitude <= 90)) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private ZoneId parseZone() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            fail("--zone '" + zone + "' is not a valid time zone: " + e.getMessage());
            return null;
        }
    }

    private LocalDate parseDate(ZonedDateTime now) {
        if (date == null || date.isBlank()) {
            return now.toLocalDate();
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            fail("--date '" + date + "' must be formatted as yyyy-MM-dd");
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
