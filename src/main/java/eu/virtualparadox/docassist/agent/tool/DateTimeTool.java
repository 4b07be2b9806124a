package eu.virtualparadox.docassist.agent.tool;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Current date/time and day differences between ISO dates.
 */
@Component
public class DateTimeTool extends AbstractTool {

    public static final String NAME = "datetime_tool";

    private static final String DESCRIPTION = "Useful for getting current date/time, calculating date differences, "
            + "or formatting dates. Input can be 'current' for current datetime, or date calculations like "
            + "'days between 2024-01-01 and 2024-12-31'";

    static final String USAGE = "Available operations: 'current' for current datetime, "
            + "'days between YYYY-MM-DD and YYYY-MM-DD' for date calculations";
    static final String DATE_FORMAT_HINT = "Please provide dates in YYYY-MM-DD format";

    private static final Set<String> CURRENT_KEYWORDS = Set.of("current", "now", "today");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    @Autowired
    public DateTimeTool() {
        this(Clock.systemDefaultZone());
    }

    public DateTimeTool(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    protected String execute(final String input) {
        final String query = input.trim().toLowerCase(Locale.ROOT);

        if (CURRENT_KEYWORDS.contains(query)) {
            return "Current date and time: " + LocalDateTime.now(clock).format(TIMESTAMP);
        }

        final List<String> dates = new ArrayList<>();
        final Matcher matcher = ISO_DATE.matcher(query);
        while (matcher.find()) {
            dates.add(matcher.group());
        }

        if (dates.size() >= 2) {
            final LocalDate first = LocalDate.parse(dates.get(0));
            final LocalDate second = LocalDate.parse(dates.get(1));
            final long days = Math.abs(ChronoUnit.DAYS.between(first, second));
            return "Days between " + dates.get(0) + " and " + dates.get(1) + ": " + days + " days";
        }
        if (query.contains("between")) {
            return DATE_FORMAT_HINT;
        }
        return USAGE;
    }

    @Override
    protected String describeFailure(final Exception e) {
        return "Error with date/time operation: " + messageOf(e);
    }
}
