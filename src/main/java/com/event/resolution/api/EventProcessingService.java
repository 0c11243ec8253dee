package com.event.resolution.api;

import com.event.resolution.core.model.DropReason;
import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.LocationMatch;
import com.event.resolution.core.model.LocationQuery;
import com.event.resolution.core.model.LocationResolution;
import com.event.resolution.core.model.RawRow;
import com.event.resolution.core.model.ResolvedRow;
import com.event.resolution.core.model.TagRules;
import com.event.resolution.filter.DateWindowFilter;
import com.event.resolution.filter.TagFilter;
import com.event.resolution.grouping.OccurrenceGrouper;
import com.event.resolution.location.LocationResolver;
import com.event.resolution.logging.LogContext;
import com.event.resolution.metrics.MetricsService;
import com.event.resolution.parse.ParseResult;
import com.event.resolution.parse.TableParser;
import com.event.resolution.text.EmojiSelector;
import com.event.resolution.text.FieldSanitizer;
import com.event.resolution.text.NameNormalizer;
import com.event.resolution.text.TagNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the extracted table of one source file into finalized events.
 *
 * <p>Per row, in order: sanitize the free-text fields, apply the date window, normalize tags,
 * add the {@code Virtual} tag for online venues, apply the remove-tag filter, resolve the
 * venue and pick the emoji. Surviving rows are then grouped into events, and each event's
 * name is recased and shortened. A row that fails unexpectedly is dropped on its own; it
 * never fails the file.</p>
 */
public class EventProcessingService {
    private static final Logger log = LoggerFactory.getLogger(EventProcessingService.class);

    static final String VIRTUAL_TAG = "Virtual";
    private static final List<String> ONLINE_KEYWORDS = List.of("virtual", "online", "livestream");
    private static final Pattern SOURCE_FILE = Pattern.compile("\\d{8}_(.+)\\.md");

    private final TableParser parser;
    private final TagNormalizer tagNormalizer;
    private final NameNormalizer nameNormalizer;
    private final LocationResolver locationResolver;
    private final OccurrenceGrouper grouper;
    private final DateWindowFilter dateFilter;
    private final TagFilter tagFilter;
    private final TagRules tagRules;
    private final MetricsService metrics;

    public EventProcessingService(TableParser parser, TagNormalizer tagNormalizer, NameNormalizer nameNormalizer,
                                  LocationResolver locationResolver, OccurrenceGrouper grouper,
                                  DateWindowFilter dateFilter, TagRules tagRules, MetricsService metrics) {
        this.parser = parser;
        this.tagNormalizer = tagNormalizer;
        this.nameNormalizer = nameNormalizer;
        this.locationResolver = locationResolver;
        this.grouper = grouper;
        this.dateFilter = dateFilter;
        this.tagRules = tagRules != null ? tagRules : TagRules.empty();
        this.tagFilter = new TagFilter(this.tagRules);
        this.metrics = metrics;
    }

    /**
     * Processes one extracted table. Empty or table-less text yields no events.
     *
     * @param text           the table text returned by the extraction service
     * @param sourceFileName name of the extracted file, e.g. {@code 20250913_oculus.md}
     */
    public FileProcessingResult processTable(String text, String sourceFileName) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forFile(sourceFileName)) {
            Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);
            ParseResult parsed = parser.parse(text);
            if (!parsed.tableFound()) {
                log.info("file.empty source={}", sourceFileName);
            }
            count(dropped, DropReason.MALFORMED_ROW, parsed.malformedRows());

            String siteName = siteName(sourceFileName);
            List<ResolvedRow> rows = new ArrayList<>();
            int unresolved = 0;
            for (RawRow raw : parsed.rows()) {
                try {
                    RowOutcome outcome = processRow(raw, siteName);
                    if (outcome.dropReason() != null) {
                        count(dropped, outcome.dropReason(), 1);
                        continue;
                    }
                    if (outcome.row().location() == null) {
                        unresolved++;
                    }
                    rows.add(outcome.row());
                } catch (RuntimeException e) {
                    log.warn("row.failed name='{}' error={}", raw.name(), e.toString());
                    count(dropped, DropReason.MALFORMED_ROW, 1);
                }
            }

            List<Event> events = grouper.group(rows);
            for (Event event : events) {
                event.setName(nameNormalizer.normalize(event.getName()));
                event.setShortName(nameNormalizer.shortName(event.getName()));
            }

            metrics.recordEventsProduced(events.size());
            metrics.recordFileDuration(Duration.ofNanos(System.nanoTime() - start));
            FileProcessingResult result = new FileProcessingResult(sourceFileName, events,
                    parsed.rows().size(), dropped, unresolved);
            log.info("file.processed source={} events={} rows={} dropped={} unresolved={}",
                    sourceFileName, events.size(), parsed.rows().size(), result.droppedCount(), unresolved);
            return result;
        }
    }

    private RowOutcome processRow(RawRow raw, String siteName) {
        RawRow row = raw.withText(
                FieldSanitizer.sanitizeName(raw.name()),
                FieldSanitizer.sanitize(raw.location()),
                FieldSanitizer.sanitize(raw.sublocation()),
                FieldSanitizer.sanitize(raw.description()));

        Optional<DropReason> dateCheck = dateFilter.checkRow(row.startDate(), row.endDate());
        if (dateCheck.isPresent()) {
            log.debug("Dropping '{}' ({}): start={} end={}", row.name(), dateCheck.get(), row.startDate(), row.endDate());
            return RowOutcome.dropped(dateCheck.get());
        }

        List<String> tags = new ArrayList<>(tagNormalizer.normalize(row.hashtags(), tagRules));
        if (isOnline(row.location()) && !tags.contains(VIRTUAL_TAG)) {
            tags.add(VIRTUAL_TAG);
        }
        if (!tagFilter.accepts(tags)) {
            log.debug("Dropping '{}': carries a remove tag {}", row.name(), tags);
            return RowOutcome.dropped(DropReason.REMOVED_TAG);
        }

        LocationQuery query = new LocationQuery(row.location(), row.sublocation(), siteName, row.name());
        LocationMatch location = locationResolver.resolve(query).map(LocationResolution::location).orElse(null);
        String fallbackEmoji = location != null ? location.emoji() : null;
        String emoji = EmojiSelector.select(row.emoji(), fallbackEmoji);

        return RowOutcome.kept(new ResolvedRow(row, tags, location, emoji));
    }

    private static boolean isOnline(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return ONLINE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private void count(Map<DropReason, Integer> dropped, DropReason reason, int n) {
        if (n <= 0) {
            return;
        }
        dropped.merge(reason, n, Integer::sum);
        for (int i = 0; i < n; i++) {
            metrics.recordRowDropped(reason);
        }
    }

    /**
     * Site name encoded in an extracted file name: {@code 20250913_the_oculus.md} gives
     * {@code "the oculus"}. Other names give an empty string.
     */
    public static String siteName(String sourceFileName) {
        if (sourceFileName == null) {
            return "";
        }
        Matcher m = SOURCE_FILE.matcher(sourceFileName);
        if (!m.lookingAt()) {
            return "";
        }
        return m.group(1).replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    private record RowOutcome(ResolvedRow row, DropReason dropReason) {
        static RowOutcome kept(ResolvedRow row) {
            return new RowOutcome(row, null);
        }

        static RowOutcome dropped(DropReason reason) {
            return new RowOutcome(null, reason);
        }
    }
}
