package io.github.yok.industrydb.types;

import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import lombok.Generated;

/**
 * Permissive ISO-8601 parsers for temporal values stored as text.
 *
 * <p>
 * SQLite has no temporal storage class, so dates and timestamps come back as text written by
 * whichever client stored them. These parsers accept the common variants: {@code T} or space
 * separator, optional seconds, optional fraction of up to nine digits and an optional zone offset.
 * A timestamp carrying an offset is normalized to UTC.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TemporalParsers {

    /**
     * Local time parser accepting {@code HH:mm}, {@code HH:mm:ss} and {@code HH:mm:ss.fraction}.
     */
    public static final DateTimeFormatter FLEXIBLE_LOCAL_TIME =
            new DateTimeFormatterBuilder().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    /**
     * Timestamp parser: ISO date, {@code T} or space, flexible local time, optional offset.
     */
    public static final DateTimeFormatter FLEXIBLE_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart().appendLiteral('T')
            .optionalEnd().optionalStart().appendLiteral(' ').optionalEnd()
            .append(FLEXIBLE_LOCAL_TIME).optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd().optionalStart()
            .appendOffset("+HHMM", "Z").optionalEnd().toFormatter();

    /**
     * Date-only formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyyMMdd} (basic ISO)</li>
     * </ol>
     */
    public static final DateTimeFormatter[] DATE_ONLY_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                    DateTimeFormatter.BASIC_ISO_DATE};

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TemporalParsers() {}

    /**
     * Parses a date. A full timestamp is accepted and truncated to its date.
     *
     * @param text text to parse
     * @return parsed date
     * @throws DateTimeParseException if no format matches
     */
    public static LocalDate parseDate(String text) {
        String trimmed = text.trim();
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            ParsePosition position = new ParsePosition(0);
            TemporalAccessor parsed = formatter.parseUnresolved(trimmed, position);
            if (parsed != null && position.getErrorIndex() < 0
                    && position.getIndex() == trimmed.length()) {
                return LocalDate.parse(trimmed, formatter);
            }
        }
        return parseTimestamp(trimmed).toLocalDate();
    }

    /**
     * Parses a timestamp. A date without a time part is read as midnight.
     *
     * @param text text to parse
     * @return parsed timestamp, in UTC when the text carries an offset
     * @throws DateTimeParseException if the text is not a supported timestamp
     */
    public static LocalDateTime parseTimestamp(String text) {
        String trimmed = text.trim();
        if (trimmed.length() == 10) {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
        }
        TemporalAccessor parsed = FLEXIBLE_TIMESTAMP.parse(trimmed);
        LocalDateTime local = LocalDateTime.of(LocalDate.from(parsed), LocalTime.from(parsed));
        ZoneOffset offset = parsed.query(TemporalQueries.offset());
        if (offset != null) {
            return OffsetDateTime.of(local, offset).withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        }
        return local;
    }

    /**
     * Formats a timestamp as {@code yyyy-MM-dd HH:mm:ss[.fraction]}, the form SQLite's date
     * functions understand.
     *
     * @param value timestamp
     * @return formatted text
     */
    public static String formatTimestamp(LocalDateTime value) {
        String text = value.toLocalDate() + " " + value.toLocalTime();
        // LocalTime#toString drops zero seconds
        return value.getSecond() == 0 && value.getNano() == 0 ? text + ":00" : text;
    }
}
