package com.racing.reconcile.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Canonicalizes scalar values so that values from different sources become comparable.
 *
 * <p>Every method is side-effect free and fails closed: unparseable input yields
 * {@code null} (or the input unchanged, where documented) and never an exception.</p>
 */
public class DataNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DataNormalizer.class);

    private static final List<DateTimeFormatter> FALLBACK_TIMESTAMP_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT)
    );

    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]");
    private static final Pattern NON_TIME_CHARS = Pattern.compile("[^\\d:.]");
    private static final Pattern TIME_FORMAT = Pattern.compile("^\\d+:\\d{2}(:\\d{2})?(\\.\\d+)?$");

    private static final Map<String, FinishStatus> STATUS_MAPPINGS = new HashMap<>();
    private static final Map<String, String> TYRE_COMPOUNDS = new HashMap<>();

    static {
        STATUS_MAPPINGS.put("FINISHED", FinishStatus.FINISHED);
        STATUS_MAPPINGS.put("F", FinishStatus.FINISHED);
        STATUS_MAPPINGS.put("DNF", FinishStatus.DNF);
        STATUS_MAPPINGS.put("DID NOT FINISH", FinishStatus.DNF);
        STATUS_MAPPINGS.put("NOT CLASSIFIED", FinishStatus.DNF);
        STATUS_MAPPINGS.put("NC", FinishStatus.DNF);
        STATUS_MAPPINGS.put("RETIRED", FinishStatus.DNF);
        STATUS_MAPPINGS.put("R", FinishStatus.DNF);
        STATUS_MAPPINGS.put("DNS", FinishStatus.DNS);
        STATUS_MAPPINGS.put("DID NOT START", FinishStatus.DNS);
        STATUS_MAPPINGS.put("DSQ", FinishStatus.DSQ);
        STATUS_MAPPINGS.put("DISQUALIFIED", FinishStatus.DSQ);
        STATUS_MAPPINGS.put("EX", FinishStatus.DSQ);
        STATUS_MAPPINGS.put("WD", FinishStatus.WITHDREW);
        STATUS_MAPPINGS.put("WITHDREW", FinishStatus.WITHDREW);

        for (String compound : List.of("SOFT", "MEDIUM", "HARD", "INTERMEDIATE", "WET",
                "C1", "C2", "C3", "C4", "C5")) {
            TYRE_COMPOUNDS.put(compound, compound);
        }
        // pre-2019 marketing names, all at the soft end of the current range
        TYRE_COMPOUNDS.put("SUPERSOFT", "C5");
        TYRE_COMPOUNDS.put("ULTRASOFT", "C5");
        TYRE_COMPOUNDS.put("HYPERSOFT", "C5");
    }

    private final NormalizationEngine circuitEngine;

    public DataNormalizer() {
        this(DefaultNormalizationRules.circuitEngine());
    }

    public DataNormalizer(NormalizationEngine circuitEngine) {
        this.circuitEngine = circuitEngine;
    }

    /**
     * Normalizes a timestamp to a UTC instant.
     *
     * <p>Strings are parsed as ISO-8601 first, then against a fixed list of fallback patterns.
     * A value without zone information is interpreted in {@code sourceTimezone} when given,
     * otherwise as UTC.</p>
     *
     * @param value          an {@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime},
     *                       {@link LocalDateTime}, {@link Date} or text
     * @param sourceTimezone IANA zone id of the source, or {@code null}
     * @return the instant, or {@code null} when the value cannot be interpreted
     */
    public Instant normalizeTimestamp(Object value, String sourceTimezone) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localize(localDateTime, sourceTimezone);
        }
        if (value instanceof CharSequence text) {
            return parseTimestamp(text.toString().trim(), sourceTimezone);
        }
        log.warn("normalize.timestamp.unsupported type={}", value.getClass().getName());
        return null;
    }

    public Instant normalizeTimestamp(Object value) {
        return normalizeTimestamp(value, null);
    }

    private Instant parseTimestamp(String text, String sourceTimezone) {
        if (text.isEmpty()) {
            return null;
        }
        OffsetDateTime offset = attempt(text, t -> OffsetDateTime.parse(t, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        if (offset != null) {
            return offset.toInstant();
        }
        LocalDateTime local = attempt(text, t -> LocalDateTime.parse(t, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        if (local == null) {
            LocalDate date = attempt(text, t -> LocalDate.parse(t, DateTimeFormatter.ISO_LOCAL_DATE));
            local = date != null ? date.atStartOfDay() : null;
        }
        for (int i = 0; local == null && i < FALLBACK_TIMESTAMP_FORMATS.size(); i++) {
            DateTimeFormatter format = FALLBACK_TIMESTAMP_FORMATS.get(i);
            local = attempt(text, t -> LocalDateTime.parse(t, format));
        }
        if (local == null) {
            log.warn("normalize.timestamp.unparseable value='{}'", text);
            return null;
        }
        return localize(local, sourceTimezone);
    }

    private static <T> T attempt(String text, Function<String, T> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            log.trace("normalize.timestamp.attempt value='{}' error={}", text, e.getMessage());
            return null;
        }
    }

    private Instant localize(LocalDateTime localDateTime, String sourceTimezone) {
        if (sourceTimezone == null || sourceTimezone.isBlank()) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        try {
            return localDateTime.atZone(ZoneId.of(sourceTimezone.trim())).toInstant();
        } catch (DateTimeException e) {
            log.warn("normalize.timestamp.badZone zone='{}' error={}", sourceTimezone, e.getMessage());
            return null;
        }
    }

    /**
     * Maps raw finish-status text onto {@link FinishStatus} labels. Exact (case-insensitive)
     * lookups run first, then substring heuristics. Unrecognized text is returned trimmed;
     * missing text yields {@code "Unknown"}.
     */
    public String normalizeStatus(String status) {
        if (status == null || status.isBlank()) {
            return FinishStatus.UNKNOWN.getLabel();
        }
        String trimmed = status.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);

        FinishStatus mapped = STATUS_MAPPINGS.get(upper);
        if (mapped != null) {
            return mapped.getLabel();
        }

        if (upper.contains("DNF") || upper.contains("NOT FINISH")) {
            return FinishStatus.DNF.getLabel();
        } else if (upper.contains("DNS") || upper.contains("NOT START")) {
            return FinishStatus.DNS.getLabel();
        } else if (upper.contains("DSQ") || upper.contains("DISQUAL")) {
            return FinishStatus.DSQ.getLabel();
        } else if (upper.contains("WITHDR")) {
            return FinishStatus.WITHDREW.getLabel();
        } else if (upper.contains("FINISH") || upper.contains("COMPLETED")) {
            return FinishStatus.FINISHED.getLabel();
        }

        return trimmed;
    }

    /**
     * Collapses whitespace and title-cases each word. All-caps words of up to three
     * characters are kept as abbreviations ("GP", "F1").
     */
    public String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String[] words = name.trim().split("\\s+");
        StringBuilder normalized = new StringBuilder();
        for (String word : words) {
            if (normalized.length() > 0) {
                normalized.append(' ');
            }
            if (isAllCaps(word) && word.length() <= 3) {
                normalized.append(word);
            } else {
                normalized.append(capitalize(word));
            }
        }
        return normalized.toString();
    }

    public String normalizeCircuitName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return circuitEngine.normalize(normalizeName(name));
    }

    /**
     * Aligns a lap number across sources. Text keeps only its digits; numbers are truncated.
     *
     * @param source source name, used for diagnostics only
     */
    public Integer alignLapNumber(Object value, String source) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence text) {
            return parseDigits(text.toString(), source);
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (!fitsInt(asDouble)) {
                log.warn("normalize.lap.invalid value={} source={}", value, source);
                return null;
            }
            return number.intValue();
        }
        log.warn("normalize.lap.unsupported type={} source={}", value.getClass().getName(), source);
        return null;
    }

    private Integer parseDigits(String text, String source) {
        String digits = NON_DIGITS.matcher(text).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            log.warn("normalize.number.overflow value='{}' source={}", text, source);
            return null;
        }
    }

    /**
     * Normalizes a lap, sector or race time to {@code M:SS[.mmm]} or {@code H:MM:SS[.mmm]}.
     * A leading {@code +} and any characters other than digits, colons and dots are removed.
     */
    public String normalizeTimeString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String cleaned = value.trim();
        if (cleaned.startsWith("+")) {
            cleaned = cleaned.substring(1);
        }
        cleaned = NON_TIME_CHARS.matcher(cleaned).replaceAll("");
        if (TIME_FORMAT.matcher(cleaned).matches()) {
            return cleaned;
        }
        return null;
    }

    /**
     * Uppercases a driver code and requires three letters. Longer input is cut to its
     * first three characters.
     */
    public String normalizeDriverCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String code = value.trim().toUpperCase(Locale.ROOT);
        if (code.length() < 3) {
            return null;
        }
        if (code.length() > 3) {
            code = code.substring(0, 3);
        }
        for (int i = 0; i < code.length(); i++) {
            if (!Character.isLetter(code.charAt(i))) {
                return null;
            }
        }
        return code;
    }

    /**
     * Uppercases a tyre compound and maps historical marketing names onto C1-C5.
     * Unknown compounds pass through uppercased.
     */
    public String normalizeTyreCompound(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String compound = value.trim().toUpperCase(Locale.ROOT);
        return TYRE_COMPOUNDS.getOrDefault(compound, compound);
    }

    /**
     * Coerces a classified position to a positive integer. Text keeps only its digits
     * ("P3" reads as 3).
     */
    public Integer normalizePosition(Object value) {
        Integer position;
        if (value == null) {
            return null;
        } else if (value instanceof CharSequence text) {
            position = parseDigits(text.toString(), "position");
        } else if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (!fitsInt(asDouble)) {
                return null;
            }
            position = number.intValue();
        } else {
            return null;
        }
        return position != null && position > 0 ? position : null;
    }

    private static boolean fitsInt(double value) {
        return Double.isFinite(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static boolean isAllCaps(String word) {
        boolean hasCased = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasCased = true;
            }
        }
        return hasCased;
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int first = word.codePointAt(0);
        int firstLength = Character.charCount(first);
        return new StringBuilder()
                .appendCodePoint(Character.toTitleCase(first))
                .append(word.substring(firstLength).toLowerCase(Locale.ROOT))
                .toString();
    }
}
