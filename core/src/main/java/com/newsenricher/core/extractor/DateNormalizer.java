package com.newsenricher.core.extractor;

import java.text.Normalizer;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 자유 형식 날짜 문자열 → ISO-8601.
 * 오프셋이 있으면 {@code 2024-03-01T10:15:00+01:00}(UTC는 +00:00), 없으면 {@code 2024-03-01T10:15:00},
 * 날짜만 있으면 자정으로 채운다. 해석 실패는 빈 문자열(예외 없음).
 */
public final class DateNormalizer {

    private static final DateTimeFormatter LOCAL = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter OFFSET = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");
    /** 2024-03-01T10:15:00.000+0100 (콜론 없는 오프셋) */
    private static final DateTimeFormatter COMPACT_OFFSET = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss[.SSS]xx");

    private static final Pattern EPOCH = Pattern.compile("\\d{10}|\\d{13}");
    /** 1 de marzo de 2024 / 1 March 2024 */
    private static final Pattern DAY_MONTH_YEAR =
            Pattern.compile("(\\d{1,2})\\s+(?:de\\s+)?(\\p{L}{3,})\\.?,?\\s+(?:de\\s+)?(\\d{4})");
    /** March 1, 2024 */
    private static final Pattern MONTH_DAY_YEAR =
            Pattern.compile("(\\p{L}{3,})\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})");
    /** 01/03/2024 (일 우선) */
    private static final Pattern NUMERIC_DMY = Pattern.compile("(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})");
    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2})(?::(\\d{2}))?");

    /** 월 이름 앞 세 글자(스페인어/영어, 악센트 제거) */
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("ene", 1), Map.entry("jan", 1),
            Map.entry("feb", 2),
            Map.entry("mar", 3),
            Map.entry("abr", 4), Map.entry("apr", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6),
            Map.entry("jul", 7),
            Map.entry("ago", 8), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("set", 9),
            Map.entry("oct", 10),
            Map.entry("nov", 11),
            Map.entry("dic", 12), Map.entry("dec", 12));

    private DateNormalizer() {}

    public static String toIso(String raw) {
        if (raw == null) return "";
        String value = raw.strip();
        if (value.isEmpty()) return "";

        if (EPOCH.matcher(value).matches()) {
            long n = Long.parseLong(value);
            if (value.length() == 13) n = n / 1000L;
            return Instant.ofEpochSecond(n).atOffset(ZoneOffset.UTC).format(OFFSET);
        }

        try {
            return OffsetDateTime.parse(value).format(OFFSET);
        } catch (DateTimeParseException ignored) {
            // 다음 형식
        }
        try {
            return OffsetDateTime.parse(value, COMPACT_OFFSET).format(OFFSET);
        } catch (DateTimeParseException ignored) {
            // 다음 형식
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toOffsetDateTime().format(OFFSET);
        } catch (DateTimeParseException ignored) {
            // 다음 형식
        }
        try {
            return LocalDateTime.parse(value).format(LOCAL);
        } catch (DateTimeParseException ignored) {
            // 다음 형식
        }
        try {
            return LocalDate.parse(value).atStartOfDay().format(LOCAL);
        } catch (DateTimeParseException ignored) {
            // 다음 형식
        }
        if (value.length() == 19 && value.charAt(10) == ' ') { // 2024-03-01 10:15:00
            try {
                return LocalDateTime.parse(value.replace(' ', 'T')).format(LOCAL);
            } catch (DateTimeParseException ignored) {
                // 다음 형식
            }
        }

        String textual = fromText(value);
        if (!textual.isEmpty()) return textual;

        // ISO 날짜로 시작하는 기타 문자열
        if (value.length() >= 10) {
            try {
                return LocalDate.parse(value.substring(0, 10)).atStartOfDay().format(LOCAL);
            } catch (DateTimeParseException ignored) {
                return "";
            }
        }
        return "";
    }

    private static String fromText(String value) {
        String v = stripAccents(value).toLowerCase(Locale.ROOT);
        LocalDate date = null;

        Matcher m = DAY_MONTH_YEAR.matcher(v);
        if (m.find()) {
            date = date(m.group(3), month(m.group(2)), m.group(1));
        }
        if (date == null) {
            m = MONTH_DAY_YEAR.matcher(v);
            if (m.find()) date = date(m.group(3), month(m.group(1)), m.group(2));
        }
        if (date == null) {
            m = NUMERIC_DMY.matcher(v);
            if (m.find()) date = date(m.group(3), parse(m.group(2)), m.group(1));
        }
        if (date == null) return "";

        LocalDateTime at = date.atStartOfDay();
        Matcher c = CLOCK.matcher(v);
        if (c.find()) {
            int h = Integer.parseInt(c.group(1));
            int min = Integer.parseInt(c.group(2));
            int s = c.group(3) == null ? 0 : Integer.parseInt(c.group(3));
            if (h < 24 && min < 60 && s < 60) at = date.atTime(h, min, s);
        }
        return at.format(LOCAL);
    }

    private static LocalDate date(String year, int month, String day) {
        if (month < 1) return null;
        try {
            return LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static int month(String word) {
        if (word == null || word.length() < 3) return -1;
        return MONTHS.getOrDefault(word.substring(0, 3), -1);
    }

    private static int parse(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String stripAccents(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    }
}
