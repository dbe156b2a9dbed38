package com.eventharvester.parser;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locale-aware conversion of German/English date, time and price text into canonical values.
 * <p>
 * Разбор дат, времени и цен в том виде, в котором их публикуют сайты венских площадок:
 * "Mittwoch 26. November", "Do. 27.11.2025", "do 100725", "Einlass: 23:00", "ab €12,50".
 * Методы никогда не бросают исключений: нераспознанный ввод возвращает null.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemporalParser {

    /** Dates before this year are rejected as stale or mis-parsed. */
    public static final int MIN_YEAR = 2020;

    public static final String FREE_PRICE = "Free / Gratis";

    private static final Map<String, Integer> MONTHS = new HashMap<>();

    static {
        putMonth(1, "jänner", "jän", "januar", "jan", "january", "jaenner");
        putMonth(2, "februar", "feber", "feb", "february");
        putMonth(3, "märz", "mär", "maerz", "mrz", "mar", "march");
        putMonth(4, "april", "apr");
        putMonth(5, "mai", "may");
        putMonth(6, "juni", "jun", "june");
        putMonth(7, "juli", "jul", "july");
        putMonth(8, "august", "aug");
        putMonth(9, "september", "sept", "sep");
        putMonth(10, "oktober", "okt", "oct", "october");
        putMonth(11, "november", "nov");
        putMonth(12, "dezember", "dez", "dec", "december");
    }

    private static final String WORD = "([a-zäöüß]+)";
    // Названия и сокращения дней недели, перед датой или днем месяца
    static final String WEEKDAY = "(?:montag|dienstag|mittwoch|donnerstag|freitag|samstag|sonntag"
            + "|monday|tuesday|wednesday|thursday|friday|saturday|sunday"
            + "|mon|tue|wed|thu|fri|sat|sun|mo|di|mi|do|fr|sa|so)";
    private static final String DASH = "\\s*[-–—]\\s*";

    // "2025-11-26", "2025-11-26T22:00"
    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");
    // "26. November – 27. November 2025", "28. Dezember 2025 - 2. Jänner 2026"
    private static final Pattern MONTH_RANGE = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\.\\s*" + WORD + "\\.?(?:\\s+(\\d{4}))?" + DASH
                    + "(\\d{1,2})\\.\\s*" + WORD + "\\.?\\s+(\\d{4})(?!\\d)");
    // "26.11. - 28.11.2025"
    private static final Pattern NUMERIC_RANGE = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\.(\\d{1,2})\\." + DASH + "(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4}|\\d{2})(?!\\d)");
    // "27.11.2025", "27/11/25"
    private static final Pattern NUMERIC_DMY = Pattern.compile(
            "(?<!\\d)(\\d{1,2})[./](\\d{1,2})[./](\\d{4}|\\d{2})(?!\\d)");
    // "26. November 2025"
    private static final Pattern DAY_MONTH_NAME_YEAR = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\.\\s*" + WORD + "\\.?,?\\s+(\\d{4})(?!\\d)");
    // "Mittwoch 26. November", "Do 7. Aug"
    private static final Pattern DAY_MONTH_NAME = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\.\\s*([a-zäöüß]++)\\.?(?!,?\\s*\\d{4})");
    // "November 26, 2025"
    private static final Pattern MONTH_NAME_DAY_YEAR = Pattern.compile(
            WORD + "\\s+(\\d{1,2}),?\\s+(\\d{4})(?!\\d)");
    // "27.07.", "15/11", "15.09"; never a fragment of a longer D.M.Y
    private static final Pattern NUMERIC_DM = Pattern.compile(
            "(?<![\\d./])(\\d{1,2})([./])(\\d{1,2})(?!\\d)(?!\\2\\d)");
    // "100725"
    private static final Pattern COMPACT_DMY = Pattern.compile(
            "(?<![\\d.:/])(\\d{2})(\\d{2})(\\d{2})(?![\\d.:/])");
    // "15.", "Fr 15.", "Sa, 16"; "Floor 2" is not a day
    private static final Pattern DAY_ONLY = Pattern.compile(
            "^(?:" + WEEKDAY + "\\.?,?\\s*)?(\\d{1,2})\\.?$");
    // "SEPTEMBER", "November 2025"
    private static final Pattern MONTH_HEADER = Pattern.compile("^" + WORD + "\\.?(?:\\s+(\\d{4}))?$");

    private static final Pattern PREFIXED_TIME = Pattern.compile(
            "(?:doors?|einlass|start|beginn)\\s*:?\\s*(?:at\\s+|um\\s+|ab\\s+)?(\\d{1,2}):(\\d{2})(?!\\d)");
    private static final Pattern PREFIXED_HOUR = Pattern.compile(
            "(?:doors?|einlass|start|beginn|show)\\s*:?\\s*(?:at\\s+|um\\s+|ab\\s+)?(\\d{1,2})\\s*h\\b");
    private static final Pattern UHR_TIME = Pattern.compile("(?<!\\d)(\\d{1,2}):(\\d{2})\\s*uhr");
    private static final Pattern BARE_TIME = Pattern.compile("(?<!\\d)(\\d{1,2}):(\\d{2})(?!\\d)");

    private static final Pattern FREE_ENTRY = Pattern.compile(
            "\\b(?:free|gratis|kostenlos)\\b|eintritt\\s+frei|freier\\s+eintritt");
    private static final String AMOUNT = "(\\d+(?:[.,]\\d{1,2})?)";
    private static final Pattern[] PRICE_PATTERNS = {
            Pattern.compile("(?:€|\\beur(?:o)?\\b)\\s*" + AMOUNT),
            Pattern.compile(AMOUNT + "\\s*(?:€|eur(?:o)?\\b)"),
            Pattern.compile("\\b(?:ab|from)\\s+(?:€|eur)?\\s*" + AMOUNT),
            Pattern.compile("\\b(?:vvk|ak|eintritt|preis|price|entry)\\s*:?\\s*(?:€|eur)?\\s*" + AMOUNT),
    };

    private final Clock clock;

    /**
     * Parse a date from free text.
     *
     * @param text text containing a date in one of the supported forms
     * @return the date, or null if nothing valid was found
     */
    public LocalDate parseDate(String text) {
        return findDate(text).map(DateMatch::getDate).orElse(null);
    }

    /**
     * Parse a date, falling back to a bare day combined with the month of a preceding section header.
     *
     * @param text    entry text, e.g. "Fr 15."
     * @param context month (and optional year) taken from the last header, may be null
     * @return the date, or null
     */
    public LocalDate parseDate(String text, MonthContext context) {
        LocalDate date = parseDate(text);
        if (date != null || context == null || text == null) {
            return date;
        }
        Matcher matcher = DAY_ONLY.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        return parseDayInMonth(Integer.parseInt(matcher.group(1)), context);
    }

    /**
     * Locate the first valid date in the text together with the span it occupies.
     */
    public Optional<DateMatch> findDate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        DateMatch match = matchIso(lower);
        if (match == null) {
            match = matchMonthRange(lower);
        }
        if (match == null) {
            match = matchNumericRange(lower);
        }
        if (match == null) {
            match = matchNumericDmy(lower);
        }
        if (match == null) {
            match = matchDayMonthName(lower, DAY_MONTH_NAME_YEAR, true);
        }
        if (match == null) {
            match = matchDayMonthName(lower, DAY_MONTH_NAME, false);
        }
        if (match == null) {
            match = matchMonthNameDayYear(lower);
        }
        if (match == null) {
            match = matchNumericDayMonth(lower);
        }
        if (match == null) {
            match = matchCompact(lower);
        }
        return Optional.ofNullable(match);
    }

    /**
     * Recognise a section header that consists of a month name, optionally followed by a year.
     *
     * @return the month context, or null if the line is not a month header
     */
    public MonthContext parseMonthHeader(String line) {
        if (line == null) {
            return null;
        }
        Matcher matcher = MONTH_HEADER.matcher(line.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        Integer month = monthNumber(matcher.group(1));
        if (month == null) {
            return null;
        }
        Integer year = matcher.group(2) != null ? Integer.valueOf(matcher.group(2)) : null;
        return new MonthContext(month, year);
    }

    /**
     * Combine a bare day with the month announced by a section header.
     */
    public LocalDate parseDayInMonth(int day, MonthContext context) {
        if (context == null) {
            return null;
        }
        return resolve(day, context.getMonth(), context.getYear());
    }

    /**
     * Resolve a day and month without year using the year-inference rule.
     */
    public LocalDate parseDayMonth(int day, int month) {
        return resolve(day, month, null);
    }

    /**
     * Build a date, inferring the year when it is missing.
     * <p>
     * Если год не указан: месяц уже прошел (или текущий месяц, но день прошел) - следующий год,
     * иначе текущий год.
     *
     * @return the date, or null when month, day or year are out of range
     */
    public LocalDate resolve(int day, int month, Integer year) {
        if (month < 1 || month > 12 || day < 1 || day > 31) {
            return null;
        }
        int resolvedYear = year != null ? year : inferYear(day, month);
        if (resolvedYear < MIN_YEAR) {
            return null;
        }
        try {
            return LocalDate.of(resolvedYear, month, day);
        } catch (DateTimeException e) {
            log.debug("Rejected impossible date {}.{}.{}", day, month, resolvedYear);
            return null;
        }
    }

    private int inferYear(int day, int month) {
        LocalDate today = LocalDate.now(clock);
        if (month < today.getMonthValue() || (month == today.getMonthValue() && day < today.getDayOfMonth())) {
            return today.getYear() + 1;
        }
        return today.getYear();
    }

    /**
     * Extract a 24h time.
     *
     * @param text e.g. "Einlass: 23:15", "19:00 Uhr", "Doors: 20h"
     * @return "HH:MM", or null when nothing valid was found
     */
    public String parseTime(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        for (Pattern pattern : new Pattern[]{PREFIXED_TIME, UHR_TIME, BARE_TIME}) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                String time = formatTime(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
                if (time != null) {
                    return time;
                }
            }
        }

        Matcher hourOnly = PREFIXED_HOUR.matcher(lower);
        if (hourOnly.find()) {
            return formatTime(Integer.parseInt(hourOnly.group(1)), 0);
        }
        return null;
    }

    /**
     * Extract a canonical price string.
     *
     * @param text e.g. "Eintritt frei", "ab €12,50", "VVK: 28,-"
     * @return "Free / Gratis", "ab €&lt;amount&gt;" or null
     */
    public String extractPrice(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        if (FREE_ENTRY.matcher(lower).find()) {
            return FREE_PRICE;
        }

        for (Pattern pattern : PRICE_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                return "ab €" + matcher.group(1).replace(',', '.');
            }
        }
        return null;
    }

    /**
     * Whether a (canonical or raw) price denotes free entry.
     */
    public boolean isFree(String price) {
        if (price == null) {
            return false;
        }
        return FREE_PRICE.equalsIgnoreCase(price.trim())
                || FREE_ENTRY.matcher(price.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Month number for a German or English month name or abbreviation.
     */
    public static Integer monthNumber(String name) {
        if (name == null) {
            return null;
        }
        String key = name.toLowerCase(Locale.ROOT).trim();
        if (key.endsWith(".")) {
            key = key.substring(0, key.length() - 1);
        }
        return MONTHS.get(key);
    }

    private DateMatch matchIso(String lower) {
        Matcher matcher = ISO_DATE.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        return toMatch(resolve(Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(2)),
                Integer.valueOf(matcher.group(1))), matcher);
    }

    private DateMatch matchMonthRange(String lower) {
        Matcher matcher = MONTH_RANGE.matcher(lower);
        while (matcher.find()) {
            Integer startMonth = monthNumber(matcher.group(2));
            Integer endMonth = monthNumber(matcher.group(5));
            if (startMonth == null || endMonth == null) {
                continue;
            }
            int day = Integer.parseInt(matcher.group(1));
            Integer year;
            if (matcher.group(3) != null) {
                year = Integer.valueOf(matcher.group(3));
            } else {
                int endYear = Integer.parseInt(matcher.group(6));
                // Диапазон через границу года: "28. Dezember - 2. Jänner 2026"
                year = startMonth > endMonth ? endYear - 1 : endYear;
            }
            return toMatch(resolve(day, startMonth, year), matcher);
        }
        return null;
    }

    private DateMatch matchNumericRange(String lower) {
        Matcher matcher = NUMERIC_RANGE.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        int day = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        int endMonth = Integer.parseInt(matcher.group(4));
        int endYear = fullYear(matcher.group(5));
        int year = month > endMonth ? endYear - 1 : endYear;
        return toMatch(resolve(day, month, year), matcher);
    }

    private DateMatch matchNumericDmy(String lower) {
        Matcher matcher = NUMERIC_DMY.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        return toMatch(resolve(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                fullYear(matcher.group(3))), matcher);
    }

    private DateMatch matchDayMonthName(String lower, Pattern pattern, boolean withYear) {
        Matcher matcher = pattern.matcher(lower);
        while (matcher.find()) {
            Integer month = monthNumber(matcher.group(2));
            if (month == null) {
                continue;
            }
            Integer year = withYear ? Integer.valueOf(matcher.group(3)) : null;
            return toMatch(resolve(Integer.parseInt(matcher.group(1)), month, year), matcher);
        }
        return null;
    }

    private DateMatch matchMonthNameDayYear(String lower) {
        Matcher matcher = MONTH_NAME_DAY_YEAR.matcher(lower);
        while (matcher.find()) {
            Integer month = monthNumber(matcher.group(1));
            if (month == null) {
                continue;
            }
            return toMatch(resolve(Integer.parseInt(matcher.group(2)), month,
                    Integer.valueOf(matcher.group(3))), matcher);
        }
        return null;
    }

    private DateMatch matchNumericDayMonth(String lower) {
        Matcher matcher = NUMERIC_DM.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        return toMatch(resolve(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(3)), null),
                matcher);
    }

    private DateMatch matchCompact(String lower) {
        Matcher matcher = COMPACT_DMY.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        return toMatch(resolve(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                2000 + Integer.parseInt(matcher.group(3))), matcher);
    }

    private static DateMatch toMatch(LocalDate date, Matcher matcher) {
        return date == null ? null : new DateMatch(date, matcher.start(), matcher.end());
    }

    private static int fullYear(String digits) {
        int year = Integer.parseInt(digits);
        return digits.length() == 2 ? 2000 + year : year;
    }

    private static String formatTime(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            return null;
        }
        return String.format("%02d:%02d", hour, minute);
    }

    private static void putMonth(int month, String... names) {
        for (String name : names) {
            MONTHS.put(name, month);
        }
    }

    /**
     * A parsed date and the character span of the text it was read from.
     */
    @Value
    public static class DateMatch {
        LocalDate date;
        int start;
        int end;
    }

    /**
     * Month (and optional year) announced by a section header such as "SEPTEMBER".
     */
    @Value
    public static class MonthContext {
        int month;
        Integer year;
    }
}
