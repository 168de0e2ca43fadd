package org.Aayush.tempo.format;

import it.unimi.dsi.fastutil.chars.Char2ObjectOpenHashMap;
import lombok.experimental.UtilityClass;
import org.Aayush.tempo.core.time.TimeUtils;

import java.time.OffsetDateTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * strftime-style renderer over an {@link OffsetDateTime}.
 *
 * <p>The renderer is not zone-aware: {@code %Z} renders {@code UTC} at offset zero and
 * nothing otherwise. Callers that know a zone abbreviation substitute {@code %Z} before
 * calling {@link #format(String, OffsetDateTime)}.</p>
 *
 * <p>Supported flags: {@code -} (no padding), a decimal width (only meaningful for
 * {@code %N}) and {@code :} (only meaningful for {@code %z}). Unknown directives are
 * copied to the output verbatim.</p>
 */
@UtilityClass
public final class Strftime {
    private static final Locale FORMAT_LOCALE = Locale.ENGLISH;
    private static final int DEFAULT_FRACTION_DIGITS = 9;
    private static final Char2ObjectOpenHashMap<Directive> DIRECTIVES = buildDirectives();

    /**
     * Renders {@code pattern} against the wall clock of {@code time}.
     *
     * @param pattern strftime pattern.
     * @param time wall clock and offset to render.
     * @return rendered text.
     */
    public static String format(String pattern, OffsetDateTime time) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(time, "time");
        StringBuilder out = new StringBuilder(pattern.length() + 16);
        int length = pattern.length();
        int i = 0;
        while (i < length) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= length) {
                out.append(c);
                i++;
                continue;
            }
            int start = i;
            i++;
            boolean noPad = false;
            if (pattern.charAt(i) == '-') {
                noPad = true;
                i++;
            }
            int width = -1;
            while (i < length && Character.isDigit(pattern.charAt(i))) {
                width = (width < 0 ? 0 : width * 10) + (pattern.charAt(i) - '0');
                i++;
            }
            boolean colon = false;
            if (i < length && pattern.charAt(i) == ':') {
                colon = true;
                i++;
            }
            if (i >= length) {
                out.append(pattern, start, length);
                break;
            }
            char conversion = pattern.charAt(i);
            i++;
            Directive directive = DIRECTIVES.get(conversion);
            if (directive == null) {
                out.append(pattern, start, i);
            } else {
                out.append(directive.render(time, new Flags(noPad, width, colon)));
            }
        }
        return out.toString();
    }

    /**
     * Returns whether a conversion character is understood.
     */
    public static boolean supports(char conversion) {
        return DIRECTIVES.containsKey(conversion);
    }

    @FunctionalInterface
    private interface Directive {
        String render(OffsetDateTime time, Flags flags);
    }

    private record Flags(boolean noPad, int width, boolean colon) {
    }

    private static Char2ObjectOpenHashMap<Directive> buildDirectives() {
        Char2ObjectOpenHashMap<Directive> map = new Char2ObjectOpenHashMap<>();
        map.put('%', (t, f) -> "%");
        map.put('n', (t, f) -> "\n");
        map.put('t', (t, f) -> "\t");

        map.put('Y', (t, f) -> Integer.toString(t.getYear()));
        map.put('C', (t, f) -> pad(Math.floorDiv(t.getYear(), 100), 2, '0', f));
        map.put('y', (t, f) -> pad(Math.floorMod(t.getYear(), 100), 2, '0', f));
        map.put('m', (t, f) -> pad(t.getMonthValue(), 2, '0', f));
        map.put('B', (t, f) -> t.getMonth().getDisplayName(TextStyle.FULL, FORMAT_LOCALE));
        map.put('b', (t, f) -> t.getMonth().getDisplayName(TextStyle.SHORT, FORMAT_LOCALE));
        map.put('h', (t, f) -> t.getMonth().getDisplayName(TextStyle.SHORT, FORMAT_LOCALE));
        map.put('d', (t, f) -> pad(t.getDayOfMonth(), 2, '0', f));
        map.put('e', (t, f) -> pad(t.getDayOfMonth(), 2, ' ', f));
        map.put('j', (t, f) -> pad(t.getDayOfYear(), 3, '0', f));

        map.put('H', (t, f) -> pad(t.getHour(), 2, '0', f));
        map.put('k', (t, f) -> pad(t.getHour(), 2, ' ', f));
        map.put('I', (t, f) -> pad(hour12(t), 2, '0', f));
        map.put('l', (t, f) -> pad(hour12(t), 2, ' ', f));
        map.put('P', (t, f) -> t.getHour() < 12 ? "am" : "pm");
        map.put('p', (t, f) -> t.getHour() < 12 ? "AM" : "PM");
        map.put('M', (t, f) -> pad(t.getMinute(), 2, '0', f));
        map.put('S', (t, f) -> pad(t.getSecond(), 2, '0', f));
        map.put('L', (t, f) -> fraction(t.getNano(), 3));
        map.put('N', (t, f) -> fraction(t.getNano(), f.width() < 0 ? DEFAULT_FRACTION_DIGITS : f.width()));

        map.put('z', (t, f) -> TimeUtils.formatOffset(t.getOffset().getTotalSeconds(), f.colon(), null));
        map.put('Z', (t, f) -> t.getOffset().getTotalSeconds() == 0 ? "UTC" : "");

        map.put('A', (t, f) -> t.getDayOfWeek().getDisplayName(TextStyle.FULL, FORMAT_LOCALE));
        map.put('a', (t, f) -> t.getDayOfWeek().getDisplayName(TextStyle.SHORT, FORMAT_LOCALE));
        map.put('u', (t, f) -> Integer.toString(t.getDayOfWeek().getValue()));
        map.put('w', (t, f) -> Integer.toString(TimeUtils.sundayBasedDayOfWeek(t.getDayOfWeek())));
        map.put('s', (t, f) -> Long.toString(t.toEpochSecond()));

        map.put('F', (t, f) -> format("%Y-%m-%d", t));
        map.put('T', (t, f) -> format("%H:%M:%S", t));
        map.put('X', (t, f) -> format("%H:%M:%S", t));
        map.put('D', (t, f) -> format("%m/%d/%y", t));
        map.put('x', (t, f) -> format("%m/%d/%y", t));
        map.put('R', (t, f) -> format("%H:%M", t));
        map.put('r', (t, f) -> format("%I:%M:%S %p", t));
        map.put('c', (t, f) -> format("%a %b %e %H:%M:%S %Y", t));
        return map;
    }

    private static int hour12(OffsetDateTime time) {
        int hour = time.getHour() % 12;
        return hour == 0 ? 12 : hour;
    }

    private static String pad(int value, int digits, char padChar, Flags flags) {
        String text = Integer.toString(value);
        if (flags.noPad() || text.length() >= digits) {
            return text;
        }
        StringBuilder padded = new StringBuilder(digits);
        for (int i = text.length(); i < digits; i++) {
            padded.append(padChar);
        }
        return padded.append(text).toString();
    }

    private static String fraction(int nanos, int digits) {
        String nine = String.format("%09d", nanos);
        if (digits <= 9) {
            return nine.substring(0, digits);
        }
        StringBuilder extended = new StringBuilder(nine);
        while (extended.length() < digits) {
            extended.append('0');
        }
        return extended.toString();
    }
}
