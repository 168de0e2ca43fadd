package org.Aayush.tempo.format;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable registry of named output formats.
 *
 * <p>A named format is either a strftime pattern or a custom renderer. {@link #DB} is
 * registered here but zoned values render it against their UTC instant.</p>
 */
public final class TimeFormats {
    public static final String DB = "db";
    public static final String NUMBER = "number";
    public static final String NSEC = "nsec";
    public static final String USEC = "usec";
    public static final String TIME = "time";
    public static final String SHORT = "short";
    public static final String LONG = "long";
    public static final String LONG_ORDINAL = "long_ordinal";
    public static final String RFC822 = "rfc822";
    public static final String ISO8601 = "iso8601";

    private static final TimeFormats DEFAULT = new TimeFormats(builtIns());

    private final Map<String, NamedFormat> formatsByName;

    private TimeFormats(Map<String, NamedFormat> formatsByName) {
        this.formatsByName = Map.copyOf(formatsByName);
    }

    /**
     * Returns the built-in formats.
     */
    public static TimeFormats defaultFormats() {
        return DEFAULT;
    }

    /**
     * Returns a copy with a pattern format added or replaced.
     */
    public TimeFormats with(String name, String pattern) {
        return with(NamedFormat.ofPattern(name, pattern));
    }

    /**
     * Returns a copy with a custom renderer added or replaced.
     */
    public TimeFormats with(String name, Function<FormattableTime, String> renderer) {
        return with(NamedFormat.ofRenderer(name, renderer));
    }

    private TimeFormats with(NamedFormat format) {
        LinkedHashMap<String, NamedFormat> merged = new LinkedHashMap<>(formatsByName);
        merged.put(format.name(), format);
        return new TimeFormats(merged);
    }

    /**
     * Returns format by name, or {@code null} when not registered.
     */
    public NamedFormat format(String name) {
        if (name == null) {
            return null;
        }
        return formatsByName.get(name);
    }

    /**
     * Returns immutable set of registered format names.
     */
    public Set<String> names() {
        return formatsByName.keySet();
    }

    /**
     * Renders a value with a named format, or returns {@code null} when the name is unknown.
     */
    public String render(String name, FormattableTime time) {
        NamedFormat format = format(name);
        return format == null ? null : format.render(time);
    }

    /**
     * Returns {@code 1st}, {@code 2nd}, {@code 3rd}, {@code 11th} style ordinals.
     */
    public static String ordinalize(int number) {
        int absolute = Math.abs(number);
        String suffix;
        if (absolute % 100 >= 11 && absolute % 100 <= 13) {
            suffix = "th";
        } else {
            switch (absolute % 10) {
                case 1:
                    suffix = "st";
                    break;
                case 2:
                    suffix = "nd";
                    break;
                case 3:
                    suffix = "rd";
                    break;
                default:
                    suffix = "th";
                    break;
            }
        }
        return number + suffix;
    }

    private static Map<String, NamedFormat> builtIns() {
        LinkedHashMap<String, NamedFormat> formats = new LinkedHashMap<>();
        register(formats, NamedFormat.ofPattern(DB, "%Y-%m-%d %H:%M:%S"));
        register(formats, NamedFormat.ofPattern(NUMBER, "%Y%m%d%H%M%S"));
        register(formats, NamedFormat.ofPattern(NSEC, "%Y%m%d%H%M%S%9N"));
        register(formats, NamedFormat.ofPattern(USEC, "%Y%m%d%H%M%S%6N"));
        register(formats, NamedFormat.ofPattern(TIME, "%H:%M"));
        register(formats, NamedFormat.ofPattern(SHORT, "%d %b %H:%M"));
        register(formats, NamedFormat.ofPattern(LONG, "%B %d, %Y %H:%M"));
        register(formats, NamedFormat.ofRenderer(LONG_ORDINAL,
                time -> time.strftime("%B " + ordinalize(time.dayOfMonth()) + ", %Y %H:%M")));
        register(formats, NamedFormat.ofRenderer(RFC822,
                time -> time.strftime("%a, %d %b %Y %H:%M:%S " + time.formattedOffset(false, null))));
        register(formats, NamedFormat.ofRenderer(ISO8601, time -> time.iso8601(0)));
        return formats;
    }

    private static void register(Map<String, NamedFormat> formats, NamedFormat format) {
        formats.put(format.name(), format);
    }

    /**
     * One named format.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class NamedFormat {
        private final String name;
        /** strftime pattern, or {@code null} for renderer formats. */
        private final String pattern;
        private final Function<FormattableTime, String> renderer;

        private NamedFormat(String name, String pattern, Function<FormattableTime, String> renderer) {
            String normalized = Objects.requireNonNull(name, "name").trim();
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("format name must be non-blank");
            }
            this.name = normalized;
            this.pattern = pattern;
            this.renderer = renderer;
        }

        static NamedFormat ofPattern(String name, String pattern) {
            return new NamedFormat(name, Objects.requireNonNull(pattern, "pattern"), null);
        }

        static NamedFormat ofRenderer(String name, Function<FormattableTime, String> renderer) {
            return new NamedFormat(name, null, Objects.requireNonNull(renderer, "renderer"));
        }

        /**
         * Renders one value.
         */
        public String render(FormattableTime time) {
            Objects.requireNonNull(time, "time");
            return pattern != null ? time.strftime(pattern) : renderer.apply(time);
        }
    }
}
