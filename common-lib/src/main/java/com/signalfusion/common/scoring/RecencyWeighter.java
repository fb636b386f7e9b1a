package com.signalfusion.common.scoring;

import com.signalfusion.common.exception.FusionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Converts a publication timestamp into an exponential recency weight.
 *
 * <pre>
 *   weight = clip(minWeight + (1 − minWeight) × exp(−hoursSincePublished / decayHours), minWeight, 1.0)
 * </pre>
 *
 * <p>Accepted formats: ISO-8601 instant / offset date-time, ISO local date-time (UTC),
 * {@code yyyy-MM-dd HH:mm:ss} (UTC), RFC-1123 and epoch seconds.
 *
 * <p>Unknown age is never penalised: a null, blank or unparsable timestamp, and a
 * timestamp in the future, all weigh 1.0.
 */
public final class RecencyWeighter {

    public static final double DEFAULT_DECAY_HOURS = 24.0;
    public static final double DEFAULT_MIN_WEIGHT  = 0.1;

    private static final DateTimeFormatter SPACE_SEPARATED =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{9,11}(\\.\\d+)?$");
    private static final double SECONDS_PER_HOUR = 3_600.0;

    private final double decayHours;
    private final double minWeight;
    private final Clock clock;

    public RecencyWeighter() {
        this(DEFAULT_DECAY_HOURS, DEFAULT_MIN_WEIGHT, Clock.systemUTC());
    }

    public RecencyWeighter(double decayHours, double minWeight, Clock clock) {
        if (decayHours <= 0.0) {
            throw FusionException.invalidConfiguration("RecencyWeighter", "decayHours must be > 0 but was " + decayHours);
        }
        if (minWeight < 0.0 || minWeight > 1.0) {
            throw FusionException.invalidConfiguration("RecencyWeighter", "minWeight must be in [0,1] but was " + minWeight);
        }
        this.decayHours = decayHours;
        this.minWeight  = minWeight;
        this.clock      = clock != null ? clock : Clock.systemUTC();
    }

    /** Weight relative to the injected clock's current instant. */
    public double weight(String publishedAt) {
        return weight(publishedAt, clock.instant());
    }

    public double weight(String publishedAt, Instant now) {
        return parse(publishedAt)
            .map(published -> weight(published, now))
            .orElse(1.0);
    }

    public double weight(Instant published, Instant now) {
        // whole seconds: toMillis() overflows for instants about 292 million years apart
        Duration age = Duration.between(published, now);
        double hours = (age.getSeconds() + age.getNano() / 1e9) / SECONDS_PER_HOUR;
        if (hours <= 0.0) {
            return 1.0;
        }
        double raw = minWeight + (1.0 - minWeight) * Math.exp(-hours / decayHours);
        return Math.max(minWeight, Math.min(1.0, raw));
    }

    public double minWeight() {
        return minWeight;
    }

    /**
     * Parses {@code value} with every supported format in turn.
     *
     * @return empty when the value is blank or matches none of the formats
     */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();

        if (EPOCH_SECONDS.matcher(text).matches()) {
            double seconds = Double.parseDouble(text);
            return Optional.of(Instant.ofEpochMilli((long) (seconds * 1000)));
        }
        if (text.indexOf('T') > 0) {
            return attempt(() -> OffsetDateTime.parse(text).toInstant())
                .or(() -> attempt(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC)));
        }
        return attempt(() -> LocalDateTime.parse(text, SPACE_SEPARATED).toInstant(ZoneOffset.UTC))
            .or(() -> attempt(() -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
