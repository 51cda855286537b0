package com.redhat.cdsync.cli;

import java.time.Duration;
import java.time.format.DateTimeParseException;

import io.quarkus.runtime.configuration.DurationConverter;
import picocli.CommandLine;

/**
 * Accepts the same forms as Quarkus configuration, {@code 30s}, {@code 10m} or ISO-8601.
 */
public class DurationOptionConverter implements CommandLine.ITypeConverter<Duration> {

    @Override
    public Duration convert(String value) {
        Duration result;
        try {
            result = DurationConverter.parseDuration(value);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not a duration");
        }
        if (result == null || result.isNegative()) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not a duration");
        }
        return result;
    }
}
