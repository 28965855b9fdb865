package io.kestra.plugin.groupby.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonSymbol;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonText;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import com.amazon.ion.system.IonSystemBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class IonValueUtils {
    private static final IonSystem SYSTEM = IonSystemBuilder.standard().build();
    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private IonValueUtils() {
    }

    public static IonSystem system() {
        return SYSTEM;
    }

    public static boolean isNull(IonValue value) {
        return value == null || value.isNullValue();
    }

    public static IonValue nullValue() {
        return SYSTEM.newNull();
    }

    /**
     * Converts a column value to Ion. Dates become day-precision timestamps, instants UTC timestamps.
     */
    public static IonValue toIonValue(Object value) {
        if (value == null) {
            return nullValue();
        }
        if (value instanceof IonValue ionValue) {
            return ionValue;
        }
        if (value instanceof String stringValue) {
            return SYSTEM.newString(stringValue);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return SYSTEM.newInt(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return SYSTEM.newFloat(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return SYSTEM.newDecimal(decimal);
        }
        if (value instanceof Boolean bool) {
            return SYSTEM.newBool(bool);
        }
        if (value instanceof LocalDate date) {
            return SYSTEM.newTimestamp(Timestamp.forDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
        }
        if (value instanceof Instant instant) {
            return SYSTEM.newTimestamp(toTimestamp(instant));
        }
        return SYSTEM.newString(String.valueOf(value));
    }

    public static Long asLong(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonInt ionInt) {
            try {
                return ionInt.bigIntegerValue().longValueExact();
            } catch (ArithmeticException e) {
                throw new CastException("Integer out of 64-bit range: " + ionInt.bigIntegerValue(), e);
            }
        }
        throw new CastException("Expected integer value, got " + value.getType());
    }

    public static Double asDouble(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonFloat ionFloat) {
            return ionFloat.doubleValue();
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue().doubleValue();
        }
        if (value instanceof IonInt ionInt) {
            return ionInt.bigIntegerValue().doubleValue();
        }
        throw new CastException("Expected numeric value, got " + value.getType());
    }

    /**
     * String and symbol values only; other types are not silently rendered as text.
     */
    public static String asString(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonText ionText) {
            return ionText.stringValue();
        }
        throw new CastException("Expected text value, got " + value.getType());
    }

    public static Boolean asBoolean(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        throw new CastException("Expected boolean value, got " + value.getType());
    }

    public static Instant asInstant(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return toInstant(ionTimestamp.timestampValue());
        }
        throw new CastException("Expected timestamp value, got " + value.getType());
    }

    /**
     * Keeps nanosecond precision; finer fractional digits are floored.
     */
    static Instant toInstant(Timestamp timestamp) {
        BigInteger nanos = timestamp.getDecimalMillis().movePointRight(6).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
        BigInteger[] secondsAndNanos = nanos.divideAndRemainder(NANOS_PER_SECOND);
        return Instant.ofEpochSecond(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValueExact());
    }

    /**
     * UTC timestamp carrying only the fractional digits the instant needs.
     */
    static Timestamp toTimestamp(Instant instant) {
        OffsetDateTime utc = instant.atOffset(ZoneOffset.UTC);
        BigDecimal second = BigDecimal.valueOf(utc.getSecond());
        if (utc.getNano() != 0) {
            second = second.add(BigDecimal.valueOf(utc.getNano(), 9).stripTrailingZeros());
        }
        return Timestamp.forSecond(
            utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(), utc.getHour(), utc.getMinute(), second, 0
        );
    }

    public static LocalDate asLocalDate(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonTimestamp ionTimestamp && isDate(ionTimestamp)) {
            Timestamp timestamp = ionTimestamp.timestampValue();
            return LocalDate.of(timestamp.getYear(), timestamp.getMonth(), timestamp.getDay());
        }
        throw new CastException("Expected date value, got " + value);
    }

    /**
     * A timestamp without a time of day: year, month or day precision.
     */
    public static boolean isDate(IonTimestamp value) {
        Timestamp.Precision precision = value.timestampValue().getPrecision();
        return precision == Timestamp.Precision.YEAR
            || precision == Timestamp.Precision.MONTH
            || precision == Timestamp.Precision.DAY;
    }

    public static boolean isSymbol(IonValue value) {
        return value instanceof IonSymbol && !value.isNullValue();
    }
}
