package dev.poc.trello.tool;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value types a tool parameter may declare, with the JSON schema type each one advertises.
 */
public enum ParameterType {

	STRING("string"),

	BOOLEAN("boolean"),

	INTEGER("integer"),

	/** Trello position: {@code top}, {@code bottom} or a non-negative number. */
	POSITION(List.of("string", "number")),

	STRING_ARRAY("array"),

	OBJECT("object"),

	/** ISO-8601 date or date-time. */
	DATE("string");

	private static final DateTimeFormatter DUE_DATE_FORMAT = new DateTimeFormatterBuilder()
		.append(DateTimeFormatter.ISO_LOCAL_DATE)
		.optionalStart()
		.appendLiteral('T')
		.append(DateTimeFormatter.ISO_LOCAL_TIME)
		.optionalStart()
		.appendOffsetId()
		.optionalEnd()
		.optionalEnd()
		.toFormatter();

	private final Object schemaType;

	ParameterType(Object schemaType) {
		this.schemaType = schemaType;
	}

	public Object schemaType() {
		return this.schemaType;
	}

	/**
	 * Check that a non-null value has this type.
	 * @param value argument value
	 * @return {@code true} if the value is acceptable for the type
	 */
	public boolean accepts(Object value) {
		return switch (this) {
			case STRING -> value instanceof String;
			case BOOLEAN -> value instanceof Boolean;
			case INTEGER -> integralValue(value).isPresent();
			case POSITION -> isPosition(value);
			case STRING_ARRAY -> value instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
			case OBJECT -> value instanceof Map<?, ?>;
			case DATE -> value instanceof String text && parseDate(text).isPresent();
		};
	}

	/**
	 * Read an integral number, accepting integral doubles such as {@code 50.0}.
	 * @param value candidate value
	 * @return the long value when the input is an integral number
	 */
	public static Optional<Long> integralValue(Object value) {
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return Optional.of(((Number) value).longValue());
		}
		if (value instanceof Number number) {
			try {
				return Optional.of(new BigDecimal(number.toString()).longValueExact());
			}
			catch (ArithmeticException | NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	/**
	 * Parse a due date. Accepts instants ({@code 2024-01-01T12:00:00Z}), offset date-times, local
	 * date-times (taken as UTC) and plain dates (midnight UTC).
	 * @param text date text
	 * @return parsed instant
	 */
	public static Optional<Instant> parseDate(String text) {
		String candidate = text.strip();
		if (candidate.isEmpty()) {
			return Optional.empty();
		}
		try {
			TemporalAccessor parsed = DUE_DATE_FORMAT.parseBest(candidate, OffsetDateTime::from, LocalDateTime::from,
					LocalDate::from);
			if (parsed instanceof OffsetDateTime offsetDateTime) {
				return Optional.of(offsetDateTime.toInstant());
			}
			if (parsed instanceof LocalDateTime localDateTime) {
				return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
			}
			return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
		}
		catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	private static boolean isPosition(Object value) {
		if (value instanceof Number number) {
			return number.doubleValue() >= 0 && Double.isFinite(number.doubleValue());
		}
		if (value instanceof String text) {
			String trimmed = text.strip();
			if ("top".equals(trimmed) || "bottom".equals(trimmed)) {
				return true;
			}
			try {
				double numeric = Double.parseDouble(trimmed);
				return numeric >= 0 && Double.isFinite(numeric);
			}
			catch (NumberFormatException e) {
				return false;
			}
		}
		return false;
	}

}
