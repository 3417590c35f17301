/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.quackpool;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Zips a {@link QueryResult}'s columns with each row's values, producing maps or instances of a target type.
 * <p>
 * Column names are validated once per result, before any row is materialized:
 * <ul>
 *   <li>a name that is neither in {@link KnownColumns} nor a field of the target type fails with
 *   {@link UnknownColumnNameException}, unless dynamic columns are enabled</li>
 *   <li>with a target type, a name that is not one of its fields fails with {@link RecordConstructionException}</li>
 * </ul>
 * Target types are records (built through the canonical constructor) or JavaBeans (built through the no-argument
 * constructor and setters). Matching is by exact name.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class RowMaterializer {
	@NonNull
	private static final Map<Class<?>, Class<?>> BOXED_TYPES_BY_PRIMITIVE_TYPE = Map.of(
			boolean.class, Boolean.class,
			byte.class, Byte.class,
			short.class, Short.class,
			int.class, Integer.class,
			long.class, Long.class,
			float.class, Float.class,
			double.class, Double.class,
			char.class, Character.class);

	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final ConcurrentMap<Class<?>, TargetFields> targetFieldsCache;

	RowMaterializer(@NonNull InstanceProvider instanceProvider,
									@NonNull ZoneId timeZone) {
		this.instanceProvider = requireNonNull(instanceProvider);
		this.timeZone = requireNonNull(timeZone);
		this.targetFieldsCache = new ConcurrentHashMap<>();
	}

	@NonNull
	List<Map<String, Object>> toMaps(@NonNull QueryResult queryResult,
																	 @NonNull KnownColumns knownColumns,
																	 boolean allowDynamicColumns) {
		requireNonNull(queryResult);
		requireNonNull(knownColumns);

		validateColumns(queryResult.getColumns(), knownColumns, allowDynamicColumns, null);

		List<String> columns = queryResult.getColumns();
		List<Map<String, Object>> maps = new ArrayList<>(queryResult.getRowCount());

		for (List<Object> row : queryResult.getRows()) {
			Map<String, Object> map = new LinkedHashMap<>(columns.size() * 2);

			for (int i = 0; i < columns.size(); ++i)
				map.put(columns.get(i), row.get(i));

			maps.add(Collections.unmodifiableMap(map));
		}

		return maps;
	}

	@NonNull
	<T> List<T> toInstances(@NonNull QueryResult queryResult,
													@NonNull Class<T> targetType,
													@NonNull KnownColumns knownColumns,
													boolean allowDynamicColumns) {
		requireNonNull(queryResult);
		requireNonNull(targetType);
		requireNonNull(knownColumns);

		TargetFields targetFields = determineTargetFields(targetType);
		validateColumns(queryResult.getColumns(), knownColumns, allowDynamicColumns, targetFields);

		List<T> instances = new ArrayList<>(queryResult.getRowCount());

		for (List<Object> row : queryResult.getRows())
			instances.add(targetType.isRecord()
					? toRecord(queryResult.getColumns(), row, targetType, targetFields)
					: toBean(queryResult.getColumns(), row, targetType, targetFields));

		return instances;
	}

	private void validateColumns(@NonNull List<String> columns,
															 @NonNull KnownColumns knownColumns,
															 boolean allowDynamicColumns,
															 @Nullable TargetFields targetFields) {
		for (String column : columns) {
			boolean targetField = targetFields != null && targetFields.contains(column);

			if (!allowDynamicColumns && !targetField && !knownColumns.contains(column))
				throw new UnknownColumnNameException(column);

			if (targetFields != null && !targetField)
				throw new RecordConstructionException(targetFields.getTargetType(), column,
						format("Column '%s' does not match any field of %s", column, targetFields.getTargetType().getSimpleName()));
		}
	}

	@NonNull
	private <T> T toRecord(@NonNull List<String> columns,
												 @NonNull List<Object> row,
												 @NonNull Class<T> recordType,
												 @NonNull TargetFields targetFields) {
		RecordComponent[] recordComponents = recordType.getRecordComponents();
		Object[] args = new Object[recordComponents.length];
		boolean[] assigned = new boolean[recordComponents.length];

		for (int i = 0; i < columns.size(); ++i) {
			String column = columns.get(i);
			int componentIndex = targetFields.getRecordComponentIndex(column);
			args[componentIndex] = convert(row.get(i), recordComponents[componentIndex].getType(), recordType, column);
			assigned[componentIndex] = true;
		}

		for (int i = 0; i < recordComponents.length; ++i) {
			Class<?> componentType = recordComponents[i].getType();

			// Components with no column default like fields do
			if (!assigned[i] && componentType.isPrimitive())
				args[i] = defaultPrimitiveValue(componentType);
		}

		return this.instanceProvider.provideRecord(recordType, args);
	}

	@NonNull
	private <T> T toBean(@NonNull List<String> columns,
											 @NonNull List<Object> row,
											 @NonNull Class<T> beanType,
											 @NonNull TargetFields targetFields) {
		T bean = this.instanceProvider.provide(beanType);

		for (int i = 0; i < columns.size(); ++i) {
			String column = columns.get(i);
			Method writeMethod = targetFields.getWriteMethod(column);
			Object value = convert(row.get(i), writeMethod.getParameterTypes()[0], beanType, column);

			try {
				writeMethod.invoke(bean, value);
			} catch (IllegalAccessException | InvocationTargetException e) {
				throw new RecordConstructionException(beanType, column,
						format("Unable to set '%s' on %s", column, beanType.getSimpleName()), e);
			}
		}

		return bean;
	}

	/**
	 * Massages a normalized result value to match the given field type.
	 */
	@Nullable
	Object convert(@Nullable Object value,
								 @NonNull Class<?> fieldType,
								 @NonNull Class<?> targetType,
								 @NonNull String column) {
		if (value == null) {
			if (fieldType.isPrimitive())
				throw new RecordConstructionException(targetType, column,
						format("Column '%s' is NULL but field '%s' of %s is primitive (%s)", column, column,
								targetType.getSimpleName(), fieldType.getName()));

			return null;
		}

		Class<?> boxedType = BOXED_TYPES_BY_PRIMITIVE_TYPE.getOrDefault(fieldType, fieldType);

		if (boxedType.isInstance(value))
			return value;

		Object converted = convertValue(value, boxedType);

		if (converted == null)
			throw new RecordConstructionException(targetType, column,
					format("Cannot assign value of type %s in column '%s' to field of type %s on %s",
							value.getClass().getName(), column, fieldType.getName(), targetType.getSimpleName()));

		return converted;
	}

	@Nullable
	private Object convertValue(@NonNull Object value,
															@NonNull Class<?> targetType) {
		if (value instanceof Number number) {
			if (Byte.class.equals(targetType))
				return number.byteValue();
			if (Short.class.equals(targetType))
				return number.shortValue();
			if (Integer.class.equals(targetType))
				return number.intValue();
			if (Long.class.equals(targetType))
				return number.longValue();
			if (Float.class.equals(targetType))
				return number.floatValue();
			if (Double.class.equals(targetType))
				return number.doubleValue();
			if (BigDecimal.class.equals(targetType))
				return number instanceof BigInteger bigInteger ? new BigDecimal(bigInteger) : new BigDecimal(number.toString());
			if (BigInteger.class.equals(targetType))
				return number instanceof BigDecimal bigDecimal ? bigDecimal.toBigInteger() : new BigDecimal(number.toString()).toBigInteger();
			if (Boolean.class.equals(targetType))
				return number.intValue() != 0;
		}

		// Legacy java.sql.* coming from drivers
		if (value instanceof java.sql.Timestamp timestamp) {
			if (LocalDateTime.class.equals(targetType))
				return timestamp.toLocalDateTime();
			if (Instant.class.equals(targetType))
				return timestamp.toInstant();
			if (LocalDate.class.equals(targetType))
				return timestamp.toLocalDateTime().toLocalDate();
			if (OffsetDateTime.class.equals(targetType))
				return timestamp.toInstant().atZone(this.timeZone).toOffsetDateTime();
		}

		if (value instanceof java.sql.Date date && LocalDate.class.equals(targetType))
			return date.toLocalDate();

		if (value instanceof java.sql.Time time && LocalTime.class.equals(targetType))
			return time.toLocalTime();

		if (value instanceof LocalDateTime localDateTime) {
			if (Instant.class.equals(targetType))
				return localDateTime.atZone(this.timeZone).toInstant();
			if (LocalDate.class.equals(targetType))
				return localDateTime.toLocalDate();
			if (OffsetDateTime.class.equals(targetType))
				return localDateTime.atZone(this.timeZone).toOffsetDateTime();
		}

		if (value instanceof OffsetDateTime offsetDateTime) {
			if (Instant.class.equals(targetType))
				return offsetDateTime.toInstant();
			if (LocalDateTime.class.equals(targetType))
				return offsetDateTime.atZoneSameInstant(this.timeZone).toLocalDateTime();
		}

		if (value instanceof LocalDate localDate && LocalDateTime.class.equals(targetType))
			return localDate.atStartOfDay();

		if (UUID.class.equals(targetType)) {
			try {
				return UUID.fromString(value.toString());
			} catch (IllegalArgumentException e) {
				return null;
			}
		}

		if (targetType.isEnum())
			return enumValue(targetType, value.toString());

		return null;
	}

	@Nullable
	private static Object enumValue(@NonNull Class<?> enumType,
																	@NonNull String name) {
		for (Object constant : enumType.getEnumConstants())
			if (((Enum<?>) constant).name().equals(name))
				return constant;

		return null;
	}

	@NonNull
	private static Object defaultPrimitiveValue(@NonNull Class<?> primitiveType) {
		if (boolean.class.equals(primitiveType))
			return false;
		if (char.class.equals(primitiveType))
			return '\0';
		if (float.class.equals(primitiveType))
			return 0F;
		if (double.class.equals(primitiveType))
			return 0D;
		if (long.class.equals(primitiveType))
			return 0L;
		if (short.class.equals(primitiveType))
			return (short) 0;
		if (byte.class.equals(primitiveType))
			return (byte) 0;

		return 0;
	}

	@NonNull
	TargetFields determineTargetFields(@NonNull Class<?> targetType) {
		requireNonNull(targetType);
		return this.targetFieldsCache.computeIfAbsent(targetType, TargetFields::of);
	}

	/**
	 * The assignable fields of a target type: record components, or JavaBean properties with setters.
	 */
	@ThreadSafe
	static final class TargetFields {
		@NonNull
		private final Class<?> targetType;
		@NonNull
		private final Map<String, Integer> recordComponentIndicesByName;
		@NonNull
		private final Map<String, Method> writeMethodsByName;

		private TargetFields(@NonNull Class<?> targetType,
												 @NonNull Map<String, Integer> recordComponentIndicesByName,
												 @NonNull Map<String, Method> writeMethodsByName) {
			this.targetType = targetType;
			this.recordComponentIndicesByName = Map.copyOf(recordComponentIndicesByName);
			this.writeMethodsByName = Map.copyOf(writeMethodsByName);
		}

		@NonNull
		static TargetFields of(@NonNull Class<?> targetType) {
			requireNonNull(targetType);

			Map<String, Integer> recordComponentIndicesByName = new LinkedHashMap<>();
			Map<String, Method> writeMethodsByName = new LinkedHashMap<>();

			if (targetType.isRecord()) {
				RecordComponent[] recordComponents = targetType.getRecordComponents();

				for (int i = 0; i < recordComponents.length; ++i)
					recordComponentIndicesByName.put(recordComponents[i].getName(), i);
			} else {
				try {
					BeanInfo beanInfo = Introspector.getBeanInfo(targetType);

					for (PropertyDescriptor propertyDescriptor : beanInfo.getPropertyDescriptors()) {
						Method writeMethod = propertyDescriptor.getWriteMethod();

						if (writeMethod != null)
							writeMethodsByName.put(propertyDescriptor.getName(), writeMethod);
					}
				} catch (IntrospectionException e) {
					throw new RecordConstructionException(targetType, null,
							format("Unable to introspect properties for %s", targetType.getName()), e);
				}
			}

			return new TargetFields(targetType, recordComponentIndicesByName, writeMethodsByName);
		}

		boolean contains(@NonNull String name) {
			return this.recordComponentIndicesByName.containsKey(name) || this.writeMethodsByName.containsKey(name);
		}

		int getRecordComponentIndex(@NonNull String name) {
			return requireNonNull(this.recordComponentIndicesByName.get(name));
		}

		@NonNull
		Method getWriteMethod(@NonNull String name) {
			return requireNonNull(this.writeMethodsByName.get(name));
		}

		@NonNull
		Class<?> getTargetType() {
			return this.targetType;
		}
	}
}
