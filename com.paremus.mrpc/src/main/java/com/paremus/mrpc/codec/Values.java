/*-
 * #%L
 * com.paremus.mrpc
 * %%
 * Copyright (C) 2016 - 2019 Paremus Ltd
 * %%
 * Licensed under the Fair Source License, Version 0.9 (the "License");
 * 
 * See the NOTICE.txt file distributed with this work for additional 
 * information regarding copyright ownership. You may not use this file 
 * except in compliance with the License. For usage restrictions see the 
 * LICENSE.txt file distributed with this work
 * #L%
 */
package com.paremus.mrpc.codec;

import java.io.InvalidObjectException;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts decoded values to the types expected by the receiver, for example
 * when a small number is decoded as an {@link Integer} but a {@link Long} is 
 * required, or when a decoded list must become an array.
 */
public final class Values {

	private static final Map<Class<?>, Class<?>> WRAPPER_TYPES = new HashMap<>(31);

	static {
		WRAPPER_TYPES.put(boolean.class, Boolean.class);
		WRAPPER_TYPES.put(byte.class, Byte.class);
		WRAPPER_TYPES.put(char.class, Character.class);
		WRAPPER_TYPES.put(short.class, Short.class);
		WRAPPER_TYPES.put(int.class, Integer.class);
		WRAPPER_TYPES.put(long.class, Long.class);
		WRAPPER_TYPES.put(float.class, Float.class);
		WRAPPER_TYPES.put(double.class, Double.class);
		WRAPPER_TYPES.put(void.class, Void.class);
	}
	
	private Values() {}
	
	public static Class<?> asWrapper(Class<?> clazz) {
		Class<?> ret = WRAPPER_TYPES.get(clazz);
		return ret == null ? clazz : ret;
	}

	/**
	 * Convert a decoded value to the supplied type
	 * 
	 * @param o the decoded value
	 * @param clazz the required type, primitive types are converted to their wrappers
	 * @return the converted value
	 * @throws InvalidObjectException if the value cannot be represented as the type
	 */
	@SuppressWarnings("unchecked")
	public static <T> T convert(Object o, Class<T> clazz) throws InvalidObjectException {
		if (o == null || clazz == null) {
			return null;
		}

		Class<?> target = asWrapper(clazz);
		Class<?> oClass = o.getClass();
		
		if(target.isArray()) {
			if(target.isAssignableFrom(oClass)) {
				return (T) o;
			}
			return (T) toArray(o, target.getComponentType());
		}
		
		if(Collection.class.isAssignableFrom(target) && !target.isInstance(o)) {
			return (T) toCollection(o, target);
		}
		
		if(Map.class.isAssignableFrom(target) && o instanceof Map && !target.isInstance(o)) {
			Map<Object, Object> map = newInstance(target, LinkedHashMap::new);
			map.putAll((Map<?, ?>) o);
			return (T) map;
		}

		if (target.isInstance(o)) {
			return (T) o;
		}

		if (Number.class.isAssignableFrom(target)) {
			Number n = null;
			if (o instanceof Number) {
				n = (Number) o;
			} else if (o instanceof Character) {
				n = (int) ((Character) o).charValue();
			}
			
			if(n != null) {
				if (target == Byte.class) return (T)(Byte)n.byteValue();
				if (target == Short.class) return (T)(Short)n.shortValue();
				if (target == Integer.class) return (T)(Integer)n.intValue();
				if (target == Long.class) return (T)(Long)n.longValue();
				if (target == Float.class) return (T)(Float)n.floatValue();
				if (target == Double.class) return (T)(Double)n.doubleValue();
				if (target == BigInteger.class) return (T)BigInteger.valueOf(n.longValue());
				if (target == BigDecimal.class) return (T)new BigDecimal(n.toString());
			}
		}
		
		if (target == Character.class) {
			if(o instanceof Number) {
				return (T)(Character)(char)((Number) o).intValue();
			} else if (o instanceof CharSequence && ((CharSequence) o).length() == 1) {
				return (T)(Character)((CharSequence) o).charAt(0);
			}
		}

		if (target == String.class && (o instanceof CharSequence || o instanceof Character)) {
			return (T)o.toString();
		}
		
		if (target.isEnum() && o instanceof String) {
			try {
				return (T) Enum.valueOf(target.asSubclass(Enum.class), (String) o);
			} catch (IllegalArgumentException iae) {
				throw new InvalidObjectException("The value " + o + " is not a constant of " + target.getName());
			}
		}

		throw new InvalidObjectException("Unable to convert the type " + oClass.getName() + 
				" to " + target.getName());
	}

	private static Object toArray(Object o, Class<?> componentType) throws InvalidObjectException {
		List<?> values;
		if(o instanceof Collection) {
			values = new ArrayList<>((Collection<?>) o);
		} else if (o instanceof Object[]) {
			values = Arrays.asList((Object[]) o);
		} else if (o.getClass().isArray()) {
			int length = Array.getLength(o);
			List<Object> list = new ArrayList<>(length);
			for(int i = 0; i < length; i++) {
				list.add(Array.get(o, i));
			}
			values = list;
		} else {
			throw new InvalidObjectException("Unable to convert the type " + o.getClass().getName() + 
					" to an array of " + componentType.getName());
		}
		
		Object array = Array.newInstance(componentType, values.size());
		for(int i = 0; i < values.size(); i++) {
			Object value = convert(values.get(i), componentType);
			if(value == null && componentType.isPrimitive()) {
				throw new InvalidObjectException("The array of " + componentType.getName() + 
						" cannot contain null");
			}
			Array.set(array, i, value);
		}
		return array;
	}

	@SuppressWarnings("unchecked")
	private static Collection<Object> toCollection(Object o, Class<?> target) throws InvalidObjectException {
		Collection<Object> collection;
		if(Set.class.isAssignableFrom(target)) {
			collection = newInstance(target, LinkedHashSet::new);
		} else {
			collection = newInstance(target, ArrayList::new);
		}
		
		if(o instanceof Collection) {
			collection.addAll((Collection<Object>) o);
		} else if (o instanceof Object[]) {
			collection.addAll(Arrays.asList((Object[]) o));
		} else if (o.getClass().isArray()) {
			int length = Array.getLength(o);
			for(int i = 0; i < length; i++) {
				collection.add(Array.get(o, i));
			}
		} else {
			throw new InvalidObjectException("Unable to convert the type " + o.getClass().getName() + 
					" to " + target.getName());
		}
		return collection;
	}
	
	/**
	 * Create an empty instance of a container type, using the default 
	 * implementation when the type is an interface or abstract
	 */
	@SuppressWarnings("unchecked")
	static <C> C newInstance(Class<?> type, java.util.function.Supplier<? extends C> defaultImpl) 
			throws InvalidObjectException {
		if(type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
			C c = defaultImpl.get();
			if(type.isInstance(c)) {
				return c;
			}
			throw new InvalidObjectException("No default implementation is available for " + type.getName());
		}
		try {
			Constructor<?> constructor = type.getConstructor();
			return (C) constructor.newInstance();
		} catch (Exception e) {
			InvalidObjectException ioe = new InvalidObjectException("Unable to create an instance of " + type.getName());
			ioe.initCause(e);
			throw ioe;
		}
	}
}
