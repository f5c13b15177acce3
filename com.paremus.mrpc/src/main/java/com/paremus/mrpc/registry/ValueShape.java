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
package com.paremus.mrpc.registry;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

import com.paremus.mrpc.codec.Values;

/**
 * Describes the type of a method argument or reply, and allocates the fresh
 * reply value passed to each invocation.
 *
 * <p>Sequences and maps are allocated as empty containers, primitives, their
 * wrappers and strings as their zero value, arrays as empty arrays and other
 * types using their no-argument constructor. Types which cannot be allocated
 * produce <code>null</code>.
 */
public final class ValueShape<T> {
	
	private static final Map<Class<?>, Object> ZERO_VALUES = new HashMap<>();
	
	static {
		ZERO_VALUES.put(Boolean.class, Boolean.FALSE);
		ZERO_VALUES.put(Byte.class, (byte) 0);
		ZERO_VALUES.put(Character.class, (char) 0);
		ZERO_VALUES.put(Short.class, (short) 0);
		ZERO_VALUES.put(Integer.class, 0);
		ZERO_VALUES.put(Long.class, 0L);
		ZERO_VALUES.put(Float.class, 0f);
		ZERO_VALUES.put(Double.class, 0d);
		ZERO_VALUES.put(String.class, "");
	}

	private final Class<T> type;
	
	private final Supplier<T> allocator;

	@SuppressWarnings("unchecked")
	private ValueShape(Class<T> type) {
		this.type = (Class<T>) Values.asWrapper(type);
		this.allocator = allocatorFor(this.type);
	}
	
	public static <T> ValueShape<T> of(Class<T> type) {
		if(type == null || type == void.class || type == Void.class) {
			throw new IllegalArgumentException("A value shape requires a non-void type");
		}
		return new ValueShape<>(type);
	}

	/**
	 * @return the type, with primitives replaced by their wrapper types
	 */
	public Class<T> getType() {
		return type;
	}

	public T newReply() {
		return allocator.get();
	}
	
	@SuppressWarnings("unchecked")
	private static <T> Supplier<T> allocatorFor(Class<T> type) {
		Object zero = ZERO_VALUES.get(type);
		if(zero != null) {
			return () -> (T) zero;
		}
		
		if(type.isArray()) {
			return () -> (T) Array.newInstance(type.getComponentType(), 0);
		}
		
		boolean isAbstract = type.isInterface() || Modifier.isAbstract(type.getModifiers());
		
		if(isAbstract) {
			if(type.isAssignableFrom(ArrayList.class)) {
				return () -> (T) new ArrayList<>();
			} else if(type.isAssignableFrom(LinkedHashSet.class)) {
				return () -> (T) new LinkedHashSet<>();
			} else if(type.isAssignableFrom(TreeSet.class) && 
					(type == SortedSet.class || type == NavigableSet.class)) {
				return () -> (T) new TreeSet<>();
			} else if(type.isAssignableFrom(LinkedHashMap.class)) {
				return () -> (T) new LinkedHashMap<>();
			} else if(type.isAssignableFrom(TreeMap.class) && 
					(type == SortedMap.class || type == NavigableMap.class)) {
				return () -> (T) new TreeMap<>();
			}
			return () -> null;
		}
		
		if(type == Object.class || type.isEnum()) {
			return () -> null;
		}
		
		Constructor<T> constructor;
		try {
			constructor = type.getDeclaredConstructor();
			constructor.setAccessible(true);
		} catch (Exception e) {
			return () -> null;
		}
		
		return () -> {
			try {
				return constructor.newInstance();
			} catch (Exception e) {
				throw new IllegalStateException("Unable to create a reply of type " + type.getName(), e);
			}
		};
	}

	@Override
	public String toString() {
		return type.getName();
	}
}
