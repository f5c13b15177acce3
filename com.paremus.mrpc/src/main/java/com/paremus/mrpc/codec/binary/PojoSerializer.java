/*
 Copyright 2008-2011 the original author or authors

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an &quot;AS IS&quot; BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 */

package com.paremus.mrpc.codec.binary;

import java.io.IOException;
import java.io.InvalidClassException;
import java.io.NotSerializableException;
import java.io.StreamCorruptedException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.paremus.mrpc.codec.Values;

import io.netty.buffer.ByteBuf;

/**
 * Writes plain objects as their class name followed by the value of each 
 * non-static, non-transient field. Superclass fields are written first.
 * Objects are recreated using their no-argument constructor.
 */
public class PojoSerializer {

	private final ClassValue<List<Field>> fieldCache = new ClassValue<List<Field>>() {
		@Override
		protected List<Field> computeValue(Class<?> type) {
			List<Field> fields = new ArrayList<>();
			collectFields(type, fields);
			return Collections.unmodifiableList(fields);
		}
	};
	
	private static void collectFields(Class<?> clazz, List<Field> fields) {
		if(clazz == null || clazz == Object.class) {
			return;
		}
		collectFields(clazz.getSuperclass(), fields);
		for (Field field : clazz.getDeclaredFields()) {
			if ((field.getModifiers() & (Modifier.STATIC | Modifier.TRANSIENT)) != 0 || field.isSynthetic()) {
				continue;
			}
			field.setAccessible(true);
			fields.add(field);
		}
	}
	
	public boolean canSerialize(Object pojo) {
		Class<?> clazz = pojo.getClass();
		if(clazz.isArray() || clazz.isEnum() || clazz.isPrimitive() || clazz.isSynthetic()) {
			return false;
		}
		final String className = clazz.getName();
		return !className.startsWith("java") && !className.startsWith("com.sun.") && 
				!className.startsWith("sun.") && !className.startsWith("jdk.");
	}

	public void serialize(ByteBuf wb, BinaryWireFormat wf, Object pojo, int depth) throws IOException {
		Class<?> clazz = pojo.getClass();
		List<Field> fields = fieldCache.get(clazz);
		
		wf.writeString(wb, clazz.getName());
		wf.writeNum(wb, fields.size());
		
		for (Field field : fields) {
			Object value;
			try {
				value = field.get(pojo);
			} catch (IllegalAccessException e) {
				NotSerializableException nse = new NotSerializableException(clazz.getName());
				nse.initCause(e);
				throw nse;
			}
			wf.writeObject(wb, value, depth);
		}
	}

	public Object deserialize(ByteBuf rb, BinaryWireFormat wf, int depth) throws ClassNotFoundException, IOException {
		String className = wf.readString(rb);
		if(className == null) {
			throw new StreamCorruptedException("The object has no type name");
		}
		Class<?> clazz = wf.loadClass(className);
		List<Field> fields = fieldCache.get(clazz);
		
		long count = wf.readNum(rb);
		if(count != fields.size()) {
			throw new InvalidClassException(className, "The encoded object has " + count + 
					" fields but the local type has " + fields.size());
		}
		
		Object pojo = newInstance(clazz);

		for (Field field : fields) {
			Object value = Values.convert(wf.readObject(rb, depth), field.getType());
			if(value == null && field.getType().isPrimitive()) {
				throw new StreamCorruptedException("The primitive field " + field.getName() + 
						" of " + className + " cannot be null");
			}
			try {
				field.set(pojo, value);
			} catch (IllegalAccessException | IllegalArgumentException e) {
				InvalidClassException ice = new InvalidClassException(className, 
						"Unable to set the field " + field.getName());
				ice.initCause(e);
				throw ice;
			}
		}

		return pojo;
	}

	private Object newInstance(Class<?> clazz) throws InvalidClassException {
		try {
			Constructor<?> constructor = clazz.getDeclaredConstructor();
			constructor.setAccessible(true);
			return constructor.newInstance();
		} catch (Exception e) {
			InvalidClassException ice = new InvalidClassException(clazz.getName(), 
					"Exception attempting to create an instance");
			ice.initCause(e);
			throw ice;
		}
	}
}
