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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named service and the methods that it exposes
 */
public final class ServiceDefinition {

	private final String name;
	
	private final Map<String, MethodBinding<?, ?>> methods;

	private ServiceDefinition(String name, Map<String, MethodBinding<?, ?>> methods) {
		this.name = name;
		this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String getName() {
		return name;
	}

	/**
	 * @param methodName the method name
	 * @return the binding, or <code>null</code> if the service has no such method
	 */
	public MethodBinding<?, ?> getMethod(String methodName) {
		return methods.get(methodName);
	}

	public Collection<MethodBinding<?, ?>> getMethods() {
		return methods.values();
	}

	@Override
	public String toString() {
		return "ServiceDefinition [name=" + name + ", methods=" + methods.keySet() + "]";
	}

	public static final class Builder {
		
		private final String name;
		
		private final Map<String, MethodBinding<?, ?>> methods = new LinkedHashMap<>();

		private Builder(String name) {
			this.name = checkName("service", name);
		}
		
		public <A, R> Builder method(String methodName, Class<A> argumentType, Class<R> replyType, 
				Invocable<A, R> invocable) {
			checkName("method", methodName);
			if(invocable == null) {
				throw new IllegalArgumentException("The method " + methodName + " has no implementation");
			}
			if(methods.containsKey(methodName)) {
				throw new IllegalArgumentException("The service " + name + " already has a method " + methodName);
			}
			methods.put(methodName, new MethodBinding<>(methodName, ValueShape.of(argumentType), 
					ValueShape.of(replyType), invocable));
			return this;
		}
		
		public ServiceDefinition build() {
			return new ServiceDefinition(name, methods);
		}
	}
	
	private static String checkName(String kind, String name) {
		if(name == null || name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
			throw new IllegalArgumentException("The " + kind + " name " + name + " is not valid");
		}
		for(int i = 1; i < name.length(); i++) {
			if(!Character.isJavaIdentifierPart(name.charAt(i))) {
				throw new IllegalArgumentException("The " + kind + " name " + name + " is not valid");
			}
		}
		return name;
	}
}
