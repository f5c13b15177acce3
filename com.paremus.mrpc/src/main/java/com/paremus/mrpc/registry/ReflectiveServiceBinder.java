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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the public methods of a service object. The service is named using 
 * the simple name of its class, and the bound methods are those with one of
 * the forms:
 * 
 * <pre>
 *   R method(A argument)
 *   R method(A argument, R reply)
 * </pre>
 * 
 * where the argument and reply types are public. Other methods are ignored.
 */
public class ReflectiveServiceBinder implements ServiceBinder {

	private static final Logger LOG = LoggerFactory.getLogger(ReflectiveServiceBinder.class);
	
	@Override
	public ServiceDefinition bind(Object service) {
		Class<?> clazz = service.getClass();
		
		if(clazz.isAnonymousClass() || clazz.isLocalClass() || clazz.isSynthetic() || 
				!Modifier.isPublic(clazz.getModifiers())) {
			throw new IllegalArgumentException("rpc.Register: type " + clazz.getName() + 
					" is not public and cannot be registered");
		}
		
		ServiceDefinition.Builder builder = ServiceDefinition.builder(clazz.getSimpleName());
		Set<String> bound = new HashSet<>();
		
		Method[] methods = clazz.getMethods();
		Arrays.sort(methods, Comparator.comparing(Method::getName)
				.thenComparing(m -> Arrays.toString(m.getParameterTypes())));
		
		for(Method method : methods) {
			if(!isBindable(method)) {
				continue;
			}
			if(!bound.add(method.getName())) {
				LOG.warn("The method {} of {} is overloaded. Only the first bindable form will be callable.",
						method.getName(), clazz.getName());
				continue;
			}
			bindMethod(builder, service, method);
		}
		
		if(bound.isEmpty()) {
			LOG.warn("The type {} has no methods suitable for remote calls", clazz.getName());
		}
		
		return builder.build();
	}

	private boolean isBindable(Method method) {
		if(method.getDeclaringClass() == Object.class || method.isBridge() || method.isSynthetic() ||
				Modifier.isStatic(method.getModifiers())) {
			return false;
		}
		
		Class<?> replyType = method.getReturnType();
		Class<?>[] params = method.getParameterTypes();
		
		if(replyType == void.class || params.length == 0 || params.length > 2) {
			LOG.debug("The method {} does not take an argument and return a reply", method);
			return false;
		}
		if(params.length == 2 && params[1] != replyType) {
			LOG.debug("The method {} must have a second parameter of type {}", method, replyType.getName());
			return false;
		}
		if(!isExposable(params[0]) || !isExposable(replyType)) {
			LOG.debug("The method {} uses a type which is not public", method);
			return false;
		}
		return true;
	}

	private boolean isExposable(Class<?> type) {
		while(type.isArray()) {
			type = type.getComponentType();
		}
		return type.isPrimitive() || Modifier.isPublic(type.getModifiers());
	}

	@SuppressWarnings("unchecked")
	private <A, R> void bindMethod(ServiceDefinition.Builder builder, Object service, Method method) {
		boolean passReply = method.getParameterCount() == 2;
		method.trySetAccessible();
		
		builder.method(method.getName(), (Class<A>) method.getParameterTypes()[0], 
				(Class<R>) method.getReturnType(), (argument, reply) -> {
					try {
						return (R) (passReply ? method.invoke(service, argument, reply) : 
							method.invoke(service, argument));
					} catch (InvocationTargetException ite) {
						Throwable cause = ite.getCause();
						if(cause instanceof Exception) {
							throw (Exception) cause;
						} else if (cause instanceof Error) {
							throw (Error) cause;
						}
						throw ite;
					}
				});
	}
}
