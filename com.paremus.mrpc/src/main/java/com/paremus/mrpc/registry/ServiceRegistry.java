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

import static com.paremus.mrpc.RpcException.DUPLICATE_SERVICE;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;

/**
 * The services available to a server, indexed by name
 */
public class ServiceRegistry {

	private static final Logger LOG = LoggerFactory.getLogger(ServiceRegistry.class);
	
	private final ConcurrentMap<String, ServiceDefinition> services = new ConcurrentHashMap<>();
	
	/**
	 * Add a service
	 * 
	 * @param definition the service
	 * @throws RpcException if a service with the same name is already present
	 */
	public void add(ServiceDefinition definition) {
		if(services.putIfAbsent(definition.getName(), definition) != null) {
			throw new RpcException("rpc server: duplicated service " + definition.getName(), DUPLICATE_SERVICE);
		}
		LOG.info("Registered the service {} with methods {}", definition.getName(), definition.getMethods());
	}
	
	/**
	 * Find the binding for a procedure
	 * 
	 * @param procedureName a name of the form Service.Method
	 * @return the binding
	 * @throws MissingServiceException if the name is malformed or the service is unknown
	 * @throws MissingMethodException if the service has no such method
	 */
	public MethodBinding<?, ?> find(String procedureName) throws MissingServiceException, MissingMethodException {
		int dot = procedureName.lastIndexOf('.');
		if(dot < 0) {
			throw new MissingServiceException("rpc server: service name must be like \"Service.Method\"");
		}
		String serviceName = procedureName.substring(0, dot);
		String methodName = procedureName.substring(dot + 1);
		
		ServiceDefinition definition = services.get(serviceName);
		if(definition == null) {
			throw new MissingServiceException("rpc server: cannot find service " + serviceName);
		}
		MethodBinding<?, ?> binding = definition.getMethod(methodName);
		if(binding == null) {
			throw new MissingMethodException(serviceName, methodName);
		}
		return binding;
	}

	public Set<String> getServiceNames() {
		return Collections.unmodifiableSet(new TreeSet<>(services.keySet()));
	}
	
	/**
	 * @return the service, or <code>null</code> if it is not registered
	 */
	public ServiceDefinition getService(String name) {
		return services.get(name);
	}
}
