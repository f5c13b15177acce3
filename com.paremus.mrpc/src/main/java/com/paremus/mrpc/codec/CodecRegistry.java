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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The process-wide mapping from a codec type tag to the factory for that codec.
 * 
 * <p>The built-in {@link CodecType}s are present from class initialisation.
 * Additional codecs should be registered before any client dials or any server
 * accepts a connection using them; lookups are safe from any thread.
 */
public final class CodecRegistry {

	private static final Logger LOG = LoggerFactory.getLogger(CodecRegistry.class);

	private static final ConcurrentMap<Integer, CodecFactory> FACTORIES = new ConcurrentHashMap<>();
	
	static {
		for(CodecType type : CodecType.values()) {
			FACTORIES.put(type.getTag(), type.getFactory());
		}
	}
	
	private CodecRegistry() {}
	
	/**
	 * Register a codec
	 * 
	 * @param tag the unsigned 32 bit type tag sent in the connection preamble
	 * @param factory the factory for the codec
	 * @throws IllegalArgumentException if the tag is already in use
	 */
	public static void register(int tag, CodecFactory factory) {
		if(factory == null) {
			throw new IllegalArgumentException("The codec factory must not be null");
		}
		CodecFactory existing = FACTORIES.putIfAbsent(tag, factory);
		if(existing != null) {
			throw new IllegalArgumentException("The codec type " + Integer.toUnsignedString(tag) 
				+ " is already registered to " + existing);
		}
		LOG.info("Registered the codec type {} using {}", Integer.toUnsignedString(tag), factory);
	}
	
	/**
	 * @param tag the codec type
	 * @return the factory, or <code>null</code> if the type is unknown
	 */
	public static CodecFactory lookup(int tag) {
		return FACTORIES.get(tag);
	}
	
	public static boolean isRegistered(int tag) {
		return FACTORIES.containsKey(tag);
	}
}
