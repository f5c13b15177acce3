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
package com.paremus.mrpc.transport;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.osgi.util.converter.Converters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.config.TransportConfig;

import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.FastThreadLocalThread;

/**
 * The threads and shared resources used by clients and servers. A transport
 * may be shared by any number of clients and servers, and must outlive them.
 */
public class Transport implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(Transport.class);
	
	private static final ByteBufAllocator allocator = new PooledByteBufAllocator(true);
	
	private static Transport defaultTransport;
	
	private final TransportConfig config;
	
	private final EventLoopGroup ioGroup;
	
	private final EventExecutorGroup workers;
	
	private final Timer timer;
	
	public Transport(Map<String, ?> rawConfig) {
		this(Converters.standardConverter().convert(rawConfig).to(TransportConfig.class));
	}
	
	public Transport(TransportConfig config) {
		this.config = config;
		
		timer = new HashedWheelTimer(namedDaemonThreads("MRPC Timeout worker"), 100, MILLISECONDS, 16384);
		ioGroup = new NioEventLoopGroup(config.io_threads(), namedDaemonThreads("MRPC IO: "));
		workers = new RpcExecutorGroup(config.worker_threads(), namedDaemonThreads("MRPC Worker "), 
				config.task_queue_depth());
		
		LOG.debug("Created a transport with {} IO threads and {} worker threads", 
				config.io_threads(), config.worker_threads());
	}

	/**
	 * Get the process-wide transport, creating it using the default 
	 * configuration if necessary. The default transport is never closed.
	 */
	public static synchronized Transport getDefault() {
		if(defaultTransport == null) {
			defaultTransport = new Transport(Collections.emptyMap());
		}
		return defaultTransport;
	}
	
	private static ThreadFactory namedDaemonThreads(String prefix) {
		AtomicInteger threadId = new AtomicInteger(1); 
		return r -> {
			Thread thread = new FastThreadLocalThread(r, prefix + threadId.getAndIncrement());
			thread.setDaemon(true);
			return thread;
		};
	}

	public TransportConfig getConfig() {
		return config;
	}

	public EventLoopGroup getIoGroup() {
		return ioGroup;
	}

	public EventExecutorGroup getWorkers() {
		return workers;
	}

	public Timer getTimer() {
		return timer;
	}

	public ByteBufAllocator getAllocator() {
		return allocator;
	}

	@Override
	public void close() {
		ioGroup.shutdownGracefully(0, 3, SECONDS);
		workers.shutdownGracefully(0, 3, SECONDS);
		timer.stop();
		
		try {
			ioGroup.awaitTermination(3, SECONDS);
			workers.awaitTermination(3, SECONDS);
		} catch (InterruptedException e) {
			LOG.debug("Will not wait for shutdown as this thread is interrupted", e);
			Thread.currentThread().interrupt();
		}
	}
}
