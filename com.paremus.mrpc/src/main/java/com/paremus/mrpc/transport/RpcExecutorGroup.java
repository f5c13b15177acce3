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

import java.util.concurrent.Executor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.MultithreadEventExecutorGroup;
import io.netty.util.concurrent.RejectedExecutionHandlers;

/**
 * The worker threads which run dispatched calls. Each worker has a bounded
 * task queue, and rejects new tasks with a 
 * {@link java.util.concurrent.RejectedExecutionException} when it is full.
 */
public class RpcExecutorGroup extends MultithreadEventExecutorGroup {

	public RpcExecutorGroup(int nThreads, ThreadFactory threadFactory, int maxQueueDepth) {
		super(nThreads, new ThreadPoolExecutor(nThreads, nThreads, 0, TimeUnit.SECONDS, 
				new SynchronousQueue<>(), threadFactory), 
				maxQueueDepth < 0 ? Integer.MAX_VALUE : maxQueueDepth);
	}

	@Override
	protected EventExecutor newChild(Executor executor, Object... args) throws Exception {
		return new DefaultEventExecutor(this, executor, (Integer) args[0], RejectedExecutionHandlers.reject());
	}
}
