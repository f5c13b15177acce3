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
package com.paremus.mrpc.client;

import static com.paremus.mrpc.RpcException.UNSPECIFIED;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;

import io.netty.util.Timeout;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

/**
 * A single invocation made by an {@link RpcClient}. A call completes exactly
 * once, either with a reply or with an error, and is never reused.
 *
 * @param <R> the reply type
 */
public final class Call<R> {

	private static final Logger LOG = LoggerFactory.getLogger(Call.class);
	
	private final String procedureName;
	
	private final Object arguments;
	
	private final Class<R> replyType;
	
	private final Promise<R> result;
	
	private volatile long sequence;
	
	private volatile Timeout timeout;

	Call(String procedureName, Object arguments, Class<R> replyType, Promise<R> result,
			BlockingQueue<Call<?>> done) {
		this.procedureName = procedureName;
		this.arguments = arguments;
		this.replyType = replyType;
		this.result = result;
		
		result.addListener(f -> {
			Timeout t = timeout;
			if(t != null) {
				t.cancel();
			}
			if(done != null && !done.offer(this)) {
				LOG.warn("The completion queue for the call {} with sequence {} is full. The call will not be added.",
						procedureName, Long.toUnsignedString(sequence));
			}
		});
	}

	public String getProcedureName() {
		return procedureName;
	}

	public Object getArguments() {
		return arguments;
	}

	public Class<R> getReplyType() {
		return replyType;
	}

	/**
	 * @return the sequence number, or 0 if the call was never sent
	 */
	public long getSequence() {
		return sequence;
	}
	
	void setSequence(long sequence) {
		this.sequence = sequence;
	}
	
	void setTimeout(Timeout timeout) {
		this.timeout = timeout;
		if(result.isDone()) {
			timeout.cancel();
		}
	}

	boolean complete(R reply) {
		return result.trySuccess(reply);
	}
	
	boolean fail(Throwable failure) {
		return result.tryFailure(failure);
	}
	
	public boolean isDone() {
		return result.isDone();
	}

	/**
	 * @return the reply, or <code>null</code> if the call has not succeeded
	 */
	public R getReply() {
		return result.getNow();
	}
	
	/**
	 * @return the failure, or <code>null</code> if the call has not failed
	 */
	public Throwable getError() {
		return result.cause();
	}
	
	/**
	 * Wait for the call to complete
	 * 
	 * @return this call
	 * @throws InterruptedException if the calling thread is interrupted
	 */
	public Call<R> await() throws InterruptedException {
		result.await();
		return this;
	}
	
	public boolean await(long time, TimeUnit unit) throws InterruptedException {
		return result.await(time, unit);
	}
	
	/**
	 * Wait for the call to complete and return the reply
	 * 
	 * @return the reply
	 * @throws RpcException if the call failed
	 * @throws InterruptedException if the calling thread is interrupted
	 */
	public R getResult() throws InterruptedException {
		result.await();
		if(result.isSuccess()) {
			return result.getNow();
		}
		Throwable cause = result.cause();
		if(cause instanceof RpcException) {
			throw (RpcException) cause;
		}
		throw new RpcException(String.valueOf(cause.getMessage()), UNSPECIFIED, cause);
	}
	
	/**
	 * @return a future which completes with this call
	 */
	public Future<R> toFuture() {
		return result;
	}

	@Override
	public String toString() {
		return "Call [procedureName=" + procedureName + ", sequence=" + Long.toUnsignedString(sequence) + 
				", done=" + result.isDone() + "]";
	}
}
