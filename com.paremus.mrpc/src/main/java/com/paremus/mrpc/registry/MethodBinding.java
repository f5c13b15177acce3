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

import java.util.concurrent.atomic.AtomicLong;

/**
 * A method of a registered service, along with the shapes of its argument 
 * and reply and a count of the calls made to it
 */
public final class MethodBinding<A, R> {

	private final String name;
	
	private final ValueShape<A> argumentShape;
	
	private final ValueShape<R> replyShape;
	
	private final Invocable<A, R> invocable;
	
	private final AtomicLong calls = new AtomicLong();

	public MethodBinding(String name, ValueShape<A> argumentShape, ValueShape<R> replyShape,
			Invocable<A, R> invocable) {
		this.name = name;
		this.argumentShape = argumentShape;
		this.replyShape = replyShape;
		this.invocable = invocable;
	}

	public String getName() {
		return name;
	}

	public ValueShape<A> getArgumentShape() {
		return argumentShape;
	}

	public ValueShape<R> getReplyShape() {
		return replyShape;
	}

	/**
	 * Invoke the method with a newly allocated reply value
	 * 
	 * @param argument the decoded argument
	 * @return the reply
	 * @throws Exception the failure of the method
	 */
	public R invoke(A argument) throws Exception {
		calls.incrementAndGet();
		return invocable.invoke(argument, replyShape.newReply());
	}

	public long getCallCount() {
		return calls.get();
	}

	@Override
	public String toString() {
		return name + "(" + argumentShape + ") -> " + replyShape;
	}
}
