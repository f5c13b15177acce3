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
package com.paremus.mrpc.test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Arith {
	
	public static volatile CountDownLatch gate = new CountDownLatch(0);

	public int add(Args args) {
		return args.num1 + args.num2;
	}

	public Integer multiply(Args args, Integer reply) {
		return args.num1 * args.num2;
	}
	
	public Quotient divide(Args args, Quotient reply) {
		if(args.num2 == 0) {
			throw new IllegalArgumentException("divide by zero");
		}
		reply.quo = args.num1 / args.num2;
		reply.rem = args.num1 % args.num2;
		return reply;
	}
	
	public List<Integer> range(Integer n, List<Integer> reply) {
		for(int i = 0; i < n; i++) {
			reply.add(i);
		}
		return reply;
	}
	
	public String fail(String message) {
		throw new IllegalStateException(message);
	}
	
	public String sleep(Integer millis) throws InterruptedException {
		Thread.sleep(millis);
		return "slept";
	}
	
	/**
	 * Waits for the gate to open, for at most ten seconds
	 */
	public Boolean await(String ignored) throws InterruptedException {
		return gate.await(10, TimeUnit.SECONDS);
	}
	
	public void notBound(Args args) {
	}
	
	public static int alsoNotBound(Args args) {
		return 0;
	}
}
