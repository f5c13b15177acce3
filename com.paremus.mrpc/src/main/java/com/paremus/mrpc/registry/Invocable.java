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

/**
 * A single callable service method
 *
 * @param <A> the argument type
 * @param <R> the reply type
 */
@FunctionalInterface
public interface Invocable<A, R> {

	/**
	 * Invoke the method
	 * 
	 * @param argument the decoded argument
	 * @param reply a freshly allocated reply value, which may be populated and returned
	 * @return the reply to send
	 * @throws Exception if the call fails. The exception message is sent to the caller.
	 */
	R invoke(A argument, R reply) throws Exception;
}
