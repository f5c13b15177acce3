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

public class MissingMethodException extends Exception {

	private static final long serialVersionUID = -5390658105164314276L;

	public MissingMethodException(String service, String method) {
		super("rpc server: cannot find method " + method + " on service " + service);
	}
}
