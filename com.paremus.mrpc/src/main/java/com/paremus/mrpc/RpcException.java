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
package com.paremus.mrpc;

/**
 * The unchecked exception used to report call-level and connection-level
 * failures to users of the RPC runtime. The type code identifies the reason
 * for the failure.
 */
public class RpcException extends RuntimeException {

	private static final long serialVersionUID = 4720185939263851743L;

	/** The failure has no more specific type */
	public static final int UNSPECIFIED = 0;

	/** The client has been closed, or its connection was lost */
	public static final int SHUTDOWN = 1;

	/** The requested codec type is not registered */
	public static final int INVALID_CODEC = 2;

	/** A service with the same name is already registered */
	public static final int DUPLICATE_SERVICE = 3;

	/** The server reported that the call failed */
	public static final int REMOTE = 4;

	/** No response arrived before the call's deadline */
	public static final int TIMEOUT = 5;

	/** A message could not be encoded or decoded */
	public static final int CODEC = 6;

	/** The connection could not be established */
	public static final int CONNECTION = 7;

	private final int type;

	public RpcException(String message) {
		this(message, UNSPECIFIED, null);
	}

	public RpcException(String message, int type) {
		this(message, type, null);
	}

	public RpcException(String message, int type, Throwable cause) {
		super(message, cause);
		this.type = type;
	}

	public int getType() {
		return type;
	}
}
