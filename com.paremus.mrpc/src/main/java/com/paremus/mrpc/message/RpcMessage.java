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
package com.paremus.mrpc.message;

import com.paremus.mrpc.codec.Header;

/**
 * A header and body pair waiting to be encoded onto a connection
 */
public final class RpcMessage {

	private final Header header;
	
	private final Object body;

	public RpcMessage(Header header, Object body) {
		this.header = header;
		this.body = body;
	}

	public Header getHeader() {
		return header;
	}

	public Object getBody() {
		return body;
	}

	@Override
	public String toString() {
		return "RpcMessage [header=" + header + "]";
	}
}
