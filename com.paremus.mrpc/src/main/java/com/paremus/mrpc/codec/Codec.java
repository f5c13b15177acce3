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

import java.io.IOException;

import io.netty.buffer.ByteBuf;

/**
 * Encodes and decodes (header, body) message pairs. A codec instance belongs to
 * a single connection, and is only ever called from that connection's event loop.
 * 
 * <p>Buffers passed to the read methods contain exactly one framed message, so
 * the body always runs to the end of the readable bytes.
 */
public interface Codec {

	Header readHeader(ByteBuf buffer) throws IOException;

	/**
	 * Decode the next body from the buffer.
	 * 
	 * @param buffer the buffer positioned at the start of the body
	 * @param type the type to decode into, or <code>null</code> to consume 
	 *  and discard the body
	 * @return the decoded body, or <code>null</code> if the type was <code>null</code>
	 * @throws IOException if the body is malformed or cannot be converted to the type
	 * @throws ClassNotFoundException if the body refers to an unknown class
	 */
	<T> T readBody(ByteBuf buffer, Class<T> type) throws IOException, ClassNotFoundException;

	/**
	 * Write the header and then the body into the buffer
	 */
	void write(ByteBuf buffer, Header header, Object body) throws IOException;
	
}
