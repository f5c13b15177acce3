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
package com.paremus.mrpc.codec.binary;

import java.io.EOFException;
import java.io.IOException;
import java.io.StreamCorruptedException;

import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.codec.Values;

import io.netty.buffer.ByteBuf;

/**
 * The default codec. Headers are written as the sequence number followed by 
 * the procedure name and the error text, bodies as a single tagged value.
 */
public class BinaryCodec implements Codec {

	private final BinaryWireFormat wireFormat;
	
	public BinaryCodec(ClassLoader classSpace) {
		this.wireFormat = new BinaryWireFormat(classSpace, new PojoSerializer());
	}

	@Override
	public Header readHeader(ByteBuf buffer) throws IOException {
		try {
			long sequence = wireFormat.readNum(buffer);
			String procedureName = wireFormat.readString(buffer);
			String error = wireFormat.readString(buffer);
			return new Header(sequence, procedureName, error);
		} catch (IndexOutOfBoundsException ioobe) {
			throw truncated("header", ioobe);
		}
	}

	@Override
	public <T> T readBody(ByteBuf buffer, Class<T> type) throws IOException, ClassNotFoundException {
		if(type == null) {
			buffer.skipBytes(buffer.readableBytes());
			return null;
		}
		Object o;
		try {
			o = wireFormat.readObject(buffer);
		} catch (IndexOutOfBoundsException ioobe) {
			throw truncated("body", ioobe);
		}
		if(buffer.isReadable()) {
			throw new StreamCorruptedException("The body was followed by " + buffer.readableBytes() + 
					" unexpected bytes");
		}
		return Values.convert(o, type);
	}

	private EOFException truncated(String part, IndexOutOfBoundsException cause) {
		EOFException eof = new EOFException("The message " + part + " was truncated");
		eof.initCause(cause);
		return eof;
	}

	@Override
	public void write(ByteBuf buffer, Header header, Object body) throws IOException {
		wireFormat.writeNum(buffer, header.getSequence());
		wireFormat.writeString(buffer, header.getProcedureName());
		wireFormat.writeString(buffer, header.getError());
		wireFormat.writeObject(buffer, body);
	}
}
