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
package com.paremus.mrpc.codec.java;

import java.io.EOFException;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;

import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.codec.Values;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.ByteBufOutputStream;

/**
 * A codec using Java Serialization for message bodies. Every argument and
 * reply type must therefore be {@link java.io.Serializable}.
 */
public class JavaSerializationCodec implements Codec {

	private final ClassLoader classSpace;
	
	public JavaSerializationCodec(ClassLoader classSpace) {
		this.classSpace = classSpace;
	}

	@Override
	public Header readHeader(ByteBuf buffer) throws IOException {
		try (ByteBufInputStream in = new ByteBufInputStream(buffer)) {
			long sequence = in.readLong();
			String procedureName = in.readUTF();
			String error = in.readUTF();
			return new Header(sequence, procedureName, error);
		}
	}

	@Override
	public <T> T readBody(ByteBuf buffer, Class<T> type) throws IOException, ClassNotFoundException {
		if(type == null) {
			buffer.skipBytes(buffer.readableBytes());
			return null;
		}
		if(!buffer.isReadable()) {
			throw new EOFException("The message body is missing");
		}
		try (ObjectInputStream ois = new ObjectInputStream(new ByteBufInputStream(buffer)) {
			@Override
			protected Class<?> resolveClass(ObjectStreamClass desc)
					throws IOException, ClassNotFoundException {
				try {
					return Class.forName(desc.getName(), false, classSpace);
				} catch (ClassNotFoundException cnfe) {
					// Primitive types are only known to the default resolution
					return super.resolveClass(desc);
				}
			}
		}) {
			return Values.convert(ois.readObject(), type);
		}
	}

	@Override
	public void write(ByteBuf buffer, Header header, Object body) throws IOException {
		ByteBufOutputStream bbos = new ByteBufOutputStream(buffer);
		bbos.writeLong(header.getSequence());
		bbos.writeUTF(header.getProcedureName());
		bbos.writeUTF(header.getError());
		try (ObjectOutputStream oos = new ObjectOutputStream(bbos)) {
			oos.writeObject(body);
		}
	}
}
