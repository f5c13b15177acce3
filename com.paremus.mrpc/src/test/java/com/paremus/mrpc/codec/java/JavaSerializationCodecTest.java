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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

import java.io.EOFException;
import java.io.NotSerializableException;
import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.test.Args;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

public class JavaSerializationCodecTest {

	JavaSerializationCodec codec = new JavaSerializationCodec(getClass().getClassLoader());
	
	ByteBuf buffer;
	
	@Before
	public void setUp() {
		buffer = Unpooled.buffer();
	}
	
	@After
	public void tearDown() {
		buffer.release();
	}
	
	@Test
	public void testHeaderAndBody() throws Exception {
		codec.write(buffer, new Header(7, "Arith.add", ""), new Args(3, 4));
		
		Header header = codec.readHeader(buffer);
		assertEquals(7, header.getSequence());
		assertEquals("Arith.add", header.getProcedureName());
		assertFalse(header.isError());
		
		Args args = codec.readBody(buffer, Args.class);
		assertEquals(3, args.num1);
		assertEquals(4, args.num2);
		assertFalse(buffer.isReadable());
	}

	@Test
	public void testPrimitiveReplyType() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), 12);
		codec.readHeader(buffer);
		assertEquals(Long.valueOf(12), codec.readBody(buffer, long.class));
	}
	
	@Test
	public void testArrayConvertedToList() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new String[] {"a", "b"});
		codec.readHeader(buffer);
		assertEquals(Arrays.asList("a", "b"), codec.readBody(buffer, List.class));
	}
	
	@Test
	public void testDiscardBody() throws Exception {
		codec.write(buffer, new Header(1, "A.b", "failed"), null);
		assertEquals("failed", codec.readHeader(buffer).getError());
		assertNull(codec.readBody(buffer, null));
		assertFalse(buffer.isReadable());
	}

	@Test(expected = NotSerializableException.class)
	public void testNotSerializable() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new Object());
	}
	
	@Test(expected = EOFException.class)
	public void testTruncatedHeader() throws Exception {
		buffer.writeLong(1);
		codec.readHeader(buffer);
	}
}
