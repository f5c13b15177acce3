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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.EOFException;
import java.io.InvalidClassException;
import java.io.InvalidObjectException;
import java.io.NotSerializableException;
import java.io.StreamCorruptedException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.test.Args;
import com.paremus.mrpc.test.Quotient;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

public class BinaryCodecTest {

	BinaryCodec codec = new BinaryCodec(getClass().getClassLoader());
	
	ByteBuf buffer;
	
	@Before
	public void setUp() {
		buffer = Unpooled.buffer();
	}
	
	@After
	public void tearDown() {
		buffer.release();
	}
	
	public static class Node {
		public String name;
		public Node next;
	}
	
	public static class Base {
		protected long id;
		transient String ignored = "ignored";
	}
	
	public static class Derived extends Base {
		private Set<String> tags;
		private TimeUnit unit;
		private double[] weights;
	}
	
	public static class NoDefaultConstructor {
		public final int value;
		
		public NoDefaultConstructor(int value) {
			this.value = value;
		}
	}
	
	@Test
	public void testHeader() throws Exception {
		codec.write(buffer, new Header(42, "Arith.add", "oops"), null);
		
		Header header = codec.readHeader(buffer);
		assertEquals(42, header.getSequence());
		assertEquals("Arith.add", header.getProcedureName());
		assertEquals("oops", header.getError());
		assertTrue(header.isError());
		assertNull(codec.readBody(buffer, Object.class));
		assertFalse(buffer.isReadable());
	}

	@Test
	public void testHeaderUnsignedSequence() throws Exception {
		codec.write(buffer, new Header(-1L, "A.b"), "x");
		
		Header header = codec.readHeader(buffer);
		assertEquals("18446744073709551615", Long.toUnsignedString(header.getSequence()));
		assertFalse(header.isError());
	}

	@Test
	public void testSmallNumbersUseOneByte() throws Exception {
		codec.write(buffer, new Header(1, ""), 3);
		// 1 byte sequence, 2 byte name, 2 byte error, 1 byte body
		assertEquals(6, buffer.readableBytes());
	}
	
	@Test
	public void testNumbersAreConvertedToTheRequestedType() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), 7);
		codec.readHeader(buffer);
		assertEquals(Long.valueOf(7), codec.readBody(buffer, long.class));
		
		buffer.clear();
		codec.write(buffer, new Header(1, "A.b"), 300L);
		codec.readHeader(buffer);
		assertEquals(Short.valueOf((short) 300), codec.readBody(buffer, Short.class));

		buffer.clear();
		codec.write(buffer, new Header(1, "A.b"), 65);
		codec.readHeader(buffer);
		assertEquals(Character.valueOf('A'), codec.readBody(buffer, char.class));
	}
	
	@Test
	public void testPojo() throws Exception {
		codec.write(buffer, new Header(1, "Arith.add"), new Args(1, 2));
		codec.readHeader(buffer);
		Args args = codec.readBody(buffer, Args.class);
		assertEquals(1, args.num1);
		assertEquals(2, args.num2);
	}

	@Test
	public void testPojoWithSuperclassAndContainers() throws Exception {
		Derived d = new Derived();
		d.id = 99;
		d.ignored = "changed";
		d.tags = new java.util.TreeSet<>(Arrays.asList("a", "b"));
		d.unit = TimeUnit.SECONDS;
		d.weights = new double[] {0.5, 1.5};
		
		codec.write(buffer, new Header(1, "A.b"), d);
		codec.readHeader(buffer);
		Derived read = codec.readBody(buffer, Derived.class);
		
		assertEquals(99, read.id);
		assertEquals("ignored", read.ignored);
		assertEquals(d.tags, read.tags);
		assertEquals(TimeUnit.SECONDS, read.unit);
		assertArrayEquals(d.weights, read.weights, 0.0d);
	}

	@Test
	public void testListConvertedToArray() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), Arrays.asList(1, 2, 300));
		codec.readHeader(buffer);
		assertArrayEquals(new int[] {1, 2, 300}, codec.readBody(buffer, int[].class));
	}

	@Test
	public void testMapOfPojos() throws Exception {
		Map<String, Quotient> map = new LinkedHashMap<>();
		Quotient q = new Quotient();
		q.quo = 3;
		q.rem = 1;
		map.put("first", q);
		map.put("second", null);
		
		codec.write(buffer, new Header(1, "A.b"), map);
		codec.readHeader(buffer);
		Map<?, ?> read = codec.readBody(buffer, Map.class);
		
		assertEquals(Arrays.asList("first", "second"), new ArrayList<>(read.keySet()));
		assertEquals(3, ((Quotient) read.get("first")).quo);
		assertNull(read.get("second"));
	}
	
	@Test
	public void testSerializableFallback() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new BigDecimal("1.25"));
		codec.readHeader(buffer);
		assertEquals(new BigDecimal("1.25"), codec.readBody(buffer, BigDecimal.class));
	}
	
	@Test
	public void testStrings() throws Exception {
		List<String> values = Arrays.asList("", "plain", "é中😀");
		codec.write(buffer, new Header(1, "A.b"), values);
		codec.readHeader(buffer);
		assertEquals(values, codec.readBody(buffer, List.class));
	}

	@Test
	public void testDiscardBody() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new Args(1, 2));
		codec.readHeader(buffer);
		assertNull(codec.readBody(buffer, null));
		assertFalse(buffer.isReadable());
	}
	
	@Test(expected = NotSerializableException.class)
	public void testUnsupportedType() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new Object());
	}

	@Test(expected = NotSerializableException.class)
	public void testCyclicGraph() throws Exception {
		Node a = new Node();
		Node b = new Node();
		a.next = b;
		b.next = a;
		codec.write(buffer, new Header(1, "A.b"), a);
	}

	@Test(expected = InvalidClassException.class)
	public void testNoDefaultConstructor() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), new NoDefaultConstructor(4));
		codec.readHeader(buffer);
		codec.readBody(buffer, NoDefaultConstructor.class);
	}

	@Test(expected = InvalidObjectException.class)
	public void testIncompatibleType() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), "text");
		codec.readHeader(buffer);
		codec.readBody(buffer, Integer.class);
	}
	
	@Test
	public void testUnknownClass() throws Exception {
		BinaryWireFormat wf = new BinaryWireFormat(getClass().getClassLoader(), new PojoSerializer());
		wf.writeNum(buffer, 1);
		wf.writeString(buffer, "A.b");
		wf.writeString(buffer, "");
		buffer.writeByte(~SpecialTag.POJO.ordinal());
		wf.writeString(buffer, "com.example.DoesNotExist");
		wf.writeNum(buffer, 0);
		
		codec.readHeader(buffer);
		try {
			codec.readBody(buffer, Object.class);
			fail("Should not be able to load the class");
		} catch (ClassNotFoundException cnfe) {
			assertTrue(cnfe.getMessage().contains("DoesNotExist"));
		}
	}
	
	@Test(expected = EOFException.class)
	public void testTruncatedHeader() throws Exception {
		codec.write(buffer, new Header(1000, "Arith.add"), null);
		// Cut off after the tag of the procedure name
		buffer.writerIndex(4);
		codec.readHeader(buffer);
	}

	@Test(expected = StreamCorruptedException.class)
	public void testUnknownTag() throws Exception {
		buffer.writeByte(-100);
		codec.readHeader(buffer);
	}

	@Test(expected = StreamCorruptedException.class)
	public void testTrailingBytes() throws Exception {
		codec.write(buffer, new Header(1, "A.b"), 1);
		buffer.writeByte(1);
		codec.readHeader(buffer);
		codec.readBody(buffer, Integer.class);
	}
}
