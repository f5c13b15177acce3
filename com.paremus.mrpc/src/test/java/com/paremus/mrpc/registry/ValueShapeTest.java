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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.paremus.mrpc.test.Quotient;

public class ValueShapeTest {

	@Test
	public void testContainersAreEmptyAndMutable() {
		List<?> list = ValueShape.of(List.class).newReply();
		assertTrue(list instanceof ArrayList);
		assertTrue(list.isEmpty());
		
		assertTrue(ValueShape.of(Collection.class).newReply() instanceof ArrayList);
		assertTrue(ValueShape.of(Set.class).newReply() instanceof LinkedHashSet);
		assertTrue(ValueShape.of(Map.class).newReply() instanceof LinkedHashMap);
		assertTrue(ValueShape.of(SortedMap.class).newReply() instanceof TreeMap);
		assertTrue(ValueShape.of(HashMap.class).newReply() instanceof HashMap);
	}

	@Test
	public void testEachReplyIsNew() {
		ValueShape<Map> shape = ValueShape.of(Map.class);
		assertNotSame(shape.newReply(), shape.newReply());
	}
	
	@Test
	public void testZeroValues() {
		assertEquals(Integer.valueOf(0), ValueShape.of(int.class).newReply());
		assertEquals(Integer.class, ValueShape.of(int.class).getType());
		assertEquals(Boolean.FALSE, ValueShape.of(boolean.class).newReply());
		assertEquals(Double.valueOf(0), ValueShape.of(Double.class).newReply());
		assertEquals("", ValueShape.of(String.class).newReply());
		assertArrayEquals(new String[0], ValueShape.of(String[].class).newReply());
	}

	@Test
	public void testPojo() {
		Quotient q = ValueShape.of(Quotient.class).newReply();
		assertEquals(0, q.quo);
	}

	@Test
	public void testUnallocatable() {
		assertNull(ValueShape.of(Object.class).newReply());
		assertNull(ValueShape.of(TimeUnit.class).newReply());
		assertNull(ValueShape.of(Runnable.class).newReply());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testVoid() {
		ValueShape.of(void.class);
	}
}
