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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.InvalidObjectException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class ValuesTest {

	@Test
	public void testNumbers() throws Exception {
		assertEquals(Integer.valueOf(5), Values.convert(5L, int.class));
		assertEquals(Double.valueOf(2), Values.convert(2, Double.class));
		assertEquals(BigInteger.TEN, Values.convert(10, BigInteger.class));
		assertEquals(Integer.valueOf('a'), Values.convert('a', Integer.class));
	}

	@Test
	public void testNull() throws Exception {
		assertNull(Values.convert(null, int.class));
	}

	@Test
	public void testCollections() throws Exception {
		Set<?> set = Values.convert(Arrays.asList(1, 2, 2), Set.class);
		assertTrue(set instanceof LinkedHashSet);
		assertEquals(2, set.size());
		
		ArrayList<?> list = Values.convert(new Object[] {"a", "b"}, ArrayList.class);
		assertEquals(Arrays.asList("a", "b"), list);
		
		assertArrayEquals(new long[] {1, 2}, Values.convert(Arrays.asList(1, 2), long[].class));
		
		HashMap<?, ?> map = Values.convert(Collections.singletonMap("k", "v"), HashMap.class);
		assertEquals("v", map.get("k"));
	}

	@Test
	public void testEnum() throws Exception {
		assertEquals(TimeUnit.HOURS, Values.convert("HOURS", TimeUnit.class));
	}
	
	@Test(expected = InvalidObjectException.class)
	public void testNullInPrimitiveArray() throws Exception {
		Values.convert(Arrays.asList(1, null), int[].class);
	}

	@Test(expected = InvalidObjectException.class)
	public void testUnknownEnumConstant() throws Exception {
		Values.convert("FORTNIGHTS", TimeUnit.class);
	}
}
