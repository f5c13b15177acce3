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
package com.paremus.mrpc.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetSocketAddress;

import org.junit.Test;

public class AddressesTest {

	@Test
	public void testIPv4() throws Exception {
		InetSocketAddress address = Addresses.resolve("tcp", "127.0.0.1:1234");
		assertEquals("127.0.0.1", address.getAddress().getHostAddress());
		assertEquals(1234, address.getPort());
	}

	@Test
	public void testIPv6() throws Exception {
		InetSocketAddress address = Addresses.resolve("tcp6", "[::1]:8080");
		assertTrue(address.getAddress() instanceof Inet6Address);
		assertTrue(address.getAddress().isLoopbackAddress());
		assertEquals(8080, address.getPort());
	}

	@Test
	public void testEmptyHostIsLoopback() throws Exception {
		InetSocketAddress address = Addresses.resolve("tcp", ":99");
		assertTrue(address.getAddress().isLoopbackAddress());
		assertEquals(99, address.getPort());
	}

	@Test
	public void testAddressFamily() throws Exception {
		assertTrue(Addresses.resolve("tcp4", "127.0.0.1:1").getAddress() instanceof Inet4Address);
	}
	
	@Test(expected = java.net.UnknownHostException.class)
	public void testWrongAddressFamily() throws Exception {
		Addresses.resolve("tcp6", "127.0.0.1:1");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownNetwork() throws Exception {
		Addresses.resolve("udp", "127.0.0.1:1");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingPort() throws Exception {
		Addresses.resolve("tcp", "localhost");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnbracketedIPv6() throws Exception {
		Addresses.resolve("tcp", "::1:80");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidPort() throws Exception {
		Addresses.resolve("tcp", "localhost:70000");
	}
}
