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

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the network and address strings accepted when dialling a server
 */
public final class Addresses {
	
	private static final Logger LOG = LoggerFactory.getLogger(Addresses.class);
	
	private static final Pattern COLON = Pattern.compile(":");
	
	private Addresses() {}

	/**
	 * Resolve an address
	 * 
	 * @param network one of "tcp", "tcp4" or "tcp6"
	 * @param value the address in the form host:port, or [ipv6 literal]:port
	 * @return the resolved socket address
	 * @throws IllegalArgumentException if the network or the address syntax is invalid
	 * @throws UnknownHostException if the host has no address in the network
	 */
	public static InetSocketAddress resolve(String network, String value) throws UnknownHostException {
		Class<? extends InetAddress> family = toAddressFamily(network);
		
		int portDelimiter = value.lastIndexOf(':');
		
		Matcher colonCounter = COLON.matcher(value);
		
		boolean hasMultipleColons = colonCounter.find() && colonCounter.find();
		
		String host;
		if(value.startsWith("[") ) {
			// IPv6
			int endOfAddress = value.lastIndexOf(']');
			if(endOfAddress < 0 || portDelimiter != endOfAddress + 1) {
				throw new IllegalArgumentException("The address " + value + " must have the form [host]:port");
			}
			host = value.substring(1, endOfAddress);
		} else if(hasMultipleColons) {
			LOG.warn("The address {} uses IPV6 notation but is not surrounded by \"[]\". No port information can be detected using this syntax.", value);
			throw new IllegalArgumentException("The address " + value + " must have the form [host]:port");
		} else if (portDelimiter < 0) {
			throw new IllegalArgumentException("The address " + value + " is missing a port");
		} else {
			host = value.substring(0, portDelimiter);
		}
		
		int port;
		try {
			port = Integer.parseInt(value.substring(portDelimiter + 1));
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("The address " + value + " does not declare a numeric port");
		}
		if(port < 0 || port > 65535)  {
			throw new IllegalArgumentException("The " + port + " is not a valid port number");
		}
		
		if(host.isEmpty()) {
			return new InetSocketAddress(InetAddress.getLoopbackAddress(), port);
		}
		
		for(InetAddress address : InetAddress.getAllByName(host)) {
			if(family.isInstance(address)) {
				return new InetSocketAddress(address, port);
			}
		}
		throw new UnknownHostException("The host " + host + " has no address usable by the network " + network);
	}

	private static Class<? extends InetAddress> toAddressFamily(String network) {
		switch(network) {
			case "tcp" :
				return InetAddress.class;
			case "tcp4" :
				return Inet4Address.class;
			case "tcp6" :
				return Inet6Address.class;
			default :
				throw new IllegalArgumentException("The network " + network + " is not supported");
		}
	}
}
