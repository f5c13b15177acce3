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
package com.paremus.mrpc.server;

import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;

public class ListenerErrorHandlerTest {

	@Test
	public void testAcceptFailureReachesTheAcceptor() {
		AtomicReference<Throwable> seen = new AtomicReference<>();
		EmbeddedChannel channel = new EmbeddedChannel(new ListenerErrorHandler(), 
				new ChannelInboundHandlerAdapter() {
					@Override
					public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
						seen.set(cause);
					}
				});
		
		IOException failure = new IOException("Too many open files");
		channel.pipeline().fireExceptionCaught(failure);
		
		assertSame(failure, seen.get());
		assertTrue(channel.isOpen());
		channel.finishAndReleaseAll();
	}
}
