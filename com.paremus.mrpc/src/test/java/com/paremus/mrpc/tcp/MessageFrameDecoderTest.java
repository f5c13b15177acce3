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
package com.paremus.mrpc.tcp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

public class MessageFrameDecoderTest {

	EmbeddedChannel channel = new EmbeddedChannel(new MessageFrameDecoder(64));
	
	@Test
	public void testFramesSplitAcrossReads() {
		ByteBuf data = Unpooled.buffer();
		data.writeInt(3).writeBytes(new byte[] {1, 2, 3});
		data.writeInt(0);
		data.writeInt(2).writeBytes(new byte[] {4, 5});
		
		channel.writeInbound(data.readRetainedSlice(5));
		ByteBuf first = channel.readInbound();
		assertNull(first);
		
		channel.writeInbound(data.readRetainedSlice(9));
		first = channel.readInbound();
		assertEquals(3, first.readableBytes());
		assertEquals(1, first.getByte(0));
		first.release();
		
		ByteBuf empty = channel.readInbound();
		assertEquals(0, empty.readableBytes());
		empty.release();
		
		channel.writeInbound(data);
		ByteBuf last = channel.readInbound();
		assertEquals(2, last.readableBytes());
		assertEquals(5, last.getByte(1));
		last.release();
		
		assertFalse(channel.finish());
	}

	@Test
	public void testFrameTooLong() {
		try {
			channel.writeInbound(Unpooled.buffer().writeInt(65));
			fail("Should reject the frame");
		} catch (TooLongFrameException tlfe) {
			// Expected
		}
	}

	@Test
	public void testNegativeLength() {
		try {
			channel.writeInbound(Unpooled.buffer().writeInt(-1));
			fail("Should reject the frame");
		} catch (CorruptedFrameException cfe) {
			// Expected
		}
	}
}
