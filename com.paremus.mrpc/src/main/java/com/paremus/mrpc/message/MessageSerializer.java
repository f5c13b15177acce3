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
package com.paremus.mrpc.message;

import static com.paremus.mrpc.RpcException.CODEC;
import static com.paremus.mrpc.wireformat.Protocol.FRAME_LENGTH_WIDTH_IN_BYTES;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;
import com.paremus.mrpc.codec.Codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;

/**
 * Encodes {@link RpcMessage}s into length prefixed frames. The header and body
 * are always written together, so messages from different callers never 
 * interleave on the connection.
 * 
 * <p>A message which cannot be encoded fails its write and closes the 
 * connection, as the peer may already be waiting on a partial exchange.
 * A message whose frame would exceed the maximum frame length fails its 
 * write but leaves the connection open, as nothing has been sent.
 */
public class MessageSerializer extends ChannelOutboundHandlerAdapter {

	private static final Logger LOG = LoggerFactory.getLogger(MessageSerializer.class);
	
	private final Codec codec;
	
	private final int maxFrameLength;
	
	public MessageSerializer(Codec codec, int maxFrameLength) {
		this.codec = codec;
		this.maxFrameLength = maxFrameLength;
	}

	@Override
	public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) throws Exception {
		if(!(msg instanceof RpcMessage)) {
			ctx.write(msg, promise);
			return;
		}
		
		RpcMessage message = (RpcMessage) msg;
		ByteBuf buffer = ctx.alloc().ioBuffer();
		try {
			int start = buffer.writerIndex();
			buffer.writerIndex(start + FRAME_LENGTH_WIDTH_IN_BYTES);
			codec.write(buffer, message.getHeader(), message.getBody());
			int length = buffer.writerIndex() - start - FRAME_LENGTH_WIDTH_IN_BYTES;
			if(length > maxFrameLength) {
				buffer.release();
				LOG.warn("The message {} to {} is {} bytes long, which exceeds the maximum frame length", 
						message.getHeader(), ctx.channel().remoteAddress(), length);
				promise.tryFailure(new RpcException("rpc: the message is " + length + 
						" bytes long, larger than the limit of " + maxFrameLength + " bytes", CODEC));
				return;
			}
			buffer.setInt(start, length);
		} catch (Exception e) {
			buffer.release();
			LOG.error("Unable to encode the message {}. The connection to {} will be closed.", 
					message.getHeader(), ctx.channel().remoteAddress(), e);
			promise.tryFailure(new RpcException("rpc: unable to encode the message: " + e.getMessage(), CODEC, e));
			ctx.close();
			return;
		}
		ctx.write(buffer, promise);
	}
}
