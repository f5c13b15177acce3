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
package com.paremus.mrpc.client;

import static com.paremus.mrpc.RpcException.CODEC;
import static com.paremus.mrpc.RpcException.REMOTE;
import static com.paremus.mrpc.RpcException.SHUTDOWN;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;
import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.Header;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

/**
 * Matches response frames to the pending calls of an {@link RpcClient}. When 
 * the connection is lost every pending call fails.
 */
public class ClientResponseHandler extends ChannelInboundHandlerAdapter {

	private static final Logger LOG = LoggerFactory.getLogger(ClientResponseHandler.class);
	
	private final RpcClient client;
	
	private final Codec codec;
	
	public ClientResponseHandler(RpcClient client, Codec codec) {
		this.client = client;
		this.codec = codec;
	}

	@Override
	public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
		ByteBuf buf = (ByteBuf) msg;
		
		try {
			Header header;
			try {
				header = codec.readHeader(buf);
			} catch (Exception e) {
				LOG.error("Unable to read a response header from {}. The connection will be closed.", 
						ctx.channel().remoteAddress(), e);
				ctx.close();
				return;
			}
			
			Call<?> call = client.removeCall(header.getSequence());
			
			if(call == null) {
				LOG.debug("The response {} does not match a pending call and will be discarded", header);
				codec.readBody(buf, null);
			} else if (header.isError()) {
				codec.readBody(buf, null);
				LOG.debug("The call {} failed remotely with {}", call, header.getError());
				call.fail(new RpcException(header.getError(), REMOTE));
			} else {
				completeCall(call, buf);
			}
		} finally {
			buf.release();
		}
	}

	private <R> void completeCall(Call<R> call, ByteBuf buf) {
		R reply;
		try {
			reply = codec.readBody(buf, call.getReplyType());
		} catch (Exception e) {
			LOG.debug("Unable to read the reply for the call {}", call, e);
			call.fail(new RpcException("reading body error: " + e.getMessage(), CODEC, e));
			return;
		}
		call.complete(reply);
	}

	@Override
	public void channelInactive(ChannelHandlerContext ctx) throws Exception {
		LOG.debug("The connection to {} is closed", ctx.channel().remoteAddress());
		client.terminateCalls(new RpcException(RpcClient.ERR_SHUTDOWN, SHUTDOWN));
		super.channelInactive(ctx);
	}

	@Override
	public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
		LOG.error("The connection to {} failed and will be closed", ctx.channel().remoteAddress(), cause);
		ctx.close();
	}
}
