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

import static com.paremus.mrpc.wireformat.Protocol.INVALID_REQUEST;
import static com.paremus.mrpc.wireformat.Protocol.SERVER_OVERLOADED;

import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.message.RpcMessage;
import com.paremus.mrpc.registry.MethodBinding;
import com.paremus.mrpc.registry.MissingMethodException;
import com.paremus.mrpc.registry.MissingServiceException;
import com.paremus.mrpc.registry.ServiceRegistry;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Reads the requests arriving on one connection and dispatches them to the 
 * worker threads. Every request receives exactly one response.
 * 
 * <p>When the client shuts down its output the handler waits for all of the 
 * outstanding responses to be written, and then closes the connection.
 */
class ServerRequestHandler extends ChannelInboundHandlerAdapter {

	private static final Logger LOG = LoggerFactory.getLogger(ServerRequestHandler.class); 
	
	private final ServiceRegistry registry;
	
	private final Codec codec;
	
	private final EventExecutorGroup workers;
	
	/** Only accessed from the event loop */
	private int inFlight;
	
	/** Only accessed from the event loop */
	private boolean inputShutdown;

	public ServerRequestHandler(ServiceRegistry registry, Codec codec, EventExecutorGroup workers) {
		this.registry = registry;
		this.codec = codec;
		this.workers = workers;
	}
	
	@Override
	public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
		ByteBuf buf = ((ByteBuf) msg);
		try {
			Header header;
			try {
				header = codec.readHeader(buf);
			} catch (Exception e) {
				LOG.error("rpc server: read request header error from {}. The connection will be closed.", 
						ctx.channel().remoteAddress(), e);
				ctx.close();
				return;
			}
			
			inFlight++;
			
			MethodBinding<?, ?> binding;
			Object argument;
			try {
				binding = registry.find(header.getProcedureName());
				argument = codec.readBody(buf, binding.getArgumentShape().getType());
			} catch (MissingServiceException | MissingMethodException e) {
				LOG.debug("The request {} could not be resolved", header, e);
				writeResponse(ctx.channel(), new RpcMessage(header.withError(e.getMessage()), INVALID_REQUEST));
				return;
			} catch (Exception e) {
				LOG.debug("rpc server: read request body error for {}", header, e);
				writeResponse(ctx.channel(), new RpcMessage(header.withError(
						"rpc server: read request body error: " + toErrorText(e)), INVALID_REQUEST));
				return;
			}
			
			dispatch(ctx.channel(), header, binding, argument);
		} finally {
			buf.release();
		}
	}

	private void dispatch(Channel channel, Header header, MethodBinding<?, ?> binding, Object argument) {
		try {
			workers.execute(() -> writeResponse(channel, invoke(header, binding, argument)));
		} catch (RejectedExecutionException ree) {
			LOG.warn("rpc server: unable to dispatch {} from {} as the worker queue is full", 
					header.getProcedureName(), channel.remoteAddress());
			writeResponse(channel, new RpcMessage(header.withError(SERVER_OVERLOADED), INVALID_REQUEST));
		}
	}
	
	private RpcMessage invoke(Header header, MethodBinding<?, ?> binding, Object argument) {
		try {
			return new RpcMessage(header, invokeBinding(binding, argument));
		} catch (Exception e) {
			LOG.debug("The call {} failed", header, e);
			return new RpcMessage(header.withError(toErrorText(e)), INVALID_REQUEST);
		}
	}
	
	private static <A, R> R invokeBinding(MethodBinding<A, R> binding, Object argument) throws Exception {
		return binding.invoke(binding.getArgumentShape().getType().cast(argument));
	}
	
	static String toErrorText(Throwable t) {
		String message = t.getMessage();
		return message == null || message.isEmpty() ? t.getClass().getName() : message;
	}

	private void writeResponse(Channel channel, RpcMessage response) {
		channel.writeAndFlush(response).addListener(f -> {
				if(!f.isSuccess()) {
					Header header = response.getHeader();
					LOG.warn("rpc server: write response error for {}", header, f.cause());
					if(!header.isError() && channel.isActive()) {
						// The caller still needs a response, so report the failure instead
						writeResponse(channel, new RpcMessage(header.withError(
								"rpc server: write response error: " + toErrorText(f.cause())), INVALID_REQUEST));
						return;
					}
				}
				responseComplete(channel);
			});
	}
	
	private void responseComplete(Channel channel) {
		inFlight--;
		if(inputShutdown && inFlight == 0) {
			LOG.debug("All responses have been written to {} and the connection will be closed", 
					channel.remoteAddress());
			channel.close();
		}
	}

	@Override
	public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
		if(evt instanceof ChannelInputShutdownEvent) {
			LOG.debug("The client {} has finished sending requests, {} responses remain", 
					ctx.channel().remoteAddress(), inFlight);
			inputShutdown = true;
			if(inFlight == 0) {
				ctx.close();
			}
		}
		super.userEventTriggered(ctx, evt);
	}

	@Override
	public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
		LOG.error("rpc server: the connection from {} failed and will be closed", 
				ctx.channel().remoteAddress(), cause);
		ctx.close();
	}
}
