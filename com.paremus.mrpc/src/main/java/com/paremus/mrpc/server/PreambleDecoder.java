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

import static com.paremus.mrpc.wireformat.Protocol.MAGIC;
import static com.paremus.mrpc.wireformat.Protocol.PREAMBLE_LENGTH;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.CodecFactory;
import com.paremus.mrpc.codec.CodecRegistry;
import com.paremus.mrpc.message.MessageSerializer;
import com.paremus.mrpc.registry.ServiceRegistry;
import com.paremus.mrpc.tcp.MessageFrameDecoder;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Reads the connection preamble and replaces itself with the request 
 * handling pipeline for the negotiated codec. Connections from unknown 
 * clients, or using unknown codecs, are closed without a response.
 */
class PreambleDecoder extends ByteToMessageDecoder {
	
	private static final Logger LOG = LoggerFactory.getLogger(PreambleDecoder.class);

	private final ServiceRegistry registry;
	
	private final EventExecutorGroup workers;
	
	private final int maxFrameLength;
	
	private final ClassLoader classSpace;
	
	private boolean rejected;
	
	public PreambleDecoder(ServiceRegistry registry, EventExecutorGroup workers, int maxFrameLength,
			ClassLoader classSpace) {
		this.registry = registry;
		this.workers = workers;
		this.maxFrameLength = maxFrameLength;
		this.classSpace = classSpace;
	}

	@Override
	protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
		if(in.readableBytes() < PREAMBLE_LENGTH) {
			return;
		}
		
		int magic = in.readInt();
		if(magic != MAGIC) {
			LOG.warn("rpc server: invalid magic number: {} from {}", Integer.toHexString(magic), 
					ctx.channel().remoteAddress());
			reject(ctx, in);
			return;
		}
		
		int codecType = in.readInt();
		CodecFactory factory = CodecRegistry.lookup(codecType);
		if(factory == null) {
			LOG.warn("rpc server: invalid codec type: {} from {}", Integer.toUnsignedString(codecType), 
					ctx.channel().remoteAddress());
			reject(ctx, in);
			return;
		}
		
		Codec codec = factory.create(classSpace);
		
		ChannelPipeline pipeline = ctx.pipeline();
		pipeline.addAfter(ctx.name(), "messageSerializer", new MessageSerializer(codec, maxFrameLength));
		pipeline.addAfter(ctx.name(), "requestHandler", new ServerRequestHandler(registry, codec, workers));
		pipeline.addAfter(ctx.name(), "frameDecoder", new MessageFrameDecoder(maxFrameLength));
		
		// Any bytes following the preamble are passed to the frame decoder
		pipeline.remove(this);
	}

	private void reject(ChannelHandlerContext ctx, ByteBuf in) {
		rejected = true;
		in.skipBytes(in.readableBytes());
		ctx.close();
	}

	@Override
	protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
		if(rejected) {
			in.skipBytes(in.readableBytes());
		} else if(in.readableBytes() < PREAMBLE_LENGTH) {
			LOG.warn("rpc server: read conn error: the connection from {} ended after {} bytes of the preamble", 
					ctx.channel().remoteAddress(), in.readableBytes());
			in.skipBytes(in.readableBytes());
			ctx.close();
		} else {
			super.decodeLast(ctx, in, out);
		}
	}
}
