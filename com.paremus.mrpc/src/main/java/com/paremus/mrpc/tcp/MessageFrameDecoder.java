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

import static com.paremus.mrpc.wireformat.Protocol.FRAME_LENGTH_WIDTH_IN_BYTES;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

/**
 * Splits the inbound byte stream into frames, each containing one header and
 * its body. The emitted buffers do not include the length prefix.
 */
public class MessageFrameDecoder extends ByteToMessageDecoder {

	private final int maxFrameLength;
	
	public MessageFrameDecoder(int maxFrameLength) {
		this.maxFrameLength = maxFrameLength;
	}

	@Override
	protected void decode(ChannelHandlerContext ctx, ByteBuf buf, List<Object> out) throws Exception {
		while (buf.readableBytes() >= FRAME_LENGTH_WIDTH_IN_BYTES) {
			final int offset = buf.readerIndex();
			final int length = buf.getInt(offset);
			if(length < 0) {
				throw new CorruptedFrameException("Negative frame length (" + length + ")"); 
			} else if (length > maxFrameLength) {
				throw new TooLongFrameException("The frame length " + length + 
						" exceeds the maximum of " + maxFrameLength);
			}
			
			if(!buf.isReadable(length + FRAME_LENGTH_WIDTH_IN_BYTES)) {
				break;
			}
			
			out.add(buf.retainedSlice(offset + FRAME_LENGTH_WIDTH_IN_BYTES, length));
			buf.skipBytes(length + FRAME_LENGTH_WIDTH_IN_BYTES); 
		}
	}
}
