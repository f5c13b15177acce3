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
package com.paremus.mrpc.wireformat;

public class Protocol {

	/** 
	 * The connection preamble is sent once by the client, immediately after
	 * connecting, and read once by the server:
	 * 
	 * |  bytes 0-3  |  bytes 4-7  |
	 * |    MAGIC    | codec type  |
	 * 
	 * Both values are big-endian. The codec type is an unsigned 32 bit tag
	 * looked up in the {@link com.paremus.mrpc.codec.CodecRegistry}.
	 */
	public static final int MAGIC = 0x5a2b71c3;

	public static final int PREAMBLE_LENGTH = 8;

	/**
	 * After the preamble both directions carry a sequence of frames:
	 * 
	 * |   int    |    ...     |   ...   |
	 * |  length  |   header   |  body   |
	 * 
	 * The header and body are encoded by the negotiated codec, one after the
	 * other. The header holds the sequence number, the procedure name 
	 * (Service.Method) and the error text, which is empty for requests and 
	 * for successful responses.
	 */
	public static final int FRAME_LENGTH_WIDTH_IN_BYTES = 4;

	public static final String NO_ERROR = "";

	/**
	 * The body written alongside an error response
	 */
	public static final Object INVALID_REQUEST = null;

	/**
	 * The error text sent when the server cannot queue a request
	 */
	public static final String SERVER_OVERLOADED = "rpc server: the server is overloaded";
}
