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
package com.paremus.mrpc.codec;

import com.paremus.mrpc.codec.binary.BinaryCodecFactory;
import com.paremus.mrpc.codec.java.JavaSerializationCodecFactory;

/**
 * The codecs which are always available in the {@link CodecRegistry}
 */
public enum CodecType {
	
	BINARY(0, new BinaryCodecFactory()),
	JAVA_SERIALIZATION(1, new JavaSerializationCodecFactory());

	private final int tag;
	
	private final CodecFactory factory;

	private CodecType(int tag, CodecFactory factory) {
		this.tag = tag;
		this.factory = factory;
	}

	public int getTag() {
		return tag;
	}
	
	public CodecFactory getFactory() {
		return factory;
	}
}
