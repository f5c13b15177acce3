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
package com.paremus.mrpc.codec.binary;

import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.CodecFactory;

public class BinaryCodecFactory implements CodecFactory {

	@Override
	public Codec create(ClassLoader classSpace) {
		return new BinaryCodec(classSpace);
	}

	@Override
	public String toString() {
		return "BinaryCodecFactory";
	}
}
