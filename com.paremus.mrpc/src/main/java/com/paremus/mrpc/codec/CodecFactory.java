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

public interface CodecFactory {

	/**
	 * Create a codec for a new connection
	 * 
	 * @param classSpace the class loader used to resolve classes named in message bodies
	 * @return the codec
	 */
	Codec create(ClassLoader classSpace);
}
