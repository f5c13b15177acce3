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
package com.paremus.mrpc.config;

import org.osgi.service.metatype.annotations.ObjectClassDefinition;

/**
 * The configuration of a {@link com.paremus.mrpc.transport.Transport}. Property
 * keys use "." where the method names use "_", for example "worker.threads".
 */
@ObjectClassDefinition(pid="com.paremus.mrpc.transport")
public @interface TransportConfig {

	int io_threads() default 4;
	
	int worker_threads() default 8;
	
	/** The number of dispatch tasks queued per worker thread, negative for no limit */
	int task_queue_depth() default 1024;
	
	int connect_timeout() default 3000;
	
	boolean nodelay() default true;
	
	int max_frame_length() default 16 * 1024 * 1024;
	
	/** The deadline in milliseconds applied to calls made without one, 0 for none */
	long client_default_timeout() default 0;
	
	int default_codec() default 0;
	
	String bind_address() default "0.0.0.0";
}
