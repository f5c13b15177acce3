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
package com.paremus.mrpc.registry;

/**
 * Discovers the callable methods of a service object
 */
public interface ServiceBinder {

	/**
	 * @param service the service object
	 * @return the definition of the service
	 * @throws IllegalArgumentException if the object cannot be exposed as a service
	 */
	ServiceDefinition bind(Object service);
}
