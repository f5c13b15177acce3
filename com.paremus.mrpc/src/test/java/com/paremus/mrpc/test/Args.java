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
package com.paremus.mrpc.test;

import java.io.Serializable;

public class Args implements Serializable {

	private static final long serialVersionUID = 1L;

	public int num1;
	
	public int num2;
	
	public Args() {}

	public Args(int num1, int num2) {
		this.num1 = num1;
		this.num2 = num2;
	}
}
