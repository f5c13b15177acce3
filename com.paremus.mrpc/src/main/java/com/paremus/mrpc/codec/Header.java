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

import static com.paremus.mrpc.wireformat.Protocol.NO_ERROR;

/**
 * The envelope sent immediately before every message body.
 */
public final class Header {

	private final long sequence;
	
	private final String procedureName;
	
	private final String error;

	public Header(long sequence, String procedureName) {
		this(sequence, procedureName, NO_ERROR);
	}
	
	public Header(long sequence, String procedureName, String error) {
		this.sequence = sequence;
		this.procedureName = procedureName == null ? "" : procedureName;
		this.error = error == null ? NO_ERROR : error;
	}

	/**
	 * @return the sequence number, an unsigned value
	 */
	public long getSequence() {
		return sequence;
	}

	public String getProcedureName() {
		return procedureName;
	}

	public String getError() {
		return error;
	}
	
	public boolean isError() {
		return !error.isEmpty();
	}

	public Header withError(String error) {
		return new Header(sequence, procedureName, error);
	}

	@Override
	public String toString() {
		return "Header [sequence=" + Long.toUnsignedString(sequence) + ", procedureName=" + procedureName 
				+ ", error=" + error + "]";
	}
}
