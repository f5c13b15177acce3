/*
 Copyright 2008-2011 the original author or authors

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an &quot;AS IS&quot; BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 */

package com.paremus.mrpc.codec.binary;

/**
 * The marker written before every non-trivial value. A tag is written as the
 * bitwise complement of its ordinal, so it is always a negative byte. The 
 * order of these constants is part of the wire format.
 */
enum SpecialTag {
	NULL, TRUE, FALSE, SIGNED1, BYTES, SIGNED2, SIGNED4, SIGNED8, CHAR, FLOAT4, FLOAT8, ARRAY,
	STRING, LIST, SET, MAP, ENUM, SERIALIZABLE, POJO, INTS, LONGS, DOUBLES
}
