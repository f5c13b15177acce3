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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.io.Serializable;
import java.io.StreamCorruptedException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

/**
 * A compact tagged binary encoding. Small non-negative integers are written as 
 * a single byte, everything else is preceded by a {@link SpecialTag}. Object 
 * graphs must be acyclic, shared references are written once per occurrence.
 */
public class BinaryWireFormat {

	static final int MAX_DEPTH = 256;
	
	private static final SpecialTag[] SPECIAL_TAGS = SpecialTag.values();

	private final ClassLoader classSpace;
	private final PojoSerializer serializer;

	public BinaryWireFormat(ClassLoader classSpace, PojoSerializer serializer) {
		this.classSpace = classSpace;
		this.serializer = serializer;
	}

	private static SpecialTag asSTag(byte b, String expected) throws StreamCorruptedException {
		if (b >= 0) throw new StreamCorruptedException("Expected " + expected + " but got a value of " + b);
		int b2 = ~b;
		if (b2 >= SPECIAL_TAGS.length) {
			throw new StreamCorruptedException("Expected " + expected + " but unknown SpecialTag " + b);
		}
		return SPECIAL_TAGS[b2];
	}

	private static void writeSTag(ByteBuf writeBuffer, SpecialTag stag) {
		writeBuffer.writeByte((byte)~stag.ordinal());
	}

	public void writeNum(ByteBuf writeBuffer, long value) {
		if (value >= 0 && value <= Byte.MAX_VALUE) {
			writeBuffer.writeByte((byte)value);
		} else if (value == (byte)value) {
			writeSTag(writeBuffer, SpecialTag.SIGNED1);
			writeBuffer.writeByte((byte)value);
		} else if (value == (short)value) {
			writeSTag(writeBuffer, SpecialTag.SIGNED2);
			writeBuffer.writeShort((short)value);
		} else if (value == (int)value) {
			writeSTag(writeBuffer, SpecialTag.SIGNED4);
			writeBuffer.writeInt((int)value);
		} else {
			writeSTag(writeBuffer, SpecialTag.SIGNED8);
			writeBuffer.writeLong(value);
		}
	}

	public long readNum(ByteBuf readBuffer) throws StreamCorruptedException {
		byte b = readBuffer.readByte();
		if (b >= 0) {
			return b;
		}
		SpecialTag tag = asSTag(b, "number");
		switch (tag) {
			case SIGNED1 :
				return readBuffer.readByte();
			case SIGNED2 :
				return readBuffer.readShort();
			case SIGNED4 :
				return readBuffer.readInt();
			case SIGNED8 :
				return readBuffer.readLong();
			case CHAR :
				return readBuffer.readChar();
			default :
				throw new StreamCorruptedException("Expected a number, got a " + tag);
		}
	}

	private int readLen(ByteBuf readBuffer) throws StreamCorruptedException {
		long len = readNum(readBuffer);
		if (len < 0 || len > readBuffer.readableBytes()) {
			// Every element occupies at least one byte
			throw new StreamCorruptedException("length invalid, len=" + len);
		}
		return (int)len;
	}

	public void writeString(ByteBuf writeBuffer, String text) {
		if(text == null) {
			writeSTag(writeBuffer, SpecialTag.NULL);
			return;
		}
		writeSTag(writeBuffer, SpecialTag.STRING);
		writeString0(writeBuffer, text);
	}

	private void writeString0(ByteBuf writeBuffer, String text) {
		writeNum(writeBuffer, ByteBufUtil.utf8Bytes(text));
		writeBuffer.writeCharSequence(text, UTF_8);
	}

	public String readString(ByteBuf readBuffer) throws StreamCorruptedException {
		byte b = readBuffer.readByte();
		SpecialTag tag = asSTag(b, "string");
		switch(tag) {
			case NULL:
				return null;
			case STRING:
				return readString0(readBuffer);
			default:
				throw new StreamCorruptedException("Expected a string, got a " + tag);
		}
	}

	private String readString0(ByteBuf readBuffer) throws StreamCorruptedException {
		int len = readLen(readBuffer);
		return readBuffer.readCharSequence(len, UTF_8).toString();
	}

	public void writeObject(ByteBuf writeBuffer, Object object) throws IOException {
		writeObject(writeBuffer, object, 0);
	}
	
	void writeObject(ByteBuf writeBuffer, Object object, int depth) throws IOException {
		if (object == null) {
			writeSTag(writeBuffer, SpecialTag.NULL);
			return;
		}
		if (depth > MAX_DEPTH) {
			throw new NotSerializableException("The object graph is nested more than " + MAX_DEPTH + 
					" levels deep, it may contain a cycle");
		}

		Class<?> clazz = object.getClass();
		
		if (clazz == Boolean.class) {
			writeSTag(writeBuffer, ((Boolean) object) ? SpecialTag.TRUE : SpecialTag.FALSE);
		} else if (clazz == Integer.class) {
			int value = (Integer) object;
			if (value >= 0 && value <= Byte.MAX_VALUE) {
				writeBuffer.writeByte(value);
			} else {
				writeSTag(writeBuffer, SpecialTag.SIGNED4);
				writeBuffer.writeInt(value);
			}
		} else if (clazz == Long.class) {
			writeSTag(writeBuffer, SpecialTag.SIGNED8);
			writeBuffer.writeLong((Long) object);
		} else if (clazz == Byte.class) {
			writeSTag(writeBuffer, SpecialTag.SIGNED1);
			writeBuffer.writeByte((Byte) object);
		} else if (clazz == Short.class) {
			writeSTag(writeBuffer, SpecialTag.SIGNED2);
			writeBuffer.writeShort((Short) object);
		} else if (clazz == Character.class) {
			writeSTag(writeBuffer, SpecialTag.CHAR);
			writeBuffer.writeChar((Character) object);
		} else if (clazz == Float.class) {
			writeSTag(writeBuffer, SpecialTag.FLOAT4);
			writeBuffer.writeFloat((Float) object);
		} else if (clazz == Double.class) {
			writeSTag(writeBuffer, SpecialTag.FLOAT8);
			writeBuffer.writeDouble((Double) object);
		} else if (object instanceof String) {
			writeSTag(writeBuffer, SpecialTag.STRING);
			writeString0(writeBuffer, (String) object);
		} else if (clazz == byte[].class) {
			byte[] bytes = (byte[]) object;
			writeSTag(writeBuffer, SpecialTag.BYTES);
			writeNum(writeBuffer, bytes.length);
			writeBuffer.writeBytes(bytes);
		} else if (clazz == int[].class) {
			int[] ints = (int[]) object;
			writeSTag(writeBuffer, SpecialTag.INTS);
			writeNum(writeBuffer, ints.length);
			for (int i : ints) {
				writeNum(writeBuffer, i);
			}
		} else if (clazz == long[].class) {
			long[] longs = (long[]) object;
			writeSTag(writeBuffer, SpecialTag.LONGS);
			writeNum(writeBuffer, longs.length);
			for (long l : longs) {
				writeNum(writeBuffer, l);
			}
		} else if (clazz == double[].class) {
			double[] doubles = (double[]) object;
			writeSTag(writeBuffer, SpecialTag.DOUBLES);
			writeNum(writeBuffer, doubles.length);
			for (double d : doubles) {
				writeBuffer.writeDouble(d);
			}
		} else if (clazz.isArray()) {
			writeArray(writeBuffer, object, depth);
		} else if (object instanceof Enum) {
			Enum<?> enumValue = (Enum<?>) object;
			writeSTag(writeBuffer, SpecialTag.ENUM);
			writeString0(writeBuffer, enumValue.getDeclaringClass().getName());
			writeString0(writeBuffer, enumValue.name());
		} else if (object instanceof Set) {
			writeCollection(writeBuffer, SpecialTag.SET, (Collection<?>) object, depth);
		} else if (object instanceof Collection) {
			writeCollection(writeBuffer, SpecialTag.LIST, (Collection<?>) object, depth);
		} else if (object instanceof Map) {
			writeMap(writeBuffer, (Map<?, ?>) object, depth);
		} else if (serializer.canSerialize(object)) {
			writeSTag(writeBuffer, SpecialTag.POJO);
			serializer.serialize(writeBuffer, this, object, depth + 1);
		} else if (object instanceof Serializable) {
			writeSTag(writeBuffer, SpecialTag.SERIALIZABLE);
			writeSerializable0(writeBuffer, object);
		} else {
			throw new NotSerializableException(clazz.getName());
		}
	}

	private void writeArray(ByteBuf writeBuffer, Object array, int depth) throws IOException {
		writeSTag(writeBuffer, SpecialTag.ARRAY);
		int len = Array.getLength(array);
		writeNum(writeBuffer, len);
		for (int i = 0; i < len; i++) {
			writeObject(writeBuffer, Array.get(array, i), depth + 1);
		}
	}

	private void writeCollection(ByteBuf writeBuffer, SpecialTag stag, Collection<?> collection, int depth)
			throws IOException {
		writeSTag(writeBuffer, stag);
		writeNum(writeBuffer, collection.size());
		for (Object o : collection) {
			writeObject(writeBuffer, o, depth + 1);
		}
	}

	private void writeMap(ByteBuf writeBuffer, Map<?, ?> map, int depth) throws IOException {
		writeSTag(writeBuffer, SpecialTag.MAP);
		writeNum(writeBuffer, map.size());
		for (Entry<?, ?> entry : map.entrySet()) {
			writeObject(writeBuffer, entry.getKey(), depth + 1);
			writeObject(writeBuffer, entry.getValue(), depth + 1);
		}
	}

	private void writeSerializable0(ByteBuf writeBuffer, Object object) throws IOException {
		ByteArrayOutputStream baos = new ByteArrayOutputStream(256);
		try (ObjectOutputStream oos = new ObjectOutputStream(baos)) {
			oos.writeObject(object);
		}
		byte[] bytes = baos.toByteArray();
		writeNum(writeBuffer, bytes.length);
		writeBuffer.writeBytes(bytes);
	}

	public Object readObject(ByteBuf readBuffer) throws ClassNotFoundException, IOException {
		return readObject(readBuffer, 0);
	}
	
	Object readObject(ByteBuf readBuffer, int depth) throws ClassNotFoundException, IOException {
		if (depth > MAX_DEPTH) {
			throw new StreamCorruptedException("The encoded value is nested more than " + MAX_DEPTH + " levels deep");
		}
		
		byte b = readBuffer.readByte();
		if (b >= 0) {
			return (int)b;
		}

		SpecialTag stag = asSTag(b, "object");
		switch (stag) {
			case NULL :
				return null;
			case TRUE :
				return Boolean.TRUE;
			case FALSE :
				return Boolean.FALSE;
			case SIGNED1 :
				return readBuffer.readByte();
			case SIGNED2 :
				return readBuffer.readShort();
			case SIGNED4 :
				return readBuffer.readInt();
			case SIGNED8 :
				return readBuffer.readLong();
			case CHAR :
				return readBuffer.readChar();
			case FLOAT4 :
				return readBuffer.readFloat();
			case FLOAT8 :
				return readBuffer.readDouble();
			case STRING :
				return readString0(readBuffer);
			case BYTES : {
				byte[] bytes = new byte[readLen(readBuffer)];
				readBuffer.readBytes(bytes);
				return bytes;
			}
			case INTS : {
				int[] ints = new int[readLen(readBuffer)];
				for (int i = 0; i < ints.length; i++) {
					ints[i] = (int) readNum(readBuffer);
				}
				return ints;
			}
			case LONGS : {
				long[] longs = new long[readLen(readBuffer)];
				for (int i = 0; i < longs.length; i++) {
					longs[i] = readNum(readBuffer);
				}
				return longs;
			}
			case DOUBLES : {
				double[] doubles = new double[readLen(readBuffer)];
				for (int i = 0; i < doubles.length; i++) {
					doubles[i] = readBuffer.readDouble();
				}
				return doubles;
			}
			case ARRAY : {
				Object[] objects = new Object[readLen(readBuffer)];
				for (int i = 0; i < objects.length; i++) {
					objects[i] = readObject(readBuffer, depth + 1);
				}
				return objects;
			}
			case LIST : {
				int len = readLen(readBuffer);
				List<Object> list = new ArrayList<>(len);
				for (int i = 0; i < len; i++) {
					list.add(readObject(readBuffer, depth + 1));
				}
				return list;
			}
			case SET : {
				int len = readLen(readBuffer);
				Set<Object> set = new LinkedHashSet<>();
				for (int i = 0; i < len; i++) {
					set.add(readObject(readBuffer, depth + 1));
				}
				return set;
			}
			case MAP : {
				int len = readLen(readBuffer);
				Map<Object, Object> map = new LinkedHashMap<>();
				for (int i = 0; i < len; i++) {
					Object key = readObject(readBuffer, depth + 1);
					map.put(key, readObject(readBuffer, depth + 1));
				}
				return map;
			}
			case ENUM :
				return readEnum(readBuffer);
			case POJO :
				return serializer.deserialize(readBuffer, this, depth + 1);
			case SERIALIZABLE :
				return readSerializable0(readBuffer);
			default :
				throw new StreamCorruptedException("Unknown tag " + stag);
		}
	}

	@SuppressWarnings({ "unchecked", "rawtypes" })
	private Enum<?> readEnum(ByteBuf readBuffer) throws ClassNotFoundException, IOException {
		Class<?> enumClass = loadClass(readString0(readBuffer));
		String name = readString0(readBuffer);
		if(!enumClass.isEnum()) {
			throw new StreamCorruptedException("The type " + enumClass.getName() + " is not an enum");
		}
		try {
			return Enum.valueOf((Class<? extends Enum>) enumClass, name);
		} catch (IllegalArgumentException iae) {
			throw new StreamCorruptedException("The enum " + enumClass.getName() + " has no constant " + name);
		}
	}

	private Object readSerializable0(ByteBuf readBuffer) throws IOException, ClassNotFoundException {
		int len = readLen(readBuffer);
		byte[] bytes = new byte[len];
		readBuffer.readBytes(bytes);
		try (ObjectInputStream ois = new ClassSpaceObjectInputStream(new ByteArrayInputStream(bytes))) {
			return ois.readObject();
		}
	}

	Class<?> loadClass(String name) throws ClassNotFoundException {
		return Class.forName(name, false, classSpace);
	}

	private class ClassSpaceObjectInputStream extends ObjectInputStream {

		ClassSpaceObjectInputStream(InputStream in) throws IOException {
			super(in);
		}

		@Override
		protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
			try {
				return loadClass(desc.getName());
			} catch (ClassNotFoundException cnfe) {
				return super.resolveClass(desc);
			}
		}
	}
}
