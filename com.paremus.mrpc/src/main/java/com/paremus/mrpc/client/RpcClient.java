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
package com.paremus.mrpc.client;

import static com.paremus.mrpc.RpcException.CODEC;
import static com.paremus.mrpc.RpcException.CONNECTION;
import static com.paremus.mrpc.RpcException.INVALID_CODEC;
import static com.paremus.mrpc.RpcException.SHUTDOWN;
import static com.paremus.mrpc.RpcException.TIMEOUT;
import static com.paremus.mrpc.wireformat.Protocol.MAGIC;
import static com.paremus.mrpc.wireformat.Protocol.PREAMBLE_LENGTH;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;
import com.paremus.mrpc.codec.Codec;
import com.paremus.mrpc.codec.CodecFactory;
import com.paremus.mrpc.codec.CodecRegistry;
import com.paremus.mrpc.codec.Header;
import com.paremus.mrpc.config.Addresses;
import com.paremus.mrpc.config.TransportConfig;
import com.paremus.mrpc.message.MessageSerializer;
import com.paremus.mrpc.message.RpcMessage;
import com.paremus.mrpc.tcp.MessageFrameDecoder;
import com.paremus.mrpc.transport.Transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.Timer;

/**
 * A client which multiplexes any number of concurrent calls over a single
 * connection. Responses are matched to calls using sequence numbers, and may
 * arrive in any order.
 * 
 * <p>If the connection is lost then every pending call fails, and the client 
 * can make no further calls. Clients do not reconnect.
 */
public class RpcClient implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(RpcClient.class);
	
	public static final String ERR_SHUTDOWN = "connection shut down";
	
	private final Channel channel;
	
	private final Timer timer;
	
	private final long defaultTimeout;

	/**
	 * Orders the writes to the connection. Always acquired before the stateLock.
	 */
	private final ReentrantLock sendLock = new ReentrantLock();

	/**
	 * Guards the sequence, the pending calls and the closing/shutdown flags
	 */
	private final ReentrantLock stateLock = new ReentrantLock();
	
	private final Map<Long, Call<?>> pending = new HashMap<>();
	
	private long nextSequence = 1;
	
	/** The user has called close */
	private boolean closing;
	
	/** The connection has been lost */
	private boolean shutdown;

	private RpcClient(Channel channel, Transport transport) {
		this.channel = channel;
		this.timer = transport.getTimer();
		this.defaultTimeout = transport.getConfig().client_default_timeout();
	}

	/**
	 * Connect to a server using the default transport and codec
	 * 
	 * @param network "tcp", "tcp4" or "tcp6"
	 * @param address the server address as host:port
	 * @return a connected client
	 * @throws RpcException if the connection cannot be established
	 */
	public static RpcClient dial(String network, String address) {
		Transport transport = Transport.getDefault();
		return dial(transport, network, address, transport.getConfig().default_codec());
	}

	public static RpcClient dial(String network, String address, int codecType) {
		return dial(Transport.getDefault(), network, address, codecType);
	}

	public static RpcClient dial(Transport transport, String network, String address, int codecType) {
		InetSocketAddress remoteAddress;
		try {
			remoteAddress = Addresses.resolve(network, address);
		} catch (UnknownHostException uhe) {
			LOG.error("rpc client: dial error: unable to resolve {}", address, uhe);
			throw new RpcException("rpc client: dial error: " + uhe.getMessage(), CONNECTION, uhe);
		} catch (IllegalArgumentException iae) {
			LOG.error("rpc client: dial error: invalid network {} or address {}", network, address, iae);
			throw new RpcException("rpc client: dial error: " + iae.getMessage(), CONNECTION, iae);
		}
		
		TransportConfig config = transport.getConfig();
		
		Bootstrap b = new Bootstrap();
		b.group(transport.getIoGroup())
			.channel(NioSocketChannel.class)
			.option(ChannelOption.ALLOCATOR, transport.getAllocator())
			.option(ChannelOption.SO_KEEPALIVE, true)
			.option(ChannelOption.TCP_NODELAY, config.nodelay())
			.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.connect_timeout())
			// Nothing may be read until the client pipeline is in place
			.option(ChannelOption.AUTO_READ, false)
			.handler(new ChannelInitializer<Channel>() {
				@Override
				protected void initChannel(Channel ch) throws Exception {
					LOG.debug("Connecting to {}", remoteAddress);
				}
			});
		
		ChannelFuture future = b.connect(remoteAddress);
		try {
			future.await();
		} catch (InterruptedException e) {
			future.channel().close();
			Thread.currentThread().interrupt();
			throw new RpcException("rpc client: dial error: interrupted while connecting to " + address, 
					CONNECTION, e);
		}
		
		if(!future.isSuccess()) {
			LOG.error("rpc client: dial error: unable to connect to the remote address {}", 
					remoteAddress, future.cause());
			throw new RpcException("rpc client: dial error: " + future.cause().getMessage(), 
					CONNECTION, future.cause());
		}
		
		Channel channel = future.channel();
		try {
			return newClient(channel, codecType, transport);
		} catch (RpcException re) {
			channel.close();
			LOG.error("rpc client: create client error", re);
			throw re;
		}
	}

	public static RpcClient newClient(Channel channel, int codecType, Transport transport) {
		ClassLoader classSpace = Thread.currentThread().getContextClassLoader();
		return newClient(channel, codecType, transport, 
				classSpace == null ? RpcClient.class.getClassLoader() : classSpace);
	}
	
	/**
	 * Create a client for a connected channel, sending the connection preamble.
	 * The channel should not have started reading.
	 * 
	 * @param channel the connected channel
	 * @param codecType the codec to use
	 * @param transport the transport supplying timers and configuration
	 * @param classSpace the class loader used to resolve reply types
	 * @return the client
	 * @throws RpcException if the codec type is not registered or the preamble
	 *  cannot be written, in which case the channel is closed
	 */
	public static RpcClient newClient(Channel channel, int codecType, Transport transport, 
			ClassLoader classSpace) {
		CodecFactory factory = CodecRegistry.lookup(codecType);
		if(factory == null) {
			String message = "invalid codec type " + Integer.toUnsignedString(codecType);
			LOG.error("rpc client: codec error: {}", message);
			throw new RpcException(message, INVALID_CODEC);
		}
		
		ByteBuf preamble = channel.alloc().ioBuffer(PREAMBLE_LENGTH)
				.writeInt(MAGIC)
				.writeInt(codecType);
		
		ChannelFuture written = channel.writeAndFlush(preamble);
		if(channel.eventLoop().inEventLoop()) {
			written.addListener(f -> {
				if(!f.isSuccess()) {
					LOG.error("rpc client: write conn error", f.cause());
					channel.close();
				}
			});
		} else {
			written.awaitUninterruptibly();
			if(!written.isSuccess()) {
				LOG.error("rpc client: write conn error", written.cause());
				channel.close();
				throw new RpcException("rpc client: write conn error: " + written.cause().getMessage(), 
						CONNECTION, written.cause());
			}
		}
		
		Codec codec = factory.create(classSpace);
		RpcClient client = new RpcClient(channel, transport);
		
		ChannelPipeline pipeline = channel.pipeline();
		int maxFrameLength = transport.getConfig().max_frame_length();
		pipeline.addLast("frameDecoder", new MessageFrameDecoder(maxFrameLength));
		pipeline.addLast("responseHandler", new ClientResponseHandler(client, codec));
		pipeline.addLast("messageSerializer", new MessageSerializer(codec, maxFrameLength));
		
		if(!channel.isActive()) {
			client.terminateCalls(new RpcException(ERR_SHUTDOWN, SHUTDOWN));
		}
		
		channel.config().setAutoRead(true);
		return client;
	}

	/**
	 * Start an asynchronous call
	 * 
	 * @param procedureName the procedure to call, of the form Service.Method
	 * @param args the argument
	 * @param replyType the type of the reply, or <code>null</code> to discard the reply
	 * @return the call
	 */
	public <R> Call<R> go(String procedureName, Object args, Class<R> replyType) {
		return go(procedureName, args, replyType, null);
	}

	/**
	 * Start an asynchronous call
	 * 
	 * @param procedureName the procedure to call, of the form Service.Method
	 * @param args the argument
	 * @param replyType the type of the reply, or <code>null</code> to discard the reply
	 * @param done a queue to which the call is added when it completes, may be <code>null</code>.
	 *  The queue should have spare capacity, a call which cannot be added is logged and dropped.
	 * @return the call
	 */
	public <R> Call<R> go(String procedureName, Object args, Class<R> replyType, 
			BlockingQueue<Call<?>> done) {
		return go(procedureName, args, replyType, done, defaultTimeout, MILLISECONDS);
	}

	/**
	 * Start an asynchronous call with a deadline. A call which has no response 
	 * within the timeout fails, and any late response is discarded.
	 */
	public <R> Call<R> go(String procedureName, Object args, Class<R> replyType, 
			BlockingQueue<Call<?>> done, long timeout, TimeUnit unit) {
		Call<R> call = new Call<>(procedureName, args, replyType, channel.eventLoop().newPromise(), done);
		send(call, timeout, unit);
		return call;
	}

	/**
	 * Make a call and wait for the reply
	 * 
	 * @return the reply
	 * @throws RpcException if the call fails
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public <R> R call(String procedureName, Object args, Class<R> replyType) throws InterruptedException {
		return go(procedureName, args, replyType).getResult();
	}

	public <R> R call(String procedureName, Object args, Class<R> replyType, long timeout, TimeUnit unit) 
			throws InterruptedException {
		return go(procedureName, args, replyType, null, timeout, unit).getResult();
	}

	private <R> void send(Call<R> call, long timeout, TimeUnit unit) {
		sendLock.lock();
		try {
			long sequence;
			stateLock.lock();
			try {
				if(closing || shutdown) {
					call.fail(new RpcException(ERR_SHUTDOWN, SHUTDOWN));
					return;
				}
				sequence = nextSequence++;
				call.setSequence(sequence);
				pending.put(sequence, call);
			} finally {
				stateLock.unlock();
			}
			
			if(timeout > 0) {
				call.setTimeout(timer.newTimeout(t -> {
						if(removeCall(sequence) != null) {
							call.fail(new RpcException("The call " + call.getProcedureName() + 
									" had no response within " + unit.toMillis(timeout) + " milliseconds", TIMEOUT));
						}
					}, timeout, unit));
			}
			
			channel.writeAndFlush(new RpcMessage(new Header(sequence, call.getProcedureName()), call.getArguments()))
				.addListener(f -> {
					if(!f.isSuccess()) {
						Call<?> failed = removeCall(sequence);
						if(failed != null) {
							failed.fail(toRpcException(f.cause()));
						}
					}
				});
		} finally {
			sendLock.unlock();
		}
	}
	
	private static RpcException toRpcException(Throwable t) {
		if(t instanceof RpcException) {
			return (RpcException) t;
		} else if (t instanceof ClosedChannelException) {
			return new RpcException(ERR_SHUTDOWN, SHUTDOWN, t);
		} else if (t instanceof java.io.IOException) {
			return new RpcException(String.valueOf(t.getMessage()), CONNECTION, t);
		}
		return new RpcException(String.valueOf(t.getMessage()), CODEC, t);
	}

	/**
	 * Remove a pending call. Removing a call which is not pending has no effect.
	 * 
	 * @return the call, or <code>null</code> if no call with the sequence was pending
	 */
	Call<?> removeCall(long sequence) {
		stateLock.lock();
		try {
			return pending.remove(sequence);
		} finally {
			stateLock.unlock();
		}
	}

	/**
	 * Fail all pending calls following the loss of the connection
	 */
	void terminateCalls(RpcException failure) {
		List<Call<?>> toFail;
		sendLock.lock();
		try {
			stateLock.lock();
			try {
				shutdown = true;
				toFail = new ArrayList<>(pending.values());
				pending.clear();
			} finally {
				stateLock.unlock();
			}
		} finally {
			sendLock.unlock();
		}
		
		if(!toFail.isEmpty()) {
			LOG.debug("Failing {} pending calls to {}", toFail.size(), channel.remoteAddress());
		}
		toFail.forEach(c -> c.fail(failure));
	}

	/**
	 * Close the connection. Pending calls fail once the connection is closed.
	 * 
	 * @throws RpcException if the client is already closed or shut down
	 */
	@Override
	public void close() {
		stateLock.lock();
		try {
			if(closing || shutdown) {
				throw new RpcException(ERR_SHUTDOWN, SHUTDOWN);
			}
			closing = true;
		} finally {
			stateLock.unlock();
		}
		channel.close();
	}

	/**
	 * @return true unless the client has been closed or its connection lost
	 */
	public boolean isAvailable() {
		stateLock.lock();
		try {
			return !closing && !shutdown;
		} finally {
			stateLock.unlock();
		}
	}

	public int getPendingCount() {
		stateLock.lock();
		try {
			return pending.size();
		} finally {
			stateLock.unlock();
		}
	}

	public Channel getChannel() {
		return channel;
	}
}
