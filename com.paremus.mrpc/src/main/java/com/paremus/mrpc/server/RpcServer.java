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
package com.paremus.mrpc.server;

import static com.paremus.mrpc.RpcException.CONNECTION;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paremus.mrpc.RpcException;
import com.paremus.mrpc.config.TransportConfig;
import com.paremus.mrpc.registry.ReflectiveServiceBinder;
import com.paremus.mrpc.registry.ServiceBinder;
import com.paremus.mrpc.registry.ServiceDefinition;
import com.paremus.mrpc.registry.ServiceRegistry;
import com.paremus.mrpc.transport.Transport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

/**
 * A server which exposes registered services to {@link com.paremus.mrpc.client.RpcClient}s.
 * Each connection is served independently, and the requests on a connection
 * are dispatched concurrently.
 */
public class RpcServer implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(RpcServer.class);
	
	private static final ListenerErrorHandler LISTENER_ERROR_HANDLER = new ListenerErrorHandler();
	
	private static RpcServer defaultServer;
	
	private final Transport transport;
	
	private final ClassLoader classSpace;
	
	private final ServiceRegistry registry = new ServiceRegistry();
	
	private final ServiceBinder binder = new ReflectiveServiceBinder();
	
	private final ChannelGroup group;

	public RpcServer() {
		this(Transport.getDefault());
	}
	
	public RpcServer(Transport transport) {
		this(transport, defaultClassSpace());
	}

	public RpcServer(Transport transport, ClassLoader classSpace) {
		this.transport = transport;
		this.classSpace = classSpace;
		this.group = new DefaultChannelGroup(transport.getIoGroup().next());
	}
	
	/**
	 * Get the process-wide server, creating it on the default transport if 
	 * necessary. Services registered with the default server are available 
	 * on every address that it is bound to.
	 */
	public static synchronized RpcServer getDefault() {
		if(defaultServer == null) {
			defaultServer = new RpcServer();
		}
		return defaultServer;
	}
	
	private static ClassLoader defaultClassSpace() {
		ClassLoader classSpace = Thread.currentThread().getContextClassLoader();
		return classSpace == null ? RpcServer.class.getClassLoader() : classSpace;
	}

	/**
	 * Register a service object, exposing its public methods of the form 
	 * <code>R method(A)</code> or <code>R method(A, R)</code>
	 * 
	 * @param service the service, or a {@link ServiceDefinition}
	 * @throws IllegalArgumentException if the object cannot be exposed as a service
	 * @throws RpcException if a service with the same name is already registered
	 */
	public void register(Object service) {
		if(service instanceof ServiceDefinition) {
			register((ServiceDefinition) service);
		} else {
			register(binder.bind(service));
		}
	}

	public void register(ServiceDefinition definition) {
		registry.add(definition);
	}

	public ServiceRegistry getRegistry() {
		return registry;
	}

	/**
	 * Listen on the configured bind address
	 * 
	 * @param port the port, or 0 to use an ephemeral port
	 * @return the listening channel
	 */
	public Channel bind(int port) {
		return bind(new InetSocketAddress(transport.getConfig().bind_address(), port));
	}

	/**
	 * Start accepting connections
	 * 
	 * @param address the address to listen on
	 * @return the listening channel
	 * @throws RpcException if the address cannot be bound
	 */
	public Channel bind(SocketAddress address) {
		TransportConfig config = transport.getConfig();
		
		ServerBootstrap b = new ServerBootstrap();
		b.group(transport.getIoGroup())
			.channel(NioServerSocketChannel.class)
			.option(ChannelOption.ALLOCATOR, transport.getAllocator())
			.option(ChannelOption.SO_BACKLOG, 128)
			.handler(LISTENER_ERROR_HANDLER)
			.childOption(ChannelOption.ALLOCATOR, transport.getAllocator())
			.childOption(ChannelOption.SO_KEEPALIVE, true)
			.childOption(ChannelOption.TCP_NODELAY, config.nodelay())
			.childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
			.childHandler(new ChannelInitializer<Channel>() {
				@Override
				protected void initChannel(Channel ch) throws Exception {
					serveConnection(ch);
				}
			});
		
		ChannelFuture future = b.bind(address);
		try {
			future.await();
		} catch (InterruptedException ie) {
			LOG.warn("Interrupted while binding the server to {}", address);
			future.channel().close();
			Thread.currentThread().interrupt();
			throw new RpcException("Interrupted while binding to " + address, CONNECTION, ie);
		}
		
		if(!future.isSuccess()) {
			LOG.error("Unable to bind the server to {}", address, future.cause());
			throw new RpcException("Unable to bind to " + address + ": " + future.cause().getMessage(), 
					CONNECTION, future.cause());
		}
		
		Channel server = future.channel();
		group.add(server);
		LOG.info("The server is accepting connections on {}", server.localAddress());
		return server;
	}

	/**
	 * Accept connections until the listener is closed
	 * 
	 * @param address the address to listen on
	 * @throws InterruptedException if the calling thread is interrupted
	 */
	public void accept(SocketAddress address) throws InterruptedException {
		bind(address).closeFuture().await();
	}

	/**
	 * Serve requests on a connection which was accepted elsewhere. The 
	 * connection must begin with the preamble sent by the client.
	 */
	public void serveConnection(Channel channel) {
		channel.pipeline().addLast("preamble", new PreambleDecoder(registry, transport.getWorkers(), 
				transport.getConfig().max_frame_length(), classSpace));
		group.add(channel);
	}

	/**
	 * Stop listening and close every connection
	 */
	@Override
	public void close() {
		group.close().awaitUninterruptibly();
	}
}
