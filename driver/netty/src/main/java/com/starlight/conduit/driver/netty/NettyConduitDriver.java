// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Conduit nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.driver.ConduitDriver;
import com.starlight.conduit.driver.DriverSocket;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.EnvelopeHandler;
import com.starlight.conduit.driver.SocketType;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.local.LocalServerChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.compression.ZlibCodecFactory;
import io.netty.handler.codec.compression.ZlibWrapper;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;


/**
 * {@link ConduitDriver} built on Netty. Supports {@code tcp://} endpoints (NIO sockets)
 * and {@code inproc://} endpoints (Netty local channels, within a single VM).
 * <p>
 * Each link carries length-prefixed multi-part frames. Idle links exchange heartbeats
 * and a link that stays silent past the liveness timeout is closed. Connecting sockets
 * reconnect at the retry interval until closed.
 */
public class NettyConduitDriver implements ConduitDriver {
	private static final Logger LOG = LoggerFactory.getLogger( NettyConduitDriver.class );

	static final long RECONNECT_RETRY_INTERVAL =
		Long.getLong( "conduit.driver.netty.reconnect_retry", 1000 ).longValue();
	static final long HEARTBEAT_INTERVAL =
		Long.getLong( "conduit.driver.netty.heartbeat_interval", 5000 ).longValue();
	static final long LIVENESS_TIMEOUT =
		Long.getLong( "conduit.driver.netty.liveness_timeout", 15000 ).longValue();
	static final int MAX_FRAME_SIZE =
		Integer.getInteger( "conduit.driver.netty.max_frame_size", 1 << 30 ).intValue();

	private static final int CONNECT_TIMEOUT_MS = 10000;


	private final boolean enable_compression;
	private final SslContext client_ssl_context;
	private final SslContext server_ssl_context;
	private final EventLoopGroup boss_group;
	private final EventLoopGroup worker_group;
	private final boolean owns_groups;

	private final long reconnect_retry_ms;
	private final long heartbeat_interval_ms;
	private final long liveness_timeout_ms;
	private final int max_frame_size;

	private final Lock sockets_lock = new ReentrantLock();
	private final Set<DriverSocket> sockets = new HashSet<>();
	private volatile boolean shut_down = false;


	public static Builder newBuilder() {
		return new Builder();
	}


	public NettyConduitDriver() {
		this( new Builder() );
	}

	private NettyConduitDriver( Builder builder ) {
		this.enable_compression = builder.enable_compression;
		this.client_ssl_context = builder.client_ssl_context;
		this.server_ssl_context = builder.server_ssl_context;
		this.reconnect_retry_ms = builder.reconnect_retry_ms;
		this.heartbeat_interval_ms = builder.heartbeat_interval_ms;
		this.liveness_timeout_ms = builder.liveness_timeout_ms;
		this.max_frame_size = builder.max_frame_size;

		if ( builder.worker_group == null ) {
			boss_group = new NioEventLoopGroup( 1 );
			worker_group = new NioEventLoopGroup();
			owns_groups = true;
		}
		else {
			if ( builder.worker_group.isShuttingDown() ||
				builder.worker_group.isShutdown() ||
				builder.worker_group.isTerminated() ) {

				throw new IllegalArgumentException( "Worker group is stopped" );
			}
			boss_group = builder.worker_group;
			worker_group = builder.worker_group;
			owns_groups = false;
		}
	}


	@Override
	public DriverSocket bind( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException {

		requireNonNull( endpoint );
		requireNonNull( handler );
		if ( !type.isBinding() ) {
			throw new IllegalArgumentException( type + " sockets connect, not bind" );
		}
		checkNotShutDown();

		boolean tcp = isTCP( endpoint );
		BoundSocket socket = new BoundSocket( this, endpoint, type, handler );

		ServerBootstrap bootstrap = new ServerBootstrap()
			.group( boss_group, worker_group )
			.channel( tcp ? NioServerSocketChannel.class : LocalServerChannel.class )
			.childHandler( new PipelineInitializer( socket, tcp, true ) );
		if ( tcp ) {
			bootstrap = bootstrap
				.option( ChannelOption.SO_REUSEADDR, true )
				.childOption( ChannelOption.TCP_NODELAY, true )
				.childOption( ChannelOption.SO_KEEPALIVE, true );
		}

		ChannelFuture future = bootstrap.bind( bindAddress( endpoint ) );
		awaitOrThrow( future, "Unable to bind " + endpoint );

		socket.setServerChannel( future.channel() );
		addSocket( socket );

		LOG.debug( "Bound {} socket to {} ({})", type, endpoint,
			future.channel().localAddress() );
		return socket;
	}


	@Override
	public DriverSocket connect( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException {

		requireNonNull( endpoint );
		requireNonNull( handler );
		if ( type.isBinding() ) {
			throw new IllegalArgumentException( type + " sockets bind, not connect" );
		}
		checkNotShutDown();

		boolean tcp = isTCP( endpoint );
		ConnectedSocket socket = new ConnectedSocket( this, endpoint, type, handler );

		Bootstrap bootstrap = new Bootstrap()
			.group( worker_group )
			.channel( tcp ? NioSocketChannel.class : LocalChannel.class )
			.handler( new PipelineInitializer( socket, tcp, false ) );
		if ( tcp ) {
			bootstrap = bootstrap
				.option( ChannelOption.TCP_NODELAY, true )
				.option( ChannelOption.SO_KEEPALIVE, true )
				.option( ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS );
		}

		socket.setBootstrap( bootstrap, connectAddress( endpoint ) );
		socket.connectInitial();
		addSocket( socket );

		LOG.debug( "Connected {} socket to {}", type, endpoint );
		return socket;
	}


	@Override
	public void shutdown() {
		if ( shut_down ) return;
		shut_down = true;

		List<DriverSocket> to_close;
		sockets_lock.lock();
		try {
			to_close = new ArrayList<>( sockets );
			sockets.clear();
		}
		finally {
			sockets_lock.unlock();
		}
		to_close.forEach( DriverSocket::close );

		if ( owns_groups ) {
			boss_group.shutdownGracefully( 0, 1, TimeUnit.SECONDS );
			worker_group.shutdownGracefully( 0, 1, TimeUnit.SECONDS );
		}
	}


	long getReconnectRetryInterval() {
		return reconnect_retry_ms;
	}

	EventLoopGroup getWorkerGroup() {
		return worker_group;
	}

	boolean isShutDown() {
		return shut_down;
	}


	void socketClosed( DriverSocket socket ) {
		sockets_lock.lock();
		try {
			sockets.remove( socket );
		}
		finally {
			sockets_lock.unlock();
		}
	}


	private void addSocket( DriverSocket socket ) {
		sockets_lock.lock();
		try {
			sockets.add( socket );
		}
		finally {
			sockets_lock.unlock();
		}
	}


	private void checkNotShutDown() throws IOException {
		if ( shut_down ) throw new IOException( "Driver has been shut down" );
	}


	static void awaitOrThrow( ChannelFuture future, String message ) throws IOException {
		try {
			future.await();
		}
		catch( InterruptedException ex ) {
			future.cancel( false );
			InterruptedIOException io_ex = new InterruptedIOException();
			io_ex.initCause( ex );
			throw io_ex;
		}

		if ( !future.isSuccess() ) {
			Throwable cause = future.cause();
			if ( cause instanceof IOException ) {
				IOException io_ex = ( IOException ) cause;
				throw new IOException( message + ": " + io_ex.getMessage(), io_ex );
			}
			throw new IOException( message, cause );
		}
	}


	private static boolean isTCP( Endpoint endpoint ) {
		switch( endpoint.getScheme() ) {
			case Endpoint.TCP:
				return true;
			case Endpoint.INPROC:
				return false;
			default:
				throw new IllegalArgumentException(
					"Unsupported endpoint scheme: " + endpoint );
		}
	}


	private static SocketAddress bindAddress( Endpoint endpoint ) {
		if ( !isTCP( endpoint ) ) return new LocalAddress( endpoint.getLocation() );

		if ( endpoint.isWildcardHost() ) return new InetSocketAddress( endpoint.getPort() );
		else return new InetSocketAddress( endpoint.getHost(), endpoint.getPort() );
	}


	private static SocketAddress connectAddress( Endpoint endpoint ) {
		if ( !isTCP( endpoint ) ) return new LocalAddress( endpoint.getLocation() );

		if ( endpoint.isWildcardHost() ) {
			throw new IllegalArgumentException(
				"Wildcard host is only valid when binding: " + endpoint );
		}
		return InetSocketAddress.createUnresolved( endpoint.getHost(),
			endpoint.getPort() );
	}


	private class PipelineInitializer extends ChannelInitializer<Channel> {
		private final LinkHandler.LinkListener listener;
		private final boolean tcp;
		private final boolean server;

		PipelineInitializer( LinkHandler.LinkListener listener, boolean tcp,
			boolean server ) {

			this.listener = listener;
			this.tcp = tcp;
			this.server = server;
		}


		@Override
		protected void initChannel( Channel c ) {
			ChannelPipeline pipe = c.pipeline();

			SslContext ssl_context = server ? server_ssl_context : client_ssl_context;
			if ( tcp && ssl_context != null ) {
				pipe.addLast( ssl_context.newHandler( c.alloc() ) );
			}

			if ( enable_compression ) {
				pipe.addLast( ZlibCodecFactory.newZlibEncoder( ZlibWrapper.ZLIB ),
					ZlibCodecFactory.newZlibDecoder( ZlibWrapper.ZLIB ) );
			}

			pipe.addLast( new NettyEnvelopeEncoder() );
			pipe.addLast( new NettyEnvelopeDecoder( max_frame_size ) );

			if ( heartbeat_interval_ms > 0 || liveness_timeout_ms > 0 ) {
				pipe.addLast( new IdleStateHandler( liveness_timeout_ms,
					heartbeat_interval_ms, 0, TimeUnit.MILLISECONDS ) );
			}

			pipe.addLast( new LinkHandler( listener ) );
		}
	}


	public static class Builder {
		private boolean enable_compression = false;
		private SslContext client_ssl_context = null;
		private SslContext server_ssl_context = null;
		private EventLoopGroup worker_group = null;
		private long reconnect_retry_ms = RECONNECT_RETRY_INTERVAL;
		private long heartbeat_interval_ms = HEARTBEAT_INTERVAL;
		private long liveness_timeout_ms = LIVENESS_TIMEOUT;
		private int max_frame_size = MAX_FRAME_SIZE;

		Builder() {}


		/**
		 * Compress links with zlib. Both ends must agree.
		 */
		public Builder compression( boolean enable ) {
			this.enable_compression = enable;
			return this;
		}

		/**
		 * SSL for connecting {@code tcp://} sockets.
		 */
		public Builder clientSslContext( @Nonnull SslContext context ) {
			this.client_ssl_context = requireNonNull( context );
			return this;
		}

		/**
		 * SSL for binding {@code tcp://} sockets.
		 */
		public Builder serverSslContext( @Nonnull SslContext context ) {
			this.server_ssl_context = requireNonNull( context );
			return this;
		}

		/**
		 * Event loop group to run all links on. The caller remains responsible for
		 * shutting it down. By default the driver creates (and shuts down) its own.
		 */
		public Builder workerGroup( @Nonnull EventLoopGroup group ) {
			this.worker_group = requireNonNull( group );
			return this;
		}

		public Builder reconnectRetryInterval( long time, @Nonnull TimeUnit unit ) {
			this.reconnect_retry_ms = unit.toMillis( time );
			return this;
		}

		/**
		 * Idle time after which a heartbeat is sent. Zero disables heartbeats.
		 */
		public Builder heartbeatInterval( long time, @Nonnull TimeUnit unit ) {
			this.heartbeat_interval_ms = unit.toMillis( time );
			return this;
		}

		/**
		 * Silence after which a link is considered dead. Zero disables the check.
		 */
		public Builder livenessTimeout( long time, @Nonnull TimeUnit unit ) {
			this.liveness_timeout_ms = unit.toMillis( time );
			return this;
		}

		public Builder maxFrameSize( int max_frame_size ) {
			if ( max_frame_size < 8 ) {
				throw new IllegalArgumentException( "Frame size too small" );
			}
			this.max_frame_size = max_frame_size;
			return this;
		}


		public NettyConduitDriver build() {
			if ( liveness_timeout_ms > 0 && heartbeat_interval_ms > 0 &&
				liveness_timeout_ms <= heartbeat_interval_ms ) {

				throw new IllegalStateException( "Liveness timeout (" +
					liveness_timeout_ms + " ms) must exceed the heartbeat interval (" +
					heartbeat_interval_ms + " ms)" );
			}
			return new NettyConduitDriver( this );
		}
	}
}
