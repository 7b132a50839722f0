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

import com.starlight.conduit.Envelope;
import com.starlight.conduit.driver.DriverSocket;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.EnvelopeHandler;
import com.starlight.conduit.driver.SocketType;
import com.starlight.conduit.exception.NotConnectedException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;


/**
 * Connecting socket ({@link SocketType#DEALER DEALER} or {@link SocketType#REQUEST
 * REQUEST}) with a single link, which is re-established after the retry interval
 * whenever it drops.
 * <p>
 * REQUEST sockets enforce strict alternation: a send is only allowed once the reply to
 * the previous one has been received (or the link has dropped).
 */
class ConnectedSocket implements DriverSocket, LinkHandler.LinkListener {
	private static final Logger LOG = LoggerFactory.getLogger( ConnectedSocket.class );


	private final NettyConduitDriver driver;
	private final Endpoint endpoint;
	private final SocketType type;
	private final EnvelopeHandler handler;

	private final AtomicBoolean awaiting_reply = new AtomicBoolean( false );

	private Bootstrap bootstrap;
	private SocketAddress remote_address;

	private volatile Channel channel;
	private volatile ScheduledFuture<?> reconnect_future;
	private volatile boolean closed = false;


	ConnectedSocket( NettyConduitDriver driver, Endpoint endpoint, SocketType type,
		EnvelopeHandler handler ) {

		this.driver = driver;
		this.endpoint = endpoint;
		this.type = type;
		this.handler = handler;
	}


	void setBootstrap( Bootstrap bootstrap, SocketAddress remote_address ) {
		this.bootstrap = bootstrap;
		this.remote_address = remote_address;
	}


	/**
	 * Make the first connection, blocking until it's established or fails.
	 */
	void connectInitial() throws IOException {
		ChannelFuture future = bootstrap.connect( remote_address );
		NettyConduitDriver.awaitOrThrow( future, "Unable to connect to " + endpoint );

		// NOTE: linkActive may not have run yet
		if ( channel == null ) channel = future.channel();
	}


	@Override
	public void send( @Nonnull Envelope envelope ) throws IOException {
		if ( closed ) throw new IOException( "Socket closed: " + endpoint );
		if ( envelope.isEmpty() ) {
			throw new IllegalArgumentException( "Empty envelopes can't be sent" );
		}

		Channel channel = this.channel;
		if ( channel == null || !channel.isActive() ) {
			throw new NotConnectedException( endpoint );
		}

		if ( type == SocketType.REQUEST && !awaiting_reply.compareAndSet( false, true ) ) {
			throw new IllegalStateException(
				"REQUEST socket is still waiting for a reply" );
		}

		channel.writeAndFlush( envelope ).addListener( ( ChannelFutureListener ) f -> {
			if ( !f.isSuccess() ) {
				LOG.debug( "Send to {} failed", endpoint, f.cause() );
			}
		} );
	}


	@Override
	public SocketType getType() {
		return type;
	}

	@Override
	public Endpoint getEndpoint() {
		return endpoint;
	}

	@Override
	public SocketAddress getLocalAddress() {
		Channel channel = this.channel;
		return channel == null ? null : channel.localAddress();
	}

	@Override
	public boolean isConnected() {
		Channel channel = this.channel;
		return !closed && channel != null && channel.isActive();
	}


	@Override
	public void close() {
		if ( closed ) return;
		closed = true;

		ScheduledFuture<?> reconnect_future = this.reconnect_future;
		if ( reconnect_future != null ) reconnect_future.cancel( false );

		Channel channel = this.channel;
		if ( channel != null ) channel.close().awaitUninterruptibly( 1000 );

		driver.socketClosed( this );
	}


	////////////////////////////////
	// LinkListener

	@Override
	public void linkActive( Channel channel ) {
		if ( closed ) {
			channel.close();
			return;
		}

		// NOTE: the first request may already be out, so alternation is left alone
		this.channel = channel;

		LOG.debug( "Link to {} active: {}", endpoint, channel );
		handler.peerConnected( null );
	}


	@Override
	public void linkInactive( Channel channel ) {
		if ( closed ) return;

		awaiting_reply.set( false );

		LOG.debug( "Link to {} lost", endpoint );
		handler.peerDisconnected( null );

		scheduleReconnect();
	}


	@Override
	public void envelopeReceived( Channel channel, Envelope envelope ) {
		if ( closed ) return;

		if ( type == SocketType.REQUEST && !awaiting_reply.compareAndSet( true, false ) ) {
			LOG.debug( "Unexpected envelope on REQUEST socket to {} dropped", endpoint );
			return;
		}

		handler.envelopeReceived( envelope );
	}


	private void scheduleReconnect() {
		if ( closed || driver.isShutDown() ) return;

		long delay = driver.getReconnectRetryInterval();
		try {
			reconnect_future = driver.getWorkerGroup().schedule( this::reconnect, delay,
				TimeUnit.MILLISECONDS );
		}
		catch( RuntimeException ex ) {
			// Rejected when the event loop is shutting down
			LOG.debug( "Unable to schedule reconnect to {}", endpoint, ex );
		}
	}


	private void reconnect() {
		if ( closed || driver.isShutDown() ) return;

		LOG.debug( "Reconnecting to {}", endpoint );
		bootstrap.connect( remote_address ).addListener( ( ChannelFutureListener ) f -> {
			if ( f.isSuccess() ) {
				if ( closed ) f.channel().close();
				return;
			}

			LOG.debug( "Reconnect to {} failed: {}", endpoint, f.cause().toString() );
			scheduleReconnect();
		} );
	}


	@Override
	public String toString() {
		return "ConnectedSocket{" + type + " " + endpoint + "}";
	}
}
