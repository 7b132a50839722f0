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
import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.driver.SocketType;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Binding socket ({@link SocketType#ROUTER ROUTER} or {@link SocketType#REPLY REPLY}).
 * Each accepted link gets a routing identity of five bytes: a zero byte followed by a
 * counter.
 * <p>
 * ROUTER sockets prefix inbound envelopes with the sender's identity and route
 * outbound envelopes by their first part. REPLY sockets deliver one request at a time
 * and send each reply to the peer of the request being answered.
 */
class BoundSocket implements DriverSocket, LinkHandler.LinkListener {
	private static final Logger LOG = LoggerFactory.getLogger( BoundSocket.class );

	static final AttributeKey<RoutingIdentity> IDENTITY_KEY =
		AttributeKey.newInstance( ".routing_identity" );


	private final NettyConduitDriver driver;
	private final Endpoint endpoint;
	private final SocketType type;
	private final EnvelopeHandler handler;

	private final AtomicInteger identity_counter = new AtomicInteger( 0 );

	// Lock for peers, request_queue and current_request
	private final Lock peers_lock = new ReentrantLock();
	private final TIntObjectMap<Channel> peers = new TIntObjectHashMap<>();

	// REPLY only
	private final Deque<InboundRequest> request_queue = new ArrayDeque<>();
	private InboundRequest current_request;

	private volatile Channel server_channel;
	private volatile boolean closed = false;


	BoundSocket( NettyConduitDriver driver, Endpoint endpoint, SocketType type,
		EnvelopeHandler handler ) {

		this.driver = driver;
		this.endpoint = endpoint;
		this.type = type;
		this.handler = handler;
	}


	void setServerChannel( Channel server_channel ) {
		this.server_channel = server_channel;
	}


	@Override
	public void send( @Nonnull Envelope envelope ) throws IOException {
		if ( closed ) throw new IOException( "Socket closed: " + endpoint );

		Channel channel;
		if ( type == SocketType.ROUTER ) {
			if ( envelope.isEmpty() ) {
				throw new IllegalArgumentException( "ROUTER envelopes need an identity" );
			}
			RoutingIdentity identity = new RoutingIdentity( envelope.popFront() );

			peers_lock.lock();
			try {
				channel = peers.get( identityKey( identity ) );
			}
			finally {
				peers_lock.unlock();
			}

			if ( channel == null ) {
				LOG.debug( "Envelope for unknown peer {} dropped", identity );
				return;
			}
		}
		else {
			InboundRequest request;
			peers_lock.lock();
			try {
				request = current_request;
				if ( request == null ) {
					throw new IllegalStateException(
						"REPLY socket has no request to answer" );
				}
				current_request = null;
			}
			finally {
				peers_lock.unlock();
			}
			channel = request.channel;
		}

		if ( envelope.isEmpty() ) {
			throw new IllegalArgumentException( "Empty envelopes can't be sent" );
		}

		channel.writeAndFlush( envelope ).addListener( ( ChannelFutureListener ) f -> {
			if ( !f.isSuccess() ) {
				LOG.debug( "Send to {} failed", f.channel(), f.cause() );
			}
		} );

		if ( type == SocketType.REPLY ) deliverNextRequest();
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
		Channel channel = server_channel;
		return channel == null ? null : channel.localAddress();
	}


	@Override
	public boolean isConnected() {
		peers_lock.lock();
		try {
			return !closed && !peers.isEmpty();
		}
		finally {
			peers_lock.unlock();
		}
	}


	@Override
	public void close() {
		if ( closed ) return;
		closed = true;

		Channel channel = server_channel;
		if ( channel != null ) channel.close().syncUninterruptibly();

		List<Channel> links;
		peers_lock.lock();
		try {
			links = new ArrayList<>( peers.valueCollection() );
			peers.clear();
			request_queue.clear();
			current_request = null;
		}
		finally {
			peers_lock.unlock();
		}
		links.forEach( link -> link.close().awaitUninterruptibly( 1000 ) );

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

		int id = identity_counter.incrementAndGet();
		RoutingIdentity identity = new RoutingIdentity(
			ByteBuffer.allocate( 5 ).put( ( byte ) 0 ).putInt( id ).array() );
		channel.attr( IDENTITY_KEY ).set( identity );

		peers_lock.lock();
		try {
			peers.put( id, channel );
		}
		finally {
			peers_lock.unlock();
		}

		LOG.debug( "Peer {} connected to {}: {}", identity, endpoint,
			channel.remoteAddress() );
		handler.peerConnected( identity );
	}


	@Override
	public void linkInactive( Channel channel ) {
		RoutingIdentity identity = channel.attr( IDENTITY_KEY ).get();
		if ( identity == null ) return;

		peers_lock.lock();
		try {
			peers.remove( identityKey( identity ) );

			// Requests from that peer can no longer be answered
			request_queue.removeIf( request -> request.channel == channel );
		}
		finally {
			peers_lock.unlock();
		}

		if ( closed ) return;

		LOG.debug( "Peer {} disconnected from {}", identity, endpoint );
		handler.peerDisconnected( identity );
	}


	@Override
	public void envelopeReceived( Channel channel, Envelope envelope ) {
		if ( closed ) return;

		if ( type == SocketType.ROUTER ) {
			RoutingIdentity identity = channel.attr( IDENTITY_KEY ).get();
			envelope.pushFront( identity.toBytes() );
			handler.envelopeReceived( envelope );
		}
		else {
			peers_lock.lock();
			try {
				request_queue.add( new InboundRequest( channel, envelope ) );
			}
			finally {
				peers_lock.unlock();
			}
			deliverNextRequest();
		}
	}


	private void deliverNextRequest() {
		InboundRequest request;
		peers_lock.lock();
		try {
			if ( current_request != null || request_queue.isEmpty() ) return;

			request = request_queue.poll();
			current_request = request;
		}
		finally {
			peers_lock.unlock();
		}

		handler.envelopeReceived( request.envelope );
	}


	/**
	 * Identities are always created by this class, so the counter is the key.
	 */
	private static int identityKey( RoutingIdentity identity ) {
		byte[] bytes = identity.toBytes();
		if ( bytes.length != 5 ) return -1;
		return ByteBuffer.wrap( bytes, 1, 4 ).getInt();
	}


	@Override
	public String toString() {
		return "BoundSocket{" + type + " " + endpoint + "}";
	}


	private static class InboundRequest {
		private final Channel channel;
		private final Envelope envelope;

		InboundRequest( Channel channel, Envelope envelope ) {
			this.channel = channel;
			this.envelope = envelope;
		}
	}
}
