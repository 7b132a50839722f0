package com.starlight.conduit;

import com.starlight.conduit.driver.ConduitDriver;
import com.starlight.conduit.driver.DriverSocket;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.EnvelopeHandler;
import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.driver.SocketType;
import com.starlight.conduit.exception.NotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;


/**
 * In-memory driver providing {@link SocketType#ROUTER ROUTER} and
 * {@link SocketType#DEALER DEALER} sockets. All callbacks are made in order from a single
 * delivery thread.
 * <p>
 * Tests can sever links, hold back requests (simulating a server that never replies) and
 * inject envelopes into connected sockets.
 */
class StubConduitDriver implements ConduitDriver {
	private static final Logger LOG = LoggerFactory.getLogger( StubConduitDriver.class );


	private final ExecutorService delivery_executor =
		Executors.newSingleThreadExecutor( r -> {
			Thread thread = new Thread( r, "Stub driver delivery" );
			thread.setDaemon( true );
			return thread;
		} );

	private final Map<Endpoint,StubBoundSocket> bound_sockets = new ConcurrentHashMap<>();
	private final AtomicInteger identity_counter = new AtomicInteger( 0 );

	private final AtomicInteger requests_delivered = new AtomicInteger( 0 );
	private final List<Envelope> held_requests = new CopyOnWriteArrayList<>();
	private volatile boolean hold_requests = false;


	@Override
	public DriverSocket bind( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException {

		if ( type != SocketType.ROUTER ) {
			throw new IllegalArgumentException( "Stub driver only binds ROUTER sockets" );
		}

		StubBoundSocket socket = new StubBoundSocket( endpoint, handler );
		if ( bound_sockets.putIfAbsent( endpoint, socket ) != null ) {
			throw new IOException( "Address already in use: " + endpoint );
		}
		return socket;
	}


	@Override
	public DriverSocket connect( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException {

		if ( type != SocketType.DEALER ) {
			throw new IllegalArgumentException( "Stub driver only connects DEALER sockets" );
		}

		StubBoundSocket server = bound_sockets.get( endpoint );
		if ( server == null ) throw new ConnectException( "Connection refused: " + endpoint );

		StubConnectedSocket client = new StubConnectedSocket( endpoint, handler );
		RoutingIdentity identity = new RoutingIdentity(
			Frames.intFrame( identity_counter.incrementAndGet() ) );

		StubLink link = new StubLink( identity, server, client );
		server.links.put( identity, link );
		client.link = link;

		deliver( () -> {
			server.handler.peerConnected( identity );
			client.handler.peerConnected( null );
		} );
		return client;
	}


	@Override
	public void shutdown() {
		new ArrayList<>( bound_sockets.values() ).forEach( StubBoundSocket::close );
		delivery_executor.shutdown();
	}


	/**
	 * When true, requests sent by connected sockets are kept rather than delivered.
	 */
	void setHoldRequests( boolean hold_requests ) {
		this.hold_requests = hold_requests;
	}

	List<Envelope> getHeldRequests() {
		return held_requests;
	}


	/**
	 * Number of envelopes handed to bound sockets so far.
	 */
	int getRequestsDelivered() {
		return requests_delivered.get();
	}


	/**
	 * Drop every link to the given endpoint, notifying both ends.
	 */
	void severLinks( @Nonnull Endpoint endpoint ) {
		StubBoundSocket server = bound_sockets.get( endpoint );
		if ( server == null ) return;

		new ArrayList<>( server.links.values() ).forEach( StubLink::sever );
	}


	/**
	 * Deliver an envelope to every socket connected to the endpoint, as if the server had
	 * sent it.
	 */
	void injectToClients( @Nonnull Endpoint endpoint, @Nonnull Envelope envelope ) {
		StubBoundSocket server = bound_sockets.get( endpoint );
		if ( server == null ) return;

		for( StubLink link : server.links.values() ) {
			Envelope copy = envelope.copy();
			deliver( () -> {
				if ( link.active.get() && !link.client.closed ) {
					link.client.handler.envelopeReceived( copy );
				}
			} );
		}
	}


	private void deliver( Runnable delivery ) {
		delivery_executor.execute( () -> {
			try {
				delivery.run();
			}
			catch( RuntimeException ex ) {
				LOG.warn( "Error during delivery", ex );
			}
		} );
	}



	private class StubLink {
		private final RoutingIdentity identity;
		private final StubBoundSocket server;
		private final StubConnectedSocket client;

		private final AtomicBoolean active = new AtomicBoolean( true );

		StubLink( RoutingIdentity identity, StubBoundSocket server,
			StubConnectedSocket client ) {

			this.identity = identity;
			this.server = server;
			this.client = client;
		}


		void sever() {
			if ( !active.compareAndSet( true, false ) ) return;

			server.links.remove( identity );
			deliver( () -> {
				if ( !server.closed ) server.handler.peerDisconnected( identity );
				if ( !client.closed ) client.handler.peerDisconnected( null );
			} );
		}
	}


	private class StubBoundSocket implements DriverSocket {
		private final Endpoint endpoint;
		private final EnvelopeHandler handler;
		private final Map<RoutingIdentity,StubLink> links = new ConcurrentHashMap<>();

		private volatile boolean closed = false;

		StubBoundSocket( Endpoint endpoint, EnvelopeHandler handler ) {
			this.endpoint = endpoint;
			this.handler = handler;
		}


		@Override
		public void send( @Nonnull Envelope envelope ) throws IOException {
			if ( closed ) throw new IOException( "Socket closed: " + endpoint );

			RoutingIdentity identity = new RoutingIdentity( envelope.popFront() );
			StubLink link = links.get( identity );
			if ( link == null ) {
				LOG.debug( "Envelope for unknown peer {} dropped", identity );
				return;
			}

			deliver( () -> {
				if ( link.active.get() && !link.client.closed ) {
					link.client.handler.envelopeReceived( envelope );
				}
			} );
		}

		@Override
		public SocketType getType() {
			return SocketType.ROUTER;
		}

		@Override
		public Endpoint getEndpoint() {
			return endpoint;
		}

		@Override
		public SocketAddress getLocalAddress() {
			return null;
		}

		@Override
		public boolean isConnected() {
			return !closed && !links.isEmpty();
		}

		@Override
		public void close() {
			if ( closed ) return;
			closed = true;

			bound_sockets.remove( endpoint, this );
			new ArrayList<>( links.values() ).forEach( StubLink::sever );
		}
	}


	private class StubConnectedSocket implements DriverSocket {
		private final Endpoint endpoint;
		private final EnvelopeHandler handler;

		private volatile StubLink link;
		private volatile boolean closed = false;

		StubConnectedSocket( Endpoint endpoint, EnvelopeHandler handler ) {
			this.endpoint = endpoint;
			this.handler = handler;
		}


		@Override
		public void send( @Nonnull Envelope envelope ) throws IOException {
			if ( closed ) throw new IOException( "Socket closed: " + endpoint );

			StubLink link = this.link;
			if ( link == null || !link.active.get() ) {
				throw new NotConnectedException( endpoint );
			}

			if ( hold_requests ) {
				held_requests.add( envelope );
				return;
			}

			deliver( () -> {
				if ( link.active.get() && !link.server.closed ) {
					envelope.pushFront( link.identity.toBytes() );
					requests_delivered.incrementAndGet();
					link.server.handler.envelopeReceived( envelope );
				}
			} );
		}

		@Override
		public SocketType getType() {
			return SocketType.DEALER;
		}

		@Override
		public Endpoint getEndpoint() {
			return endpoint;
		}

		@Override
		public SocketAddress getLocalAddress() {
			return null;
		}

		@Override
		public boolean isConnected() {
			StubLink link = this.link;
			return !closed && link != null && link.active.get();
		}

		@Override
		public void close() {
			if ( closed ) return;
			closed = true;

			StubLink link = this.link;
			if ( link != null ) link.sever();
		}
	}
}
