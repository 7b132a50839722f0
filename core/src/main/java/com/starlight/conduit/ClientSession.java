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

package com.starlight.conduit;

import com.starlight.conduit.driver.ConduitDriver;
import com.starlight.conduit.driver.DriverSocket;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.EnvelopeHandler;
import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.driver.SocketType;
import com.starlight.conduit.exception.CallTimeoutException;
import com.starlight.conduit.exception.InterruptedCallException;
import com.starlight.conduit.exception.SessionClosedException;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Client end of a connection: issues calls to a {@link ServerSession} and matches
 * replies to them. Any number of threads may make calls concurrently; each blocks only
 * on its own call.
 * <p>
 * Outbound requests are queued and written by a single dispatch thread, which is the
 * only thread that touches the socket. Replies are matched by call ID in the pending
 * call table.
 * <p>
 * Usage:
 * <pre>
 *     ClientSession session = ClientSession.newBuilder()
 *         .driver( driver )
 *         .endpoint( "tcp://localhost:5555" )
 *         .connect();
 *     Counter counter = session.create( Counter.class );
 *     counter.add( 5 );
 * </pre>
 */
public class ClientSession implements Closeable {
	private static final Logger LOG = LoggerFactory.getLogger( ClientSession.class );

	static final long DEFAULT_CALL_TIMEOUT_MS =
		Long.getLong( "conduit.call.default_timeout", 0 ).longValue();
	static final long CLOSE_WAIT_MS =
		Long.getLong( "conduit.session.close_wait", 2000 ).longValue();

	// Marks the end of the outbound queue
	private static final OutboundCall SHUTDOWN = new OutboundCall( -1, new Envelope() );


	private final Endpoint endpoint;
	private final SocketType socket_type;
	private final FunctionRegistry functions;
	private final CallDispatcher dispatcher;
	private final RoleContext role_context;
	private final long default_timeout_ms;
	private final ConnectionListener connection_listener;

	private final BlockingQueue<OutboundCall> outbound_queue = new LinkedBlockingQueue<>();

	private final Lock pending_lock = new ReentrantLock();
	private final TIntObjectMap<PendingCall> pending_calls = new TIntObjectHashMap<>();

	private final AtomicInteger call_id_counter = new AtomicInteger( 0 );

	private final ScheduledThreadPoolExecutor timeout_executor;

	// REQUEST mode only: held from send until a reply arrives or the link drops
	private final Semaphore request_permit;
	private final AtomicBoolean request_outstanding = new AtomicBoolean( false );

	private final DispatchThread dispatch_thread;
	private final RemoteFactory factory;
	private final ProxyLeases leases;

	private volatile DriverSocket socket;
	private volatile boolean closed = false;


	private ClientSession( Builder builder ) {
		this.endpoint = builder.endpoint;
		this.socket_type = builder.socket_type;
		this.functions = builder.functions;
		this.default_timeout_ms = builder.default_timeout_ms;
		this.connection_listener = builder.connection_listener;

		dispatcher = new CallDispatcher( functions );
		role_context = RoleContext.client( this );

		request_permit = socket_type == SocketType.REQUEST ? new Semaphore( 1 ) : null;

		timeout_executor = new ScheduledThreadPoolExecutor( 1, r -> {
			Thread thread = new Thread( r, "Conduit timeouts - " + endpoint );
			thread.setDaemon( true );
			return thread;
		} );
		timeout_executor.setRemoveOnCancelPolicy( true );

		dispatch_thread = new DispatchThread();
		leases = new ProxyLeases( this );
		factory = ProxyKit.createProxy( this, FunctionRegistry.FACTORY_TYPE,
			ObjectRegistry.FACTORY_OBJECT_ID );
	}


	public static Builder newBuilder() {
		return new Builder();
	}


	private void open( ConduitDriver driver ) throws IOException {
		try {
			socket = driver.connect( endpoint, socket_type, new InboundHandler() );
		}
		catch( IOException | RuntimeException ex ) {
			timeout_executor.shutdownNow();
			leases.stop();
			closed = true;
			throw ex;
		}

		dispatch_thread.start();
		leases.start();
		LOG.debug( "Client session connected to {} ({})", endpoint, socket_type );
	}


	/**
	 * Construct a new object on the server and return a proxy for it. The object is
	 * destroyed once the proxy (and any other proxy for it) has been garbage collected.
	 *
	 * @param type_interface	A registered exported interface.
	 * @param args				Arguments for the type's constructor.
	 */
	public <T> T create( @Nonnull Class<T> type_interface, Object... args ) {
		ExportedType<T> type = exportedType( type_interface );

		int object_id =
			factory.create( type.getName(), args == null ? new Object[ 0 ] : args );
		return ProxyKit.createProxy( this, type, object_id, true );
	}


	/**
	 * Return a proxy for an existing object whose ID is already known (for example an
	 * object the server exported itself). No call is made, and the object is never
	 * destroyed on the proxy's account.
	 */
	public <T> T proxyFor( @Nonnull Class<T> type_interface, int object_id ) {
		if ( object_id <= ObjectRegistry.FACTORY_OBJECT_ID ) {
			throw new IllegalArgumentException( "Invalid object ID: " + object_id );
		}
		return ProxyKit.createProxy( this, exportedType( type_interface ), object_id,
			false );
	}


	/**
	 * Proxy for the server's factory object.
	 */
	public RemoteFactory factory() {
		return factory;
	}


	public Endpoint getEndpoint() {
		return endpoint;
	}

	public SocketType getSocketType() {
		return socket_type;
	}

	public FunctionRegistry getFunctionRegistry() {
		return functions;
	}

	/**
	 * Timeout applied to calls by default, in milliseconds. Zero means no timeout.
	 */
	public long getDefaultTimeout() {
		return default_timeout_ms;
	}


	public boolean isConnected() {
		DriverSocket socket = this.socket;
		return !closed && socket != null && socket.isConnected();
	}

	public boolean isClosed() {
		return closed;
	}


	/**
	 * Number of calls waiting for replies.
	 */
	public int getPendingCallCount() {
		pending_lock.lock();
		try {
			return pending_calls.size();
		}
		finally {
			pending_lock.unlock();
		}
	}


	/**
	 * Close the session. Pending calls fail with {@link SessionClosedException} and
	 * later calls fail immediately.
	 */
	@Override
	public void close() {
		if ( closed ) return;
		closed = true;

		outbound_queue.add( SHUTDOWN );
		try {
			dispatch_thread.join( CLOSE_WAIT_MS );
		}
		catch( InterruptedException ex ) {
			Thread.currentThread().interrupt();
		}
		if ( dispatch_thread.isAlive() ) {
			LOG.warn( "Dispatch thread for {} did not exit within {} ms", endpoint,
				Long.valueOf( CLOSE_WAIT_MS ) );
			dispatch_thread.interrupt();
		}

		DriverSocket socket = this.socket;
		if ( socket != null ) socket.close();

		timeout_executor.shutdownNow();
		leases.stop();

		failAll( new SessionClosedException( "Session to " + endpoint + " closed" ) );
		LOG.debug( "Client session to {} closed", endpoint );
	}


	CallDispatcher getDispatcher() {
		return dispatcher;
	}

	RoleContext getRoleContext() {
		return role_context;
	}

	ProxyLeases getLeases() {
		return leases;
	}


	private <T> ExportedType<T> exportedType( Class<T> type_interface ) {
		ExportedType<T> type = functions.typeFor( type_interface );
		if ( type == null ) {
			throw new IllegalArgumentException(
				"Type is not registered: " + type_interface.getName() );
		}
		return type;
	}


	/**
	 * Register a call and queue its request for sending.
	 *
	 * @param request		The request, without call ID (which is added here).
	 * @param timeout_ms	Timeout in milliseconds, or zero for none.
	 *
	 * @throws SessionClosedException	If the session is closed.
	 */
	PendingCall send( @Nonnull Envelope request, @Nonnull PendingCall.ReplyDecoder decoder,
		long timeout_ms ) {

		if ( closed ) throw new SessionClosedException( "Session to " + endpoint + " closed" );

		if ( request_permit != null ) acquireRequestPermit( timeout_ms );

		int call_id = call_id_counter.getAndIncrement();
		PendingCall call = new PendingCall( call_id, decoder );

		pending_lock.lock();
		try {
			// Checked again under the lock so close() can't miss the call
			if ( closed ) {
				releaseRequestPermit();
				throw new SessionClosedException( "Session to " + endpoint + " closed" );
			}
			pending_calls.put( call_id, call );
		}
		finally {
			pending_lock.unlock();
		}

		if ( timeout_ms > 0 ) {
			try {
				call.setTimeoutFuture( timeout_executor.schedule(
					() -> timeoutCall( call_id, timeout_ms ), timeout_ms,
					TimeUnit.MILLISECONDS ) );
			}
			catch( RuntimeException ex ) {
				// Executor shut down by a concurrent close
				LOG.debug( "Unable to schedule timeout for call {}", call, ex );
			}
		}

		request.pushFront( Frames.intFrame( call_id ) );
		outbound_queue.add( new OutboundCall( call_id, request ) );
		return call;
	}


	/**
	 * Abandon a call whose caller is no longer waiting. A late reply is dropped.
	 */
	void abandon( @Nonnull PendingCall call, @Nonnull Throwable reason ) {
		if ( removePending( call.getCallID() ) != null ) call.fail( reason );
	}


	private void acquireRequestPermit( long timeout_ms ) {
		try {
			if ( timeout_ms > 0 ) {
				if ( !request_permit.tryAcquire( timeout_ms, TimeUnit.MILLISECONDS ) ) {
					throw new CallTimeoutException( -1, timeout_ms );
				}
			}
			else request_permit.acquire();
		}
		catch( InterruptedException ex ) {
			throw new InterruptedCallException( ex );
		}
		request_outstanding.set( true );
	}


	private void releaseRequestPermit() {
		if ( request_permit != null && request_outstanding.compareAndSet( true, false ) ) {
			request_permit.release();
		}
	}


	private PendingCall removePending( int call_id ) {
		pending_lock.lock();
		try {
			return pending_calls.remove( call_id );
		}
		finally {
			pending_lock.unlock();
		}
	}


	private void timeoutCall( int call_id, long timeout_ms ) {
		PendingCall call = removePending( call_id );
		if ( call == null ) return;

		LOG.debug( "Call {} to {} timed out after {} ms", call, endpoint,
			Long.valueOf( timeout_ms ) );
		call.fail( new CallTimeoutException( call_id, timeout_ms ) );
	}


	private void failAll( Throwable reason ) {
		List<PendingCall> calls;
		pending_lock.lock();
		try {
			calls = new ArrayList<>( pending_calls.valueCollection() );
			pending_calls.clear();
		}
		finally {
			pending_lock.unlock();
		}

		if ( !calls.isEmpty() ) {
			LOG.debug( "Failing {} pending calls to {}: {}",
				Integer.valueOf( calls.size() ), endpoint, reason.getMessage() );
		}
		calls.forEach( call -> call.fail( reason ) );
		releaseRequestPermit();
	}


	private void replyReceived( Envelope reply ) {
		if ( reply.isEmpty() ) {
			LOG.warn( "Empty reply from {} dropped", endpoint );
			return;
		}

		int call_id;
		try {
			call_id = Frames.readInt( reply.popFront() );
		}
		catch( IllegalArgumentException ex ) {
			LOG.warn( "Reply from {} with invalid call ID dropped: {}", endpoint,
				ex.getMessage() );
			return;
		}

		PendingCall call = removePending( call_id );

		// Any reply ends the request/reply cycle, including late ones
		releaseRequestPermit();

		if ( call == null ) {
			LOG.debug( "Reply for unknown call {} from {} dropped (timed out?)",
				Integer.valueOf( call_id ), endpoint );
			return;
		}

		call.resolve( reply );
	}


	@Override
	public String toString() {
		return "ClientSession{" + endpoint + ", " + socket_type + "}";
	}



	private static class OutboundCall {
		private final int call_id;
		private final Envelope request;

		OutboundCall( int call_id, Envelope request ) {
			this.call_id = call_id;
			this.request = request;
		}
	}


	private class DispatchThread extends Thread {
		DispatchThread() {
			super( "Conduit dispatch - " + endpoint );
			setDaemon( true );
		}


		@Override
		public void run() {
			while( true ) {
				OutboundCall call;
				try {
					call = outbound_queue.take();
				}
				catch( InterruptedException ex ) {
					break;
				}

				if ( call == SHUTDOWN ) break;

				try {
					socket.send( call.request );
				}
				catch( IOException | IllegalStateException ex ) {
					LOG.debug( "Unable to send call {} to {}",
						Integer.valueOf( call.call_id ), endpoint, ex );

					PendingCall pending = removePending( call.call_id );
					if ( pending != null ) {
						releaseRequestPermit();
						pending.fail( new SessionClosedException(
							"Unable to send call to " + endpoint, ex ) );
					}
				}
			}

			// Anything left behind will never be sent
			List<OutboundCall> remaining = new ArrayList<>();
			outbound_queue.drainTo( remaining );
			for( OutboundCall call : remaining ) {
				if ( call == SHUTDOWN ) continue;

				PendingCall pending = removePending( call.call_id );
				if ( pending != null ) {
					pending.fail( new SessionClosedException(
						"Session to " + endpoint + " closed" ) );
				}
			}
		}
	}


	private class InboundHandler implements EnvelopeHandler {
		@Override
		public void envelopeReceived( Envelope envelope ) {
			replyReceived( envelope );
		}


		@Override
		public void peerConnected( @Nullable RoutingIdentity peer ) {
			LOG.debug( "Connection to {} opened", endpoint );
			if ( connection_listener != null ) {
				connection_listener.connectionOpened( endpoint );
			}
		}


		@Override
		public void peerDisconnected( @Nullable RoutingIdentity peer ) {
			if ( closed ) return;

			LOG.info( "Connection to {} lost", endpoint );
			leases.forgetAll();
			failAll( new SessionClosedException( "Connection to " + endpoint + " lost" ) );

			if ( connection_listener != null ) {
				connection_listener.connectionLost( endpoint );
			}
		}
	}


	public static class Builder {
		private ConduitDriver driver;
		private Endpoint endpoint;
		private SocketType socket_type = SocketType.DEALER;
		private FunctionRegistry functions = FunctionRegistry.shared();
		private long default_timeout_ms = DEFAULT_CALL_TIMEOUT_MS;
		private ConnectionListener connection_listener;

		Builder() {}


		public Builder driver( @Nonnull ConduitDriver driver ) {
			this.driver = Objects.requireNonNull( driver );
			return this;
		}

		public Builder endpoint( @Nonnull Endpoint endpoint ) {
			this.endpoint = Objects.requireNonNull( endpoint );
			return this;
		}

		public Builder endpoint( @Nonnull String endpoint ) {
			return endpoint( Endpoint.parse( endpoint ) );
		}

		/**
		 * {@link SocketType#DEALER DEALER} (the default) allows any number of calls in
		 * flight. {@link SocketType#REQUEST REQUEST} allows one at a time.
		 */
		public Builder socketType( @Nonnull SocketType socket_type ) {
			if ( socket_type != SocketType.DEALER && socket_type != SocketType.REQUEST ) {
				throw new IllegalArgumentException(
					"Client sessions use DEALER or REQUEST sockets: " + socket_type );
			}
			this.socket_type = socket_type;
			return this;
		}

		public Builder functions( @Nonnull FunctionRegistry functions ) {
			this.functions = Objects.requireNonNull( functions );
			return this;
		}

		/**
		 * Timeout for calls made through this session. Zero means no timeout.
		 */
		public Builder defaultTimeout( long timeout, @Nonnull TimeUnit unit ) {
			if ( timeout < 0 ) throw new IllegalArgumentException( "Negative timeout" );
			this.default_timeout_ms = unit.toMillis( timeout );
			return this;
		}

		public Builder connectionListener( @Nullable ConnectionListener listener ) {
			this.connection_listener = listener;
			return this;
		}


		/**
		 * Connect to the server.
		 *
		 * @throws IOException	If the link can't be established.
		 */
		public ClientSession connect() throws IOException {
			if ( driver == null ) throw new IllegalStateException( "Driver not set" );
			if ( endpoint == null ) throw new IllegalStateException( "Endpoint not set" );

			ClientSession session = new ClientSession( this );
			session.open( driver );
			return session;
		}
	}
}
