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
import com.starlight.conduit.exception.DispatchReason;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.THashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Server end of a connection: executes calls from any number of {@link ClientSession
 * client sessions} against an {@link ObjectRegistry}.
 * <p>
 * Arriving requests are placed on a bounded work queue and executed by a fixed pool of
 * worker threads. Replies go to an egress queue drained by a single thread, which is
 * the only thread that writes to the socket. When the work queue is full, requests are
 * answered immediately with an {@link DispatchReason#OVERLOADED OVERLOADED} error.
 * <p>
 * Objects are destroyed when the peer that owns them disconnects, and all objects are
 * destroyed when the session is closed. Objects created by requests that were still
 * executing when their peer disconnected are destroyed once those requests finish.
 */
public class ServerSession implements Closeable {
	private static final Logger LOG = LoggerFactory.getLogger( ServerSession.class );

	static final int DEFAULT_WORKER_THREADS = Integer.getInteger(
		"conduit.server.worker_threads",
		Runtime.getRuntime().availableProcessors() ).intValue();
	static final int DEFAULT_QUEUE_DEPTH =
		Integer.getInteger( "conduit.server.queue_depth", 1024 ).intValue();

	// Marks the end of the work and egress queues
	private static final WorkItem SHUTDOWN_WORK = new WorkItem( null, new Envelope() );
	private static final Envelope SHUTDOWN_EGRESS = new Envelope();


	private final Endpoint endpoint;
	private final SocketType socket_type;
	private final FunctionRegistry functions;
	private final ObjectRegistry object_registry;
	private final CallDispatcher dispatcher;

	private final BlockingQueue<WorkItem> work_queue;
	private final BlockingQueue<Envelope> egress_queue = new LinkedBlockingQueue<>();

	// Requests queued or executing per peer, and peers that left while some were
	private final Lock in_flight_lock = new ReentrantLock();
	private final TObjectIntMap<RoutingIdentity> in_flight = new TObjectIntHashMap<>();
	private final Set<RoutingIdentity> departed_peers = new THashSet<>();

	private final List<Thread> workers;
	private final Thread egress_thread;

	private volatile DriverSocket socket;
	private volatile boolean closed = false;


	private ServerSession( Builder builder ) {
		this.endpoint = builder.endpoint;
		this.socket_type = builder.socket_type;
		this.functions = builder.functions;

		object_registry = new ObjectRegistry( functions );
		dispatcher = new CallDispatcher( functions );
		work_queue = new ArrayBlockingQueue<>( builder.queue_depth );

		workers = new ArrayList<>( builder.worker_threads );
		for( int i = 0; i < builder.worker_threads; i++ ) {
			workers.add( new WorkerThread( i ) );
		}
		egress_thread = new EgressThread();
	}


	public static Builder newBuilder() {
		return new Builder();
	}


	private void open( ConduitDriver driver ) throws IOException {
		workers.forEach( Thread::start );
		egress_thread.start();

		try {
			socket = driver.bind( endpoint, socket_type, new InboundHandler() );
		}
		catch( IOException | RuntimeException ex ) {
			stopThreads();
			closed = true;
			throw ex;
		}

		LOG.debug( "Server session bound to {} ({}, {} workers)", endpoint, socket_type,
			Integer.valueOf( workers.size() ) );
	}


	public Endpoint getEndpoint() {
		return endpoint;
	}

	public SocketType getSocketType() {
		return socket_type;
	}

	/**
	 * The actual bound address, which is useful when binding to an ephemeral port.
	 */
	public SocketAddress getLocalAddress() {
		return socket.getLocalAddress();
	}

	public FunctionRegistry getFunctionRegistry() {
		return functions;
	}

	public ObjectRegistry getObjectRegistry() {
		return object_registry;
	}


	/**
	 * Make an existing object available to clients, who can reach it with
	 * {@link ClientSession#proxyFor(Class, int)}. The object has no owner, so it lives
	 * until destroyed or until the session closes.
	 *
	 * @return		The object's ID.
	 */
	public int export( @Nonnull Object instance ) {
		ExportedType<?> type = functions.exportedTypeOf( instance.getClass() );
		if ( type == null ) {
			throw new IllegalArgumentException( "Class implements no registered type: " +
				instance.getClass().getName() );
		}
		return object_registry.export( instance, type, null );
	}


	public boolean isClosed() {
		return closed;
	}


	/**
	 * Close the socket, stop the worker and egress threads and destroy all objects.
	 */
	@Override
	public void close() {
		if ( closed ) return;
		closed = true;

		DriverSocket socket = this.socket;
		if ( socket != null ) socket.close();

		stopThreads();
		object_registry.destroyAll();

		LOG.debug( "Server session on {} closed", endpoint );
	}


	private void stopThreads() {
		// Queued work will never be answered
		work_queue.clear();
		for( int i = 0; i < workers.size(); i++ ) {
			try {
				work_queue.put( SHUTDOWN_WORK );
			}
			catch( InterruptedException ex ) {
				Thread.currentThread().interrupt();
				break;
			}
		}
		joinAll( workers );

		egress_queue.add( SHUTDOWN_EGRESS );
		joinAll( List.of( egress_thread ) );
	}


	private void joinAll( List<Thread> threads ) {
		long deadline = System.nanoTime() +
			TimeUnit.MILLISECONDS.toNanos( ClientSession.CLOSE_WAIT_MS );
		for( Thread thread : threads ) {
			long remaining_ms =
				TimeUnit.NANOSECONDS.toMillis( deadline - System.nanoTime() );
			try {
				if ( remaining_ms > 0 ) thread.join( remaining_ms );
			}
			catch( InterruptedException ex ) {
				Thread.currentThread().interrupt();
			}

			if ( thread.isAlive() ) {
				LOG.warn( "{} did not exit, interrupting", thread.getName() );
				thread.interrupt();
			}
		}
	}


	private void requestReceived( Envelope envelope ) {
		RoutingIdentity peer = null;
		if ( socket_type == SocketType.ROUTER ) {
			if ( envelope.isEmpty() ) return;
			peer = new RoutingIdentity( envelope.popFront() );
		}

		if ( envelope.isEmpty() ) {
			LOG.warn( "Empty request from {} dropped", peer );
			return;
		}

		if ( peer != null ) requestStarted( peer );

		if ( !work_queue.offer( new WorkItem( peer, envelope ) ) ) {
			LOG.debug( "Work queue full, rejecting request from {}", peer );
			if ( peer != null ) requestFinished( peer );

			Envelope reply = CallDispatcher.dispatchError( envelope.peekFront(),
				DispatchReason.OVERLOADED, "Server work queue is full (" +
				( work_queue.size() + work_queue.remainingCapacity() ) + " requests)" );
			enqueueReply( reply, peer );
		}
	}


	private void requestStarted( @Nonnull RoutingIdentity peer ) {
		in_flight_lock.lock();
		try {
			in_flight.adjustOrPutValue( peer, 1, 1 );
		}
		finally {
			in_flight_lock.unlock();
		}
	}


	private void requestFinished( @Nonnull RoutingIdentity peer ) {
		boolean departed;
		in_flight_lock.lock();
		try {
			if ( in_flight.adjustOrPutValue( peer, -1, 0 ) > 0 ) return;

			in_flight.remove( peer );
			departed = departed_peers.remove( peer );
		}
		finally {
			in_flight_lock.unlock();
		}

		// Anything the last request created for a departed peer has no owner left
		if ( departed ) {
			int destroyed = object_registry.destroyOwnedBy( peer );
			LOG.debug( "Last request from departed peer {} finished ({} objects " +
				"destroyed)", peer, Integer.valueOf( destroyed ) );
		}
	}


	/**
	 * Number of disconnected peers whose requests are still executing.
	 */
	int departedPeerCount() {
		in_flight_lock.lock();
		try {
			return departed_peers.size();
		}
		finally {
			in_flight_lock.unlock();
		}
	}


	private void enqueueReply( Envelope reply, @Nullable RoutingIdentity peer ) {
		if ( peer != null ) reply.pushFront( peer.toBytes() );
		egress_queue.add( reply );
	}


	@Override
	public String toString() {
		return "ServerSession{" + endpoint + ", " + socket_type + "}";
	}



	private static class WorkItem {
		private final RoutingIdentity peer;
		private final Envelope request;

		WorkItem( RoutingIdentity peer, Envelope request ) {
			this.peer = peer;
			this.request = request;
		}
	}


	private class WorkerThread extends Thread {
		WorkerThread( int index ) {
			super( "Conduit worker " + index + " - " + endpoint );
			setDaemon( true );
		}


		@Override
		public void run() {
			while( true ) {
				WorkItem item;
				try {
					item = work_queue.take();
				}
				catch( InterruptedException ex ) {
					break;
				}

				if ( item == SHUTDOWN_WORK ) break;

				try {
					Envelope reply =
						dispatcher.execute( item.request, object_registry, item.peer );
					if ( reply != null ) enqueueReply( reply, item.peer );
				}
				catch( Throwable t ) {
					LOG.warn( "Unexpected error executing request from {}", item.peer, t );
				}
				finally {
					if ( item.peer != null ) requestFinished( item.peer );
				}
			}
		}
	}


	private class EgressThread extends Thread {
		EgressThread() {
			super( "Conduit egress - " + endpoint );
			setDaemon( true );
		}


		@Override
		public void run() {
			while( true ) {
				Envelope reply;
				try {
					reply = egress_queue.take();
				}
				catch( InterruptedException ex ) {
					break;
				}

				if ( reply == SHUTDOWN_EGRESS ) break;

				DriverSocket socket = ServerSession.this.socket;
				if ( socket == null ) {
					LOG.warn( "Reply dropped, socket not bound" );
					continue;
				}

				try {
					socket.send( reply );
				}
				catch( IOException | IllegalStateException ex ) {
					// Usually the peer went away
					LOG.debug( "Unable to send reply on {}", endpoint, ex );
				}
			}
		}
	}


	private class InboundHandler implements EnvelopeHandler {
		@Override
		public void envelopeReceived( Envelope envelope ) {
			if ( closed ) return;
			requestReceived( envelope );
		}


		@Override
		public void peerConnected( @Nullable RoutingIdentity peer ) {
			LOG.debug( "Peer connected to {}: {}", endpoint, peer );
		}


		@Override
		public void peerDisconnected( @Nullable RoutingIdentity peer ) {
			if ( peer == null ) return;

			in_flight_lock.lock();
			try {
				if ( in_flight.containsKey( peer ) ) departed_peers.add( peer );
			}
			finally {
				in_flight_lock.unlock();
			}

			int destroyed = object_registry.destroyOwnedBy( peer );
			LOG.debug( "Peer disconnected from {}: {} ({} objects destroyed)", endpoint,
				peer, Integer.valueOf( destroyed ) );
		}
	}


	public static class Builder {
		private ConduitDriver driver;
		private Endpoint endpoint;
		private SocketType socket_type = SocketType.ROUTER;
		private FunctionRegistry functions = FunctionRegistry.shared();
		private int worker_threads = DEFAULT_WORKER_THREADS;
		private int queue_depth = DEFAULT_QUEUE_DEPTH;

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
		 * {@link SocketType#ROUTER ROUTER} (the default) serves any number of calls
		 * from each peer concurrently and tracks object ownership per peer.
		 * {@link SocketType#REPLY REPLY} serves one call at a time.
		 */
		public Builder socketType( @Nonnull SocketType socket_type ) {
			if ( socket_type != SocketType.ROUTER && socket_type != SocketType.REPLY ) {
				throw new IllegalArgumentException(
					"Server sessions use ROUTER or REPLY sockets: " + socket_type );
			}
			this.socket_type = socket_type;
			return this;
		}

		public Builder functions( @Nonnull FunctionRegistry functions ) {
			this.functions = Objects.requireNonNull( functions );
			return this;
		}

		public Builder workerThreads( int worker_threads ) {
			if ( worker_threads < 1 ) {
				throw new IllegalArgumentException( "At least one worker is required" );
			}
			this.worker_threads = worker_threads;
			return this;
		}

		public Builder queueDepth( int queue_depth ) {
			if ( queue_depth < 1 ) {
				throw new IllegalArgumentException( "Queue depth must be positive" );
			}
			this.queue_depth = queue_depth;
			return this;
		}


		/**
		 * Bind the server socket and start serving.
		 *
		 * @throws IOException	If the endpoint can't be bound.
		 */
		public ServerSession bind() throws IOException {
			if ( driver == null ) throw new IllegalStateException( "Driver not set" );
			if ( endpoint == null ) throw new IllegalStateException( "Endpoint not set" );

			ServerSession session = new ServerSession( this );
			session.open( driver );
			return session;
		}
	}
}
