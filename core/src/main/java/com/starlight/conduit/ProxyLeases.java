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

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Tracks the proxies of a {@link ClientSession} so remote objects can be destroyed once
 * no proxy for them is left. Proxies are followed through weak references; a reaper
 * thread polls the reference queue and, when the last proxy for an object has been
 * collected, destroys the object on the server.
 * <p>
 * Only objects this client is responsible for are released: those it created and those
 * the server attributed to it when returning them. Objects reached with
 * {@link ClientSession#proxyFor(Class, int)} are left alone.
 * <p>
 * Release is best-effort: failures are logged and the server still destroys everything
 * the peer owns when it disconnects.
 */
final class ProxyLeases {
	private static final Logger LOG = LoggerFactory.getLogger( ProxyLeases.class );

	static final long REAP_INTERVAL_MS =
		Long.getLong( "conduit.proxy.reap_interval", 1000 ).longValue();


	private final ClientSession session;

	private final ReferenceQueue<ProxyInvocationHandler> ref_queue =
		new ReferenceQueue<>();

	private final Lock lease_lock = new ReentrantLock();
	private final TIntObjectMap<Lease> leases = new TIntObjectHashMap<>();

	private final ScheduledThreadPoolExecutor reaper;


	ProxyLeases( @Nonnull ClientSession session ) {
		this.session = session;

		reaper = new ScheduledThreadPoolExecutor( 1, r -> {
			Thread thread = new Thread( r, "Conduit proxy reaper - " +
				session.getEndpoint() );
			thread.setDaemon( true );
			return thread;
		} );
	}


	void start() {
		reaper.scheduleWithFixedDelay( this::reapSafely, REAP_INTERVAL_MS,
			REAP_INTERVAL_MS, TimeUnit.MILLISECONDS );
	}

	void stop() {
		reaper.shutdownNow();
		forgetAll();
	}


	/**
	 * Stop following every object. Used when the link drops: the server destroys what
	 * the client owned, and a restarted server hands out the same IDs again.
	 */
	void forgetAll() {
		lease_lock.lock();
		try {
			leases.clear();
		}
		finally {
			lease_lock.unlock();
		}
	}


	/**
	 * Start following a new proxy.
	 *
	 * @param release		True if the object should be destroyed once its last proxy is
	 * 						gone. Once set for an object, it stays set.
	 */
	void register( @Nonnull ProxyInvocationHandler handler, boolean release ) {
		int object_id = handler.getObjectID();

		lease_lock.lock();
		try {
			Lease lease = leases.get( object_id );
			if ( lease == null ) {
				lease = new Lease();
				leases.put( object_id, lease );
			}

			lease.references.add( new HandlerReference( handler, object_id, ref_queue ) );
			if ( release ) lease.release = true;
		}
		finally {
			lease_lock.unlock();
		}
	}


	/**
	 * Stop following an object, which has been destroyed explicitly.
	 */
	void forget( int object_id ) {
		lease_lock.lock();
		try {
			leases.remove( object_id );
		}
		finally {
			lease_lock.unlock();
		}
	}


	/**
	 * Whether the object still has live proxies being followed.
	 */
	boolean isLeased( int object_id ) {
		lease_lock.lock();
		try {
			return leases.containsKey( object_id );
		}
		finally {
			lease_lock.unlock();
		}
	}


	/**
	 * Process collected proxies and release objects with none left.
	 *
	 * @return		The number of objects released.
	 */
	int reap() {
		TIntList to_release = new TIntArrayList();

		HandlerReference ref;
		while( ( ref = ( HandlerReference ) ref_queue.poll() ) != null ) {
			lease_lock.lock();
			try {
				Lease lease = leases.get( ref.object_id );

				// Null when the object was destroyed explicitly
				if ( lease == null || !lease.references.remove( ref ) ) continue;

				if ( lease.references.isEmpty() ) {
					leases.remove( ref.object_id );
					if ( lease.release ) to_release.add( ref.object_id );
				}
			}
			finally {
				lease_lock.unlock();
			}
		}

		int released = 0;
		for( int i = 0; i < to_release.size(); i++ ) {
			int object_id = to_release.get( i );

			// A reply may have produced a new proxy in the meantime
			if ( isLeased( object_id ) ) continue;
			if ( session.isClosed() || !session.isConnected() ) break;

			try {
				session.factory().destroy( object_id );
				released++;
				LOG.debug( "Released remote object {} on {}", Integer.valueOf( object_id ),
					session.getEndpoint() );
			}
			catch( RuntimeException ex ) {
				LOG.debug( "Unable to release remote object {} on {}: {}",
					Integer.valueOf( object_id ), session.getEndpoint(), ex.toString() );
			}
		}
		return released;
	}


	private void reapSafely() {
		try {
			reap();
		}
		catch( Throwable t ) {
			// Thrown out of a scheduled task, it would stop the reaper for good
			LOG.warn( "Error releasing proxies of {}", session.getEndpoint(), t );
		}
	}



	private static class Lease {
		private final List<HandlerReference> references = new ArrayList<>( 1 );
		private boolean release = false;
	}


	private static class HandlerReference extends WeakReference<ProxyInvocationHandler> {
		private final int object_id;

		HandlerReference( ProxyInvocationHandler handler, int object_id,
			ReferenceQueue<ProxyInvocationHandler> queue ) {

			super( handler, queue );
			this.object_id = object_id;
		}
	}
}
