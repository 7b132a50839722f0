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

import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.exception.ConduitRuntimeException;
import com.starlight.conduit.exception.DispatchException;
import com.starlight.conduit.exception.RegistryNotInitializedException;
import com.starlight.conduit.exception.UnknownObjectException;
import com.starlight.conduit.exception.UnknownTypeException;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.custom_hash.TObjectIntCustomHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.strategy.IdentityHashingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Server-side table of live exported objects, keyed by object ID. Objects get here by
 * being constructed through the factory or by being returned (or passed) to a client.
 */
public class ObjectRegistry {
	private static final Logger LOG = LoggerFactory.getLogger( ObjectRegistry.class );

	/** ID of the factory object. Never allocated to a registered object. */
	public static final int FACTORY_OBJECT_ID = 0;


	private final FunctionRegistry functions;

	private final Lock map_lock = new ReentrantLock();
	private final TObjectIntMap<Object> object_to_id_map =
		new TObjectIntCustomHashMap<>( new IdentityHashingStrategy<>() );
	private final TIntObjectMap<ObjectRecord> id_to_record_map =
		new TIntObjectHashMap<>();

	// NOTE: ID zero is reserved
	private final AtomicInteger object_id_counter = new AtomicInteger( 0 );


	public ObjectRegistry( @Nonnull FunctionRegistry functions ) {
		this.functions = Objects.requireNonNull( functions );
	}


	public FunctionRegistry getFunctionRegistry() {
		return functions;
	}


	/**
	 * Construct a new object of the named type.
	 *
	 * @param owner		Peer to which the object belongs, if known.
	 *
	 * @return			The new object's ID.
	 *
	 * @throws UnknownTypeException					If the type isn't registered.
	 * @throws RegistryNotInitializedException		If the type has no constructor.
	 */
	public int create( @Nonnull String type_name, @Nonnull Object[] args,
		@Nullable RoutingIdentity owner ) throws DispatchException {

		ExportedType<?> type = functions.typeNamed( type_name );
		if ( type == null ) throw new UnknownTypeException( type_name );

		ObjectConstructor<?> constructor = type.getConstructor();
		if ( constructor == null ) throw new RegistryNotInitializedException( type_name );

		Object instance;
		try {
			instance = constructor.construct( args );
		}
		catch( RuntimeException ex ) {
			throw ex;
		}
		catch( Exception ex ) {
			throw new ConduitRuntimeException(
				"Unable to construct object of type " + type_name, ex );
		}

		if ( !type.getInterface().isInstance( instance ) ) {
			throw new ConduitRuntimeException( "Constructor for type " + type_name +
				" returned " + ( instance == null ? "null" :
				"a " + instance.getClass().getName() ) );
		}

		int object_id = allocateID();
		ObjectRecord record = new ObjectRecord( object_id, type, instance, owner );

		map_lock.lock();
		try {
			id_to_record_map.put( object_id, record );
			object_to_id_map.put( instance, object_id );
		}
		finally {
			map_lock.unlock();
		}

		LOG.debug( "Created object {} of type {} for {}",
			Integer.valueOf( object_id ), type_name, owner );
		return object_id;
	}


	/**
	 * Register an existing instance, or find its ID if it's already registered.
	 *
	 * @param owner		Peer to which the object will belong if this is its first
	 * 					exposure.
	 */
	public int export( @Nonnull Object instance, @Nonnull ExportedType<?> type,
		@Nullable RoutingIdentity owner ) {

		if ( !type.getInterface().isInstance( instance ) ) {
			throw new IllegalArgumentException( instance.getClass().getName() +
				" does not implement " + type.getInterface().getName() );
		}

		int object_id;
		map_lock.lock();
		try {
			// NOTE: zero is the "no entry" value and is never allocated
			object_id = object_to_id_map.get( instance );
			if ( object_id != 0 ) return object_id;

			object_id = allocateID();
			id_to_record_map.put( object_id,
				new ObjectRecord( object_id, type, instance, owner ) );
			object_to_id_map.put( instance, object_id );
		}
		finally {
			map_lock.unlock();
		}

		LOG.debug( "Exported object {} of type {} to {}", Integer.valueOf( object_id ),
			type.getName(), owner );
		return object_id;
	}


	/**
	 * Find the instance with the given ID.
	 */
	public Object lookup( int object_id ) throws UnknownObjectException {
		return record( object_id ).getInstance();
	}


	public ObjectRecord record( int object_id ) throws UnknownObjectException {
		map_lock.lock();
		try {
			ObjectRecord record = id_to_record_map.get( object_id );
			if ( record == null ) throw new UnknownObjectException( object_id );
			return record;
		}
		finally {
			map_lock.unlock();
		}
	}


	public boolean contains( int object_id ) {
		map_lock.lock();
		try {
			return id_to_record_map.containsKey( object_id );
		}
		finally {
			map_lock.unlock();
		}
	}


	/**
	 * True if the object is registered and belongs to the given peer.
	 */
	public boolean isOwnedBy( int object_id, @Nullable RoutingIdentity peer ) {
		if ( peer == null ) return false;

		map_lock.lock();
		try {
			ObjectRecord record = id_to_record_map.get( object_id );
			return record != null && peer.equals( record.getOwner() );
		}
		finally {
			map_lock.unlock();
		}
	}


	/**
	 * Remove and dispose of an object.
	 *
	 * @throws UnknownObjectException	If the ID isn't registered (including if it was
	 * 									already destroyed).
	 */
	public void destroy( int object_id ) throws UnknownObjectException {
		ObjectRecord record;
		map_lock.lock();
		try {
			record = id_to_record_map.remove( object_id );
			if ( record == null ) throw new UnknownObjectException( object_id );

			object_to_id_map.remove( record.getInstance() );
		}
		finally {
			map_lock.unlock();
		}

		dispose( record );
	}


	/**
	 * Destroy all objects belonging to the given peer.
	 *
	 * @return		The number of objects destroyed.
	 */
	public int destroyOwnedBy( @Nonnull RoutingIdentity owner ) {
		List<ObjectRecord> removed = new ArrayList<>();
		map_lock.lock();
		try {
			id_to_record_map.retainEntries( ( id, record ) -> {
				if ( owner.equals( record.getOwner() ) ) {
					removed.add( record );
					object_to_id_map.remove( record.getInstance() );
					return false;
				}
				return true;
			} );
		}
		finally {
			map_lock.unlock();
		}

		removed.forEach( this::dispose );
		return removed.size();
	}


	public void destroyAll() {
		List<ObjectRecord> removed;
		map_lock.lock();
		try {
			removed = new ArrayList<>( id_to_record_map.valueCollection() );
			id_to_record_map.clear();
			object_to_id_map.clear();
		}
		finally {
			map_lock.unlock();
		}

		removed.forEach( this::dispose );
	}


	public int size() {
		map_lock.lock();
		try {
			return id_to_record_map.size();
		}
		finally {
			map_lock.unlock();
		}
	}


	private int allocateID() {
		int object_id = object_id_counter.incrementAndGet();
		if ( object_id <= FACTORY_OBJECT_ID ) {
			throw new IllegalStateException( "Object IDs exhausted" );
		}
		return object_id;
	}


	private void dispose( ObjectRecord record ) {
		LOG.debug( "Destroying {}", record );

		Object instance = record.getInstance();
		if ( !( instance instanceof AutoCloseable ) ) return;

		try {
			( ( AutoCloseable ) instance ).close();
		}
		catch( Exception ex ) {
			LOG.warn( "Error closing destroyed object {}", record, ex );
		}
	}
}
