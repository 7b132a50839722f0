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

import com.starlight.conduit.exception.UnknownFunctionNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * Registry of {@link ExportedType exported types} and the invokers for their methods.
 * Both sides of a connection must register the same types (under the same names).
 * <p>
 * Sessions use the {@link #shared() shared} registry unless given their own. The
 * built-in {@link RemoteFactory factory} type is always registered.
 * <p>
 * Registration is normally done at startup. Lookups are safe from any thread.
 */
public final class FunctionRegistry {
	private static final Logger LOG = LoggerFactory.getLogger( FunctionRegistry.class );

	/** Type of the factory object ({@link ObjectRegistry#FACTORY_OBJECT_ID}). */
	public static final ExportedType<RemoteFactory> FACTORY_TYPE =
		ExportedType.newBuilder( RemoteFactory.TYPE_NAME, RemoteFactory.class ).build();

	private static final FunctionRegistry SHARED = new FunctionRegistry();


	private final Lock lock = new ReentrantLock();

	private final Map<String,ExportedType<?>> types_by_name = new HashMap<>();
	private final Map<Class<?>,ExportedType<?>> types_by_interface = new HashMap<>();
	private final Map<String,Invoker> invokers = new HashMap<>();

	// Implementation class -> most specific exported type (or empty). Cleared on register.
	private final Map<Class<?>,Optional<ExportedType<?>>> instance_type_cache =
		new HashMap<>();


	public FunctionRegistry() {
		register( FACTORY_TYPE );
	}


	/**
	 * The process-wide registry used by sessions that aren't given one.
	 */
	public static FunctionRegistry shared() {
		return SHARED;
	}


	/**
	 * Register a type. Registering an equivalent type (same name and interface) again
	 * has no effect, except that a constructor it brings replaces a registration that
	 * had none. An existing constructor is never replaced.
	 *
	 * @throws IllegalStateException		If the name, interface or a function is
	 * 										already registered for a different type.
	 */
	public void register( @Nonnull ExportedType<?> type ) {
		lock.lock();
		try {
			ExportedType<?> existing = types_by_name.get( type.getName() );
			if ( existing != null ) {
				if ( existing.isEquivalent( type ) ) {
					if ( existing.getConstructor() == null &&
						type.getConstructor() != null ) {

						replaceEquivalent( type );
					}
					return;
				}

				throw new IllegalStateException( "Type name \"" + type.getName() +
					"\" already registered: " + existing );
			}

			existing = types_by_interface.get( type.getInterface() );
			if ( existing != null ) {
				throw new IllegalStateException( "Interface " +
					type.getInterface().getName() + " already registered: " + existing );
			}

			List<Invoker> new_invokers = new ArrayList<>();
			for( Map.Entry<String,Method> entry : type.getMethods().entrySet() ) {
				if ( invokers.containsKey( entry.getKey() ) ) {
					throw new IllegalStateException(
						"Function already registered: " + entry.getKey() );
				}
				new_invokers.add( new MethodInvoker( type, entry.getValue() ) );
			}

			types_by_name.put( type.getName(), type );
			types_by_interface.put( type.getInterface(), type );
			for( Invoker invoker : new_invokers ) {
				invokers.put( invoker.getQualifiedName(), invoker );
			}
			instance_type_cache.clear();

			LOG.debug( "Registered {} with functions: {}", type,
				type.getMethods().keySet() );
		}
		finally {
			lock.unlock();
		}
	}


	private void replaceEquivalent( ExportedType<?> type ) {
		types_by_name.put( type.getName(), type );
		types_by_interface.put( type.getInterface(), type );
		for( Method method : type.getMethods().values() ) {
			MethodInvoker invoker = new MethodInvoker( type, method );
			invokers.put( invoker.getQualifiedName(), invoker );
		}
		instance_type_cache.clear();

		LOG.debug( "Constructor added to {}", type );
	}


	public void register( @Nonnull ExportedType<?>... types ) {
		for( ExportedType<?> type : types ) {
			register( type );
		}
	}


	@Nullable
	public ExportedType<?> typeNamed( @Nonnull String name ) {
		lock.lock();
		try {
			return types_by_name.get( name );
		}
		finally {
			lock.unlock();
		}
	}


	@Nullable
	@SuppressWarnings( "unchecked" )
	public <T> ExportedType<T> typeFor( @Nonnull Class<T> type_interface ) {
		lock.lock();
		try {
			return ( ExportedType<T> ) types_by_interface.get( type_interface );
		}
		finally {
			lock.unlock();
		}
	}


	public Collection<ExportedType<?>> types() {
		lock.lock();
		try {
			return new ArrayList<>( types_by_name.values() );
		}
		finally {
			lock.unlock();
		}
	}


	/**
	 * Find the invoker for a qualified function name.
	 */
	Invoker invoker( @Nonnull String qualified_name ) throws UnknownFunctionNameException {
		Invoker invoker;
		lock.lock();
		try {
			invoker = invokers.get( qualified_name );
		}
		finally {
			lock.unlock();
		}

		if ( invoker == null ) throw new UnknownFunctionNameException( qualified_name );
		return invoker;
	}


	/**
	 * Find the invoker for a method of the given type, or null if the method isn't
	 * exported by it.
	 */
	@Nullable
	Invoker invoker( @Nonnull ExportedType<?> type, @Nonnull Method method ) {
		Invoker invoker;
		lock.lock();
		try {
			invoker = invokers.get( type.qualifiedName( method ) );
		}
		finally {
			lock.unlock();
		}

		if ( invoker == null || !invoker.getType().isEquivalent( type ) ) return null;

		// Same name but different signature (a method of another interface)
		Method exported = invoker.getMethod();
		if ( !exported.equals( method ) &&
			!Arrays.equals( exported.getParameterTypes(), method.getParameterTypes() ) ) {

			return null;
		}
		return invoker;
	}


	/**
	 * Qualified name for the given method of a type, or null if it isn't exported.
	 */
	@Nullable
	public String qualifiedName( @Nonnull ExportedType<?> type, @Nonnull Method method ) {
		Invoker invoker = invoker( type, method );
		return invoker == null ? null : invoker.getQualifiedName();
	}


	/**
	 * Find the most specific registered type implemented by the given class, or null
	 * if it implements none.
	 */
	@Nullable
	ExportedType<?> exportedTypeOf( @Nonnull Class<?> instance_class ) {
		lock.lock();
		try {
			Optional<ExportedType<?>> cached = instance_type_cache.get( instance_class );
			//noinspection OptionalAssignedToNull
			if ( cached == null ) {
				cached = Optional.ofNullable( findExportedType( instance_class ) );
				instance_type_cache.put( instance_class, cached );
			}
			return cached.orElse( null );
		}
		finally {
			lock.unlock();
		}
	}


	private ExportedType<?> findExportedType( Class<?> instance_class ) {
		ExportedType<?> best = null;
		for( ExportedType<?> type : types_by_name.values() ) {
			if ( !type.getInterface().isAssignableFrom( instance_class ) ) continue;

			if ( best == null ||
				best.getInterface().isAssignableFrom( type.getInterface() ) ) {

				best = type;
			}
		}
		return best;
	}
}
