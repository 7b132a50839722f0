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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;


/**
 * Definition of a type whose instances live in a server and are used remotely through
 * proxies. Every public, non-static method of the interface (including inherited ones)
 * is exported under the qualified name {@code <type name>::<method name>}.
 * <p>
 * Example:
 * <pre>
 *     ExportedType&lt;Counter&gt; COUNTER =
 *         ExportedType.newBuilder( "counter", Counter.class )
 *             .constructor( args -&gt; new CounterImpl() )
 *             .build();
 *
 *     FunctionRegistry.shared().register( COUNTER );
 * </pre>
 * The constructor is only needed where instances are created (the server).
 *
 * @param <T>	The exported interface.
 */
public final class ExportedType<T> {
	static final String QUALIFIER = "::";


	private final String name;
	private final Class<T> type_interface;
	private final ObjectConstructor<T> constructor;

	// Qualified name -> method, in declaration order
	private final Map<String,Method> methods;


	private ExportedType( String name, Class<T> type_interface,
		ObjectConstructor<T> constructor ) {

		this.name = name;
		this.type_interface = type_interface;
		this.constructor = constructor;
		this.methods = Collections.unmodifiableMap( findMethods( name, type_interface ) );
	}


	public static <T> Builder<T> newBuilder( @Nonnull String name,
		@Nonnull Class<T> type_interface ) {

		return new Builder<>( name, type_interface );
	}


	public String getName() {
		return name;
	}

	public Class<T> getInterface() {
		return type_interface;
	}

	@Nullable
	public ObjectConstructor<T> getConstructor() {
		return constructor;
	}


	/**
	 * Qualified name of the given method of this type.
	 */
	public String qualifiedName( @Nonnull Method method ) {
		return name + QUALIFIER + method.getName();
	}


	Map<String,Method> getMethods() {
		return methods;
	}


	/**
	 * True if the other type exports the same interface under the same name (which makes
	 * registering it again harmless).
	 */
	boolean isEquivalent( ExportedType<?> other ) {
		return name.equals( other.name ) && type_interface.equals( other.type_interface );
	}


	@Override
	public String toString() {
		return "ExportedType(" + name + ":" + type_interface.getName() + ")";
	}


	private static Map<String,Method> findMethods( String name, Class<?> type_interface ) {
		Map<String,Method> to_return = new LinkedHashMap<>();

		// NOTE: getMethods() includes methods of extended interfaces
		for( Method method : type_interface.getMethods() ) {
			if ( Modifier.isStatic( method.getModifiers() ) ) continue;

			String qualified_name = name + QUALIFIER + method.getName();
			Method existing = to_return.get( qualified_name );
			if ( existing != null ) {
				// The same method inherited through two paths is fine
				if ( Arrays.equals( existing.getParameterTypes(),
					method.getParameterTypes() ) ) continue;

				throw new IllegalArgumentException( "Overloaded methods can't be " +
					"exported (" + qualified_name + "): " + existing + " and " + method );
			}

			to_return.put( qualified_name, method );
		}

		return to_return;
	}


	public static class Builder<T> {
		private final String name;
		private final Class<T> type_interface;
		private ObjectConstructor<T> constructor;

		Builder( @Nonnull String name, @Nonnull Class<T> type_interface ) {
			this.name = requireNonNull( name );
			this.type_interface = requireNonNull( type_interface );

			if ( name.isEmpty() || name.contains( QUALIFIER ) ) {
				throw new IllegalArgumentException( "Invalid type name: " + name );
			}
			if ( !type_interface.isInterface() ) {
				throw new IllegalArgumentException(
					"Exported types must be interfaces: " + type_interface.getName() );
			}
		}


		public Builder<T> constructor( @Nonnull ObjectConstructor<T> constructor ) {
			this.constructor = requireNonNull( constructor );
			return this;
		}


		public ExportedType<T> build() {
			return new ExportedType<>( name, type_interface, constructor );
		}
	}
}
