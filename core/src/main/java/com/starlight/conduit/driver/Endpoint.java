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

package com.starlight.conduit.driver;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

import static java.util.Objects.requireNonNull;


/**
 * Transport address expressed as {@code scheme://location}, for example
 * {@code tcp://127.0.0.1:5555}, {@code tcp://*:0} or {@code inproc://counter-service}.
 */
public final class Endpoint {
	public static final String TCP = "tcp";
	public static final String INPROC = "inproc";

	private static final String SEPARATOR = "://";


	private final String scheme;
	private final String location;


	private Endpoint( String scheme, String location ) {
		this.scheme = scheme;
		this.location = location;
	}


	/**
	 * Parse an endpoint string.
	 *
	 * @throws IllegalArgumentException	If the string is not of the form
	 * 									{@code scheme://location}.
	 */
	public static Endpoint parse( @Nonnull String endpoint ) {
		requireNonNull( endpoint );

		int index = endpoint.indexOf( SEPARATOR );
		if ( index <= 0 || index + SEPARATOR.length() >= endpoint.length() ) {
			throw new IllegalArgumentException( "Invalid endpoint: " + endpoint );
		}

		String scheme = endpoint.substring( 0, index ).toLowerCase( Locale.ROOT );
		String location = endpoint.substring( index + SEPARATOR.length() );

		Endpoint to_return = new Endpoint( scheme, location );
		if ( TCP.equals( scheme ) ) {
			// Validate now rather than at bind/connect time
			to_return.getHost();
			to_return.getPort();
		}
		return to_return;
	}

	public static Endpoint tcp( @Nonnull String host, int port ) {
		return parse( TCP + SEPARATOR + host + ":" + port );
	}

	public static Endpoint inproc( @Nonnull String name ) {
		return parse( INPROC + SEPARATOR + name );
	}


	public String getScheme() {
		return scheme;
	}

	public String getLocation() {
		return location;
	}


	/**
	 * Host portion of a {@code tcp} endpoint. {@code *} means all interfaces.
	 */
	public String getHost() {
		requireScheme( TCP );

		int index = location.lastIndexOf( ':' );
		if ( index <= 0 ) {
			throw new IllegalArgumentException( "Missing host or port: " + this );
		}
		String host = location.substring( 0, index );
		// Bracketed IPv6 literal
		if ( host.startsWith( "[" ) && host.endsWith( "]" ) ) {
			host = host.substring( 1, host.length() - 1 );
		}
		return host;
	}

	/**
	 * Port portion of a {@code tcp} endpoint. Zero means "any free port" when binding.
	 */
	public int getPort() {
		requireScheme( TCP );

		int index = location.lastIndexOf( ':' );
		try {
			int port = Integer.parseInt( location.substring( index + 1 ) );
			if ( port < 0 || port > 0xffff ) {
				throw new IllegalArgumentException( "Port out of range: " + this );
			}
			return port;
		}
		catch( NumberFormatException ex ) {
			throw new IllegalArgumentException( "Invalid port: " + this, ex );
		}
	}

	public boolean isWildcardHost() {
		return "*".equals( getHost() );
	}


	private void requireScheme( String expected ) {
		if ( !expected.equals( scheme ) ) {
			throw new IllegalStateException(
				"Not a " + expected + " endpoint: " + this );
		}
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		Endpoint that = ( Endpoint ) o;
		return scheme.equals( that.scheme ) && location.equals( that.location );
	}

	@Override
	public int hashCode() {
		return Objects.hash( scheme, location );
	}

	@Override
	public String toString() {
		return scheme + SEPARATOR + location;
	}
}
