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
import java.util.Arrays;

import static java.util.Objects.requireNonNull;


/**
 * Opaque token assigned by a {@link SocketType#ROUTER ROUTER} socket to a connected
 * peer. Replies are routed by pushing the identity back onto the front of the
 * envelope.
 */
public final class RoutingIdentity {
	private final byte[] bytes;
	private final int hash_code;


	public RoutingIdentity( @Nonnull byte[] bytes ) {
		this.bytes = requireNonNull( bytes ).clone();
		this.hash_code = Arrays.hashCode( this.bytes );
	}


	/**
	 * Returns a copy of the identity bytes, suitable for use as an envelope part.
	 */
	public byte[] toBytes() {
		return bytes.clone();
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		return Arrays.equals( bytes, ( ( RoutingIdentity ) o ).bytes );
	}

	@Override
	public int hashCode() {
		return hash_code;
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder( "Peer(" );
		for( byte b : bytes ) {
			buf.append( Character.forDigit( ( b >> 4 ) & 0xf, 16 ) );
			buf.append( Character.forDigit( b & 0xf, 16 ) );
		}
		return buf.append( ')' ).toString();
	}
}
