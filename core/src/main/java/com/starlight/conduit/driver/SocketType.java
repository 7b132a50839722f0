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

/**
 * Messaging patterns a {@link ConduitDriver} must provide.
 */
public enum SocketType {
	/**
	 * Connecting side of a strict request/reply pair: each send must be followed by a
	 * receive before the next send.
	 */
	REQUEST( false, true ),

	/**
	 * Binding side of a strict request/reply pair: requests from any number of peers are
	 * delivered one at a time and each reply is routed to the peer of the last request.
	 * Routing identities are hidden from the handler.
	 */
	REPLY( true, true ),

	/**
	 * Connecting side with unrestricted send/receive.
	 */
	DEALER( false, false ),

	/**
	 * Binding side with unrestricted send/receive. Every inbound envelope is prefixed
	 * with the sending peer's {@link RoutingIdentity routing identity} and every
	 * outbound envelope must start with the identity of its destination.
	 */
	ROUTER( true, false );


	private final boolean binding;
	private final boolean alternating;

	SocketType( boolean binding, boolean alternating ) {
		this.binding = binding;
		this.alternating = alternating;
	}


	/**
	 * True for the patterns that accept connections ({@link #REPLY}, {@link #ROUTER}).
	 */
	public boolean isBinding() {
		return binding;
	}

	/**
	 * True for the patterns enforcing strict send/receive alternation.
	 */
	public boolean isAlternating() {
		return alternating;
	}
}
