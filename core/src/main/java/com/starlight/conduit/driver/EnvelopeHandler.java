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

import com.starlight.conduit.Envelope;

import javax.annotation.Nullable;


/**
 * Interface for handling events from a {@link DriverSocket}. Callbacks arrive on driver
 * threads and should hand work off rather than block.
 */
public interface EnvelopeHandler {
	/**
	 * Called when an envelope is received. For {@link SocketType#ROUTER ROUTER}
	 * sockets the first part is the sender's routing identity.
	 */
	void envelopeReceived( Envelope envelope );


	/**
	 * Called when a link to a peer is established.
	 *
	 * @param peer		The peer's routing identity on binding sockets, null on
	 * 					connecting sockets.
	 */
	default void peerConnected( @Nullable RoutingIdentity peer ) {}


	/**
	 * Called when a link to a peer is lost or closed. Connecting sockets may reconnect
	 * afterward, in which case {@link #peerConnected} is called again.
	 *
	 * @param peer		The peer's routing identity on binding sockets, null on
	 * 					connecting sockets.
	 */
	default void peerDisconnected( @Nullable RoutingIdentity peer ) {}
}
