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

import javax.annotation.Nonnull;
import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;


/**
 * A socket opened by a {@link ConduitDriver}. Sockets are not thread safe: all calls to
 * {@link #send(Envelope)} must come from a single thread at a time.
 */
public interface DriverSocket extends Closeable {
	/**
	 * Send an envelope. Part boundaries and order are preserved to the receiver.
	 *
	 * @throws IOException				If the envelope can't be handed to the link
	 * 									(for example because it is not connected).
	 * @throws IllegalStateException	If the send violates the socket's pattern
	 * 									(for example two sends in a row on a
	 * 									{@link SocketType#REQUEST REQUEST} socket).
	 */
	void send( @Nonnull Envelope envelope ) throws IOException;


	SocketType getType();

	Endpoint getEndpoint();


	/**
	 * For binding sockets, the actual bound address (useful with ephemeral ports).
	 * For connecting sockets, the local address of the current link, if any.
	 */
	SocketAddress getLocalAddress();


	/**
	 * True if the socket has at least one live link to a peer.
	 */
	boolean isConnected();


	/**
	 * Close the socket. No further callbacks are delivered once this returns.
	 */
	@Override
	void close();
}
