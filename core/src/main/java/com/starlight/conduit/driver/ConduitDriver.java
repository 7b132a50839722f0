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
import java.io.IOException;


/**
 * Message transport used by sessions. Implementations supply the four
 * {@link SocketType socket patterns}, multi-part envelopes with preserved boundaries,
 * reconnection of connecting sockets and liveness detection.
 */
public interface ConduitDriver {
	/**
	 * Bind a {@link SocketType#isBinding() binding} socket to the given endpoint.
	 */
	DriverSocket bind( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException;


	/**
	 * Connect a non-binding socket to the given endpoint. The link is established
	 * before this returns; afterward the driver re-establishes it as needed.
	 */
	DriverSocket connect( @Nonnull Endpoint endpoint, @Nonnull SocketType type,
		@Nonnull EnvelopeHandler handler ) throws IOException;


	/**
	 * Close all sockets and release driver resources.
	 */
	void shutdown();
}
