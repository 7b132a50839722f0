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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;


/**
 * A call waiting for its reply. Whoever removes it from the session's pending table
 * resolves it, so it is resolved exactly once.
 */
final class PendingCall {
	/**
	 * Turns a reply (with the call ID already removed) into the call's result.
	 */
	@FunctionalInterface
	interface ReplyDecoder {
		Object decode( @Nonnull Envelope reply ) throws Throwable;
	}


	private final int call_id;
	private final ReplyDecoder decoder;
	private final CompletableFuture<Object> future = new CompletableFuture<>();

	private volatile ScheduledFuture<?> timeout_future;


	PendingCall( int call_id, @Nonnull ReplyDecoder decoder ) {
		this.call_id = call_id;
		this.decoder = decoder;
	}


	int getCallID() {
		return call_id;
	}

	CompletableFuture<Object> future() {
		return future;
	}


	void setTimeoutFuture( ScheduledFuture<?> timeout_future ) {
		this.timeout_future = timeout_future;
	}


	void resolve( @Nonnull Envelope reply ) {
		cancelTimeout();

		try {
			future.complete( decoder.decode( reply ) );
		}
		catch( Throwable t ) {
			future.completeExceptionally( t );
		}
	}


	void fail( @Nonnull Throwable t ) {
		cancelTimeout();
		future.completeExceptionally( t );
	}


	private void cancelTimeout() {
		ScheduledFuture<?> timeout_future = this.timeout_future;
		if ( timeout_future != null ) timeout_future.cancel( false );
	}


	@Override
	public String toString() {
		return "PendingCall(" + call_id + ")";
	}
}
