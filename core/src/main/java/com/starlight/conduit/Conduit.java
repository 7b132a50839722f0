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
import java.util.concurrent.TimeUnit;


/**
 * Utilities for working with proxies.
 */
public final class Conduit {
	private Conduit() {}


	/**
	 * Returns true if the object is a proxy for a remote object.
	 */
	public static boolean isProxy( @Nullable Object object ) {
		return ProxyKit.isProxy( object );
	}


	/**
	 * ID of the remote object behind a proxy, or -1 if the proxy has been destroyed.
	 *
	 * @throws IllegalArgumentException		If the object isn't a proxy.
	 */
	public static int getObjectID( @Nonnull Object proxy ) {
		return handler( proxy ).getObjectID();
	}


	/**
	 * Name of the exported type of the remote object behind a proxy.
	 *
	 * @throws IllegalArgumentException		If the object isn't a proxy.
	 */
	public static String getTypeName( @Nonnull Object proxy ) {
		return handler( proxy ).getType().getName();
	}


	/**
	 * The session through which a proxy makes its calls.
	 *
	 * @throws IllegalArgumentException		If the object isn't a proxy.
	 */
	public static ClientSession getSession( @Nonnull Object proxy ) {
		return handler( proxy ).getSession();
	}


	/**
	 * Set the timeout for calls made through a proxy. Zero means no timeout. Proxies
	 * start with their session's default timeout.
	 *
	 * @throws IllegalArgumentException		If the object isn't a proxy.
	 */
	public static void setCallTimeout( @Nonnull Object proxy, long timeout,
		@Nonnull TimeUnit unit ) {

		if ( timeout < 0 ) throw new IllegalArgumentException( "Negative timeout" );
		handler( proxy ).setCallTimeout( unit.toMillis( timeout ) );
	}


	/**
	 * Destroy the remote object behind a proxy. The proxy is invalidated first, so
	 * further calls through it fail with IllegalStateException whether or not the remote
	 * destroy works. Failures are logged rather than thrown.
	 *
	 * @return		True if the remote object was destroyed by this call.
	 *
	 * @throws IllegalArgumentException		If the object isn't a proxy.
	 */
	public static boolean destroy( @Nonnull Object proxy ) {
		return handler( proxy ).destroy();
	}


	private static ProxyInvocationHandler handler( Object proxy ) {
		ProxyInvocationHandler handler = ProxyKit.handlerOf( proxy );
		if ( handler == null ) {
			throw new IllegalArgumentException( "Not a proxy: " + proxy );
		}
		return handler;
	}
}
