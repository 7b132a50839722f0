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
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;


/**
 * Creation and inspection of proxies.
 */
final class ProxyKit {
	private ProxyKit() {}


	/**
	 * Create a proxy that isn't followed by the session's {@link ProxyLeases}.
	 */
	static <T> T createProxy( @Nonnull ClientSession session,
		@Nonnull ExportedType<T> type, int object_id ) {

		return newProxy( type, new ProxyInvocationHandler( session, type, object_id ) );
	}


	/**
	 * Create a proxy and register it with the session's {@link ProxyLeases}.
	 *
	 * @param release		True if the remote object should be destroyed once no proxy
	 * 						for it is left.
	 */
	static <T> T createProxy( @Nonnull ClientSession session,
		@Nonnull ExportedType<T> type, int object_id, boolean release ) {

		ProxyInvocationHandler handler =
			new ProxyInvocationHandler( session, type, object_id );
		T proxy = newProxy( type, handler );
		session.getLeases().register( handler, release );
		return proxy;
	}


	private static <T> T newProxy( ExportedType<T> type, ProxyInvocationHandler handler ) {
		Class<T> type_interface = type.getInterface();

		ClassLoader loader = type_interface.getClassLoader();
		if ( loader == null ) loader = ProxyKit.class.getClassLoader();

		Object proxy = Proxy.newProxyInstance( loader,
			new Class<?>[] { type_interface, RemoteProxy.class }, handler );
		return type_interface.cast( proxy );
	}


	static boolean isProxy( @Nullable Object object ) {
		return handlerOf( object ) != null;
	}


	/**
	 * The handler behind a proxy, or null if the object isn't a proxy.
	 */
	@Nullable
	static ProxyInvocationHandler handlerOf( @Nullable Object object ) {
		if ( object == null || !Proxy.isProxyClass( object.getClass() ) ) return null;

		InvocationHandler handler = Proxy.getInvocationHandler( object );
		if ( handler instanceof ProxyInvocationHandler ) {
			return ( ProxyInvocationHandler ) handler;
		}
		else return null;
	}
}
