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

import com.starlight.conduit.exception.ConduitRuntimeException;
import com.starlight.conduit.exception.InterruptedCallException;
import com.starlight.conduit.exception.ServerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;


/**
 * Handles reflective method invocations on proxies and dispatches the calls to the
 * proxy's session.
 */
class ProxyInvocationHandler implements InvocationHandler {
	private static final Logger LOG =
		LoggerFactory.getLogger( ProxyInvocationHandler.class );

	static final int DESTROYED_ID = -1;

	// Guards against huge traces when calls bounce between processes
	private static final int MAX_STACK_SIZE = 2000;

	private static final Method EQUALS_METHOD;
	private static final Method HASHCODE_METHOD;
	private static final Method TOSTRING_METHOD;
	private static final Method GET_OBJECT_ID_METHOD;
	private static final Method GET_TYPE_NAME_METHOD;
	private static final Method GET_SESSION_METHOD;
	private static final Method DESTROY_METHOD;
	static {
		try {
			EQUALS_METHOD = Object.class.getMethod( "equals", Object.class );
			HASHCODE_METHOD = Object.class.getMethod( "hashCode" );
			TOSTRING_METHOD = Object.class.getMethod( "toString" );

			GET_OBJECT_ID_METHOD = RemoteProxy.class.getMethod( "__conduit__getObjectID" );
			GET_TYPE_NAME_METHOD = RemoteProxy.class.getMethod( "__conduit__getTypeName" );
			GET_SESSION_METHOD = RemoteProxy.class.getMethod( "__conduit__getSession" );
			DESTROY_METHOD = RemoteProxy.class.getMethod( "__conduit__destroy" );
		}
		catch( Exception ex ) {
			throw new IllegalArgumentException(
				"Method not found in static initializer", ex );
		}
	}


	private final ClientSession session;
	private final ExportedType<?> type;
	private final AtomicInteger object_id;

	// Identity for equals and hashCode, which must not change on destroy
	private final int original_id;

	// Milliseconds, zero for none
	private volatile long call_timeout;


	ProxyInvocationHandler( ClientSession session, ExportedType<?> type, int object_id ) {
		this.session = session;
		this.type = type;
		this.object_id = new AtomicInteger( object_id );
		this.original_id = object_id;
		this.call_timeout = session.getDefaultTimeout();
	}


	@Override
	public Object invoke( Object proxy, Method method, Object[] args ) throws Throwable {
		// Methods from Object are not passed on to the remote object.
		if ( method.getDeclaringClass().equals( Object.class ) ) {
			if ( method.equals( HASHCODE_METHOD ) ) {
				return Integer.valueOf( hashCode() );
			}
			else if ( method.equals( EQUALS_METHOD ) ) {
				return Boolean.valueOf( proxyEquals( args[ 0 ] ) );
			}
			else if ( method.equals( TOSTRING_METHOD ) ) {
				return toString();
			}

			return method.invoke( this, args );
		}
		// Handle RemoteProxy methods
		else if ( method.getDeclaringClass().equals( RemoteProxy.class ) ) {
			if ( method.equals( GET_OBJECT_ID_METHOD ) ) {
				return Integer.valueOf( object_id.get() );
			}
			else if ( method.equals( GET_TYPE_NAME_METHOD ) ) {
				return type.getName();
			}
			else if ( method.equals( GET_SESSION_METHOD ) ) {
				return session;
			}
			else if ( method.equals( DESTROY_METHOD ) ) {
				return Boolean.valueOf( destroy() );
			}
		}

		int object_id = this.object_id.get();
		if ( object_id == DESTROYED_ID ) {
			throw new IllegalStateException( "Proxy has been destroyed: " + this );
		}

		PendingCall call = session.getDispatcher().issue( session, type, object_id,
			method, args, call_timeout );
		try {
			return call.future().get();
		}
		catch( InterruptedException ex ) {
			InterruptedCallException interrupted = new InterruptedCallException( ex );
			session.abandon( call, interrupted );
			throw interrupted;
		}
		catch( ExecutionException ex ) {
			Throwable t = ex.getCause();

			// Local failures (timeouts, closed session, dispatch errors) are already
			// ConduitRuntimeExceptions. Anything else was thrown by the implementation.
			if ( !( t instanceof ConduitRuntimeException ) ) {
				appendLocalStack( t );

				if ( t instanceof Error ) t = new ServerException( t );
			}

			if ( !canThrow( method, t.getClass() ) ) {
				throw new ConduitRuntimeException( t );
			}
			else throw t;
		}
	}


	/**
	 * Invalidate the proxy and destroy the remote object.
	 *
	 * @return		True if this call destroyed the remote object. False if the proxy was
	 * 				already destroyed or the remote destroy failed.
	 */
	boolean destroy() {
		int id = object_id.getAndSet( DESTROYED_ID );
		if ( id == DESTROYED_ID ) return false;

		session.getLeases().forget( id );
		try {
			session.factory().destroy( id );
			return true;
		}
		catch( RuntimeException ex ) {
			LOG.warn( "Unable to destroy remote object {} ({}): {}", Integer.valueOf( id ),
				type.getName(), ex.toString() );
			return false;
		}
	}


	ClientSession getSession() {
		return session;
	}

	ExportedType<?> getType() {
		return type;
	}

	int getObjectID() {
		return object_id.get();
	}


	void setCallTimeout( long call_timeout_ms ) {
		this.call_timeout = call_timeout_ms;
	}

	long getCallTimeout() {
		return call_timeout;
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		ProxyInvocationHandler that = ( ProxyInvocationHandler ) o;
		return session == that.session && original_id == that.original_id;
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode( session ) + original_id;
	}

	@Override
	public String toString() {
		return "Proxy(" + type.getName() + ":" + object_id.get() + "@" +
			session.getEndpoint() + ")";
	}


	private boolean proxyEquals( Object o ) {
		ProxyInvocationHandler that = ProxyKit.handlerOf( o );
		return that != null && equals( that );
	}


	private void appendLocalStack( Throwable t ) {
		final StackTraceElement[] local_stack = new Throwable().getStackTrace();
		final StackTraceElement[] remote_stack = t.getStackTrace();
		int new_stack_size = remote_stack.length + local_stack.length;
		if ( new_stack_size >= MAX_STACK_SIZE ) return;

		StackTraceElement[] new_stack = new StackTraceElement[ new_stack_size ];
		System.arraycopy( remote_stack, 0, new_stack, 0, remote_stack.length );
		new_stack[ remote_stack.length ] = new StackTraceElement( " <<< Conduit",
			"remote call to " + session.getEndpoint() + " >>>", null, -1 );
		System.arraycopy( local_stack, 1, new_stack, remote_stack.length + 1,
			local_stack.length - 1 );   // drop top
		t.setStackTrace( new_stack );
	}


	/**
	 * Returns true if the given method can throw the given Throwable without wrapping it
	 * in an UndeclaredThrowableException.
	 */
	static boolean canThrow( Method method, Class<? extends Throwable> t ) {
		if ( RuntimeException.class.isAssignableFrom( t ) ) return true;
		if ( Error.class.isAssignableFrom( t ) ) return true;

		for( Class<?> exception : method.getExceptionTypes() ) {
			if ( exception.isAssignableFrom( t ) ) return true;
		}
		return false;
	}
}
