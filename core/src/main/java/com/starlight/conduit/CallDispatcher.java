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

import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.exception.ConduitRuntimeException;
import com.starlight.conduit.exception.DispatchException;
import com.starlight.conduit.exception.DispatchReason;
import com.starlight.conduit.exception.RemoteDispatchException;
import com.starlight.conduit.exception.UnknownFunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;


/**
 * Builds call requests on the client side and executes them on the server side.
 * <p>
 * Request: {@code [call_id][qualified_name][object_id][arg 1]...[arg n]}<br>
 * Reply: {@code [call_id][status][payload]}
 * <p>
 * The call ID is added (client) or echoed (server) by the session; routing identities
 * are handled by the session as well.
 */
final class CallDispatcher {
	private static final Logger LOG = LoggerFactory.getLogger( CallDispatcher.class );

	private static final Object[] NO_ARGS = new Object[ 0 ];
	private static final byte[] EMPTY = new byte[ 0 ];

	// Keeps dispatch error details well below the writeUTF limit
	private static final int MAX_DETAIL_LENGTH = 2000;

	private static final ValueCodec THROWABLE_CODEC = ValueCodec.forType( Throwable.class );


	private final FunctionRegistry functions;


	CallDispatcher( @Nonnull FunctionRegistry functions ) {
		this.functions = Objects.requireNonNull( functions );
	}


	////////////////////////////////////////////////////////////////////////////////////
	// Client side


	/**
	 * Encode a call and hand it to the session.
	 *
	 * @throws UnknownFunctionException		If the method isn't exported by the type.
	 * @throws ConduitRuntimeException		If an argument can't be encoded (for example
	 * 										if it isn't serializable).
	 */
	PendingCall issue( @Nonnull ClientSession session, @Nonnull ExportedType<?> type,
		int object_id, @Nonnull Method method, @Nullable Object[] args,
		long timeout_ms ) {

		Invoker invoker = functions.invoker( type, method );
		if ( invoker == null ) throw new UnknownFunctionException( method );

		RoleContext context = session.getRoleContext();

		Envelope request = new Envelope();
		request.pushBack( Frames.stringFrame( invoker.getQualifiedName() ) );
		request.pushBack( Frames.intFrame( object_id ) );
		try {
			invoker.encodeArguments( args == null ? NO_ARGS : args, context, request );
		}
		catch( IOException ex ) {
			throw new ConduitRuntimeException( "Unable to encode arguments for " +
				invoker.getQualifiedName() + ": " + ex, ex );
		}

		return session.send( request,
			reply -> decodeReply( reply, invoker, context ), timeout_ms );
	}


	/**
	 * Decode a reply, returning the result or throwing what the reply describes.
	 */
	static Object decodeReply( @Nonnull Envelope reply, @Nonnull Invoker invoker,
		@Nonnull RoleContext context ) throws Throwable {

		if ( reply.isEmpty() ) {
			throw new ConduitRuntimeException( "Reply for " +
				invoker.getQualifiedName() + " has no status" );
		}

		ReplyStatus status = ReplyStatus.forFrame( reply.popFront() );
		byte[] payload = reply.isEmpty() ? EMPTY : reply.popFront();

		switch( status ) {
			case OK:
				try {
					return invoker.decodeResult( payload, context );
				}
				catch( IOException | ClassNotFoundException ex ) {
					throw new ConduitRuntimeException( "Unable to decode result of " +
						invoker.getQualifiedName() + ": " + ex, ex );
				}

			case THROWN:
				Object thrown;
				try {
					thrown = THROWABLE_CODEC.decode( payload, context );
				}
				catch( IOException | ClassNotFoundException ex ) {
					throw new ConduitRuntimeException( "Unable to decode exception " +
						"thrown by " + invoker.getQualifiedName() + ": " + ex, ex );
				}
				if ( thrown == null ) {
					throw new ConduitRuntimeException(
						"Null exception thrown by " + invoker.getQualifiedName() );
				}
				throw ( Throwable ) thrown;

			case DISPATCH_ERROR:
				DataInputStream in =
					new DataInputStream( new ByteArrayInputStream( payload ) );
				throw new RemoteDispatchException(
					DispatchReason.forCode( in.readByte() ), in.readUTF() );

			default:
				throw new AssertionError( "Unhandled status: " + status );
		}
	}


	////////////////////////////////////////////////////////////////////////////////////
	// Server side


	/**
	 * Execute a request and produce the reply. Never throws: every failure is
	 * reported in the reply.
	 *
	 * @param request	The request, starting with the call ID part. Consumed.
	 * @param peer		The calling peer, if known.
	 *
	 * @return			The reply, or null if the request doesn't even have a call ID.
	 */
	@Nullable
	Envelope execute( @Nonnull Envelope request, @Nonnull ObjectRegistry registry,
		@Nullable RoutingIdentity peer ) {

		if ( request.isEmpty() ) {
			LOG.warn( "Empty request from {} dropped", peer );
			return null;
		}

		byte[] call_id_frame = request.popFront();
		RoleContext context = RoleContext.server( functions, registry, peer );

		String qualified_name = null;
		try {
			if ( request.size() < 2 ) {
				throw new DispatchException( DispatchReason.MALFORMED,
					"Request has " + request.size() + " parts after the call ID" );
			}

			qualified_name = Frames.readString( request.popFront() );
			int object_id = Frames.readInt( request.popFront() );

			Invoker invoker = functions.invoker( qualified_name );
			Object target = object_id == ObjectRegistry.FACTORY_OBJECT_ID ?
				new FactoryService( registry, peer ) : registry.lookup( object_id );

			if ( !invoker.getType().getInterface().isInstance( target ) ) {
				throw new DispatchException( DispatchReason.UNKNOWN_FUNCTION, "Object " +
					object_id + " does not implement " + qualified_name );
			}

			Object result;
			Thread thread = Thread.currentThread();
			String original_name = thread.getName();
			thread.setName( "Conduit invoke: " + qualified_name + " (" + peer + ")" );
			try {
				result = invoker.invoke( target, request, context );
			}
			finally {
				thread.setName( original_name );
			}

			return encodeResult( call_id_frame, invoker, result, context );
		}
		catch( InvocationTargetException ex ) {
			return encodeThrown( call_id_frame, ex.getCause(), context );
		}
		catch( DispatchException ex ) {
			if ( LOG.isDebugEnabled() ) {
				LOG.debug( "Dispatch error for {} from {}: {}", qualified_name, peer,
					ex.toString() );
			}
			return dispatchError( call_id_frame, ex.getReason(), ex.getMessage() );
		}
		catch( Throwable t ) {
			// Includes errors from decoding arguments (StackOverflowError, etc.)
			LOG.warn( "Unexpected error dispatching {} from {}", qualified_name, peer, t );
			return dispatchError( call_id_frame, DispatchReason.MALFORMED, t.toString() );
		}
	}


	/**
	 * Build a DISPATCH_ERROR reply.
	 */
	static Envelope dispatchError( @Nonnull byte[] call_id_frame,
		@Nonnull DispatchReason reason, @Nullable String detail ) {

		if ( detail == null ) detail = "";
		else if ( detail.length() > MAX_DETAIL_LENGTH ) {
			detail = detail.substring( 0, MAX_DETAIL_LENGTH );
		}

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream( bytes );
		try {
			out.writeByte( reason.getCode() );
			out.writeUTF( detail );
			out.flush();
		}
		catch( IOException ex ) {
			// Can't happen with an in-memory stream
			throw new AssertionError( ex );
		}

		return Envelope.of( call_id_frame, ReplyStatus.DISPATCH_ERROR.frame(),
			bytes.toByteArray() );
	}


	private static Envelope encodeResult( byte[] call_id_frame, Invoker invoker,
		Object result, RoleContext context ) {

		byte[] payload;
		try {
			payload = invoker.encodeResult( result, context );
		}
		catch( Throwable ex ) {
			// Not only IOException: a deeply nested result overflows the stack
			LOG.debug( "Unable to encode result of {}", invoker.getQualifiedName(), ex );
			return encodeThrown( call_id_frame, new ConduitRuntimeException(
				"Unable to encode result of " + invoker.getQualifiedName() + ": " + ex ),
				context );
		}

		return Envelope.of( call_id_frame, ReplyStatus.OK.frame(), payload );
	}


	private static Envelope encodeThrown( byte[] call_id_frame, Throwable thrown,
		RoleContext context ) {

		byte[] payload;
		try {
			payload = THROWABLE_CODEC.encode( thrown, context );
		}
		catch( Throwable ex ) {
			LOG.debug( "Unable to encode thrown exception: {}", thrown, ex );

			ConduitRuntimeException replacement = new ConduitRuntimeException(
				"Unable to encode thrown exception (" + thrown + "): " + ex );
			replacement.setStackTrace( thrown.getStackTrace() );
			try {
				payload = THROWABLE_CODEC.encode( replacement, context );
			}
			catch( Throwable ex2 ) {
				return dispatchError( call_id_frame, DispatchReason.MALFORMED,
					replacement.getMessage() );
			}
		}

		return Envelope.of( call_id_frame, ReplyStatus.THROWN.frame(), payload );
	}
}
