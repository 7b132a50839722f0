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
import com.starlight.conduit.exception.DispatchException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.NotSerializableException;

import static java.util.Objects.requireNonNull;


/**
 * Determines how exported objects are written and read by the reference streams. A
 * context is passed explicitly to every encode and decode so the role never depends on
 * which thread does the work.
 * <ul>
 *     <li>{@link Role#CLIENT CLIENT}: proxies are written as references and references
 *         are read as proxies bound to the session. Proxies for objects the server
 *         attributes to this client release them when collected.</li>
 *     <li>{@link Role#SERVER SERVER}: live instances of exported types are registered
 *         (owned by the calling peer) and written as references, references are read as
 *         the registered instances.</li>
 *     <li>{@link Role#NONE NONE}: references are not allowed.</li>
 * </ul>
 */
abstract class RoleContext {
	enum Role { CLIENT, SERVER, NONE }


	static final RoleContext NONE = new NoRole( FunctionRegistry.shared() );


	private final FunctionRegistry functions;


	private RoleContext( @Nonnull FunctionRegistry functions ) {
		this.functions = requireNonNull( functions );
	}


	static RoleContext client( @Nonnull ClientSession session ) {
		return new ClientRole( session );
	}

	static RoleContext server( @Nonnull FunctionRegistry functions,
		@Nonnull ObjectRegistry registry, @Nullable RoutingIdentity peer ) {

		return new ServerRole( functions, registry, peer );
	}


	abstract Role getRole();


	FunctionRegistry getFunctions() {
		return functions;
	}


	/**
	 * True if the object must be written as a reference rather than by value.
	 */
	boolean isReferenced( Object object ) {
		return ProxyKit.isProxy( object ) ||
			functions.exportedTypeOf( object.getClass() ) != null;
	}


	/**
	 * Produce the reference to be written in place of a proxy or exported instance.
	 *
	 * @throws NotSerializableException		If the object can't be referenced in this
	 * 										role.
	 */
	abstract ObjectReference toReference( @Nonnull Object object )
		throws NotSerializableException;


	/**
	 * Produce the object to be returned in place of a reference that was read.
	 */
	abstract Object resolve( @Nonnull ObjectReference reference ) throws IOException;



	private static class ClientRole extends RoleContext {
		private final ClientSession session;

		ClientRole( ClientSession session ) {
			super( session.getFunctionRegistry() );
			this.session = session;
		}


		@Override
		Role getRole() {
			return Role.CLIENT;
		}


		@Override
		ObjectReference toReference( @Nonnull Object object )
			throws NotSerializableException {

			ProxyInvocationHandler handler = ProxyKit.handlerOf( object );
			if ( handler == null ) {
				throw new NotSerializableException( "Local instance of exported type " +
					"can't be sent to a server: " + object.getClass().getName() );
			}
			if ( handler.getSession() != session ) {
				throw new NotSerializableException(
					"Proxy belongs to another session: " + handler );
			}

			int object_id = handler.getObjectID();
			if ( object_id == ProxyInvocationHandler.DESTROYED_ID ) {
				throw new NotSerializableException(
					"Proxy has been destroyed: " + handler );
			}
			return new ObjectReference( object_id, handler.getType().getName(), false );
		}


		@Override
		Object resolve( @Nonnull ObjectReference reference ) throws IOException {
			ExportedType<?> type = getFunctions().typeNamed( reference.getTypeName() );
			if ( type == null ) {
				throw new InvalidObjectException(
					"Reference to unregistered type: " + reference );
			}
			return ProxyKit.createProxy( session, type, reference.getObjectID(),
				reference.isOwned() );
		}
	}


	private static class ServerRole extends RoleContext {
		private final ObjectRegistry registry;
		private final RoutingIdentity peer;

		ServerRole( FunctionRegistry functions, ObjectRegistry registry,
			RoutingIdentity peer ) {

			super( functions );
			this.registry = requireNonNull( registry );
			this.peer = peer;
		}


		@Override
		Role getRole() {
			return Role.SERVER;
		}


		@Override
		ObjectReference toReference( @Nonnull Object object )
			throws NotSerializableException {

			if ( ProxyKit.isProxy( object ) ) {
				throw new NotSerializableException(
					"Proxies can't be sent from a server: " + object );
			}

			ExportedType<?> type = getFunctions().exportedTypeOf( object.getClass() );
			if ( type == null ) {
				throw new NotSerializableException( object.getClass().getName() );
			}

			int object_id = registry.export( object, type, peer );
			return new ObjectReference( object_id, type.getName(),
				registry.isOwnedBy( object_id, peer ) );
		}


		@Override
		Object resolve( @Nonnull ObjectReference reference ) throws IOException {
			try {
				return registry.lookup( reference.getObjectID() );
			}
			catch( DispatchException ex ) {
				throw new ReferenceResolutionException( ex );
			}
		}
	}


	private static class NoRole extends RoleContext {
		NoRole( FunctionRegistry functions ) {
			super( functions );
		}


		@Override
		Role getRole() {
			return Role.NONE;
		}

		@Override
		ObjectReference toReference( @Nonnull Object object )
			throws NotSerializableException {

			throw new NotSerializableException(
				"Exported objects can only be sent within a session: " + object );
		}

		@Override
		Object resolve( @Nonnull ObjectReference reference ) throws IOException {
			throw new InvalidObjectException(
				"References can only be read within a session: " + reference );
		}
	}


	/**
	 * Carries a dispatch failure out of the serialization stack, which only allows
	 * IOExceptions.
	 */
	static class ReferenceResolutionException extends IOException {
		private final DispatchException dispatch_exception;

		ReferenceResolutionException( DispatchException dispatch_exception ) {
			super( dispatch_exception.getMessage(), dispatch_exception );
			this.dispatch_exception = dispatch_exception;
		}

		DispatchException getDispatchException() {
			return dispatch_exception;
		}
	}
}
