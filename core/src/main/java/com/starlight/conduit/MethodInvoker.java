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

import com.starlight.conduit.exception.DispatchException;
import com.starlight.conduit.exception.DispatchReason;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;


/**
 * {@link Invoker} for a single method of an exported interface.
 */
class MethodInvoker implements Invoker {
	private static final Object[] NO_ARGS = new Object[ 0 ];

	private final ExportedType<?> type;
	private final Method method;
	private final String qualified_name;

	private final ValueCodec[] parameter_codecs;
	private final ValueCodec return_codec;


	MethodInvoker( @Nonnull ExportedType<?> type, @Nonnull Method method ) {
		this.type = type;
		this.method = method;
		this.qualified_name = type.qualifiedName( method );

		Class<?>[] parameter_types = method.getParameterTypes();
		parameter_codecs = new ValueCodec[ parameter_types.length ];
		for( int i = 0; i < parameter_types.length; i++ ) {
			parameter_codecs[ i ] = ValueCodec.forType( parameter_types[ i ] );
		}
		return_codec = ValueCodec.forType( method.getReturnType() );

		// Interfaces nested in non-public classes
		method.setAccessible( true );
	}


	@Override
	public ExportedType<?> getType() {
		return type;
	}

	@Override
	public Method getMethod() {
		return method;
	}

	@Override
	public String getQualifiedName() {
		return qualified_name;
	}


	@Override
	public void encodeArguments( @Nonnull Object[] args, @Nonnull RoleContext context,
		@Nonnull Envelope out ) throws IOException {

		if ( args.length != parameter_codecs.length ) {
			throw new IllegalArgumentException( "Expected " + parameter_codecs.length +
				" arguments for " + qualified_name + ", got " + args.length );
		}

		for( int i = 0; i < args.length; i++ ) {
			out.pushBack( parameter_codecs[ i ].encode( args[ i ], context ) );
		}
	}


	@Override
	public Object invoke( @Nonnull Object target, @Nonnull Envelope arguments,
		@Nonnull RoleContext context )
		throws DispatchException, InvocationTargetException {

		if ( arguments.size() != parameter_codecs.length ) {
			throw new DispatchException( DispatchReason.MALFORMED, "Expected " +
				parameter_codecs.length + " argument parts for " + qualified_name +
				", got " + arguments.size() );
		}

		Object[] args = parameter_codecs.length == 0 ?
			NO_ARGS : new Object[ parameter_codecs.length ];
		// Left to right, matching the encoding order
		for( int i = 0; i < parameter_codecs.length; i++ ) {
			try {
				args[ i ] = parameter_codecs[ i ].decode( arguments.popFront(), context );
			}
			catch( RoleContext.ReferenceResolutionException ex ) {
				throw ex.getDispatchException();
			}
			catch( IOException | ClassNotFoundException ex ) {
				throw new DispatchException( DispatchReason.MALFORMED,
					"Unable to decode argument " + i + " of " + qualified_name + ": " +
					ex, ex );
			}
		}

		try {
			return method.invoke( target, args );
		}
		catch( IllegalAccessException | IllegalArgumentException ex ) {
			throw new DispatchException( DispatchReason.UNKNOWN_FUNCTION,
				"Unable to invoke " + qualified_name + " on " +
				target.getClass().getName() + ": " + ex, ex );
		}
		catch( InvocationTargetException ex ) {
			if ( ex.getCause() instanceof DispatchFailure ) {
				throw ( ( DispatchFailure ) ex.getCause() ).getDispatchException();
			}
			throw ex;
		}
	}


	@Override
	public byte[] encodeResult( Object result, @Nonnull RoleContext context )
		throws IOException {

		return return_codec.encode( result, context );
	}


	@Override
	public Object decodeResult( @Nonnull byte[] frame, @Nonnull RoleContext context )
		throws IOException, ClassNotFoundException {

		return return_codec.decode( frame, context );
	}


	@Override
	public String toString() {
		return "MethodInvoker(" + qualified_name + ")";
	}
}
